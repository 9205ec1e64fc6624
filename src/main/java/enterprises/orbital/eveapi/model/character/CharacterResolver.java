package enterprises.orbital.eveapi.model.character;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.model.AbstractEntityResolver;
import enterprises.orbital.eveapi.model.FieldSet;
import enterprises.orbital.eveapi.model.Fields;
import enterprises.orbital.eveapi.model.ModelUtil;
import enterprises.orbital.eveapi.request.ApiDocument;
import enterprises.orbital.eveapi.request.ApiNode;
import enterprises.orbital.eveapi.request.EndpointDispatcher;
import enterprises.orbital.eveapi.request.EveApiException;

/**
 * Resolves a character from up to two documents:
 * <ol>
 * <li><code>eve/CharacterInfo</code>, always called.  Public data plus employment history, with extra values when
 * the key covers the character.</li>
 * <li><code>char/CharacterSheet</code>, called only when the key covers the character.  Adds personal details,
 * wallet balance, trained skills and certificates.</li>
 * </ol>
 * Both documents are read before anything is returned, so a failure of either leaves no partial data behind.
 */
public class CharacterResolver extends AbstractEntityResolver {
  private static final Logger log = Logger.getLogger(CharacterResolver.class.getName());

  public static final String INFO_ENDPOINT = "eve/CharacterInfo";
  public static final String SHEET_ENDPOINT = "char/CharacterSheet";

  public CharacterResolver(EndpointDispatcher dispatcher, Credential credential) {
    super(dispatcher, credential);
  }

  @Override
  protected FieldSet getServerData(long id) throws EveApiException {
    Map<String, String> params = new HashMap<>();
    params.put("character_id", String.valueOf(id));

    ApiDocument info = dispatcher.call(INFO_ENDPOINT, params, credential);
    if (info.allNodes("//result").isEmpty()) return null;
    FieldSet result = new FieldSet();
    processInfo(info, result);

    if (credential != null && credential.isValidForCharacter(id)) {
      ApiDocument sheet = dispatcher.call(SHEET_ENDPOINT, params, credential);
      processSheet(sheet, result);
    } else {
      log.fine("Key does not cover character " + id + ", skipping " + SHEET_ENDPOINT);
    }

    result.setIfAbsent(Fields.CACHED_UNTIL, info.cachedUntil());
    return result;
  }

  static void processInfo(ApiDocument xml, FieldSet result) {
    result.setIfAbsent(Fields.NAME, ModelUtil.emptyToNull(xml.firstValue("//result/characterName[1]")));
    result.setIfAbsent(Character.RACE, ModelUtil.emptyToNull(xml.firstValue("//result/race[1]")));
    result.setIfAbsent(Character.BLOODLINE, ModelUtil.emptyToNull(xml.firstValue("//result/bloodline[1]")));
    result.setIfAbsent(Character.ANCESTRY, ModelUtil.emptyToNull(xml.firstValue("//result/ancestry[1]")));
    result.setIfAbsent(Character.SECURITY_STATUS,
                       ModelUtil.parseDouble(xml.firstValue("//result/securityStatus[1]")));
    result.setIfAbsent(Character.BALANCE, ModelUtil.parseDouble(xml.firstValue("//result/accountBalance[1]")));
    result.setIfAbsent(Character.SKILLPOINTS, ModelUtil.parseLong(xml.firstValue("//result/skillPoints[1]")));
    result.setIfAbsent(Character.CORPORATION_ID, ModelUtil.parseLong(xml.firstValue("//result/corporationID[1]")));
    result.setIfAbsent(Character.CORPORATION_NAME,
                       ModelUtil.emptyToNull(xml.firstValue("//result/corporation[1]")));
    result.setIfAbsent(Character.CORPORATION_DATE, ModelUtil.parseDate(xml.firstValue("//result/corporationDate[1]")));
    setAlliance(result, xml.firstValue("//result/allianceID[1]"), xml.firstValue("//result/alliance[1]"));

    List<EmploymentRecord> history = new ArrayList<>();
    for (ApiNode row : xml.allNodes("//result/rowset[@name='employmentHistory']/row")) {
      Long corporationId = ModelUtil.parseLong(row.attribute("corporationID"));
      if (corporationId == null) continue;
      history.add(new EmploymentRecord(ModelUtil.parseLong(row.attribute("recordID"), 0L), corporationId,
                                       ModelUtil.emptyToNull(row.attribute("corporationName")),
                                       ModelUtil.parseDate(row.attribute("startDate"))));
    }
    result.setIfAbsent(Character.EMPLOYMENT_HISTORY, Collections.unmodifiableList(history));
  }

  static void processSheet(ApiDocument xml, FieldSet result) {
    result.setIfAbsent(Fields.NAME, ModelUtil.emptyToNull(xml.firstValue("//result/name[1]")));
    result.setIfAbsent(Character.DATE_OF_BIRTH, ModelUtil.parseDate(xml.firstValue("//result/DoB[1]")));
    result.setIfAbsent(Character.RACE, ModelUtil.emptyToNull(xml.firstValue("//result/race[1]")));
    result.setIfAbsent(Character.BLOODLINE, ModelUtil.emptyToNull(xml.firstValue("//result/bloodLine[1]")));
    result.setIfAbsent(Character.ANCESTRY, ModelUtil.emptyToNull(xml.firstValue("//result/ancestry[1]")));
    result.setIfAbsent(Character.GENDER, ModelUtil.emptyToNull(xml.firstValue("//result/gender[1]")));
    result.setIfAbsent(Character.BALANCE, ModelUtil.parseDouble(xml.firstValue("//result/balance[1]")));
    result.setIfAbsent(Character.CORPORATION_ID, ModelUtil.parseLong(xml.firstValue("//result/corporationID[1]")));
    result.setIfAbsent(Character.CORPORATION_NAME,
                       ModelUtil.emptyToNull(xml.firstValue("//result/corporationName[1]")));
    setAlliance(result, xml.firstValue("//result/allianceID[1]"), xml.firstValue("//result/allianceName[1]"));

    List<CharacterSkill> skills = new ArrayList<>();
    for (ApiNode row : xml.allNodes("//result/rowset[@name='skills']/row")) {
      Long typeId = ModelUtil.parseLong(row.attribute("typeID"));
      if (typeId == null) continue;
      skills.add(new CharacterSkill(typeId, ModelUtil.parseLong(row.attribute("skillpoints"), 0L),
                                    (int) ModelUtil.parseLong(row.attribute("level"), 0L)));
    }
    result.setIfAbsent(Character.SKILLS, Collections.unmodifiableList(skills));

    List<Long> certificates = new ArrayList<>();
    for (ApiNode row : xml.allNodes("//result/rowset[@name='certificates']/row")) {
      Long certificateId = ModelUtil.parseLong(row.attribute("certificateID"));
      if (certificateId != null) certificates.add(certificateId);
    }
    result.setIfAbsent(Character.CERTIFICATE_IDS, Collections.unmodifiableList(certificates));
  }

  // An alliance id of zero means no alliance
  private static void setAlliance(
                                  FieldSet result,
                                  String allianceId,
                                  String allianceName) {
    Long id = ModelUtil.parseLong(allianceId);
    if (id == null || id == 0) return;
    result.setIfAbsent(Character.ALLIANCE_ID, id);
    result.setIfAbsent(Character.ALLIANCE_NAME, ModelUtil.emptyToNull(allianceName));
  }
}
