package enterprises.orbital.eveapi.model.character;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.joda.time.DateTime;

import enterprises.orbital.eveapi.ApiContext;
import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.model.EntityKind;
import enterprises.orbital.eveapi.model.Field;
import enterprises.orbital.eveapi.model.Fields;
import enterprises.orbital.eveapi.model.LookupKey;
import enterprises.orbital.eveapi.model.ModelUtil;
import enterprises.orbital.eveapi.model.ResolvableRecord;
import enterprises.orbital.eveapi.model.corporation.Corporation;
import enterprises.orbital.eveapi.model.eve.Alliance;
import enterprises.orbital.eveapi.model.eve.Certificate;
import enterprises.orbital.eveapi.model.eve.Skill;
import enterprises.orbital.eveapi.request.ApiDocument;
import enterprises.orbital.eveapi.request.ApiNode;
import enterprises.orbital.eveapi.request.EveApiException;

/**
 * A pilot.  Public details are available for any character.  Personal details (date of birth, gender, wallet
 * balance, skills, certificates, skill queue) require a key which covers the character.
 */
public class Character {
  public static final Field<String> RACE = Field.remote("race");
  public static final Field<String> BLOODLINE = Field.remote("bloodline");
  public static final Field<String> ANCESTRY = Field.remote("ancestry");
  public static final Field<String> GENDER = Field.remote("gender");
  public static final Field<DateTime> DATE_OF_BIRTH = Field.remote("DoB");
  public static final Field<Double> BALANCE = Field.remote("balance");
  public static final Field<Double> SECURITY_STATUS = Field.remote("securityStatus");
  public static final Field<Long> SKILLPOINTS = Field.remote("skillPoints");
  public static final Field<Long> CORPORATION_ID = Field.remote("corporationID");
  public static final Field<String> CORPORATION_NAME = Field.remote("corporationName");
  public static final Field<DateTime> CORPORATION_DATE = Field.remote("corporationDate");
  public static final Field<Long> ALLIANCE_ID = Field.remote("allianceID");
  public static final Field<String> ALLIANCE_NAME = Field.remote("allianceName");
  public static final Field<List<EmploymentRecord>> EMPLOYMENT_HISTORY = Field.remote("employmentHistory");
  public static final Field<List<CharacterSkill>> SKILLS = Field.remote("skills");
  public static final Field<List<Long>> CERTIFICATE_IDS = Field.remote("certificates");

  public static final String SKILL_QUEUE_ENDPOINT = "char/SkillQueue";

  private final ApiContext context;
  private final Credential credential;
  private final long characterId;
  private final ResolvableRecord record;
  private Corporation corporation;
  private Alliance alliance;
  private List<SkillQueueEntry> skillQueue;

  public Character(
                   ApiContext context,
                   Credential credential,
                   long characterId) {
    this.context = context;
    this.credential = credential;
    this.characterId = characterId;
    this.record = new ResolvableRecord(EntityKind.CHARACTER, LookupKey.byId(characterId), context.getModelCache(),
                                       new CharacterResolver(context.getDispatcher(), credential));
  }

  /**
   * Create a character with details already known to the caller, for example from a key's character list.
   * Reading any of the supplied values will not call the server.
   */
  public static Character listed(ApiContext context, Credential credential, long characterId, String name,
                                 Long corporationId, String corporationName) {
    Character result = new Character(context, credential, characterId);
    result.record.preset(Fields.NAME, name);
    result.record.preset(CORPORATION_ID, corporationId);
    result.record.preset(CORPORATION_NAME, corporationName);
    return result;
  }

  public long getCharacterId() {
    return characterId;
  }

  public String getName() throws EveApiException {
    return record.get(Fields.NAME);
  }

  public String getRace() throws EveApiException {
    return record.get(RACE);
  }

  public String getBloodline() throws EveApiException {
    return record.get(BLOODLINE);
  }

  public String getAncestry() throws EveApiException {
    return record.get(ANCESTRY);
  }

  public String getGender() throws EveApiException {
    return record.get(GENDER);
  }

  public DateTime getDateOfBirth() throws EveApiException {
    return record.get(DATE_OF_BIRTH);
  }

  public Double getBalance() throws EveApiException {
    return record.get(BALANCE);
  }

  public Double getSecurityStatus() throws EveApiException {
    return record.get(SECURITY_STATUS);
  }

  public Long getSkillpoints() throws EveApiException {
    return record.get(SKILLPOINTS);
  }

  /**
   * @return the current employer, created unresolved, or null if unknown.
   */
  public synchronized Corporation getCorporation() throws EveApiException {
    if (corporation == null) {
      Long corporationId = record.get(CORPORATION_ID);
      if (corporationId != null)
        corporation = Corporation.withName(context, credential, corporationId, record.peek(CORPORATION_NAME));
    }
    return corporation;
  }

  /**
   * @return the character's alliance, created unresolved, or null if the character is not in one.
   */
  public synchronized Alliance getAlliance() throws EveApiException {
    if (alliance == null) {
      Long allianceId = record.get(ALLIANCE_ID);
      if (allianceId != null) {
        String name = record.peek(ALLIANCE_NAME);
        alliance = name == null ? new Alliance(context, credential, allianceId)
            : Alliance.withName(context, credential, allianceId, name);
      }
    }
    return alliance;
  }

  /**
   * Trained skills, each annotated with level and skill points.  Empty if the key does not cover this character.
   */
  public List<Skill> skills() throws EveApiException {
    List<CharacterSkill> trained = record.get(SKILLS);
    if (trained == null) return Collections.emptyList();
    List<Skill> result = new ArrayList<>(trained.size());
    for (CharacterSkill next : trained) {
      result.add(Skill.trained(context, credential, next.getTypeId(), next.getLevel(), next.getSkillpoints()));
    }
    return result;
  }

  /**
   * Certificates granted to the character.  Empty if the key does not cover this character.
   */
  public List<Certificate> certificates() throws EveApiException {
    List<Long> ids = record.get(CERTIFICATE_IDS);
    if (ids == null) return Collections.emptyList();
    List<Certificate> result = new ArrayList<>(ids.size());
    for (Long next : ids) {
      result.add(new Certificate(context, credential, next));
    }
    return result;
  }

  public List<EmploymentRecord> getEmploymentHistory() throws EveApiException {
    List<EmploymentRecord> history = record.get(EMPLOYMENT_HISTORY);
    return history == null ? Collections.emptyList() : history;
  }

  /**
   * Corporations the character has belonged to, most recent first, each annotated with the membership interval.
   * The current employer has no end date.
   */
  public List<Corporation> corporations() throws EveApiException {
    return EmploymentHistory.resolve(context, credential, getEmploymentHistory());
  }

  /**
   * The character's skill queue.  Retrieved with one call the first time it is requested.
   *
   * @return queued skills in queue order.
   * @throws EveApiException if the queue could not be retrieved, for example because no key is available.
   */
  public synchronized List<SkillQueueEntry> skillQueue() throws EveApiException {
    if (skillQueue != null) return skillQueue;
    Map<String, String> params = new HashMap<>();
    params.put("character_id", String.valueOf(characterId));
    ApiDocument xml = context.getDispatcher().call(SKILL_QUEUE_ENDPOINT, params, credential);
    List<SkillQueueEntry> queue = new ArrayList<>();
    for (ApiNode row : xml.allNodes("//result/rowset[@name='skillqueue']/row")) {
      Long typeId = ModelUtil.parseLong(row.attribute("typeID"));
      if (typeId == null) continue;
      int level = (int) ModelUtil.parseLong(row.attribute("level"), 0L);
      queue.add(new SkillQueueEntry((int) ModelUtil.parseLong(row.attribute("queuePosition"), queue.size()),
                                    Skill.trained(context, credential, typeId, level, null), level,
                                    ModelUtil.parseLong(row.attribute("startSP"), 0L),
                                    ModelUtil.parseLong(row.attribute("endSP"), 0L),
                                    ModelUtil.parseDate(row.attribute("startTime")),
                                    ModelUtil.parseDate(row.attribute("endTime"))));
    }
    queue.sort((a, b) -> Integer.compare(a.getPosition(), b.getPosition()));
    skillQueue = Collections.unmodifiableList(queue);
    return skillQueue;
  }

  public boolean isCached() {
    return record.isCached();
  }

  public ResolvableRecord getRecord() {
    return record;
  }

  @Override
  public String toString() {
    return "Character [characterId=" + characterId + "]";
  }
}
