package enterprises.orbital.eveapi.model.corporation;

import java.util.HashMap;
import java.util.Map;

import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.model.AbstractEntityResolver;
import enterprises.orbital.eveapi.model.FieldSet;
import enterprises.orbital.eveapi.model.Fields;
import enterprises.orbital.eveapi.model.ModelUtil;
import enterprises.orbital.eveapi.request.ApiDocument;
import enterprises.orbital.eveapi.request.EndpointDispatcher;
import enterprises.orbital.eveapi.request.EveApiException;

/**
 * Reads <code>corp/CorporationSheet</code>.  The key is attached only if it covers the corporation, so member
 * limit and other member-only values are absent for foreign corporations.
 */
public class CorporationSheetResolver extends AbstractEntityResolver {

  public static final String ENDPOINT = "corp/CorporationSheet";

  public CorporationSheetResolver(EndpointDispatcher dispatcher, Credential credential) {
    super(dispatcher, credential);
  }

  @Override
  protected FieldSet getServerData(long id) throws EveApiException {
    Map<String, String> params = new HashMap<>();
    params.put("corporation_id", String.valueOf(id));
    ApiDocument xml = dispatcher.call(ENDPOINT, params, credential);
    if (xml.allNodes("//result").isEmpty()) return null;

    FieldSet result = new FieldSet();
    result.set(Fields.NAME, xml.firstValue("//result/corporationName[1]"));
    result.set(Fields.DESCRIPTION, ModelUtil.emptyToNull(xml.firstValue("//result/description[1]")));
    result.set(Corporation.TICKER, xml.firstValue("//result/ticker[1]"));
    result.set(Corporation.CEO_ID, ModelUtil.parseLong(xml.firstValue("//result/ceoID[1]")));
    result.set(Corporation.CEO_NAME, ModelUtil.emptyToNull(xml.firstValue("//result/ceoName[1]")));
    result.set(Corporation.STATION_ID, ModelUtil.parseLong(xml.firstValue("//result/stationID[1]")));
    result.set(Corporation.STATION_NAME, ModelUtil.emptyToNull(xml.firstValue("//result/stationName[1]")));
    result.set(Corporation.URL, ModelUtil.emptyToNull(xml.firstValue("//result/url[1]")));
    result.set(Corporation.TAX_RATE, ModelUtil.parseDouble(xml.firstValue("//result/taxRate[1]")));
    result.set(Corporation.MEMBER_COUNT, ModelUtil.parseInteger(xml.firstValue("//result/memberCount[1]")));
    result.set(Corporation.SHARES, ModelUtil.parseLong(xml.firstValue("//result/shares[1]")));

    // A zero member limit means the value was withheld
    Integer limit = ModelUtil.parseInteger(xml.firstValue("//result/memberLimit[1]"));
    if (limit != null && limit != 0) result.set(Corporation.MEMBER_LIMIT, limit);

    Long allianceId = ModelUtil.parseLong(xml.firstValue("//result/allianceID[1]"));
    if (allianceId != null && allianceId != 0) {
      result.set(Corporation.ALLIANCE_ID, allianceId);
      result.set(Corporation.ALLIANCE_NAME, ModelUtil.emptyToNull(xml.firstValue("//result/allianceName[1]")));
    }

    result.set(Fields.CACHED_UNTIL, xml.cachedUntil());
    return result;
  }
}
