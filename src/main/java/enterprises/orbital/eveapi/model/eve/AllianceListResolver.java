package enterprises.orbital.eveapi.model.eve;

import java.util.HashMap;
import java.util.Map;

import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.model.AbstractRefResolver;
import enterprises.orbital.eveapi.model.FieldSet;
import enterprises.orbital.eveapi.model.Fields;
import enterprises.orbital.eveapi.model.ModelUtil;
import enterprises.orbital.eveapi.request.ApiDocument;
import enterprises.orbital.eveapi.request.ApiNode;
import enterprises.orbital.eveapi.request.EndpointDispatcher;

public class AllianceListResolver extends AbstractRefResolver {

  public static final String ENDPOINT = "eve/AllianceList";

  public AllianceListResolver(EndpointDispatcher dispatcher, Credential credential) {
    super(dispatcher, credential);
  }

  @Override
  protected String endpoint() {
    return ENDPOINT;
  }

  @Override
  protected Map<Long, FieldSet> processServerData(ApiDocument xml) {
    Map<Long, FieldSet> alliances = new HashMap<>();
    for (ApiNode row : xml.allNodes("//result/rowset[@name='alliances']/row")) {
      Long allianceId = ModelUtil.parseLong(row.attribute("allianceID"));
      if (allianceId == null) continue;
      FieldSet next = new FieldSet();
      next.set(Fields.NAME, row.attribute("name"));
      next.set(Alliance.SHORT_NAME, row.attribute("shortName"));
      next.set(Alliance.EXECUTOR_ID, ModelUtil.parseLong(row.attribute("executorCorpID")));
      next.set(Alliance.MEMBER_COUNT, ModelUtil.parseInteger(row.attribute("memberCount")));
      next.set(Alliance.FOUNDED, ModelUtil.parseDate(row.attribute("startDate")));
      alliances.put(allianceId, next);
    }
    return alliances;
  }
}
