package enterprises.orbital.eveapi.model.eve;

import java.util.ArrayList;
import java.util.List;

import org.joda.time.DateTime;

import enterprises.orbital.eveapi.ApiContext;
import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.model.EntityKind;
import enterprises.orbital.eveapi.model.Field;
import enterprises.orbital.eveapi.model.Fields;
import enterprises.orbital.eveapi.model.IdentityCache;
import enterprises.orbital.eveapi.model.LookupKey;
import enterprises.orbital.eveapi.model.ResolvableRecord;
import enterprises.orbital.eveapi.model.corporation.Corporation;
import enterprises.orbital.eveapi.request.EveApiException;

/**
 * An alliance from the public alliance list.  The list is fetched once and shared by every alliance.  Alliances
 * may be located by id, by name, or by short name (ticker); name matches ignore case.
 */
public class Alliance {
  public static final Field<String> SHORT_NAME = Field.remote("shortName");
  public static final Field<Long> EXECUTOR_ID = Field.remote("executorCorpID");
  public static final Field<Integer> MEMBER_COUNT = Field.remote("memberCount");
  public static final Field<DateTime> FOUNDED = Field.remote("startDate");

  private final ApiContext context;
  private final Credential credential;
  private final ResolvableRecord record;
  private Corporation executor;

  public Alliance(
                  ApiContext context,
                  Credential credential,
                  long allianceId) {
    this(context, credential, LookupKey.byId(allianceId));
  }

  private Alliance(
                   ApiContext context,
                   Credential credential,
                   LookupKey key) {
    this.context = context;
    this.credential = credential;
    this.record = new ResolvableRecord(EntityKind.ALLIANCE, key, context.getModelCache(),
                                       new AllianceListResolver(context.getDispatcher(), credential));
  }

  public static Alliance byName(
                                ApiContext context,
                                Credential credential,
                                String name) {
    return new Alliance(context, credential, LookupKey.byName(Fields.NAME, name));
  }

  public static Alliance byShortName(
                                     ApiContext context,
                                     Credential credential,
                                     String shortName) {
    return new Alliance(context, credential, LookupKey.byName(SHORT_NAME, shortName));
  }

  /**
   * Create an alliance with a name already known to the caller, saving a lookup when only the name is needed.
   */
  public static Alliance withName(
                                  ApiContext context,
                                  Credential credential,
                                  long allianceId,
                                  String name) {
    Alliance result = new Alliance(context, credential, allianceId);
    result.record.preset(Fields.NAME, name);
    return result;
  }

  /**
   * Retrieve every alliance.  Loads the alliance list if it has not been loaded yet.
   *
   * @param context    API context.
   * @param credential key passed to created alliances, may be null.
   * @return all alliances in ascending id order.
   * @throws EveApiException if the alliance list could not be retrieved.
   */
  public static List<Alliance> all(ApiContext context, Credential credential) throws EveApiException {
    IdentityCache cache = context.getModelCache().forKind(EntityKind.ALLIANCE);
    new AllianceListResolver(context.getDispatcher(), credential).loadCollection(cache);
    List<Alliance> result = new ArrayList<>();
    for (Long next : cache.ids()) {
      result.add(new Alliance(context, credential, next));
    }
    return result;
  }

  /**
   * @return the alliance id, or null if the alliance was located by a name which matched nothing.
   */
  public Long getAllianceId() throws EveApiException {
    return record.getId();
  }

  public String getName() throws EveApiException {
    return record.get(Fields.NAME);
  }

  public String getShortName() throws EveApiException {
    return record.get(SHORT_NAME);
  }

  public Integer getMemberCount() throws EveApiException {
    return record.get(MEMBER_COUNT);
  }

  public DateTime getFounded() throws EveApiException {
    return record.get(FOUNDED);
  }

  /**
   * The executor corporation.  The corporation is created unresolved with this alliance's credential.
   *
   * @return the executor, or null if the alliance has none.
   */
  public synchronized Corporation getExecutor() throws EveApiException {
    if (executor == null) {
      Long executorId = record.get(EXECUTOR_ID);
      if (executorId != null && executorId != 0) executor = new Corporation(context, credential, executorId);
    }
    return executor;
  }

  public boolean isCached() {
    return record.isCached();
  }

  public ResolvableRecord getRecord() {
    return record;
  }

  @Override
  public String toString() {
    return "Alliance [" + record.getKey() + "]";
  }
}
