package enterprises.orbital.eveapi.model.corporation;

import org.joda.time.DateTime;

import enterprises.orbital.eveapi.ApiContext;
import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.model.EntityKind;
import enterprises.orbital.eveapi.model.Field;
import enterprises.orbital.eveapi.model.Fields;
import enterprises.orbital.eveapi.model.LookupKey;
import enterprises.orbital.eveapi.model.ResolvableRecord;
import enterprises.orbital.eveapi.model.eve.Alliance;
import enterprises.orbital.eveapi.request.EveApiException;

/**
 * A corporation, resolved from its corporation sheet.
 * <p>
 * Corporations listed in a character's employment history also carry the interval the character spent in the
 * corporation.  The interval is supplied when the corporation is created and never fetched.
 */
public class Corporation {
  public static final Field<String> TICKER = Field.remote("ticker");
  public static final Field<Long> CEO_ID = Field.remote("ceoID");
  public static final Field<String> CEO_NAME = Field.remote("ceoName");
  public static final Field<Long> STATION_ID = Field.remote("stationID");
  public static final Field<String> STATION_NAME = Field.remote("stationName");
  public static final Field<String> URL = Field.remote("url");
  public static final Field<Double> TAX_RATE = Field.remote("taxRate");
  public static final Field<Integer> MEMBER_COUNT = Field.remote("memberCount");
  public static final Field<Integer> MEMBER_LIMIT = Field.remote("memberLimit");
  public static final Field<Long> SHARES = Field.remote("shares");
  public static final Field<Long> ALLIANCE_ID = Field.remote("allianceID");
  public static final Field<String> ALLIANCE_NAME = Field.remote("allianceName");

  // Employment interval annotations
  public static final Field<DateTime> START_DATE = Field.local("startDate");
  public static final Field<DateTime> END_DATE = Field.local("endDate");

  private final ApiContext context;
  private final Credential credential;
  private final long corporationId;
  private final ResolvableRecord record;
  private Alliance alliance;

  public Corporation(
                     ApiContext context,
                     Credential credential,
                     long corporationId) {
    this.context = context;
    this.credential = credential;
    this.corporationId = corporationId;
    this.record = new ResolvableRecord(EntityKind.CORPORATION, LookupKey.byId(corporationId),
                                       context.getModelCache(),
                                       new CorporationSheetResolver(context.getDispatcher(), credential));
  }

  /**
   * Create a corporation with a name already known to the caller.
   */
  public static Corporation withName(
                                     ApiContext context,
                                     Credential credential,
                                     long corporationId,
                                     String name) {
    Corporation result = new Corporation(context, credential, corporationId);
    result.record.preset(Fields.NAME, name);
    return result;
  }

  /**
   * Create a corporation annotated with an employment interval.
   *
   * @param endDate end of the interval, null for the current employer.
   */
  public static Corporation employment(ApiContext context, Credential credential, long corporationId, String name,
                                       DateTime startDate, DateTime endDate) {
    Corporation result = withName(context, credential, corporationId, name);
    result.record.preset(START_DATE, startDate);
    result.record.preset(END_DATE, endDate);
    return result;
  }

  public long getCorporationId() {
    return corporationId;
  }

  public String getName() throws EveApiException {
    return record.get(Fields.NAME);
  }

  public String getDescription() throws EveApiException {
    return record.get(Fields.DESCRIPTION);
  }

  public String getTicker() throws EveApiException {
    return record.get(TICKER);
  }

  public Long getCeoId() throws EveApiException {
    return record.get(CEO_ID);
  }

  public String getCeoName() throws EveApiException {
    return record.get(CEO_NAME);
  }

  public Long getStationId() throws EveApiException {
    return record.get(STATION_ID);
  }

  public String getStationName() throws EveApiException {
    return record.get(STATION_NAME);
  }

  public String getUrl() throws EveApiException {
    return record.get(URL);
  }

  public Double getTaxRate() throws EveApiException {
    return record.get(TAX_RATE);
  }

  public Integer getMemberCount() throws EveApiException {
    return record.get(MEMBER_COUNT);
  }

  public Integer getMemberLimit() throws EveApiException {
    return record.get(MEMBER_LIMIT);
  }

  public Long getShares() throws EveApiException {
    return record.get(SHARES);
  }

  /**
   * The corporation's alliance, created unresolved with this corporation's credential.
   *
   * @return the alliance, or null if the corporation is not in one.
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

  public DateTime getStartDate() {
    return record.peek(START_DATE);
  }

  /**
   * @return end of the employment interval, null if this is the current employer or the corporation did not come
   *         from an employment history.
   */
  public DateTime getEndDate() {
    return record.peek(END_DATE);
  }

  public boolean isCached() {
    return record.isCached();
  }

  public ResolvableRecord getRecord() {
    return record;
  }

  @Override
  public String toString() {
    return "Corporation [corporationId=" + corporationId + "]";
  }
}
