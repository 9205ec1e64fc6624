package enterprises.orbital.eveapi.model.character;

import java.util.Objects;

import org.joda.time.DateTime;

/**
 * One row of a character's employment history: the corporation joined and when.
 */
public final class EmploymentRecord {
  private final long recordId;
  private final long corporationId;
  private final String corporationName;
  private final DateTime startDate;

  /**
   * @param startDate join date, null if the server value could not be parsed.
   */
  public EmploymentRecord(
                          long recordId,
                          long corporationId,
                          String corporationName,
                          DateTime startDate) {
    this.recordId = recordId;
    this.corporationId = corporationId;
    this.corporationName = corporationName;
    this.startDate = startDate;
  }

  public long getRecordId() {
    return recordId;
  }

  public long getCorporationId() {
    return corporationId;
  }

  public String getCorporationName() {
    return corporationName;
  }

  public DateTime getStartDate() {
    return startDate;
  }

  @Override
  public int hashCode() {
    return Objects.hash(recordId, corporationId, corporationName, startDate);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    EmploymentRecord other = (EmploymentRecord) obj;
    return recordId == other.recordId && corporationId == other.corporationId
        && Objects.equals(corporationName, other.corporationName) && Objects.equals(startDate, other.startDate);
  }

  @Override
  public String toString() {
    return "EmploymentRecord [recordId=" + recordId + ", corporationId=" + corporationId + ", startDate=" + startDate
        + "]";
  }
}
