package enterprises.orbital.eveapi.model.character;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

import org.joda.time.DateTime;

import enterprises.orbital.eveapi.ApiContext;
import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.model.corporation.Corporation;

/**
 * Turns employment records into corporations annotated with the interval of each membership.
 * <p>
 * Records are ordered most recent first.  Each membership ends one second before the next one starts, the most
 * recent membership has no end.  Rejoining a corporation yields one entry per membership.
 */
public final class EmploymentHistory {
  private static final Logger log = Logger.getLogger(EmploymentHistory.class.getName());

  private EmploymentHistory() {}

  public static List<Corporation> resolve(ApiContext context, Credential credential,
                                          List<EmploymentRecord> records) {
    List<EmploymentRecord> dated = new ArrayList<>(records.size());
    for (EmploymentRecord next : records) {
      if (next.getStartDate() == null) {
        // Without a start date the record cannot bound its neighbours
        log.warning("Dropping employment record with unparseable start date: " + next);
        continue;
      }
      dated.add(next);
    }
    dated.sort(Comparator.comparing(EmploymentRecord::getStartDate, Collections.reverseOrder()));

    List<Corporation> result = new ArrayList<>(dated.size());
    DateTime nextStart = null;
    for (EmploymentRecord next : dated) {
      DateTime endDate = nextStart == null ? null : nextStart.minusSeconds(1);
      result.add(Corporation.employment(context, credential, next.getCorporationId(), next.getCorporationName(),
                                        next.getStartDate(), endDate));
      nextStart = next.getStartDate();
    }
    return result;
  }
}
