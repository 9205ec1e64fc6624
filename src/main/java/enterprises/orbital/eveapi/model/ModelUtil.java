package enterprises.orbital.eveapi.model;

import org.joda.time.DateTime;
import org.joda.time.DateTimeUtils;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

/**
 * Useful utility methods for dealing with model values.  All API dates share the format
 * <code>yyyy-MM-dd HH:mm:ss</code> and are always UTC.
 */
public class ModelUtil {

  private static final DateTimeFormatter dateFormat = DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss")
                                                                    .withZoneUTC();

  public static boolean isExpired(DateTime cachedUntil) {
    return cachedUntil.isBefore(DateTimeUtils.currentTimeMillis());
  }

  /**
   * Parse an API date.
   *
   * @param value date string, may be null.
   * @return the parsed date, or null if the value is absent or malformed.
   */
  public static DateTime parseDate(String value) {
    if (value == null || value.trim().isEmpty()) return null;
    try {
      return dateFormat.parseDateTime(value.trim());
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  public static String formatDate(DateTime value) {
    return dateFormat.print(value);
  }

  public static Long parseLong(String value) {
    if (value == null) return null;
    try {
      return Long.valueOf(value.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  public static long parseLong(String value, long def) {
    Long result = parseLong(value);
    return result == null ? def : result;
  }

  public static Integer parseInteger(String value) {
    if (value == null) return null;
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  public static Double parseDouble(String value) {
    if (value == null) return null;
    try {
      return Double.valueOf(value.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  public static Boolean parseBoolean(String value) {
    if (value == null || value.trim().isEmpty()) return null;
    String v = value.trim();
    return v.equals("1") || v.equalsIgnoreCase("true");
  }

  // Empty strings count as absent in API documents
  public static String emptyToNull(String value) {
    return value == null || value.trim().isEmpty() ? null : value;
  }
}
