package enterprises.orbital.eveapi.model;

import org.joda.time.DateTime;

/**
 * Fields shared by several entity kinds.
 */
public final class Fields {
  public static final Field<String> NAME = Field.remote("name");
  public static final Field<String> DESCRIPTION = Field.remote("description");

  // Server cache expiry of the document the fields were read from
  public static final Field<DateTime> CACHED_UNTIL = Field.remote("cachedUntil");

  private Fields() {}
}
