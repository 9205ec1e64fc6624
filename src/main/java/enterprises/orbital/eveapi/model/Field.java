package enterprises.orbital.eveapi.model;

/**
 * A named, typed entity attribute.
 * <p>
 * Remote fields are populated by resolution, so reading an unset remote field triggers resolution.  Local fields
 * only carry values supplied by the code which constructed the entity (for example an employment interval) and are
 * never fetched.
 *
 * @param <T> value type.
 */
public final class Field<T> {
  private final String name;
  private final boolean local;

  private Field(String name, boolean local) {
    this.name = name;
    this.local = local;
  }

  public static <T> Field<T> remote(String name) {
    return new Field<>(name, false);
  }

  public static <T> Field<T> local(String name) {
    return new Field<>(name, true);
  }

  public String getName() {
    return name;
  }

  public boolean isLocal() {
    return local;
  }

  @Override
  public String toString() {
    return name;
  }
}
