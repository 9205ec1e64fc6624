package enterprises.orbital.eveapi.model;

import java.util.Objects;

/**
 * How an entity is located: by numeric id, or by a case-insensitive match on a name field.
 */
public final class LookupKey {
  private final Long id;
  private final Field<String> nameField;
  private final String name;

  private LookupKey(
                    Long id,
                    Field<String> nameField,
                    String name) {
    this.id = id;
    this.nameField = nameField;
    this.name = name;
  }

  public static LookupKey byId(long id) {
    return new LookupKey(id, null, null);
  }

  public static LookupKey byName(Field<String> nameField, String name) {
    return new LookupKey(null, Objects.requireNonNull(nameField), Objects.requireNonNull(name));
  }

  public boolean hasId() {
    return id != null;
  }

  public Long getId() {
    return id;
  }

  public Field<String> getNameField() {
    return nameField;
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return hasId() ? "id=" + id : nameField + "='" + name + "'";
  }
}
