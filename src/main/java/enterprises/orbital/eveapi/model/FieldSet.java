package enterprises.orbital.eveapi.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A set of write-once field values.  Once a field holds a value it never changes: writing the same value again is
 * a no-op, writing a different value is a programming error.  Null values are never stored, an absent field simply
 * has no value.
 */
public class FieldSet {
  private final Map<Field<?>, Object> values = new LinkedHashMap<>();

  public FieldSet() {}

  public FieldSet(FieldSet source) {
    values.putAll(source.values);
  }

  public boolean has(Field<?> field) {
    return values.containsKey(field);
  }

  @SuppressWarnings("unchecked")
  public <T> T get(Field<T> field) {
    return (T) values.get(field);
  }

  /**
   * Set a field.
   *
   * @param field field to set.
   * @param value new value, null is ignored.
   * @return this set.
   * @throws IllegalStateException if the field already holds a different value.
   */
  public <T> FieldSet set(Field<T> field, T value) {
    if (value == null) return this;
    Object existing = values.get(field);
    if (existing == null) {
      values.put(field, value);
    } else if (!existing.equals(value)) {
      throw new IllegalStateException("Field " + field + " already set to " + existing + ", refusing " + value);
    }
    return this;
  }

  /**
   * Set a field only if it does not already hold a value.
   *
   * @return true if the value was stored.
   */
  public <T> boolean setIfAbsent(Field<T> field, T value) {
    if (value == null || values.containsKey(field)) return false;
    values.put(field, value);
    return true;
  }

  /**
   * Copy every field of another set which is not already present here.  Existing values are kept.
   *
   * @param other source of new values.
   * @return the number of fields added.
   */
  public int merge(FieldSet other) {
    int added = 0;
    for (Map.Entry<Field<?>, Object> next : other.values.entrySet()) {
      if (!values.containsKey(next.getKey())) {
        values.put(next.getKey(), next.getValue());
        added++;
      }
    }
    return added;
  }

  public Set<Field<?>> fields() {
    return Collections.unmodifiableSet(values.keySet());
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public int hashCode() {
    return Objects.hash(values);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    return values.equals(((FieldSet) obj).values);
  }

  @Override
  public String toString() {
    return "FieldSet " + values;
  }
}
