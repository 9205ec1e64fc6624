package enterprises.orbital.eveapi.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resolved field sets for one entity kind, keyed by numeric id.  Entries are merged, never replaced, and never
 * evicted.  Entries are kept in id order so name lookups with duplicate names always pick the lowest id.
 * <p>
 * All methods synchronize on the cache instance.
 */
public class IdentityCache {
  private final EntityKind kind;
  private final Map<Long, FieldSet> entries = new TreeMap<>();
  private boolean collectionLoaded;

  public IdentityCache(EntityKind kind) {
    this.kind = kind;
  }

  public EntityKind getKind() {
    return kind;
  }

  /**
   * @return a copy of the cached fields for the given id, or null if nothing is cached.
   */
  public synchronized FieldSet get(long id) {
    FieldSet cached = entries.get(id);
    return cached == null ? null : new FieldSet(cached);
  }

  public synchronized boolean has(long id) {
    return entries.containsKey(id);
  }

  /**
   * Merge fields into the entry for an id.  Fields already present in the entry are kept.
   */
  public synchronized void put(long id, FieldSet fields) {
    FieldSet existing = entries.get(id);
    if (existing == null) {
      entries.put(id, new FieldSet(fields));
    } else {
      existing.merge(fields);
    }
  }

  /**
   * Merge a complete collection and mark the collection loaded.
   */
  public synchronized void putCollection(Map<Long, FieldSet> collection) {
    for (Map.Entry<Long, FieldSet> next : collection.entrySet()) {
      put(next.getKey(), next.getValue());
    }
    collectionLoaded = true;
  }

  public synchronized boolean isCollectionLoaded() {
    return collectionLoaded;
  }

  /**
   * Find the lowest id whose name field matches, ignoring case.
   *
   * @param nameField field to compare.
   * @param name      name to look for.
   * @return the matching id, or null if nothing matches.
   */
  public synchronized Long findIdByName(Field<String> nameField, String name) {
    for (Map.Entry<Long, FieldSet> next : entries.entrySet()) {
      String candidate = next.getValue().get(nameField);
      if (candidate != null && candidate.equalsIgnoreCase(name)) return next.getKey();
    }
    return null;
  }

  /**
   * @return all cached ids in ascending order.
   */
  public synchronized List<Long> ids() {
    return new ArrayList<>(entries.keySet());
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized void clear() {
    entries.clear();
    collectionLoaded = false;
  }
}
