package enterprises.orbital.eveapi.model;

import java.util.logging.Logger;

import org.joda.time.DateTime;

import enterprises.orbital.eveapi.request.EveApiException;

/**
 * Lazily resolved field storage embedded in every entity.
 * <p>
 * A record starts unresolved, possibly with some fields preset by whoever created the entity.  A name used as the
 * lookup key is not stored as a field, so a record located by name reports the name the server holds for it.  The
 * first read of an unset remote field runs resolution, which locates the remote record through the entity's
 * {@link RecordResolver}, copies every field not already set on this record, and merges the remote fields into the
 * identity cache.  Resolution runs at most once.  After it completes all reads are local, including reads of fields
 * the remote record did not provide.  If resolution fails the record stays unresolved and the next read tries again.
 */
public class ResolvableRecord {
  private static final Logger log = Logger.getLogger(ResolvableRecord.class.getName());

  private final EntityKind kind;
  private final LookupKey key;
  private final IdentityCache cache;
  private final RecordResolver resolver;
  private final FieldSet fields = new FieldSet();
  private Long resolvedId;
  private boolean resolved;

  public ResolvableRecord(
                          EntityKind kind,
                          LookupKey key,
                          ModelCache modelCache,
                          RecordResolver resolver) {
    this.kind = kind;
    this.key = key;
    this.cache = modelCache.forKind(kind);
    this.resolver = resolver;
    this.resolvedId = key.getId();
  }

  public EntityKind getKind() {
    return kind;
  }

  public LookupKey getKey() {
    return key;
  }

  /**
   * Preset a field before resolution.  Follows write-once rules.
   *
   * @throws IllegalStateException if the field already holds a different value.
   */
  public synchronized <T> ResolvableRecord preset(Field<T> field, T value) {
    fields.set(field, value);
    return this;
  }

  /**
   * Read a field, resolving first if the field is an unset remote field and resolution has not yet run.
   *
   * @return the field value, or null if the entity has no value for it.
   * @throws EveApiException if resolution was needed and failed.
   */
  public synchronized <T> T get(Field<T> field) throws EveApiException {
    if (!fields.has(field) && !field.isLocal() && !resolved) resolve();
    return fields.get(field);
  }

  /**
   * Read a field without triggering resolution.
   */
  public synchronized <T> T peek(Field<T> field) {
    return fields.get(field);
  }

  public synchronized boolean has(Field<?> field) {
    return fields.has(field);
  }

  /**
   * Numeric id of the entity.  Entities looked up by name resolve to learn their id.
   *
   * @return the id, or null if no record matched the name.
   * @throws EveApiException if resolution was needed and failed.
   */
  public synchronized Long getId() throws EveApiException {
    if (resolvedId == null && !resolved) resolve();
    return resolvedId;
  }

  public synchronized boolean isResolved() {
    return resolved;
  }

  /**
   * Run resolution if it has not already run.
   *
   * @throws EveApiException if the remote call fails.  The record stays unresolved.
   */
  public synchronized void resolve() throws EveApiException {
    if (resolved) return;
    log.fine("Resolving " + kind + " " + key);
    ResolvedRecord found = resolver.resolve(key, cache);
    if (found != null) {
      if (resolvedId == null) resolvedId = found.getId();
      absorb(found.getFields());
    } else {
      log.fine("No " + kind + " record for " + key);
    }
    resolved = true;
  }

  private void absorb(FieldSet remote) {
    for (Field<?> next : remote.fields()) {
      copy(next, remote);
    }
    cache.put(resolvedId, remote);
  }

  private <T> void copy(Field<T> field, FieldSet source) {
    fields.setIfAbsent(field, source.get(field));
  }

  /**
   * True while the server cache timer of the document this entity was resolved from has not expired.  Never
   * triggers resolution.
   */
  public synchronized boolean isCached() {
    DateTime cachedUntil = fields.get(Fields.CACHED_UNTIL);
    return cachedUntil != null && !ModelUtil.isExpired(cachedUntil);
  }
}
