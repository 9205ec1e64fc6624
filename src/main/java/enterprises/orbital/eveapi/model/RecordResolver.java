package enterprises.orbital.eveapi.model;

import enterprises.orbital.eveapi.request.EveApiException;

/**
 * Strategy which locates the remote record for a lookup key.
 */
public interface RecordResolver {

  /**
   * Locate a record.  Implementations consult the identity cache before calling the server, and must not write
   * partial results to the cache when a call fails.
   *
   * @param key   lookup key of the entity being resolved.
   * @param cache identity cache for the entity's kind.
   * @return the record, or null if no record exists for the key.
   * @throws EveApiException if a remote call fails.
   */
  ResolvedRecord resolve(LookupKey key, IdentityCache cache) throws EveApiException;
}
