package enterprises.orbital.eveapi.model;

import java.util.Map;
import java.util.logging.Logger;

import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.request.ApiDocument;
import enterprises.orbital.eveapi.request.EndpointDispatcher;
import enterprises.orbital.eveapi.request.EveApiException;

/**
 * Base class for reference data kinds (alliances, skills, certificates) which are fetched as a whole collection.
 * The collection is loaded into the identity cache the first time any entity of the kind resolves, after which
 * every lookup, by id or by name, is served from the cache.
 */
public abstract class AbstractRefResolver implements RecordResolver {
  private static final Logger log = Logger.getLogger(AbstractRefResolver.class.getName());

  protected final EndpointDispatcher dispatcher;
  protected final Credential credential;

  protected AbstractRefResolver(EndpointDispatcher dispatcher, Credential credential) {
    this.dispatcher = dispatcher;
    this.credential = credential;
  }

  /**
   * @return endpoint serving the whole collection.
   */
  protected abstract String endpoint();

  /**
   * Convert the collection document into field sets keyed by id.
   *
   * @param xml the collection document.
   * @return all records in the collection.
   */
  protected abstract Map<Long, FieldSet> processServerData(ApiDocument xml);

  /**
   * Load the collection into the cache unless it is already there.
   *
   * @param cache identity cache of this kind.
   * @throws EveApiException if the collection call fails.  The cache is left untouched.
   * @throws IllegalArgumentException if the cache does not hold a lookup table kind.
   */
  public void loadCollection(IdentityCache cache) throws EveApiException {
    if (!cache.getKind().isLookupTable())
      throw new IllegalArgumentException(cache.getKind() + " records are not loaded as a collection");
    // Hold the cache lock so two resolvers sharing a cache do not both fetch
    synchronized (cache) {
      if (cache.isCollectionLoaded()) return;
      log.fine("Loading " + cache.getKind() + " collection from " + endpoint());
      ApiDocument xml = dispatcher.call(endpoint(), null, credential);
      Map<Long, FieldSet> collection = processServerData(xml);
      if (xml.cachedUntil() != null) {
        for (FieldSet next : collection.values()) {
          next.setIfAbsent(Fields.CACHED_UNTIL, xml.cachedUntil());
        }
      }
      cache.putCollection(collection);
      log.fine("Loaded " + collection.size() + " " + cache.getKind() + " records");
    }
  }

  @Override
  public ResolvedRecord resolve(LookupKey key, IdentityCache cache) throws EveApiException {
    Long id = key.getId();
    if (id == null || !cache.has(id)) {
      loadCollection(cache);
      if (id == null) id = cache.findIdByName(key.getNameField(), key.getName());
    }
    if (id == null) return null;
    FieldSet found = cache.get(id);
    return found == null ? null : new ResolvedRecord(id, found);
  }
}
