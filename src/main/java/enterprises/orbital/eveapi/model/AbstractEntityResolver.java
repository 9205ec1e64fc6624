package enterprises.orbital.eveapi.model;

import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.request.EndpointDispatcher;
import enterprises.orbital.eveapi.request.EveApiException;

/**
 * Base class for kinds resolved one record at a time by numeric id (characters, corporations).
 */
public abstract class AbstractEntityResolver implements RecordResolver {

  protected final EndpointDispatcher dispatcher;
  protected final Credential credential;

  protected AbstractEntityResolver(EndpointDispatcher dispatcher, Credential credential) {
    this.dispatcher = dispatcher;
    this.credential = credential;
  }

  /**
   * Fetch and parse every field available for an id.  Must either return the complete field set or throw.
   *
   * @param id entity id.
   * @return the fields read, or null if the server has no such entity.
   * @throws EveApiException if a remote call fails.
   */
  protected abstract FieldSet getServerData(long id) throws EveApiException;

  @Override
  public ResolvedRecord resolve(LookupKey key, IdentityCache cache) throws EveApiException {
    if (!key.hasId()) throw new IllegalArgumentException(cache.getKind() + " can only be resolved by id");
    long id = key.getId();
    FieldSet cached = cache.get(id);
    if (cached != null) return new ResolvedRecord(id, cached);
    FieldSet fetched = getServerData(id);
    return fetched == null ? null : new ResolvedRecord(id, fetched);
  }
}
