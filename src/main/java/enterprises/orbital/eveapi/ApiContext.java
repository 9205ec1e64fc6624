package enterprises.orbital.eveapi;

import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.account.CredentialResolver;
import enterprises.orbital.eveapi.config.ApiProperties;
import enterprises.orbital.eveapi.model.ModelCache;
import enterprises.orbital.eveapi.request.EndpointDispatcher;
import enterprises.orbital.eveapi.request.HttpTransport;

/**
 * Collaborators shared by every entity: the dispatcher used for remote calls, the credential scope cache, and the
 * identity caches.  Entities receive the context explicitly through their constructors.
 */
public class ApiContext {

  // Shared default context, created on first use
  private static ApiContext defaultContext;

  private final EndpointDispatcher dispatcher;
  private final CredentialResolver credentialResolver;
  private final ModelCache modelCache;

  public ApiContext(EndpointDispatcher dispatcher, ModelCache modelCache) {
    this.dispatcher = dispatcher;
    this.credentialResolver = new CredentialResolver(dispatcher);
    this.modelCache = modelCache;
  }

  /**
   * Retrieve the process-wide context.  Uses the HTTP transport configured from <code>eveapi.properties</code> and
   * the global model cache.
   *
   * @return the default context.
   */
  public static ApiContext getDefault() {
    synchronized (ApiContext.class) {
      if (defaultContext == null) {
        ApiProperties properties = ApiProperties.load();
        defaultContext = new ApiContext(new EndpointDispatcher(new HttpTransport(properties), properties),
                                        ModelCache.global());
      }
      return defaultContext;
    }
  }

  public Credential credential(long keyId, String verificationCode) {
    return new Credential(keyId, verificationCode, credentialResolver);
  }

  public EndpointDispatcher getDispatcher() {
    return dispatcher;
  }

  public CredentialResolver getCredentialResolver() {
    return credentialResolver;
  }

  public ModelCache getModelCache() {
    return modelCache;
  }
}
