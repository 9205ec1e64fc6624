package enterprises.orbital.eveapi.account;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.joda.time.DateTime;

import enterprises.orbital.eveapi.model.ModelUtil;
import enterprises.orbital.eveapi.request.ApiDocument;
import enterprises.orbital.eveapi.request.ApiNode;
import enterprises.orbital.eveapi.request.EndpointDispatcher;
import enterprises.orbital.eveapi.request.EveApiException;
import enterprises.orbital.eveapi.request.RemoteApiException;

/**
 * Resolves key scopes through <code>account/APIKeyInfo</code>.  Results are cached by key ID and verification code
 * so that several credential objects for the same key cost a single remote call.  Failed resolutions are not
 * cached.
 */
public class CredentialResolver {
  private static final Logger log = Logger.getLogger(CredentialResolver.class.getName());

  public static final String ENDPOINT = "account/APIKeyInfo";

  // API error codes which mean the key itself was rejected
  private static final Set<Integer> INVALID_KEY_CODES = new HashSet<>(Arrays.asList(202, 203, 204, 205, 222));

  private final EndpointDispatcher dispatcher;
  private final Map<Pair<Long, String>, CredentialScope> scopeCache = new HashMap<>();

  public CredentialResolver(EndpointDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  /**
   * Retrieve the scope of a credential, calling the server only if this pair has not been resolved before.
   *
   * @param credential the key to resolve.
   * @return the key's scope.
   * @throws InvalidCredentialException if the server rejects the key.
   * @throws EveApiException            on any other call failure.
   */
  public CredentialScope resolve(Credential credential) throws EveApiException {
    Pair<Long, String> cacheKey = Pair.of(credential.getKeyId(), credential.getVerificationCode());
    synchronized (scopeCache) {
      CredentialScope cached = scopeCache.get(cacheKey);
      if (cached != null) return cached;

      ApiDocument xml;
      try {
        xml = dispatcher.call(ENDPOINT, Collections.emptyMap(), credential);
      } catch (RemoteApiException e) {
        if (e.isApiError() && INVALID_KEY_CODES.contains(e.getErrorCode()))
          throw new InvalidCredentialException(credential.getKeyId(), e.getStatusText(), e);
        throw e;
      }

      CredentialScope scope = parseScope(credential, xml);
      scopeCache.put(cacheKey, scope);
      log.fine("Resolved " + credential + " to " + scope);
      return scope;
    }
  }

  public boolean isResolved(Credential credential) {
    synchronized (scopeCache) {
      return scopeCache.containsKey(Pair.of(credential.getKeyId(), credential.getVerificationCode()));
    }
  }

  static CredentialScope parseScope(Credential credential, ApiDocument xml) throws InvalidCredentialException {
    if (xml.allNodes("//result/key").isEmpty())
      throw new InvalidCredentialException(credential.getKeyId(), "key info missing from response");

    KeyType type = KeyType.fromApiValue(xml.firstValue("//result/key/@type"));
    if (type == null) {
      log.warning("Unrecognized key type for " + credential + ": " + xml.firstValue("//result/key/@type"));
    }
    long mask = ModelUtil.parseLong(xml.firstValue("//result/key/@accessMask"), 0L);

    DateTime expires = CredentialScope.NEVER_EXPIRES;
    String expireString = xml.firstValue("//result/key/@expires");
    if (StringUtils.isNotBlank(expireString)) {
      DateTime parsed = ModelUtil.parseDate(expireString);
      if (parsed != null) expires = parsed;
    }

    List<Long> characters = new ArrayList<>();
    List<Long> corporations = new ArrayList<>();
    for (ApiNode row : xml.allNodes("//result/key/rowset[@name='characters']/row")) {
      Long charId = ModelUtil.parseLong(row.attribute("characterID"));
      Long corpId = ModelUtil.parseLong(row.attribute("corporationID"));
      if (charId != null) characters.add(charId);
      if (type == KeyType.CORPORATION && corpId != null && !corporations.contains(corpId)) corporations.add(corpId);
    }

    return new CredentialScope(type, mask, expires, characters, corporations, xml.cachedUntil());
  }
}
