package enterprises.orbital.eveapi.request;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.config.ApiProperties;
import enterprises.orbital.eveapi.model.ModelUtil;

/**
 * Issues single calls against the remote API.
 * <p>
 * Each call proceeds as follows:
 * <ol>
 * <li>Validate the endpoint name. Malformed names fail before any network activity.</li>
 * <li>Rename parameters to the provider's conventions and separate any key fields.</li>
 * <li>Apply the endpoint's {@link AccessPolicy} to decide whether key fields are attached.</li>
 * <li>Build the URL with parameters in sorted order and issue the GET.</li>
 * <li>Map non-2xx responses and API error documents to {@link RemoteApiException}.</li>
 * </ol>
 */
public class EndpointDispatcher {
  private static final Logger log = Logger.getLogger(EndpointDispatcher.class.getName());

  private static final Pattern ENDPOINT_PATTERN = Pattern.compile("^[a-z]+/[A-Za-z]+$");

  private final Transport transport;
  private final String baseUrl;
  private final String urlSuffix;

  public EndpointDispatcher(Transport transport, ApiProperties properties) {
    this(transport, properties.getBaseUrl(), properties.getUrlSuffix());
  }

  public EndpointDispatcher(
                            Transport transport,
                            String baseUrl,
                            String urlSuffix) {
    this.transport = transport;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    this.urlSuffix = urlSuffix;
  }

  public static boolean isValidEndpoint(String endpoint) {
    return endpoint != null && ENDPOINT_PATTERN.matcher(endpoint).matches();
  }

  public ApiDocument call(
                          String endpoint,
                          Map<String, String> params)
    throws EveApiException {
    return call(endpoint, params, null);
  }

  /**
   * Call an endpoint.
   *
   * @param endpoint   endpoint path, e.g. <code>char/CharacterSheet</code>.
   * @param params     request parameters in either library (<code>character_id</code>) or provider
   *                   (<code>characterID</code>) form.  May include <code>key_id</code> and <code>v_code</code>.
   * @param credential key to use if the endpoint's policy allows it, may be null.
   * @return the parsed response.
   * @throws InvalidEndpointException   if the endpoint name is malformed.
   * @throws MissingCredentialException if the endpoint requires a key and none is available.
   * @throws TransportException         if the call could not be completed or the response is not XML.
   * @throws RemoteApiException         if the server reports a failure.
   * @throws EveApiException            if the key's scope could not be resolved.
   */
  public ApiDocument call(String endpoint, Map<String, String> params, Credential credential)
    throws EveApiException {
    if (!isValidEndpoint(endpoint)) throw new InvalidEndpointException(endpoint);
    if (params == null) params = Collections.emptyMap();

    // Separate key fields from the rest of the query
    SortedMap<String, String> query = new TreeMap<>();
    String keyId = null;
    String vCode = null;
    for (Map.Entry<String, String> next : params.entrySet()) {
      if (next.getValue() == null) continue;
      String name = ParameterNames.toProviderName(next.getKey());
      if (ParameterNames.KEY_ID.equals(name))
        keyId = next.getValue();
      else if (ParameterNames.V_CODE.equals(name))
        vCode = next.getValue();
      else
        query.put(name, next.getValue());
    }
    if (credential != null) {
      keyId = String.valueOf(credential.getKeyId());
      vCode = credential.getVerificationCode();
    }

    AccessPolicy policy = AccessPolicy.forEndpoint(endpoint);
    boolean authenticated = authorize(endpoint, policy, query, credential, keyId, vCode);
    if (authenticated) {
      query.put(ParameterNames.KEY_ID, keyId);
      query.put(ParameterNames.V_CODE, vCode);
    }

    log.fine("Calling " + endpoint + " (" + policy + ", " + (authenticated ? "authenticated" : "anonymous") + ")");
    TransportResponse response = transport.get(buildUrl(endpoint, query));
    if (!response.isSuccess()) throw new RemoteApiException(response.getStatus(), response.getStatusText());

    ApiDocument xml = ApiDocument.parse(response.getBody());
    if (xml.isError()) {
      int code = xml.getErrorCode();
      log.fine("Call to " + endpoint + " returned error " + code + ": " + xml.getErrorString());
      throw new RemoteApiException(response.getStatus(), xml.getErrorString(),
                                   code == RemoteApiException.NO_ERROR_CODE ? 0 : code);
    }
    return xml;
  }

  private boolean authorize(String endpoint, AccessPolicy policy, Map<String, String> query, Credential credential,
                            String keyId, String vCode)
    throws EveApiException {
    switch (policy) {
    case PUBLIC:
      return false;

    case CHARACTER_SCOPED:
    case CORPORATION_SCOPED:
      // Scope can only be checked against a credential, raw key parameters are stripped
      if (credential == null) return false;
      Long target = ModelUtil.parseLong(query.get(policy.getScopeParameter()));
      if (target == null) return false;
      return policy == AccessPolicy.CHARACTER_SCOPED ? credential.isValidForCharacter(target)
          : credential.isValidForCorporation(target);

    case AUTHENTICATED:
    default:
      if (keyId == null || vCode == null) throw new MissingCredentialException(endpoint);
      return true;
    }
  }

  /**
   * Assemble the request URL.  Parameters are percent encoded and emitted in sorted order.
   *
   * @param endpoint endpoint path.
   * @param query    provider named parameters.
   * @return the URL.
   */
  public String buildUrl(
                         String endpoint,
                         SortedMap<String, String> query) {
    StringBuilder url = new StringBuilder(baseUrl).append(endpoint).append(urlSuffix);
    char sep = '?';
    for (Map.Entry<String, String> next : query.entrySet()) {
      url.append(sep).append(encode(next.getKey())).append('=').append(encode(next.getValue()));
      sep = '&';
    }
    return url.toString();
  }

  static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8)
                     .replace("+", "%20")
                     .replace("*", "%2A")
                     .replace("%7E", "~");
  }
}
