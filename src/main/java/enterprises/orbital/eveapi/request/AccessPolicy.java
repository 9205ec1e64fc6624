package enterprises.orbital.eveapi.request;

import java.util.HashMap;
import java.util.Map;

/**
 * Decides whether key fields accompany a call to a given endpoint.
 */
public enum AccessPolicy {
  /** Key fields are never sent. */
  PUBLIC(null),
  /** Key fields are sent only if the key covers the requested character. */
  CHARACTER_SCOPED("characterID"),
  /** Key fields are sent only if the key covers the requested corporation. */
  CORPORATION_SCOPED("corporationID"),
  /** Key fields are always sent, and the call fails without them. */
  AUTHENTICATED(null);

  private static final Map<String, AccessPolicy> policies = new HashMap<>();

  static {
    policies.put("eve/AllianceList", PUBLIC);
    policies.put("eve/SkillTree", PUBLIC);
    policies.put("eve/CertificateTree", PUBLIC);
    policies.put("eve/CharacterName", PUBLIC);
    policies.put("eve/CharacterID", PUBLIC);
    policies.put("server/ServerStatus", PUBLIC);
    policies.put("eve/CharacterInfo", CHARACTER_SCOPED);
    policies.put("corp/CorporationSheet", CORPORATION_SCOPED);
  }

  // Provider name of the request parameter holding the scoped target id
  private final String scopeParameter;

  AccessPolicy(String scopeParameter) {
    this.scopeParameter = scopeParameter;
  }

  public String getScopeParameter() {
    return scopeParameter;
  }

  /**
   * Look up the policy for an endpoint.  Endpoints not explicitly listed require a key.  Private endpoints such
   * as <code>char/CharacterSheet</code> always send the key, so callers check the key covers the target first.
   *
   * @param endpoint endpoint path, e.g. <code>char/CharacterSheet</code>
   * @return the policy to apply.
   */
  public static AccessPolicy forEndpoint(String endpoint) {
    AccessPolicy policy = policies.get(endpoint);
    return policy == null ? AUTHENTICATED : policy;
  }
}
