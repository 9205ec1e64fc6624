package enterprises.orbital.eveapi.account;

import java.util.Collections;
import java.util.List;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

/**
 * What a key grants: its type, access mask, expiry and the characters and corporations it covers.
 */
public class CredentialScope {

  /**
   * Expiry of keys which never expire.  Orders after every real instant so normal comparisons keep working.  This
   * value is outside the range joda can format, so compare it rather than print it.
   */
  public static final DateTime NEVER_EXPIRES = new DateTime(Long.MAX_VALUE, DateTimeZone.UTC);

  private final KeyType type;
  private final long accessMask;
  private final DateTime expires;
  private final List<Long> characterIds;
  private final List<Long> corporationIds;
  private final DateTime cachedUntil;

  /**
   * Create a scope.
   *
   * @param type           key type.
   * @param accessMask     access bit mask.
   * @param expires        expiry, or {@link #NEVER_EXPIRES}.
   * @param characterIds   characters covered by the key, or null if unknown.
   * @param corporationIds corporations covered by the key, or null if unknown.
   * @param cachedUntil    when the key info document expires from the server cache, may be null.
   */
  public CredentialScope(KeyType type, long accessMask, DateTime expires, List<Long> characterIds,
                         List<Long> corporationIds, DateTime cachedUntil) {
    this.type = type;
    this.accessMask = accessMask;
    this.expires = expires == null ? NEVER_EXPIRES : expires;
    this.characterIds = characterIds == null ? null : Collections.unmodifiableList(characterIds);
    this.corporationIds = corporationIds == null ? null : Collections.unmodifiableList(corporationIds);
    this.cachedUntil = cachedUntil;
  }

  public KeyType getType() {
    return type;
  }

  public long getAccessMask() {
    return accessMask;
  }

  public DateTime getExpires() {
    return expires;
  }

  public boolean neverExpires() {
    return expires.equals(NEVER_EXPIRES);
  }

  public boolean isExpired() {
    return !neverExpires() && expires.isBeforeNow();
  }

  public List<Long> getCharacterIds() {
    return characterIds;
  }

  public List<Long> getCorporationIds() {
    return corporationIds;
  }

  public DateTime getCachedUntil() {
    return cachedUntil;
  }

  // An unknown list grants nothing
  public boolean isValidForCharacter(long characterId) {
    return characterIds != null && characterIds.contains(characterId);
  }

  public boolean isValidForCorporation(long corporationId) {
    return corporationIds != null && corporationIds.contains(corporationId);
  }

  public boolean hasAccess(long bits) {
    return (accessMask & bits) == bits;
  }

  @Override
  public String toString() {
    return "CredentialScope [type=" + type + ", accessMask=" + accessMask + ", expires="
        + (neverExpires() ? "never" : expires.toString()) + ", characterIds=" + characterIds + ", corporationIds="
        + corporationIds + "]";
  }
}
