package enterprises.orbital.eveapi.account;

/**
 * Kind of access key.  Corporation keys may only be created by CEOs and directors.
 */
public enum KeyType {
  ACCOUNT,
  CHARACTER,
  CORPORATION;

  /**
   * Map the API's type string (<code>Account</code>, <code>Character</code>, <code>Corporation</code>).
   *
   * @param value type string from the key info document.
   * @return the matching type, or null if the value is not recognized.
   */
  public static KeyType fromApiValue(String value) {
    if (value == null) return null;
    for (KeyType next : values()) {
      if (next.name().equalsIgnoreCase(value.trim())) return next;
    }
    return null;
  }
}
