package enterprises.orbital.eveapi.account;

import enterprises.orbital.eveapi.request.EveApiException;

/**
 * The remote API did not recognize a key ID and verification code pair.
 */
public class InvalidCredentialException extends EveApiException {
  private static final long serialVersionUID = -7376124521925561390L;

  private final long keyId;

  public InvalidCredentialException(long keyId, String message) {
    super("Invalid key " + keyId + ": " + message);
    this.keyId = keyId;
  }

  public InvalidCredentialException(
                                    long keyId,
                                    String message,
                                    Throwable cause) {
    super("Invalid key " + keyId + ": " + message, cause);
    this.keyId = keyId;
  }

  public long getKeyId() {
    return keyId;
  }
}
