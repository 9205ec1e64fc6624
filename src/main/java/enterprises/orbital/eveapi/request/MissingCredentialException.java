package enterprises.orbital.eveapi.request;

/**
 * Thrown when an endpoint which requires a key is called without one.
 */
public class MissingCredentialException extends EveApiException {
  private static final long serialVersionUID = 6148860954335262013L;

  public MissingCredentialException(String endpoint) {
    super("Endpoint " + endpoint + " requires a key ID and verification code");
  }
}
