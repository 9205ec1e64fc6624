package enterprises.orbital.eveapi.request;

/**
 * Base class for all failures raised while calling the remote API or resolving model data.
 */
public class EveApiException extends Exception {
  private static final long serialVersionUID = 3390842161637811954L;

  public EveApiException(String message) {
    super(message);
  }

  public EveApiException(String message, Throwable cause) {
    super(message, cause);
  }
}
