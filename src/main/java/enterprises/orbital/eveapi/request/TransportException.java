package enterprises.orbital.eveapi.request;

/**
 * Network level failure: connection problems, timeouts, or a response body which could not be read as XML.
 */
public class TransportException extends EveApiException {
  private static final long serialVersionUID = -4528316683391047617L;

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
