package enterprises.orbital.eveapi.request;

/**
 * HTTP transport used by the dispatcher.  Implementations perform a single GET and return the raw response.
 * This abstraction exists so tests can inject canned responses.
 */
public interface Transport {

  /**
   * Issue a GET for the given URL.
   *
   * @param url fully formed request URL.
   * @return status and body of the response, whatever the status.
   * @throws TransportException if the request could not be completed.
   */
  TransportResponse get(String url) throws TransportException;
}
