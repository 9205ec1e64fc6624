package enterprises.orbital.eveapi.request;

/**
 * Thrown when an endpoint name is not of the form <code>section/Name</code>.  Never reaches the network.
 */
public class InvalidEndpointException extends EveApiException {
  private static final long serialVersionUID = -2101409127418377650L;

  private final String endpoint;

  public InvalidEndpointException(String endpoint) {
    super("Malformed endpoint name: " + endpoint);
    this.endpoint = endpoint;
  }

  public String getEndpoint() {
    return endpoint;
  }
}
