package enterprises.orbital.eveapi.request;

public class TransportResponse {
  private final int status;
  private final String statusText;
  private final String body;

  public TransportResponse(
                           int status,
                           String statusText,
                           String body) {
    this.status = status;
    this.statusText = statusText;
    this.body = body;
  }

  public int getStatus() {
    return status;
  }

  public String getStatusText() {
    return statusText;
  }

  public String getBody() {
    return body;
  }

  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }
}
