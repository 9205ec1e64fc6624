package enterprises.orbital.eveapi.request;

/**
 * The server answered but did not succeed.  Either the HTTP status was not 2xx, or the document carried an API
 * error element.  In the latter case {@link #getErrorCode()} holds the API error code and {@link #getStatus()}
 * holds the HTTP status of the (otherwise successful) response.
 */
public class RemoteApiException extends EveApiException {
  private static final long serialVersionUID = 1833525907342618772L;

  // Value of errorCode when the failure was an HTTP status
  public static final int NO_ERROR_CODE = -1;

  private final int status;
  private final String statusText;
  private final int errorCode;

  public RemoteApiException(int status, String statusText) {
    this(status, statusText, NO_ERROR_CODE);
  }

  public RemoteApiException(
                            int status,
                            String statusText,
                            int errorCode) {
    super(errorCode == NO_ERROR_CODE ? "HTTP " + status + ": " + statusText : "Error " + errorCode + ": " + statusText);
    this.status = status;
    this.statusText = statusText;
    this.errorCode = errorCode;
  }

  public int getStatus() {
    return status;
  }

  public String getStatusText() {
    return statusText;
  }

  public int getErrorCode() {
    return errorCode;
  }

  public boolean isApiError() {
    return errorCode != NO_ERROR_CODE;
  }
}
