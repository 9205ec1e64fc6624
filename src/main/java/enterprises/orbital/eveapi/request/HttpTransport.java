package enterprises.orbital.eveapi.request;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.logging.Logger;

import enterprises.orbital.eveapi.config.ApiProperties;

/**
 * Default transport backed by the JDK HTTP client.  Every call is bounded by the configured request timeout.
 */
public class HttpTransport implements Transport {
  private static final Logger log = Logger.getLogger(HttpTransport.class.getName());

  private final HttpClient httpClient;
  private final Duration timeout;
  private final String userAgent;

  public HttpTransport(ApiProperties properties) {
    this.timeout = Duration.ofMillis(properties.getRequestTimeout());
    this.userAgent = properties.getUserAgent();
    this.httpClient = HttpClient.newBuilder()
                                .connectTimeout(timeout)
                                .followRedirects(HttpClient.Redirect.NORMAL)
                                .build();
  }

  @Override
  public TransportResponse get(String url) throws TransportException {
    HttpRequest request;
    try {
      request = HttpRequest.newBuilder()
                           .uri(URI.create(url))
                           .timeout(timeout)
                           .header("User-Agent", userAgent)
                           .GET()
                           .build();
    } catch (IllegalArgumentException e) {
      throw new TransportException("Invalid request URL: " + url, e);
    }
    try {
      log.fine("GET " + url);
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      return new TransportResponse(response.statusCode(), reasonPhrase(response.statusCode()), response.body());
    } catch (HttpTimeoutException e) {
      throw new TransportException("Request timed out after " + timeout.toMillis() + " ms", e);
    } catch (IOException e) {
      throw new TransportException("Request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("Interrupted while waiting for response", e);
    }
  }

  // The JDK client does not expose the status line, so map the common codes.
  static String reasonPhrase(int status) {
    switch (status) {
    case 200:
      return "OK";
    case 400:
      return "Bad Request";
    case 403:
      return "Forbidden";
    case 404:
      return "Not Found";
    case 500:
      return "Internal Server Error";
    case 502:
      return "Bad Gateway";
    case 503:
      return "Service Unavailable";
    default:
      return "HTTP " + status;
    }
  }
}
