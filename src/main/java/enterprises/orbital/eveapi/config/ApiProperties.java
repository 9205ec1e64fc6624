package enterprises.orbital.eveapi.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Configuration properties for the API client.  Values are read from <code>eveapi.properties</code> on the
 * classpath when present.  System properties with the same name take precedence over file values.
 */
public class ApiProperties {
  private static final Logger log = Logger.getLogger(ApiProperties.class.getName());

  public static final String PROPERTIES_RESOURCE = "eveapi.properties";

  // Remote API location
  public static final String PROP_BASE_URL = "enterprises.orbital.eveapi.base_url";
  public static final String DEF_BASE_URL = "https://api.eveonline.com/";

  // Suffix appended to every endpoint path
  public static final String PROP_URL_SUFFIX = "enterprises.orbital.eveapi.url_suffix";
  public static final String DEF_URL_SUFFIX = ".xml.aspx";

  // Per-call timeout in milliseconds
  public static final String PROP_REQUEST_TIMEOUT = "enterprises.orbital.eveapi.request_timeout";
  public static final long DEF_REQUEST_TIMEOUT = 30000L;

  // User agent sent with each request
  public static final String PROP_USER_AGENT = "enterprises.orbital.eveapi.user_agent";
  public static final String DEF_USER_AGENT = "orbital-eveapi/1.0";

  private final Properties properties;

  public ApiProperties(Properties properties) {
    this.properties = properties;
  }

  /**
   * Load properties from the default classpath resource.  A missing resource yields an empty property set, in
   * which case all lookups fall back to system properties and defaults.
   *
   * @return loaded properties.
   */
  public static ApiProperties load() {
    Properties props = new Properties();
    try (InputStream in = ApiProperties.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
      if (in != null) props.load(in);
    } catch (IOException e) {
      log.log(Level.WARNING, "Unable to read " + PROPERTIES_RESOURCE + ", using defaults", e);
    }
    return new ApiProperties(props);
  }

  public String getProperty(String name) {
    String value = System.getProperty(name);
    return value != null ? value : properties.getProperty(name);
  }

  public String getPropertyWithFallback(String name, String def) {
    String value = getProperty(name);
    return value == null || value.trim().isEmpty() ? def : value.trim();
  }

  public long getLongPropertyWithFallback(String name, long def) {
    String value = getProperty(name);
    if (value == null) return def;
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      log.warning("Non-numeric value for " + name + ": " + value + ", using default " + def);
      return def;
    }
  }

  public String getBaseUrl() {
    return getPropertyWithFallback(PROP_BASE_URL, DEF_BASE_URL);
  }

  public String getUrlSuffix() {
    return getPropertyWithFallback(PROP_URL_SUFFIX, DEF_URL_SUFFIX);
  }

  public long getRequestTimeout() {
    long timeout = getLongPropertyWithFallback(PROP_REQUEST_TIMEOUT, DEF_REQUEST_TIMEOUT);
    if (timeout <= 0) {
      log.warning("Request timeout must be positive, got " + timeout + ", using default " + DEF_REQUEST_TIMEOUT);
      return DEF_REQUEST_TIMEOUT;
    }
    return timeout;
  }

  public String getUserAgent() {
    return getPropertyWithFallback(PROP_USER_AGENT, DEF_USER_AGENT);
  }
}
