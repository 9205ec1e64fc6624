package enterprises.orbital.eveapi.model;

import org.easymock.EasyMock;
import org.joda.time.DateTime;
import org.joda.time.DateTimeUtils;
import org.joda.time.DateTimeZone;
import org.junit.After;
import org.junit.Before;

import enterprises.orbital.eveapi.ApiContext;
import enterprises.orbital.eveapi.TestBase;
import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.request.EndpointDispatcher;
import enterprises.orbital.eveapi.request.Transport;

/**
 * Common setup for entity tests: a mock transport behind a real dispatcher, an empty model cache, and a key with a
 * fixed id and verification code.  Remote calls are counted by the mock, so every test replays its expectations and
 * verifies them at the end.
 */
public class ModelTestBase extends TestBase {

  public static final String BASE_URL = "https://api.test/";
  public static final String URL_SUFFIX = ".xml.aspx";
  public static final long KEY_ID = 12345L;
  public static final String V_CODE = "abcdef";
  public static final String KEY_QUERY = "keyID=" + KEY_ID + "&vCode=" + V_CODE;

  // Fixtures are stamped 2020-03-01 12:00:00 and cached for up to a day
  public static final DateTime FIXTURE_TIME = new DateTime(2020, 3, 1, 12, 0, 0, DateTimeZone.UTC);

  protected Transport mockTransport;
  protected ModelCache modelCache;
  protected ApiContext context;
  protected Credential credential;

  @Before
  public void setup() throws Exception {
    DateTimeUtils.setCurrentMillisFixed(FIXTURE_TIME.getMillis());
    mockTransport = EasyMock.createMock(Transport.class);
    modelCache = new ModelCache();
    context = new ApiContext(new EndpointDispatcher(mockTransport, BASE_URL, URL_SUFFIX), modelCache);
    credential = context.credential(KEY_ID, V_CODE);
  }

  @After
  public void teardown() throws Exception {
    DateTimeUtils.setCurrentMillisSystem();
  }

  public static String url(String endpoint) {
    return BASE_URL + endpoint + URL_SUFFIX;
  }

  public static String url(String endpoint, String query) {
    return url(endpoint) + "?" + query;
  }

  /**
   * Expect exactly one request for the given URL.
   */
  protected void expectUrl(String url, String fixture) throws Exception {
    EasyMock.expect(mockTransport.get(url)).andReturn(okResponse(fixture));
  }

  /**
   * Expect exactly one call to an endpoint, whatever the parameters.
   */
  protected void expectCall(String endpoint, String fixture) throws Exception {
    EasyMock.expect(mockTransport.get(EasyMock.startsWith(url(endpoint)))).andReturn(okResponse(fixture));
  }

  /**
   * Expect the key info call made the first time the test key's scope is needed.
   */
  protected void expectKeyInfo(String fixture) throws Exception {
    expectUrl(url("account/APIKeyInfo", KEY_QUERY), fixture);
  }

  protected void replay() {
    EasyMock.replay(mockTransport);
  }

  protected void verify() {
    EasyMock.verify(mockTransport);
  }
}
