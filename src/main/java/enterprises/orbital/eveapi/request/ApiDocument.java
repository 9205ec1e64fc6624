package enterprises.orbital.eveapi.request;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.joda.time.DateTime;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import enterprises.orbital.eveapi.model.ModelUtil;

/**
 * Parsed response document.  All EVE XML API responses share the envelope:
 *
 * <pre>
 * &lt;eveapi version="2"&gt;
 *   &lt;currentTime&gt;...&lt;/currentTime&gt;
 *   &lt;result&gt;...&lt;/result&gt; or &lt;error code="N"&gt;...&lt;/error&gt;
 *   &lt;cachedUntil&gt;...&lt;/cachedUntil&gt;
 * &lt;/eveapi&gt;
 * </pre>
 */
public class ApiDocument {
  private final Document document;

  private ApiDocument(Document document) {
    this.document = document;
  }

  /**
   * Parse a response body.
   *
   * @param body raw XML text.
   * @return the parsed document.
   * @throws TransportException if the body is not well formed XML.
   */
  public static ApiDocument parse(String body) throws TransportException {
    if (body == null) throw new TransportException("Empty response body");
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setExpandEntityReferences(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      return new ApiDocument(builder.parse(new InputSource(new StringReader(body))));
    } catch (ParserConfigurationException | SAXException | IOException e) {
      throw new TransportException("Unable to parse response document", e);
    }
  }

  /**
   * Text of the first node matching a path.
   *
   * @param path XPath expression, e.g. <code>//result/key/@type</code>.
   * @return the value, or null if nothing matches.
   */
  public String firstValue(String path) {
    return ApiNode.firstValue(document, path);
  }

  public List<ApiNode> allNodes(String path) {
    return ApiNode.allNodes(document, path);
  }

  public DateTime currentTime() {
    return ModelUtil.parseDate(firstValue("/eveapi/currentTime"));
  }

  public DateTime cachedUntil() {
    return ModelUtil.parseDate(firstValue("/eveapi/cachedUntil"));
  }

  public boolean isError() {
    return !allNodes("/eveapi/error").isEmpty();
  }

  /**
   * @return the API error code, or {@link RemoteApiException#NO_ERROR_CODE} if the document carries no error or the
   *         code is not numeric.
   */
  public int getErrorCode() {
    String code = firstValue("/eveapi/error/@code");
    if (code == null) return RemoteApiException.NO_ERROR_CODE;
    try {
      return Integer.parseInt(code.trim());
    } catch (NumberFormatException e) {
      return RemoteApiException.NO_ERROR_CODE;
    }
  }

  public String getErrorString() {
    String text = firstValue("/eveapi/error");
    return text == null ? null : text.trim();
  }
}
