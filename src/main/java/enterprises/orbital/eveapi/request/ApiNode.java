package enterprises.orbital.eveapi.request;

import java.util.ArrayList;
import java.util.List;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * A single element of a response document.  Paths are XPath expressions evaluated relative to this node.
 */
public class ApiNode {
  private final Node node;

  ApiNode(Node node) {
    this.node = node;
  }

  /**
   * Retrieve an attribute of this element.
   *
   * @param name attribute name.
   * @return the attribute value, or null if the attribute is not present.
   */
  public String attribute(String name) {
    if (!(node instanceof Element)) return null;
    Element el = (Element) node;
    return el.hasAttribute(name) ? el.getAttribute(name) : null;
  }

  public String firstValue(String path) {
    return firstValue(node, path);
  }

  public List<ApiNode> allNodes(String path) {
    return allNodes(node, path);
  }

  static String firstValue(Node context, String path) {
    NodeList matches = evaluate(context, path);
    if (matches.getLength() == 0) return null;
    return matches.item(0).getTextContent();
  }

  static List<ApiNode> allNodes(Node context, String path) {
    NodeList matches = evaluate(context, path);
    List<ApiNode> result = new ArrayList<>(matches.getLength());
    for (int i = 0; i < matches.getLength(); i++) {
      result.add(new ApiNode(matches.item(i)));
    }
    return result;
  }

  private static NodeList evaluate(Node context, String path) {
    // XPath instances are not thread safe, so create one per evaluation
    XPath xpath = XPathFactory.newInstance().newXPath();
    try {
      return (NodeList) xpath.evaluate(path, context, XPathConstants.NODESET);
    } catch (XPathExpressionException e) {
      throw new IllegalArgumentException("Invalid document path: " + path, e);
    }
  }
}
