/*
 *   Copyright aleph-nought Developers Team
 *
 *   Licensed under the Apache License, Version 2.0 (the "License");
 *   you may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package cz.mzk.aleph.utils;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Helpers for navigating namespace aware DOM trees.
 */
public final class DOMUtils {

  private DOMUtils() {} // no instance

  /** Returns the first direct child element with the given name, or {@code null}. */
  public static Element getChildElement(Element parent, String namespaceURI, String localName) {
    for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
      if (isElement(n, namespaceURI, localName)) return (Element) n;
    }
    return null;
  }

  /** Returns all direct child elements with the given name, in document order. */
  public static List<Element> getChildElements(Element parent, String namespaceURI, String localName) {
    final List<Element> list = new ArrayList<>();
    for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
      if (isElement(n, namespaceURI, localName)) list.add((Element) n);
    }
    return list;
  }

  /** Returns the first descendant element with the given name (document order), or {@code null}. */
  public static Element findElement(Element root, String namespaceURI, String localName) {
    final NodeList nl = (namespaceURI == null) ? root.getElementsByTagName(localName) : root.getElementsByTagNameNS(namespaceURI, localName);
    return (nl.getLength() == 0) ? null : (Element) nl.item(0);
  }

  /** Returns the trimmed text of the first descendant element with the given name; {@code null} if missing or empty. */
  public static String findText(Element root, String namespaceURI, String localName) {
    return getText(findElement(root, namespaceURI, localName));
  }

  /** Returns the trimmed text content of the element; {@code null} if element is {@code null} or its text is empty. */
  public static String getText(Element e) {
    if (e == null) return null;
    final String s = e.getTextContent().trim();
    return s.isEmpty() ? null : s;
  }

  /** Serializes the node to a string (used for logging). */
  public static String toString(Node node) {
    try {
      final Transformer trans = StaticFactories.newSerializer(DOMUtils.class, "<" + node.getNodeName() + ">");
      final StringWriter sw = new StringWriter();
      trans.transform(new DOMSource(node), new StreamResult(sw));
      return sw.toString();
    } catch (TransformerException te) {
      return "<unserializable: " + te.getMessage() + ">";
    }
  }

  private static boolean isElement(Node n, String namespaceURI, String localName) {
    if (n.getNodeType() != Node.ELEMENT_NODE) return false;
    if (!localName.equals(n.getLocalName())) return false;
    return (namespaceURI == null) ? n.getNamespaceURI() == null : namespaceURI.equals(n.getNamespaceURI());
  }

}
