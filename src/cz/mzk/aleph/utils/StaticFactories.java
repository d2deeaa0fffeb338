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

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;
import javax.xml.transform.ErrorListener;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Some pre-allocated XML factories.
 */
public final class StaticFactories {

  private StaticFactories() {} // no instance

  public static final SAXParserFactory saxFactory;
  public static final TransformerFactory transFactory;
  public static final DocumentBuilderFactory dbf;
  static {
    try {
      saxFactory = SAXParserFactory.newInstance();
      saxFactory.setNamespaceAware(true);
      saxFactory.setValidating(false);

      transFactory = TransformerFactory.newInstance();

      dbf = DocumentBuilderFactory.newInstance();
      dbf.setNamespaceAware(true);
      dbf.setValidating(false);
      dbf.setCoalescing(true);
      dbf.setExpandEntityReferences(false);
      dbf.setIgnoringComments(true);
      dbf.setXIncludeAware(false);
      dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    } catch (Exception e) {
      throw new RuntimeException("Failed to initialize XML components", e);
    }
  }

  /**
   * Returns an identity {@link Transformer} writing DOM fragments without XML declaration.
   * Serializer warnings are logged to the log of <code>owner</code> together with
   * <code>what</code> is being serialized, errors abort the serialization.
   */
  public static Transformer newSerializer(Class<?> owner, String what) throws TransformerConfigurationException {
    final Transformer trans = transFactory.newTransformer();
    trans.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
    trans.setErrorListener(new SerializerErrorListener(LogFactory.getLog(owner), what));
    return trans;
  }

  private static final class SerializerErrorListener implements ErrorListener {
    private final Log log;
    private final String what;

    SerializerErrorListener(Log log, String what) {
      this.log = log;
      this.what = what;
    }

    @Override
    public void warning(TransformerException e) {
      log.warn("Problem while serializing " + what + ": " + e.getMessageAndLocation());
    }

    @Override
    public void error(TransformerException e) throws TransformerException {
      throw e;
    }

    @Override
    public void fatalError(TransformerException e) throws TransformerException {
      throw e;
    }
  }

  /** Returns a new namespace aware {@link DocumentBuilder}. Builders are not thread safe, so each parse should get its own. */
  public static DocumentBuilder newDocumentBuilder() {
    try {
      return dbf.newDocumentBuilder();
    } catch (ParserConfigurationException pce) {
      throw new IllegalStateException("Failed to create DOM builder", pce);
    }
  }

}
