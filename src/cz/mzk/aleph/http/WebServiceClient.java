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

package cz.mzk.aleph.http;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.util.Map;

import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import cz.mzk.aleph.config.WebServiceConfig;
import cz.mzk.aleph.utils.StaticFactories;

/**
 * Abstract base class for the clients of the Aleph HTTP services. It owns the
 * {@link HttpTransport} and closes it on {@link #close()}.
 */
public abstract class WebServiceClient implements Closeable {

  /** The logger for this class (initialized for the concrete client class) */
  protected final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(this.getClass());

  protected final HttpTransport transport;
  protected final URI serviceUri;
  protected final String base;

  protected WebServiceClient(WebServiceConfig config, HttpTransport transport) {
    if (transport == null) throw new NullPointerException("transport");
    config.check();
    this.transport = transport;
    this.serviceUri = config.getServiceUri();
    this.base = config.getBase();
  }

  /** Returns <code>true</code> if the service answers the given request with status 200. Never throws. */
  protected boolean ping(Map<String,String> params) {
    try {
      final HttpResult res = transport.get(serviceUri, params);
      if (!res.isOk()) log.warn("Service at '" + serviceUri + "' returned status " + res.getStatusCode());
      return res.isOk();
    } catch (IOException | RuntimeException e) {
      log.warn("Service at '" + serviceUri + "' is not available: " + e);
      return false;
    }
  }

  /** Sends a request, checks the HTTP status and parses the response as DOM. */
  protected Document request(Map<String,String> params) throws IOException {
    final HttpResult res = transport.get(serviceUri, params).checkStatus();
    return parse(res);
  }

  /** Parses the body of the response. Malformed XML is reported as {@link IOException}. */
  protected static Document parse(HttpResult res) throws IOException {
    final InputSource src = new InputSource(new ByteArrayInputStream(res.getBody()));
    src.setSystemId(res.getUri().toString());
    try {
      return StaticFactories.newDocumentBuilder().parse(src);
    } catch (SAXException saxe) {
      throw new IOException("Invalid XML response from '" + res.getUri() + "': " + saxe.getMessage(), saxe);
    }
  }

  public URI getServiceUri() {
    return serviceUri;
  }

  public String getBase() {
    return base;
  }

  @Override
  public void close() throws IOException {
    transport.close();
  }

}
