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

package cz.mzk.aleph.x;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import cz.mzk.aleph.config.XServerConfig;
import cz.mzk.aleph.http.HttpTransport;
import cz.mzk.aleph.http.JdkHttpTransport;
import cz.mzk.aleph.http.WebServiceClient;
import cz.mzk.aleph.utils.DOMUtils;

/**
 * Client for the Aleph X-Server API. A search is done in two phases: <code>find</code>
 * creates a result set on the server and opens a session ({@link #search}),
 * <code>present</code> fetches windows of it ({@link #fetch}).
 */
public class AlephXClient extends WebServiceClient {

  public static final String OP_PING = "ping";
  public static final String OP_FIND = "find";
  public static final String OP_PRESENT = "present";

  private final int pageSize;

  public AlephXClient(XServerConfig config) {
    this(config, new JdkHttpTransport(config));
  }

  public AlephXClient(XServerConfig config, HttpTransport transport) {
    super(config, transport);
    this.pageSize = config.getPageSize();
  }

  /** Sends a <code>ping</code>. Returns <code>true</code> if the X-Server answers with status 200. */
  public boolean isAvailable() {
    return ping(Collections.singletonMap("op", OP_PING));
  }

  /**
   * Searches for <code>value</code> in the index <code>field</code> (e.g. <code>ICZ</code>, <code>SYS</code>).
   * @throws XServerException if the response has no session id
   */
  public XSession search(String field, String value) throws IOException {
    final Map<String,String> params = new LinkedHashMap<>();
    params.put("op", OP_FIND);
    params.put("base", base);
    params.put("code", field);
    params.put("request", value);
    final Element root = request(params).getDocumentElement();

    final String sessionId = DOMUtils.findText(root, null, "session-id");
    if (sessionId == null) {
      String message = DOMUtils.findText(root, null, "h1");
      if (message == null) message = DOMUtils.findText(root, null, "error");
      throw new XServerException((message == null) ? "Unexpected response" : message);
    }

    final String noRecords = DOMUtils.findText(root, null, "no_records");
    final int total;
    try {
      total = (noRecords == null) ? 0 : Integer.parseInt(noRecords);
    } catch (NumberFormatException nfe) {
      throw new XServerException("Invalid number of records: " + noRecords);
    }
    final XSession session = new XSession(sessionId, DOMUtils.findText(root, null, "set_number"), total);
    log.debug("Search " + field + "=" + value + " returned " + session);
    return session;
  }

  /**
   * Fetches the system numbers of the entries <code>start</code> to <code>end</code>
   * (1-based, inclusive) of the session's result set.
   */
  public List<String> fetch(XSession session, int start, int end) throws IOException {
    final Map<String,String> params = new LinkedHashMap<>();
    params.put("op", OP_PRESENT);
    params.put("set_number", session.getSetNumber());
    params.put("set_entry", start + "-" + end);
    params.put("session_id", session.getSessionId());
    final Element root = request(params).getDocumentElement();

    session.updateSessionId(DOMUtils.findText(root, null, "session-id"));

    final NodeList nl = root.getElementsByTagName("doc_number");
    final List<String> docNumbers = new ArrayList<>(nl.getLength());
    for (int i = 0, c = nl.getLength(); i < c; i++) {
      final String docNumber = DOMUtils.getText((Element) nl.item(i));
      if (docNumber != null) docNumbers.add(docNumber);
    }
    return docNumbers;
  }

  /**
   * Returns all system numbers found for <code>value</code> in index <code>field</code>.
   * The search is sent when the stream is consumed, the result set is then fetched
   * in windows of <code>pageSize</code> entries as needed.
   * I/O errors are thrown as {@link UncheckedIOException}.
   */
  public Stream<String> findSystemNumbers(String field, String value) {
    final Iterator<String> it = new Iterator<String>() {
      private XSession session = null;
      private int nextStart = 1;
      private Iterator<String> window = Collections.emptyIterator();
      private boolean failed = false;

      @Override
      public boolean hasNext() {
        if (failed) return false;
        try {
          if (session == null) session = search(field, value);
          while (!window.hasNext()) {
            if (nextStart > session.getTotal()) return false;
            final int end = Math.min(nextStart + pageSize - 1, session.getTotal());
            window = fetch(session, nextStart, end).iterator();
            nextStart = end + 1;
          }
          return true;
        } catch (IOException ioe) {
          failed = true;
          throw new UncheckedIOException(ioe);
        } catch (RuntimeException e) {
          failed = true;
          throw e;
        }
      }

      @Override
      public String next() {
        if (!hasNext()) throw new NoSuchElementException();
        return window.next();
      }
    };
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
  }

  /**
   * Returns the system number if exactly one record is found, otherwise {@code null}.
   */
  public String getOneOrNoneSystemNumber(String field, String value) throws IOException {
    final XSession session = search(field, value);
    if (session.getTotal() != 1) {
      log.debug("Expected exactly one record for " + field + "=" + value + ", found " + session.getTotal());
      return null;
    }
    final List<String> docNumbers = fetch(session, 1, 1);
    return docNumbers.isEmpty() ? null : docNumbers.get(0);
  }

  public int getPageSize() {
    return pageSize;
  }

}
