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

package cz.mzk.aleph.oai;

import static cz.mzk.aleph.oai.AlephOAIClient.OAI_NS;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import cz.mzk.aleph.ListRecordResult;
import cz.mzk.aleph.utils.DOMUtils;
import cz.mzk.aleph.utils.ISODateFormatter;

/**
 * Harvests one OAI set page by page. A page is only requested when the records
 * of the previous one are consumed, and nothing is requested before the first
 * call to {@link #hasNext()}.
 */
final class ListRecordsIterator implements Iterator<ListRecordResult> {

  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(ListRecordsIterator.class);

  enum State { REQUESTING, PROCESSING, DONE }

  private final AlephOAIClient client;
  private final String set;
  private final Instant from, until;

  private State state = State.REQUESTING;
  private boolean firstRequest = true;
  private String resumptionToken = null;
  private Iterator<Element> page = Collections.emptyIterator();
  private ListRecordResult next = null;
  private int pages = 0, records = 0;

  ListRecordsIterator(AlephOAIClient client, String set, Instant from, Instant until) {
    this.client = client;
    this.set = set;
    this.from = from;
    this.until = until;
  }

  @Override
  public boolean hasNext() {
    try {
      while (next == null) {
        switch (state) {
          case DONE:
            return false;
          case REQUESTING:
            fetchPage();
            break;
          case PROCESSING:
            if (page.hasNext()) {
              next = client.getClassifier().classify(page.next());
              records++;
            } else {
              page = Collections.emptyIterator();
              state = (resumptionToken == null) ? State.DONE : State.REQUESTING;
              if (state == State.DONE) {
                log.info("Harvesting set '" + set + "' finished (" + records + " records in " + pages + " pages).");
              }
            }
            break;
        }
      }
      return true;
    } catch (RuntimeException e) {
      state = State.DONE;
      throw e;
    }
  }

  @Override
  public ListRecordResult next() {
    if (!hasNext()) throw new NoSuchElementException();
    final ListRecordResult r = next;
    next = null;
    return r;
  }

  State getState() {
    return state;
  }

  private void fetchPage() {
    final Map<String,String> params = new LinkedHashMap<>();
    params.put("verb", AlephOAIClient.VERB_LIST_RECORDS);
    if (firstRequest) {
      log.info("Harvesting set '" + set + "'...");
      params.put("metadataPrefix", client.getMetadataPrefix());
      params.put("set", set);
      if (from != null) params.put("from", ISODateFormatter.formatLong(from));
      if (until != null) params.put("until", ISODateFormatter.formatLong(until));
    } else {
      log.debug("Continuing set '" + set + "' with resumption token '" + resumptionToken + "'...");
      params.put("resumptionToken", resumptionToken);
    }
    firstRequest = false;

    final Document doc;
    try {
      doc = client.sendRequest(params);
    } catch (OAIException oe) {
      if (AlephOAIClient.ERROR_NO_RECORDS_MATCH.equals(oe.getCode())) {
        log.info("No records found in set '" + set + "'.");
        finish();
        return;
      }
      throw oe;
    } catch (IOException ioe) {
      throw new UncheckedIOException(ioe);
    }
    pages++;

    final Element listRecords = DOMUtils.findElement(doc.getDocumentElement(), OAI_NS, "ListRecords");
    final List<Element> list = (listRecords == null) ? Collections.<Element>emptyList() : DOMUtils.getChildElements(listRecords, OAI_NS, "record");
    if (list.isEmpty()) {
      log.info("No records found in this batch.");
      finish();
      return;
    }
    // the token is opaque and echoed back unchanged, only a blank token ends the list
    final Element token = DOMUtils.getChildElement(listRecords, OAI_NS, "resumptionToken");
    resumptionToken = (token == null || token.getTextContent().trim().isEmpty()) ? null : token.getTextContent();
    page = list.iterator();
    state = State.PROCESSING;
  }

  private void finish() {
    resumptionToken = null;
    page = Collections.emptyIterator();
    state = State.DONE;
  }

}
