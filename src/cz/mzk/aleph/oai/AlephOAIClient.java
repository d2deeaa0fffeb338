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

import java.io.IOException;
import java.time.Instant;
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

import org.marc4j.marc.Record;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import cz.mzk.aleph.ListRecordResult;
import cz.mzk.aleph.config.OAIConfig;
import cz.mzk.aleph.http.HttpTransport;
import cz.mzk.aleph.http.JdkHttpTransport;
import cz.mzk.aleph.http.WebServiceClient;
import cz.mzk.aleph.utils.DOMUtils;

/**
 * Client for the OAI-PMH interface of Aleph.
 * <p>
 * {@link #listRecords(Instant, Instant)} harvests all configured sets one after another.
 * The returned streams are lazy: pages are requested while the stream is consumed,
 * at most one page is held in memory, and abandoning a stream issues no further
 * requests. Streams are not thread safe; each call starts a fresh harvest.
 */
public class AlephOAIClient extends WebServiceClient {

  public static final String OAI_NS = "http://www.openarchives.org/OAI/2.0/";
  public static final String MARC_NS = "http://www.loc.gov/MARC21/slim";

  public static final String VERB_IDENTIFY = "Identify";
  public static final String VERB_GET_RECORD = "GetRecord";
  public static final String VERB_LIST_RECORDS = "ListRecords";

  public static final String ERROR_NO_RECORDS_MATCH = "noRecordsMatch";

  private final String metadataPrefix;
  private final List<String> sets;
  private final HarvestIdentifierPattern identifierPattern;
  private final RecordClassifier classifier;

  public AlephOAIClient(OAIConfig config) {
    this(config, new JdkHttpTransport(config));
  }

  public AlephOAIClient(OAIConfig config, HttpTransport transport) {
    super(config, transport);
    this.metadataPrefix = config.getMetadataPrefix();
    this.sets = config.getSets();
    this.identifierPattern = HarvestIdentifierPattern.compile(config.getIdentifierTemplate(), config.getBase(), config.getSystemNumberPattern());
    this.classifier = new RecordClassifier(identifierPattern);
  }

  /** Sends an <code>Identify</code> request. Returns <code>true</code> if the repository answers with status 200. */
  public boolean isAvailable() {
    return ping(Collections.singletonMap("verb", VERB_IDENTIFY));
  }

  /**
   * Fetches a single record by its system number. The OAI identifier is built from
   * the identifier template and the configured base.
   * @return the record or {@code null} if the response contains no MARC record
   * @throws OAIException if the repository reports an error, e.g. <code>idDoesNotExist</code>
   * @throws IOException on network failures or HTTP status other than 2xx
   */
  public Record getRecord(String docNumber) throws IOException {
    final Map<String,String> params = new LinkedHashMap<>();
    params.put("verb", VERB_GET_RECORD);
    params.put("metadataPrefix", metadataPrefix);
    params.put("identifier", identifierPattern.format(docNumber));
    final Document doc = sendRequest(params);
    final Element marc = DOMUtils.findElement(doc.getDocumentElement(), MARC_NS, "record");
    if (marc == null) {
      log.debug("No MARC record returned for '" + params.get("identifier") + "'.");
      return null;
    }
    return MarcRecordParser.parse(marc);
  }

  /**
   * Harvests all configured sets in their configured order. <code>from</code> and
   * <code>until</code> may be {@code null}.
   */
  public Stream<ListRecordResult> listRecords(Instant from, Instant until) {
    final Iterator<String> setIterator = sets.iterator();
    return toStream(new Iterator<ListRecordResult>() {
      private Iterator<ListRecordResult> current = Collections.emptyIterator();
      private boolean failed = false;

      @Override
      public boolean hasNext() {
        if (failed) return false;
        try {
          while (!current.hasNext()) {
            if (!setIterator.hasNext()) return false;
            current = new ListRecordsIterator(AlephOAIClient.this, setIterator.next(), from, until);
          }
          return true;
        } catch (RuntimeException e) {
          // a fatal error ends the whole harvest, remaining sets are skipped
          failed = true;
          throw e;
        }
      }

      @Override
      public ListRecordResult next() {
        if (!hasNext()) throw new NoSuchElementException();
        return current.next();
      }
    });
  }

  /** Harvests a single set. <code>from</code> and <code>until</code> may be {@code null}. */
  public Stream<ListRecordResult> listRecords(String set, Instant from, Instant until) {
    return toStream(new ListRecordsIterator(this, set, from, until));
  }

  private static Stream<ListRecordResult> toStream(Iterator<ListRecordResult> it) {
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
  }

  /**
   * Sends the request and checks the response for an OAI <code>error</code> element.
   * @throws OAIException if the repository reports an error
   */
  Document sendRequest(Map<String,String> params) throws IOException {
    final Document doc = request(params);
    final Element error = DOMUtils.findElement(doc.getDocumentElement(), OAI_NS, "error");
    if (error != null) {
      throw new OAIException(error.getAttribute("code"), DOMUtils.getText(error));
    }
    return doc;
  }

  public String getMetadataPrefix() {
    return metadataPrefix;
  }

  /** The sets harvested by {@link #listRecords(Instant, Instant)}, in order. */
  public List<String> getSets() {
    return sets;
  }

  public HarvestIdentifierPattern getIdentifierPattern() {
    return identifierPattern;
  }

  RecordClassifier getClassifier() {
    return classifier;
  }

}
