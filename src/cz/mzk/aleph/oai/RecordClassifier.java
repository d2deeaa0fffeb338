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

import static cz.mzk.aleph.oai.AlephOAIClient.MARC_NS;
import static cz.mzk.aleph.oai.AlephOAIClient.OAI_NS;

import org.marc4j.MarcException;
import org.marc4j.marc.Record;
import org.w3c.dom.Element;

import cz.mzk.aleph.ListRecordResult;
import cz.mzk.aleph.utils.DOMUtils;

/**
 * Turns one OAI-PMH <code>record</code> element into a {@link ListRecordResult}.
 * <p>
 * Records with missing header or identifier, or with an identifier not matching
 * the {@link HarvestIdentifierPattern}, are protocol violations and abort the
 * harvest with {@link OAIProtocolException}. A record whose MARC body cannot be
 * parsed is reported as {@link cz.mzk.aleph.RecordStatus#FAILED FAILED} and
 * harvesting goes on.
 */
public final class RecordClassifier {

  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(RecordClassifier.class);

  private final HarvestIdentifierPattern identifierPattern;

  public RecordClassifier(HarvestIdentifierPattern identifierPattern) {
    this.identifierPattern = identifierPattern;
  }

  public ListRecordResult classify(Element record) {
    final Element header = DOMUtils.getChildElement(record, OAI_NS, "header");
    if (header == null) {
      throw new OAIProtocolException("Record without header found.");
    }
    final String identifier = DOMUtils.getText(DOMUtils.getChildElement(header, OAI_NS, "identifier"));
    if (identifier == null) {
      throw new OAIProtocolException("Record without identifier found.");
    }
    final HarvestIdentifierPattern.Match match = identifierPattern.match(identifier);
    if (match == null) {
      throw new OAIProtocolException("Identifier '" + identifier + "' does not match template '" + identifierPattern.getTemplate() + "'.");
    }

    if ("deleted".equals(header.getAttribute("status"))) {
      log.debug("Record '" + identifier + "' is deleted.");
      return ListRecordResult.deleted(match.getBase(), match.getSystemNumber());
    }

    final Element metadata = DOMUtils.getChildElement(record, OAI_NS, "metadata");
    final Element marc = (metadata == null) ? null : DOMUtils.getChildElement(metadata, MARC_NS, "record");
    try {
      final Record marcRecord = MarcRecordParser.parse(marc);
      return ListRecordResult.active(match.getBase(), match.getSystemNumber(), marcRecord);
    } catch (MarcException me) {
      log.error("Error processing record '" + identifier + "': " + me.getMessage());
      if (log.isDebugEnabled()) log.debug("Record content: " + DOMUtils.toString(record));
      return ListRecordResult.failed(match.getBase(), match.getSystemNumber());
    }
  }

}
