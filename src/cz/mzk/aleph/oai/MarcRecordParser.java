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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

import javax.xml.transform.TransformerException;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.marc4j.MarcException;
import org.marc4j.MarcXmlReader;
import org.marc4j.marc.Record;
import org.w3c.dom.Element;

import cz.mzk.aleph.utils.StaticFactories;

/**
 * Converts a MARCXML <code>record</code> element to a marc4j {@link Record}.
 */
public final class MarcRecordParser {

  private MarcRecordParser() {} // no instance

  /**
   * Parses the given <code>marc:record</code> element.
   * @throws MarcException if the element is {@code null} or not a valid MARCXML record
   */
  public static Record parse(Element marcRecord) {
    if (marcRecord == null) throw new MarcException("Missing MARC record in metadata");
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      StaticFactories.newSerializer(MarcRecordParser.class, "MARC record").transform(new DOMSource(marcRecord), new StreamResult(out));
    } catch (TransformerException te) {
      throw new MarcException("Cannot serialize MARC record", te);
    }
    final MarcXmlReader reader = new MarcXmlReader(new ByteArrayInputStream(out.toByteArray()));
    final Record record;
    try {
      if (!reader.hasNext()) throw new MarcException("No MARC record found in metadata");
      record = reader.next();
    } catch (MarcException me) {
      throw me;
    } catch (RuntimeException e) {
      // marc4j reports unparseable leaders as plain runtime exceptions
      throw new MarcException("Unreadable MARC record", e);
    }
    if (record.getLeader() == null) throw new MarcException("MARC record without leader");
    return record;
  }

}
