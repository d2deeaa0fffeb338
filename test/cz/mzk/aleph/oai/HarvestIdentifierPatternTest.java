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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class HarvestIdentifierPatternTest {

  private static final String TEMPLATE = "oai:example.org:{base}-{doc_number}";

  @Test
  public void testMatch() {
    final HarvestIdentifierPattern p = HarvestIdentifierPattern.compile(TEMPLATE, "MZK01", "\\d{9}");
    final HarvestIdentifierPattern.Match m = p.match("oai:example.org:MZK01-000960080");
    assertNotNull(m);
    assertEquals("MZK01", m.getBase());
    assertEquals("000960080", m.getSystemNumber());
  }

  @Test
  public void testNoMatch() {
    final HarvestIdentifierPattern p = HarvestIdentifierPattern.compile(TEMPLATE, "MZK01", "\\d{9}");
    assertNull(p.match("oai:example.org:MZK03-000960080"));
    assertNull(p.match("oai:example.org:MZK01-00096008"));
    assertNull(p.match("oai:example.org:MZK01-0009600801"));
    assertNull(p.match("prefix oai:example.org:MZK01-000960080"));
    assertNull(p.match(null));
  }

  @Test
  public void testTemplateCharactersAreLiterals() {
    final HarvestIdentifierPattern p = HarvestIdentifierPattern.compile(TEMPLATE, "MZK01", "\\d{9}");
    assertNull(p.match("oai:exampleXorg:MZK01-000960080"));
    final HarvestIdentifierPattern q = HarvestIdentifierPattern.compile("[x]({base})*{doc_number}\\E", "A.B", "\\d+");
    final HarvestIdentifierPattern.Match m = q.match("[x](A.B)*42\\E");
    assertNotNull(m);
    assertEquals("A.B", m.getBase());
    assertEquals("42", m.getSystemNumber());
    assertNull(q.match("[x](AxB)*42\\E"));
  }

  @Test
  public void testTemplateWithoutBase() {
    final HarvestIdentifierPattern p = HarvestIdentifierPattern.compile("urn:mzk:{doc_number}", "MZK01", "\\d{9}");
    final HarvestIdentifierPattern.Match m = p.match("urn:mzk:000000001");
    assertNotNull(m);
    assertEquals("MZK01", m.getBase());
    assertEquals("000000001", m.getSystemNumber());
  }

  @Test
  public void testRepeatedPlaceholder() {
    final HarvestIdentifierPattern p = HarvestIdentifierPattern.compile("{doc_number}/{base}/{doc_number}", "MZK01", "\\d{3}");
    assertNotNull(p.match("123/MZK01/123"));
    assertNull(p.match("123/MZK01/124"));
    assertEquals("123/MZK01/123", p.format("123"));
  }

  @Test
  public void testPatternWithGroups() {
    final HarvestIdentifierPattern p = HarvestIdentifierPattern.compile(TEMPLATE, "MZK01", "(\\d{3})+|[A-Z]{2}");
    assertEquals("000960080", p.match("oai:example.org:MZK01-000960080").getSystemNumber());
    assertEquals("AB", p.match("oai:example.org:MZK01-AB").getSystemNumber());
  }

  @Test
  public void testFormatAndMatchRecoverValues() {
    final HarvestIdentifierPattern p = HarvestIdentifierPattern.compile(TEMPLATE, "MZK01", "\\d{9}");
    for (String docNumber : new String[] { "000000000", "000960080", "999999999" }) {
      final String identifier = p.format(docNumber);
      assertEquals("oai:example.org:MZK01-" + docNumber, identifier);
      final HarvestIdentifierPattern.Match m = p.match(identifier);
      assertEquals("MZK01", m.getBase());
      assertEquals(docNumber, m.getSystemNumber());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTemplateWithoutDocNumber() {
    HarvestIdentifierPattern.compile("oai:example.org:{base}", "MZK01", "\\d{9}");
  }

}
