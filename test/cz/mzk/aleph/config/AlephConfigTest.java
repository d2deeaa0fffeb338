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

package cz.mzk.aleph.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import cz.mzk.aleph.z3950.AlephZ3950ClientTest;

public class AlephConfigTest {

  private static AlephConfig load(String name) throws Exception {
    try (InputStream in = AlephConfigTest.class.getResourceAsStream(name)) {
      assertNotNull("Missing test resource " + name, in);
      return AlephConfig.load(in);
    }
  }

  @Test
  public void testLoadFull() throws Exception {
    final AlephConfig conf = load("aleph-config.xml");
    assertEquals("MZK01", conf.getBase());

    final OAIConfig oai = conf.getOAI();
    assertEquals("https://aleph.example.org/OAI", oai.getServiceUri().toString());
    assertEquals("MZK01", oai.getBase());
    assertEquals(60, oai.getTimeout());
    assertEquals(3, oai.getTotalRetry());
    assertEquals(2, oai.getRetryBackoffFactor());
    assertEquals("marc21", oai.getMetadataPrefix());
    assertEquals("\\d{9}", oai.getSystemNumberPattern());
    assertEquals("oai:aleph.mzk.cz:{base}-{doc_number}", oai.getIdentifierTemplate());
    assertEquals(Arrays.asList("MZK01-VDK", "MZK01-MZK"), oai.getSets());

    final XServerConfig x = conf.getX();
    assertEquals("https://aleph.example.org/X", x.getServiceUri().toString());
    assertEquals("MZK03", x.getBase());
    assertEquals(20, x.getPageSize());
    assertEquals(WebServiceConfig.DEFAULT_TIMEOUT, x.getTimeout());

    final Z3950Config z = conf.getZ3950();
    assertEquals("aleph.example.org", z.getHost());
    assertEquals(9991, z.getPort());
    assertEquals("MZK01", z.getBase());
    assertTrue(z.getConnectionFactory() instanceof AlephZ3950ClientTest.FakeConnectionFactory);
  }

  @Test
  public void testDefaults() throws Exception {
    final AlephConfig conf = load("aleph-config-minimal.xml");
    assertNull(conf.getX());
    assertNull(conf.getZ3950());
    final OAIConfig oai = conf.getOAI();
    assertEquals("https://aleph.example.org/OAI", oai.getServiceUri().toString());
    assertEquals(30, oai.getTimeout());
    assertEquals(5, oai.getTotalRetry());
    assertEquals(1, oai.getRetryBackoffFactor());
    assertEquals("oai:aleph.example.org:{base}-{doc_number}", oai.getIdentifierTemplate());
    assertEquals(Collections.singletonList("MZK01"), oai.getSets());
  }

  @Test
  public void testUnknownElement() throws Exception {
    try {
      load("aleph-config-typo.xml");
      fail("Unknown element should be rejected");
    } catch (Exception e) {
      assertTrue(e.getMessage(), e.getMessage().contains("metadataPrefx"));
    }
  }

  @Test
  public void testNoService() throws Exception {
    try {
      load("aleph-config-no-service.xml");
      fail("Configuration without service should be rejected");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("At least one"));
    }
  }

  @Test(expected = Exception.class)
  public void testInvalidPort() throws Exception {
    load("aleph-config-bad-port.xml");
  }

  @Test
  public void testProgrammatic() {
    final AlephConfig conf = new AlephConfig("MZK01");
    final XServerConfig x = new XServerConfig();
    x.setHost("http://localhost:8080");
    conf.setX(x);
    conf.check();
    assertEquals("MZK01", x.getBase());
    assertEquals("http://localhost:8080/X", x.getServiceUri().toString());
  }

  @Test(expected = IllegalStateException.class)
  public void testImmutableAfterCheck() {
    final AlephConfig conf = new AlephConfig("MZK01");
    final OAIConfig oai = new OAIConfig();
    oai.setHost("http://localhost");
    conf.setOAI(oai);
    conf.check();
    oai.setMetadataPrefix("oai_dc");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingBase() {
    final AlephConfig conf = new AlephConfig();
    final OAIConfig oai = new OAIConfig();
    oai.setHost("http://localhost");
    conf.setOAI(oai);
    conf.check();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateService() {
    final AlephConfig conf = new AlephConfig("MZK01");
    conf.setX(new XServerConfig());
    conf.setX(new XServerConfig());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonHttpHost() {
    final OAIConfig oai = new OAIConfig();
    oai.setHost("ftp://aleph.example.org");
    oai.setBase("MZK01");
    oai.check();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTemplateWithoutDocNumber() {
    final OAIConfig oai = new OAIConfig();
    oai.setHost("http://aleph.example.org");
    oai.setBase("MZK01");
    oai.setIdentifierTemplate("oai:aleph.example.org:{base}");
    oai.check();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidSystemNumberPattern() {
    final OAIConfig oai = new OAIConfig();
    oai.setHost("http://aleph.example.org");
    oai.setBase("MZK01");
    oai.setSystemNumberPattern("\\d{9");
    oai.check();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateSet() {
    final OAIConfig oai = new OAIConfig();
    oai.addSet("MZK01");
    oai.addSet(" MZK01 ");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidPageSize() {
    final XServerConfig x = new XServerConfig();
    x.setHost("http://aleph.example.org");
    x.setBase("MZK01");
    x.setPageSize(0);
    x.check();
  }

}
