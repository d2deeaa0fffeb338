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

package cz.mzk.aleph.z3950;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;
import org.marc4j.marc.MarcFactory;
import org.marc4j.marc.Record;

import cz.mzk.aleph.config.Z3950Config;

public class AlephZ3950ClientTest {

  /** Connection factory answering every query with the same records. */
  public static class FakeConnectionFactory implements Z3950ConnectionFactory {
    final Map<String,String> options = new LinkedHashMap<>();
    final List<String> queries = new ArrayList<>();
    final List<Record> records = new ArrayList<>();
    String host;
    int port;
    int closeCount = 0;

    @Override
    public Z3950Connection open(String host, int port) {
      this.host = host;
      this.port = port;
      return new Z3950Connection() {
        @Override
        public void setOption(String name, String value) {
          options.put(name, value);
        }

        @Override
        public Z3950ResultSet search(String pqfQuery) {
          queries.add(pqfQuery);
          return new Z3950ResultSet() {
            @Override
            public int size() {
              return records.size();
            }

            @Override
            public Record getRecord(int index) {
              return records.get(index);
            }
          };
        }

        @Override
        public void close() {
          closeCount++;
        }
      };
    }
  }

  private FakeConnectionFactory factory;
  private Z3950Config config;

  @Before
  public void setUp() {
    factory = new FakeConnectionFactory();
    config = new Z3950Config();
    config.setHost("aleph.example.org");
    config.setBase("MZK01");
  }

  private static Record record(String controlNumber) {
    final MarcFactory mf = MarcFactory.newInstance();
    final Record r = mf.newRecord();
    r.addVariableField(mf.newControlField("001", controlNumber));
    return r;
  }

  @Test
  public void testConnectionOptions() throws Exception {
    try (AlephZ3950Client client = new AlephZ3950Client(config, factory)) {
      assertTrue(client.isOpen());
      assertEquals("aleph.example.org", factory.host);
      assertEquals(Z3950Config.DEFAULT_PORT, factory.port);
      assertEquals("MARC21", factory.options.get("preferredRecordSyntax"));
      assertEquals("MZK01", factory.options.get("databaseName"));
    }
  }

  @Test
  public void testSearchReturnsRecordsInOrder() throws Exception {
    factory.records.addAll(Arrays.asList(record("000000001"), record("000000002"), record("000000003")));
    try (AlephZ3950Client client = new AlephZ3950Client(config, factory)) {
      final List<Record> result = client.search("@attr 1=12 000000001");
      assertEquals(3, result.size());
      assertEquals("000000001", result.get(0).getControlNumber());
      assertEquals("000000003", result.get(2).getControlNumber());
      assertEquals(Arrays.asList("@attr 1=12 000000001"), factory.queries);
    }
  }

  @Test
  public void testEmptyResult() throws Exception {
    try (AlephZ3950Client client = new AlephZ3950Client(config, factory)) {
      assertTrue(client.search("@attr 1=4 nothing").isEmpty());
    }
  }

  @Test
  public void testCloseIsIdempotent() throws Exception {
    final AlephZ3950Client client = new AlephZ3950Client(config, factory);
    client.close();
    client.close();
    assertFalse(client.isOpen());
    assertEquals(1, factory.closeCount);
  }

  @Test(expected = IllegalStateException.class)
  public void testSearchAfterClose() throws Exception {
    final AlephZ3950Client client = new AlephZ3950Client(config, factory);
    client.close();
    client.search("@attr 1=12 000000001");
  }

  @Test
  public void testFactoryFromConfig() throws Exception {
    config.setConnectionFactory(factory);
    config.setPort(2100);
    try (AlephZ3950Client client = new AlephZ3950Client(config)) {
      assertEquals(2100, factory.port);
      assertEquals(2100, client.getPort());
    }
  }

  @Test
  public void testConnectionClosedWhenOptionRejected() throws Exception {
    final List<String> closed = new ArrayList<>();
    final Z3950ConnectionFactory rejecting = (h, p) -> new Z3950Connection() {
      @Override
      public void setOption(String name, String value) {
        if ("databaseName".equals(name)) throw new IllegalArgumentException("Unknown database " + value);
      }

      @Override
      public Z3950ResultSet search(String pqfQuery) {
        throw new AssertionError("no search expected");
      }

      @Override
      public void close() {
        closed.add(h + ":" + p);
      }
    };
    try {
      new AlephZ3950Client(config, rejecting);
      fail("IllegalArgumentException expected");
    } catch (IllegalArgumentException e) {
      assertEquals("Unknown database MZK01", e.getMessage());
    }
    assertEquals(Arrays.asList("aleph.example.org:" + Z3950Config.DEFAULT_PORT), closed);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingFactory() throws IOException {
    new AlephZ3950Client(config);
  }

}
