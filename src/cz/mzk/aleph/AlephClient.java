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

package cz.mzk.aleph;

import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Stream;

import cz.mzk.aleph.config.AlephConfig;
import cz.mzk.aleph.oai.AlephOAIClient;
import cz.mzk.aleph.utils.ISODateFormatter;
import cz.mzk.aleph.x.AlephXClient;
import cz.mzk.aleph.z3950.AlephZ3950Client;

/**
 * Facade over the Aleph services configured in an {@link AlephConfig}.
 * <p>
 * It can also be started from the command line with a configuration file. It then
 * checks the availability of the configured web services and, if a start date is
 * given, harvests all configured OAI sets and prints a summary:
 * <pre>
 * java cz.mzk.aleph.AlephClient config.xml [from [until]]
 * </pre>
 */
public class AlephClient implements Closeable {

  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(AlephClient.class);

  public static void main(String[] args) {
    if (args.length < 1 || args.length > 3) {
      System.err.println("Command line: java " + AlephClient.class.getName() + " config.xml [from [until]]");
      return;
    }

    try {
      final AlephConfig conf = AlephConfig.load(args[0]);
      final Instant from = (args.length > 1) ? ISODateFormatter.parseDate(args[1]) : null;
      final Instant until = (args.length > 2) ? ISODateFormatter.parseDate(args[2]) : null;
      try (AlephClient client = new AlephClient(conf)) {
        client.run(from, until);
      }
    } catch (Exception e) {
      log.fatal("Aleph client general error:", e);
    }
  }

  private final AlephOAIClient oai;
  private final AlephXClient x;
  private final AlephZ3950Client z3950;

  /** Creates clients for all configured services. */
  public AlephClient(AlephConfig config) throws IOException {
    config.check();
    this.oai = (config.getOAI() == null) ? null : new AlephOAIClient(config.getOAI());
    this.x = (config.getX() == null) ? null : new AlephXClient(config.getX());
    AlephZ3950Client z = null;
    if (config.getZ3950() != null) {
      try {
        z = new AlephZ3950Client(config.getZ3950());
      } catch (IOException | RuntimeException e) {
        closeAll(e);
        throw e;
      }
    }
    this.z3950 = z;
  }

  /** Creates the facade from existing clients, each may be {@code null}. */
  public AlephClient(AlephOAIClient oai, AlephXClient x, AlephZ3950Client z3950) {
    this.oai = oai;
    this.x = x;
    this.z3950 = z3950;
  }

  /** @throws IllegalStateException if the OAI service is not configured */
  public AlephOAIClient getOAI() {
    if (oai == null) throw new IllegalStateException("OAI service is not configured");
    return oai;
  }

  /** @throws IllegalStateException if the X-Server service is not configured */
  public AlephXClient getX() {
    if (x == null) throw new IllegalStateException("X service is not configured");
    return x;
  }

  /** @throws IllegalStateException if the Z39.50 service is not configured */
  public AlephZ3950Client getZ3950() {
    if (z3950 == null) throw new IllegalStateException("Z3950 service is not configured");
    return z3950;
  }

  public boolean hasOAI() {
    return oai != null;
  }

  public boolean hasX() {
    return x != null;
  }

  public boolean hasZ3950() {
    return z3950 != null;
  }

  /**
   * Counts the harvested records of all configured OAI sets by status.
   * @see AlephOAIClient#listRecords(Instant, Instant)
   */
  public Map<RecordStatus,Long> harvestSummary(Instant from, Instant until) {
    final Map<RecordStatus,Long> counts = new EnumMap<>(RecordStatus.class);
    for (RecordStatus s : RecordStatus.values()) counts.put(s, 0L);
    try (Stream<ListRecordResult> records = getOAI().listRecords(from, until)) {
      records.forEach(r -> counts.merge(r.getStatus(), 1L, Long::sum));
    }
    return counts;
  }

  private void run(Instant from, Instant until) {
    if (oai != null) log.info("OAI service at '" + oai.getServiceUri() + "' available: " + oai.isAvailable());
    if (x != null) log.info("X-Server at '" + x.getServiceUri() + "' available: " + x.isAvailable());
    if (z3950 != null) log.info("Z39.50 server " + z3950.getHost() + ":" + z3950.getPort() + " connected: " + z3950.isOpen());
    if (from != null) {
      log.info("Harvesting records from " + ISODateFormatter.formatLong(from) +
          ((until == null) ? "" : (" until " + ISODateFormatter.formatLong(until))) + "...");
      final Map<RecordStatus,Long> counts = harvestSummary(from, until);
      log.info("Harvesting finished: " + counts);
    }
  }

  /** Closes all clients. All of them are closed, even if one fails. */
  @Override
  public void close() throws IOException {
    final IOException ioe = closeAll(null);
    if (ioe != null) throw ioe;
  }

  private IOException closeAll(Throwable primary) {
    IOException first = null;
    for (Closeable c : new Closeable[] { oai, x, z3950 }) {
      if (c == null) continue;
      try {
        c.close();
      } catch (IOException e) {
        if (primary != null) {
          primary.addSuppressed(e);
        } else if (first == null) {
          first = e;
        } else {
          first.addSuppressed(e);
        }
      }
    }
    return first;
  }

}
