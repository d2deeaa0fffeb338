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

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.marc4j.marc.Record;

import cz.mzk.aleph.config.Z3950Config;

/**
 * Client for the Z39.50 interface of Aleph. The protocol itself is implemented by
 * a native toolkit (e.g. YAZ) behind a {@link Z3950ConnectionFactory}.
 * Records are requested as MARC21 from the configured database.
 */
public class AlephZ3950Client implements Closeable {

  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(AlephZ3950Client.class);

  public static final String OPTION_RECORD_SYNTAX = "preferredRecordSyntax";
  public static final String OPTION_DATABASE_NAME = "databaseName";
  public static final String RECORD_SYNTAX_MARC21 = "MARC21";

  private final String host, base;
  private final int port;
  private Z3950Connection connection;

  /** Opens the connection using the factory of the configuration. */
  public AlephZ3950Client(Z3950Config config) throws IOException {
    this(config, config.getConnectionFactory());
  }

  public AlephZ3950Client(Z3950Config config, Z3950ConnectionFactory factory) throws IOException {
    if (factory == null) throw new IllegalArgumentException("No Z39.50 connection factory configured");
    config.check();
    this.host = config.getHost();
    this.port = config.getPort();
    this.base = config.getBase();
    log.info("Connecting to Z39.50 server " + host + ":" + port + " (database '" + base + "')...");
    this.connection = factory.open(host, port);
    try {
      connection.setOption(OPTION_RECORD_SYNTAX, RECORD_SYNTAX_MARC21);
      connection.setOption(OPTION_DATABASE_NAME, base);
    } catch (RuntimeException e) {
      try {
        connection.close();
      } catch (IOException ioe) {
        e.addSuppressed(ioe);
      }
      connection = null;
      throw e;
    }
  }

  /**
   * Executes a query in Prefix Query Format (PQF) and returns all found records in result order.
   * @throws IllegalStateException if the client was closed
   */
  public List<Record> search(String pqfQuery) throws IOException {
    if (connection == null) throw new IllegalStateException("Z39.50 connection is already closed");
    final Z3950ResultSet resultSet = connection.search(pqfQuery);
    final int size = resultSet.size();
    log.debug("Query '" + pqfQuery + "' found " + size + " records.");
    final List<Record> records = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      records.add(resultSet.getRecord(i));
    }
    return records;
  }

  public boolean isOpen() {
    return connection != null;
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public String getBase() {
    return base;
  }

  /** Closes the connection. Calling it again has no effect. */
  @Override
  public void close() throws IOException {
    if (connection != null) {
      final Z3950Connection c = connection;
      connection = null;
      c.close();
    }
  }

}
