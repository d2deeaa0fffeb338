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

import cz.mzk.aleph.utils.PublicForDigesterUse;
import cz.mzk.aleph.z3950.Z3950ConnectionFactory;

/**
 * Configuration of the Aleph Z39.50 service: <code>host</code>, <code>port</code>,
 * <code>base</code> (database name) and the <code>connectionFactory</code> that
 * binds the native Z39.50 toolkit.
 */
public final class Z3950Config {

  public static final int DEFAULT_PORT = 9991;

  public Z3950Config() {}

  private void checkImmutable() {
    if (checked) throw new IllegalStateException("Configuration cannot be changed anymore!");
  }

  public void setHost(String host) {
    checkImmutable();
    this.host = host;
  }

  public void setPort(int port) {
    checkImmutable();
    this.port = port;
  }

  public void setBase(String base) {
    checkImmutable();
    this.base = base;
  }

  public void setConnectionFactory(Z3950ConnectionFactory connectionFactory) {
    checkImmutable();
    this.connectionFactory = connectionFactory;
  }

  /** Sets class name of the connection factory (called from Digester on config load). **/
  @PublicForDigesterUse
  @Deprecated
  public void setConnectionFactoryClass(String v) throws ReflectiveOperationException {
    setConnectionFactory(Class.forName(v.trim()).asSubclass(Z3950ConnectionFactory.class).getConstructor().newInstance());
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

  /** Returns the connection factory, {@code null} if none was configured. */
  public Z3950ConnectionFactory getConnectionFactory() {
    return connectionFactory;
  }

  /**
   * Checks, if configuration is ok. After calling this, you are not able to
   * change anything in this instance.
   */
  public void check() {
    if (host == null || host.isEmpty()) throw new IllegalArgumentException("Missing property 'host' of Z39.50 service");
    if (base == null || base.isEmpty()) throw new IllegalArgumentException("Missing property 'base' of Z39.50 service");
    if (port <= 0 || port > 65535) throw new IllegalArgumentException("Invalid value for port: " + port);
    checked = true;
  }

  private boolean checked = false;

  private String host = null, base = null;
  private int port = DEFAULT_PORT;
  private Z3950ConnectionFactory connectionFactory = null;

}
