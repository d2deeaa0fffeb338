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

import java.io.File;
import java.io.InputStream;
import java.lang.reflect.InvocationTargetException;

import org.apache.commons.digester.ExtendedBaseRules;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import cz.mzk.aleph.Package;
import cz.mzk.aleph.utils.ExtendedDigester;
import cz.mzk.aleph.utils.StaticFactories;

/**
 * Main configuration class. It can be built in code or loaded from a XML file:
 * <pre>
 * &lt;aleph xmlns="urn:java:cz.mzk.aleph.config.AlephConfig"&gt;
 *   &lt;base&gt;MZK01&lt;/base&gt;
 *   &lt;oai&gt;
 *     &lt;host&gt;https://aleph.mzk.cz&lt;/host&gt;
 *     &lt;endpoint&gt;OAI&lt;/endpoint&gt;
 *     &lt;identifierTemplate&gt;oai:aleph.mzk.cz:{base}-{doc_number}&lt;/identifierTemplate&gt;
 *     &lt;sets&gt;&lt;set&gt;MZK01-VDK&lt;/set&gt;&lt;/sets&gt;
 *   &lt;/oai&gt;
 *   &lt;x&gt;&lt;host&gt;https://aleph.mzk.cz&lt;/host&gt;&lt;pageSize&gt;20&lt;/pageSize&gt;&lt;/x&gt;
 *   &lt;z3950&gt;&lt;host&gt;aleph.mzk.cz&lt;/host&gt;&lt;port&gt;9991&lt;/port&gt;&lt;/z3950&gt;
 * &lt;/aleph&gt;
 * </pre>
 * Services that do not declare their own <code>base</code> use the global one.
 * At least one of the services must be configured.
 */
public final class AlephConfig {

  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(AlephConfig.class);

  public static final String CONFIG_NAMESPACE = "urn:java:" + AlephConfig.class.getName();

  public AlephConfig() {}

  public AlephConfig(String base) {
    setBase(base);
  }

  /** Loads and checks the configuration from the given file. */
  public static AlephConfig load(String file) throws Exception {
    log.info(Package.getFullPackageDescription());
    log.info("Loading configuration from '" + file + "'...");
    final InputSource src = new InputSource(new File(file).toURI().toString());
    return load(src);
  }

  /** Loads and checks the configuration from the given stream. */
  public static AlephConfig load(InputStream in) throws Exception {
    return load(new InputSource(in));
  }

  private static AlephConfig load(InputSource src) throws Exception {
    final AlephConfig conf = new AlephConfig();
    final ExtendedDigester dig = new ExtendedDigester(StaticFactories.saxFactory.newSAXParser());
    dig.setRulesWithInvalidElementCheck(new ExtendedBaseRules());
    dig.setRuleNamespaceURI(CONFIG_NAMESPACE);

    dig.addDoNothing("aleph");
    dig.addCallMethod("aleph/base", "setBase", 0);

    // *** OAI-PMH ***
    dig.addObjectCreate("aleph/oai", OAIConfig.class);
    dig.addSetNext("aleph/oai", "setOAI");
    addWebServiceRules(dig, "aleph/oai");
    dig.addCallMethod("aleph/oai/metadataPrefix", "setMetadataPrefix", 0);
    dig.addCallMethod("aleph/oai/systemNumberPattern", "setSystemNumberPattern", 0);
    dig.addCallMethod("aleph/oai/identifierTemplate", "setIdentifierTemplate", 0);
    dig.addDoNothing("aleph/oai/sets");
    dig.addCallMethod("aleph/oai/sets/set", "addSet", 0);

    // *** X-Server ***
    dig.addObjectCreate("aleph/x", XServerConfig.class);
    dig.addSetNext("aleph/x", "setX");
    addWebServiceRules(dig, "aleph/x");
    dig.addCallMethod("aleph/x/pageSize", "setPageSize", 0, INT_PARAMS);

    // *** Z39.50 ***
    dig.addObjectCreate("aleph/z3950", Z3950Config.class);
    dig.addSetNext("aleph/z3950", "setZ3950");
    dig.addCallMethod("aleph/z3950/host", "setHost", 0);
    dig.addCallMethod("aleph/z3950/port", "setPort", 0, INT_PARAMS);
    dig.addCallMethod("aleph/z3950/base", "setBase", 0);
    dig.addCallMethod("aleph/z3950/connectionFactory", "setConnectionFactoryClass", 0);

    // parse config
    try {
      dig.push(conf);
      dig.parse(src);
    } catch (SAXException saxe) {
      Throwable e = saxe;
      // throw the real Exception not the digester one
      if (saxe.getException() != null) e = saxe.getException();
      if (e instanceof InvocationTargetException) e = e.getCause();
      if (e instanceof Error) throw (Error) e;
      if (e instanceof Exception) throw (Exception) e;
      throw saxe;
    }

    conf.check();
    return conf;
  }

  private static void addWebServiceRules(ExtendedDigester dig, String prefix) {
    dig.addCallMethod(prefix + "/host", "setHost", 0);
    dig.addCallMethod(prefix + "/endpoint", "setEndpoint", 0);
    dig.addCallMethod(prefix + "/base", "setBase", 0);
    dig.addCallMethod(prefix + "/timeout", "setTimeout", 0, INT_PARAMS);
    dig.addCallMethod(prefix + "/totalRetry", "setTotalRetry", 0, INT_PARAMS);
    dig.addCallMethod(prefix + "/retryBackoffFactor", "setRetryBackoffFactor", 0, INT_PARAMS);
  }

  public void setBase(String base) {
    this.base = base;
  }

  public void setOAI(OAIConfig oai) {
    if (this.oai != null) throw new IllegalArgumentException("Duplicate OAI service configuration");
    this.oai = oai;
  }

  public void setX(XServerConfig x) {
    if (this.x != null) throw new IllegalArgumentException("Duplicate X-Server service configuration");
    this.x = x;
  }

  public void setZ3950(Z3950Config z3950) {
    if (this.z3950 != null) throw new IllegalArgumentException("Duplicate Z39.50 service configuration");
    this.z3950 = z3950;
  }

  public String getBase() {
    return base;
  }

  /** Returns the OAI-PMH configuration, {@code null} if the service is not configured. */
  public OAIConfig getOAI() {
    return oai;
  }

  /** Returns the X-Server configuration, {@code null} if the service is not configured. */
  public XServerConfig getX() {
    return x;
  }

  /** Returns the Z39.50 configuration, {@code null} if the service is not configured. */
  public Z3950Config getZ3950() {
    return z3950;
  }

  /**
   * Checks the configuration and all configured services. Services without a base
   * inherit the global one.
   */
  public void check() {
    if (base == null || base.trim().isEmpty()) throw new IllegalArgumentException("Missing property 'base'");
    base = base.trim();
    if (oai == null && x == null && z3950 == null) {
      throw new IllegalArgumentException("At least one of the Aleph services must be configured");
    }
    if (oai != null) {
      if (oai.getBase() == null) oai.setBase(base);
      oai.check();
    }
    if (x != null) {
      if (x.getBase() == null) x.setBase(base);
      x.check();
    }
    if (z3950 != null) {
      if (z3950.getBase() == null) z3950.setBase(base);
      z3950.check();
    }
  }

  private String base = null;
  private OAIConfig oai = null;
  private XServerConfig x = null;
  private Z3950Config z3950 = null;

  private static final Class<?>[] INT_PARAMS = new Class<?>[] { Integer.TYPE };

}
