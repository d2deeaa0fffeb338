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

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;

/**
 * Common configuration of the HTTP based Aleph services (OAI-PMH and X-Server).
 * <p>
 * Supported properties:
 * <ul>
 * <li><code>host</code>: base URL of the Aleph server, e.g. <code>https://aleph.mzk.cz</code></li>
 * <li><code>endpoint</code>: path of the service below the host, e.g. <code>OAI</code></li>
 * <li><code>base</code>: the Aleph base (library) to work with, e.g. <code>MZK01</code></li>
 * <li><code>timeout</code>: HTTP timeout in seconds (default: 30)</li>
 * <li><code>totalRetry</code>: how often retry on server errors? (default: 5)</li>
 * <li><code>retryBackoffFactor</code>: the n-th retry waits <code>factor * 2^(n-1)</code>
 * seconds (default: 1)</li>
 * </ul>
 */
public abstract class WebServiceConfig {

  public static final int DEFAULT_TIMEOUT = 30; // seconds
  public static final int DEFAULT_TOTAL_RETRY = 5;
  public static final int DEFAULT_RETRY_BACKOFF_FACTOR = 1; // seconds

  protected WebServiceConfig() {}

  protected void checkImmutable() {
    if (checked) throw new IllegalStateException("Configuration cannot be changed anymore!");
  }

  public void setHost(String host) {
    checkImmutable();
    this.host = host;
  }

  public void setEndpoint(String endpoint) {
    checkImmutable();
    this.endpoint = endpoint;
  }

  public void setBase(String base) {
    checkImmutable();
    this.base = base;
  }

  public void setTimeout(int timeout) {
    checkImmutable();
    this.timeout = timeout;
  }

  public void setTotalRetry(int totalRetry) {
    checkImmutable();
    this.totalRetry = totalRetry;
  }

  public void setRetryBackoffFactor(int retryBackoffFactor) {
    checkImmutable();
    this.retryBackoffFactor = retryBackoffFactor;
  }

  public String getHost() {
    return host;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public String getBase() {
    return base;
  }

  public int getTimeout() {
    return timeout;
  }

  public Duration getTimeoutDuration() {
    return Duration.ofSeconds(timeout);
  }

  public int getTotalRetry() {
    return totalRetry;
  }

  public int getRetryBackoffFactor() {
    return retryBackoffFactor;
  }

  /** Returns the URL of the service endpoint (host and endpoint joined by exactly one slash). */
  public URI getServiceUri() {
    String h = host;
    while (h.endsWith("/")) h = h.substring(0, h.length() - 1);
    String e = endpoint;
    while (e.startsWith("/")) e = e.substring(1);
    return URI.create(h + "/" + e);
  }

  /** Returns the host name part of {@link #getHost()}. */
  public String getHostName() {
    try {
      final String name = new URI(host).getHost();
      if (name == null) throw new IllegalArgumentException("Missing hostname in host URL: " + host);
      return name;
    } catch (URISyntaxException use) {
      throw new IllegalArgumentException("Invalid host URL: " + host, use);
    }
  }

  /**
   * Checks, if configuration is ok. After calling this, you are not able to
   * change anything in this instance.
   */
  public void check() {
    if (host == null || host.isEmpty()) throw new IllegalArgumentException("Missing property 'host' of " + getServiceName() + " service");
    if (endpoint == null) throw new IllegalArgumentException("Missing property 'endpoint' of " + getServiceName() + " service");
    if (base == null || base.isEmpty()) throw new IllegalArgumentException("Missing property 'base' of " + getServiceName() + " service");
    final String proto = URI.create(host).getScheme();
    if (proto == null || !("http".equals(proto.toLowerCase(Locale.ROOT)) || "https".equals(proto.toLowerCase(Locale.ROOT)))) {
      throw new IllegalArgumentException(getServiceName() + " service only allows HTTP(S) as network protocol: " + host);
    }
    if (timeout <= 0) throw new IllegalArgumentException("Invalid value for timeout: " + timeout);
    if (totalRetry < 0) throw new IllegalArgumentException("Invalid value for totalRetry: " + totalRetry);
    if (retryBackoffFactor < 0) throw new IllegalArgumentException("Invalid value for retryBackoffFactor: " + retryBackoffFactor);
    checked = true;
  }

  /** Name of the service used in messages. */
  protected abstract String getServiceName();

  protected boolean checked = false;

  // members "the configuration"
  protected String host = null, endpoint = null, base = null;
  protected int timeout = DEFAULT_TIMEOUT;
  protected int totalRetry = DEFAULT_TOTAL_RETRY;
  protected int retryBackoffFactor = DEFAULT_RETRY_BACKOFF_FACTOR;

}
