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

package cz.mzk.aleph.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpClient.Redirect;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import cz.mzk.aleph.Package;
import cz.mzk.aleph.config.WebServiceConfig;

/**
 * {@link HttpTransport} on top of the JDK's {@link HttpClient}.
 * <p>
 * Requests are repeated on connection failures and on the status codes
 * {@link #RETRY_STATUS_CODES} up to <code>totalRetry</code> times. The n-th retry
 * waits <code>retryBackoffFactor * 2^(n-1)</code> seconds (at most
 * {@link #MAX_BACKOFF} seconds), unless a '503 Service Unavailable' response
 * carries a <code>Retry-After</code> header.
 */
public class JdkHttpTransport implements HttpTransport {

  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(JdkHttpTransport.class);

  public static final Set<Integer> RETRY_STATUS_CODES = Set.of(500, 502, 503, 504);
  public static final long MAX_BACKOFF = 120L; // seconds

  private final Duration timeout;
  private final int totalRetry;
  private final int retryBackoffFactor;
  private final HttpClient httpClient;

  public JdkHttpTransport(WebServiceConfig config) {
    this(config.getTimeoutDuration(), config.getTotalRetry(), config.getRetryBackoffFactor());
  }

  public JdkHttpTransport(Duration timeout, int totalRetry, int retryBackoffFactor) {
    this.timeout = timeout;
    this.totalRetry = totalRetry;
    this.retryBackoffFactor = retryBackoffFactor;
    this.httpClient = HttpClient.newBuilder()
        .followRedirects(Redirect.NORMAL)
        .connectTimeout(timeout)
        .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ORIGINAL_SERVER))
        .build();
  }

  @Override
  public HttpResult get(URI uri, Map<String,String> params) throws IOException {
    final URI requestUri = HttpClientUtils.buildQueryUri(uri, params);
    for (int retry = 0; retry <= totalRetry; retry++) {
      try {
        return send(requestUri);
      } catch (RetryAfterIOException ioe) {
        if (retry >= totalRetry) {
          if (ioe.getCause() instanceof IOException) throw (IOException) ioe.getCause();
          throw new IOException(ioe.getMessage() + " (no retries left)");
        }
        final long after = (ioe.getRetryAfter() >= 0L) ? ioe.getRetryAfter() : getBackoff(retry);
        log.warn(ioe.getMessage());
        log.info("Retrying after " + after + " seconds (" + (totalRetry - retry) + " retries left)...");
        sleep(after);
      }
    }
    throw new IOException("Unable to properly connect HTTP server.");
  }

  /** Returns the seconds to wait before the retry that follows the given (0-based) attempt. */
  long getBackoff(int attempt) {
    if (retryBackoffFactor <= 0) return 0L;
    final long backoff = retryBackoffFactor * (1L << Math.min(attempt, 16));
    return Math.min(backoff, MAX_BACKOFF);
  }

  /** Waits the given number of seconds. */
  protected void sleep(long seconds) throws IOException {
    if (seconds <= 0L) return;
    try {
      Thread.sleep(1000L * seconds);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting for retry.");
    }
  }

  private HttpResult send(URI uri) throws IOException {
    log.debug("Requesting '" + uri + "'...");
    final HttpRequest.Builder reqBuilder = HttpRequest.newBuilder(uri).GET()
        .timeout(timeout)
        .setHeader("User-Agent", Package.getUserAgent())
        .setHeader("Accept-Charset", StandardCharsets.UTF_8.name() + ", *;q=0.1")
        .setHeader("Accept", "text/xml, application/xml, *;q=0.1");
    HttpClientUtils.sendCompressionHeaders(reqBuilder);

    final HttpResponse<InputStream> resp;
    try {
      resp = HttpClientUtils.sendHttpRequestWithRetry(httpClient, reqBuilder.build(), BodyHandlers.ofInputStream());
    } catch (InterruptedIOException iioe) {
      throw iioe;
    } catch (IOException ioe) {
      throw new RetryAfterIOException(-1L, ioe);
    }

    final int statusCode = resp.statusCode();
    if (RETRY_STATUS_CODES.contains(statusCode)) {
      resp.body().close();
      if (statusCode == HttpURLConnection.HTTP_UNAVAILABLE) {
        final Optional<Long> retryAfter = resp.headers().firstValue("Retry-After").flatMap(JdkHttpTransport::parseRetryAfter);
        if (retryAfter.isPresent()) {
          throw new RetryAfterIOException(retryAfter.get(),
              "Webserver returned '503 Service Unavailable', repeating after " + retryAfter.get() + "s.");
        }
      }
      throw new RetryAfterIOException(-1L, "Webserver returned error code " + statusCode + " for '" + uri + "'");
    }

    try (InputStream in = HttpClientUtils.getDecompressingInputStream(resp)) {
      return new HttpResult(uri, statusCode, in.readAllBytes());
    }
  }

  private static Optional<Long> parseRetryAfter(String value) {
    try {
      return Optional.of(Long.parseLong(value.trim()));
    } catch (NumberFormatException nfe) {
      // HTTP-date values are not supported, the default backoff is used
      return Optional.empty();
    }
  }

  @Override
  public void close() {
    // HttpClient has no close() before Java 21, its connections are released by GC
  }

}
