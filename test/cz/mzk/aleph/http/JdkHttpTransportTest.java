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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

public class JdkHttpTransportTest {

  private HttpServer server;
  private URI uri;
  private final ConcurrentLinkedQueue<Integer> statusCodes = new ConcurrentLinkedQueue<>();
  private final List<String> queries = Collections.synchronizedList(new ArrayList<>());
  private final AtomicInteger requestCount = new AtomicInteger();
  private volatile String userAgent;

  /** Transport that records the waits instead of sleeping. */
  static final class RecordingTransport extends JdkHttpTransport {
    final List<Long> sleeps = new ArrayList<>();

    RecordingTransport(int totalRetry, int backoffFactor) {
      super(Duration.ofSeconds(5), totalRetry, backoffFactor);
    }

    @Override
    protected void sleep(long seconds) {
      sleeps.add(seconds);
    }
  }

  @Before
  public void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/OAI", this::handle);
    server.start();
    uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/OAI");
  }

  @After
  public void tearDown() {
    server.stop(0);
  }

  private void handle(HttpExchange exchange) throws IOException {
    requestCount.incrementAndGet();
    queries.add(exchange.getRequestURI().getRawQuery());
    userAgent = exchange.getRequestHeaders().getFirst("User-Agent");
    final Integer status = statusCodes.poll();
    final int code = (status == null) ? 200 : status;
    final byte[] body = ("<response status=\"" + code + "\"/>").getBytes(StandardCharsets.UTF_8);
    if (code == 503) exchange.getResponseHeaders().set("Retry-After", "7");
    exchange.sendResponseHeaders(code, body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(body);
    }
  }

  @Test
  public void testGetWithParameters() throws Exception {
    final Map<String,String> params = new LinkedHashMap<>();
    params.put("verb", "ListRecords");
    params.put("resumptionToken", "MZK01:2/a b&c");
    params.put("from", null);
    try (RecordingTransport t = new RecordingTransport(0, 0)) {
      final HttpResult res = t.get(uri, params);
      assertTrue(res.isOk());
      assertEquals("<response status=\"200\"/>", new String(res.getBody(), StandardCharsets.UTF_8));
    }
    assertEquals("verb=ListRecords&resumptionToken=MZK01%3A2%2Fa+b%26c", queries.get(0));
    assertTrue(userAgent.startsWith("Java/"));
  }

  @Test
  public void testRetryOnServerErrors() throws Exception {
    statusCodes.add(500);
    statusCodes.add(502);
    statusCodes.add(504);
    final RecordingTransport t = new RecordingTransport(5, 1);
    final HttpResult res = t.get(uri, Collections.singletonMap("verb", "Identify"));
    assertEquals(200, res.getStatusCode());
    assertEquals(4, requestCount.get());
    assertEquals(List.of(1L, 2L, 4L), t.sleeps);
  }

  @Test
  public void testRetryAfterHeader() throws Exception {
    statusCodes.add(503);
    final RecordingTransport t = new RecordingTransport(5, 1);
    assertTrue(t.get(uri, Collections.emptyMap()).isOk());
    assertEquals(List.of(7L), t.sleeps);
  }

  @Test
  public void testRetriesExhausted() throws Exception {
    for (int i = 0; i < 3; i++) statusCodes.add(500);
    final RecordingTransport t = new RecordingTransport(2, 0);
    try {
      t.get(uri, Collections.emptyMap());
      fail("IOException expected");
    } catch (IOException ioe) {
      assertTrue(ioe.getMessage().contains("500"));
    }
    assertEquals(3, requestCount.get());
    assertEquals(List.of(0L, 0L), t.sleeps);
  }

  @Test
  public void testClientErrorIsNotRetried() throws Exception {
    statusCodes.add(404);
    final RecordingTransport t = new RecordingTransport(5, 1);
    final HttpResult res = t.get(uri, Collections.emptyMap());
    assertEquals(404, res.getStatusCode());
    assertEquals(1, requestCount.get());
    assertTrue(t.sleeps.isEmpty());
    try {
      res.checkStatus();
      fail("IOException expected");
    } catch (IOException ioe) {
      assertTrue(ioe.getMessage().contains("404"));
    }
  }

  @Test
  public void testConnectionFailureIsRetried() throws Exception {
    server.stop(0);
    final RecordingTransport t = new RecordingTransport(1, 0);
    try {
      t.get(uri, Collections.emptyMap());
      fail("IOException expected");
    } catch (IOException ioe) {
      assertEquals(1, t.sleeps.size());
    }
  }

  @Test
  public void testBackoffIsCapped() {
    final JdkHttpTransport t = new JdkHttpTransport(Duration.ofSeconds(1), 20, 3);
    assertEquals(3L, t.getBackoff(0));
    assertEquals(6L, t.getBackoff(1));
    assertEquals(JdkHttpTransport.MAX_BACKOFF, t.getBackoff(10));
    assertEquals(0L, new JdkHttpTransport(Duration.ofSeconds(1), 5, 0).getBackoff(3));
  }

}
