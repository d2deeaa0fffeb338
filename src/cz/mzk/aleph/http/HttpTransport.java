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

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Blocking HTTP GET transport used by the Aleph web service clients.
 * Implementations are responsible for timeouts and for retrying on server
 * errors; callers never retry themselves.
 */
public interface HttpTransport extends Closeable {

  /**
   * Sends a GET request to the given URI with the given query parameters
   * (in iteration order of the map) and returns the fully read response.
   * @throws IOException if the server could not be reached, also after all retries.
   */
  HttpResult get(URI uri, Map<String,String> params) throws IOException;

  /** Releases connection resources. The default implementation does nothing. */
  @Override
  default void close() throws IOException {}

}
