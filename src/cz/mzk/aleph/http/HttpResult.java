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
import java.net.HttpURLConnection;
import java.net.URI;

/**
 * The status code and body of a HTTP response.
 */
public final class HttpResult {

  public HttpResult(URI uri, int statusCode, byte[] body) {
    this.uri = uri;
    this.statusCode = statusCode;
    this.body = (body == null) ? new byte[0] : body;
  }

  /** The URI that was requested (including the query string). */
  public URI getUri() {
    return uri;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public byte[] getBody() {
    return body;
  }

  public boolean isOk() {
    return statusCode == HttpURLConnection.HTTP_OK;
  }

  /** Throws an {@link IOException} if the status code is not 2xx. */
  public HttpResult checkStatus() throws IOException {
    if (statusCode < 200 || statusCode >= 300) {
      throw new IOException("Webserver returned invalid status code " + statusCode + " for '" + uri + "'");
    }
    return this;
  }

  @Override
  public String toString() {
    return "HttpResult[uri=" + uri + " status=" + statusCode + " length=" + body.length + "]";
  }

  private final URI uri;
  private final int statusCode;
  private final byte[] body;

}
