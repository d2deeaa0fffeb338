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

/**
 * Thrown inside the retry loop of {@link JdkHttpTransport} when a request
 * should be repeated after the given number of seconds.
 */
public class RetryAfterIOException extends IOException {

  public RetryAfterIOException(long retryAfter, IOException ioe) {
    super(ioe.getMessage(), ioe);
    this.retryAfter = retryAfter;
  }

  public RetryAfterIOException(long retryAfter, String message) {
    super(message);
    this.retryAfter = retryAfter;
  }

  /** Seconds to wait before the request is repeated. */
  public long getRetryAfter() {
    return retryAfter;
  }

  private final long retryAfter;

}
