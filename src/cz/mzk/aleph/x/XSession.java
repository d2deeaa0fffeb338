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

package cz.mzk.aleph.x;

/**
 * State of one X-Server search: the result set created by <code>find</code>, its size
 * and the session id that is sent with every following <code>present</code> request.
 * The X-Server may hand out a new session id with any response, which then replaces
 * the current one.
 */
public final class XSession {

  private final String setNumber;
  private final int total;
  private String sessionId;

  public XSession(String sessionId, String setNumber, int total) {
    if (sessionId == null || sessionId.isEmpty()) throw new IllegalArgumentException("Session id may not be empty");
    this.sessionId = sessionId;
    this.setNumber = setNumber;
    this.total = total;
  }

  public String getSessionId() {
    return sessionId;
  }

  /** Replaces the session id, empty values are ignored. */
  void updateSessionId(String newSessionId) {
    if (newSessionId != null && !newSessionId.isEmpty()) sessionId = newSessionId;
  }

  public String getSetNumber() {
    return setNumber;
  }

  /** Number of records in the result set. */
  public int getTotal() {
    return total;
  }

  @Override
  public String toString() {
    return "XSession[session=" + sessionId + " set=" + setNumber + " total=" + total + "]";
  }

}
