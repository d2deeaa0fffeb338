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

package cz.mzk.aleph.oai;

import cz.mzk.aleph.AlephException;

/**
 * Thrown when the OAI-PMH repository answers with an <code>error</code> element.
 */
public class OAIException extends AlephException {

  private final String code;

  public OAIException(String code, String message) {
    super((message == null || message.isEmpty()) ? ("OAI-PMH error: " + code) : ("OAI-PMH error '" + code + "': " + message));
    this.code = code;
  }

  /** The OAI-PMH error code, e.g. <code>idDoesNotExist</code>. */
  public String getCode() {
    return code;
  }

}
