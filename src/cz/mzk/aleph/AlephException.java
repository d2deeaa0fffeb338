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

package cz.mzk.aleph;

/**
 * Thrown when an Aleph server violates the protocol or reports an error.
 * It is unchecked, because it is also thrown while consuming lazy result streams.
 */
public class AlephException extends RuntimeException {

  public AlephException(String message) {
    super(message);
  }

  public AlephException(String message, Throwable cause) {
    super(message, cause);
  }

}
