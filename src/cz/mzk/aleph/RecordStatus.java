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
 * Lifecycle status of a harvested record. Every harvested record has exactly one.
 */
public enum RecordStatus {
  /** The record is present and was parsed to MARC. */
  ACTIVE,
  /** The server marked the record as deleted, there is no body. */
  DELETED,
  /** The record is present, but its body could not be parsed to MARC. */
  FAILED
}
