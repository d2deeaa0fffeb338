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

package cz.mzk.aleph.z3950;

import java.io.IOException;

import org.marc4j.marc.Record;

/**
 * Result of a Z39.50 search.
 */
public interface Z3950ResultSet {

  /** Number of records found. */
  int size();

  /** Materializes the record at the given 0-based position. */
  Record getRecord(int index) throws IOException;

}
