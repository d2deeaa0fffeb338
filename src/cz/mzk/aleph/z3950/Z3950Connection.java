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

import java.io.Closeable;
import java.io.IOException;

/**
 * An open session to a Z39.50 server.
 */
public interface Z3950Connection extends Closeable {

  /** Sets a connection option, e.g. <code>databaseName</code> or <code>preferredRecordSyntax</code>. */
  void setOption(String name, String value);

  /**
   * Executes a query in Prefix Query Format (PQF), e.g. <code>@attr 1=12 000862960</code>.
   * @see <a href="https://software.indexdata.com/yaz/doc/tools.html">YAZ PQF documentation</a>
   */
  Z3950ResultSet search(String pqfQuery) throws IOException;

  @Override
  void close() throws IOException;

}
