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

/**
 * Opens connections to a Z39.50 server. Implementations bind a native
 * Z39.50 toolkit; they need a public no-argument constructor if they are
 * named by class in the configuration.
 */
public interface Z3950ConnectionFactory {

  /** Opens a new connection to the given Z39.50 server. */
  Z3950Connection open(String host, int port) throws IOException;

}
