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
 * Class to get version information about this library (read from the JAR manifest).
 */
public final class Package {

  private Package() {}

  /** Gets package object from classloader. */
  public static java.lang.Package get() {
    return Package.class.getPackage();
  }

  /** Gets version of the library, {@code null} if not running from a JAR file. */
  public static String getVersion() {
    final java.lang.Package pkg = get();
    return (pkg == null) ? null : pkg.getImplementationVersion();
  }

  /** Gets product name ("Aleph Nought"). */
  public static String getProductName() {
    final java.lang.Package pkg = get();
    return (pkg == null || pkg.getImplementationTitle() == null) ? "Aleph Nought" : pkg.getImplementationTitle();
  }

  /** Gets a version string to print out. */
  public static String getFullPackageDescription() {
    final StringBuilder sb = new StringBuilder(getProductName());
    final String version = getVersion();
    if (version != null) sb.append(" version ").append(version);
    return sb.toString();
  }

  /** The User-Agent sent with every HTTP request. */
  public static String getUserAgent() {
    final StringBuilder sb = new StringBuilder("Java/").append(Runtime.version())
        .append(" (").append(getProductName());
    final String version = getVersion();
    if (version != null) sb.append('/').append(version);
    return sb.append("; Aleph client)").toString();
  }

}
