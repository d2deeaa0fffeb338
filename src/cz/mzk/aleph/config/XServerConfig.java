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

package cz.mzk.aleph.config;

/**
 * Configuration of the Aleph X-Server service. In addition to the properties of
 * {@link WebServiceConfig} it supports <code>pageSize</code>: how many entries of
 * a result set are fetched with one request (default: 10).
 */
public final class XServerConfig extends WebServiceConfig {

  public static final int DEFAULT_PAGE_SIZE = 10;

  public XServerConfig() {
    setEndpoint("X");
  }

  public void setPageSize(int pageSize) {
    checkImmutable();
    this.pageSize = pageSize;
  }

  public int getPageSize() {
    return pageSize;
  }

  @Override
  public void check() {
    if (pageSize <= 0) throw new IllegalArgumentException("Invalid value for pageSize: " + pageSize);
    super.check();
  }

  @Override
  protected String getServiceName() {
    return "X-Server";
  }

  private int pageSize = DEFAULT_PAGE_SIZE;

}
