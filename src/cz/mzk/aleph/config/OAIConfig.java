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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Configuration of the Aleph OAI-PMH service.
 * <p>
 * In addition to the properties of {@link WebServiceConfig} it supports:
 * <ul>
 * <li><code>metadataPrefix</code>: OAI metadata prefix to harvest (default: <code>marc21</code>)</li>
 * <li><code>systemNumberPattern</code>: regular expression matching a system number (default: <code>\d{9}</code>)</li>
 * <li><code>identifierTemplate</code>: template of the OAI identifiers, with the placeholders
 * <code>{base}</code> and <code>{doc_number}</code> (default: <code>oai:&lt;hostname&gt;:{base}-{doc_number}</code>)</li>
 * <li><code>sets</code>: the OAI sets to harvest, in this order (default: one set named like the base)</li>
 * </ul>
 */
public final class OAIConfig extends WebServiceConfig {

  public static final String DEFAULT_METADATA_PREFIX = "marc21";
  public static final String DEFAULT_SYSTEM_NUMBER_PATTERN = "\\d{9}";

  public static final String BASE_PLACEHOLDER = "{base}";
  public static final String DOC_NUMBER_PLACEHOLDER = "{doc_number}";

  public OAIConfig() {
    setEndpoint("OAI");
  }

  public void setMetadataPrefix(String metadataPrefix) {
    checkImmutable();
    this.metadataPrefix = metadataPrefix;
  }

  public void setSystemNumberPattern(String systemNumberPattern) {
    checkImmutable();
    this.systemNumberPattern = systemNumberPattern;
  }

  public void setIdentifierTemplate(String identifierTemplate) {
    checkImmutable();
    this.identifierTemplate = identifierTemplate;
  }

  /** Adds an OAI set to harvest. Sets are harvested in the order they were added. */
  public void addSet(String set) {
    checkImmutable();
    if (set == null || set.trim().isEmpty()) throw new IllegalArgumentException("An OAI set name may not be empty");
    if (sets.contains(set.trim())) throw new IllegalArgumentException("Duplicate OAI set: " + set.trim());
    sets.add(set.trim());
  }

  public String getMetadataPrefix() {
    return metadataPrefix;
  }

  public String getSystemNumberPattern() {
    return systemNumberPattern;
  }

  /** Returns the identifier template, if not configured it is derived from the host name. */
  public String getIdentifierTemplate() {
    if (identifierTemplate != null) return identifierTemplate;
    return "oai:" + getHostName() + ":" + BASE_PLACEHOLDER + "-" + DOC_NUMBER_PLACEHOLDER;
  }

  /** Returns the sets to harvest. If none are configured, the only set is the base. */
  public List<String> getSets() {
    if (sets.isEmpty() && base != null) return Collections.singletonList(base);
    return Collections.unmodifiableList(sets);
  }

  @Override
  public void check() {
    if (metadataPrefix == null || metadataPrefix.isEmpty()) throw new IllegalArgumentException("Missing property 'metadataPrefix' of OAI service");
    if (systemNumberPattern == null || systemNumberPattern.isEmpty()) throw new IllegalArgumentException("Missing property 'systemNumberPattern' of OAI service");
    try {
      Pattern.compile(systemNumberPattern);
    } catch (PatternSyntaxException pse) {
      throw new IllegalArgumentException("Invalid regular expression in 'systemNumberPattern': " + systemNumberPattern, pse);
    }
    super.check();
    final String template = getIdentifierTemplate();
    if (!template.contains(DOC_NUMBER_PLACEHOLDER)) {
      throw new IllegalArgumentException("The 'identifierTemplate' must contain the placeholder " + DOC_NUMBER_PLACEHOLDER + ": " + template);
    }
  }

  @Override
  protected String getServiceName() {
    return "OAI";
  }

  private String metadataPrefix = DEFAULT_METADATA_PREFIX;
  private String systemNumberPattern = DEFAULT_SYSTEM_NUMBER_PATTERN;
  private String identifierTemplate = null;
  private final List<String> sets = new ArrayList<>();

}
