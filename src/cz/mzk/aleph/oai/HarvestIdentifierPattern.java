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

import static cz.mzk.aleph.config.OAIConfig.BASE_PLACEHOLDER;
import static cz.mzk.aleph.config.OAIConfig.DOC_NUMBER_PLACEHOLDER;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches OAI identifiers like <code>oai:aleph.mzk.cz:MZK01-000960080</code> against an
 * identifier template like <code>oai:aleph.mzk.cz:{base}-{doc_number}</code> and extracts
 * base and system number. All other characters of the template are literals.
 * <p>
 * Instances are immutable and thread safe.
 */
public final class HarvestIdentifierPattern {

  private static final String BASE_GROUP = "base", DOC_GROUP = "doc";

  private final String template, base;
  private final Pattern pattern;

  private HarvestIdentifierPattern(String template, String base, Pattern pattern) {
    this.template = template;
    this.base = base;
    this.pattern = pattern;
  }

  /**
   * Compiles the template. <code>{base}</code> only matches the given base,
   * <code>{doc_number}</code> matches the regular expression <code>systemNumberPattern</code>.
   * A placeholder occurring more than once must match the same text every time.
   * @throws IllegalArgumentException if the template has no <code>{doc_number}</code>
   */
  public static HarvestIdentifierPattern compile(String template, String base, String systemNumberPattern) {
    if (template == null || base == null || systemNumberPattern == null) throw new NullPointerException();
    if (!template.contains(DOC_NUMBER_PLACEHOLDER)) {
      throw new IllegalArgumentException("Identifier template must contain " + DOC_NUMBER_PLACEHOLDER + ": " + template);
    }
    final StringBuilder regex = new StringBuilder();
    boolean baseSeen = false, docSeen = false;
    int pos = 0;
    while (pos < template.length()) {
      final int b = template.indexOf(BASE_PLACEHOLDER, pos), d = template.indexOf(DOC_NUMBER_PLACEHOLDER, pos);
      final int next = (b < 0) ? d : ((d < 0) ? b : Math.min(b, d));
      if (next < 0) {
        appendLiteral(regex, template.substring(pos));
        break;
      }
      appendLiteral(regex, template.substring(pos, next));
      if (next == b) {
        if (baseSeen) {
          regex.append("\\k<").append(BASE_GROUP).append('>');
        } else {
          regex.append("(?<").append(BASE_GROUP).append('>').append(Pattern.quote(base)).append(')');
          baseSeen = true;
        }
        pos = next + BASE_PLACEHOLDER.length();
      } else {
        if (docSeen) {
          regex.append("\\k<").append(DOC_GROUP).append('>');
        } else {
          regex.append("(?<").append(DOC_GROUP).append(">(?:").append(systemNumberPattern).append("))");
          docSeen = true;
        }
        pos = next + DOC_NUMBER_PLACEHOLDER.length();
      }
    }
    return new HarvestIdentifierPattern(template, base, Pattern.compile(regex.toString()));
  }

  private static void appendLiteral(StringBuilder regex, String literal) {
    if (!literal.isEmpty()) regex.append(Pattern.quote(literal));
  }

  /** Matches the full identifier. Returns {@code null} if it does not match the template. */
  public Match match(String identifier) {
    if (identifier == null) return null;
    final Matcher m = pattern.matcher(identifier);
    if (!m.matches()) return null;
    final String matchedBase = template.contains(BASE_PLACEHOLDER) ? m.group(BASE_GROUP) : base;
    return new Match(matchedBase, m.group(DOC_GROUP));
  }

  /** Builds the OAI identifier of the given system number. */
  public String format(String docNumber) {
    return template.replace(BASE_PLACEHOLDER, base).replace(DOC_NUMBER_PLACEHOLDER, docNumber);
  }

  public String getTemplate() {
    return template;
  }

  public String getBase() {
    return base;
  }

  @Override
  public String toString() {
    return pattern.pattern();
  }

  /** Base and system number extracted from an identifier. */
  public static final class Match {
    private final String base, systemNumber;

    Match(String base, String systemNumber) {
      this.base = base;
      this.systemNumber = systemNumber;
    }

    public String getBase() {
      return base;
    }

    public String getSystemNumber() {
      return systemNumber;
    }

    @Override
    public String toString() {
      return base + "/" + systemNumber;
    }
  }

}
