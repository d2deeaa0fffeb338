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

package cz.mzk.aleph.utils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Simple static class to create and parse ISO-8601 date stamps as used by OAI-PMH.
 * The used date formats are:<ul>
 * <li>Long date: <code>yyyy-MM-dd'T'HH:mm:ss'Z'</code></li>
 * <li>Short date: <code>yyyy-MM-dd</code></li>
 * </ul>
 */
public final class ISODateFormatter {

  private ISODateFormatter() {} // no instance

  private static final DateTimeFormatter LONG_DATE = DateTimeFormatter
      .ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter SHORT_DATE = DateTimeFormatter
      .ofPattern("yyyy-MM-dd", Locale.ROOT).withZone(ZoneOffset.UTC);

  /** Parses the given string into an {@link Instant}. It accepts short and long dates (with time). */
  public static Instant parseDate(String date) {
    if (date == null) return null;
    date = date.trim();
    try {
      return Instant.from(LONG_DATE.parse(date));
    } catch (DateTimeParseException e) {
      return LocalDate.parse(date, SHORT_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
  }

  /** Formats a long date (seconds granularity). */
  public static String formatLong(Instant date) {
    return LONG_DATE.format(date.truncatedTo(ChronoUnit.SECONDS));
  }

  /** Formats a short date (days granularity). */
  public static String formatShort(Instant date) {
    return SHORT_DATE.format(date);
  }

}
