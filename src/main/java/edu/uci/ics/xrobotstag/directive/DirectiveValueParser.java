/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package edu.uci.ics.xrobotstag.directive;

import java.util.Date;

import org.apache.http.client.utils.DateUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the value of a directive from its header fragment.
 */
public final class DirectiveValueParser {
  private static final Logger logger = LoggerFactory.getLogger(DirectiveValueParser.class);

  /**
   * Date formats accepted for unavailable_after, tried in order. The first
   * pattern that consumes any input wins, so longer patterns must come before
   * their prefixes. Patterns without a zone are read as GMT.
   */
  static final String[] DATE_PATTERNS = {
      DateUtils.PATTERN_RFC1123,          // Friday, 25 Jun 2010 15:00:00 PST
      DateUtils.PATTERN_RFC1036,          // Friday, 25-Jun-10 15:00:00 PST
      DateUtils.PATTERN_ASCTIME,          // Fri Jun 25 15:00:00 2010
      "EEE, dd MMM yyyy HH:mm:ss",
      "EEE, dd MMM yyyy",
      "dd MMM yyyy HH:mm:ss zzz",         // 25 Jun 2010 15:00:00 PST
      "dd MMM yyyy HH:mm:ss",
      "dd MMM yyyy",
      "yyyy-MM-dd'T'HH:mm:ssXXX",         // ISO 8601
      "yyyy-MM-dd'T'HH:mm:ss",
      "yyyy-MM-dd'T'HH:mm",
      "yyyy-MM-dd"
  };

  private DirectiveValueParser() {
  }

  /**
   * Flags only record presence, anything after the name is ignored.
   */
  public static DirectiveValue parseFlag(Directive directive, String fragment) {
    return DirectiveValue.flag(directive, fragment);
  }

  /**
   * Parse the date after the first colon of the fragment. A value that cannot
   * be parsed is kept as unparsed instead of failing.
   *
   * @param directive The valued directive
   * @param fragment The complete fragment, e.g. "unavailable_after: 25 Jun 2010"
   * @return The parsed value, never null
   */
  public static DirectiveValue parseTimestamp(Directive directive, String fragment) {
    String valueText = valueOf(fragment);
    if (valueText.isEmpty()) {
      logger.warn("No date given for directive {}", directive.getName());
      return DirectiveValue.unparsed(directive, fragment, valueText);
    }

    Date date = DateUtils.parseDate(valueText, DATE_PATTERNS);
    if (date == null) {
      logger.warn("Unable to parse date for directive {}: {}", directive.getName(), valueText);
      return DirectiveValue.unparsed(directive, fragment, valueText);
    }
    return DirectiveValue.timestamp(directive, fragment, valueText, date.toInstant());
  }

  /**
   * @return The trimmed text after the first colon, or an empty string
   */
  static String valueOf(String fragment) {
    if (fragment == null) {
      return "";
    }
    int colon = fragment.indexOf(':');
    if (colon < 0) {
      return "";
    }
    return fragment.substring(colon + 1).trim();
  }
}
