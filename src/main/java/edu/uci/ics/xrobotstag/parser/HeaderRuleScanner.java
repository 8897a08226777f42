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

package edu.uci.ics.xrobotstag.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.uci.ics.xrobotstag.directive.Directive;

/**
 * Splits raw header lines of the form
 *
 * <pre>
 * X-Robots-Tag: [&lt;user agent&gt;:] &lt;directive&gt;[: &lt;value&gt;], ...
 * </pre>
 *
 * into a user agent scope and a list of directives.
 */
public class HeaderRuleScanner {
  private static final Logger logger = LoggerFactory.getLogger(HeaderRuleScanner.class);

  public static final String HEADER_RULE_IDENTIFIER = "x-robots-tag";

  /**
   * Scan a single header line.
   *
   * @param header The raw header line, e.g. "X-Robots-Tag: googlebot: noindex"
   * @return The parsed line, or null if the line is not an X-Robots-Tag header
   */
  public ParsedHeaderLine scan(String header) {
    if (header == null) {
      return null;
    }
    int colon = header.indexOf(':');
    if (colon < 0) {
      return null;
    }
    String name = header.substring(0, colon).trim();
    if (!HEADER_RULE_IDENTIFIER.equalsIgnoreCase(name)) {
      return null;
    }

    List<String> fragments = split(header.substring(colon + 1));
    String userAgent = XRobotsTagParser.USERAGENT_DEFAULT;

    // A leading "<user agent>:" applies to every directive on the line. It
    // must be followed by a directive, "max-snippet: 20" is not a scope.
    if (!fragments.isEmpty()) {
      String first = fragments.get(0);
      int sep = first.indexOf(':');
      if (sep >= 0) {
        String candidate = first.substring(0, sep).trim();
        String rest = first.substring(sep + 1).trim();
        if (!candidate.isEmpty() && !Directive.isDirective(candidate) && Directive.isDirective(nameOf(rest))) {
          userAgent = candidate;
          fragments.set(0, rest);
        }
      }
    }

    ParsedHeaderLine line = new ParsedHeaderLine(userAgent);
    Directive pending = null;
    String pendingFragment = null;
    boolean continued = false;
    for (String fragment : fragments) {
      if (fragment.isEmpty()) {
        continue;
      }
      Optional<Directive> directive = Directive.fromName(nameOf(fragment));
      if (!directive.isPresent()) {
        // HTTP dates contain a single comma: "Friday, 25 Jun 2010 15:00:00 PST"
        if (pending != null && !continued) {
          pendingFragment = pendingFragment + ", " + fragment;
          continued = true;
        } else {
          logger.debug("Skipping unrecognized directive in {}: {}", header, fragment);
        }
        continue;
      }

      if (pending != null) {
        line.add(pending.parseValue(pendingFragment));
        pending = null;
      }

      if (directive.get().getKind() == Directive.Kind.VALUED) {
        pending = directive.get();
        pendingFragment = fragment;
        continued = false;
      } else {
        line.add(directive.get().parseValue(fragment));
      }
    }
    if (pending != null) {
      line.add(pending.parseValue(pendingFragment));
    }

    if (line.isEmpty()) {
      logger.debug("No directives found in header: {}", header);
    }
    return line;
  }

  /**
   * Scan all header lines, skipping the ones that are not X-Robots-Tag headers.
   *
   * @param headers The raw header lines, in the order they were received
   * @return The parsed X-Robots-Tag lines, in the same order
   */
  public List<ParsedHeaderLine> scanAll(List<String> headers) {
    List<ParsedHeaderLine> lines = new ArrayList<>();
    if (headers == null) {
      return lines;
    }
    for (String header : headers) {
      ParsedHeaderLine line = scan(header);
      if (line != null) {
        lines.add(line);
      }
    }
    return lines;
  }

  private static List<String> split(String value) {
    List<String> fragments = new ArrayList<>();
    for (String fragment : value.split(",")) {
      fragments.add(fragment.trim());
    }
    return fragments;
  }

  /**
   * @return The text before the first colon of a fragment
   */
  static String nameOf(String fragment) {
    int colon = fragment.indexOf(':');
    return (colon < 0 ? fragment : fragment.substring(0, colon)).trim();
  }
}
