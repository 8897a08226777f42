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

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import edu.uci.ics.xrobotstag.exceptions.UnknownDirectiveException;

/**
 * The directives that may appear in an X-Robots-Tag header. The semantics
 * follow the Google documentation at:
 *
 * https://developers.google.com/webmasters/control-crawl-index/docs/robots_meta_tag
 */
public enum Directive {
  ALL("all", Kind.FLAG,
      "There are no restrictions for indexing or serving. "
      + "This is the default value and has no effect if explicitly listed."),
  NONE("none", Kind.FLAG,
      "Equivalent to noindex, nofollow."),
  NO_ARCHIVE("noarchive", Kind.FLAG,
      "Do not show a cached link in search results."),
  NO_FOLLOW("nofollow", Kind.FLAG,
      "Do not follow the links on this page."),
  NO_IMAGE_INDEX("noimageindex", Kind.FLAG,
      "Do not index images on this page."),
  NO_INDEX("noindex", Kind.FLAG,
      "Do not show this page in search results and do not show a cached link in search results."),
  NO_ODP("noodp", Kind.FLAG,
      "Do not use metadata from the Open Directory project for titles or snippets shown for this page."),
  NO_SNIPPET("nosnippet", Kind.FLAG,
      "Do not show a snippet in the search results for this page."),
  NO_TRANSLATE("notranslate", Kind.FLAG,
      "Do not offer translation of this page in search results."),
  UNAVAILABLE_AFTER("unavailable_after", Kind.VALUED,
      "Do not show this page in search results after the specified date/time.");

  /** Whether a directive is a plain flag or carries a value */
  public enum Kind {
    FLAG, VALUED
  }

  private static final Map<String, Directive> BY_NAME;

  static {
    Map<String, Directive> byName = new HashMap<>();
    for (Directive directive : values()) {
      byName.put(directive.name, directive);
    }
    BY_NAME = Collections.unmodifiableMap(byName);
  }

  private final String name;
  private final Kind kind;
  private final String meaning;

  Directive(String name, Kind kind, String meaning) {
    this.name = name;
    this.kind = kind;
    this.meaning = meaning;
  }

  /**
   * @return The name of the directive as it appears in the header
   */
  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  public String getMeaning() {
    return meaning;
  }

  /**
   * Parse the value of this directive from its raw header fragment.
   *
   * @param fragment The complete fragment, e.g. "unavailable_after: 25 Jun 2010"
   * @return The parsed value, never null
   */
  public DirectiveValue parseValue(String fragment) {
    if (kind == Kind.VALUED) {
      return DirectiveValueParser.parseTimestamp(this, fragment);
    }
    return DirectiveValueParser.parseFlag(this, fragment);
  }

  /**
   * Look up a directive by name. The lookup is case insensitive and ignores
   * surrounding whitespace.
   *
   * @param name The directive name
   * @return The directive, or an empty Optional when the name is not known
   */
  public static Optional<Directive> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
  }

  public static boolean isDirective(String name) {
    return fromName(name).isPresent();
  }

  /**
   * Get the documented meaning of a directive.
   *
   * @param name The directive name
   * @return A description of what the directive means
   * @throws UnknownDirectiveException When the name is not a known directive
   */
  public static String meaningOf(String name) throws UnknownDirectiveException {
    Optional<Directive> directive = fromName(name);
    if (!directive.isPresent()) {
      throw new UnknownDirectiveException(name);
    }
    return directive.get().getMeaning();
  }

  @Override
  public String toString() {
    return name;
  }
}
