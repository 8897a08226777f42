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

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.uci.ics.xrobotstag.directive.Directive;
import edu.uci.ics.xrobotstag.directive.DirectiveValue;
import edu.uci.ics.xrobotstag.exceptions.HeaderFetchException;
import edu.uci.ics.xrobotstag.exceptions.UnknownDirectiveException;
import edu.uci.ics.xrobotstag.fetcher.HeaderFetcher;
import edu.uci.ics.xrobotstag.rebuild.RuleNormalizer;
import edu.uci.ics.xrobotstag.url.TargetURL;

/**
 * Parses the X-Robots-Tag headers of a response and exposes the rules that
 * apply to one user agent. The headers are parsed once, on construction;
 * the rules are derived from the parsed headers on every call.
 *
 * <pre>
 * XRobotsTagParser parser = new XRobotsTagParser("googlebot", headers);
 * if (parser.getRules().containsKey(Directive.NO_INDEX)) {
 *   ...
 * }
 * </pre>
 */
public class XRobotsTagParser {
  private static final Logger logger = LoggerFactory.getLogger(XRobotsTagParser.class);

  public static final String USERAGENT_DEFAULT = "";

  private final String url;
  private final String userAgent;
  private final RawRuleSet rules;
  private final RuleNormalizer normalizer;

  /**
   * @param userAgent The user agent of the crawler, or the empty string to
   *                  only use the rules that apply to all user agents
   * @param headers The raw header lines, in the order they were received. May
   *                contain headers other than X-Robots-Tag, which are ignored.
   */
  public XRobotsTagParser(String userAgent, List<String> headers) {
    this(userAgent, headers, new RuleNormalizer());
  }

  public XRobotsTagParser(String userAgent, List<String> headers, RuleNormalizer normalizer) {
    this(null, userAgent, headers, normalizer);
  }

  private XRobotsTagParser(String url, String userAgent, List<String> headers, RuleNormalizer normalizer) {
    this.url = url;
    this.normalizer = normalizer;
    if (headers == null || headers.isEmpty()) {
      logger.debug("No headers to parse{}", url == null ? "" : " for " + url);
    }

    HeaderRuleScanner scanner = new HeaderRuleScanner();
    this.rules = new RuleAggregator().addAll(scanner.scanAll(headers)).getRules();

    UserAgentMatcher matcher = new UserAgentMatcher(userAgent);
    this.userAgent = matcher.match(rules.getUserAgents(), USERAGENT_DEFAULT);
    logger.debug("User agent '{}' matched rules for '{}'", userAgent, this.userAgent);
  }

  /**
   * Fetch the headers of a URL and parse them.
   *
   * @param url The URL to fetch the headers from
   * @param userAgent The user agent of the crawler
   * @param fetcher The fetcher used to retrieve the headers
   * @return The parser for the retrieved headers
   * @throws HeaderFetchException When the headers could not be fetched
   */
  public static XRobotsTagParser fetch(String url, String userAgent, HeaderFetcher fetcher)
      throws HeaderFetchException {
    return fetch(url, userAgent, fetcher, new RuleNormalizer());
  }

  public static XRobotsTagParser fetch(String url, String userAgent, HeaderFetcher fetcher,
                                       RuleNormalizer normalizer) throws HeaderFetchException {
    if (!TargetURL.isValid(url)) {
      logger.warn("Invalid URL: {}", url);
    }
    String encoded = TargetURL.encode(url);
    List<String> headers = fetcher.fetchHeaders(encoded);
    return new XRobotsTagParser(encoded, userAgent, headers, normalizer);
  }

  /**
   * @return The effective rules for the user agent
   */
  public Map<Directive, DirectiveValue> getRules() {
    return getRules(false);
  }

  /**
   * Return all applicable rules: the rules for all user agents, overridden by
   * the rules for the matched user agent.
   *
   * @param raw True to return the rules as they were found in the headers,
   *            false to resolve the relations between directives
   * @return The rules, read-only
   */
  public Map<Directive, DirectiveValue> getRules(boolean raw) {
    Map<Directive, DirectiveValue> result = new EnumMap<>(Directive.class);
    ScopeDirectives defaults = rules.findDirectives(USERAGENT_DEFAULT);
    if (defaults != null) {
      result.putAll(defaults.asMap());
    }
    if (!userAgent.equals(USERAGENT_DEFAULT)) {
      ScopeDirectives matched = rules.findDirectives(userAgent);
      if (matched != null) {
        result.putAll(matched.asMap());
      }
    }
    if (!raw) {
      return normalizer.rebuild(result);
    }
    return Collections.unmodifiableMap(result);
  }

  /**
   * Check whether a directive applies to the user agent, after resolving the
   * relations between directives.
   */
  public boolean hasDirective(Directive directive) {
    return getRules().containsKey(directive);
  }

  /**
   * Export all rules for all user agents
   *
   * @return The rules per user agent, the empty string being the rules for
   *         all user agents
   */
  public Map<String, Map<Directive, DirectiveValue>> export() {
    return rules.export();
  }

  /**
   * @return The user agent whose rules apply in addition to the default
   *         rules, or the empty string if none matched
   */
  public String getMatchedUserAgent() {
    return userAgent;
  }

  /**
   * @return The encoded URL the headers were fetched from, or null if the
   *         headers were supplied by the caller
   */
  public String getUrl() {
    return url;
  }

  /**
   * Get the meaning of a directive.
   *
   * @param directive The name of the directive
   * @return A description of what the directive means
   * @throws UnknownDirectiveException When the directive is not known
   */
  public static String getDirectiveMeaning(String directive) throws UnknownDirectiveException {
    return Directive.meaningOf(directive);
  }
}
