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

import java.util.Collection;
import java.util.Comparator;
import java.util.Locale;

/**
 * Selects the user agent scope that applies to a crawler, in addition to
 * the default scope.
 */
public class UserAgentMatcher {
  private static final int EXACT = 0;
  private static final int TOKEN_IN_AGENT = 1;
  private static final int AGENT_IN_TOKEN = 2;
  private static final int NO_MATCH = Integer.MAX_VALUE;

  private final String crawlUserAgent;

  /**
   * @param crawlUserAgent The user agent of the crawler, may be null or empty
   */
  public UserAgentMatcher(String crawlUserAgent) {
    this.crawlUserAgent = crawlUserAgent == null ? "" : crawlUserAgent.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Check whether a scope applies to the crawler. Bot user agents are
   * usually longer than the token used in the header ("Mozilla/5.0
   * (compatible; Googlebot/2.1)" vs. "googlebot"), so both directions of
   * containment count. See {@link #match(Collection, String)} for how
   * matches are ranked.
   *
   * @param userAgent The user agent token of a scope
   * @return True if the scope applies
   */
  public boolean matches(String userAgent) {
    return rank(userAgent) != NO_MATCH;
  }

  /**
   * Find the best matching scope. An exact match (ignoring case) wins.
   * Otherwise the longest scope token found in the crawler's user agent
   * wins. Only when neither exists does a scope that contains the crawler's
   * user agent apply, the shortest one first. Ties keep the first seen
   * scope.
   *
   * @param userAgents The user agent scopes found in the headers, in the
   *                   order they were first seen
   * @param fallback The scope to return when nothing matches
   * @return The best matching user agent, or the fallback when none matches
   */
  public String match(Collection<String> userAgents, String fallback) {
    Comparator<String> longestFirst = new UserAgentComparator();
    String best = null;
    int bestRank = NO_MATCH;
    for (String userAgent : userAgents) {
      int rank = rank(userAgent);
      if (rank == NO_MATCH || rank > bestRank) {
        continue;
      }
      if (best == null || rank < bestRank) {
        best = userAgent;
        bestRank = rank;
        continue;
      }
      int order = longestFirst.compare(userAgent, best);
      if ((rank == TOKEN_IN_AGENT && order < 0) || (rank == AGENT_IN_TOKEN && order > 0)) {
        best = userAgent;
      }
    }
    return best == null ? fallback : best;
  }

  private int rank(String userAgent) {
    if (crawlUserAgent.isEmpty() || userAgent == null) {
      return NO_MATCH;
    }
    String token = userAgent.trim().toLowerCase(Locale.ROOT);
    if (token.isEmpty()) {
      return NO_MATCH;
    }
    if (token.equals(crawlUserAgent)) {
      return EXACT;
    }
    if (crawlUserAgent.contains(token)) {
      return TOKEN_IN_AGENT;
    }
    if (token.contains(crawlUserAgent)) {
      return AGENT_IN_TOKEN;
    }
    return NO_MATCH;
  }

  public String getCrawlUserAgent() {
    return crawlUserAgent;
  }

  /**
   * Orders the most specific (= longest) user agent first. Equal lengths
   * compare as equal.
   */
  static class UserAgentComparator implements Comparator<String> {
    @Override
    public int compare(String lhs, String rhs) {
      return Integer.compare(rhs.trim().length(), lhs.trim().length());
    }
  }
}
