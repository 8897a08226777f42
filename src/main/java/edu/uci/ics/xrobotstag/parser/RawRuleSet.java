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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import edu.uci.ics.xrobotstag.directive.Directive;
import edu.uci.ics.xrobotstag.directive.DirectiveValue;

/**
 * All directives found in a set of headers, per user agent scope. Scopes are
 * kept in the order they were first seen. User agents that only differ in
 * case share one scope, named by the spelling that was seen first.
 */
public class RawRuleSet {
  private final Map<String, ScopeDirectives> scopes = new LinkedHashMap<>();

  /**
   * Get the directives for the specified user agent. If they do not exist
   * yet, they will be created.
   *
   * @param userAgent The user agent as written in the header, or the empty string
   * @return The directives for this scope
   */
  public ScopeDirectives getDirectives(String userAgent) {
    String key = keyOf(userAgent);
    ScopeDirectives directives = scopes.get(key);
    if (directives == null) {
      directives = new ScopeDirectives(userAgent);
      scopes.put(key, directives);
    }
    return directives;
  }

  /**
   * @return The directives for the user agent, or null if the headers did not
   *         mention it
   */
  public ScopeDirectives findDirectives(String userAgent) {
    return scopes.get(keyOf(userAgent));
  }

  /**
   * @return The user agents as first written in the headers, in the order
   *         they were first seen
   */
  public Set<String> getUserAgents() {
    Set<String> userAgents = new LinkedHashSet<>();
    for (ScopeDirectives directives : scopes.values()) {
      userAgents.add(directives.getUserAgent());
    }
    return Collections.unmodifiableSet(userAgents);
  }

  public boolean isEmpty() {
    return scopes.isEmpty();
  }

  /**
   * @return A read-only copy of all directives, per scope
   */
  public Map<String, Map<Directive, DirectiveValue>> export() {
    Map<String, Map<Directive, DirectiveValue>> result = new LinkedHashMap<>();
    for (ScopeDirectives directives : scopes.values()) {
      result.put(directives.getUserAgent(), directives.asMap());
    }
    return Collections.unmodifiableMap(result);
  }

  private static String keyOf(String userAgent) {
    return userAgent == null ? "" : userAgent.toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return scopes.values().toString();
  }
}
