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
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.uci.ics.xrobotstag.directive.Directive;
import edu.uci.ics.xrobotstag.directive.DirectiveValue;

/**
 * The ScopeDirectives class stores the directives for a single user agent
 * scope. The default scope, applying to all user agents, uses the empty
 * string as its user agent.
 */
public class ScopeDirectives {
  private static final Logger logger = LoggerFactory.getLogger(ScopeDirectives.class);

  private final String userAgent;
  private final Map<Directive, DirectiveValue> directives = new EnumMap<>(Directive.class);

  public ScopeDirectives(String userAgent) {
    this.userAgent = userAgent;
  }

  /**
   * Add a directive to this scope. A directive that was already set is
   * replaced, so the last occurrence in the headers wins.
   *
   * @param value The parsed directive
   */
  public void add(DirectiveValue value) {
    DirectiveValue previous = directives.put(value.getDirective(), value);
    if (previous != null && !previous.equals(value)) {
      logger.debug("Directive {} for user agent '{}' overridden: {} -> {}",
                   value.getDirective(), userAgent, previous, value);
    }
  }

  public String getUserAgent() {
    return userAgent;
  }

  public DirectiveValue get(Directive directive) {
    return directives.get(directive);
  }

  public boolean contains(Directive directive) {
    return directives.containsKey(directive);
  }

  public int size() {
    return directives.size();
  }

  /**
   * @return A read-only view on the directives in this scope
   */
  public Map<Directive, DirectiveValue> asMap() {
    return Collections.unmodifiableMap(directives);
  }

  @Override
  public String toString() {
    return "'" + userAgent + "' " + directives.values();
  }
}
