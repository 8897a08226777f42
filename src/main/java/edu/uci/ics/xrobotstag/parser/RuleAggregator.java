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

import java.util.List;

import edu.uci.ics.xrobotstag.directive.DirectiveValue;

/**
 * Folds parsed header lines into a {@link RawRuleSet}. Lines must be added
 * in the order the headers were received: a directive repeated for the same
 * user agent replaces the earlier value.
 */
public class RuleAggregator {
  private final RawRuleSet rules = new RawRuleSet();

  public RuleAggregator add(ParsedHeaderLine line) {
    if (line == null || line.isEmpty()) {
      return this;
    }
    ScopeDirectives directives = rules.getDirectives(line.getUserAgent());
    for (DirectiveValue value : line.getDirectives()) {
      directives.add(value);
    }
    return this;
  }

  public RuleAggregator addAll(List<ParsedHeaderLine> lines) {
    for (ParsedHeaderLine line : lines) {
      add(line);
    }
    return this;
  }

  public RawRuleSet getRules() {
    return rules;
  }
}
