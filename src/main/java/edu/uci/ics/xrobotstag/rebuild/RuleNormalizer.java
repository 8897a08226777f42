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

package edu.uci.ics.xrobotstag.rebuild;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import edu.uci.ics.xrobotstag.directive.Directive;
import edu.uci.ics.xrobotstag.directive.DirectiveValue;

/**
 * Rebuilds a merged set of raw directives into the effective rules, using a
 * table of {@link DirectiveImplications}. The input is never modified.
 */
public class RuleNormalizer {
  private final DirectiveImplications implications;

  public RuleNormalizer() {
    this(DirectiveImplications.DEFAULT);
  }

  public RuleNormalizer(DirectiveImplications implications) {
    this.implications = Objects.requireNonNull(implications, "implications");
  }

  /**
   * @param rules The raw directives, default scope overlaid with the matched scope
   * @return The effective directives, read-only, in declaration order
   */
  public Map<Directive, DirectiveValue> rebuild(Map<Directive, DirectiveValue> rules) {
    Map<Directive, DirectiveValue> result = new EnumMap<>(Directive.class);
    if (rules == null || rules.isEmpty()) {
      return Collections.unmodifiableMap(result);
    }
    result.putAll(rules);

    for (Directive umbrella : implications.getUmbrellas()) {
      DirectiveValue value = result.remove(umbrella);
      if (value == null) {
        continue;
      }
      // Explicit values take precedence over implied ones
      for (Directive implied : implications.getImplied(umbrella)) {
        if (!result.containsKey(implied)) {
          result.put(implied, DirectiveValue.flag(implied, value.getFragment()));
        }
      }
    }

    for (Directive directive : implications.getWithoutEffect()) {
      result.remove(directive);
    }
    return Collections.unmodifiableMap(result);
  }

  public DirectiveImplications getImplications() {
    return implications;
  }
}
