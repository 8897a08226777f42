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
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import edu.uci.ics.xrobotstag.directive.Directive;

/**
 * The relations between directives that are resolved when rules are
 * rebuilt into their effective form:
 * <ul>
 * <li>an umbrella directive is replaced by the directives it implies</li>
 * <li>a directive without effect is dropped</li>
 * </ul>
 * Instances are immutable.
 */
public final class DirectiveImplications {

  /**
   * The relations documented by Google: "none" is equivalent to
   * "noindex, nofollow" and "all" is the default that has no effect.
   */
  public static final DirectiveImplications DEFAULT = builder()
      .implies(Directive.NONE, Directive.NO_INDEX, Directive.NO_FOLLOW)
      .withoutEffect(Directive.ALL)
      .build();

  /** No relations at all, rebuilding with this table only copies the rules */
  public static final DirectiveImplications EMPTY = builder().build();

  private final Map<Directive, Set<Directive>> implied;
  private final Set<Directive> withoutEffect;

  private DirectiveImplications(Map<Directive, Set<Directive>> implied, Set<Directive> withoutEffect) {
    this.implied = implied;
    this.withoutEffect = withoutEffect;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return The umbrella directives, in declaration order
   */
  public Set<Directive> getUmbrellas() {
    return implied.keySet();
  }

  /**
   * @return The directives implied by the umbrella, or an empty set
   */
  public Set<Directive> getImplied(Directive umbrella) {
    Set<Directive> result = implied.get(umbrella);
    return result == null ? Collections.<Directive>emptySet() : result;
  }

  public boolean isUmbrella(Directive directive) {
    return implied.containsKey(directive);
  }

  public Set<Directive> getWithoutEffect() {
    return withoutEffect;
  }

  public boolean hasNoEffect(Directive directive) {
    return withoutEffect.contains(directive);
  }

  @Override
  public String toString() {
    return "implies=" + implied + ", withoutEffect=" + withoutEffect;
  }

  public static class Builder {
    private final Map<Directive, Set<Directive>> implied = new EnumMap<>(Directive.class);
    private final Set<Directive> withoutEffect = EnumSet.noneOf(Directive.class);

    /**
     * Declare an umbrella directive. Only flag directives can be implied, and
     * an implied directive cannot be an umbrella itself.
     */
    public Builder implies(Directive umbrella, Directive first, Directive... rest) {
      Set<Directive> set = EnumSet.of(first, rest);
      if (set.contains(umbrella)) {
        throw new IllegalArgumentException("Directive " + umbrella + " cannot imply itself");
      }
      for (Directive directive : set) {
        if (directive.getKind() != Directive.Kind.FLAG) {
          throw new IllegalArgumentException("Only flag directives can be implied: " + directive);
        }
      }
      implied.put(umbrella, set);
      return this;
    }

    public Builder withoutEffect(Directive directive) {
      withoutEffect.add(directive);
      return this;
    }

    public DirectiveImplications build() {
      Map<Directive, Set<Directive>> copy = new EnumMap<>(Directive.class);
      for (Map.Entry<Directive, Set<Directive>> entry : implied.entrySet()) {
        for (Directive directive : entry.getValue()) {
          if (implied.containsKey(directive)) {
            throw new IllegalArgumentException("Umbrella " + entry.getKey()
                                               + " implies another umbrella: " + directive);
          }
        }
        copy.put(entry.getKey(), Collections.unmodifiableSet(EnumSet.copyOf(entry.getValue())));
      }
      Set<Directive> noEffect = withoutEffect.isEmpty()
          ? EnumSet.noneOf(Directive.class) : EnumSet.copyOf(withoutEffect);
      return new DirectiveImplications(Collections.unmodifiableMap(copy),
                                       Collections.unmodifiableSet(noEffect));
    }
  }
}
