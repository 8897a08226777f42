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

import java.time.Instant;
import java.util.Objects;

/**
 * The value of a single directive as found in a header. Flag directives
 * only record their presence; valued directives additionally carry the
 * parsed timestamp, or are marked as unparsed when the value text could not
 * be understood.
 */
public final class DirectiveValue {
  private final Directive directive;
  private final String fragment;
  private final String valueText;
  private final Instant timestamp;

  private DirectiveValue(Directive directive, String fragment, String valueText, Instant timestamp) {
    this.directive = Objects.requireNonNull(directive, "directive");
    this.fragment = fragment == null ? "" : fragment;
    this.valueText = valueText;
    this.timestamp = timestamp;
  }

  public static DirectiveValue flag(Directive directive, String fragment) {
    return new DirectiveValue(directive, fragment, null, null);
  }

  public static DirectiveValue timestamp(Directive directive, String fragment, String valueText, Instant timestamp) {
    return new DirectiveValue(directive, fragment, valueText, Objects.requireNonNull(timestamp, "timestamp"));
  }

  public static DirectiveValue unparsed(Directive directive, String fragment, String valueText) {
    return new DirectiveValue(directive, fragment, valueText, null);
  }

  public Directive getDirective() {
    return directive;
  }

  /**
   * @return The raw header fragment this value was parsed from
   */
  public String getFragment() {
    return fragment;
  }

  /**
   * @return The text after the directive name, or null for flags
   */
  public String getValueText() {
    return valueText;
  }

  /**
   * @return The parsed point in time, or null for flags and unparsed values
   */
  public Instant getTimestamp() {
    return timestamp;
  }

  /**
   * A flag is always parsed. A valued directive is parsed when its value
   * text was recognized.
   */
  public boolean isParsed() {
    return directive.getKind() == Directive.Kind.FLAG || timestamp != null;
  }

  /**
   * @return Boolean.TRUE for flags, the Instant for a parsed timestamp and
   *         the raw value text for an unparsed value
   */
  public Object toPlainValue() {
    if (directive.getKind() == Directive.Kind.FLAG) {
      return Boolean.TRUE;
    }
    if (timestamp != null) {
      return timestamp;
    }
    return valueText == null ? "" : valueText;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DirectiveValue)) {
      return false;
    }
    DirectiveValue other = (DirectiveValue) o;
    return directive == other.directive
        && fragment.equals(other.fragment)
        && Objects.equals(valueText, other.valueText)
        && Objects.equals(timestamp, other.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(directive, fragment, valueText, timestamp);
  }

  @Override
  public String toString() {
    if (directive.getKind() == Directive.Kind.FLAG) {
      return directive.getName();
    }
    return directive.getName() + ": " + toPlainValue();
  }
}
