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
import java.util.Collections;
import java.util.List;

import edu.uci.ics.xrobotstag.directive.Directive;
import edu.uci.ics.xrobotstag.directive.DirectiveValue;

/**
 * A single X-Robots-Tag header line, split into the user agent it applies
 * to and its directives in order of appearance.
 */
public class ParsedHeaderLine {
  private final String userAgent;
  private final List<DirectiveValue> directives = new ArrayList<>();

  /**
   * @param userAgent The user agent token, or the empty string for the default scope
   */
  public ParsedHeaderLine(String userAgent) {
    this.userAgent = userAgent == null ? XRobotsTagParser.USERAGENT_DEFAULT : userAgent;
  }

  void add(DirectiveValue value) {
    directives.add(value);
  }

  public String getUserAgent() {
    return userAgent;
  }

  public boolean isDefaultScope() {
    return userAgent.isEmpty();
  }

  public List<DirectiveValue> getDirectives() {
    return Collections.unmodifiableList(directives);
  }

  public boolean contains(Directive directive) {
    for (DirectiveValue value : directives) {
      if (value.getDirective() == directive) {
        return true;
      }
    }
    return false;
  }

  public boolean isEmpty() {
    return directives.isEmpty();
  }

  @Override
  public String toString() {
    return (isDefaultScope() ? "*" : userAgent) + " " + directives;
  }
}
