package edu.uci.ics.xrobotstag.tests;

import static org.junit.Assert.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;

import org.junit.Test;

import edu.uci.ics.xrobotstag.directive.Directive;
import edu.uci.ics.xrobotstag.directive.DirectiveValue;
import edu.uci.ics.xrobotstag.parser.HeaderRuleScanner;
import edu.uci.ics.xrobotstag.parser.RawRuleSet;
import edu.uci.ics.xrobotstag.parser.RuleAggregator;

public class RuleAggregatorTest {
  private final HeaderRuleScanner scanner = new HeaderRuleScanner();

  private RawRuleSet aggregate(String... headers) {
    return new RuleAggregator().addAll(scanner.scanAll(Arrays.asList(headers))).getRules();
  }

  @Test
  public void testScopesAreSeparated() {
    RawRuleSet rules = aggregate(
        "X-Robots-Tag: noindex",
        "X-Robots-Tag: googlebot: nofollow",
        "X-Robots-Tag: bingbot: noarchive, nosnippet");

    assertEquals(Arrays.asList("", "googlebot", "bingbot"), Arrays.asList(rules.getUserAgents().toArray()));
    Map<String, Map<Directive, DirectiveValue>> export = rules.export();
    assertEquals(1, export.get("").size());
    assertTrue(export.get("").containsKey(Directive.NO_INDEX));
    assertEquals(1, export.get("googlebot").size());
    assertTrue(export.get("googlebot").containsKey(Directive.NO_FOLLOW));
    assertEquals(2, export.get("bingbot").size());
  }

  @Test
  public void testLastWriteWins() {
    RawRuleSet rules = aggregate(
        "X-Robots-Tag: unavailable_after: 25 Jun 2010 15:00:00 GMT",
        "X-Robots-Tag: noindex, unavailable_after: 26 Jun 2010 15:00:00 GMT");

    Map<Directive, DirectiveValue> defaults = rules.export().get("");
    assertEquals(2, defaults.size());
    assertEquals(Instant.parse("2010-06-26T15:00:00Z"), defaults.get(Directive.UNAVAILABLE_AFTER).getTimestamp());
  }

  @Test
  public void testDuplicatesOnOneLineAreMerged() {
    RawRuleSet rules = aggregate("X-Robots-Tag: googlebot: noindex, nofollow, noindex");
    assertEquals(2, rules.findDirectives("googlebot").size());
  }

  @Test
  public void testEmptyLinesDoNotCreateScopes() {
    RawRuleSet rules = aggregate("X-Robots-Tag: googlebot: noai", "Server: nginx");
    assertTrue(rules.isEmpty());
    assertNull(rules.findDirectives("googlebot"));
    assertTrue(rules.export().isEmpty());
  }

  @Test
  public void testScopesDifferingInCaseAreMerged() {
    RawRuleSet rules = aggregate("X-Robots-Tag: GoogleBot: noindex", "X-Robots-Tag: googlebot: nofollow");
    assertEquals(Arrays.asList("GoogleBot"), Arrays.asList(rules.getUserAgents().toArray()));
    assertEquals(2, rules.findDirectives("googlebot").size());
    assertSame(rules.findDirectives("GoogleBot"), rules.findDirectives("GOOGLEBOT"));

    Map<String, Map<Directive, DirectiveValue>> export = rules.export();
    assertEquals(1, export.size());
    assertTrue(export.get("GoogleBot").containsKey(Directive.NO_INDEX));
    assertTrue(export.get("GoogleBot").containsKey(Directive.NO_FOLLOW));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testExportIsReadOnly() {
    RawRuleSet rules = aggregate("X-Robots-Tag: noindex");
    rules.export().get("").remove(Directive.NO_INDEX);
  }
}
