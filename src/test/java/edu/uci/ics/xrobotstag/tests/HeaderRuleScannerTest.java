package edu.uci.ics.xrobotstag.tests;

import static org.junit.Assert.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.uci.ics.xrobotstag.directive.Directive;
import edu.uci.ics.xrobotstag.directive.DirectiveValue;
import edu.uci.ics.xrobotstag.parser.HeaderRuleScanner;
import edu.uci.ics.xrobotstag.parser.ParsedHeaderLine;

public class HeaderRuleScannerTest {
  private final HeaderRuleScanner scanner = new HeaderRuleScanner();

  private static void assertDirectives(ParsedHeaderLine line, Directive... expected) {
    List<DirectiveValue> values = line.getDirectives();
    assertEquals(values.toString(), expected.length, values.size());
    for (int i = 0; i < expected.length; ++i) {
      assertEquals(expected[i], values.get(i).getDirective());
    }
  }

  @Test
  public void testOtherHeadersAreIgnored() {
    assertNull(scanner.scan("HTTP/1.1 200 OK"));
    assertNull(scanner.scan("Date: Tue, 25 May 2010 21:42:43 GMT"));
    assertNull(scanner.scan("X-Robots: noindex"));
    assertNull(scanner.scan(null));
  }

  @Test
  public void testUnscopedLine() {
    ParsedHeaderLine line = scanner.scan("X-Robots-Tag: noindex, nofollow");
    assertTrue(line.isDefaultScope());
    assertEquals("", line.getUserAgent());
    assertDirectives(line, Directive.NO_INDEX, Directive.NO_FOLLOW);
  }

  @Test
  public void testHeaderNameIsCaseInsensitive() {
    assertDirectives(scanner.scan("x-robots-tag: noarchive"), Directive.NO_ARCHIVE);
    assertDirectives(scanner.scan("X-ROBOTS-TAG:noarchive"), Directive.NO_ARCHIVE);
    assertDirectives(scanner.scan("  X-Robots-Tag  :  noarchive  "), Directive.NO_ARCHIVE);
  }

  @Test
  public void testDirectiveNamesAreCaseInsensitive() {
    assertDirectives(scanner.scan("X-Robots-Tag: NoIndex, NOFOLLOW"), Directive.NO_INDEX, Directive.NO_FOLLOW);
  }

  @Test
  public void testScopedLine() {
    ParsedHeaderLine line = scanner.scan("X-Robots-Tag: googlebot: nofollow, noarchive");
    assertEquals("googlebot", line.getUserAgent());
    assertFalse(line.isDefaultScope());
    assertDirectives(line, Directive.NO_FOLLOW, Directive.NO_ARCHIVE);
  }

  @Test
  public void testScopeKeepsItsCase() {
    ParsedHeaderLine line = scanner.scan("X-Robots-Tag: GoogleBot: noindex");
    assertEquals("GoogleBot", line.getUserAgent());
  }

  @Test
  public void testDirectiveIsNotMistakenForScope() {
    ParsedHeaderLine line = scanner.scan("X-Robots-Tag: unavailable_after: 25 Jun 2010 15:00:00 GMT");
    assertTrue(line.isDefaultScope());
    assertDirectives(line, Directive.UNAVAILABLE_AFTER);

    line = scanner.scan("X-Robots-Tag: NoIndex: yes");
    assertTrue(line.isDefaultScope());
    assertDirectives(line, Directive.NO_INDEX);
  }

  @Test
  public void testEmptyScopeIsIgnored() {
    ParsedHeaderLine line = scanner.scan("X-Robots-Tag: : noindex, nofollow");
    assertTrue(line.isDefaultScope());
    assertDirectives(line, Directive.NO_FOLLOW);
  }

  @Test
  public void testUnknownDirectivesAreSkipped() {
    ParsedHeaderLine line = scanner.scan("X-Robots-Tag: max-snippet: 20, noindex, noai, max-image-preview: large");
    assertDirectives(line, Directive.NO_INDEX);
  }

  @Test
  public void testUnknownValuedDirectiveIsNotMistakenForScope() {
    ParsedHeaderLine line = scanner.scan("X-Robots-Tag: max-snippet: 20, noindex");
    assertTrue(line.isDefaultScope());
    assertDirectives(line, Directive.NO_INDEX);

    line = scanner.scan("X-Robots-Tag: googlebot: noai, nofollow");
    assertTrue(line.isDefaultScope());
    assertDirectives(line, Directive.NO_FOLLOW);
  }

  @Test
  public void testLineWithoutDirectives() {
    ParsedHeaderLine line = scanner.scan("X-Robots-Tag: noai, noimageai");
    assertNotNull(line);
    assertTrue(line.isEmpty());

    line = scanner.scan("X-Robots-Tag:");
    assertNotNull(line);
    assertTrue(line.isEmpty());

    line = scanner.scan("X-Robots-Tag: , ,");
    assertTrue(line.isEmpty());
  }

  @Test
  public void testDateWithCommaIsJoined() {
    ParsedHeaderLine line = scanner.scan(
        "X-Robots-Tag: googlebot: nofollow, unavailable_after: Friday, 25 Jun 2010 15:00:00 GMT, noindex");
    assertEquals("googlebot", line.getUserAgent());
    assertDirectives(line, Directive.NO_FOLLOW, Directive.UNAVAILABLE_AFTER, Directive.NO_INDEX);

    DirectiveValue value = line.getDirectives().get(1);
    assertEquals("unavailable_after: Friday, 25 Jun 2010 15:00:00 GMT", value.getFragment());
    assertEquals(Instant.parse("2010-06-25T15:00:00Z"), value.getTimestamp());
  }

  @Test
  public void testDateAtEndOfLine() {
    ParsedHeaderLine line = scanner.scan("X-Robots-Tag: unavailable_after: Friday, 25 Jun 2010 15:00:00 GMT");
    assertDirectives(line, Directive.UNAVAILABLE_AFTER);
    assertEquals(Instant.parse("2010-06-25T15:00:00Z"), line.getDirectives().get(0).getTimestamp());
  }

  @Test
  public void testOnlyOneFragmentIsJoinedToDate() {
    ParsedHeaderLine line = scanner.scan("X-Robots-Tag: unavailable_after: 25 Jun 2010, foo, noindex");
    assertDirectives(line, Directive.UNAVAILABLE_AFTER, Directive.NO_INDEX);
    assertEquals("unavailable_after: 25 Jun 2010, foo", line.getDirectives().get(0).getFragment());
  }

  @Test
  public void testRepeatedDirectiveIsKeptInOrder() {
    ParsedHeaderLine line = scanner.scan("X-Robots-Tag: noindex, noindex");
    assertDirectives(line, Directive.NO_INDEX, Directive.NO_INDEX);
    assertTrue(line.contains(Directive.NO_INDEX));
    assertFalse(line.contains(Directive.NO_FOLLOW));
  }

  @Test
  public void testScanAll() {
    List<ParsedHeaderLine> lines = scanner.scanAll(Arrays.asList(
        "HTTP/1.1 200 OK",
        "X-Robots-Tag: noindex",
        "Content-Type: text/html",
        "X-Robots-Tag: bingbot: nofollow"));
    assertEquals(2, lines.size());
    assertEquals("", lines.get(0).getUserAgent());
    assertEquals("bingbot", lines.get(1).getUserAgent());

    assertTrue(scanner.scanAll(null).isEmpty());
  }
}
