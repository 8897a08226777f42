package edu.uci.ics.xrobotstag.tests;

import static org.junit.Assert.*;

import java.util.Collections;

import org.apache.http.Header;
import org.apache.http.message.BasicHeader;
import org.junit.Test;

import edu.uci.ics.xrobotstag.config.XRobotsTagConfig;

public class XRobotsTagConfigTest {

  private static void assertInvalid(XRobotsTagConfig config) {
    try {
      config.validate();
      fail("Expected the configuration to be rejected");
    } catch (Exception e) {
      assertNotNull(e.getMessage());
    }
  }

  @Test
  public void testDefaultsAreValid() throws Exception {
    XRobotsTagConfig config = new XRobotsTagConfig();
    config.validate();
    assertTrue(config.isFollowRedirects());
    assertTrue(config.toString().contains("User agent string: " + config.getUserAgentString()));
  }

  @Test
  public void testInvalidValues() {
    XRobotsTagConfig config = new XRobotsTagConfig();
    config.setUserAgentString(" ");
    assertInvalid(config);

    config = new XRobotsTagConfig();
    config.setSocketTimeout(-1);
    assertInvalid(config);

    config = new XRobotsTagConfig();
    config.setMaxTotalConnections(0);
    assertInvalid(config);

    config = new XRobotsTagConfig();
    config.setMaxRedirects(-1);
    assertInvalid(config);

    config = new XRobotsTagConfig();
    config.setProxyHost("proxy.example.com");
    config.setProxyPort(0);
    assertInvalid(config);
  }

  @Test
  public void testProxyPasswordIsMasked() {
    XRobotsTagConfig config = new XRobotsTagConfig();
    assertTrue(config.toString().contains("Proxy password: null"));

    config.setProxyPassword("s3cr3t");
    assertFalse(config.toString().contains("s3cr3t"));
    assertTrue(config.toString().contains("Proxy password: ********"));
  }

  @Test
  public void testDefaultHeadersAreCopied() {
    XRobotsTagConfig config = new XRobotsTagConfig();
    config.setDefaultHeaders(Collections.singletonList(new BasicHeader("Accept-Language", "en")));
    assertEquals(1, config.getDefaultHeaders().size());
    Header header = config.getDefaultHeaders().iterator().next();
    assertEquals("Accept-Language", header.getName());
    assertEquals("en", header.getValue());

    config.getDefaultHeaders().clear();
    assertEquals(1, config.getDefaultHeaders().size());
  }
}
