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

package edu.uci.ics.xrobotstag.url;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Validation and encoding of the URL the headers are fetched from.
 */
public final class TargetURL {
  private static final String RESERVED = ":/?#[]@!$&'()*+,;=";
  private static final String UNRESERVED = "-._~";
  private static final char[] HEX = "0123456789ABCDEF".toCharArray();

  private TargetURL() {
  }

  /**
   * Check if the URL is an absolute http or https URL with a host.
   *
   * @param url The URL to check
   * @return True if the URL can be fetched
   */
  public static boolean isValid(String url) {
    if (url == null || url.trim().isEmpty()) {
      return false;
    }
    try {
      URI uri = new URI(url.trim());
      String scheme = uri.getScheme();
      if (scheme == null) {
        return false;
      }
      scheme = scheme.toLowerCase(Locale.ROOT);
      if (!scheme.equals("http") && !scheme.equals("https")) {
        return false;
      }
      return uri.getHost() != null && !uri.getHost().isEmpty();
    } catch (URISyntaxException e) {
      return false;
    }
  }

  /**
   * Percent-encode all characters that may not appear in a URL. Existing
   * escapes are kept as they are.
   *
   * @param url The URL to encode
   * @return The encoded URL, trimmed
   */
  public static String encode(String url) {
    if (url == null) {
      return "";
    }
    String trimmed = url.trim();
    StringBuilder sb = new StringBuilder(trimmed.length());
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c == '%' && isEscape(trimmed, i)) {
        sb.append(c);
      } else if (isAllowed(c)) {
        sb.append(c);
      } else {
        int end = i + 1;
        if (Character.isHighSurrogate(c) && end < trimmed.length()
            && Character.isLowSurrogate(trimmed.charAt(end))) {
          end++;
        }
        for (byte b : trimmed.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
          sb.append('%').append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
        }
        i = end - 1;
      }
    }
    return sb.toString();
  }

  private static boolean isAllowed(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
        || UNRESERVED.indexOf(c) >= 0 || RESERVED.indexOf(c) >= 0;
  }

  private static boolean isEscape(String s, int pos) {
    return pos + 2 < s.length() && isHex(s.charAt(pos + 1)) && isHex(s.charAt(pos + 2));
  }

  private static boolean isHex(char c) {
    return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }
}
