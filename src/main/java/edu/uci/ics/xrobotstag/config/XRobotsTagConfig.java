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

package edu.uci.ics.xrobotstag.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;

import org.apache.http.Header;
import org.apache.http.message.BasicHeader;

public class XRobotsTagConfig {

  /**
   * user-agent string that is sent to web servers when fetching headers.
   * See http://en.wikipedia.org/wiki/User_agent for more details
   */
  private String userAgentString = "xrobotstag4j/1.0";

  /**
   * Default request headers, sent with every request.
   */
  private Collection<BasicHeader> defaultHeaders = new HashSet<BasicHeader>();

  /**
   * Socket timeout in milliseconds
   */
  private int socketTimeout = 20000;

  /**
   * Connection timeout in milliseconds
   */
  private int connectionTimeout = 30000;

  /**
   * Maximum total connections
   */
  private int maxTotalConnections = 20;

  /**
   * Should we follow redirects? The headers of the final response are used.
   */
  private boolean followRedirects = true;

  /**
   * Maximum number of redirects to follow before giving up
   */
  private int maxRedirects = 5;

  /**
   * If the fetcher should run behind a proxy, this parameter can be used for
   * specifying the proxy host.
   */
  private String proxyHost = null;

  /**
   * If the fetcher should run behind a proxy, this parameter can be used for
   * specifying the proxy port.
   */
  private int proxyPort = 80;

  /**
   * If the fetcher should run behind a proxy and user/pass is needed for
   * authentication in proxy, this parameter can be used for specifying the
   * username.
   */
  private String proxyUsername = null;

  /**
   * If the fetcher should run behind a proxy and user/pass is needed for
   * authentication in proxy, this parameter can be used for specifying the
   * password.
   */
  private String proxyPassword = null;

  public XRobotsTagConfig() {
  }

  /**
   * Validates the configs specified by this instance.
   *
   * @throws Exception Whenever the configuration is not correct.
   */
  public void validate() throws Exception {
    if (userAgentString == null || userAgentString.trim().isEmpty()) {
      throw new Exception("User agent string is not set in the XRobotsTagConfig.");
    }
    if (socketTimeout < 0) {
      throw new Exception("Invalid value for socket timeout: " + socketTimeout);
    }
    if (connectionTimeout < 0) {
      throw new Exception("Invalid value for connection timeout: " + connectionTimeout);
    }
    if (maxTotalConnections < 1) {
      throw new Exception("Maximum total connections should be at least 1: " + maxTotalConnections);
    }
    if (maxRedirects < 0) {
      throw new Exception("Invalid value for maximum redirects: " + maxRedirects);
    }
    if (proxyHost != null && (proxyPort < 1 || proxyPort > 65535)) {
      throw new Exception("Invalid proxy port: " + proxyPort);
    }
  }

  public String getUserAgentString() {
    return userAgentString;
  }

  /**
   * user-agent string that is sent to web servers when fetching headers.
   *
   * @param userAgentString Custom user agent string
   */
  public void setUserAgentString(String userAgentString) {
    this.userAgentString = userAgentString;
  }

  public Collection<Header> getDefaultHeaders() {
    return new ArrayList<Header>(defaultHeaders);
  }

  /**
   * Set the default headers sent with every request.
   *
   * @param defaultHeaders Headers to send
   */
  public void setDefaultHeaders(Collection<? extends Header> defaultHeaders) {
    Collection<BasicHeader> copiedHeaders = new HashSet<BasicHeader>();
    for (Header header : defaultHeaders) {
      copiedHeaders.add(new BasicHeader(header.getName(), header.getValue()));
    }
    this.defaultHeaders = copiedHeaders;
  }

  public int getSocketTimeout() {
    return socketTimeout;
  }

  /**
   * @param socketTimeout Socket timeout in milliseconds
   */
  public void setSocketTimeout(int socketTimeout) {
    this.socketTimeout = socketTimeout;
  }

  public int getConnectionTimeout() {
    return connectionTimeout;
  }

  /**
   * @param connectionTimeout Connection timeout in milliseconds
   */
  public void setConnectionTimeout(int connectionTimeout) {
    this.connectionTimeout = connectionTimeout;
  }

  public int getMaxTotalConnections() {
    return maxTotalConnections;
  }

  public void setMaxTotalConnections(int maxTotalConnections) {
    this.maxTotalConnections = maxTotalConnections;
  }

  public boolean isFollowRedirects() {
    return followRedirects;
  }

  public void setFollowRedirects(boolean followRedirects) {
    this.followRedirects = followRedirects;
  }

  public int getMaxRedirects() {
    return maxRedirects;
  }

  public void setMaxRedirects(int maxRedirects) {
    this.maxRedirects = maxRedirects;
  }

  public String getProxyHost() {
    return proxyHost;
  }

  /**
   * @param proxyHost If the fetcher should run behind a proxy, this parameter can be used for
   *                  specifying the proxy host.
   */
  public void setProxyHost(String proxyHost) {
    this.proxyHost = proxyHost;
  }

  public int getProxyPort() {
    return proxyPort;
  }

  /**
   * @param proxyPort If the fetcher should run behind a proxy, this parameter can be used for
   *                  specifying the proxy port.
   */
  public void setProxyPort(int proxyPort) {
    this.proxyPort = proxyPort;
  }

  public String getProxyUsername() {
    return proxyUsername;
  }

  public void setProxyUsername(String proxyUsername) {
    this.proxyUsername = proxyUsername;
  }

  public String getProxyPassword() {
    return proxyPassword;
  }

  public void setProxyPassword(String proxyPassword) {
    this.proxyPassword = proxyPassword;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("User agent string: " + getUserAgentString() + "\n");
    sb.append("Default headers: " + getDefaultHeaders() + "\n");
    sb.append("Socket timeout: " + getSocketTimeout() + "\n");
    sb.append("Connection timeout: " + getConnectionTimeout() + "\n");
    sb.append("Max total connections: " + getMaxTotalConnections() + "\n");
    sb.append("Should follow redirects?: " + isFollowRedirects() + "\n");
    sb.append("Max redirects: " + getMaxRedirects() + "\n");
    sb.append("Proxy host: " + getProxyHost() + "\n");
    sb.append("Proxy port: " + getProxyPort() + "\n");
    sb.append("Proxy username: " + getProxyUsername() + "\n");
    sb.append("Proxy password: " + (getProxyPassword() == null ? null : "********") + "\n");
    return sb.toString();
  }
}
