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

package edu.uci.ics.xrobotstag.fetcher;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.http.Header;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.config.CookieSpecs;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.uci.ics.xrobotstag.config.XRobotsTagConfig;
import edu.uci.ics.xrobotstag.exceptions.HeaderFetchException;

/**
 * Retrieves the raw HTTP response headers of a URL. The response body is
 * never read.
 */
public class HeaderFetcher implements Closeable {
  protected static final Logger logger = LoggerFactory.getLogger(HeaderFetcher.class);

  protected final XRobotsTagConfig config;
  protected PoolingHttpClientConnectionManager connectionManager;
  protected CloseableHttpClient httpClient;

  /**
   * @param config The fetcher configuration
   * @throws Exception When the configuration is not valid
   */
  public HeaderFetcher(XRobotsTagConfig config) throws Exception {
    config.validate();
    this.config = config;

    RequestConfig requestConfig =
        RequestConfig.custom().setExpectContinueEnabled(false).setCookieSpec(CookieSpecs.STANDARD)
                     .setRedirectsEnabled(config.isFollowRedirects()).setMaxRedirects(config.getMaxRedirects())
                     .setSocketTimeout(config.getSocketTimeout())
                     .setConnectTimeout(config.getConnectionTimeout()).build();

    connectionManager = new PoolingHttpClientConnectionManager();
    connectionManager.setMaxTotal(config.getMaxTotalConnections());
    connectionManager.setDefaultMaxPerRoute(config.getMaxTotalConnections());

    HttpClientBuilder clientBuilder = HttpClientBuilder.create();
    clientBuilder.setDefaultRequestConfig(requestConfig);
    clientBuilder.setConnectionManager(connectionManager);
    clientBuilder.setUserAgent(config.getUserAgentString());
    clientBuilder.setDefaultHeaders(config.getDefaultHeaders());

    if (config.getProxyHost() != null) {
      if (config.getProxyUsername() != null) {
        BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
        credentialsProvider.setCredentials(new AuthScope(config.getProxyHost(), config.getProxyPort()),
                                           new UsernamePasswordCredentials(config.getProxyUsername(),
                                                                           config.getProxyPassword()));
        clientBuilder.setDefaultCredentialsProvider(credentialsProvider);
      }

      HttpHost proxy = new HttpHost(config.getProxyHost(), config.getProxyPort());
      clientBuilder.setProxy(proxy);
      logger.debug("Working through Proxy: {}", proxy.getHostName());
    }

    httpClient = clientBuilder.build();
  }

  /**
   * Fetch the response headers of a URL.
   *
   * @param url The URL to request
   * @return The status line followed by one "Name: value" line per header,
   *         in the order the server sent them
   * @throws HeaderFetchException When the request could not be made
   */
  public List<String> fetchHeaders(String url) throws HeaderFetchException {
    HttpUriRequest request;
    try {
      request = newHttpUriRequest(url);
    } catch (IllegalArgumentException e) {
      throw new HeaderFetchException("Invalid URL: " + url, url, e);
    }

    try (CloseableHttpResponse response = httpClient.execute(request)) {
      List<String> headers = new ArrayList<>();
      headers.add(response.getStatusLine().toString());
      for (Header header : response.getAllHeaders()) {
        headers.add(header.getName() + ": " + header.getValue());
      }
      logger.debug("Fetched {} headers from {}, status: {}", headers.size() - 1, url,
                   response.getStatusLine().getStatusCode());
      return headers;
    } catch (IOException e) {
      throw new HeaderFetchException("Unable to fetch HTTP headers from " + url + ": " + e.getMessage(), url, e);
    } finally {
      // Headers are all we need, don't wait for the body
      request.abort();
    }
  }

  /**
   * Creates a new HttpUriRequest for the given url. The default is to create a HttpGet without
   * any further configuration. Subclasses may override this method, for example to send a
   * HEAD request instead.
   *
   * @param url the url to be fetched
   * @return the HttpUriRequest for the given url
   */
  protected HttpUriRequest newHttpUriRequest(String url) {
    return new HttpGet(url);
  }

  public XRobotsTagConfig getConfig() {
    return config;
  }

  public synchronized void shutDown() {
    try {
      httpClient.close();
    } catch (IOException e) {
      logger.warn("Error while closing the HTTP client: {}", e.getMessage());
      logger.debug("Stacktrace", e);
    }
    connectionManager.shutdown();
  }

  @Override
  public void close() {
    shutDown();
  }
}
