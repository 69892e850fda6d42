// Copyright 2012 Google Inc.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.enterprise.httpntlm.http;

import com.google.enterprise.httpntlm.common.HttpUtil;
import java.io.IOException;
import java.net.ServerSocket;
import java.util.List;
import junit.framework.TestCase;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.mockito.Mockito;

/**
 * Tests for the {@link HttpClientTransport} class.
 */
public final class HttpClientTransportTest extends TestCase {
  private MockNtlmServer server;
  private HttpClientTransport transport;

  @Override
  public void setUp()
      throws IOException {
    server = new MockNtlmServer("mememe");
    server.start();
    transport = new HttpClientTransport();
  }

  @Override
  public void tearDown()
      throws IOException {
    transport.close();
    server.stop();
  }

  public void testDefaults() {
    assertEquals(4, transport.getMaxConnectionsPerHost());
    assertEquals(40, transport.getMaxConnections());
    assertTrue(transport.isIdleConnectionMonitorRunning());
  }

  public void testSystemProperties()
      throws IOException {
    System.setProperty("httpntlm.http.MaxConnectionsPerHost", "7");
    System.setProperty("httpntlm.http.MaxConnectionsTotal", "70");
    try {
      HttpClientTransport tuned = new HttpClientTransport();
      try {
        assertEquals(7, tuned.getMaxConnectionsPerHost());
        assertEquals(70, tuned.getMaxConnections());
      } finally {
        tuned.close();
      }
    } finally {
      System.clearProperty("httpntlm.http.MaxConnectionsPerHost");
      System.clearProperty("httpntlm.http.MaxConnectionsTotal");
    }
  }

  public void testClose()
      throws IOException {
    PoolingHttpClientConnectionManager connectionManager =
        Mockito.mock(PoolingHttpClientConnectionManager.class);
    HttpClientTransport closing = new HttpClientTransport(connectionManager);
    assertTrue(closing.isIdleConnectionMonitorRunning());
    closing.close();
    assertFalse(closing.isIdleConnectionMonitorRunning());
    Mockito.verify(connectionManager).shutdown();
  }

  public void testUnauthorizedReturned()
      throws IOException {
    try (CloseableHttpResponse response =
        transport.execute(new HttpGet(server.getUrl("/protected")), null)) {
      assertEquals(401, response.getStatusLine().getStatusCode());
      assertEquals(HttpUtil.NTLM_AUTH_SCHEME,
          response.getFirstHeader(HttpUtil.HTTP_HEADER_WWW_AUTHENTICATE).getValue());
      EntityUtils.consume(response.getEntity());
    }
    assertEquals(1, server.getLog().size());
  }

  public void testRedirectNotFollowed()
      throws IOException {
    try (CloseableHttpResponse response =
        transport.execute(new HttpGet(server.getUrl("/redirect")), null)) {
      assertEquals(302, response.getStatusLine().getStatusCode());
    }
    assertEquals(1, server.getLog().size());
  }

  public void testUserAgent()
      throws IOException {
    HttpGet request = new HttpGet(server.getUrl("/open"));
    HttpClientContext context = HttpClientContext.create();
    try (CloseableHttpResponse response = transport.execute(request, context)) {
      EntityUtils.consume(response.getEntity());
    }
    assertEquals(HttpUtil.USER_AGENT,
        context.getRequest().getFirstHeader(HttpUtil.HTTP_HEADER_USER_AGENT).getValue());
  }

  public void testConnectionReuse()
      throws IOException {
    HttpClientContext context = HttpClientContext.create();
    for (int i = 0; i < 3; i += 1) {
      try (CloseableHttpResponse response =
          transport.execute(new HttpGet(server.getUrl("/open")), context)) {
        assertEquals("open", EntityUtils.toString(response.getEntity()));
      }
    }
    List<String> log = server.getLog();
    assertEquals(3, log.size());
    assertEquals(log.get(0), log.get(1));
    assertEquals(log.get(0), log.get(2));
  }

  public void testNoListener()
      throws IOException {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    try {
      transport.execute(new HttpGet("http://127.0.0.1:" + port + "/"), null);
      fail("Normal return from URL without listener");
    } catch (IOException e) {
      // pass
    }
  }
}
