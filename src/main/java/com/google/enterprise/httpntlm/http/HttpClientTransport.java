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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.enterprise.httpntlm.common.HttpUtil;
import com.google.inject.Singleton;
import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;
import org.apache.http.client.config.CookieSpecs;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.conn.HttpClientConnectionManager;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.protocol.HttpContext;

/**
 * The default transport, using the HttpClient library.  Connections are
 * pooled; a connection is handed back to the pool when its response has been
 * fully consumed or closed, and the next request sent with the same context
 * to the same route gets it again.
 *
 * HttpClient's own authentication and redirect handling are turned off, so
 * that 401 responses and their WWW-Authenticate headers reach the caller.
 */
@ThreadSafe
@Singleton
@ParametersAreNonnullByDefault
public final class HttpClientTransport implements HttpTransport, Closeable {
  private static final Logger logger = Logger.getLogger(HttpClientTransport.class.getName());

  // How long it takes to establish a connection before we give up:
  private static int getConnectionTimeoutMillis() {
    String conto = System.getProperty("httpntlm.http.ConnectionTimeoutMillis");
    if (conto == null || conto.isEmpty()) {
      return 3000;
    }
    return Integer.parseInt(conto);
  }

  // How long we wait for data to be sent or received over the underlying socket:
  private static int getSocketTimeoutMillis() {
    String soto = System.getProperty("httpntlm.http.SocketTimeoutMillis");
    if (soto == null || soto.isEmpty()) {
      return 3000;
    }
    return Integer.parseInt(soto);
  }

  // How long a connection is unused before it is considered idle, and how
  // often we check:
  private static int getIdleConnectionMillis() {
    String idle = System.getProperty("httpntlm.http.IdleConnectionMillis");
    if (idle == null || idle.isEmpty()) {
      return 15000;
    }
    return Integer.parseInt(idle);
  }

  // The maximum number of simultaneous connections to a given host (and port):
  private static int getMaxConnectionsPerHostPort() {
    String maxcon = System.getProperty("httpntlm.http.MaxConnectionsPerHost");
    if (maxcon == null || maxcon.isEmpty()) {
      return 4;
    }
    return Integer.parseInt(maxcon);
  }

  // The maximum number of simultaneous connections overall:
  private static int getMaxConnectionsTotal() {
    String maxcon = System.getProperty("httpntlm.http.MaxConnectionsTotal");
    if (maxcon == null || maxcon.isEmpty()) {
      return 40;
    }
    return Integer.parseInt(maxcon);
  }

  @Nonnull private final PoolingHttpClientConnectionManager connectionManager;
  @Nonnull private final CloseableHttpClient httpClient;
  @Nonnull private final IdleConnectionMonitorThread idleConnectionMonitor;

  @Inject
  public HttpClientTransport() {
    this(buildPoolingConnectionManager());
  }

  @VisibleForTesting
  HttpClientTransport(PoolingHttpClientConnectionManager connectionManager) {
    this.connectionManager = connectionManager;
    RequestConfig requestConfig = RequestConfig.custom()
        .setConnectTimeout(getConnectionTimeoutMillis())
        .setSocketTimeout(getSocketTimeoutMillis())
        .setAuthenticationEnabled(false)
        .setRedirectsEnabled(false)
        .setCookieSpec(CookieSpecs.STANDARD)
        .build();
    httpClient = HttpClientBuilder.create()
        .setConnectionManager(connectionManager)
        .setDefaultRequestConfig(requestConfig)
        .disableAuthCaching()
        .disableRedirectHandling()
        .setUserAgent(HttpUtil.USER_AGENT)
        .build();
    idleConnectionMonitor = new IdleConnectionMonitorThread(connectionManager,
        getIdleConnectionMillis());
    idleConnectionMonitor.start();
  }

  private static PoolingHttpClientConnectionManager buildPoolingConnectionManager() {
    PoolingHttpClientConnectionManager connectionManager =
        new PoolingHttpClientConnectionManager();
    connectionManager.setDefaultMaxPerRoute(getMaxConnectionsPerHostPort());
    connectionManager.setMaxTotal(getMaxConnectionsTotal());
    return connectionManager;
  }

  @Override
  public CloseableHttpResponse execute(HttpUriRequest request, @Nullable HttpContext context)
      throws IOException {
    Preconditions.checkNotNull(request);
    return httpClient.execute(request, context);
  }

  /**
   * Stops the idle-connection monitor and shuts down the connection pool.
   */
  @Override
  public void close()
      throws IOException {
    logger.fine("Shutting down HTTP transport");
    idleConnectionMonitor.shutdown();
    httpClient.close();
  }

  /**
   * A daemon thread that periodically closes expired connections, and
   * connections that have been idle for too long.
   */
  static final class IdleConnectionMonitorThread extends Thread {
    private final HttpClientConnectionManager connectionManager;
    private final long idleConnectionMillis;
    private volatile boolean shutdown;

    IdleConnectionMonitorThread(HttpClientConnectionManager connectionManager,
        long idleConnectionMillis) {
      super("httpntlm-idle-connection-monitor");
      this.connectionManager = connectionManager;
      this.idleConnectionMillis = idleConnectionMillis;
      setDaemon(true);
    }

    @Override
    public void run() {
      try {
        while (!shutdown) {
          synchronized (this) {
            wait(idleConnectionMillis);
            connectionManager.closeExpiredConnections();
            connectionManager.closeIdleConnections(idleConnectionMillis, TimeUnit.MILLISECONDS);
          }
        }
      } catch (InterruptedException ex) {
        // done
        Thread.currentThread().interrupt();
      }
    }

    void shutdown() {
      shutdown = true;
      synchronized (this) {
        notifyAll();
      }
    }

    boolean isRunning() {
      return !shutdown;
    }
  }

  @VisibleForTesting
  boolean isIdleConnectionMonitorRunning() {
    return idleConnectionMonitor.isRunning();
  }

  @VisibleForTesting
  int getMaxConnectionsPerHost() {
    return connectionManager.getDefaultMaxPerRoute();
  }

  @VisibleForTesting
  int getMaxConnections() {
    return connectionManager.getMaxTotal();
  }
}
