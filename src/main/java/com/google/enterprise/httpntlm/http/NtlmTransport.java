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
import com.google.common.io.BaseEncoding;
import com.google.common.io.ByteStreams;
import com.google.enterprise.httpntlm.common.HttpUtil;
import com.google.enterprise.httpntlm.ntlmssp.NtlmAuthenticate;
import com.google.enterprise.httpntlm.ntlmssp.NtlmChallenge;
import com.google.enterprise.httpntlm.ntlmssp.NtlmClientSession;
import com.google.enterprise.httpntlm.ntlmssp.NtlmEngine;
import com.google.enterprise.httpntlm.ntlmssp.NtlmMode;
import com.google.enterprise.httpntlm.ntlmssp.NtlmSspEngine;
import com.google.enterprise.httpntlm.ntlmssp.NtlmVersion;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.ThreadSafe;

import org.apache.http.HttpEntity;
import org.apache.http.client.CookieStore;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.impl.client.BasicCookieStore;
import org.apache.http.protocol.BasicHttpContext;
import org.apache.http.protocol.HttpContext;

/**
 * A transport that answers NTLM authentication requests transparently.  Each
 * request runs a complete NTLM handshake:
 *
 * <ol>
 * <li>a GET probe to the request's URI carrying a Negotiate message;
 * <li>if the probe gets a 401, the server's Challenge message is read from the
 *     WWW-Authenticate header and answered with an Authenticate message, which
 *     is attached to the caller's request before it is sent.
 * </ol>
 *
 * Every message of a handshake goes through the same inner transport with the
 * same exchange context, so the server sees them on one connection.  That
 * only works if each intermediate response is fully drained and closed before
 * the next request is sent; this class always does so.
 *
 * Servers that send an empty NTLM challenge get one more complete handshake.
 */
@ThreadSafe
@ParametersAreNonnullByDefault
public final class NtlmTransport implements HttpTransport {
  private static final Logger logger = Logger.getLogger(NtlmTransport.class.getName());

  @VisibleForTesting
  static final int EMPTY_CHALLENGE_RETRIES = 1;

  @Nonnull private final NtlmCredentials credentials;
  @Nullable private final HttpTransport innerTransport;
  @Nullable private final CookieStore cookieStore;
  @Nonnull private final NtlmEngine engine;

  private NtlmTransport(NtlmCredentials credentials, @Nullable HttpTransport innerTransport,
      @Nullable CookieStore cookieStore, NtlmEngine engine) {
    this.credentials = credentials;
    this.innerTransport = innerTransport;
    this.cookieStore = cookieStore;
    this.engine = engine;
  }

  /**
   * Create a new NTLM transport builder.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * A builder class for NTLM transports.
   */
  public static final class Builder {
    private NtlmCredentials credentials;
    private HttpTransport innerTransport;
    private CookieStore cookieStore;
    private NtlmEngine engine;

    private Builder() {
    }

    /**
     * Set the identity to authenticate as.  Required.
     *
     * @param credentials The credentials.
     * @return The builder object, for convenience.
     */
    public Builder setCredentials(NtlmCredentials credentials) {
      Preconditions.checkNotNull(credentials);
      this.credentials = credentials;
      return this;
    }

    /**
     * Set the transport that carries the handshake's messages.  If not set, a
     * shared {@link HttpClientTransport} is used.
     *
     * @param innerTransport The transport to use.
     * @return The builder object, for convenience.
     */
    public Builder setInnerTransport(HttpTransport innerTransport) {
      Preconditions.checkNotNull(innerTransport);
      this.innerTransport = innerTransport;
      return this;
    }

    /**
     * Set the cookie store for the handshakes.  If not set, the caller's
     * context's store is used, or a fresh one per request if it has none.
     *
     * @param cookieStore The cookie store to use.
     * @return The builder object, for convenience.
     */
    public Builder setCookieStore(CookieStore cookieStore) {
      Preconditions.checkNotNull(cookieStore);
      this.cookieStore = cookieStore;
      return this;
    }

    /**
     * Set the NTLM engine.  If not set, an {@link NtlmSspEngine} is used.
     *
     * @param engine The engine to use.
     * @return The builder object, for convenience.
     */
    public Builder setEngine(NtlmEngine engine) {
      Preconditions.checkNotNull(engine);
      this.engine = engine;
      return this;
    }

    /**
     * @return A new NTLM transport using the accumulated parameters.
     * @throws IllegalStateException if no credentials were set.
     */
    public NtlmTransport build() {
      Preconditions.checkState(credentials != null, "Credentials must be set");
      return new NtlmTransport(credentials, innerTransport, cookieStore,
          (engine != null) ? engine : new NtlmSspEngine());
    }
  }

  public NtlmCredentials getCredentials() {
    return credentials;
  }

  /**
   * Sends a request with a fresh exchange context.
   *
   * @see #execute(HttpUriRequest, HttpContext)
   */
  public CloseableHttpResponse execute(HttpUriRequest request)
      throws IOException {
    return execute(request, null);
  }

  /**
   * Sends a request, authenticating it with NTLM if the server asks for it.
   *
   * @param request The request to send; its URI must be absolute.  Its
   *     Authorization header is replaced if a handshake reaches the final
   *     request.
   * @param context The caller's context; if given, the exchange context is
   *     layered on top of it.
   * @return The probe's response if it wasn't a 401, otherwise the response to
   *     the authenticated request.
   * @throws NtlmAuthenticationException if the handshake fails.
   * @throws IOException if the inner transport fails.
   */
  @Override
  public CloseableHttpResponse execute(HttpUriRequest request, @Nullable HttpContext context)
      throws IOException {
    Preconditions.checkNotNull(request);
    URI uri = request.getURI();
    Preconditions.checkArgument(uri != null && uri.isAbsolute(),
        "Request URI must be absolute: %s", uri);
    HttpTransport transport = getTransport();
    HttpClientContext exchangeContext = makeExchangeContext(context);
    int retries = 0;
    while (true) {
      try {
        return ntlmRoundTrip(transport, exchangeContext, request);
      } catch (EmptyNtlmChallengeException e) {
        if (retries >= EMPTY_CHALLENGE_RETRIES) {
          throw e;
        }
        retries += 1;
        logger.fine("Empty NTLM challenge from " + uri + "; restarting handshake");
      }
    }
  }

  private HttpTransport getTransport() {
    return (innerTransport != null) ? innerTransport : DefaultTransportHolder.INSTANCE;
  }

  private HttpClientContext makeExchangeContext(@Nullable HttpContext parent) {
    HttpClientContext exchangeContext = (parent != null)
        ? HttpClientContext.adapt(new BasicHttpContext(parent))
        : HttpClientContext.create();
    if (cookieStore != null) {
      exchangeContext.setCookieStore(cookieStore);
    } else if (exchangeContext.getCookieStore() == null) {
      exchangeContext.setCookieStore(new BasicCookieStore());
    }
    return exchangeContext;
  }

  private CloseableHttpResponse ntlmRoundTrip(HttpTransport transport,
      HttpClientContext exchangeContext, HttpUriRequest request)
      throws IOException {
    URI uri = request.getURI();

    byte[] negotiate = engine.createNegotiateMessage().encode();
    HttpGet probe = new HttpGet(uri);
    probe.setHeader(HttpUtil.HTTP_HEADER_AUTHORIZATION,
        NtlmChallengeHeader.makeAuthorizationValue(negotiate));
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Sending NTLM Negotiate to " + uri + ": " + bytesToHex(negotiate));
    }
    CloseableHttpResponse probeResponse = transport.execute(probe, exchangeContext);

    int status = probeResponse.getStatusLine().getStatusCode();
    if (status != HttpUtil.HTTP_STATUS_UNAUTHORIZED) {
      logger.fine("Probe of " + uri + " returned " + status + "; no NTLM handshake");
      return probeResponse;
    }
    drainAndClose(probeResponse);

    NtlmChallengeHeader challengeHeader =
        NtlmChallengeHeader.select(probeResponse.getHeaders(HttpUtil.HTTP_HEADER_WWW_AUTHENTICATE));
    byte[] encodedChallenge = challengeHeader.decode();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Received NTLM Challenge: " + bytesToHex(encodedChallenge));
    }

    byte[] encodedAuthenticate = authenticate(encodedChallenge);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Sending NTLM Authenticate: " + bytesToHex(encodedAuthenticate));
    }
    request.setHeader(HttpUtil.HTTP_HEADER_AUTHORIZATION,
        NtlmChallengeHeader.makeAuthorizationValue(encodedAuthenticate));
    return transport.execute(request, exchangeContext);
  }

  private byte[] authenticate(byte[] encodedChallenge)
      throws NtlmAuthenticationException {
    NtlmAuthenticate authenticate;
    try {
      NtlmClientSession session =
          engine.createClientSession(NtlmVersion.V2, NtlmMode.CONNECTIONLESS);
      session.setUserInfo(credentials.getUserName(), credentials.getPassword(),
          credentials.getDomain(), credentials.getWorkstation());
      NtlmChallenge challenge = engine.parseChallengeMessage(encodedChallenge);
      session.processChallengeMessage(challenge);
      authenticate = session.generateAuthenticateMessage();
    } catch (GeneralSecurityException e) {
      throw new NtlmAuthenticationException("NTLM handshake failed: " + e.getMessage(), e);
    }
    return authenticate.encode();
  }

  /**
   * Reads and discards the rest of a response's body, then closes it.  The
   * connection can carry another request only after this.
   */
  @VisibleForTesting
  static void drainAndClose(CloseableHttpResponse response)
      throws IOException {
    try (CloseableHttpResponse r = response) {
      HttpEntity entity = r.getEntity();
      if (entity != null && entity.isStreaming()) {
        try (InputStream in = entity.getContent()) {
          ByteStreams.exhaust(in);
        }
      }
    }
  }

  private static String bytesToHex(byte[] bytes) {
    return BaseEncoding.base16().lowerCase().encode(bytes);
  }

  // Created on first use, so that callers with their own transport never
  // start a connection pool.
  private static final class DefaultTransportHolder {
    static final HttpTransport INSTANCE = new HttpClientTransport();
  }
}
