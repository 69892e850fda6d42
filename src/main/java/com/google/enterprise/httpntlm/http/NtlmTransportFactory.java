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

import com.google.common.base.Preconditions;
import com.google.enterprise.httpntlm.ntlmssp.NtlmEngine;
import com.google.inject.Singleton;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;

import org.apache.http.client.CookieStore;

/**
 * Makes NTLM transports that share one inner transport and one engine.
 */
@Singleton
@ThreadSafe
public final class NtlmTransportFactory {
  private final HttpTransport innerTransport;
  private final NtlmEngine engine;

  @Inject
  NtlmTransportFactory(HttpTransport innerTransport, NtlmEngine engine) {
    this.innerTransport = innerTransport;
    this.engine = engine;
  }

  /**
   * Makes a transport for some credentials.
   *
   * @param credentials The identity the transport authenticates as.
   * @return A new transport.
   */
  public NtlmTransport make(NtlmCredentials credentials) {
    return make(credentials, null);
  }

  /**
   * Makes a transport for some credentials, with a cookie store shared by all
   * of its requests.
   *
   * @param credentials The identity the transport authenticates as.
   * @param cookieStore The cookie store; if null, each request's context
   *     supplies one.
   * @return A new transport.
   */
  public NtlmTransport make(NtlmCredentials credentials, @Nullable CookieStore cookieStore) {
    Preconditions.checkNotNull(credentials);
    NtlmTransport.Builder builder = NtlmTransport.builder()
        .setCredentials(credentials)
        .setInnerTransport(innerTransport)
        .setEngine(engine);
    if (cookieStore != null) {
      builder.setCookieStore(cookieStore);
    }
    return builder.build();
  }
}
