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
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;
import com.google.enterprise.httpntlm.common.HttpUtil;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import org.apache.http.Header;

/**
 * The NTLM challenge carried by a WWW-Authenticate header, and the
 * Authorization header values that carry NTLM messages the other way.
 *
 * A value belongs to NTLM if its scheme token is exactly {@code NTLM}: either
 * the whole value, or followed by whitespace and a base64 payload.  Matching
 * is case-sensitive.
 */
@Immutable
public final class NtlmChallengeHeader {
  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();
  private static final BaseEncoding BASE64 = BaseEncoding.base64();

  @Nonnull private final String payload;

  private NtlmChallengeHeader(String payload) {
    this.payload = payload;
  }

  /**
   * Picks the NTLM challenge out of a 401 response's WWW-Authenticate headers.
   * The first value with the NTLM scheme wins, even if a later one has a
   * payload.
   *
   * @param headers The response's WWW-Authenticate headers, in order.
   * @return The selected challenge, whose payload is non-empty.
   * @throws NtlmAuthenticationException if there are no headers, or none of
   *     them has the NTLM scheme.
   * @throws EmptyNtlmChallengeException if the selected value has no payload.
   */
  public static NtlmChallengeHeader select(@Nullable Header[] headers)
      throws NtlmAuthenticationException {
    if (headers == null || headers.length == 0) {
      throw new NtlmAuthenticationException("WWW-Authenticate header missing");
    }
    for (Header header : headers) {
      String payload = parsePayload(header.getValue());
      if (payload == null) {
        continue;
      }
      if (payload.isEmpty()) {
        throw new EmptyNtlmChallengeException();
      }
      return new NtlmChallengeHeader(payload);
    }
    throw new NtlmAuthenticationException("wrong WWW-Authenticate header");
  }

  /**
   * Extracts the NTLM payload of a single header value.
   *
   * @param value A WWW-Authenticate header value.
   * @return The trimmed payload, empty if there is none, or null if the value
   *     doesn't have the NTLM scheme.
   */
  @VisibleForTesting
  @Nullable
  static String parsePayload(@Nullable String value) {
    if (value == null) {
      return null;
    }
    String trimmed = WHITESPACE.trimLeadingFrom(value);
    String scheme = HttpUtil.NTLM_AUTH_SCHEME;
    if (!trimmed.startsWith(scheme)) {
      return null;
    }
    String rest = trimmed.substring(scheme.length());
    if (!rest.isEmpty() && !WHITESPACE.matches(rest.charAt(0))) {
      // Some other scheme that starts with the same letters.
      return null;
    }
    return WHITESPACE.trimFrom(rest);
  }

  /**
   * @return The challenge's base64 payload.
   */
  public String getPayload() {
    return payload;
  }

  /**
   * Decodes the challenge's payload.
   *
   * @return The raw Challenge message.
   * @throws NtlmAuthenticationException if the payload isn't valid base64.
   */
  public byte[] decode()
      throws NtlmAuthenticationException {
    try {
      return BASE64.decode(payload);
    } catch (IllegalArgumentException e) {
      throw new NtlmAuthenticationException("Could not decode NTLM challenge: " + payload, e);
    }
  }

  /**
   * Makes the Authorization header value that carries an NTLM message.
   *
   * @param message The raw message.
   * @return The header value, {@code NTLM <base64>}.
   */
  public static String makeAuthorizationValue(byte[] message) {
    Preconditions.checkNotNull(message);
    return HttpUtil.NTLM_AUTH_SCHEME + " " + BASE64.encode(message);
  }

  @Override
  public String toString() {
    return HttpUtil.NTLM_AUTH_SCHEME + " " + payload;
  }
}
