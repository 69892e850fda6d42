// Copyright 2009 Google Inc.
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

package com.google.enterprise.httpntlm.common;

/**
 * HTTP constants shared by the transports.
 */
public final class HttpUtil {

  // Don't instantiate.
  private HttpUtil() {
    throw new UnsupportedOperationException();
  }

  public static final String HTTP_METHOD_GET = "GET";

  public static final String HTTP_HEADER_AUTHORIZATION = "Authorization";
  public static final String HTTP_HEADER_USER_AGENT = "User-Agent";
  public static final String HTTP_HEADER_WWW_AUTHENTICATE = "WWW-Authenticate";

  public static final int HTTP_STATUS_UNAUTHORIZED = 401;

  /** The authentication scheme token of NTLM, matched case-sensitively. */
  public static final String NTLM_AUTH_SCHEME = "NTLM";

  public static final String USER_AGENT = "HttpNtlm";
}
