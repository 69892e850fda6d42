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

import java.io.IOException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.protocol.HttpContext;

/**
 * A single HTTP round trip: a request goes in, a response comes out.  This
 * allows HTTP transport to be mocked for testing, and lets transports wrap
 * each other.
 */
@ParametersAreNonnullByDefault
public interface HttpTransport {
  /**
   * Sends a request and returns its response.  The caller owns the response
   * and must close it.
   *
   * @param request The request to send.
   * @param context The exchange context, which carries cookies and connection
   *     state from one request to the next; may be null.
   * @return The response.
   * @throws IOException if the request can't be sent or the response can't be read.
   */
  @Nonnull
  CloseableHttpResponse execute(HttpUriRequest request, @Nullable HttpContext context)
      throws IOException;
}
