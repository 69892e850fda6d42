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

/**
 * Thrown when an NTLM handshake can't be completed because the server's
 * answers don't have the expected shape, or because the NTLM engine rejects
 * them.
 */
public class NtlmAuthenticationException extends IOException {

  public NtlmAuthenticationException(String message) {
    super(message);
  }

  public NtlmAuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}
