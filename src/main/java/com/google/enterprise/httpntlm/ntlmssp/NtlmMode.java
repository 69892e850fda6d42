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

package com.google.enterprise.httpntlm.ntlmssp;

/**
 * How an NTLM session relates to its transport.  HTTP authentication is
 * connectionless: each Authenticate message answers the Challenge it follows,
 * with no negotiated state carried over from the Negotiate message.
 */
public enum NtlmMode {
  CONNECTION_ORIENTED,
  CONNECTIONLESS
}
