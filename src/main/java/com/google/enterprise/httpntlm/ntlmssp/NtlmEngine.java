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

import java.security.GeneralSecurityException;

/**
 * A source of NTLM messages and client sessions.  An engine is stateless; all
 * per-handshake state lives in the {@link NtlmClientSession}s it creates.
 */
public interface NtlmEngine {

  /**
   * @return A new Negotiate message announcing what this engine supports.
   */
  NtlmNegotiate createNegotiateMessage();

  /**
   * Creates a fresh client session.
   *
   * @param version The protocol version the session will use.
   * @param mode The session's mode.
   * @return A new session, with no user info and no challenge.
   * @throws GeneralSecurityException if the engine can't support such a session.
   */
  NtlmClientSession createClientSession(NtlmVersion version, NtlmMode mode)
      throws GeneralSecurityException;

  /**
   * Parses the wire form of a Challenge message.
   *
   * @param message The raw message bytes.
   * @return The decoded message.
   * @throws GeneralSecurityException if the message is malformed.
   */
  NtlmChallenge parseChallengeMessage(byte[] message)
      throws GeneralSecurityException;
}
