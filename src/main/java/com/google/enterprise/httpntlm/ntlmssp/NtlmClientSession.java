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

import javax.annotation.Nullable;

/**
 * The client side of a single NTLM handshake.  A session processes one
 * Challenge message and generates one Authenticate message; it can't be reused.
 */
public interface NtlmClientSession {

  /**
   * Sets the identity the session authenticates as.  Must be called before
   * {@link #generateAuthenticateMessage}.
   *
   * @param userName The user name.
   * @param password The user's password.
   * @param domainName The user's domain; may be null.
   * @param workstationName The client's workstation name; may be null.
   */
  void setUserInfo(String userName, String password, @Nullable String domainName,
      @Nullable String workstationName);

  /**
   * Records the server's Challenge message.
   *
   * @param challenge The Challenge message received from the server.
   * @throws GeneralSecurityException if the challenge can't be answered.
   * @throws IllegalStateException if a challenge was already processed.
   */
  void processChallengeMessage(NtlmChallenge challenge)
      throws GeneralSecurityException;

  /**
   * Computes the answer to the processed challenge.
   *
   * @return The Authenticate message.
   * @throws GeneralSecurityException if there's a crypto library error.
   * @throws IllegalStateException if there's no challenge or no user info, or
   *     if the message was already generated.
   */
  NtlmAuthenticate generateAuthenticateMessage()
      throws GeneralSecurityException;
}
