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

import com.google.common.base.Preconditions;
import javax.inject.Inject;
import com.google.inject.Singleton;

import java.security.GeneralSecurityException;
import java.util.EnumSet;

import javax.annotation.concurrent.ThreadSafe;

/**
 * The built-in NTLM engine.  Its Negotiate message supplies neither domain nor
 * workstation, so the same message serves every set of credentials.
 */
@Singleton
@ThreadSafe
public final class NtlmSspEngine implements NtlmEngine {

  static final EnumSet<NtlmSspFlag> NEGOTIATE_FLAGS =
      EnumSet.of(
          NtlmSspFlag.NEGOTIATE_UNICODE,
          NtlmSspFlag.NEGOTIATE_OEM,
          NtlmSspFlag.REQUEST_TARGET,
          NtlmSspFlag.NEGOTIATE_NTLM,
          NtlmSspFlag.NEGOTIATE_ALWAYS_SIGN,
          NtlmSspFlag.NEGOTIATE_EXTENDED_SESSION_SECURITY,
          NtlmSspFlag.NEGOTIATE_128,
          NtlmSspFlag.NEGOTIATE_56);

  @Inject
  public NtlmSspEngine() {
  }

  @Override
  public NtlmNegotiate createNegotiateMessage() {
    return NtlmNegotiate.make(NEGOTIATE_FLAGS, null, null, null);
  }

  @Override
  public NtlmClientSession createClientSession(NtlmVersion version, NtlmMode mode)
      throws GeneralSecurityException {
    Preconditions.checkNotNull(version);
    Preconditions.checkNotNull(mode);
    NtlmCrypto.checkAlgorithms(version);
    return NtlmClient.builder(version, mode)
        .setNegotiateFlags(NEGOTIATE_FLAGS)
        .build();
  }

  @Override
  public NtlmChallenge parseChallengeMessage(byte[] message)
      throws GeneralSecurityException {
    Preconditions.checkNotNull(message);
    return NtlmChallenge.decode(message);
  }
}
