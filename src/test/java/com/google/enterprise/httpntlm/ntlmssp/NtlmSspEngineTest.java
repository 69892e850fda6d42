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
import java.util.Collections;
import java.util.EnumSet;
import junit.framework.TestCase;

/**
 * Unit tests for {@link NtlmSspEngine}.
 */
public final class NtlmSspEngineTest extends TestCase {
  private final NtlmEngine engine = new NtlmSspEngine();

  public void testNegotiateMessage()
      throws MalformedNtlmMessageException {
    NtlmNegotiate negotiate = engine.createNegotiateMessage();
    assertEquals(NtlmSspEngine.NEGOTIATE_FLAGS, negotiate.getFlags());
    assertNull(negotiate.getDomainName());
    assertNull(negotiate.getWorkstationName());
    assertEquals(negotiate, NtlmNegotiate.decode(negotiate.encode()));
  }

  public void testCreateSession()
      throws GeneralSecurityException {
    NtlmClientSession session = engine.createClientSession(NtlmVersion.V2, NtlmMode.CONNECTIONLESS);
    assertTrue(session instanceof NtlmClient);
    assertEquals(NtlmVersion.V2, ((NtlmClient) session).getVersion());
    assertEquals(NtlmMode.CONNECTIONLESS, ((NtlmClient) session).getMode());
    assertNotSame(session, engine.createClientSession(NtlmVersion.V2, NtlmMode.CONNECTIONLESS));
  }

  public void testParseGarbage() {
    try {
      engine.parseChallengeMessage(new byte[] { 'N', 'T', 'L', 'M' });
      fail("Expected to see exception");
    } catch (GeneralSecurityException e) {
      // pass
    }
  }

  public void testParseNegotiateAsChallenge() {
    try {
      engine.parseChallengeMessage(engine.createNegotiateMessage().encode());
      fail("Expected to see exception");
    } catch (GeneralSecurityException e) {
      // pass
    }
  }

  public void testExchange()
      throws GeneralSecurityException {
    byte[] challenge = NtlmChallenge.make("DOMAIN",
        EnumSet.of(NtlmSspFlag.NEGOTIATE_UNICODE, NtlmSspFlag.NEGOTIATE_NTLM,
            NtlmSspFlag.REQUEST_TARGET, NtlmSspFlag.NEGOTIATE_TARGET_INFO),
        NtlmCrypto.generateNonce(NtlmChallenge.SERVER_CHALLENGE_LENGTH),
        Collections.<AvPair>emptyList(), null)
        .encode();
    NtlmClientSession session = engine.createClientSession(NtlmVersion.V2, NtlmMode.CONNECTIONLESS);
    session.setUserInfo("mememe", "mineminemine", "MYDOMAIN", "MYWORKSTATION");
    session.processChallengeMessage(engine.parseChallengeMessage(challenge));
    NtlmAuthenticate authenticate =
        NtlmAuthenticate.decode(session.generateAuthenticateMessage().encode(), false);
    assertEquals("MYDOMAIN", authenticate.getDomainName());
    assertEquals("mememe", authenticate.getUserName());
    assertEquals("MYWORKSTATION", authenticate.getWorkstationName());
    assertEquals(24, authenticate.getLmChallengeResponse().length);
    assertTrue(authenticate.getNtChallengeResponse().length > 24);
  }
}
