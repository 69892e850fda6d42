// Copyright 2010 Google Inc.
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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import junit.framework.TestCase;

/**
 * Unit tests for the NTLM Challenge message.
 */
public final class NtlmChallengeTest extends TestCase {
  private static final String DOMAIN_NAME = "MYDOMAIN.COM";
  private static final List<AvPair> TARGET_INFO = ImmutableList.of(
      AvPair.makeString(AvPair.MsvAv.NETBIOS_DOMAIN_NAME, "MYDOMAIN"),
      AvPair.makeString(AvPair.MsvAv.DNS_COMPUTER_NAME, "server.mydomain.com"),
      AvPair.makeTimestamp(130000000000000000L));

  public void testEncodeDecode()
      throws MalformedNtlmMessageException {
    NtlmChallenge message
        = NtlmChallenge.make(DOMAIN_NAME, EnumSet.of(NtlmSspFlag.NEGOTIATE_UNICODE),
            NtlmCrypto.generateNonce(8), null, null);
    assertTrue(message.containsFlag(NtlmSspFlag.REQUEST_TARGET));
    NtlmChallenge decoded = NtlmChallenge.decode(message.encode());
    assertEquals(message, decoded);
  }

  public void testEncodeDecodeWithTargetInfo()
      throws MalformedNtlmMessageException {
    NtlmChallenge message
        = NtlmChallenge.make(DOMAIN_NAME,
            EnumSet.of(NtlmSspFlag.NEGOTIATE_UNICODE, NtlmSspFlag.TARGET_TYPE_DOMAIN),
            NtlmCrypto.generateNonce(8), TARGET_INFO,
            NtlmSspVersion.make(6, 1, 7601, NtlmSspVersion.NTLMSSP_REVISION_W2K3));
    assertTrue(message.containsFlag(NtlmSspFlag.NEGOTIATE_TARGET_INFO));
    assertTrue(message.containsFlag(NtlmSspFlag.NEGOTIATE_VERSION));
    NtlmChallenge decoded = NtlmChallenge.decode(message.encode());
    assertEquals(message, decoded);
    assertEquals(TARGET_INFO, decoded.getTargetInfo());
    assertEquals(6, decoded.getVersionInfo().getMajor());
  }

  public void testDecodeOemTargetName()
      throws MalformedNtlmMessageException {
    NtlmChallenge message
        = NtlmChallenge.make(DOMAIN_NAME, EnumSet.of(NtlmSspFlag.NEGOTIATE_OEM),
            new byte[8], null, null);
    assertEquals(DOMAIN_NAME, NtlmChallenge.decode(message.encode()).getTargetName());
  }

  // Servers that predate target info send a 32-byte message.
  public void testDecodeShortMessage()
      throws MalformedNtlmMessageException {
    byte[] serverChallenge = NtlmCrypto.generateNonce(8);
    byte[] encoded = NtlmChallenge.make(null,
        EnumSet.of(NtlmSspFlag.NEGOTIATE_UNICODE, NtlmSspFlag.NEGOTIATE_TARGET_INFO),
        serverChallenge, ImmutableList.<AvPair>of(), null).encode();
    byte[] truncated = Arrays.copyOf(encoded, 32);
    NtlmChallenge decoded = NtlmChallenge.decode(truncated);
    assertTrue(Arrays.equals(serverChallenge, decoded.getServerChallenge()));
    assertNull(decoded.getTargetInfo());
    assertFalse(decoded.containsFlag(NtlmSspFlag.NEGOTIATE_TARGET_INFO));
  }

  public void testDecodeGarbage() {
    tryBadChallenge(new byte[0]);
    tryBadChallenge("NTLMSSP".getBytes());
    tryBadChallenge(new byte[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12 });
  }

  public void testDecodeTruncated() {
    byte[] encoded = NtlmChallenge.make(DOMAIN_NAME, EnumSet.of(NtlmSspFlag.NEGOTIATE_UNICODE),
        new byte[8], TARGET_INFO, null).encode();
    tryBadChallenge(Arrays.copyOf(encoded, encoded.length - 4));
  }

  // Offsets near Integer.MAX_VALUE must not wrap around the bounds check.
  public void testDecodeHugeTargetNameOffset() {
    byte[] encoded = NtlmChallenge.make(DOMAIN_NAME, EnumSet.of(NtlmSspFlag.NEGOTIATE_UNICODE),
        new byte[8], null, null).encode();
    tryBadChallenge(withPayloadHeader(Arrays.copyOf(encoded, 32), 12, 1, 0x7fffffff));
  }

  public void testDecodeHugeTargetInfoOffset() {
    byte[] encoded = NtlmChallenge.make(null, EnumSet.of(NtlmSspFlag.NEGOTIATE_UNICODE),
        new byte[8], TARGET_INFO, null).encode();
    tryBadChallenge(withPayloadHeader(encoded, 40, 4, 0x7ffffffe));
  }

  public void testTargetInfoBytes()
      throws MalformedNtlmMessageException {
    NtlmChallenge message = NtlmChallenge.make(null, EnumSet.of(NtlmSspFlag.NEGOTIATE_UNICODE),
        new byte[8], TARGET_INFO, null);
    assertTrue(Arrays.equals(AvPair.encode(TARGET_INFO), message.getTargetInfoBytes()));
    assertTrue(Arrays.equals(AvPair.encode(TARGET_INFO),
        NtlmChallenge.decode(message.encode()).getTargetInfoBytes()));
    assertNull(NtlmChallenge.make(null, EnumSet.of(NtlmSspFlag.NEGOTIATE_UNICODE),
            new byte[8], null, null)
        .getTargetInfoBytes());
  }

  // Overwrites the (length, maximum length, offset) triple at index.
  static byte[] withPayloadHeader(byte[] message, int index, int length, int offset) {
    byte[] result = message.clone();
    result[index] = (byte) length;
    result[index + 1] = (byte) (length >> 8);
    result[index + 2] = (byte) length;
    result[index + 3] = (byte) (length >> 8);
    for (int i = 0; i < 4; i++) {
      result[index + 4 + i] = (byte) (offset >> (8 * i));
    }
    return result;
  }

  private void tryBadChallenge(byte[] encoded) {
    try {
      NtlmChallenge.decode(encoded);
      fail("Expected to see exception");
    } catch (MalformedNtlmMessageException e) {
      // pass
    }
  }

  public void testServerChallengeLength() {
    try {
      NtlmChallenge.make(null, EnumSet.of(NtlmSspFlag.NEGOTIATE_UNICODE), new byte[7], null, null);
      fail("Expected to see exception");
    } catch (IllegalArgumentException e) {
      // pass
    }
  }
}
