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

import java.util.Arrays;
import junit.framework.TestCase;

/**
 * Unit tests to ensure that NTLM messages are properly encoded.
 */
public final class NtlmMessageEncoderTest extends TestCase {
  private static final int PAYLOAD_HEADER_LENGTH = 8;
  private static final byte[] EMPTY = new byte[0];
  private static final byte[] EXPECTED =
      new byte[] { 0x01, 0x02, 0x03, 0x04, 0x05, 0x06, 0x07 };

  public void testWrite8Ranges() {
    tryGoodRangeWrite8(0);
    tryGoodRangeWrite8(127);
    tryGoodRangeWrite8(255);
    tryBadRangeWrite8(256);
    tryBadRangeWrite8(-1);
  }

  private void tryGoodRangeWrite8(int n) {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    encoder.write8(n);
    byte[] bytes = encoder.getBytes();
    assertEquals(1, bytes.length);
    assertEquals(n, bytes[0] & 0xff);
  }

  private void tryBadRangeWrite8(int n) {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    try {
      encoder.write8(n);
      fail("Method should have signalled exception");
    } catch (IllegalArgumentException e) {
      // pass
    }
  }

  public void testWrite16Ranges() {
    tryGoodRangeWrite16(0);
    tryGoodRangeWrite16(0x7fff);
    tryGoodRangeWrite16(0x8000);
    tryGoodRangeWrite16(0xffff);
    tryBadRangeWrite16(0x10000);
    tryBadRangeWrite16(-1);
    tryBadRangeWrite16(-0x8001);
  }

  private void tryGoodRangeWrite16(int n) {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    encoder.write16(n);
    byte[] bytes = encoder.getBytes();
    assertEquals(2, bytes.length);
    assertEquals(n & 0xff, bytes[0] & 0xff);
    assertEquals((n >> 8) & 0xff, bytes[1] & 0xff);
  }

  private void tryBadRangeWrite16(int n) {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    try {
      encoder.write16(n);
      fail("Method should have signalled exception");
    } catch (IllegalArgumentException e) {
      // pass
    }
  }

  public void testWrite32Encoding() {
    tryWrite32Encoding(0);
    tryWrite32Encoding(0x7fffffff);
    tryWrite32Encoding(0x80000000);
    tryWrite32Encoding(-1);
  }

  private void tryWrite32Encoding(int n) {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    encoder.write32(n);
    byte[] bytes = encoder.getBytes();
    assertEquals(4, bytes.length);
    assertEquals(n & 0xff, bytes[0] & 0xff);
    assertEquals((n >> 8) & 0xff, bytes[1] & 0xff);
    assertEquals((n >> 16) & 0xff, bytes[2] & 0xff);
    assertEquals((n >> 24) & 0xff, bytes[3] & 0xff);
  }

  public void testWriteIntCombo() {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    encoder.write8(0x01);
    encoder.write16(0x0302);
    encoder.write32(0x07060504);
    assertTrue(Arrays.equals(EXPECTED, encoder.getBytes()));
  }

  public void testWriteBytesNull() {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    encoder.writeBytes(null);
    assertEquals(0, encoder.getBytes().length);
  }

  public void testWritePayloadNull() {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    encoder.writePayload(null);
    byte[] encoded = encoder.getBytes();
    assertEquals(PAYLOAD_HEADER_LENGTH, encoded.length);
    checkPayloadHeader(0, 0, PAYLOAD_HEADER_LENGTH, encoded, 0);
  }

  public void testWritePayloadEmpty() {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    encoder.writePayload(EMPTY);
    byte[] encoded = encoder.getBytes();
    assertEquals(PAYLOAD_HEADER_LENGTH, encoded.length);
    checkPayloadHeader(0, 0, PAYLOAD_HEADER_LENGTH, encoded, 0);
  }

  public void testWritePayloadSimple() {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    encoder.writePayload(EXPECTED);
    byte[] encoded = encoder.getBytes();
    assertEquals(PAYLOAD_HEADER_LENGTH + EXPECTED.length, encoded.length);
    checkPayloadHeader(EXPECTED.length, EXPECTED.length, PAYLOAD_HEADER_LENGTH, encoded, 0);
    checkBytes(EXPECTED, encoded, PAYLOAD_HEADER_LENGTH);
  }

  // Offsets are rebased past the whole header, including fields written after
  // the payload reference.
  public void testWritePayloadThenHeader() {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    encoder.writePayload(EXPECTED);
    encoder.write32(0);
    byte[] encoded = encoder.getBytes();
    int headerLength = PAYLOAD_HEADER_LENGTH + 4;
    assertEquals(headerLength + EXPECTED.length, encoded.length);
    checkPayloadHeader(EXPECTED.length, EXPECTED.length, headerLength, encoded, 0);
    checkBytes(EXPECTED, encoded, headerLength);
  }

  private void checkPayloadHeader(int j, int k, int l, byte[] actual, int offset) {
    assertEquals(j & 0xff, actual[offset++]);
    assertEquals((j >> 8) & 0xff, actual[offset++]);
    assertEquals(k & 0xff, actual[offset++]);
    assertEquals((k >> 8) & 0xff, actual[offset++]);
    assertEquals(l & 0xff, actual[offset++]);
    assertEquals((l >> 8) & 0xff, actual[offset++]);
    assertEquals((l >> 16) & 0xff, actual[offset++]);
    assertEquals((l >> 24) & 0xff, actual[offset++]);
  }

  private void checkBytes(byte[] expected, byte[] actual, int offset) {
    for (byte b : expected) {
      assertEquals(b, actual[offset++]);
    }
  }
}
