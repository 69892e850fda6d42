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
import com.google.common.io.BaseEncoding;
import java.util.List;
import junit.framework.TestCase;

/**
 * Unit tests for {@link AvPair}.
 */
public final class AvPairTest extends TestCase {
  private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

  // The target info of the MS-NLMP NTLMv2 sample exchange.
  private static final String SAMPLE_TARGET_INFO =
      "02000c0044006f006d00610069006e00"
      + "01000c005300650072007600650072000000"
      + "0000";

  public void testEncodeSample() {
    List<AvPair> pairs = ImmutableList.of(
        AvPair.makeString(AvPair.MsvAv.NETBIOS_DOMAIN_NAME, "Domain"),
        AvPair.makeString(AvPair.MsvAv.NETBIOS_COMPUTER_NAME, "Server"));
    assertEquals(SAMPLE_TARGET_INFO, HEX.encode(AvPair.encode(pairs)));
  }

  public void testDecodeSample()
      throws MalformedNtlmMessageException {
    List<AvPair> pairs = AvPair.decode(HEX.decode(SAMPLE_TARGET_INFO));
    assertEquals(2, pairs.size());
    assertEquals(AvPair.MsvAv.NETBIOS_DOMAIN_NAME, pairs.get(0).getType());
    assertEquals("Domain", pairs.get(0).getStringValue());
    assertEquals("Server", pairs.get(1).getStringValue());
  }

  public void testEncodeDecodeAllKinds()
      throws MalformedNtlmMessageException {
    List<AvPair> pairs = ImmutableList.of(
        AvPair.makeString(AvPair.MsvAv.DNS_DOMAIN_NAME, "mydomain.com"),
        AvPair.makeFlags(0x00000002),
        AvPair.makeTimestamp(130000000000000000L),
        AvPair.makeBytes(AvPair.MsvAv.CHANNEL_BINDINGS, new byte[16]));
    assertEquals(pairs, AvPair.decode(AvPair.encode(pairs)));
  }

  public void testFindTimestamp()
      throws MalformedNtlmMessageException {
    long fileTime = 0x01cc8c3d1ad0c000L;
    List<AvPair> pairs = AvPair.decode(AvPair.encode(ImmutableList.of(
        AvPair.makeString(AvPair.MsvAv.NETBIOS_DOMAIN_NAME, "Domain"),
        AvPair.makeTimestamp(fileTime))));
    AvPair timestamp = AvPair.find(pairs, AvPair.MsvAv.TIMESTAMP);
    assertNotNull(timestamp);
    assertEquals("00c0d01a3d8ccc01", HEX.encode(timestamp.getBytesValue()));
    assertNull(AvPair.find(pairs, AvPair.MsvAv.DNS_TREE_NAME));
    assertNull(AvPair.find(null, AvPair.MsvAv.TIMESTAMP));
  }

  public void testDecodeUnknownId() {
    tryBadBlock("ff00000000000000");
  }

  public void testDecodeMissingEol() {
    tryBadBlock("02000400440000");
  }

  public void testDecodeBadFlagsLength() {
    tryBadBlock("0600020000000000");
  }

  private void tryBadBlock(String hex) {
    try {
      AvPair.decode(HEX.decode(hex));
      fail("Expected to see exception");
    } catch (MalformedNtlmMessageException e) {
      // pass
    }
  }

  public void testWrongValueKind() {
    try {
      AvPair.makeString(AvPair.MsvAv.TIMESTAMP, "now");
      fail("Expected to see exception");
    } catch (IllegalArgumentException e) {
      // pass
    }
    try {
      AvPair.makeFlags(1).getStringValue();
      fail("Expected to see exception");
    } catch (IllegalStateException e) {
      // pass
    }
  }
}
