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

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * An NTLM AV_PAIR structure.  A list of these makes up the target info that
 * an NTLMv2 server sends in its Challenge message, and that the client echoes
 * back inside its NTLMv2 response.
 *
 * See http://msdn.microsoft.com/en-us/library/cc236646 for details.
 */
@Immutable
public final class AvPair extends NtlmBase {

  /**
   * The AvId of a pair; its ordinal is the wire value.  Determines how the
   * value of the pair is interpreted.
   */
  public enum MsvAv {
    EOL,
    NETBIOS_COMPUTER_NAME,
    NETBIOS_DOMAIN_NAME,
    DNS_COMPUTER_NAME,
    DNS_DOMAIN_NAME,
    DNS_TREE_NAME,
    FLAGS,
    TIMESTAMP,
    SINGLE_HOST,
    TARGET_NAME,
    CHANNEL_BINDINGS;

    public boolean hasNoValue() {
      return this == EOL;
    }

    public boolean hasStringValue() {
      return this == NETBIOS_COMPUTER_NAME
          || this == NETBIOS_DOMAIN_NAME
          || this == DNS_COMPUTER_NAME
          || this == DNS_DOMAIN_NAME
          || this == DNS_TREE_NAME
          || this == TARGET_NAME;
    }

    public boolean hasIntValue() {
      return this == FLAGS;
    }

    public boolean hasBytesValue() {
      return this == TIMESTAMP
          || this == SINGLE_HOST
          || this == CHANNEL_BINDINGS;
    }

    static MsvAv decode(int raw)
        throws MalformedNtlmMessageException {
      MsvAv[] values = values();
      if (raw < 0 || raw >= values.length) {
        throw new MalformedNtlmMessageException("Unknown AvId: " + raw);
      }
      return values[raw];
    }
  }

  @Nonnull private final MsvAv type;
  @Nullable private final String stringValue;
  private final int intValue;
  @Nullable private final byte[] bytesValue;

  private AvPair(MsvAv type, String stringValue, int intValue, byte[] bytesValue) {
    this.type = type;
    this.stringValue = stringValue;
    this.intValue = intValue;
    this.bytesValue = bytesValue;
  }

  public MsvAv getType() {
    return type;
  }

  /**
   * Make an AvPair with a string value.
   *
   * @param type The type of the pair to make.
   * @param stringValue The value for the pair to have.
   * @return A pair of that type with the given value.
   * @throws IllegalArgumentException if the type doesn't have a string value.
   */
  public static AvPair makeString(@Nonnull MsvAv type, @Nonnull String stringValue) {
    Preconditions.checkNotNull(type);
    Preconditions.checkArgument(type.hasStringValue());
    Preconditions.checkNotNull(stringValue);
    return new AvPair(type, stringValue, 0, null);
  }

  /**
   * Make an AvPair with a bytes value.
   *
   * @param type The type of the pair to make.
   * @param bytesValue The value for the pair to have.
   * @return A pair of that type with the given value.
   * @throws IllegalArgumentException if the type doesn't have a bytes value.
   */
  public static AvPair makeBytes(@Nonnull MsvAv type, @Nonnull byte[] bytesValue) {
    Preconditions.checkNotNull(type);
    Preconditions.checkArgument(type.hasBytesValue());
    Preconditions.checkNotNull(bytesValue);
    return new AvPair(type, null, 0, copyBytes(bytesValue));
  }

  /**
   * Make a "flags" AvPair.
   *
   * @param flags The flags that the pair will have.
   * @return A "flags" pair.
   */
  public static AvPair makeFlags(int flags) {
    return new AvPair(MsvAv.FLAGS, null, flags, null);
  }

  /**
   * Make a timestamp AvPair.
   *
   * @param fileTime A Windows FILETIME: 100ns intervals since January 1, 1601 UTC.
   * @return A timestamp pair.
   */
  public static AvPair makeTimestamp(long fileTime) {
    return new AvPair(MsvAv.TIMESTAMP, null, 0, NtlmCrypto.encodeFileTime(fileTime));
  }

  private static AvPair makeEol() {
    return new AvPair(MsvAv.EOL, null, 0, null);
  }

  public boolean isEol() {
    return type == MsvAv.EOL;
  }

  /**
   * @throws IllegalStateException if the pair doesn't have a string value.
   */
  public String getStringValue() {
    Preconditions.checkState(type.hasStringValue());
    return stringValue;
  }

  /**
   * @throws IllegalStateException if the pair doesn't have an integer value.
   */
  public int getIntValue() {
    Preconditions.checkState(type.hasIntValue());
    return intValue;
  }

  /**
   * @throws IllegalStateException if the pair doesn't have a bytes value.
   */
  public byte[] getBytesValue() {
    Preconditions.checkState(type.hasBytesValue());
    return copyBytes(bytesValue);
  }

  /**
   * Finds the first pair of a given type.
   *
   * @param pairs The pairs to search; may be null.
   * @param type The type to look for.
   * @return The first pair with that type, or null if there isn't one.
   */
  @Nullable
  public static AvPair find(@Nullable List<AvPair> pairs, MsvAv type) {
    if (pairs != null) {
      for (AvPair pair : pairs) {
        if (pair.getType() == type) {
          return pair;
        }
      }
    }
    return null;
  }

  // The encoded form of an AvPair is:
  // AvId (2 bytes)
  // AvLen (2 bytes)
  // Value (AvLen bytes)
  // A list is terminated by an EOL pair.

  static List<AvPair> decode(@Nonnull byte[] block)
      throws MalformedNtlmMessageException {
    Preconditions.checkNotNull(block);
    NtlmMessageDecoder decoder = NtlmMessageDecoder.make(block);
    List<AvPair> pairs = Lists.newArrayList();
    while (true) {
      AvPair pair = decodePair(decoder);
      if (pair.isEol()) {
        break;
      }
      pairs.add(pair);
    }
    // Some servers pad the block after the EOL; anything there is ignored.
    return pairs;
  }

  private static AvPair decodePair(NtlmMessageDecoder decoder)
      throws MalformedNtlmMessageException {
    MsvAv type = MsvAv.decode(decoder.read16());
    int avLen = decoder.read16();
    if (type.hasNoValue()) {
      decoder.skip(avLen);
      return makeEol();
    }
    if (type.hasIntValue()) {
      if (avLen != 4) {
        throw new MalformedNtlmMessageException("Length must be 4: " + avLen);
      }
      return makeFlags(decoder.read32());
    }
    if (type.hasStringValue()) {
      return makeString(type, decodeString(decoder.readBytes(avLen), UNICODE_CHARSET));
    }
    return makeBytes(type, decoder.readBytes(avLen));
  }

  static byte[] encode(@Nonnull List<AvPair> pairs) {
    Preconditions.checkNotNull(pairs);
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    for (AvPair pair : pairs) {
      Preconditions.checkArgument(!pair.isEol(), "EOL is added by the encoder");
      pair.encode(encoder);
    }
    makeEol().encode(encoder);
    return encoder.getBytes();
  }

  private void encode(NtlmMessageEncoder encoder) {
    encoder.write16(type.ordinal());
    if (type.hasNoValue()) {
      encoder.write16(0);
    } else if (type.hasIntValue()) {
      encoder.write16(4);
      encoder.write32(intValue);
    } else if (type.hasStringValue()) {
      byte[] encoded = encodeUnicodeString(stringValue);
      encoder.write16(encoded.length);
      encoder.writeBytes(encoded);
    } else {
      encoder.write16(bytesValue.length);
      encoder.writeBytes(bytesValue);
    }
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof AvPair)) { return false; }
    AvPair other = (AvPair) object;
    return type == other.type
        && Objects.equals(stringValue, other.stringValue)
        && intValue == other.intValue
        && Arrays.equals(bytesValue, other.bytesValue);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, stringValue, intValue, Arrays.hashCode(bytesValue));
  }

  @Override
  public String toString() {
    if (type.hasStringValue()) {
      return type + "=" + stringValue;
    }
    if (type.hasIntValue()) {
      return type + "=" + Integer.toHexString(intValue);
    }
    return type.toString();
  }
}
