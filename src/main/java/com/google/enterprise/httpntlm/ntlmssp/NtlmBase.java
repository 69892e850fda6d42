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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_16LE;

import com.google.common.base.Preconditions;

import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A base class for NTLM message processing.  Holds the constants shared by the
 * message classes, and the helpers they use to encode and decode the common
 * message fields.
 */
@Immutable
abstract class NtlmBase {

  // "NTLMSSP\0" in US-ASCII encoding.
  protected static final byte[] NTLMSSP_SIGNATURE =
      new byte[] { 0x4e, 0x54, 0x4c, 0x4d, 0x53, 0x53, 0x50, 0x00 };

  protected static final byte[] RESERVED_8_BYTES = new byte[8];

  protected static final Charset UNICODE_CHARSET = UTF_16LE;
  protected static final Charset OEM_CHARSET = chooseOemCharset();

  private static Charset chooseOemCharset() {
    return Charset.isSupported("Cp850") ? Charset.forName("Cp850") : US_ASCII;
  }

  protected static void checkSignature(NtlmMessageDecoder decoder)
      throws MalformedNtlmMessageException {
    if (!Arrays.equals(NTLMSSP_SIGNATURE, decoder.readBytes(NTLMSSP_SIGNATURE.length))) {
      throw new MalformedNtlmMessageException("Message missing NTLM signature");
    }
  }

  protected static void encodeSignature(NtlmMessageEncoder encoder) {
    encoder.writeBytes(NTLMSSP_SIGNATURE);
  }

  protected static void checkMessageType(NtlmMessageDecoder decoder, NtlmMessageType type)
      throws MalformedNtlmMessageException {
    int actual = decoder.read32();
    if (actual != type.getCode()) {
      throw new MalformedNtlmMessageException("Incorrect NTLM message type: " + actual
          + " expected: " + type.getCode());
    }
  }

  protected static void encodeMessageType(NtlmMessageType type, NtlmMessageEncoder encoder) {
    encoder.write32(type.getCode());
  }

  protected static EnumSet<NtlmSspFlag> decodeFlags(NtlmMessageDecoder decoder)
      throws MalformedNtlmMessageException {
    return NtlmSspFlag.fromBits(decoder.read32());
  }

  protected static void encodeFlags(EnumSet<NtlmSspFlag> flags, NtlmMessageEncoder encoder) {
    encoder.write32(NtlmSspFlag.toBits(flags));
  }

  protected static String decodeString(@Nullable byte[] raw, EnumSet<NtlmSspFlag> flags)
      throws MalformedNtlmMessageException {
    Charset charset = getCharset(flags);
    if (charset == null) {
      throw new MalformedNtlmMessageException(
          "Must specify either NEGOTIATE_UNICODE or NEGOTIATE_OEM");
    }
    return decodeString(raw, charset);
  }

  protected static String decodeString(@Nullable byte[] raw, Charset charset) {
    return (raw != null) ? new String(raw, charset) : null;
  }

  protected static byte[] encodeString(@Nullable String string, EnumSet<NtlmSspFlag> flags) {
    Charset charset = getCharset(flags);
    Preconditions.checkArgument(charset != null,
        "Must specify either NEGOTIATE_UNICODE or NEGOTIATE_OEM");
    return (charset == UNICODE_CHARSET)
        ? encodeUnicodeString(string)
        : encodeOemString(string);
  }

  @Nullable
  private static Charset getCharset(EnumSet<NtlmSspFlag> flags) {
    if (flags.contains(NtlmSspFlag.NEGOTIATE_UNICODE)) {
      return UNICODE_CHARSET;
    }
    if (flags.contains(NtlmSspFlag.NEGOTIATE_OEM)) {
      return OEM_CHARSET;
    }
    return null;
  }

  protected static byte[] encodeOemString(@Nullable String string) {
    return (string != null) ? string.toUpperCase(Locale.ROOT).getBytes(OEM_CHARSET) : null;
  }

  protected static byte[] encodeUnicodeString(@Nullable String string) {
    return (string != null) ? string.getBytes(UNICODE_CHARSET) : null;
  }

  /**
   * Checks an argument whose presence is signalled by a flag.  If the flag is
   * set the argument must be present; if the argument is present the flag is
   * added.
   */
  protected static void checkFlaggedArgument(EnumSet<NtlmSspFlag> flags, NtlmSspFlag flag,
      @Nullable Object argument) {
    if (flags.contains(flag)) {
      Preconditions.checkNotNull(argument, "Flag %s requires a value", flag);
    } else if (argument != null) {
      flags.add(flag);
    }
  }

  protected static byte[] copyBytes(@Nullable byte[] bytes) {
    return (bytes != null) ? Arrays.copyOf(bytes, bytes.length) : null;
  }
}
