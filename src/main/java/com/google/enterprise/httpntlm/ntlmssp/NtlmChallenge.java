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
import com.google.common.collect.ImmutableList;
import com.google.enterprise.httpntlm.ntlmssp.NtlmMessageDecoder.PayloadHeader;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The NTLM Challenge (type 2) message, sent by the server in reply to a
 * Negotiate message.
 *
 * See http://msdn.microsoft.com/en-us/library/cc236642 for details.
 */
@Immutable
public final class NtlmChallenge extends NtlmBase {
  public static final int SERVER_CHALLENGE_LENGTH = 8;

  @Nullable private final String targetName;
  @Nonnull private final EnumSet<NtlmSspFlag> flags;
  @Nonnull private final byte[] serverChallenge;
  @Nullable private final ImmutableList<AvPair> targetInfo;
  @Nullable private final byte[] targetInfoBytes;
  @Nullable private final NtlmSspVersion versionInfo;

  /**
   * Make a Challenge message.
   *
   * @param targetName The name of the server or its domain; may be null.
   * @param flags The negotiation flags for the message; never null.
   * @param serverChallenge An 8-byte nonce.
   * @param targetInfo For NTLMv2, some additional info about the server; for NTLMv1 pass null.
   * @param versionInfo The server's version info; may be null.
   * @return A suitable Challenge message.
   */
  public static NtlmChallenge make(@Nullable String targetName, @Nonnull EnumSet<NtlmSspFlag> flags,
      @Nonnull byte[] serverChallenge, @Nullable List<AvPair> targetInfo,
      @Nullable NtlmSspVersion versionInfo) {
    return make(targetName, flags, serverChallenge, targetInfo,
        (targetInfo != null) ? AvPair.encode(targetInfo) : null, versionInfo);
  }

  private static NtlmChallenge make(String targetName, EnumSet<NtlmSspFlag> flags,
      byte[] serverChallenge, List<AvPair> targetInfo, byte[] targetInfoBytes,
      NtlmSspVersion versionInfo) {
    Preconditions.checkNotNull(flags);
    flags = flags.clone();
    checkFlaggedArgument(flags, NtlmSspFlag.REQUEST_TARGET, targetName);
    Preconditions.checkNotNull(serverChallenge);
    Preconditions.checkArgument(serverChallenge.length == SERVER_CHALLENGE_LENGTH,
        "Server challenge must be %s bytes", SERVER_CHALLENGE_LENGTH);
    checkFlaggedArgument(flags, NtlmSspFlag.NEGOTIATE_TARGET_INFO, targetInfo);
    checkFlaggedArgument(flags, NtlmSspFlag.NEGOTIATE_VERSION, versionInfo);
    return new NtlmChallenge(targetName, flags, copyBytes(serverChallenge), targetInfo,
        targetInfoBytes, versionInfo);
  }

  private NtlmChallenge(String targetName, EnumSet<NtlmSspFlag> flags, byte[] serverChallenge,
      List<AvPair> targetInfo, byte[] targetInfoBytes, NtlmSspVersion versionInfo) {
    this.targetName = targetName;
    this.flags = flags;
    this.serverChallenge = serverChallenge;
    this.targetInfo = (targetInfo != null) ? ImmutableList.copyOf(targetInfo) : null;
    this.targetInfoBytes = targetInfoBytes;
    this.versionInfo = versionInfo;
  }

  @Nullable
  public String getTargetName() {
    return targetName;
  }

  public EnumSet<NtlmSspFlag> getFlags() {
    return flags.clone();
  }

  public boolean containsFlag(NtlmSspFlag flag) {
    return flags.contains(flag);
  }

  public byte[] getServerChallenge() {
    return copyBytes(serverChallenge);
  }

  /**
   * @return This message's target info, or null if the server didn't send any.
   */
  @Nullable
  public List<AvPair> getTargetInfo() {
    return targetInfo;
  }

  /**
   * @return The target info block exactly as it appeared on the wire, or null
   *     if the server didn't send any.
   */
  @Nullable
  public byte[] getTargetInfoBytes() {
    return (targetInfoBytes != null) ? copyBytes(targetInfoBytes) : null;
  }

  @Nullable
  public NtlmSspVersion getVersionInfo() {
    return versionInfo;
  }

  /**
   * Decode a Challenge message.
   *
   * @param message The encoded message.
   * @return The corresponding Challenge message object.
   * @throws MalformedNtlmMessageException if the message can't be decoded.
   */
  public static NtlmChallenge decode(@Nonnull byte[] message)
      throws MalformedNtlmMessageException {
    Preconditions.checkNotNull(message);
    NtlmMessageDecoder decoder = NtlmMessageDecoder.make(message);
    checkSignature(decoder);
    checkMessageType(decoder, NtlmMessageType.CHALLENGE);
    PayloadHeader targetHeader = decoder.readPayloadHeader();
    EnumSet<NtlmSspFlag> flags = decodeFlags(decoder);
    byte[] serverChallenge = decoder.readBytes(SERVER_CHALLENGE_LENGTH);
    String targetName = flags.contains(NtlmSspFlag.REQUEST_TARGET)
        ? decodeString(decoder.readPayload(targetHeader), flags)
        : null;
    if (decoder.atEnd()) {
      // Old servers stop here; there's no room for target info or version.
      flags.remove(NtlmSspFlag.NEGOTIATE_TARGET_INFO);
      flags.remove(NtlmSspFlag.NEGOTIATE_VERSION);
      return NtlmChallenge.make(targetName, flags, serverChallenge, null, null);
    }
    decoder.skip(RESERVED_8_BYTES.length);
    PayloadHeader targetInfoHeader = decoder.readPayloadHeader();
    List<AvPair> targetInfo = null;
    byte[] targetInfoBytes = null;
    if (flags.contains(NtlmSspFlag.NEGOTIATE_TARGET_INFO)) {
      targetInfoBytes = decoder.readPayload(targetInfoHeader);
      targetInfo = (targetInfoBytes.length > 0)
          ? AvPair.decode(targetInfoBytes)
          : ImmutableList.<AvPair>of();
    }
    NtlmSspVersion versionInfo = flags.contains(NtlmSspFlag.NEGOTIATE_VERSION)
        ? NtlmSspVersion.decode(decoder)
        : null;
    return NtlmChallenge.make(targetName, flags, serverChallenge, targetInfo, targetInfoBytes,
        versionInfo);
  }

  /**
   * Encode this message.
   *
   * @return The encoded message.
   */
  public byte[] encode() {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    encodeSignature(encoder);
    encodeMessageType(NtlmMessageType.CHALLENGE, encoder);
    encoder.writePayload(flags.contains(NtlmSspFlag.REQUEST_TARGET)
        ? encodeString(targetName, flags)
        : null);
    encodeFlags(flags, encoder);
    encoder.writeBytes(serverChallenge);
    encoder.writeBytes(RESERVED_8_BYTES);
    encoder.writePayload(flags.contains(NtlmSspFlag.NEGOTIATE_TARGET_INFO)
        ? targetInfoBytes
        : null);
    if (flags.contains(NtlmSspFlag.NEGOTIATE_VERSION)) {
      versionInfo.encode(encoder);
    }
    return encoder.getBytes();
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof NtlmChallenge)) { return false; }
    NtlmChallenge other = (NtlmChallenge) object;
    return Objects.equals(targetName, other.targetName)
        && Objects.equals(flags, other.flags)
        && Arrays.equals(serverChallenge, other.serverChallenge)
        && Objects.equals(targetInfo, other.targetInfo)
        && Objects.equals(versionInfo, other.versionInfo);
  }

  @Override
  public int hashCode() {
    return Objects.hash(targetName, flags, Arrays.hashCode(serverChallenge), targetInfo,
        versionInfo);
  }

  @Override
  public String toString() {
    return "NtlmChallenge{targetName=" + targetName + ", flags=" + flags
        + ", targetInfo=" + targetInfo + "}";
  }
}
