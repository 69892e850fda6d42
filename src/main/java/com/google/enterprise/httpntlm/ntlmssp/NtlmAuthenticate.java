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
import com.google.common.base.Strings;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The NTLM Authenticate (type 3) message, the client's answer to a Challenge.
 *
 * See http://msdn.microsoft.com/en-us/library/cc236643 for details.
 */
@Immutable
public final class NtlmAuthenticate extends NtlmBase {
  public static final int MIC_LENGTH = 16;

  @Nonnull private final byte[] lmChallengeResponse;
  @Nonnull private final byte[] ntChallengeResponse;
  @Nonnull private final String domainName;
  @Nonnull private final String userName;
  @Nonnull private final String workstationName;
  @Nullable private final byte[] encryptedRandomSessionKey;
  @Nonnull private final EnumSet<NtlmSspFlag> flags;
  @Nullable private final NtlmSspVersion versionInfo;
  @Nullable private final byte[] mic;

  /**
   * Make an Authenticate message.
   *
   * @param lmChallengeResponse The LM challenge response.
   * @param ntChallengeResponse The NT challenge response.
   * @param domainName The client's domain; null is treated as empty.
   * @param userName The client's user name; null is treated as empty.
   * @param workstationName The client's workstation name; null is treated as empty.
   * @param encryptedRandomSessionKey The session key, required if key exchange was negotiated.
   * @param flags The negotiation flags for the message.
   * @param versionInfo The client's version info.
   * @param mic A 16-byte message integrity check, or null if there isn't one.
   * @return A suitable Authenticate message.
   * @throws IllegalArgumentException if the flags don't select a string encoding.
   */
  public static NtlmAuthenticate make(@Nonnull byte[] lmChallengeResponse,
      @Nonnull byte[] ntChallengeResponse, @Nullable String domainName, @Nullable String userName,
      @Nullable String workstationName, @Nullable byte[] encryptedRandomSessionKey,
      @Nonnull EnumSet<NtlmSspFlag> flags, @Nullable NtlmSspVersion versionInfo,
      @Nullable byte[] mic) {
    Preconditions.checkNotNull(flags);
    flags = flags.clone();
    Preconditions.checkNotNull(lmChallengeResponse);
    Preconditions.checkNotNull(ntChallengeResponse);
    Preconditions.checkArgument(
        flags.contains(NtlmSspFlag.NEGOTIATE_UNICODE) || flags.contains(NtlmSspFlag.NEGOTIATE_OEM),
        "Must specify either NEGOTIATE_UNICODE or NEGOTIATE_OEM");
    checkFlaggedArgument(flags, NtlmSspFlag.NEGOTIATE_KEY_EXCH, encryptedRandomSessionKey);
    checkFlaggedArgument(flags, NtlmSspFlag.NEGOTIATE_VERSION, versionInfo);
    if (mic != null) {
      Preconditions.checkArgument(mic.length == MIC_LENGTH);
    }
    return new NtlmAuthenticate(copyBytes(lmChallengeResponse), copyBytes(ntChallengeResponse),
        Strings.nullToEmpty(domainName), Strings.nullToEmpty(userName),
        Strings.nullToEmpty(workstationName), copyBytes(encryptedRandomSessionKey), flags,
        versionInfo, copyBytes(mic));
  }

  private NtlmAuthenticate(byte[] lmChallengeResponse, byte[] ntChallengeResponse,
      String domainName, String userName, String workstationName, byte[] encryptedRandomSessionKey,
      EnumSet<NtlmSspFlag> flags, NtlmSspVersion versionInfo, byte[] mic) {
    this.lmChallengeResponse = lmChallengeResponse;
    this.ntChallengeResponse = ntChallengeResponse;
    this.domainName = domainName;
    this.userName = userName;
    this.workstationName = workstationName;
    this.encryptedRandomSessionKey = encryptedRandomSessionKey;
    this.flags = flags;
    this.versionInfo = versionInfo;
    this.mic = mic;
  }

  public byte[] getLmChallengeResponse() {
    return copyBytes(lmChallengeResponse);
  }

  public byte[] getNtChallengeResponse() {
    return copyBytes(ntChallengeResponse);
  }

  public String getDomainName() {
    return domainName;
  }

  public String getUserName() {
    return userName;
  }

  public String getWorkstationName() {
    return workstationName;
  }

  @Nullable
  public byte[] getEncryptedRandomSessionKey() {
    return copyBytes(encryptedRandomSessionKey);
  }

  public EnumSet<NtlmSspFlag> getFlags() {
    return flags.clone();
  }

  public boolean containsFlag(NtlmSspFlag flag) {
    return flags.contains(flag);
  }

  @Nullable
  public NtlmSspVersion getVersionInfo() {
    return versionInfo;
  }

  @Nullable
  public byte[] getMic() {
    return copyBytes(mic);
  }

  /**
   * Decode an Authenticate message.
   *
   * @param message The raw message to decode.
   * @param hasMic True if the message carries a MIC after the version field.
   * @return The corresponding Authenticate message object.
   * @throws MalformedNtlmMessageException if the message can't be decoded.
   */
  public static NtlmAuthenticate decode(@Nonnull byte[] message, boolean hasMic)
      throws MalformedNtlmMessageException {
    Preconditions.checkNotNull(message);
    NtlmMessageDecoder decoder = NtlmMessageDecoder.make(message);
    checkSignature(decoder);
    checkMessageType(decoder, NtlmMessageType.AUTHENTICATE);
    byte[] lmChallengeResponse = decoder.readPayload();
    byte[] ntChallengeResponse = decoder.readPayload();
    byte[] rawDomainName = decoder.readPayload();
    byte[] rawUserName = decoder.readPayload();
    byte[] rawWorkstationName = decoder.readPayload();
    byte[] encryptedRandomSessionKey = decoder.readPayload();
    EnumSet<NtlmSspFlag> flags = decodeFlags(decoder);
    String domainName = decodeString(rawDomainName, flags);
    String userName = decodeString(rawUserName, flags);
    String workstationName = decodeString(rawWorkstationName, flags);
    if (!flags.contains(NtlmSspFlag.NEGOTIATE_KEY_EXCH)) {
      encryptedRandomSessionKey = null;
    }
    NtlmSspVersion versionInfo = flags.contains(NtlmSspFlag.NEGOTIATE_VERSION)
        ? NtlmSspVersion.decode(decoder)
        : null;
    byte[] mic = hasMic ? decoder.readBytes(MIC_LENGTH) : null;
    return NtlmAuthenticate.make(lmChallengeResponse, ntChallengeResponse, domainName, userName,
        workstationName, encryptedRandomSessionKey, flags, versionInfo, mic);
  }

  /**
   * Encode this message.
   *
   * @return The encoded message.
   */
  public byte[] encode() {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    encodeSignature(encoder);
    encodeMessageType(NtlmMessageType.AUTHENTICATE, encoder);
    encoder.writePayload(lmChallengeResponse);
    encoder.writePayload(ntChallengeResponse);
    encoder.writePayload(encodeString(domainName, flags));
    encoder.writePayload(encodeString(userName, flags));
    encoder.writePayload(encodeString(workstationName, flags));
    encoder.writePayload(encryptedRandomSessionKey);
    encodeFlags(flags, encoder);
    if (flags.contains(NtlmSspFlag.NEGOTIATE_VERSION)) {
      versionInfo.encode(encoder);
    }
    if (mic != null) {
      encoder.writeBytes(mic);
    }
    return encoder.getBytes();
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof NtlmAuthenticate)) { return false; }
    NtlmAuthenticate other = (NtlmAuthenticate) object;
    return Arrays.equals(lmChallengeResponse, other.lmChallengeResponse)
        && Arrays.equals(ntChallengeResponse, other.ntChallengeResponse)
        && Objects.equals(domainName, other.domainName)
        && Objects.equals(userName, other.userName)
        && Objects.equals(workstationName, other.workstationName)
        && Arrays.equals(encryptedRandomSessionKey, other.encryptedRandomSessionKey)
        && Objects.equals(flags, other.flags)
        && Objects.equals(versionInfo, other.versionInfo)
        && Arrays.equals(mic, other.mic);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.hashCode(lmChallengeResponse),
        Arrays.hashCode(ntChallengeResponse), domainName, userName, workstationName,
        Arrays.hashCode(encryptedRandomSessionKey), flags, versionInfo, Arrays.hashCode(mic));
  }

  @Override
  public String toString() {
    return "NtlmAuthenticate{domain=" + domainName + ", user=" + userName
        + ", workstation=" + workstationName + ", flags=" + flags + "}";
  }
}
