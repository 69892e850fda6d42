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

import java.util.EnumSet;
import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The NTLM Negotiate (type 1) message, which opens a handshake.
 *
 * See http://msdn.microsoft.com/en-us/library/cc236641 for details.
 */
@Immutable
public final class NtlmNegotiate extends NtlmBase {
  @Nonnull private final EnumSet<NtlmSspFlag> flags;
  @Nullable private final String domainName;
  @Nullable private final String workstationName;
  @Nullable private final NtlmSspVersion versionInfo;

  /**
   * Make a Negotiate message.  Supplying a domain, a workstation or a version
   * turns on the flag that announces it.
   *
   * @param flags The negotiation flags for the message; never null.
   * @param domainName The client's domain; may be null.
   * @param workstationName The client's workstation name; may be null.
   * @param versionInfo The client's version info; may be null.
   * @return A suitable Negotiate message.
   */
  public static NtlmNegotiate make(@Nonnull EnumSet<NtlmSspFlag> flags, @Nullable String domainName,
      @Nullable String workstationName, @Nullable NtlmSspVersion versionInfo) {
    Preconditions.checkNotNull(flags);
    flags = flags.clone();
    checkFlaggedArgument(flags, NtlmSspFlag.NEGOTIATE_OEM_DOMAIN_SUPPLIED, domainName);
    checkFlaggedArgument(flags, NtlmSspFlag.NEGOTIATE_OEM_WORKSTATION_SUPPLIED, workstationName);
    checkFlaggedArgument(flags, NtlmSspFlag.NEGOTIATE_VERSION, versionInfo);
    return new NtlmNegotiate(flags, domainName, workstationName, versionInfo);
  }

  private NtlmNegotiate(EnumSet<NtlmSspFlag> flags, String domainName,
      String workstationName, NtlmSspVersion versionInfo) {
    this.flags = flags;
    this.domainName = domainName;
    this.workstationName = workstationName;
    this.versionInfo = versionInfo;
  }

  public EnumSet<NtlmSspFlag> getFlags() {
    return flags.clone();
  }

  public boolean containsFlag(NtlmSspFlag flag) {
    return flags.contains(flag);
  }

  @Nullable
  public String getDomainName() {
    return domainName;
  }

  @Nullable
  public String getWorkstationName() {
    return workstationName;
  }

  @Nullable
  public NtlmSspVersion getVersionInfo() {
    return versionInfo;
  }

  /**
   * Decode a Negotiate message.
   *
   * @param message The raw message to decode.
   * @return The corresponding Negotiate message object.
   * @throws MalformedNtlmMessageException if the message can't be decoded.
   */
  public static NtlmNegotiate decode(@Nonnull byte[] message)
      throws MalformedNtlmMessageException {
    Preconditions.checkNotNull(message);
    NtlmMessageDecoder decoder = NtlmMessageDecoder.make(message);
    checkSignature(decoder);
    checkMessageType(decoder, NtlmMessageType.NEGOTIATE);
    EnumSet<NtlmSspFlag> flags = decodeFlags(decoder);
    String domainName = null;
    if (flags.contains(NtlmSspFlag.NEGOTIATE_OEM_DOMAIN_SUPPLIED)) {
      domainName = decodeString(decoder.readPayload(), OEM_CHARSET);
    } else {
      decoder.skipPayloadHeader();
    }
    String workstationName = null;
    if (flags.contains(NtlmSspFlag.NEGOTIATE_OEM_WORKSTATION_SUPPLIED)) {
      workstationName = decodeString(decoder.readPayload(), OEM_CHARSET);
    } else {
      decoder.skipPayloadHeader();
    }
    NtlmSspVersion versionInfo = flags.contains(NtlmSspFlag.NEGOTIATE_VERSION)
        ? NtlmSspVersion.decode(decoder)
        : null;
    return NtlmNegotiate.make(flags, domainName, workstationName, versionInfo);
  }

  /**
   * Encode this message.
   *
   * @return The encoded message.
   */
  public byte[] encode() {
    NtlmMessageEncoder encoder = NtlmMessageEncoder.make();
    encodeSignature(encoder);
    encodeMessageType(NtlmMessageType.NEGOTIATE, encoder);
    encodeFlags(flags, encoder);
    encoder.writePayload(flags.contains(NtlmSspFlag.NEGOTIATE_OEM_DOMAIN_SUPPLIED)
        ? encodeOemString(domainName)
        : null);
    encoder.writePayload(flags.contains(NtlmSspFlag.NEGOTIATE_OEM_WORKSTATION_SUPPLIED)
        ? encodeOemString(workstationName)
        : null);
    if (flags.contains(NtlmSspFlag.NEGOTIATE_VERSION)) {
      versionInfo.encode(encoder);
    }
    return encoder.getBytes();
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof NtlmNegotiate)) { return false; }
    NtlmNegotiate other = (NtlmNegotiate) object;
    return Objects.equals(flags, other.flags)
        && Objects.equals(domainName, other.domainName)
        && Objects.equals(workstationName, other.workstationName)
        && Objects.equals(versionInfo, other.versionInfo);
  }

  @Override
  public int hashCode() {
    return Objects.hash(flags, domainName, workstationName, versionInfo);
  }

  @Override
  public String toString() {
    return "NtlmNegotiate{flags=" + flags + "}";
  }
}
