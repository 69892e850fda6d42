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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An NTLM client session.  Speaks NTLMv1 (with or without extended session
 * security) and NTLMv2, in either mode.
 */
@NotThreadSafe
public final class NtlmClient extends NtlmBase implements NtlmClientSession {
  private static final Logger logger = Logger.getLogger(NtlmClient.class.getName());

  // The only flags an Authenticate message will echo back.
  private static final EnumSet<NtlmSspFlag> SUPPORTED_FLAGS =
      EnumSet.of(
          NtlmSspFlag.NEGOTIATE_UNICODE,
          NtlmSspFlag.NEGOTIATE_OEM,
          NtlmSspFlag.REQUEST_TARGET,
          NtlmSspFlag.NEGOTIATE_NTLM,
          NtlmSspFlag.NEGOTIATE_ALWAYS_SIGN,
          NtlmSspFlag.NEGOTIATE_EXTENDED_SESSION_SECURITY,
          NtlmSspFlag.NEGOTIATE_TARGET_INFO,
          NtlmSspFlag.NEGOTIATE_128,
          NtlmSspFlag.NEGOTIATE_56);

  @Nonnull private final NtlmVersion version;
  @Nonnull private final NtlmMode mode;
  @Nonnull private final EnumSet<NtlmSspFlag> negotiateFlags;
  private final boolean noLmResponseNtlmV1;
  @Nullable private final byte[] fixedClientChallenge;
  @Nullable private final Long fixedFileTime;
  @Nullable private String userName;
  @Nullable private String password;
  @Nullable private String domainName;
  @Nullable private String workstationName;
  @Nullable private NtlmChallenge challenge;
  @Nullable private NtlmAuthenticate authenticate;

  /**
   * Create a new client session builder.
   *
   * @param version The protocol version the session will speak.
   * @param mode The session's mode.
   */
  public static Builder builder(NtlmVersion version, NtlmMode mode) {
    return new Builder(version, mode);
  }

  /**
   * A builder class for client sessions.
   */
  public static final class Builder {
    private final NtlmVersion version;
    private final NtlmMode mode;
    private EnumSet<NtlmSspFlag> negotiateFlags;
    private boolean noLmResponseNtlmV1;
    private byte[] clientChallenge;
    private Long fileTime;

    private Builder(NtlmVersion version, NtlmMode mode) {
      Preconditions.checkNotNull(version);
      Preconditions.checkNotNull(mode);
      this.version = version;
      this.mode = mode;
      negotiateFlags = NtlmSspEngine.NEGOTIATE_FLAGS.clone();
      noLmResponseNtlmV1 = true;
    }

    /**
     * Set the flags that were sent in the Negotiate message.  Only used in
     * connection-oriented mode, where the Authenticate flags must be a subset
     * of them.
     *
     * @param negotiateFlags The Negotiate message's flags.
     * @return The builder object, for convenience.
     */
    public Builder setNegotiateFlags(@Nonnull EnumSet<NtlmSspFlag> negotiateFlags) {
      Preconditions.checkNotNull(negotiateFlags);
      this.negotiateFlags = negotiateFlags.clone();
      return this;
    }

    /**
     * Set the NoLMResponseNTLMv1 flag.  This flag is set to true by default,
     * and all modern versions of Windows use that setting.  Setting it to false
     * provides weaker security and is not recommended.
     *
     * @param noLmResponseNtlmV1 The new flag value.
     * @return The builder object, for convenience.
     */
    public Builder setNoLmResponseNtlmV1(boolean noLmResponseNtlmV1) {
      this.noLmResponseNtlmV1 = noLmResponseNtlmV1;
      return this;
    }

    /**
     * Allow unit tests to provide a fixed client challenge.
     */
    @VisibleForTesting
    public Builder setClientChallenge(byte[] clientChallenge) {
      Preconditions.checkNotNull(clientChallenge);
      Preconditions.checkArgument(clientChallenge.length == NtlmCrypto.CHALLENGE_LENGTH);
      this.clientChallenge = copyBytes(clientChallenge);
      return this;
    }

    /**
     * Allow unit tests to provide a fixed NTLMv2 timestamp, as a FILETIME.
     */
    @VisibleForTesting
    public Builder setFileTime(long fileTime) {
      this.fileTime = fileTime;
      return this;
    }

    /**
     * @return A new client session using the accumulated parameters.
     */
    public NtlmClient build() {
      return new NtlmClient(version, mode, negotiateFlags.clone(), noLmResponseNtlmV1,
          clientChallenge, fileTime);
    }
  }

  private NtlmClient(NtlmVersion version, NtlmMode mode, EnumSet<NtlmSspFlag> negotiateFlags,
      boolean noLmResponseNtlmV1, byte[] fixedClientChallenge, Long fixedFileTime) {
    this.version = version;
    this.mode = mode;
    this.negotiateFlags = negotiateFlags;
    this.noLmResponseNtlmV1 = noLmResponseNtlmV1;
    this.fixedClientChallenge = fixedClientChallenge;
    this.fixedFileTime = fixedFileTime;
  }

  public NtlmVersion getVersion() {
    return version;
  }

  public NtlmMode getMode() {
    return mode;
  }

  /**
   * @return The Challenge message if it has been processed; null otherwise.
   */
  @Nullable
  public NtlmChallenge getChallengeMessage() {
    return challenge;
  }

  /**
   * @return The Authenticate message if it has been generated; null otherwise.
   */
  @Nullable
  public NtlmAuthenticate getAuthenticateMessage() {
    return authenticate;
  }

  @Override
  public void setUserInfo(String userName, String password, @Nullable String domainName,
      @Nullable String workstationName) {
    Preconditions.checkNotNull(userName);
    Preconditions.checkNotNull(password);
    Preconditions.checkState(authenticate == null, "Session already authenticated");
    this.userName = userName;
    this.password = password;
    this.domainName = domainName;
    this.workstationName = workstationName;
  }

  @Override
  public void processChallengeMessage(@Nonnull NtlmChallenge challenge)
      throws GeneralSecurityException {
    Preconditions.checkNotNull(challenge);
    Preconditions.checkState(this.challenge == null, "Challenge already processed");
    EnumSet<NtlmSspFlag> flags = getBaseFlags(challenge);
    if (!(flags.contains(NtlmSspFlag.NEGOTIATE_UNICODE)
            || flags.contains(NtlmSspFlag.NEGOTIATE_OEM))) {
      throw new GeneralSecurityException("Server failed to provide UNICODE or OEM flag");
    }
    if (version == NtlmVersion.V1 && !challenge.containsFlag(NtlmSspFlag.NEGOTIATE_NTLM)) {
      throw new GeneralSecurityException("Server doesn't support NTLMv1");
    }
    this.challenge = challenge;
  }

  @Override
  public NtlmAuthenticate generateAuthenticateMessage()
      throws GeneralSecurityException {
    Preconditions.checkState(challenge != null, "No challenge has been processed");
    Preconditions.checkState(userName != null, "No user info has been set");
    Preconditions.checkState(authenticate == null, "Authenticate message already generated");
    EnumSet<NtlmSspFlag> flags = getAuthenticateFlags();
    String domainName = getEffectiveDomainName();
    byte[] serverChallenge = challenge.getServerChallenge();
    byte[] lmChallengeResponse;
    byte[] ntChallengeResponse;
    if (version == NtlmVersion.V2) {
      byte[] responseKey = NtlmCrypto.ntowfV2(password, userName, domainName);
      byte[] clientChallenge = getClientChallenge();
      List<AvPair> targetInfo = (challenge.getTargetInfo() != null)
          ? challenge.getTargetInfo()
          : ImmutableList.<AvPair>of();
      AvPair timestamp = AvPair.find(targetInfo, AvPair.MsvAv.TIMESTAMP);
      byte[] fileTime;
      if (timestamp != null) {
        // When the server supplies a timestamp, the LMv2 response is omitted.
        fileTime = timestamp.getBytesValue();
        if (fileTime.length != 8) {
          throw new MalformedNtlmMessageException(
              "Timestamp must be 8 bytes: " + fileTime.length);
        }
        lmChallengeResponse = new byte[NtlmCrypto.V1_RESPONSE_LENGTH];
      } else {
        fileTime = NtlmCrypto.encodeFileTime((fixedFileTime != null)
            ? fixedFileTime
            : NtlmCrypto.toFileTime(System.currentTimeMillis()));
        lmChallengeResponse =
            NtlmCrypto.generateLmV2Response(responseKey, serverChallenge, clientChallenge);
      }
      byte[] targetInfoBytes = (challenge.getTargetInfoBytes() != null)
          ? challenge.getTargetInfoBytes()
          : AvPair.encode(targetInfo);
      byte[] blob = NtlmCrypto.makeNtV2Blob(fileTime, clientChallenge, targetInfoBytes);
      ntChallengeResponse = NtlmCrypto.generateNtV2Response(responseKey, serverChallenge, blob);
    } else if (flags.contains(NtlmSspFlag.NEGOTIATE_EXTENDED_SESSION_SECURITY)) {
      byte[] clientChallenge = getClientChallenge();
      lmChallengeResponse = Arrays.copyOf(clientChallenge, NtlmCrypto.V1_RESPONSE_LENGTH);
      ntChallengeResponse =
          NtlmCrypto.generateEssChallengeResponse(serverChallenge, clientChallenge, password);
    } else {
      ntChallengeResponse = NtlmCrypto.generateNtChallengeResponse(serverChallenge, password);
      lmChallengeResponse = noLmResponseNtlmV1
          ? ntChallengeResponse
          : NtlmCrypto.generateLmChallengeResponse(serverChallenge, password);
    }
    logger.log(Level.FINE, "NTLM{0} authenticate for {1}\\{2}, flags {3}",
        new Object[] { version, domainName, userName, flags });
    authenticate = NtlmAuthenticate.make(lmChallengeResponse, ntChallengeResponse,
        domainName, userName, workstationName, null, flags, null, null);
    return authenticate;
  }

  // The flags both sides agree on, before trimming to what this client supports.
  private EnumSet<NtlmSspFlag> getBaseFlags(NtlmChallenge challenge) {
    EnumSet<NtlmSspFlag> flags = challenge.getFlags();
    if (mode == NtlmMode.CONNECTION_ORIENTED) {
      flags.retainAll(negotiateFlags);
    }
    return flags;
  }

  private EnumSet<NtlmSspFlag> getAuthenticateFlags() {
    EnumSet<NtlmSspFlag> flags = getBaseFlags(challenge);
    flags.retainAll(SUPPORTED_FLAGS);
    flags.add(NtlmSspFlag.NEGOTIATE_NTLM);
    if (flags.contains(NtlmSspFlag.NEGOTIATE_UNICODE)) {
      flags.remove(NtlmSspFlag.NEGOTIATE_OEM);
    }
    return flags;
  }

  private String getEffectiveDomainName() {
    return (Strings.isNullOrEmpty(domainName)
            && challenge.containsFlag(NtlmSspFlag.TARGET_TYPE_DOMAIN))
        ? Strings.nullToEmpty(challenge.getTargetName())
        : Strings.nullToEmpty(domainName);
  }

  private byte[] getClientChallenge() {
    return (fixedClientChallenge != null)
        ? copyBytes(fixedClientChallenge)
        : NtlmCrypto.generateNonce(NtlmCrypto.CHALLENGE_LENGTH);
  }
}
