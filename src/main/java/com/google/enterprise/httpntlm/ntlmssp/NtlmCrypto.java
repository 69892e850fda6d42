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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Arrays;
import java.util.Locale;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

/**
 * The cryptographic functions of NTLMv1 and NTLMv2.
 *
 * See http://msdn.microsoft.com/en-us/library/cc236699 (NTLMv1) and
 * http://msdn.microsoft.com/en-us/library/cc236700 (NTLMv2).
 */
@ThreadSafe
final class NtlmCrypto extends NtlmBase {

  static final int CHALLENGE_LENGTH = 8;
  static final int V1_RESPONSE_LENGTH = 24;

  private static final String MD4_ALGORITHM = "MD4";
  private static final String MD5_ALGORITHM = "MD5";
  private static final String HMAC_MD5_ALGORITHM = "HmacMD5";
  private static final String DES_KEY_ALGORITHM = "DES";
  private static final String DES_ALGORITHM = "DES/ECB/NoPadding";
  private static final String LM_MAGIC_STRING = "KGS!@#$%";
  private static final SecureRandom prng = new SecureRandom();

  // Blob signature (RespType, HiRespType) of an NTLMv2 client challenge.
  private static final byte[] BLOB_SIGNATURE = new byte[] { 0x01, 0x01 };

  // Milliseconds between the FILETIME epoch (1601) and the Java epoch (1970).
  private static final long FILETIME_EPOCH_OFFSET_MILLIS = 11644473600000L;

  static {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  // Don't instantiate.
  private NtlmCrypto() {
    throw new UnsupportedOperationException();
  }

  static byte[] generateNonce(int nBytes) {
    byte[] nonce = new byte[nBytes];
    synchronized (prng) {
      prng.nextBytes(nonce);
    }
    return nonce;
  }

  /**
   * Converts a Java time to a Windows FILETIME: 100ns intervals since
   * January 1, 1601 UTC.
   */
  static long toFileTime(long millis) {
    return (millis + FILETIME_EPOCH_OFFSET_MILLIS) * 10000L;
  }

  static byte[] encodeFileTime(long fileTime) {
    byte[] bytes = new byte[8];
    for (int i = 0; i < 8; i += 1) {
      bytes[i] = (byte) (fileTime >>> (8 * i));
    }
    return bytes;
  }

  /**
   * Checks that the JCA can supply every algorithm a given protocol version needs.
   *
   * @throws GeneralSecurityException if one of them is missing.
   */
  static void checkAlgorithms(NtlmVersion version)
      throws GeneralSecurityException {
    MessageDigest.getInstance(MD4_ALGORITHM);
    if (version == NtlmVersion.V2) {
      Mac.getInstance(HMAC_MD5_ALGORITHM);
    } else {
      MessageDigest.getInstance(MD5_ALGORITHM);
      Cipher.getInstance(DES_ALGORITHM);
    }
  }

  // NTLMv1

  /**
   * Computes the NTLMv1 response when extended session security is in effect:
   * DESL(NTOWFv1, MD5(serverChallenge || clientChallenge)[0..7]).
   */
  static byte[] generateEssChallengeResponse(
      byte[] serverChallenge, byte[] clientChallenge, String password)
      throws GeneralSecurityException {
    checkChallenge(serverChallenge);
    checkChallenge(clientChallenge);
    Preconditions.checkNotNull(password);
    MessageDigest md5 = MessageDigest.getInstance(MD5_ALGORITHM);
    byte[] combinedNonce =
        Arrays.copyOf(md5.digest(concatenate(serverChallenge, clientChallenge)), 8);
    return runDesl(Cipher.getInstance(DES_ALGORITHM), combinedNonce, ntowfV1(password));
  }

  static byte[] generateNtChallengeResponse(byte[] serverChallenge, String password)
      throws GeneralSecurityException {
    checkChallenge(serverChallenge);
    Preconditions.checkNotNull(password);
    return runDesl(Cipher.getInstance(DES_ALGORITHM), serverChallenge, ntowfV1(password));
  }

  static byte[] generateLmChallengeResponse(byte[] serverChallenge, String password)
      throws GeneralSecurityException {
    checkChallenge(serverChallenge);
    Preconditions.checkNotNull(password);
    Cipher des = Cipher.getInstance(DES_ALGORITHM);
    byte[] pBytes =
        Arrays.copyOf(password.toUpperCase(Locale.ROOT).getBytes(OEM_CHARSET), 14);
    byte[] keyBytes = new byte[16];
    byte[] magicNonce = LM_MAGIC_STRING.getBytes(US_ASCII);
    runDes(des, magicNonce, keyBytes, 0, pBytes, 0);
    runDes(des, magicNonce, keyBytes, 8, pBytes, 7);
    return runDesl(des, serverChallenge, keyBytes);
  }

  static byte[] ntowfV1(String password)
      throws GeneralSecurityException {
    MessageDigest md4 = MessageDigest.getInstance(MD4_ALGORITHM);
    return md4.digest(encodeUnicodeString(password));
  }

  // NTLMv2

  /**
   * NTOWFv2: HMAC_MD5(MD4(UNICODE(password)), UNICODE(Uppercase(user) || domain)).
   */
  static byte[] ntowfV2(String password, String userName, String domainName)
      throws GeneralSecurityException {
    Preconditions.checkNotNull(password);
    String identity = Strings.nullToEmpty(userName).toUpperCase(Locale.ROOT)
        + Strings.nullToEmpty(domainName);
    return hmacMd5(ntowfV1(password), encodeUnicodeString(identity));
  }

  /**
   * LMv2: HMAC_MD5(responseKey, serverChallenge || clientChallenge) || clientChallenge.
   */
  static byte[] generateLmV2Response(byte[] responseKey, byte[] serverChallenge,
      byte[] clientChallenge)
      throws GeneralSecurityException {
    checkChallenge(serverChallenge);
    checkChallenge(clientChallenge);
    byte[] proof = hmacMd5(responseKey, concatenate(serverChallenge, clientChallenge));
    return concatenate(proof, clientChallenge);
  }

  /**
   * Builds the NTLMv2 client blob ("temp" in MS-NLMP) that follows the proof
   * string in an NTLMv2 response.
   *
   * @param fileTime The 8-byte little-endian timestamp.
   * @param clientChallenge The 8-byte client nonce.
   * @param targetInfo The encoded AV_PAIR list, including its terminator.
   */
  static byte[] makeNtV2Blob(byte[] fileTime, byte[] clientChallenge, byte[] targetInfo) {
    Preconditions.checkArgument(fileTime.length == 8);
    checkChallenge(clientChallenge);
    Preconditions.checkNotNull(targetInfo);
    return concatenate(
        BLOB_SIGNATURE,
        new byte[6],
        fileTime,
        clientChallenge,
        new byte[4],
        targetInfo,
        new byte[4]);
  }

  /**
   * NTLMv2 response: HMAC_MD5(responseKey, serverChallenge || blob) || blob.
   * The first 16 bytes are the NTProofStr.
   */
  static byte[] generateNtV2Response(byte[] responseKey, byte[] serverChallenge, byte[] blob)
      throws GeneralSecurityException {
    checkChallenge(serverChallenge);
    byte[] proof = hmacMd5(responseKey, concatenate(serverChallenge, blob));
    return concatenate(proof, blob);
  }

  static byte[] hmacMd5(byte[] key, byte[] data)
      throws GeneralSecurityException {
    Mac mac = Mac.getInstance(HMAC_MD5_ALGORITHM);
    mac.init(new SecretKeySpec(key, HMAC_MD5_ALGORITHM));
    return mac.doFinal(data);
  }

  private static void checkChallenge(byte[] challenge) {
    Preconditions.checkNotNull(challenge);
    Preconditions.checkArgument(challenge.length == CHALLENGE_LENGTH,
        "Challenge must be %s bytes", CHALLENGE_LENGTH);
  }

  private static byte[] runDesl(Cipher des, byte[] nonce, byte[] keyBytes)
      throws GeneralSecurityException {
    byte[] result = new byte[V1_RESPONSE_LENGTH];
    runDes(des, nonce, result, 0, keyBytes, 0);
    runDes(des, nonce, result, 8, keyBytes, 7);
    runDes(des, nonce, result, 16, keyBytes, 14);
    return result;
  }

  // Key bytes past the end of keyBytes are taken as zero.
  private static void runDes(Cipher des, byte[] nonce, byte[] result, int resultIndex,
      byte[] keyBytes, int keyIndex)
      throws GeneralSecurityException {
    byte[] subKey = Arrays.copyOfRange(keyBytes, keyIndex, keyIndex + 7);
    des.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(addParityBits(subKey), DES_KEY_ALGORITHM));
    System.arraycopy(des.doFinal(nonce), 0, result, resultIndex, 8);
  }

  static byte[] concatenate(byte[]... parts) {
    int length = 0;
    for (byte[] part : parts) {
      length += part.length;
    }
    byte[] result = new byte[length];
    int index = 0;
    for (byte[] part : parts) {
      System.arraycopy(part, 0, result, index, part.length);
      index += part.length;
    }
    return result;
  }

  /**
   * Add parity bits to a DES key: a parity bit is added after each 7th bits of the 56bit input
   * key, making it a valid 64bit DES key.
   *
   * @param key56bit key without parity bits
   * @return key with parity bits added
   */
  @VisibleForTesting
  static byte[] addParityBits(byte[] key56bit) {
    Preconditions.checkNotNull(key56bit);
    Preconditions.checkArgument(key56bit.length == 7);

    byte[] key64bit = new byte[8];

    int bitPos = 1;
    int bitCount = 0;

    for (int i = 0; i < 56; i++) {
      boolean bit = (key56bit[6 - i / 8] & (1 << (i % 8))) > 0;

      if (bit) {
        key64bit[7 - bitPos / 8] |= (1 << (bitPos % 8)) & 0xFF;
        bitCount++;
      }

      if ((i + 1) % 7 == 0) {
        if (bitCount % 2 == 0) {
          key64bit[7 - bitPos / 8] |= 1;
        }
        bitPos++;
        bitCount = 0;
      }
      bitPos++;
    }
    return key64bit;
  }
}
