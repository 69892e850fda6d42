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

import java.util.Arrays;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Decodes an NTLM message one little-endian field at a time.  Fixed-size
 * fields are read from the header, which ends where the first payload starts;
 * payload references are checked against both the header and the message
 * length before they are followed.
 */
@NotThreadSafe
final class NtlmMessageDecoder {
  private final byte[] message;
  private int index;
  private int payloadStart;

  static NtlmMessageDecoder make(byte[] message) {
    Preconditions.checkNotNull(message);
    return new NtlmMessageDecoder(message);
  }

  private NtlmMessageDecoder(byte[] message) {
    this.message = message;
    index = 0;
    payloadStart = message.length;
  }

  boolean atEnd() {
    return index == payloadStart;
  }

  int getIndex() {
    return index;
  }

  int read8()
      throws MalformedNtlmMessageException {
    checkHeaderIndex(1);
    return message[index++] & 0xff;
  }

  int read16()
      throws MalformedNtlmMessageException {
    checkHeaderIndex(2);
    int value = (message[index] & 0xff)
        | ((message[index + 1] & 0xff) << 8);
    index += 2;
    return value;
  }

  int read32()
      throws MalformedNtlmMessageException {
    checkHeaderIndex(4);
    int value = (message[index] & 0xff)
        | ((message[index + 1] & 0xff) << 8)
        | ((message[index + 2] & 0xff) << 16)
        | ((message[index + 3] & 0xff) << 24);
    index += 4;
    return value;
  }

  byte[] readBytes(int n)
      throws MalformedNtlmMessageException {
    Preconditions.checkArgument(n >= 0);
    checkHeaderIndex(n);
    byte[] result = Arrays.copyOfRange(message, index, index + n);
    index += n;
    return result;
  }

  void skip(int n)
      throws MalformedNtlmMessageException {
    Preconditions.checkArgument(n >= 0);
    checkHeaderIndex(n);
    index += n;
  }

  private void checkHeaderIndex(int n)
      throws MalformedNtlmMessageException {
    if ((index + n) > payloadStart) {
      throw new MalformedNtlmMessageException("Header read exceeds end of message");
    }
  }

  byte[] readPayload()
      throws MalformedNtlmMessageException {
    return readPayload(readPayloadHeader());
  }

  PayloadHeader readPayloadHeader()
      throws MalformedNtlmMessageException {
    int len = read16();
    int maxLen = read16();
    int offset = read32();
    return new PayloadHeader(len, maxLen, offset);
  }

  byte[] readPayload(PayloadHeader header)
      throws MalformedNtlmMessageException {
    if (header.len > header.maxLen) {
      throw new MalformedNtlmMessageException(
          "Payload length " + header.len + " exceeds its maximum " + header.maxLen);
    }
    if (header.len == 0) {
      return new byte[0];
    }
    checkPayloadOffset(header.offset, header.len);
    return Arrays.copyOfRange(message, header.offset, header.offset + header.len);
  }

  void skipPayloadHeader()
      throws MalformedNtlmMessageException {
    skip(PayloadHeader.SIZE);
  }

  /**
   * The (length, maximum length, offset) triple that points at a payload.
   */
  static final class PayloadHeader {
    static final int SIZE = 8;

    final int len;
    final int maxLen;
    final int offset;

    private PayloadHeader(int len, int maxLen, int offset) {
      this.len = len;
      this.maxLen = maxLen;
      this.offset = offset;
    }
  }

  // Moves payloadStart down to start if the latter is smaller.
  private void checkPayloadOffset(int start, int n)
      throws MalformedNtlmMessageException {
    if (n == 0) {
      return;
    }
    if (start < 0) {
      throw new MalformedNtlmMessageException("Payload start too big to fit in int: " + start);
    }
    if (start < index) {
      throw new MalformedNtlmMessageException("Payload read in header: " + start);
    }
    if (start > message.length - n) {
      throw new MalformedNtlmMessageException("Payload read exceeds end of message: " + start);
    }
    if (start < payloadStart) {
      payloadStart = start;
    }
  }
}
