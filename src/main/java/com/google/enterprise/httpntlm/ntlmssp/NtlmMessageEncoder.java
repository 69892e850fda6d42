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

import java.io.ByteArrayOutputStream;
import java.util.List;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Encodes an NTLM message.  The header and the payload are accumulated
 * separately; the payload offsets written into the header are relative to the
 * start of the payload until {@link #getBytes} rebases them.
 */
@NotThreadSafe
final class NtlmMessageEncoder {
  private final ByteArrayOutputStream header;
  private final ByteArrayOutputStream payload;
  private final List<Integer> offsetFields;

  static NtlmMessageEncoder make() {
    return new NtlmMessageEncoder();
  }

  private NtlmMessageEncoder() {
    header = new ByteArrayOutputStream();
    payload = new ByteArrayOutputStream();
    offsetFields = Lists.newArrayList();
  }

  void write8(int value) {
    Preconditions.checkArgument(value >= 0 && value < 0x100,
        "Value not representable as 8-bit unsigned: %s", value);
    header.write(value);
  }

  void write16(int value) {
    Preconditions.checkArgument(value >= 0 && value < 0x10000,
        "Value not representable as 16-bit unsigned: %s", value);
    header.write(value & 0xff);
    header.write((value >> 8) & 0xff);
  }

  void write32(int value) {
    writeInt(header, value);
  }

  void writeBytes(@Nullable byte[] bytes) {
    if (bytes != null) {
      header.write(bytes, 0, bytes.length);
    }
  }

  void writePayload(@Nullable byte[] bytes) {
    if (bytes == null) {
      bytes = new byte[0];
    }
    write16(bytes.length);
    write16(bytes.length);
    offsetFields.add(header.size());
    write32(payload.size());
    payload.write(bytes, 0, bytes.length);
  }

  byte[] getBytes() {
    int payloadStart = header.size();
    byte[] result = new byte[payloadStart + payload.size()];
    System.arraycopy(header.toByteArray(), 0, result, 0, payloadStart);
    System.arraycopy(payload.toByteArray(), 0, result, payloadStart, payload.size());
    for (int field : offsetFields) {
      int relative = (result[field] & 0xff)
          | ((result[field + 1] & 0xff) << 8)
          | ((result[field + 2] & 0xff) << 16)
          | ((result[field + 3] & 0xff) << 24);
      int absolute = payloadStart + relative;
      result[field] = (byte) absolute;
      result[field + 1] = (byte) (absolute >> 8);
      result[field + 2] = (byte) (absolute >> 16);
      result[field + 3] = (byte) (absolute >> 24);
    }
    return result;
  }

  private static void writeInt(ByteArrayOutputStream out, int value) {
    out.write(value & 0xff);
    out.write((value >> 8) & 0xff);
    out.write((value >> 16) & 0xff);
    out.write((value >> 24) & 0xff);
  }
}
