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

import java.util.EnumSet;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * An enum of the NTLM "negotiate flags".  The ordinal of each flag is its bit
 * position in the 32-bit flags field, least significant bit first.
 *
 * See http://msdn.microsoft.com/en-us/library/cc236650 for details.
 */
@Immutable
public enum NtlmSspFlag {
  NEGOTIATE_UNICODE,
  NEGOTIATE_OEM,
  REQUEST_TARGET,
  RESERVED_10,
  NEGOTIATE_SIGN,
  NEGOTIATE_SEAL,
  NEGOTIATE_DATAGRAM,
  NEGOTIATE_LM_KEY,
  RESERVED_9,
  NEGOTIATE_NTLM,
  RESERVED_8,
  ANONYMOUS,
  NEGOTIATE_OEM_DOMAIN_SUPPLIED,
  NEGOTIATE_OEM_WORKSTATION_SUPPLIED,
  RESERVED_7,
  NEGOTIATE_ALWAYS_SIGN,
  TARGET_TYPE_DOMAIN,
  TARGET_TYPE_SERVER,
  RESERVED_6,
  NEGOTIATE_EXTENDED_SESSION_SECURITY,
  NEGOTIATE_IDENTIFY,
  RESERVED_5,
  REQUEST_NON_NT_SESSION_KEY,
  NEGOTIATE_TARGET_INFO,
  RESERVED_4,
  NEGOTIATE_VERSION,
  RESERVED_3,
  RESERVED_2,
  RESERVED_1,
  NEGOTIATE_128,
  NEGOTIATE_KEY_EXCH,
  NEGOTIATE_56;

  /**
   * @return The bit that represents this flag on the wire.
   */
  public int getMask() {
    return 1 << ordinal();
  }

  /**
   * Converts a set of flags to its wire representation.
   *
   * @param flags The flags to convert.
   * @return The 32-bit flags field.
   */
  public static int toBits(Set<NtlmSspFlag> flags) {
    int bits = 0;
    for (NtlmSspFlag flag : flags) {
      bits |= flag.getMask();
    }
    return bits;
  }

  /**
   * Converts a wire flags field to a set of flags.
   *
   * @param bits The 32-bit flags field.
   * @return A new mutable set of the flags that are on in {@code bits}.
   */
  public static EnumSet<NtlmSspFlag> fromBits(int bits) {
    EnumSet<NtlmSspFlag> flags = EnumSet.noneOf(NtlmSspFlag.class);
    for (NtlmSspFlag flag : values()) {
      if ((bits & flag.getMask()) != 0) {
        flags.add(flag);
      }
    }
    return flags;
  }
}
