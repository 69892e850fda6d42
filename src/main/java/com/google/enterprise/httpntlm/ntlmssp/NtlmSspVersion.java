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

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * The NTLM VERSION structure: the sender's operating system version and NTLM
 * revision.  Servers commonly include it in their Challenge message.
 *
 * See http://msdn.microsoft.com/en-us/library/cc236654 for details.
 */
@Immutable
public final class NtlmSspVersion extends NtlmBase {
  private static final int RESERVED_BYTES = 3;

  public static final int NTLMSSP_REVISION_W2K3 = 0x0f;

  private final int major;
  private final int minor;
  private final int build;
  private final int ntlmRevision;

  /**
   * Make an NTLM SSP version object.
   *
   * @param major The operating system's major version.
   * @param minor The operating system's minor version.
   * @param build The operating system's build number.
   * @param ntlmRevision The NTLM revision number.
   */
  public static NtlmSspVersion make(int major, int minor, int build, int ntlmRevision) {
    Preconditions.checkArgument(major >= 0 && major < 0x100);
    Preconditions.checkArgument(minor >= 0 && minor < 0x100);
    Preconditions.checkArgument(build >= 0 && build < 0x10000);
    Preconditions.checkArgument(ntlmRevision >= 0 && ntlmRevision < 0x100);
    return new NtlmSspVersion(major, minor, build, ntlmRevision);
  }

  private NtlmSspVersion(int major, int minor, int build, int ntlmRevision) {
    this.major = major;
    this.minor = minor;
    this.build = build;
    this.ntlmRevision = ntlmRevision;
  }

  public int getMajor() {
    return major;
  }

  public int getMinor() {
    return minor;
  }

  public int getBuild() {
    return build;
  }

  public int getNtlmRevision() {
    return ntlmRevision;
  }

  static NtlmSspVersion decode(@Nonnull NtlmMessageDecoder decoder)
      throws MalformedNtlmMessageException {
    int major = decoder.read8();
    int minor = decoder.read8();
    int build = decoder.read16();
    decoder.skip(RESERVED_BYTES);
    int ntlmRevision = decoder.read8();
    return NtlmSspVersion.make(major, minor, build, ntlmRevision);
  }

  void encode(@Nonnull NtlmMessageEncoder encoder) {
    encoder.write8(major);
    encoder.write8(minor);
    encoder.write16(build);
    encoder.writeBytes(new byte[RESERVED_BYTES]);
    encoder.write8(ntlmRevision);
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof NtlmSspVersion)) { return false; }
    NtlmSspVersion other = (NtlmSspVersion) object;
    return major == other.major
        && minor == other.minor
        && build == other.build
        && ntlmRevision == other.ntlmRevision;
  }

  @Override
  public int hashCode() {
    return Objects.hash(major, minor, build, ntlmRevision);
  }

  @Override
  public String toString() {
    return major + "." + minor + "." + build + "/" + ntlmRevision;
  }
}
