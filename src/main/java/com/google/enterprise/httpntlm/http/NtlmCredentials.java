// Copyright 2012 Google Inc.
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

package com.google.enterprise.httpntlm.http;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The identity an NTLM transport authenticates as.
 */
@Immutable
public final class NtlmCredentials {
  @Nullable private final String domain;
  @Nonnull private final String userName;
  @Nonnull private final String password;
  @Nullable private final String workstation;

  private NtlmCredentials(String domain, String userName, String password, String workstation) {
    this.domain = domain;
    this.userName = userName;
    this.password = password;
    this.workstation = workstation;
  }

  /**
   * Makes a credential set.
   *
   * @param domain The user's domain; may be null or empty.
   * @param userName The user name; must be non-empty.
   * @param password The password; must be non-empty.
   * @param workstation The client's workstation name; may be null or empty.
   * @return The credentials.
   */
  public static NtlmCredentials make(@Nullable String domain, String userName, String password,
      @Nullable String workstation) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(userName), "User name must be non-empty");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(password), "Password must be non-empty");
    return new NtlmCredentials(domain, userName, password, workstation);
  }

  @Nullable
  public String getDomain() {
    return domain;
  }

  public String getUserName() {
    return userName;
  }

  public String getPassword() {
    return password;
  }

  @Nullable
  public String getWorkstation() {
    return workstation;
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof NtlmCredentials)) { return false; }
    NtlmCredentials other = (NtlmCredentials) object;
    return Objects.equals(domain, other.domain)
        && Objects.equals(userName, other.userName)
        && Objects.equals(password, other.password)
        && Objects.equals(workstation, other.workstation);
  }

  @Override
  public int hashCode() {
    return Objects.hash(domain, userName, password, workstation);
  }

  // Never shows the password.
  @Override
  public String toString() {
    return Strings.isNullOrEmpty(domain) ? userName : domain + "\\" + userName;
  }
}
