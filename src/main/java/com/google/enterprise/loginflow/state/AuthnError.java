// Copyright 2011 Google Inc.
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

package com.google.enterprise.loginflow.state;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * A verification failure attached to a state so that the next rendering of the
 * login form can display it.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class AuthnError implements Serializable {
  private static final long serialVersionUID = 1L;

  @Nonnull private final String code;
  @Nonnull private final ImmutableMap<String, String> params;

  private AuthnError(String code, ImmutableMap<String, String> params) {
    this.code = code;
    this.params = params;
  }

  /**
   * Makes a new error.
   *
   * @param code The machine-readable error code, e.g. {@code WRONGUSERPASS}.
   * @param params Display parameters for the error message.
   * @return An immutable error.
   */
  @Nonnull
  public static AuthnError make(String code, Map<String, String> params) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(code));
    return new AuthnError(code, ImmutableMap.copyOf(params));
  }

  @Nonnull
  public static AuthnError make(String code) {
    return make(code, ImmutableMap.<String, String>of());
  }

  @Nonnull
  public String getCode() {
    return code;
  }

  @Nonnull
  public ImmutableMap<String, String> getParams() {
    return params;
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof AuthnError)) { return false; }
    AuthnError other = (AuthnError) object;
    return code.equals(other.code) && params.equals(other.params);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, params);
  }

  @Override
  public String toString() {
    return code + params;
  }
}
