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

package com.google.enterprise.loginflow.authsource;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.loginflow.state.AuthnError;

import java.util.Map;

import javax.annotation.Nonnull;

/**
 * Thrown by a backend when the supplied credentials are rejected.  The failure
 * is recoverable: the login form is shown again with the error.
 */
public class AuthnFailureException extends Exception {
  private final String code;
  private final ImmutableMap<String, String> params;

  public AuthnFailureException(String code) {
    this(code, ImmutableMap.<String, String>of());
  }

  public AuthnFailureException(String code, Map<String, String> params) {
    super(code);
    Preconditions.checkArgument(!Strings.isNullOrEmpty(code));
    this.code = code;
    this.params = ImmutableMap.copyOf(params);
  }

  @Nonnull
  public String getCode() {
    return code;
  }

  @Nonnull
  public ImmutableMap<String, String> getParams() {
    return params;
  }

  /**
   * Gets this failure as an error that can be attached to a state.
   */
  @Nonnull
  public AuthnError toError() {
    return AuthnError.make(code, params);
  }
}
