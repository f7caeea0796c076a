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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.loginflow.config.AuthSourceConfig;

import java.io.IOException;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A backend that verifies a username and a password.
 */
@ThreadSafe
public abstract class UserPassAuthSource extends AuthSource {
  private final boolean rememberMeEnabled;
  private final boolean rememberMeChecked;

  protected UserPassAuthSource(AuthSourceConfig config) {
    super(config);
    rememberMeEnabled = config.isRememberMeEnabled();
    rememberMeChecked = config.isRememberMeChecked();
  }

  public boolean isRememberMeEnabled() {
    return rememberMeEnabled;
  }

  public boolean isRememberMeChecked() {
    return rememberMeChecked;
  }

  /**
   * Verifies a username and password.
   *
   * @param username The username, never {@code null} but possibly empty.
   * @param password The password, never {@code null} but possibly empty.
   * @return The verified user's attributes.
   * @throws AuthnFailureException if the credentials are rejected.
   * @throws IOException if the backend can't be reached.
   */
  @Nonnull
  public abstract ImmutableMap<String, ImmutableList<String>> login(String username,
      String password)
      throws AuthnFailureException, IOException;
}
