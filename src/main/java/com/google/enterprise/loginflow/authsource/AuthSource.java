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
import com.google.common.collect.ImmutableList;
import com.google.enterprise.loginflow.config.AuthSourceConfig;
import com.google.enterprise.loginflow.config.LoginLink;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * A configured credential-verification backend.  Subclasses define the kind of
 * credentials they accept.
 */
@Immutable
public abstract class AuthSource {
  public static final String USERNAME_COOKIE_SUFFIX = "-username";

  @Nonnull private final String authId;
  private final boolean rememberUsernameEnabled;
  private final boolean rememberUsernameChecked;
  @Nonnull private final ImmutableList<LoginLink> loginLinks;

  protected AuthSource(AuthSourceConfig config) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(config.getId()));
    authId = config.getId();
    rememberUsernameEnabled = config.isRememberUsernameEnabled();
    rememberUsernameChecked = config.isRememberUsernameChecked();
    loginLinks = config.getLoginLinks();
  }

  /**
   * Gets the configured ID of this source, which is also the prefix of its
   * cookie names.
   */
  @Nonnull
  public String getAuthId() {
    return authId;
  }

  public boolean isRememberUsernameEnabled() {
    return rememberUsernameEnabled;
  }

  /**
   * Is the remember-username checkbox checked by default?
   */
  public boolean isRememberUsernameChecked() {
    return rememberUsernameChecked;
  }

  @Nonnull
  public ImmutableList<LoginLink> getLoginLinks() {
    return loginLinks;
  }

  @Nonnull
  public String getUsernameCookieName() {
    return authId + USERNAME_COOKIE_SUFFIX;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + authId + ")";
  }
}
