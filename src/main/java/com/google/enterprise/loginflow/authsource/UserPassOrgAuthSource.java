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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.loginflow.common.ErrorCodes;
import com.google.enterprise.loginflow.config.AuthSourceConfig;
import com.google.enterprise.loginflow.config.UsernameOrgMethod;

import java.io.IOException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A backend that verifies a username and a password within an organization.
 */
@ThreadSafe
public abstract class UserPassOrgAuthSource extends AuthSource {
  public static final String ORGANIZATION_COOKIE_SUFFIX = "-organization";

  private final boolean rememberOrganizationEnabled;
  private final boolean rememberOrganizationChecked;
  @Nonnull private final UsernameOrgMethod usernameOrgMethod;

  protected UserPassOrgAuthSource(AuthSourceConfig config) {
    super(config);
    rememberOrganizationEnabled = config.isRememberOrganizationEnabled();
    rememberOrganizationChecked = config.isRememberOrganizationChecked();
    usernameOrgMethod = config.getUsernameOrgMethod();
  }

  public boolean isRememberOrganizationEnabled() {
    return rememberOrganizationEnabled;
  }

  public boolean isRememberOrganizationChecked() {
    return rememberOrganizationChecked;
  }

  @Nonnull
  public UsernameOrgMethod getUsernameOrgMethod() {
    return usernameOrgMethod;
  }

  @Nonnull
  public String getOrganizationCookieName() {
    return getAuthId() + ORGANIZATION_COOKIE_SUFFIX;
  }

  /**
   * Lists the organizations the user may choose between.
   *
   * @return The organizations in display order, or {@code null} if the user
   *     doesn't choose one on the form.
   * @throws IOException if the backend can't be reached.
   */
  @Nullable
  public ImmutableList<Organization> listOrganizations()
      throws IOException {
    return (usernameOrgMethod == UsernameOrgMethod.FORCE) ? null : getOrganizations();
  }

  /**
   * Verifies credentials, first splitting a {@code user@org} username when
   * this source's username/organization method asks for it.
   *
   * @return The verified user's attributes.
   * @throws AuthnFailureException if the credentials are rejected.
   * @throws IOException if the backend can't be reached.
   */
  @Nonnull
  public final ImmutableMap<String, ImmutableList<String>> authenticate(String username,
      String password, String organization)
      throws AuthnFailureException, IOException {
    if (usernameOrgMethod != UsernameOrgMethod.NONE) {
      String[] parts = splitUsername(username);
      if (parts != null) {
        username = parts[0];
        organization = parts[1];
      } else if (usernameOrgMethod == UsernameOrgMethod.FORCE) {
        throw new AuthnFailureException(ErrorCodes.WRONGUSERPASS);
      }
    }
    return login(username, password, organization);
  }

  /**
   * Splits a username of the form {@code user@org}.
   *
   * @return The user and organization parts, or {@code null} if the username
   *     doesn't have that form.
   */
  @VisibleForTesting
  @Nullable
  static String[] splitUsername(String username) {
    int at = username.indexOf('@');
    if (at <= 0 || at == username.length() - 1) {
      return null;
    }
    return new String[] { username.substring(0, at), username.substring(at + 1) };
  }

  /**
   * Gets every organization known to this backend, in display order.
   */
  @Nonnull
  protected abstract ImmutableList<Organization> getOrganizations()
      throws IOException;

  /**
   * Verifies a username and password within an organization.
   *
   * @param username The username, never {@code null} but possibly empty.
   * @param password The password, never {@code null} but possibly empty.
   * @param organization The organization ID, possibly empty.
   * @return The verified user's attributes.
   * @throws AuthnFailureException if the credentials are rejected.
   * @throws IOException if the backend can't be reached.
   */
  @Nonnull
  protected abstract ImmutableMap<String, ImmutableList<String>> login(String username,
      String password, String organization)
      throws AuthnFailureException, IOException;
}
