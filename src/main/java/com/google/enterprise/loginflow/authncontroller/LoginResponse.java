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

package com.google.enterprise.loginflow.authncontroller;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.enterprise.loginflow.remember.RememberCookie;

import java.util.List;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The outcome of one login-form request: either a page to render or a
 * completed login, plus the remember cookies to send either way.
 */
@Immutable
public final class LoginResponse {
  @Nullable private final LoginPage page;
  @Nullable private final CompletedLogin completedLogin;
  @Nonnull private final ImmutableList<RememberCookie> cookies;

  private LoginResponse(LoginPage page, CompletedLogin completedLogin,
      ImmutableList<RememberCookie> cookies) {
    this.page = page;
    this.completedLogin = completedLogin;
    this.cookies = cookies;
  }

  @Nonnull
  public static LoginResponse makePage(LoginPage page, List<RememberCookie> cookies) {
    Preconditions.checkNotNull(page);
    return new LoginResponse(page, null, ImmutableList.copyOf(cookies));
  }

  @Nonnull
  public static LoginResponse makeCompleted(CompletedLogin completedLogin,
      List<RememberCookie> cookies) {
    Preconditions.checkNotNull(completedLogin);
    return new LoginResponse(null, completedLogin, ImmutableList.copyOf(cookies));
  }

  public boolean isCompleted() {
    return completedLogin != null;
  }

  /**
   * Gets the page to render.
   *
   * @throws IllegalStateException if the login was completed.
   */
  @Nonnull
  public LoginPage getPage() {
    Preconditions.checkState(page != null, "Login was completed");
    return page;
  }

  /**
   * Gets the completed login.
   *
   * @throws IllegalStateException if a page is to be rendered.
   */
  @Nonnull
  public CompletedLogin getCompletedLogin() {
    Preconditions.checkState(completedLogin != null, "Login wasn't completed");
    return completedLogin;
  }

  @Nonnull
  public ImmutableList<RememberCookie> getCookies() {
    return cookies;
  }
}
