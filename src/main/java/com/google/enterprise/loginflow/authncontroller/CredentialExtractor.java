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

import com.google.common.base.Strings;
import com.google.enterprise.loginflow.common.HttpUtil;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.servlet.http.HttpServletRequest;

/**
 * Derives the effective value of a remembered form field from, in order of
 * precedence, the submitted form, the field's remember cookie, and the value
 * cached in the authentication state.
 */
public final class CredentialExtractor {

  // Don't instantiate.
  private CredentialExtractor() {
    throw new UnsupportedOperationException();
  }

  /**
   * Picks the effective value of a field.
   *
   * @param submittedValue The submitted form value, or {@code null} if the
   *     field wasn't submitted.  An empty submission still wins.
   * @param cookiePresent Does the request carry the field's remember cookie?
   * @param cookieValue The cookie's value, if present.
   * @param cookieEnabled Is remembering this field enabled?
   * @param cachedValue The value cached in the state, or {@code null}.
   * @return The effective value, never {@code null}.
   */
  @Nonnull
  public static String extract(@Nullable String submittedValue, boolean cookiePresent,
      @Nullable String cookieValue, boolean cookieEnabled, @Nullable String cachedValue) {
    if (submittedValue != null) {
      return submittedValue;
    }
    if (cookieEnabled && cookiePresent) {
      return Strings.nullToEmpty(cookieValue);
    }
    return Strings.nullToEmpty(cachedValue);
  }

  /**
   * Picks the effective value of a field of a request.
   *
   * @param request The request carrying the form and cookies.
   * @param fieldName The form field's name.
   * @param cookieName The name of the field's remember cookie.
   * @param cookieEnabled Is remembering this field enabled?
   * @param cachedValue The value cached in the state, or {@code null}.
   * @return The effective value, never {@code null}.
   */
  @Nonnull
  public static String extract(HttpServletRequest request, String fieldName, String cookieName,
      boolean cookieEnabled, @Nullable String cachedValue) {
    String cookieValue = HttpUtil.getCookieValue(request, cookieName);
    return extract(HttpUtil.getFormParameter(request, fieldName), cookieValue != null,
        cookieValue, cookieEnabled, cachedValue);
  }

  /**
   * Gets the submitted password, or the empty string if none was submitted.
   */
  @Nonnull
  public static String extractPassword(HttpServletRequest request, String fieldName) {
    return Strings.nullToEmpty(HttpUtil.getFormParameter(request, fieldName));
  }
}
