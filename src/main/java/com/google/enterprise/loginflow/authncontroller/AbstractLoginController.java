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
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.loginflow.authsource.AuthSourceRegistry;
import com.google.enterprise.loginflow.authsource.AuthnFailureException;
import com.google.enterprise.loginflow.common.BadRequestException;
import com.google.enterprise.loginflow.common.HttpUtil;
import com.google.enterprise.loginflow.common.LoginFlowException;
import com.google.enterprise.loginflow.remember.RememberCookie;
import com.google.enterprise.loginflow.remember.RememberDecision;
import com.google.enterprise.loginflow.remember.RememberPolicy;
import com.google.enterprise.loginflow.remember.SameSiteSupport;
import com.google.enterprise.loginflow.state.AuthnError;
import com.google.enterprise.loginflow.state.StateIds;
import com.google.enterprise.loginflow.state.StateStore;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.servlet.http.HttpServletRequest;

/**
 * The parts shared by the login-form controllers.  A controller handles one
 * request against a saved state: it either shows the form again, possibly
 * with an error, or completes the login.
 */
public abstract class AbstractLoginController {
  private static final Logger logger = Logger.getLogger(AbstractLoginController.class.getName());

  public static final String PARAM_AUTH_STATE = "AuthState";
  public static final String FIELD_USERNAME = "username";
  public static final String FIELD_PASSWORD = "password";
  public static final String FIELD_ORGANIZATION = "organization";
  public static final String FIELD_REMEMBER_USERNAME = "remember_username";
  public static final String FIELD_REMEMBER_ME = "remember_me";
  public static final String FIELD_REMEMBER_ORGANIZATION = "remember_organization";

  protected final StateStore stateStore;
  protected final AuthSourceRegistry authSourceRegistry;
  protected final UserPassAuthnHandler authnHandler;

  protected AbstractLoginController(StateStore stateStore, AuthSourceRegistry authSourceRegistry,
      UserPassAuthnHandler authnHandler) {
    Preconditions.checkNotNull(stateStore);
    Preconditions.checkNotNull(authSourceRegistry);
    Preconditions.checkNotNull(authnHandler);
    this.stateStore = stateStore;
    this.authSourceRegistry = authSourceRegistry;
    this.authnHandler = authnHandler;
  }

  /**
   * Handles one request to the login form.
   *
   * @param request The request.
   * @return The page to render or the completed login, with cookies.
   * @throws LoginFlowException if the request can't be processed at all.
   * @throws IOException if the state store or a backend can't be reached.
   */
  @Nonnull
  public abstract LoginResponse handle(HttpServletRequest request)
      throws LoginFlowException, IOException;

  /**
   * Gets the state ID from a request.
   *
   * @throws BadRequestException if the request has no state ID.
   */
  @Nonnull
  protected static String getStateId(HttpServletRequest request)
      throws BadRequestException {
    String stateId = request.getParameter(PARAM_AUTH_STATE);
    if (stateId == null) {
      throw new BadRequestException("Missing " + PARAM_AUTH_STATE + " parameter");
    }
    return stateId;
  }

  /**
   * Is a remember box of the submitted form checked?
   */
  protected static boolean isChecked(HttpServletRequest request, String fieldName) {
    return RememberPolicy.isChecked(HttpUtil.getFormParameter(request, fieldName));
  }

  /**
   * Was a non-empty value submitted for a form field?
   */
  protected static boolean isSubmitted(HttpServletRequest request, String fieldName) {
    String value = HttpUtil.getFormParameter(request, fieldName);
    return value != null && !value.isEmpty();
  }

  protected static boolean hasCookie(HttpServletRequest request, String cookieName) {
    return HttpUtil.findCookie(request, cookieName) != null;
  }

  /**
   * Applies the remember policy to one field, adding a cookie when it calls
   * for one.
   */
  protected static void rememberField(HttpServletRequest request, String cookieName,
      String value, boolean enabled, String checkboxName, List<RememberCookie> cookies) {
    RememberDecision decision = RememberPolicy.decide(enabled, isChecked(request, checkboxName));
    if (decision.shouldSet()) {
      cookies.add(
          RememberCookie.make(cookieName, value, decision, request.isSecure(),
              SameSiteSupport.canSetSameSiteNone(
                  request.getHeader(HttpUtil.HTTP_HEADER_USER_AGENT))));
    }
  }

  /**
   * Gets the query parameters that let a reloaded error page find its state.
   */
  @Nonnull
  protected static Map<String, String> errorQueryParams(@Nullable AuthnError error,
      String stateId) {
    return (error == null)
        ? ImmutableMap.<String, String>of()
        : ImmutableMap.of(PARAM_AUTH_STATE, stateId);
  }

  protected static void logSuccess(HttpServletRequest request, String stateId, String username) {
    logger.info(StateIds.logMessage(stateId,
        "User " + username + " from " + request.getRemoteAddr()
        + " successfully authenticated"));
  }

  protected static void logFailure(HttpServletRequest request, String stateId, String username,
      AuthnFailureException e) {
    logger.info(StateIds.logMessage(stateId,
        "User " + username + " from " + request.getRemoteAddr()
        + " failed to authenticate: " + e.getCode()));
  }
}
