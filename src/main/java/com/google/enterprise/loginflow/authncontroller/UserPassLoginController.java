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

import com.google.common.collect.Lists;
import com.google.enterprise.loginflow.authsource.AuthSourceRegistry;
import com.google.enterprise.loginflow.authsource.AuthnFailureException;
import com.google.enterprise.loginflow.authsource.UserPassAuthSource;
import com.google.enterprise.loginflow.common.LoginFlowException;
import com.google.enterprise.loginflow.remember.RememberCookie;
import com.google.enterprise.loginflow.state.AuthnError;
import com.google.enterprise.loginflow.state.AuthnStage;
import com.google.enterprise.loginflow.state.AuthnState;
import com.google.enterprise.loginflow.state.StateIds;
import com.google.enterprise.loginflow.state.StateStore;
import com.google.inject.Singleton;

import java.io.IOException;
import java.util.List;
import java.util.logging.Logger;

import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;
import javax.servlet.http.HttpServletRequest;

/**
 * The controller of the username/password login form.
 */
@Singleton
@ThreadSafe
public class UserPassLoginController extends AbstractLoginController {
  private static final Logger logger = Logger.getLogger(UserPassLoginController.class.getName());

  @Inject
  UserPassLoginController(StateStore stateStore, AuthSourceRegistry authSourceRegistry,
      UserPassAuthnHandler authnHandler) {
    super(stateStore, authSourceRegistry, authnHandler);
  }

  @Override
  public LoginResponse handle(HttpServletRequest request)
      throws LoginFlowException, IOException {
    String stateId = getStateId(request);
    AuthnState state = stateStore.load(stateId, AuthnStage.USERPASS);
    UserPassAuthSource authSource
        = authSourceRegistry.getById(state.getAuthSourceId(), UserPassAuthSource.class);

    String usernameCookieName = authSource.getUsernameCookieName();
    String username = CredentialExtractor.extract(request, FIELD_USERNAME, usernameCookieName,
        authSource.isRememberUsernameEnabled(), state.getCachedUsername());
    String password = CredentialExtractor.extractPassword(request, FIELD_PASSWORD);

    AuthnError error = state.getError();
    List<RememberCookie> cookies = Lists.newArrayList();

    if (isSubmitted(request, FIELD_USERNAME) || !password.isEmpty()) {
      if (state.hasForcedUsername()) {
        username = state.getForcedUsername();
      }

      rememberField(request, usernameCookieName, username,
          authSource.isRememberUsernameEnabled(), FIELD_REMEMBER_USERNAME, cookies);

      if (authSource.isRememberMeEnabled() && isChecked(request, FIELD_REMEMBER_ME)) {
        state = state.toBuilder().setRememberMe(true).setError(null).build();
        stateId = stateStore.save(state, AuthnStage.USERPASS);
        logger.fine(StateIds.logMessage(stateId, "remember me selected"));
      }

      try {
        CompletedLogin completedLogin = authnHandler.handleLogin(stateId, username, password);
        logSuccess(request, stateId, username);
        return LoginResponse.makeCompleted(completedLogin, cookies);
      } catch (AuthnFailureException e) {
        logFailure(request, stateId, username, e);
        error = e.toError();
        stateId = stateStore.save(state.withError(error), AuthnStage.USERPASS);
      }
    }

    LoginPage.Builder builder = LoginPage.builder(stateId);
    if (state.hasForcedUsername()) {
      builder.setUsername(state.getForcedUsername(), true)
          .setRememberUsername(false, false);
    } else {
      builder.setUsername(username, false)
          .setRememberUsername(authSource.isRememberUsernameEnabled(),
              authSource.isRememberUsernameChecked() || hasCookie(request, usernameCookieName));
    }
    LoginPage page = builder
        .setRememberMe(authSource.isRememberMeEnabled(), authSource.isRememberMeChecked())
        .setLinks(authSource.getLoginLinks())
        .setError(error)
        .setQueryParams(errorQueryParams(error, stateId))
        .setSpMetadata(state.getSpMetadata())
        .build();
    return LoginResponse.makePage(page, cookies);
  }
}
