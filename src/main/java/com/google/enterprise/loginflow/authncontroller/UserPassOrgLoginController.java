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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.enterprise.loginflow.authsource.AuthSourceRegistry;
import com.google.enterprise.loginflow.authsource.AuthnFailureException;
import com.google.enterprise.loginflow.authsource.Organization;
import com.google.enterprise.loginflow.authsource.UserPassOrgAuthSource;
import com.google.enterprise.loginflow.common.LoginFlowException;
import com.google.enterprise.loginflow.remember.RememberCookie;
import com.google.enterprise.loginflow.state.AuthnError;
import com.google.enterprise.loginflow.state.AuthnStage;
import com.google.enterprise.loginflow.state.AuthnState;
import com.google.enterprise.loginflow.state.StateStore;
import com.google.inject.Singleton;

import java.io.IOException;
import java.util.List;

import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;
import javax.servlet.http.HttpServletRequest;

/**
 * The controller of the username/password/organization login form.  Unlike
 * the plain form it has no remember-me option and never forces the username.
 */
@Singleton
@ThreadSafe
public class UserPassOrgLoginController extends AbstractLoginController {

  @Inject
  UserPassOrgLoginController(StateStore stateStore, AuthSourceRegistry authSourceRegistry,
      UserPassAuthnHandler authnHandler) {
    super(stateStore, authSourceRegistry, authnHandler);
  }

  @Override
  public LoginResponse handle(HttpServletRequest request)
      throws LoginFlowException, IOException {
    String stateId = getStateId(request);
    AuthnState state = stateStore.load(stateId, AuthnStage.USERPASS_ORG);
    UserPassOrgAuthSource authSource
        = authSourceRegistry.getById(state.getAuthSourceId(), UserPassOrgAuthSource.class);

    ImmutableList<Organization> organizations = authnHandler.listOrganizations(stateId);
    String usernameCookieName = authSource.getUsernameCookieName();
    String organizationCookieName = authSource.getOrganizationCookieName();
    String username = CredentialExtractor.extract(request, FIELD_USERNAME, usernameCookieName,
        authSource.isRememberUsernameEnabled(), state.getCachedUsername());
    String password = CredentialExtractor.extractPassword(request, FIELD_PASSWORD);
    String organization = CredentialExtractor.extract(request, FIELD_ORGANIZATION,
        organizationCookieName, authSource.isRememberOrganizationEnabled(),
        state.getCachedOrganization());

    AuthnError error = state.getError();
    List<RememberCookie> cookies = Lists.newArrayList();

    if ((organizations == null || !organization.isEmpty())
        && (isSubmitted(request, FIELD_USERNAME) || !password.isEmpty())) {
      rememberField(request, usernameCookieName, username,
          authSource.isRememberUsernameEnabled(), FIELD_REMEMBER_USERNAME, cookies);
      rememberField(request, organizationCookieName, organization,
          authSource.isRememberOrganizationEnabled(), FIELD_REMEMBER_ORGANIZATION, cookies);

      try {
        CompletedLogin completedLogin
            = authnHandler.handleLogin(stateId, username, password, organization);
        logSuccess(request, stateId, username);
        return LoginResponse.makeCompleted(completedLogin, cookies);
      } catch (AuthnFailureException e) {
        logFailure(request, stateId, username, e);
        error = e.toError();
        stateId = stateStore.save(state.withError(error), AuthnStage.USERPASS_ORG);
      }
    }

    LoginPage page = LoginPage.builder(stateId)
        .setUsername(username, false)
        .setRememberUsername(authSource.isRememberUsernameEnabled(),
            authSource.isRememberUsernameChecked() || hasCookie(request, usernameCookieName))
        .setRememberMe(false, false)
        .setRememberOrganization(authSource.isRememberOrganizationEnabled(),
            authSource.isRememberOrganizationChecked()
            || hasCookie(request, organizationCookieName))
        .setLinks(authSource.getLoginLinks())
        .setError(error)
        .setQueryParams(errorQueryParams(error, stateId))
        .setOrganizations(organizations, organization)
        .setSpMetadata(state.getSpMetadata())
        .build();
    return LoginResponse.makePage(page, cookies);
  }
}
