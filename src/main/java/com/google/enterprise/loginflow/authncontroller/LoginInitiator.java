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
import com.google.enterprise.loginflow.authsource.AuthSource;
import com.google.enterprise.loginflow.authsource.AuthSourceRegistry;
import com.google.enterprise.loginflow.authsource.UnknownAuthSourceException;
import com.google.enterprise.loginflow.authsource.UserPassAuthSource;
import com.google.enterprise.loginflow.authsource.UserPassOrgAuthSource;
import com.google.enterprise.loginflow.common.HttpUtil;
import com.google.enterprise.loginflow.config.ConfigSingleton;
import com.google.enterprise.loginflow.state.AuthnStage;
import com.google.enterprise.loginflow.state.AuthnState;
import com.google.enterprise.loginflow.state.StateIds;
import com.google.enterprise.loginflow.state.StateStore;
import com.google.inject.Singleton;

import java.io.IOException;
import java.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.inject.Inject;

/**
 * Starts a login: saves the initial state under the stage of its backend's
 * form and says where to send the user.
 */
@Singleton
public class LoginInitiator {
  private static final Logger logger = Logger.getLogger(LoginInitiator.class.getName());

  public static final String USERPASS_PATH = "loginuserpass";
  public static final String USERPASS_ORG_PATH = "loginuserpassorg";

  private final StateStore stateStore;
  private final AuthSourceRegistry authSourceRegistry;

  @Inject
  LoginInitiator(StateStore stateStore, AuthSourceRegistry authSourceRegistry) {
    Preconditions.checkNotNull(stateStore);
    Preconditions.checkNotNull(authSourceRegistry);
    this.stateStore = stateStore;
    this.authSourceRegistry = authSourceRegistry;
  }

  /**
   * Starts a login.
   *
   * @param state The initial state, naming the backend to use.
   * @return The URL of the login form for the new state.
   * @throws UnknownAuthSourceException if the backend isn't configured.
   * @throws IOException if the state can't be saved.
   */
  @Nonnull
  public String startLogin(AuthnState state)
      throws UnknownAuthSourceException, IOException {
    AuthSource authSource = authSourceRegistry.getById(state.getAuthSourceId());
    String path;
    AuthnStage stage;
    if (authSource instanceof UserPassOrgAuthSource) {
      path = USERPASS_ORG_PATH;
      stage = AuthnStage.USERPASS_ORG;
    } else if (authSource instanceof UserPassAuthSource) {
      path = USERPASS_PATH;
      stage = AuthnStage.USERPASS;
    } else {
      throw new UnknownAuthSourceException("No login form for auth source "
          + state.getAuthSourceId());
    }
    String stateId = stateStore.save(state, stage);
    logger.info(StateIds.logMessage(stateId, "login started with " + authSource));
    return HttpUtil.addQueryParameter(ConfigSingleton.getParams().getLoginUrlBase() + path,
        AbstractLoginController.PARAM_AUTH_STATE, stateId);
  }
}
