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
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.loginflow.authsource.AuthSourceRegistry;
import com.google.enterprise.loginflow.authsource.AuthnFailureException;
import com.google.enterprise.loginflow.authsource.Organization;
import com.google.enterprise.loginflow.authsource.UnknownAuthSourceException;
import com.google.enterprise.loginflow.authsource.UserPassAuthSource;
import com.google.enterprise.loginflow.authsource.UserPassOrgAuthSource;
import com.google.enterprise.loginflow.state.AuthnStage;
import com.google.enterprise.loginflow.state.AuthnState;
import com.google.enterprise.loginflow.state.NoStateException;
import com.google.enterprise.loginflow.state.StageMismatchException;
import com.google.enterprise.loginflow.state.StateIds;
import com.google.enterprise.loginflow.state.StateStore;
import com.google.inject.Singleton;

import java.io.IOException;
import java.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;

/**
 * Runs credential verification for a saved state and, on success, moves the
 * state to the completed stage.
 */
@Singleton
@ThreadSafe
public class UserPassAuthnHandler {
  private static final Logger logger = Logger.getLogger(UserPassAuthnHandler.class.getName());

  private final StateStore stateStore;
  private final AuthSourceRegistry authSourceRegistry;

  @Inject
  UserPassAuthnHandler(StateStore stateStore, AuthSourceRegistry authSourceRegistry) {
    Preconditions.checkNotNull(stateStore);
    Preconditions.checkNotNull(authSourceRegistry);
    this.stateStore = stateStore;
    this.authSourceRegistry = authSourceRegistry;
  }

  /**
   * Verifies a username and password for a state of the username/password
   * flow.
   *
   * @param stateId The ID of a state saved under {@link AuthnStage#USERPASS}.
   * @param username The username to verify.
   * @param password The password to verify.
   * @return The completed login.
   * @throws AuthnFailureException if the backend rejects the credentials.
   * @throws NoStateException if there's no such state.
   * @throws StageMismatchException if the state belongs to another stage.
   * @throws UnknownAuthSourceException if the state's backend is gone.
   * @throws IOException if the store or the backend can't be reached.
   */
  @Nonnull
  public CompletedLogin handleLogin(String stateId, String username, String password)
      throws AuthnFailureException, NoStateException, StageMismatchException,
      UnknownAuthSourceException, IOException {
    AuthnState state = stateStore.load(stateId, AuthnStage.USERPASS);
    UserPassAuthSource authSource
        = authSourceRegistry.getById(state.getAuthSourceId(), UserPassAuthSource.class);
    ImmutableMap<String, ImmutableList<String>> attributes = authSource.login(username, password);
    return complete(stateId, state, attributes);
  }

  /**
   * Verifies a username, password and organization for a state of the
   * organization flow.
   *
   * @param stateId The ID of a state saved under
   *     {@link AuthnStage#USERPASS_ORG}.
   * @param username The username to verify.
   * @param password The password to verify.
   * @param organization The selected organization's ID.
   * @return The completed login.
   * @throws AuthnFailureException if the backend rejects the credentials.
   * @throws NoStateException if there's no such state.
   * @throws StageMismatchException if the state belongs to another stage.
   * @throws UnknownAuthSourceException if the state's backend is gone.
   * @throws IOException if the store or the backend can't be reached.
   */
  @Nonnull
  public CompletedLogin handleLogin(String stateId, String username, String password,
      String organization)
      throws AuthnFailureException, NoStateException, StageMismatchException,
      UnknownAuthSourceException, IOException {
    AuthnState state = stateStore.load(stateId, AuthnStage.USERPASS_ORG);
    UserPassOrgAuthSource authSource
        = authSourceRegistry.getById(state.getAuthSourceId(), UserPassOrgAuthSource.class);
    ImmutableMap<String, ImmutableList<String>> attributes
        = authSource.authenticate(username, password, organization);
    return complete(stateId, state.toBuilder().setCachedOrganization(organization).build(),
        attributes);
  }

  /**
   * Lists the organizations for a state of the organization flow.
   *
   * @param stateId The ID of a state saved under
   *     {@link AuthnStage#USERPASS_ORG}.
   * @return The organizations in display order, or {@code null} if the user
   *     doesn't select one.
   */
  @Nullable
  public ImmutableList<Organization> listOrganizations(String stateId)
      throws NoStateException, StageMismatchException, UnknownAuthSourceException,
      IOException {
    AuthnState state = stateStore.load(stateId, AuthnStage.USERPASS_ORG);
    return authSourceRegistry.getById(state.getAuthSourceId(), UserPassOrgAuthSource.class)
        .listOrganizations();
  }

  private CompletedLogin complete(String stateId, AuthnState state,
      ImmutableMap<String, ImmutableList<String>> attributes)
      throws IOException {
    AuthnState completed = state.toBuilder()
        .setError(null)
        .setAttributes(attributes)
        .build();
    String completedId = stateStore.save(completed, AuthnStage.COMPLETED);
    logger.fine(StateIds.logMessage(stateId, "completed as " + completedId));
    return CompletedLogin.make(completedId, completed);
  }
}
