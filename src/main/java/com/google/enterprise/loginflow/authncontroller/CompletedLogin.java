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
import com.google.common.base.Strings;
import com.google.enterprise.loginflow.state.AuthnState;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * A login whose credentials were verified.  The state has been saved under the
 * completed stage, where the protocol layer picks it up.
 */
@Immutable
public final class CompletedLogin {
  @Nonnull private final String stateId;
  @Nonnull private final AuthnState state;

  private CompletedLogin(String stateId, AuthnState state) {
    this.stateId = stateId;
    this.state = state;
  }

  @Nonnull
  public static CompletedLogin make(String stateId, AuthnState state) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(stateId));
    Preconditions.checkNotNull(state);
    return new CompletedLogin(stateId, state);
  }

  /**
   * Gets the ID of the completed state.
   */
  @Nonnull
  public String getStateId() {
    return stateId;
  }

  @Nonnull
  public AuthnState getState() {
    return state;
  }

  @Override
  public String toString() {
    return "CompletedLogin(" + stateId + ", " + state + ")";
  }
}
