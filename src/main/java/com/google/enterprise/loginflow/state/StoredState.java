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

package com.google.enterprise.loginflow.state;

import com.google.common.base.Preconditions;

import java.io.Serializable;

import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * A state as held by a store: the state plus the stage it was saved under.
 */
@Immutable
@ParametersAreNonnullByDefault
final class StoredState implements Serializable {
  private static final long serialVersionUID = 1L;

  @Nonnull private final AuthnStage stage;
  @Nonnull private final AuthnState state;

  StoredState(AuthnStage stage, AuthnState state) {
    Preconditions.checkNotNull(stage);
    Preconditions.checkNotNull(state);
    this.stage = stage;
    this.state = state;
  }

  @Nonnull
  AuthnState getState() {
    return state;
  }

  /**
   * Gets the state if it was saved under the expected stage.
   */
  @Nonnull
  AuthnState checkStage(AuthnStage expectedStage)
      throws StageMismatchException {
    if (stage != expectedStage) {
      throw new StageMismatchException(expectedStage, stage);
    }
    return state;
  }
}
