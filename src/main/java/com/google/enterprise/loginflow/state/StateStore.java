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

import java.io.IOException;

/**
 * Durable storage for authentication states.  A store never updates an entry in
 * place: every save creates a new entry under a fresh ID, and entries expire
 * after a fixed time to live.
 */
public interface StateStore {

  /**
   * Saves a state under a stage.
   *
   * @param state The state to save.
   * @param stage The stage the state is saved for.
   * @return The new state's ID.
   * @throws IOException if the backing store can't be written.
   */
  String save(AuthnState state, AuthnStage stage)
      throws IOException;

  /**
   * Loads a previously saved state.
   *
   * @param stateId The ID returned by {@link #save}.
   * @param expectedStage The stage the caller handles.
   * @return The saved state.
   * @throws NoStateException if the ID is malformed, unknown or expired.
   * @throws StageMismatchException if the state was saved under another stage.
   * @throws IOException if the backing store can't be read.
   */
  AuthnState load(String stateId, AuthnStage expectedStage)
      throws NoStateException, StageMismatchException, IOException;
}
