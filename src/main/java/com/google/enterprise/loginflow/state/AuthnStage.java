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

/**
 * The stage tag attached to a saved authentication state.  A state may only be
 * loaded by the flow that owns the stage it was saved under.
 */
public enum AuthnStage {
  // The username/password form is being shown.
  USERPASS("core:UserPassBase.state"),
  // The username/password/organization form is being shown.
  USERPASS_ORG("core:UserPassOrgBase.state"),
  // Credentials were verified; the state is waiting for the protocol layer.
  COMPLETED("core:completed");

  private final String tag;

  private AuthnStage(String tag) {
    this.tag = tag;
  }

  /**
   * Gets the stage tag as it appears in log messages.
   */
  public String getTag() {
    return tag;
  }
}
