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

package com.google.enterprise.loginflow.config;

import com.google.gson.annotations.SerializedName;

/**
 * How an organization backend treats a username of the form {@code user@org}.
 */
public enum UsernameOrgMethod {
  // The username is used as given.
  @SerializedName("none")
  NONE,
  // A username of the form user@org selects the organization.
  @SerializedName("allow")
  ALLOW,
  // The username must be of the form user@org.
  @SerializedName("force")
  FORCE
}
