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

package com.google.enterprise.loginflow.remember;

import java.util.concurrent.TimeUnit;

/**
 * The outcome of {@link RememberPolicy#decide}.
 */
public enum RememberDecision {
  NO_ACTION(false, 0),
  REMEMBER(true, RememberPolicy.REMEMBER_SECONDS),
  FORGET(true, -RememberPolicy.CLEAR_SECONDS);

  private final boolean shouldSet;
  private final long expirySeconds;

  private RememberDecision(boolean shouldSet, long expirySeconds) {
    this.shouldSet = shouldSet;
    this.expirySeconds = expirySeconds;
  }

  /**
   * Should a cookie be sent this round?
   */
  public boolean shouldSet() {
    return shouldSet;
  }

  /**
   * Gets the cookie's expiry relative to now, in seconds.  Negative values are
   * in the past.
   */
  public long getExpirySeconds() {
    return expirySeconds;
  }

  /**
   * Gets the cookie's absolute expiry.
   *
   * @param nowMillis The current time in milliseconds since the epoch.
   * @return The expiry in milliseconds since the epoch.
   */
  public long getExpiryMillis(long nowMillis) {
    return nowMillis + TimeUnit.SECONDS.toMillis(expirySeconds);
  }
}
