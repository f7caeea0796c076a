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

import javax.annotation.Nonnull;

/**
 * Decides what to do with a remember cookie when a form is submitted.  A
 * checked box keeps the cookie for a year; an unchecked box replaces it with
 * one that has already expired, which makes the browser drop it.
 */
public final class RememberPolicy {

  /** How long a remembered value is kept: one year. */
  public static final long REMEMBER_SECONDS = 31536000L;

  /** How far in the past a cleared cookie's expiry is set. */
  public static final long CLEAR_SECONDS = 300L;

  /** The value a checked remember box submits. */
  public static final String CHECKBOX_CHECKED = "Yes";

  // Don't instantiate.
  private RememberPolicy() {
    throw new UnsupportedOperationException();
  }

  /**
   * Decides the cookie action for one remembered field.
   *
   * @param featureEnabled Is remembering this field enabled for the source?
   * @param checkboxChecked Did the user check the remember box?
   * @return The decision.
   */
  @Nonnull
  public static RememberDecision decide(boolean featureEnabled, boolean checkboxChecked) {
    if (!featureEnabled) {
      return RememberDecision.NO_ACTION;
    }
    return checkboxChecked ? RememberDecision.REMEMBER : RememberDecision.FORGET;
  }

  /**
   * Is the submitted value of a remember box the checked value?
   */
  public static boolean isChecked(String submitted) {
    return CHECKBOX_CHECKED.equals(submitted);
  }
}
