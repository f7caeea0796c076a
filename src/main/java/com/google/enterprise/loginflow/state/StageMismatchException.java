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

import com.google.enterprise.loginflow.common.LoginFlowException;

import javax.annotation.Nonnull;
import javax.servlet.http.HttpServletResponse;

/**
 * Thrown when a state is loaded by a flow other than the one it was saved for.
 */
public class StageMismatchException extends LoginFlowException {
  @Nonnull private final AuthnStage expected;
  @Nonnull private final AuthnStage actual;

  public StageMismatchException(AuthnStage expected, AuthnStage actual) {
    super("Wrong stage in state; expected " + expected.getTag() + " but found "
        + actual.getTag());
    this.expected = expected;
    this.actual = actual;
  }

  @Nonnull
  public AuthnStage getExpected() {
    return expected;
  }

  @Nonnull
  public AuthnStage getActual() {
    return actual;
  }

  @Override
  public int getStatusCode() {
    return HttpServletResponse.SC_FORBIDDEN;
  }
}
