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

package com.google.enterprise.loginflow.common;

/**
 * A fatal error in the login flow.  These are never shown inline on the login
 * form; they terminate the request with an HTTP error status.
 */
public abstract class LoginFlowException extends Exception {

  protected LoginFlowException(String message) {
    super(message);
  }

  protected LoginFlowException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Gets the HTTP status code to answer the request with.
   */
  public abstract int getStatusCode();
}
