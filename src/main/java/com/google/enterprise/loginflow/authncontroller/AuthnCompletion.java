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

import java.io.IOException;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * Hands a completed login back to the protocol layer that started it.
 */
public interface AuthnCompletion {

  /**
   * Finishes the response to a request whose login was completed.
   *
   * @param completedLogin The completed login.
   * @param request The request that completed it.
   * @param response The response to write.
   * @throws IOException if the response can't be written.
   */
  void complete(CompletedLogin completedLogin, HttpServletRequest request,
      HttpServletResponse response)
      throws IOException;
}
