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

package com.google.enterprise.loginflow.servlets;

import com.google.enterprise.loginflow.authncontroller.AuthnCompletion;
import com.google.enterprise.loginflow.authncontroller.UserPassOrgLoginController;
import com.google.enterprise.loginflow.ulf.LoginFormRenderer;
import com.google.inject.Singleton;

import javax.annotation.concurrent.Immutable;
import javax.inject.Inject;

/**
 * The username/password/organization login form.
 */
@Singleton
@Immutable
public class LoginUserPassOrgServlet extends LoginFormServlet {

  @Inject
  public LoginUserPassOrgServlet(UserPassOrgLoginController controller, LoginFormRenderer renderer,
      AuthnCompletion completion) {
    super(controller, renderer, completion);
  }
}
