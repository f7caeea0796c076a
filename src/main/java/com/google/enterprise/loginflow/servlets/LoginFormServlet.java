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

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.enterprise.loginflow.authncontroller.AbstractLoginController;
import com.google.enterprise.loginflow.authncontroller.AuthnCompletion;
import com.google.enterprise.loginflow.authncontroller.LoginResponse;
import com.google.enterprise.loginflow.common.LoginFlowException;
import com.google.enterprise.loginflow.common.ServletBase;
import com.google.enterprise.loginflow.remember.RememberCookie;
import com.google.enterprise.loginflow.ulf.LoginFormRenderer;

import java.io.IOException;
import java.util.List;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * The servlet side of a login form: runs the form's controller, then writes
 * the remember cookies and either renders the form or completes the login.
 */
@Immutable
public abstract class LoginFormServlet extends ServletBase {
  @Nonnull private final AbstractLoginController controller;
  @Nonnull private final LoginFormRenderer renderer;
  @Nonnull private final AuthnCompletion completion;

  protected LoginFormServlet(AbstractLoginController controller, LoginFormRenderer renderer,
      AuthnCompletion completion) {
    Preconditions.checkNotNull(controller);
    Preconditions.checkNotNull(renderer);
    Preconditions.checkNotNull(completion);
    this.controller = controller;
    this.renderer = renderer;
    this.completion = completion;
  }

  @Override
  protected void handleLoginRequest(HttpServletRequest request, HttpServletResponse response)
      throws IOException, LoginFlowException {
    LoginResponse loginResponse = controller.handle(request);

    List<String> setCookieHeaders = Lists.newArrayList();
    for (RememberCookie cookie : loginResponse.getCookies()) {
      setCookieHeaders.add(cookie.toSetCookieHeader());
    }
    addSetCookieHeaders(response, setCookieHeaders);

    if (loginResponse.isCompleted()) {
      completion.complete(loginResponse.getCompletedLogin(), request, response);
      return;
    }
    sendHtml(response, renderer.generateForm(loginResponse.getPage(), request.getRequestURI()));
  }
}
