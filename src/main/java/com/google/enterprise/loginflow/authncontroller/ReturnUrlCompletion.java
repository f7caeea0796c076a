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

import com.google.common.base.Strings;
import com.google.common.html.HtmlEscapers;
import com.google.enterprise.loginflow.common.HttpUtil;
import com.google.enterprise.loginflow.common.ServletBase;
import com.google.enterprise.loginflow.state.StateIds;
import com.google.inject.Singleton;

import java.io.IOException;
import java.util.logging.Logger;

import javax.inject.Inject;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * Completes a login by redirecting to the state's return URL, with the
 * completed state's ID appended as {@code AuthState}.  A state without a
 * return URL gets a plain confirmation page.
 */
@Singleton
public class ReturnUrlCompletion implements AuthnCompletion {
  private static final Logger logger = Logger.getLogger(ReturnUrlCompletion.class.getName());

  @Inject
  ReturnUrlCompletion() {
  }

  @Override
  public void complete(CompletedLogin completedLogin, HttpServletRequest request,
      HttpServletResponse response)
      throws IOException {
    String stateId = completedLogin.getStateId();
    String returnUrl = completedLogin.getState().getReturnUrl();
    if (!Strings.isNullOrEmpty(returnUrl)) {
      String location = HttpUtil.addQueryParameter(returnUrl,
          AbstractLoginController.PARAM_AUTH_STATE, stateId);
      logger.fine(StateIds.logMessage(stateId, "redirecting to " + returnUrl));
      ServletBase.sendRedirect(response, location);
      return;
    }
    logger.fine(StateIds.logMessage(stateId, "no return URL"));
    ServletBase.sendHtml(response,
        "<!DOCTYPE html><html><head><title>Logged in</title></head><body>"
        + "<p>You are logged in.</p><p>" + HtmlEscapers.htmlEscaper().escape(stateId)
        + "</p></body></html>");
  }
}
