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

package com.google.enterprise.loginflow.ulf;

import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import com.google.enterprise.loginflow.authncontroller.AbstractLoginController;
import com.google.enterprise.loginflow.authncontroller.LoginPage;
import com.google.enterprise.loginflow.common.ErrorCodes;
import com.google.enterprise.loginflow.config.LoginLink;
import com.google.enterprise.loginflow.remember.RememberPolicy;
import com.google.inject.Singleton;

import java.util.Map;

import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;

/**
 * The built-in login form.  Every value taken from the view model is
 * HTML-escaped.
 */
@Singleton
@ThreadSafe
public class LoginFormHtml implements LoginFormRenderer {
  private static final Escaper escaper = HtmlEscapers.htmlEscaper();

  private static final String PAGE_TITLE = "Enter your username and password";

  @Inject
  LoginFormHtml() {
  }

  public static LoginFormHtml make() {
    return new LoginFormHtml();
  }

  @Override
  public String generateForm(LoginPage page, String actionUrl) {
    StringBuilder form = new StringBuilder();
    form.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n<title>");
    form.append(PAGE_TITLE);
    form.append("</title>\n</head>\n<body>\n");
    appendServiceProvider(page, form);
    appendError(page, form);

    form.append("<form method=\"post\" action=\"");
    form.append(escaper.escape(actionUrl));
    form.append("\">\n");
    appendHidden(AbstractLoginController.PARAM_AUTH_STATE, page.getStateId(), form);

    boolean forceUsername = page.getBoolean(LoginPage.KEY_FORCE_USERNAME);
    form.append("<p><label for=\"username\">Username</label>\n");
    form.append("<input type=\"text\" id=\"username\" name=\"");
    form.append(AbstractLoginController.FIELD_USERNAME);
    form.append("\" value=\"");
    form.append(escaper.escape(page.getUsername()));
    form.append("\"");
    if (forceUsername) {
      form.append(" readonly");
    }
    form.append("></p>\n");
    if (page.getBoolean(LoginPage.KEY_REMEMBER_USERNAME_ENABLED)) {
      appendCheckbox(AbstractLoginController.FIELD_REMEMBER_USERNAME, "Remember my username",
          page.getBoolean(LoginPage.KEY_REMEMBER_USERNAME_CHECKED), form);
    }

    form.append("<p><label for=\"password\">Password</label>\n");
    form.append("<input type=\"password\" id=\"password\" name=\"");
    form.append(AbstractLoginController.FIELD_PASSWORD);
    form.append("\"></p>\n");

    Map<String, String> organizations = page.getOrganizations();
    if (organizations != null) {
      appendOrganizations(organizations, page.getSelectedOrg(), form);
    }
    if (page.getBoolean(LoginPage.KEY_REMEMBER_ORGANIZATION_ENABLED)) {
      appendCheckbox(AbstractLoginController.FIELD_REMEMBER_ORGANIZATION,
          "Remember my organization",
          page.getBoolean(LoginPage.KEY_REMEMBER_ORGANIZATION_CHECKED), form);
    }
    if (page.getBoolean(LoginPage.KEY_REMEMBER_ME_ENABLED)) {
      appendCheckbox(AbstractLoginController.FIELD_REMEMBER_ME, "Remember me",
          page.getBoolean(LoginPage.KEY_REMEMBER_ME_CHECKED), form);
    }

    form.append("<p><input type=\"submit\" value=\"Login\"></p>\n</form>\n");
    appendLinks(page, form);
    form.append("</body>\n</html>\n");
    return form.toString();
  }

  private static void appendServiceProvider(LoginPage page, StringBuilder form) {
    Map<String, String> spMetadata = page.getSpMetadata();
    if (spMetadata == null) {
      return;
    }
    String name = spMetadata.get("name");
    if (name == null) {
      name = spMetadata.get("entityid");
    }
    if (name != null) {
      form.append("<p class=\"sp\">Logging in to ");
      form.append(escaper.escape(name));
      form.append("</p>\n");
    }
  }

  private static void appendError(LoginPage page, StringBuilder form) {
    String code = page.getErrorCode();
    if (code == null) {
      return;
    }
    String title = ErrorCodes.getTitle(code);
    String description = ErrorCodes.getDescription(code);
    form.append("<div class=\"error\">\n<h2>");
    form.append(escaper.escape(title == null ? code : title));
    form.append("</h2>\n");
    if (description != null) {
      form.append("<p>");
      form.append(escaper.escape(description));
      form.append("</p>\n");
    }
    form.append("</div>\n");
  }

  private static void appendHidden(String name, String value, StringBuilder form) {
    form.append("<input type=\"hidden\" name=\"");
    form.append(escaper.escape(name));
    form.append("\" value=\"");
    form.append(escaper.escape(value));
    form.append("\">\n");
  }

  private static void appendCheckbox(String name, String label, boolean checked,
      StringBuilder form) {
    form.append("<p><input type=\"checkbox\" id=\"");
    form.append(name);
    form.append("\" name=\"");
    form.append(name);
    form.append("\" value=\"");
    form.append(RememberPolicy.CHECKBOX_CHECKED);
    form.append("\"");
    if (checked) {
      form.append(" checked");
    }
    form.append(">\n<label for=\"");
    form.append(name);
    form.append("\">");
    form.append(label);
    form.append("</label></p>\n");
  }

  private static void appendOrganizations(Map<String, String> organizations, String selected,
      StringBuilder form) {
    form.append("<p><label for=\"organization\">Organization</label>\n");
    form.append("<select id=\"organization\" name=\"");
    form.append(AbstractLoginController.FIELD_ORGANIZATION);
    form.append("\">\n");
    for (Map.Entry<String, String> entry : organizations.entrySet()) {
      form.append("<option value=\"");
      form.append(escaper.escape(entry.getKey()));
      form.append("\"");
      if (entry.getKey().equals(selected)) {
        form.append(" selected");
      }
      form.append(">");
      form.append(escaper.escape(entry.getValue()));
      form.append("</option>\n");
    }
    form.append("</select></p>\n");
  }

  private static void appendLinks(LoginPage page, StringBuilder form) {
    if (page.getLinks().isEmpty()) {
      return;
    }
    form.append("<ul class=\"links\">\n");
    for (LoginLink link : page.getLinks()) {
      form.append("<li><a href=\"");
      form.append(escaper.escape(link.getHref()));
      form.append("\">");
      form.append(escaper.escape(link.getText()));
      form.append("</a></li>\n");
    }
    form.append("</ul>\n");
  }
}
