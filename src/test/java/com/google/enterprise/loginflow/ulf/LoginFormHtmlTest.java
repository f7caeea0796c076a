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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.loginflow.authncontroller.LoginPage;
import com.google.enterprise.loginflow.authsource.Organization;
import com.google.enterprise.loginflow.common.ErrorCodes;
import com.google.enterprise.loginflow.config.LoginLink;
import com.google.enterprise.loginflow.state.AuthnError;
import junit.framework.TestCase;

/**
 * Unit tests for {@link LoginFormHtml}.
 */
public class LoginFormHtmlTest extends TestCase {

  private static final String STATE_ID = "0123456789abcdef0123456789abcdef";
  private static final String ACTION = "/sso/loginuserpass";

  private final LoginFormHtml renderer = LoginFormHtml.make();

  public void testPlainForm() {
    String html = renderer.generateForm(
        LoginPage.builder(STATE_ID)
        .setUsername("alice", false)
        .setRememberUsername(true, true)
        .setRememberMe(true, false)
        .setLinks(ImmutableList.of(LoginLink.make("https://idp/forgot", "Forgot?")))
        .build(),
        ACTION);
    assertTrue(html.contains("action=\"" + ACTION + "\""));
    assertTrue(html.contains("name=\"AuthState\" value=\"" + STATE_ID + "\""));
    assertTrue(html.contains("name=\"username\" value=\"alice\">"));
    assertTrue(html.contains("name=\"remember_username\" value=\"Yes\" checked>"));
    assertTrue(html.contains("name=\"remember_me\" value=\"Yes\">"));
    assertTrue(html.contains("<a href=\"https://idp/forgot\">Forgot?</a>"));
    assertFalse(html.contains("<select"));
    assertFalse(html.contains("class=\"error\""));
  }

  public void testForcedUsername() {
    String html = renderer.generateForm(
        LoginPage.builder(STATE_ID).setUsername("alice", true).build(), ACTION);
    assertTrue(html.contains("value=\"alice\" readonly>"));
    assertFalse(html.contains("remember_username"));
  }

  public void testErrorAndOrganizations() {
    String html = renderer.generateForm(
        LoginPage.builder(STATE_ID)
        .setError(AuthnError.make(ErrorCodes.WRONGUSERPASS))
        .setRememberOrganization(true, false)
        .setOrganizations(
            ImmutableList.of(
                Organization.make("acme", "Acme"),
                Organization.make("globex", "Globex")),
            "globex")
        .build(),
        ACTION);
    assertTrue(html.contains("<h2>Incorrect username or password</h2>"));
    assertTrue(html.contains("<option value=\"acme\">Acme</option>"));
    assertTrue(html.contains("<option value=\"globex\" selected>Globex</option>"));
    assertTrue(html.contains("name=\"remember_organization\" value=\"Yes\">"));
  }

  public void testValuesAreEscaped() {
    String html = renderer.generateForm(
        LoginPage.builder(STATE_ID)
        .setUsername("\"><script>alert(1)</script>", false)
        .setSpMetadata(ImmutableMap.of("name", "<b>SP</b> & co"))
        .build(),
        ACTION + "?a=1&b=2");
    assertFalse(html.contains("<script>"));
    assertTrue(html.contains("value=\"&quot;&gt;&lt;script&gt;alert(1)&lt;/script&gt;\""));
    assertTrue(html.contains("Logging in to &lt;b&gt;SP&lt;/b&gt; &amp; co"));
    assertTrue(html.contains("action=\"" + ACTION + "?a=1&amp;b=2\""));
  }
}
