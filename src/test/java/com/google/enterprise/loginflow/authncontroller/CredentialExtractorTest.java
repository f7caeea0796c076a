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

import com.google.enterprise.loginflow.testing.ServletTestUtil;
import junit.framework.TestCase;
import org.springframework.mock.web.MockHttpServletRequest;

/**
 * Unit tests for {@link CredentialExtractor}.
 */
public class CredentialExtractorTest extends TestCase {

  private static final String URL = "http://localhost/loginuserpass?AuthState=x";

  public void testPrecedence() {
    assertEquals("form", CredentialExtractor.extract("form", true, "cookie", true, "cached"));
    // An empty submission still beats the cookie.
    assertEquals("", CredentialExtractor.extract("", true, "cookie", true, "cached"));
    assertEquals("cookie", CredentialExtractor.extract(null, true, "cookie", true, "cached"));
    assertEquals("cached", CredentialExtractor.extract(null, true, "cookie", false, "cached"));
    assertEquals("cached", CredentialExtractor.extract(null, false, null, true, "cached"));
    assertEquals("", CredentialExtractor.extract(null, false, null, true, null));
    assertEquals("", CredentialExtractor.extract(null, true, null, true, "cached"));
  }

  public void testFromRequest() {
    MockHttpServletRequest request = ServletTestUtil.makeMockHttpPost(URL);
    request.addParameter("username", "alice");
    ServletTestUtil.addCookie(request, "s-username", "bob");
    assertEquals("alice", CredentialExtractor.extract(request, "username", "s-username", true,
        null));

    request = ServletTestUtil.makeMockHttpPost(URL);
    ServletTestUtil.addCookie(request, "s-username", "bob smith@example.com");
    assertEquals("bob smith@example.com",
        CredentialExtractor.extract(request, "username", "s-username", true, null));
  }

  public void testQueryIgnoredOnGet() {
    MockHttpServletRequest request = ServletTestUtil.makeMockHttpGet(URL + "&username=mallory");
    assertEquals("carol", CredentialExtractor.extract(request, "username", "s-username", true,
        "carol"));
    assertEquals("", CredentialExtractor.extractPassword(request, "password"));
  }

  public void testPassword() {
    MockHttpServletRequest request = ServletTestUtil.makeMockHttpPost(URL);
    assertEquals("", CredentialExtractor.extractPassword(request, "password"));
    request.addParameter("password", "secret");
    assertEquals("secret", CredentialExtractor.extractPassword(request, "password"));
  }
}
