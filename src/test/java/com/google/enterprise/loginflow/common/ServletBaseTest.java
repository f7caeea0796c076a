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

import com.google.common.collect.ImmutableList;
import com.google.enterprise.loginflow.testing.ServletTestUtil;
import java.io.IOException;
import javax.servlet.http.Cookie;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import junit.framework.TestCase;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Unit tests for {@link ServletBase}.
 */
public class ServletBaseTest extends TestCase {

  private static final String URL = "http://localhost/sso/loginuserpass";

  public void testGetAndPostServedAlike() throws Exception {
    ServletBase servlet = new PageServlet(null);
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doGet(ServletTestUtil.makeMockHttpGet(URL), response);
    assertEquals(HttpServletResponse.SC_OK, response.getStatus());
    assertEquals("GET", response.getContentAsString());

    response = new MockHttpServletResponse();
    servlet.doPost(ServletTestUtil.makeMockHttpPost(URL), response);
    assertEquals("POST", response.getContentAsString());
    assertTrue(response.getContentType().startsWith("text/html"));
    assertEquals("no-store", response.getHeader("Cache-Control"));
    assertEquals("no-cache", response.getHeader("Pragma"));
    assertNotNull(response.getHeader("Date"));
  }

  public void testLoginFlowExceptionSetsStatus() throws Exception {
    ServletBase servlet = new PageServlet(new BadRequestException("Missing AuthState parameter"));
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doGet(ServletTestUtil.makeMockHttpGet(URL), response);
    assertEquals(HttpServletResponse.SC_BAD_REQUEST, response.getStatus());
    assertEquals("no-store", response.getHeader("Cache-Control"));
  }

  public void testSetCookieHeadersKeepOrder() {
    MockHttpServletResponse response = new MockHttpServletResponse();
    ServletBase.addSetCookieHeaders(response, ImmutableList.of("a=1", "b=2"));
    Cookie[] cookies = response.getCookies();
    assertEquals(2, cookies.length);
    assertEquals("a", cookies[0].getName());
    assertEquals("2", cookies[1].getValue());
  }

  public void testRedirect() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    ServletBase.sendRedirect(response, "https://sp.example.com/acs");
    assertEquals("https://sp.example.com/acs", response.getRedirectedUrl());
    assertEquals("no-store", response.getHeader("Cache-Control"));

    response = new MockHttpServletResponse();
    ServletBase.sendRedirect(response, " ");
    assertEquals("/", response.getRedirectedUrl());
  }

  private static final class PageServlet extends ServletBase {
    private final LoginFlowException failure;

    PageServlet(LoginFlowException failure) {
      this.failure = failure;
    }

    @Override
    protected void handleLoginRequest(HttpServletRequest request, HttpServletResponse response)
        throws IOException, LoginFlowException {
      if (failure != null) {
        throw failure;
      }
      sendHtml(response, request.getMethod());
    }
  }
}
