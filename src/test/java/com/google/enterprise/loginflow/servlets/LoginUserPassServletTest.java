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

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.same;
import static org.easymock.EasyMock.verify;

import com.google.enterprise.loginflow.authncontroller.AuthnCompletion;
import com.google.enterprise.loginflow.authncontroller.CompletedLogin;
import com.google.enterprise.loginflow.authncontroller.UserPassLoginController;
import com.google.enterprise.loginflow.config.ConfigSingleton;
import com.google.enterprise.loginflow.state.AuthnStage;
import com.google.enterprise.loginflow.state.AuthnState;
import com.google.enterprise.loginflow.state.StateStore;
import com.google.enterprise.loginflow.testing.LoginFlowTestCase;
import com.google.enterprise.loginflow.testing.ServletTestUtil;
import com.google.enterprise.loginflow.ulf.LoginFormRenderer;
import javax.servlet.http.Cookie;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.easymock.Capture;
import org.easymock.Mock;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Tests for the {@link LoginUserPassServlet} class.
 */
public class LoginUserPassServletTest extends LoginFlowTestCase {

  private static final String FORM_URL = "http://localhost/sso/loginuserpass";

  @Mock private AuthnCompletion completion;

  private StateStore stateStore;
  private LoginUserPassServlet servlet;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    stateStore = ConfigSingleton.getInstance(StateStore.class);
    servlet = ConfigSingleton.getInstance(LoginUserPassServlet.class);
  }

  public void testRendersForm() throws Exception {
    String stateId = stateStore.save(AuthnState.builder("src1").build(), AuthnStage.USERPASS);
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doGet(get(stateId), response);

    assertEquals(HttpServletResponse.SC_OK, response.getStatus());
    assertEquals("no-store", response.getHeader("Cache-Control"));
    assertNotNull(response.getHeader("Date"));
    assertTrue(ServletTestUtil.getSetCookieHeaders(response).isEmpty());
    String html = response.getContentAsString();
    assertTrue(html.contains("action=\"/sso/loginuserpass\""));
    assertTrue(html.contains("value=\"" + stateId + "\""));
  }

  public void testFailureSetsCookieAndShowsError() throws Exception {
    String stateId = stateStore.save(AuthnState.builder("src1").build(), AuthnStage.USERPASS);
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doPost(post(stateId, "alice", "wrong"), response);

    assertEquals(HttpServletResponse.SC_OK, response.getStatus());
    assertEquals(1, ServletTestUtil.getSetCookieHeaders(response).size());
    Cookie cookie = response.getCookie("src1-username");
    assertEquals("alice", cookie.getValue());
    assertEquals(0, cookie.getMaxAge());
    assertEquals("/", cookie.getPath());
    assertTrue(cookie.isHttpOnly());
    assertFalse(cookie.getSecure());
    assertTrue(response.getContentAsString().contains("Incorrect username or password"));
  }

  public void testSuccessRedirects() throws Exception {
    String stateId = stateStore.save(
        AuthnState.builder("src1").setReturnUrl("https://sp.example.com/acs").build(),
        AuthnStage.USERPASS);
    MockHttpServletRequest request = post(stateId, "alice", "secret");
    request.addParameter("remember_username", "Yes");
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doPost(request, response);

    assertEquals(HttpServletResponse.SC_MOVED_TEMPORARILY, response.getStatus());
    assertTrue(response.getRedirectedUrl().startsWith("https://sp.example.com/acs?AuthState="));
    assertEquals(1, ServletTestUtil.getSetCookieHeaders(response).size());
    assertEquals(31536000, response.getCookie("src1-username").getMaxAge());
  }

  public void testCompletionHook() throws Exception {
    LoginUserPassServlet hooked = new LoginUserPassServlet(
        ConfigSingleton.getInstance(UserPassLoginController.class),
        ConfigSingleton.getInstance(LoginFormRenderer.class),
        completion);
    String stateId = stateStore.save(AuthnState.builder("src1").build(), AuthnStage.USERPASS);
    MockHttpServletRequest request = post(stateId, "bob", "hunter2");
    MockHttpServletResponse response = new MockHttpServletResponse();
    Capture<CompletedLogin> completed = Capture.newInstance();
    completion.complete(capture(completed), same((HttpServletRequest) request),
        anyObject(HttpServletResponse.class));
    expectLastCall();
    replay(completion);

    hooked.doPost(request, response);
    verify(completion);
    assertEquals("src1", completed.getValue().getState().getAuthSourceId());
    assertEquals(completed.getValue().getState(),
        stateStore.load(completed.getValue().getStateId(), AuthnStage.COMPLETED));
  }

  public void testMissingStateIsBadRequest() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doGet(ServletTestUtil.makeMockHttpGet(FORM_URL), response);
    assertEquals(HttpServletResponse.SC_BAD_REQUEST, response.getStatus());
  }

  public void testUnknownStateIsForbidden() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doGet(get("0123456789abcdef0123456789abcdef"), response);
    assertEquals(HttpServletResponse.SC_FORBIDDEN, response.getStatus());
  }

  public void testWrongStageIsForbidden() throws Exception {
    String stateId = stateStore.save(AuthnState.builder("src1").build(), AuthnStage.COMPLETED);
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doGet(get(stateId), response);
    assertEquals(HttpServletResponse.SC_FORBIDDEN, response.getStatus());
  }

  public void testUnknownAuthSourceIsServerError() throws Exception {
    String stateId = stateStore.save(AuthnState.builder("gone").build(), AuthnStage.USERPASS);
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doGet(get(stateId), response);
    assertEquals(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, response.getStatus());
  }

  private static MockHttpServletRequest get(String stateId) {
    return ServletTestUtil.makeMockHttpGet(FORM_URL + "?AuthState=" + stateId);
  }

  private static MockHttpServletRequest post(String stateId, String username, String password) {
    MockHttpServletRequest request =
        ServletTestUtil.makeMockHttpPost(FORM_URL + "?AuthState=" + stateId);
    request.addParameter("username", username);
    request.addParameter("password", password);
    return request;
  }
}
