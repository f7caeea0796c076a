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

import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.loginflow.authsource.AuthSourceRegistry;
import com.google.enterprise.loginflow.authsource.UnknownAuthSourceException;
import com.google.enterprise.loginflow.common.BadRequestException;
import com.google.enterprise.loginflow.common.ErrorCodes;
import com.google.enterprise.loginflow.config.ConfigSingleton;
import com.google.enterprise.loginflow.remember.RememberCookie;
import com.google.enterprise.loginflow.state.AuthnStage;
import com.google.enterprise.loginflow.state.AuthnState;
import com.google.enterprise.loginflow.state.NoStateException;
import com.google.enterprise.loginflow.state.StageMismatchException;
import com.google.enterprise.loginflow.state.StateStore;
import com.google.enterprise.loginflow.testing.LoginFlowTestCase;
import com.google.enterprise.loginflow.testing.ServletTestUtil;
import org.easymock.EasyMock;
import org.easymock.IMocksControl;
import org.springframework.mock.web.MockHttpServletRequest;

/**
 * Tests for the {@link UserPassLoginController} class.
 */
public class UserPassLoginControllerTest extends LoginFlowTestCase {

  private static final String FORM_URL = "http://localhost/sso/loginuserpass";
  private static final String OLD_CHROME =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36"
      + " (KHTML, like Gecko) Chrome/60.0.3112.113 Safari/537.36";

  private StateStore stateStore;
  private UserPassLoginController controller;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    stateStore = ConfigSingleton.getInstance(StateStore.class);
    controller = ConfigSingleton.getInstance(UserPassLoginController.class);
  }

  public void testFirstDisplay() throws Exception {
    String stateId = startLogin(AuthnState.builder("src1"));
    LoginResponse response = controller.handle(get(stateId));

    assertFalse(response.isCompleted());
    assertTrue(response.getCookies().isEmpty());
    LoginPage page = response.getPage();
    assertEquals(stateId, page.getStateId());
    assertEquals("", page.getUsername());
    assertFalse(page.getBoolean(LoginPage.KEY_FORCE_USERNAME));
    assertTrue(page.getBoolean(LoginPage.KEY_REMEMBER_USERNAME_ENABLED));
    assertFalse(page.getBoolean(LoginPage.KEY_REMEMBER_USERNAME_CHECKED));
    assertTrue(page.getBoolean(LoginPage.KEY_REMEMBER_ME_ENABLED));
    assertFalse(page.getBoolean(LoginPage.KEY_REMEMBER_ME_CHECKED));
    assertNull(page.getErrorCode());
    assertNull(page.getQueryParams());
    assertFalse(page.toModel().containsKey(LoginPage.KEY_ORGANIZATIONS));
    assertFalse(page.isOrganizationForm());
    assertEquals(1, page.getLinks().size());
    assertEquals("https://idp.example.com/forgot", page.getLinks().get(0).getHref());
  }

  public void testUsernameFromCookie() throws Exception {
    String stateId = startLogin(AuthnState.builder("src1"));
    MockHttpServletRequest request = get(stateId);
    ServletTestUtil.addCookie(request, "src1-username", "bob");
    LoginResponse response = controller.handle(request);

    assertFalse(response.isCompleted());
    assertTrue(response.getCookies().isEmpty());
    assertEquals("bob", response.getPage().getUsername());
    assertTrue(response.getPage().getBoolean(LoginPage.KEY_REMEMBER_USERNAME_CHECKED));
  }

  public void testUsernameCookieIgnoredWhenDisabled() throws Exception {
    String stateId = startLogin(AuthnState.builder("plain"));
    MockHttpServletRequest request = get(stateId);
    ServletTestUtil.addCookie(request, "plain-username", "bob");
    LoginPage page = controller.handle(request).getPage();

    assertEquals("", page.getUsername());
    assertFalse(page.getBoolean(LoginPage.KEY_REMEMBER_USERNAME_ENABLED));
  }

  public void testCachedUsername() throws Exception {
    String stateId = startLogin(AuthnState.builder("plain").setCachedUsername("carol"));
    assertEquals("carol", controller.handle(get(stateId)).getPage().getUsername());
  }

  public void testWrongPassword() throws Exception {
    String stateId = startLogin(AuthnState.builder("src1"));
    LoginResponse response = controller.handle(post(stateId, "alice", "wrong"));

    assertFalse(response.isCompleted());
    LoginPage page = response.getPage();
    String newStateId = page.getStateId();
    assertFalse(stateId.equals(newStateId));
    assertEquals(ErrorCodes.WRONGUSERPASS, page.getErrorCode());
    assertEquals("alice", page.getUsername());
    assertEquals(ImmutableMap.of("AuthState", newStateId), page.getQueryParams());

    AuthnState saved = stateStore.load(newStateId, AuthnStage.USERPASS);
    assertEquals(ErrorCodes.WRONGUSERPASS, saved.getError().getCode());

    // The unchecked remember box clears any remembered username.
    assertEquals(1, response.getCookies().size());
    RememberCookie cookie = response.getCookies().get(0);
    assertEquals("src1-username", cookie.getName());
    assertTrue(cookie.isExpired());
  }

  public void testErrorShownOnReload() throws Exception {
    String stateId = startLogin(AuthnState.builder("src1"));
    String errorStateId =
        controller.handle(post(stateId, "alice", "wrong")).getPage().getStateId();
    LoginPage page = controller.handle(get(errorStateId)).getPage();

    assertEquals(errorStateId, page.getStateId());
    assertEquals(ErrorCodes.WRONGUSERPASS, page.getErrorCode());
    assertEquals(ImmutableMap.of("AuthState", errorStateId), page.getQueryParams());
  }

  public void testSuccess() throws Exception {
    String stateId = startLogin(AuthnState.builder("src1").setReturnUrl("https://sp/acs"));
    MockHttpServletRequest request = post(stateId, "alice", "secret");
    request.addParameter(AbstractLoginController.FIELD_REMEMBER_USERNAME, "Yes");
    LoginResponse response = controller.handle(request);

    assertTrue(response.isCompleted());
    CompletedLogin completed = response.getCompletedLogin();
    assertEquals(ImmutableList.of("alice@example.com"),
        completed.getState().getAttributes().get("mail"));
    assertNull(completed.getState().getError());
    assertEquals("https://sp/acs", completed.getState().getReturnUrl());
    assertEquals(completed.getState(),
        stateStore.load(completed.getStateId(), AuthnStage.COMPLETED));

    assertEquals(1, response.getCookies().size());
    RememberCookie cookie = response.getCookies().get(0);
    assertEquals("alice", cookie.getValue());
    assertFalse(cookie.isExpired());

    try {
      controller.handle(get(completed.getStateId()));
      fail("Completed state accepted by the login form");
    } catch (StageMismatchException e) {
      // pass
    }
  }

  public void testSuccessAfterFailureClearsError() throws Exception {
    String stateId = startLogin(AuthnState.builder("src1"));
    String errorStateId =
        controller.handle(post(stateId, "alice", "wrong")).getPage().getStateId();
    LoginResponse response = controller.handle(post(errorStateId, "alice", "secret"));

    assertTrue(response.isCompleted());
    assertNull(response.getCompletedLogin().getState().getError());
  }

  public void testRememberMe() throws Exception {
    String stateId = startLogin(AuthnState.builder("src1"));
    MockHttpServletRequest request = post(stateId, "bob", "hunter2");
    request.addParameter(AbstractLoginController.FIELD_REMEMBER_ME, "Yes");
    LoginResponse response = controller.handle(request);

    assertTrue(response.isCompleted());
    assertTrue(response.getCompletedLogin().getState().isRememberMe());
  }

  public void testRememberMeKeptAfterFailure() throws Exception {
    String stateId = startLogin(AuthnState.builder("src1"));
    MockHttpServletRequest request = post(stateId, "bob", "wrong");
    request.addParameter(AbstractLoginController.FIELD_REMEMBER_ME, "Yes");
    String newStateId = controller.handle(request).getPage().getStateId();

    AuthnState saved = stateStore.load(newStateId, AuthnStage.USERPASS);
    assertTrue(saved.isRememberMe());
    assertEquals(ErrorCodes.WRONGUSERPASS, saved.getError().getCode());
  }

  public void testRememberMeIgnoredWhenDisabled() throws Exception {
    String stateId = startLogin(AuthnState.builder("plain"));
    MockHttpServletRequest request = post(stateId, "alice", "secret");
    request.addParameter(AbstractLoginController.FIELD_REMEMBER_ME, "Yes");
    LoginResponse response = controller.handle(request);

    assertTrue(response.isCompleted());
    assertFalse(response.getCompletedLogin().getState().isRememberMe());
    assertTrue(response.getCookies().isEmpty());
  }

  public void testForcedUsername() throws Exception {
    String stateId = startLogin(AuthnState.builder("src1").setForcedUsername("alice"));
    MockHttpServletRequest request = get(stateId);
    ServletTestUtil.addCookie(request, "src1-username", "bob");
    LoginPage page = controller.handle(request).getPage();

    assertEquals("alice", page.getUsername());
    assertTrue(page.getBoolean(LoginPage.KEY_FORCE_USERNAME));
    assertFalse(page.getBoolean(LoginPage.KEY_REMEMBER_USERNAME_ENABLED));
    assertFalse(page.getBoolean(LoginPage.KEY_REMEMBER_USERNAME_CHECKED));

    // A submitted username is replaced by the forced one.
    LoginResponse response = controller.handle(post(stateId, "bob", "secret"));
    assertTrue(response.isCompleted());
    assertEquals(ImmutableList.of("alice"),
        response.getCompletedLogin().getState().getAttributes().get("uid"));
  }

  public void testEmptySubmissionShowsForm() throws Exception {
    String stateId = startLogin(AuthnState.builder("src1"));
    LoginResponse response = controller.handle(post(stateId, "", ""));

    assertFalse(response.isCompleted());
    assertEquals(stateId, response.getPage().getStateId());
    assertNull(response.getPage().getErrorCode());
    assertTrue(response.getCookies().isEmpty());
  }

  public void testPasswordOnlySubmission() throws Exception {
    String stateId = startLogin(AuthnState.builder("plain"));
    LoginResponse response = controller.handle(post(stateId, "", "secret"));

    assertFalse(response.isCompleted());
    assertEquals(ErrorCodes.WRONGUSERPASS, response.getPage().getErrorCode());
  }

  public void testCredentialsInQueryStringIgnored() throws Exception {
    String stateId = startLogin(AuthnState.builder("src1"));
    MockHttpServletRequest request = ServletTestUtil.makeMockHttpPost(
        FORM_URL + "?AuthState=" + stateId + "&username=alice&password=secret");
    LoginResponse response = controller.handle(request);

    assertFalse(response.isCompleted());
    assertTrue(response.getCookies().isEmpty());
    assertEquals(stateId, response.getPage().getStateId());
    assertEquals("", response.getPage().getUsername());
  }

  public void testCookieAttributes() throws Exception {
    String stateId = startLogin(AuthnState.builder("src1"));
    MockHttpServletRequest request = ServletTestUtil.makeMockHttpPost(
        "https://localhost/sso/loginuserpass?AuthState=" + stateId);
    request.addParameter(AbstractLoginController.FIELD_USERNAME, "alice");
    request.addParameter(AbstractLoginController.FIELD_PASSWORD, "secret");
    request.addParameter(AbstractLoginController.FIELD_REMEMBER_USERNAME, "Yes");
    request.addHeader("User-Agent", OLD_CHROME);
    RememberCookie cookie = controller.handle(request).getCookies().get(0);

    assertTrue(cookie.isSecure());
    assertFalse(cookie.isSameSiteNone());
  }

  public void testSpMetadataPassedThrough() throws Exception {
    ImmutableMap<String, String> spMetadata = ImmutableMap.of("name", "Example SP");
    String stateId = startLogin(AuthnState.builder("src1").setSpMetadata(spMetadata));
    assertEquals(spMetadata, controller.handle(get(stateId)).getPage().getSpMetadata());
  }

  public void testMissingStateId() throws Exception {
    try {
      controller.handle(ServletTestUtil.makeMockHttpGet(FORM_URL));
      fail("Request without a state ID accepted");
    } catch (BadRequestException e) {
      // pass
    }
  }

  public void testUnknownStateId() throws Exception {
    assertNoState("");
    assertNoState("bogus");
    assertNoState("0123456789abcdef0123456789abcdef");
    assertNoState("0123456789ABCDEF0123456789ABCDEF");
  }

  public void testWrongStage() throws Exception {
    String stateId = stateStore.save(AuthnState.builder("orgsrc").build(),
        AuthnStage.USERPASS_ORG);
    try {
      controller.handle(get(stateId));
      fail("State of the organization form accepted");
    } catch (StageMismatchException e) {
      assertEquals(AuthnStage.USERPASS, e.getExpected());
      assertEquals(AuthnStage.USERPASS_ORG, e.getActual());
    }
  }

  public void testWrongAuthSourceType() throws Exception {
    String stateId = startLogin(AuthnState.builder("orgsrc"));
    try {
      controller.handle(get(stateId));
      fail("Organization source accepted by the plain form");
    } catch (UnknownAuthSourceException e) {
      // pass
    }
  }

  public void testDisplayDoesNotSave() throws Exception {
    IMocksControl control = EasyMock.createControl();
    StateStore mockStore = control.createMock(StateStore.class);
    AuthSourceRegistry registry = ConfigSingleton.getInstance(AuthSourceRegistry.class);
    UserPassLoginController mockedController = new UserPassLoginController(mockStore, registry,
        new UserPassAuthnHandler(mockStore, registry));
    expect(mockStore.load(eq("id1"), eq(AuthnStage.USERPASS)))
        .andReturn(AuthnState.builder("src1").build());
    control.replay();

    LoginPage page = mockedController.handle(get("id1")).getPage();
    assertEquals("id1", page.getStateId());
    control.verify();
  }

  private String startLogin(AuthnState.Builder builder) throws Exception {
    return stateStore.save(builder.build(), AuthnStage.USERPASS);
  }

  private void assertNoState(String stateId) throws Exception {
    try {
      controller.handle(get(stateId));
      fail("Unknown state ID accepted: " + stateId);
    } catch (NoStateException e) {
      // pass
    }
  }

  private static MockHttpServletRequest get(String stateId) {
    return ServletTestUtil.makeMockHttpGet(FORM_URL + "?AuthState=" + stateId);
  }

  private static MockHttpServletRequest post(String stateId, String username, String password) {
    MockHttpServletRequest request =
        ServletTestUtil.makeMockHttpPost(FORM_URL + "?AuthState=" + stateId);
    request.addParameter(AbstractLoginController.FIELD_USERNAME, username);
    request.addParameter(AbstractLoginController.FIELD_PASSWORD, password);
    return request;
  }
}
