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

import com.google.enterprise.loginflow.testing.ServletTestUtil;
import junit.framework.TestCase;
import org.springframework.mock.web.MockHttpServletRequest;

/**
 * Unit tests for {@link HttpUtil}.
 */
public class HttpUtilTest extends TestCase {

  public void testHttpDate() throws Exception {
    assertEquals("Thu, 01 Jan 1970 00:00:00 GMT", HttpUtil.generateHttpDate(0));
    long date = 1500000000000L;
    assertEquals(date, HttpUtil.parseHttpDate(HttpUtil.generateHttpDate(date)));
  }

  public void testAddQueryParameter() {
    assertEquals("/a?AuthState=x", HttpUtil.addQueryParameter("/a", "AuthState", "x"));
    assertEquals("/a?b=1&AuthState=x%26y",
        HttpUtil.addQueryParameter("/a?b=1", "AuthState", "x&y"));
    assertEquals("/a?AuthState=x#frag", HttpUtil.addQueryParameter("/a#frag", "AuthState", "x"));
  }

  public void testCookieValues() {
    assertEquals("a%40b.com%3B+c", HttpUtil.encodeCookieValue("a@b.com; c"));
    assertEquals("a@b.com; c", HttpUtil.decodeCookieValue("a%40b.com%3B+c"));
    assertEquals("", HttpUtil.decodeCookieValue(null));
    // Values not written by us are used as they are.
    assertEquals("100%", HttpUtil.decodeCookieValue("100%"));
  }

  public void testFindCookie() {
    MockHttpServletRequest request = ServletTestUtil.makeMockHttpGet("http://localhost/");
    assertNull(HttpUtil.findCookie(request, "x"));
    ServletTestUtil.addCookie(request, "x", "1 2");
    ServletTestUtil.addCookie(request, "y", "3");
    assertEquals("1 2", HttpUtil.getCookieValue(request, "x"));
    assertEquals("3", HttpUtil.getCookieValue(request, "y"));
    assertNull(HttpUtil.getCookieValue(request, "z"));
  }

  public void testFormParameterOnlyOnPost() {
    MockHttpServletRequest get = ServletTestUtil.makeMockHttpGet("http://localhost/?u=a");
    assertNull(HttpUtil.getFormParameter(get, "u"));
    MockHttpServletRequest post = ServletTestUtil.makeMockHttpPost("http://localhost/");
    post.addParameter("u", "b");
    assertEquals("b", HttpUtil.getFormParameter(post, "u"));
    assertTrue(HttpUtil.isHttpPostMethod("post"));
  }

  public void testFormParameterIgnoresQueryString() {
    MockHttpServletRequest post =
        ServletTestUtil.makeMockHttpPost("http://localhost/?AuthState=s&u=query");
    assertNull(HttpUtil.getFormParameter(post, "u"));
    post.addParameter("u", "body");
    assertEquals("body", HttpUtil.getFormParameter(post, "u"));
  }

  public void testCountQueryValues() {
    assertEquals(0, HttpUtil.countQueryValues(null, "u"));
    assertEquals(0, HttpUtil.countQueryValues("a=1&b=2", "u"));
    assertEquals(3, HttpUtil.countQueryValues("u=1&x&u&%75=", "u"));
  }
}
