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

import com.google.common.base.Strings;

import org.joda.time.DateTimeUtils;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.logging.Logger;

import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * Base class of the login servlets.  A login page is served the same way for
 * GET and POST, and every response it sends is uncacheable.
 */
public abstract class ServletBase extends HttpServlet {
  private static final Logger logger = Logger.getLogger(ServletBase.class.getName());

  public static final String HTML_CONTENT_TYPE = "text/html; charset=UTF-8";

  @Override
  public void doGet(HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    serveLoginRequest(request, response);
  }

  @Override
  public void doPost(HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    serveLoginRequest(request, response);
  }

  /**
   * Handles a GET or POST of a login page.  A {@link LoginFlowException} ends
   * the flow with the exception's HTTP status.
   */
  private void serveLoginRequest(HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    try {
      handleLoginRequest(request, response);
    } catch (LoginFlowException e) {
      logger.warning("Login request for " + request.getRequestURI() + " rejected: "
          + e.getMessage());
      sendLoginError(response, e);
    }
  }

  protected abstract void handleLoginRequest(HttpServletRequest request,
      HttpServletResponse response)
      throws IOException, LoginFlowException;

  /**
   * Sends an HTML page.
   */
  public static void sendHtml(HttpServletResponse response, String html)
      throws IOException {
    initResponse(response);
    response.setStatus(HttpServletResponse.SC_OK);
    response.setContentType(HTML_CONTENT_TYPE);
    response.setCharacterEncoding("UTF-8");
    PrintWriter writer = response.getWriter();
    writer.print(html);
    writer.close();
  }

  /**
   * Adds {@code Set-Cookie} headers, in order.
   */
  public static void addSetCookieHeaders(HttpServletResponse response, Iterable<String> headers) {
    for (String header : headers) {
      response.addHeader(HttpUtil.HTTP_HEADER_SET_COOKIE, header);
    }
  }

  /**
   * Ends a login flow that can't continue.
   */
  public static void sendLoginError(HttpServletResponse response, LoginFlowException e)
      throws IOException {
    initResponse(response);
    response.sendError(e.getStatusCode());
  }

  /**
   * Redirects the browser at the end of a login flow.  An empty destination
   * goes to the server root.
   */
  public static void sendRedirect(HttpServletResponse response, String destinationUrl)
      throws IOException {
    initResponse(response);
    response.sendRedirect(
        Strings.nullToEmpty(destinationUrl).trim().isEmpty() ? "/" : destinationUrl);
  }

  private static void initResponse(HttpServletResponse response) {
    response.setHeader(HttpUtil.HTTP_HEADER_DATE,
        HttpUtil.generateHttpDate(DateTimeUtils.currentTimeMillis()));
    // Login pages carry state IDs and usernames.
    response.setHeader("Cache-Control", "no-store");
    response.setHeader("Pragma", "no-cache");
  }
}
