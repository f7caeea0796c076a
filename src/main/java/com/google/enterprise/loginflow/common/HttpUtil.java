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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

import java.io.UnsupportedEncodingException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.text.DateFormat;
import java.text.ParseException;
import java.text.SimpleDateFormat;
import java.util.Calendar;
import java.util.Date;
import java.util.Locale;
import java.util.TimeZone;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.servlet.http.Cookie;
import javax.servlet.http.HttpServletRequest;

/**
 * HTTP utilities for the login servlets.
 */
public final class HttpUtil {

  public static final String HTTP_METHOD_GET = "GET";
  public static final String HTTP_METHOD_POST = "POST";

  public static final String HTTP_HEADER_DATE = "Date";
  public static final String HTTP_HEADER_LOCATION = "Location";
  public static final String HTTP_HEADER_SET_COOKIE = "Set-Cookie";
  public static final String HTTP_HEADER_USER_AGENT = "User-Agent";

  public static final String PARAM_SEPARATOR = "; ";

  private static final Splitter QUERY_SPLITTER = Splitter.on('&').omitEmptyStrings();

  // Don't instantiate.
  private HttpUtil() {
    throw new UnsupportedOperationException();
  }

  public static boolean isHttpPostMethod(String method) {
    return HTTP_METHOD_POST.equalsIgnoreCase(method);
  }

  /**
   * Gets a form field from the body of a POST submission.  Values carried in
   * the query string are ignored.
   *
   * @param request The request to read.
   * @param name The field's name.
   * @return The field's first body value, or {@code null} if the request isn't
   *     a POST or its body doesn't carry the field.
   */
  @Nullable
  public static String getFormParameter(HttpServletRequest request, String name) {
    if (!isHttpPostMethod(request.getMethod())) {
      return null;
    }
    String[] values = request.getParameterValues(name);
    if (values == null) {
      return null;
    }
    // The container lists query-string values ahead of body values.
    int inQuery = countQueryValues(request.getQueryString(), name);
    return (values.length > inQuery) ? values[inQuery] : null;
  }

  @VisibleForTesting
  static int countQueryValues(@Nullable String queryString, String name) {
    if (Strings.isNullOrEmpty(queryString)) {
      return 0;
    }
    int count = 0;
    for (String element : QUERY_SPLITTER.split(queryString)) {
      int index = element.indexOf('=');
      String key = (index < 0) ? element : element.substring(0, index);
      if (name.equals(decodeCookieValue(key))) {
        count++;
      }
    }
    return count;
  }

  /**
   * Finds a cookie in a request.
   *
   * @param request The request to search.
   * @param name The cookie's name.
   * @return The first cookie with that name, or {@code null}.
   */
  @Nullable
  public static Cookie findCookie(HttpServletRequest request, String name) {
    Cookie[] cookies = request.getCookies();
    if (cookies == null) {
      return null;
    }
    for (Cookie cookie : cookies) {
      if (name.equals(cookie.getName())) {
        return cookie;
      }
    }
    return null;
  }

  /**
   * Gets the decoded value of a request cookie.
   *
   * @return The value, or {@code null} if there's no such cookie.
   */
  @Nullable
  public static String getCookieValue(HttpServletRequest request, String name) {
    Cookie cookie = findCookie(request, name);
    return (cookie == null) ? null : decodeCookieValue(cookie.getValue());
  }

  @Nonnull
  public static String encodeCookieValue(String value) {
    try {
      return URLEncoder.encode(value, StandardCharsets.UTF_8.name());
    } catch (UnsupportedEncodingException e) {
      throw new IllegalStateException(e);
    }
  }

  @Nonnull
  public static String decodeCookieValue(@Nullable String value) {
    if (Strings.isNullOrEmpty(value)) {
      return "";
    }
    try {
      return URLDecoder.decode(value, StandardCharsets.UTF_8.name());
    } catch (UnsupportedEncodingException e) {
      throw new IllegalStateException(e);
    } catch (IllegalArgumentException e) {
      // Not produced by us; use it as is.
      return value;
    }
  }

  /**
   * Appends a query parameter to a URL, URL-encoding the value.
   */
  @Nonnull
  public static String addQueryParameter(String url, String name, String value) {
    int fragment = url.indexOf('#');
    String base = (fragment < 0) ? url : url.substring(0, fragment);
    String suffix = (fragment < 0) ? "" : url.substring(fragment);
    StringBuilder builder = new StringBuilder(base);
    builder.append((base.indexOf('?') < 0) ? '?' : '&');
    builder.append(name);
    builder.append('=');
    builder.append(encodeCookieValue(value));
    builder.append(suffix);
    return builder.toString();
  }

  private static final String DATE_FORMAT_RFC1123 = "EEE, dd MMM yyyy HH:mm:ss zzz";
  private static final TimeZone GMT = TimeZone.getTimeZone("GMT");

  /**
   * Generates an HTTP date string.
   *
   * @param date A date value specified as a non-negative difference from the
   *     epoch in milliseconds.
   * @return An HTTP date string representing that date.
   */
  public static String generateHttpDate(long date) {
    return getDateFormat(DATE_FORMAT_RFC1123).format(new Date(date));
  }

  @VisibleForTesting
  static long parseHttpDate(String dateString) throws ParseException {
    return getDateFormat(DATE_FORMAT_RFC1123).parse(dateString).getTime();
  }

  private static DateFormat getDateFormat(String formatString) {
    DateFormat format = new SimpleDateFormat(formatString, Locale.US);
    format.setCalendar(Calendar.getInstance(GMT, Locale.US));
    return format;
  }
}
