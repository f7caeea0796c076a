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

package com.google.enterprise.loginflow.remember;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.enterprise.loginflow.common.HttpUtil;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import org.joda.time.DateTimeUtils;

/**
 * A remember cookie to be sent with a response.  Remember cookies always have
 * path {@code /}, no domain, and are HTTP-only.
 */
@Immutable
public final class RememberCookie {
  public static final String PATH = "/";

  @Nonnull private final String name;
  @Nonnull private final String value;
  private final long expiresMillis;
  private final long maxAgeSeconds;
  private final boolean secure;
  private final boolean sameSiteNone;

  private RememberCookie(String name, String value, long expiresMillis, long maxAgeSeconds,
      boolean secure, boolean sameSiteNone) {
    this.name = name;
    this.value = value;
    this.expiresMillis = expiresMillis;
    this.maxAgeSeconds = maxAgeSeconds;
    this.secure = secure;
    this.sameSiteNone = sameSiteNone;
  }

  /**
   * Makes a cookie carrying out a remember decision.
   *
   * @param name The cookie's name.
   * @param value The remembered value; URL-encoded when the header is written.
   * @param decision The decision, which must call for a cookie.
   * @param secure Should the cookie be restricted to HTTPS?
   * @param sameSiteNone Should the cookie be marked {@code SameSite=None}?
   * @return A new cookie.
   */
  @Nonnull
  public static RememberCookie make(String name, String value, RememberDecision decision,
      boolean secure, boolean sameSiteNone) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name));
    Preconditions.checkArgument(decision.shouldSet());
    long now = DateTimeUtils.currentTimeMillis();
    return new RememberCookie(name, Strings.nullToEmpty(value), decision.getExpiryMillis(now),
        Math.max(0, decision.getExpirySeconds()), secure, sameSiteNone);
  }

  @Nonnull
  public String getName() {
    return name;
  }

  @Nonnull
  public String getValue() {
    return value;
  }

  public long getExpiresMillis() {
    return expiresMillis;
  }

  public long getMaxAgeSeconds() {
    return maxAgeSeconds;
  }

  /**
   * Does this cookie tell the browser to drop the value?
   */
  public boolean isExpired() {
    return expiresMillis <= DateTimeUtils.currentTimeMillis();
  }

  public boolean isSecure() {
    return secure;
  }

  public boolean isSameSiteNone() {
    return sameSiteNone;
  }

  /**
   * Gets the value of the {@code Set-Cookie} header for this cookie.
   */
  @Nonnull
  public String toSetCookieHeader() {
    StringBuilder builder = new StringBuilder();
    builder.append(name);
    builder.append('=');
    builder.append(HttpUtil.encodeCookieValue(value));
    builder.append(HttpUtil.PARAM_SEPARATOR);
    builder.append("Expires=");
    builder.append(HttpUtil.generateHttpDate(expiresMillis));
    builder.append(HttpUtil.PARAM_SEPARATOR);
    builder.append("Max-Age=");
    builder.append(maxAgeSeconds);
    builder.append(HttpUtil.PARAM_SEPARATOR);
    builder.append("Path=");
    builder.append(PATH);
    if (secure) {
      builder.append(HttpUtil.PARAM_SEPARATOR);
      builder.append("Secure");
    }
    builder.append(HttpUtil.PARAM_SEPARATOR);
    builder.append("HttpOnly");
    if (sameSiteNone) {
      builder.append(HttpUtil.PARAM_SEPARATOR);
      builder.append("SameSite=None");
    }
    return builder.toString();
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof RememberCookie)) { return false; }
    RememberCookie other = (RememberCookie) object;
    return name.equals(other.name)
        && value.equals(other.value)
        && expiresMillis == other.expiresMillis
        && secure == other.secure
        && sameSiteNone == other.sameSiteNone;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value, expiresMillis, secure, sameSiteNone);
  }

  @Override
  public String toString() {
    return toSetCookieHeader();
  }
}
