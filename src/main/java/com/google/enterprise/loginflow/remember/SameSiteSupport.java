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

import com.google.common.base.Strings;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

/**
 * Detects user agents that mishandle cookies marked {@code SameSite=None}.
 * Some treat the attribute as {@code Strict}; others reject the cookie.
 */
public final class SameSiteSupport {

  private static final Pattern IOS_VERSION =
      Pattern.compile("\\(iP.+; CPU .*OS (\\d+)[_\\d]*.*\\) AppleWebKit/");
  private static final Pattern MAC_VERSION =
      Pattern.compile("\\(Macintosh;.*Mac OS X (\\d+)_(\\d+)[_\\d]*.*\\) AppleWebKit/");
  private static final Pattern SAFARI = Pattern.compile("Version/.* Safari/");
  private static final Pattern CHROME_VERSION = Pattern.compile("Chrom(?:e|ium)/(\\d+)\\.");
  private static final Pattern CHROME = Pattern.compile("Chrom(?:e|ium)");

  private static final int FIRST_GOOD_CHROME_VERSION = 67;

  // Don't instantiate.
  private SameSiteSupport() {
    throw new UnsupportedOperationException();
  }

  /**
   * Can a cookie marked {@code SameSite=None} be sent to this user agent?
   *
   * @param userAgent The {@code User-Agent} header, or {@code null} if absent.
   */
  public static boolean canSetSameSiteNone(@Nullable String userAgent) {
    if (Strings.isNullOrEmpty(userAgent)) {
      return true;
    }

    // Every iOS 12 browser.
    Matcher matcher = IOS_VERSION.matcher(userAgent);
    if (matcher.find() && "12".equals(matcher.group(1))) {
      return false;
    }

    // Safari on macOS 10.14.
    matcher = MAC_VERSION.matcher(userAgent);
    if (matcher.find()
        && SAFARI.matcher(userAgent).find()
        && !CHROME.matcher(userAgent).find()
        && "10".equals(matcher.group(1))
        && "14".equals(matcher.group(2))) {
      return false;
    }

    // Chrome and Chromium before 67.
    matcher = CHROME_VERSION.matcher(userAgent);
    if (matcher.find()) {
      try {
        if (Integer.parseInt(matcher.group(1)) < FIRST_GOOD_CHROME_VERSION) {
          return false;
        }
      } catch (NumberFormatException e) {
        // Too many digits for an int, so a new enough version.
        return true;
      }
    }
    return true;
  }
}
