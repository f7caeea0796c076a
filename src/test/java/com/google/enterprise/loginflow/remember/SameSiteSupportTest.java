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

import junit.framework.TestCase;

/**
 * Unit tests for {@link SameSiteSupport}.
 */
public class SameSiteSupportTest extends TestCase {

  private static final String IOS_12 =
      "Mozilla/5.0 (iPhone; CPU iPhone OS 12_1 like Mac OS X) AppleWebKit/605.1.15"
      + " (KHTML, like Gecko) Version/12.0 Mobile/15E148 Safari/604.1";
  private static final String IOS_13 =
      "Mozilla/5.0 (iPhone; CPU iPhone OS 13_2_3 like Mac OS X) AppleWebKit/605.1.15"
      + " (KHTML, like Gecko) Version/13.0.3 Mobile/15E148 Safari/604.1";
  private static final String MOJAVE_SAFARI =
      "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_14_6) AppleWebKit/605.1.15"
      + " (KHTML, like Gecko) Version/12.1.2 Safari/605.1.15";
  private static final String MOJAVE_CHROME =
      "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_14_6) AppleWebKit/537.36"
      + " (KHTML, like Gecko) Chrome/78.0.3904.108 Safari/537.36";
  private static final String CATALINA_SAFARI =
      "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_1) AppleWebKit/605.1.15"
      + " (KHTML, like Gecko) Version/13.0.3 Safari/605.1.15";
  private static final String CHROME_60 =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36"
      + " (KHTML, like Gecko) Chrome/60.0.3112.113 Safari/537.36";
  private static final String CHROMIUM_66 =
      "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36"
      + " (KHTML, like Gecko) Ubuntu Chromium/66.0.3359.181 Chrome/66.0.3359.181 Safari/537.36";
  private static final String CHROME_80 =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36"
      + " (KHTML, like Gecko) Chrome/80.0.3987.149 Safari/537.36";
  private static final String FIREFOX =
      "Mozilla/5.0 (X11; Linux x86_64; rv:68.0) Gecko/20100101 Firefox/68.0";

  public void testIncompatibleAgents() {
    assertFalse(SameSiteSupport.canSetSameSiteNone(IOS_12));
    assertFalse(SameSiteSupport.canSetSameSiteNone(MOJAVE_SAFARI));
    assertFalse(SameSiteSupport.canSetSameSiteNone(CHROME_60));
    assertFalse(SameSiteSupport.canSetSameSiteNone(CHROMIUM_66));
  }

  public void testCompatibleAgents() {
    assertTrue(SameSiteSupport.canSetSameSiteNone(IOS_13));
    assertTrue(SameSiteSupport.canSetSameSiteNone(MOJAVE_CHROME));
    assertTrue(SameSiteSupport.canSetSameSiteNone(CATALINA_SAFARI));
    assertTrue(SameSiteSupport.canSetSameSiteNone(CHROME_80));
    assertTrue(SameSiteSupport.canSetSameSiteNone(FIREFOX));
  }

  public void testMissingAgent() {
    assertTrue(SameSiteSupport.canSetSameSiteNone(null));
    assertTrue(SameSiteSupport.canSetSameSiteNone(""));
  }
}
