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
 * Unit tests for {@link RememberPolicy} and {@link RememberDecision}.
 */
public class RememberPolicyTest extends TestCase {

  public void testDecide() {
    assertEquals(RememberDecision.NO_ACTION, RememberPolicy.decide(false, false));
    assertEquals(RememberDecision.NO_ACTION, RememberPolicy.decide(false, true));
    assertEquals(RememberDecision.FORGET, RememberPolicy.decide(true, false));
    assertEquals(RememberDecision.REMEMBER, RememberPolicy.decide(true, true));
  }

  public void testExpiry() {
    long now = 1500000000000L;
    assertFalse(RememberDecision.NO_ACTION.shouldSet());
    assertTrue(RememberDecision.REMEMBER.shouldSet());
    assertTrue(RememberDecision.FORGET.shouldSet());
    assertEquals(31536000L, RememberDecision.REMEMBER.getExpirySeconds());
    assertEquals(-300L, RememberDecision.FORGET.getExpirySeconds());
    assertEquals(now + 31536000000L, RememberDecision.REMEMBER.getExpiryMillis(now));
    assertEquals(now - 300000L, RememberDecision.FORGET.getExpiryMillis(now));
  }

  public void testIsChecked() {
    assertTrue(RememberPolicy.isChecked("Yes"));
    assertFalse(RememberPolicy.isChecked("yes"));
    assertFalse(RememberPolicy.isChecked("on"));
    assertFalse(RememberPolicy.isChecked(""));
    assertFalse(RememberPolicy.isChecked(null));
  }
}
