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

package com.google.enterprise.loginflow.state;

import com.google.common.base.Strings;

import java.security.SecureRandom;
import java.util.Formatter;
import java.util.Random;
import java.util.regex.Pattern;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Utilities for state IDs.
 */
@ParametersAreNonnullByDefault
@ThreadSafe
public final class StateIds {

  /**
   * A regular expression that matches a valid state ID.
   */
  private static final Pattern STATE_ID_REGEXP = Pattern.compile("[0-9a-f]*");

  /**
   * The number of random bytes in a generated state ID.
   */
  private static final int STATE_ID_BYTES = 16;

  /**
   * The length of a generated state ID string.
   */
  public static final int STATE_ID_LENGTH = STATE_ID_BYTES * 2;

  private static final Random random = new SecureRandom();

  // Don't instantiate.
  private StateIds() {
    throw new UnsupportedOperationException();
  }

  /**
   * Generates an ID for a newly saved state.
   */
  @Nonnull
  public static String generateId() {
    byte[] randomBytes = new byte[STATE_ID_BYTES];
    random.nextBytes(randomBytes);
    StringBuilder builder = new StringBuilder(STATE_ID_LENGTH);
    Formatter f = new Formatter(builder);
    for (byte b : randomBytes) {
      f.format("%02x", b);
    }
    return builder.toString();
  }

  /**
   * Is the given string a well-formed state ID?
   *
   * @param proposedId The string to test.
   * @return True only if the string could have been made by {@link #generateId}.
   */
  public static boolean isValidId(@Nullable String proposedId) {
    return proposedId != null
        && proposedId.length() == STATE_ID_LENGTH
        && STATE_ID_REGEXP.matcher(proposedId).matches();
  }

  /**
   * Decorates a log message with a given state ID.
   *
   * @param stateId The state ID to decorate the message with.
   * @param message The log message to decorate.
   * @return The decorated log message.
   */
  @Nonnull
  public static String logMessage(@Nullable String stateId, String message) {
    return Strings.isNullOrEmpty(stateId)
        ? message
        : "state " + stateId + ": " + message;
  }
}
