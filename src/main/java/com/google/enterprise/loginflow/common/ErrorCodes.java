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

import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The catalog of error codes that can be shown on a login page, with their
 * display titles and descriptions.
 */
public final class ErrorCodes {

  public static final String AUTHSOURCEERROR = "AUTHSOURCEERROR";
  public static final String BADREQUEST = "BADREQUEST";
  public static final String NOACCESS = "NOACCESS";
  public static final String NOSTATE = "NOSTATE";
  public static final String UNHANDLEDEXCEPTION = "UNHANDLEDEXCEPTION";
  public static final String USERABORTED = "USERABORTED";
  public static final String WRONGUSERPASS = "WRONGUSERPASS";

  public static final String TITLE_KEY = "title";
  public static final String DESCRIPTION_KEY = "descr";

  private static final ImmutableMap<String, String> TITLES =
      ImmutableMap.<String, String>builder()
      .put(AUTHSOURCEERROR, "Authentication source error")
      .put(BADREQUEST, "Bad request received")
      .put(NOACCESS, "No access")
      .put(NOSTATE, "State information lost")
      .put(UNHANDLEDEXCEPTION, "Unhandled exception")
      .put(USERABORTED, "Authentication aborted")
      .put(WRONGUSERPASS, "Incorrect username or password")
      .build();

  private static final ImmutableMap<String, String> DESCRIPTIONS =
      ImmutableMap.<String, String>builder()
      .put(AUTHSOURCEERROR,
          "The authentication source used for this login is not available.")
      .put(BADREQUEST, "There is an error in the request to this page.")
      .put(NOACCESS, "You don't have access to this resource.")
      .put(NOSTATE, "The login attempt has expired. Please start the login again.")
      .put(UNHANDLEDEXCEPTION, "An unexpected error occurred while processing the login.")
      .put(USERABORTED, "The authentication was aborted by the user.")
      .put(WRONGUSERPASS,
          "Either no user with the given username could be found, or the password you gave"
          + " was wrong. Please check the username and try again.")
      .build();

  private static final ImmutableMap<String, ImmutableMap<String, String>> ALL_MESSAGES =
      ImmutableMap.of(TITLE_KEY, TITLES, DESCRIPTION_KEY, DESCRIPTIONS);

  // Don't instantiate.
  private ErrorCodes() {
    throw new UnsupportedOperationException();
  }

  /**
   * Gets every known message, keyed first by {@link #TITLE_KEY} or
   * {@link #DESCRIPTION_KEY} and then by error code.
   */
  @Nonnull
  public static ImmutableMap<String, ImmutableMap<String, String>> getAllErrorCodeMessages() {
    return ALL_MESSAGES;
  }

  @Nullable
  public static String getTitle(String code) {
    return TITLES.get(code);
  }

  @Nullable
  public static String getDescription(String code) {
    return DESCRIPTIONS.get(code);
  }

  public static boolean isKnown(String code) {
    return TITLES.containsKey(code);
  }
}
