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

package com.google.enterprise.loginflow.authsource;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.loginflow.common.ErrorCodes;
import com.google.enterprise.loginflow.config.AuthSourceConfig.UserEntry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Verification against a fixed table of users, shared by the static backends.
 */
@Immutable
final class StaticUsers {
  private final ImmutableMap<String, UserEntry> users;

  StaticUsers(ImmutableMap<String, UserEntry> users) {
    this.users = users;
  }

  /**
   * Checks a username and password.
   *
   * @return The matching user entry.
   * @throws AuthnFailureException with {@code WRONGUSERPASS} if there's no such
   *     user or the password doesn't match.
   */
  @Nonnull
  UserEntry check(String username, String password)
      throws AuthnFailureException {
    UserEntry entry = users.get(username);
    // Compare even for unknown users, so the time taken doesn't reveal them.
    String expected = (entry == null) ? "" : entry.getPassword();
    boolean matches = passwordsMatch(expected, password);
    if (entry == null || !matches) {
      throw new AuthnFailureException(ErrorCodes.WRONGUSERPASS);
    }
    return entry;
  }

  static boolean passwordsMatch(String expected, @Nullable String actual) {
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8),
        (actual == null ? "" : actual).getBytes(StandardCharsets.UTF_8));
  }

  @Nonnull
  static ImmutableMap<String, ImmutableList<String>> attributesOf(UserEntry entry) {
    ImmutableMap.Builder<String, ImmutableList<String>> builder = ImmutableMap.builder();
    for (Map.Entry<String, List<String>> attribute : entry.getAttributes().entrySet()) {
      builder.put(attribute.getKey(), ImmutableList.copyOf(attribute.getValue()));
    }
    return builder.build();
  }
}
