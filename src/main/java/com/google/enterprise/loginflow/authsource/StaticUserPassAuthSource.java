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
import com.google.enterprise.loginflow.config.AuthSourceConfig;
import com.google.enterprise.loginflow.config.AuthSourceConfig.UserEntry;

import java.util.logging.Logger;

import javax.annotation.concurrent.ThreadSafe;

/**
 * A username/password backend whose users are listed in the configuration.
 */
@ThreadSafe
public final class StaticUserPassAuthSource extends UserPassAuthSource {
  private static final Logger logger = Logger.getLogger(StaticUserPassAuthSource.class.getName());

  private final StaticUsers users;

  public StaticUserPassAuthSource(AuthSourceConfig config) {
    super(config);
    users = new StaticUsers(config.getUsers());
  }

  @Override
  public ImmutableMap<String, ImmutableList<String>> login(String username, String password)
      throws AuthnFailureException {
    UserEntry entry = users.check(username, password);
    logger.fine(getAuthId() + ": verified " + username);
    return StaticUsers.attributesOf(entry);
  }
}
