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
import com.google.enterprise.loginflow.config.AuthSourceConfig;
import com.google.enterprise.loginflow.config.AuthSourceConfig.UserEntry;

import java.util.Map;
import java.util.logging.Logger;

import javax.annotation.concurrent.ThreadSafe;

/**
 * A username/password/organization backend whose users and organizations are
 * listed in the configuration.  A user may only log in to the organizations
 * listed in the user's entry.
 */
@ThreadSafe
public final class StaticUserPassOrgAuthSource extends UserPassOrgAuthSource {
  private static final Logger logger =
      Logger.getLogger(StaticUserPassOrgAuthSource.class.getName());

  private final StaticUsers users;
  private final ImmutableList<Organization> organizations;
  private final ImmutableMap<String, String> organizationNames;

  public StaticUserPassOrgAuthSource(AuthSourceConfig config) {
    super(config);
    users = new StaticUsers(config.getUsers());
    organizationNames = config.getOrganizations();
    ImmutableList.Builder<Organization> builder = ImmutableList.builder();
    for (Map.Entry<String, String> entry : organizationNames.entrySet()) {
      builder.add(Organization.make(entry.getKey(), entry.getValue()));
    }
    organizations = builder.build();
  }

  @Override
  protected ImmutableList<Organization> getOrganizations() {
    return organizations;
  }

  @Override
  protected ImmutableMap<String, ImmutableList<String>> login(String username, String password,
      String organization)
      throws AuthnFailureException {
    UserEntry entry = users.check(username, password);
    if (!organizationNames.containsKey(organization)
        || !entry.getOrganizations().contains(organization)) {
      logger.fine(getAuthId() + ": " + username + " is not a member of " + organization);
      throw new AuthnFailureException(ErrorCodes.WRONGUSERPASS);
    }
    logger.fine(getAuthId() + ": verified " + username + " in " + organization);
    return StaticUsers.attributesOf(entry);
  }
}
