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

package com.google.enterprise.loginflow.config;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The configuration of one auth source.  Instances are made by Gson from the
 * configuration file, or by {@link #builder} in code.
 */
@Immutable
public final class AuthSourceConfig {

  /**
   * A user known to a static auth source.
   */
  @Immutable
  public static final class UserEntry {
    private String password;
    private Map<String, List<String>> attributes;
    private List<String> organizations;

    // For Gson.
    private UserEntry() {
    }

    private UserEntry(String password, Map<String, List<String>> attributes,
        List<String> organizations) {
      this.password = password;
      this.attributes = attributes;
      this.organizations = organizations;
    }

    @Nonnull
    public static UserEntry make(String password, Map<String, List<String>> attributes,
        List<String> organizations) {
      Preconditions.checkNotNull(password);
      return new UserEntry(password, ImmutableMap.copyOf(attributes),
          ImmutableList.copyOf(organizations));
    }

    @Nonnull
    public String getPassword() {
      return Strings.nullToEmpty(password);
    }

    @Nonnull
    public Map<String, List<String>> getAttributes() {
      return (attributes == null) ? ImmutableMap.<String, List<String>>of() : attributes;
    }

    /**
     * Gets the IDs of the organizations this user may log in to.
     */
    @Nonnull
    public List<String> getOrganizations() {
      return (organizations == null) ? ImmutableList.<String>of() : organizations;
    }
  }

  private String id;
  private AuthSourceType type;

  @SerializedName("remember.username.enabled")
  private boolean rememberUsernameEnabled;
  @SerializedName("remember.username.checked")
  private boolean rememberUsernameChecked;
  @SerializedName("remember.enabled")
  private boolean rememberMeEnabled;
  @SerializedName("remember.checked")
  private boolean rememberMeChecked;
  @SerializedName("remember.organization.enabled")
  private boolean rememberOrganizationEnabled;
  @SerializedName("remember.organization.checked")
  private boolean rememberOrganizationChecked;

  private List<LoginLink> loginLinks;
  private Map<String, UserEntry> users;
  // Gson fills this with a LinkedTreeMap, which keeps the file's order.
  private Map<String, String> organizations;
  private UsernameOrgMethod usernameOrgMethod;

  // For Gson.
  private AuthSourceConfig() {
  }

  @Nonnull
  public static Builder builder(String id, AuthSourceType type) {
    return new Builder(id, type);
  }

  @Nullable
  public String getId() {
    return id;
  }

  @Nullable
  public AuthSourceType getType() {
    return type;
  }

  public boolean isRememberUsernameEnabled() {
    return rememberUsernameEnabled;
  }

  public boolean isRememberUsernameChecked() {
    return rememberUsernameChecked;
  }

  public boolean isRememberMeEnabled() {
    return rememberMeEnabled;
  }

  public boolean isRememberMeChecked() {
    return rememberMeChecked;
  }

  public boolean isRememberOrganizationEnabled() {
    return rememberOrganizationEnabled;
  }

  public boolean isRememberOrganizationChecked() {
    return rememberOrganizationChecked;
  }

  @Nonnull
  public ImmutableList<LoginLink> getLoginLinks() {
    return (loginLinks == null)
        ? ImmutableList.<LoginLink>of()
        : ImmutableList.copyOf(loginLinks);
  }

  @Nonnull
  public ImmutableMap<String, UserEntry> getUsers() {
    return (users == null) ? ImmutableMap.<String, UserEntry>of() : ImmutableMap.copyOf(users);
  }

  /**
   * Gets the organizations, mapping ID to display name, in configured order.
   */
  @Nonnull
  public ImmutableMap<String, String> getOrganizations() {
    return (organizations == null)
        ? ImmutableMap.<String, String>of()
        : ImmutableMap.copyOf(organizations);
  }

  @Nonnull
  public UsernameOrgMethod getUsernameOrgMethod() {
    return (usernameOrgMethod == null) ? UsernameOrgMethod.NONE : usernameOrgMethod;
  }

  /**
   * A builder for auth-source configurations.
   */
  @NotThreadSafe
  public static final class Builder {
    private final AuthSourceConfig config;
    private final ImmutableList.Builder<LoginLink> loginLinks = ImmutableList.builder();
    private final Map<String, UserEntry> users = Maps.newLinkedHashMap();
    private final Map<String, String> organizations = Maps.newLinkedHashMap();

    private Builder(String id, AuthSourceType type) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(id));
      Preconditions.checkNotNull(type);
      config = new AuthSourceConfig();
      config.id = id;
      config.type = type;
    }

    public Builder setRememberUsername(boolean enabled, boolean checked) {
      config.rememberUsernameEnabled = enabled;
      config.rememberUsernameChecked = checked;
      return this;
    }

    public Builder setRememberMe(boolean enabled, boolean checked) {
      config.rememberMeEnabled = enabled;
      config.rememberMeChecked = checked;
      return this;
    }

    public Builder setRememberOrganization(boolean enabled, boolean checked) {
      config.rememberOrganizationEnabled = enabled;
      config.rememberOrganizationChecked = checked;
      return this;
    }

    public Builder addLoginLink(String href, String text) {
      loginLinks.add(LoginLink.make(href, text));
      return this;
    }

    public Builder addUser(String username, String password, Map<String, List<String>> attributes,
        String... organizationIds) {
      users.put(username,
          UserEntry.make(password, attributes, ImmutableList.copyOf(organizationIds)));
      return this;
    }

    public Builder addOrganization(String organizationId, String displayName) {
      organizations.put(organizationId, displayName);
      return this;
    }

    public Builder setUsernameOrgMethod(UsernameOrgMethod method) {
      config.usernameOrgMethod = method;
      return this;
    }

    public AuthSourceConfig build() {
      config.loginLinks = loginLinks.build();
      config.users = ImmutableMap.copyOf(users);
      config.organizations = ImmutableMap.copyOf(organizations);
      return config;
    }
  }
}
