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

package com.google.enterprise.loginflow.authncontroller;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.enterprise.loginflow.authsource.Organization;
import com.google.enterprise.loginflow.common.ErrorCodes;
import com.google.enterprise.loginflow.config.LoginLink;
import com.google.enterprise.loginflow.state.AuthnError;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The view model of a login form.  The model is a map whose keys are the names
 * the form templates use.
 */
@Immutable
public final class LoginPage {
  public static final String KEY_AUTH_STATE = "AuthState";
  public static final String KEY_USERNAME = "username";
  public static final String KEY_FORCE_USERNAME = "forceUsername";
  public static final String KEY_REMEMBER_USERNAME_ENABLED = "rememberUsernameEnabled";
  public static final String KEY_REMEMBER_USERNAME_CHECKED = "rememberUsernameChecked";
  public static final String KEY_REMEMBER_ME_ENABLED = "rememberMeEnabled";
  public static final String KEY_REMEMBER_ME_CHECKED = "rememberMeChecked";
  public static final String KEY_REMEMBER_ORGANIZATION_ENABLED = "rememberOrganizationEnabled";
  public static final String KEY_REMEMBER_ORGANIZATION_CHECKED = "rememberOrganizationChecked";
  public static final String KEY_LINKS = "links";
  public static final String KEY_ERROR_CODE = "errorcode";
  public static final String KEY_ERROR_CODES = "errorcodes";
  public static final String KEY_ERROR_PARAMS = "errorparams";
  public static final String KEY_QUERY_PARAMS = "queryParams";
  public static final String KEY_ORGANIZATIONS = "organizations";
  public static final String KEY_SELECTED_ORG = "selectedOrg";
  public static final String KEY_SP_METADATA = "SPMetadata";

  private final Map<String, Object> model;
  private final boolean organizationForm;

  private LoginPage(Map<String, Object> model, boolean organizationForm) {
    this.model = Collections.unmodifiableMap(model);
    this.organizationForm = organizationForm;
  }

  @Nonnull
  public static Builder builder(String stateId) {
    return new Builder(stateId);
  }

  /**
   * Gets the view model, in a fixed key order.  Some values may be
   * {@code null}.
   */
  @Nonnull
  public Map<String, Object> toModel() {
    return model;
  }

  @Nullable
  public Object get(String key) {
    return model.get(key);
  }

  @Nonnull
  public String getStateId() {
    return (String) model.get(KEY_AUTH_STATE);
  }

  @Nonnull
  public String getUsername() {
    return (String) model.get(KEY_USERNAME);
  }

  public boolean getBoolean(String key) {
    return Boolean.TRUE.equals(model.get(key));
  }

  @Nullable
  public String getErrorCode() {
    return (String) model.get(KEY_ERROR_CODE);
  }

  @SuppressWarnings("unchecked")
  @Nullable
  public Map<String, String> getErrorParams() {
    return (Map<String, String>) model.get(KEY_ERROR_PARAMS);
  }

  @SuppressWarnings("unchecked")
  @Nullable
  public Map<String, String> getQueryParams() {
    return (Map<String, String>) model.get(KEY_QUERY_PARAMS);
  }

  @SuppressWarnings("unchecked")
  @Nonnull
  public List<LoginLink> getLinks() {
    return (List<LoginLink>) model.get(KEY_LINKS);
  }

  /**
   * Gets the organizations to choose between, mapping ID to display name, or
   * {@code null} if the form has no organization selector.
   */
  @SuppressWarnings("unchecked")
  @Nullable
  public Map<String, String> getOrganizations() {
    return (Map<String, String>) model.get(KEY_ORGANIZATIONS);
  }

  @Nullable
  public String getSelectedOrg() {
    return (String) model.get(KEY_SELECTED_ORG);
  }

  @SuppressWarnings("unchecked")
  @Nullable
  public Map<String, String> getSpMetadata() {
    return (Map<String, String>) model.get(KEY_SP_METADATA);
  }

  /**
   * Is this the form of the organization variant?
   */
  public boolean isOrganizationForm() {
    return organizationForm;
  }

  @Override
  public String toString() {
    return "LoginPage" + model.keySet();
  }

  /**
   * A builder for login pages.  Keys are emitted in a fixed order regardless
   * of the order the setters are called in.
   */
  @NotThreadSafe
  public static final class Builder {
    private final String stateId;
    private String username = "";
    private boolean forceUsername;
    private boolean rememberUsernameEnabled;
    private boolean rememberUsernameChecked;
    private boolean rememberMeEnabled;
    private boolean rememberMeChecked;
    private boolean organizationForm;
    private boolean rememberOrganizationEnabled;
    private boolean rememberOrganizationChecked;
    private List<LoginLink> links = ImmutableList.of();
    private AuthnError error;
    private Map<String, String> queryParams = ImmutableMap.of();
    private List<Organization> organizations;
    private String selectedOrg;
    private Map<String, String> spMetadata;

    private Builder(String stateId) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(stateId));
      this.stateId = stateId;
    }

    public Builder setUsername(String username, boolean forceUsername) {
      this.username = Strings.nullToEmpty(username);
      this.forceUsername = forceUsername;
      return this;
    }

    public Builder setRememberUsername(boolean enabled, boolean checked) {
      rememberUsernameEnabled = enabled;
      rememberUsernameChecked = checked;
      return this;
    }

    public Builder setRememberMe(boolean enabled, boolean checked) {
      rememberMeEnabled = enabled;
      rememberMeChecked = checked;
      return this;
    }

    public Builder setRememberOrganization(boolean enabled, boolean checked) {
      organizationForm = true;
      rememberOrganizationEnabled = enabled;
      rememberOrganizationChecked = checked;
      return this;
    }

    public Builder setLinks(List<LoginLink> links) {
      this.links = ImmutableList.copyOf(links);
      return this;
    }

    public Builder setError(@Nullable AuthnError error) {
      this.error = error;
      return this;
    }

    public Builder setQueryParams(Map<String, String> queryParams) {
      this.queryParams = ImmutableMap.copyOf(queryParams);
      return this;
    }

    /**
     * Sets the organizations to choose between.  A {@code null} list means the
     * form has no organization selector.
     */
    public Builder setOrganizations(@Nullable List<Organization> organizations,
        String selectedOrg) {
      organizationForm = true;
      this.organizations = organizations;
      this.selectedOrg = Strings.nullToEmpty(selectedOrg);
      return this;
    }

    public Builder setSpMetadata(@Nullable Map<String, String> spMetadata) {
      this.spMetadata = spMetadata;
      return this;
    }

    public LoginPage build() {
      Map<String, Object> model = Maps.newLinkedHashMap();
      model.put(KEY_AUTH_STATE, stateId);
      model.put(KEY_USERNAME, username);
      model.put(KEY_FORCE_USERNAME, forceUsername);
      model.put(KEY_REMEMBER_USERNAME_ENABLED, rememberUsernameEnabled);
      model.put(KEY_REMEMBER_USERNAME_CHECKED, rememberUsernameChecked);
      model.put(KEY_REMEMBER_ME_ENABLED, rememberMeEnabled);
      model.put(KEY_REMEMBER_ME_CHECKED, rememberMeChecked);
      if (organizationForm) {
        model.put(KEY_REMEMBER_ORGANIZATION_ENABLED, rememberOrganizationEnabled);
        model.put(KEY_REMEMBER_ORGANIZATION_CHECKED, rememberOrganizationChecked);
      }
      model.put(KEY_LINKS, links);
      model.put(KEY_ERROR_CODE, (error == null) ? null : error.getCode());
      model.put(KEY_ERROR_CODES, ErrorCodes.getAllErrorCodeMessages());
      model.put(KEY_ERROR_PARAMS, (error == null) ? null : error.getParams());
      if (!queryParams.isEmpty()) {
        model.put(KEY_QUERY_PARAMS, queryParams);
      }
      if (organizations != null) {
        Map<String, String> choices = Maps.newLinkedHashMap();
        for (Organization organization : organizations) {
          choices.put(organization.getId(), organization.getDisplayName());
        }
        model.put(KEY_ORGANIZATIONS, Collections.unmodifiableMap(choices));
        model.put(KEY_SELECTED_ORG, selectedOrg);
      }
      model.put(KEY_SP_METADATA, spMetadata);
      return new LoginPage(model, organizationForm);
    }
  }
}
