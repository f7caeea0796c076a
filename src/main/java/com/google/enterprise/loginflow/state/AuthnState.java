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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The state of a single login attempt.  States are never modified in place;
 * every change produces a new instance, and saving that instance produces a
 * new state ID.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class AuthnState implements Serializable {
  private static final long serialVersionUID = 1L;

  @Nonnull private final String authSourceId;
  @Nullable private final String forcedUsername;
  @Nullable private final String cachedUsername;
  @Nullable private final String cachedOrganization;
  private final boolean rememberMe;
  @Nullable private final AuthnError error;
  @Nullable private final ImmutableMap<String, String> spMetadata;
  @Nullable private final String returnUrl;
  @Nonnull private final ImmutableMap<String, ImmutableList<String>> attributes;

  private AuthnState(Builder builder) {
    this.authSourceId = builder.authSourceId;
    this.forcedUsername = builder.forcedUsername;
    this.cachedUsername = builder.cachedUsername;
    this.cachedOrganization = builder.cachedOrganization;
    this.rememberMe = builder.rememberMe;
    this.error = builder.error;
    this.spMetadata = builder.spMetadata;
    this.returnUrl = builder.returnUrl;
    this.attributes = builder.attributes;
  }

  /**
   * Gets a builder for a state governed by the given auth source.
   */
  @Nonnull
  public static Builder builder(String authSourceId) {
    return new Builder(authSourceId);
  }

  /**
   * Gets a builder initialized from this state.
   */
  @Nonnull
  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * Gets the ID of the auth source that governs this attempt.
   */
  @Nonnull
  public String getAuthSourceId() {
    return authSourceId;
  }

  /**
   * Gets the username fixed by policy, or {@code null} if the user may edit it.
   */
  @Nullable
  public String getForcedUsername() {
    return forcedUsername;
  }

  public boolean hasForcedUsername() {
    return forcedUsername != null;
  }

  @Nullable
  public String getCachedUsername() {
    return cachedUsername;
  }

  @Nullable
  public String getCachedOrganization() {
    return cachedOrganization;
  }

  /**
   * Did the user ask for a long-lived session during this attempt?
   */
  public boolean isRememberMe() {
    return rememberMe;
  }

  /**
   * Gets the error from the previous verification attempt, if any.
   */
  @Nullable
  public AuthnError getError() {
    return error;
  }

  /**
   * Gets passthrough service-provider display data, or {@code null}.
   */
  @Nullable
  public ImmutableMap<String, String> getSpMetadata() {
    return spMetadata;
  }

  @Nullable
  public String getReturnUrl() {
    return returnUrl;
  }

  /**
   * Gets the attributes produced by a successful verification.  Empty until
   * then.
   */
  @Nonnull
  public ImmutableMap<String, ImmutableList<String>> getAttributes() {
    return attributes;
  }

  /**
   * Gets a copy of this state with the given error attached.
   */
  @CheckReturnValue
  @Nonnull
  public AuthnState withError(AuthnError error) {
    return toBuilder().setError(error).build();
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof AuthnState)) { return false; }
    AuthnState other = (AuthnState) object;
    return authSourceId.equals(other.authSourceId)
        && Objects.equals(forcedUsername, other.forcedUsername)
        && Objects.equals(cachedUsername, other.cachedUsername)
        && Objects.equals(cachedOrganization, other.cachedOrganization)
        && rememberMe == other.rememberMe
        && Objects.equals(error, other.error)
        && Objects.equals(spMetadata, other.spMetadata)
        && Objects.equals(returnUrl, other.returnUrl)
        && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(authSourceId, forcedUsername, cachedUsername, cachedOrganization,
        rememberMe, error, spMetadata, returnUrl, attributes);
  }

  @Override
  public String toString() {
    // Attributes may carry personal data; only their names are shown.
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("authSourceId", authSourceId)
        .add("forcedUsername", forcedUsername)
        .add("cachedUsername", cachedUsername)
        .add("cachedOrganization", cachedOrganization)
        .add("rememberMe", rememberMe)
        .add("error", error)
        .add("returnUrl", returnUrl)
        .add("attributes", attributes.keySet())
        .toString();
  }

  /**
   * A builder for authentication states.
   */
  @NotThreadSafe
  public static final class Builder {
    private String authSourceId;
    private String forcedUsername;
    private String cachedUsername;
    private String cachedOrganization;
    private boolean rememberMe;
    private AuthnError error;
    private ImmutableMap<String, String> spMetadata;
    private String returnUrl;
    private ImmutableMap<String, ImmutableList<String>> attributes;

    private Builder(String authSourceId) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(authSourceId));
      this.authSourceId = authSourceId;
      this.attributes = ImmutableMap.of();
    }

    private Builder(AuthnState state) {
      authSourceId = state.authSourceId;
      forcedUsername = state.forcedUsername;
      cachedUsername = state.cachedUsername;
      cachedOrganization = state.cachedOrganization;
      rememberMe = state.rememberMe;
      error = state.error;
      spMetadata = state.spMetadata;
      returnUrl = state.returnUrl;
      attributes = state.attributes;
    }

    public Builder setForcedUsername(@Nullable String forcedUsername) {
      this.forcedUsername = forcedUsername;
      return this;
    }

    public Builder setCachedUsername(@Nullable String cachedUsername) {
      this.cachedUsername = cachedUsername;
      return this;
    }

    public Builder setCachedOrganization(@Nullable String cachedOrganization) {
      this.cachedOrganization = cachedOrganization;
      return this;
    }

    public Builder setRememberMe(boolean rememberMe) {
      this.rememberMe = rememberMe;
      return this;
    }

    public Builder setError(@Nullable AuthnError error) {
      this.error = error;
      return this;
    }

    public Builder setSpMetadata(@Nullable Map<String, String> spMetadata) {
      this.spMetadata = (spMetadata == null) ? null : ImmutableMap.copyOf(spMetadata);
      return this;
    }

    public Builder setReturnUrl(@Nullable String returnUrl) {
      this.returnUrl = returnUrl;
      return this;
    }

    public Builder setAttributes(Map<String, ? extends List<String>> attributes) {
      ImmutableMap.Builder<String, ImmutableList<String>> builder = ImmutableMap.builder();
      for (Map.Entry<String, ? extends List<String>> entry : attributes.entrySet()) {
        builder.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
      }
      this.attributes = builder.build();
      return this;
    }

    public AuthnState build() {
      return new AuthnState(this);
    }
  }
}
