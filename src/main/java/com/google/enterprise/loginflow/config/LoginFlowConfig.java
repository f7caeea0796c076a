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
import com.google.common.collect.ImmutableList;

import java.util.List;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A complete login-flow configuration: global parameters plus the configured
 * auth sources.
 */
@Immutable
public final class LoginFlowConfig {
  public static final int CURRENT_VERSION = 1;

  private int version;
  private ConfigParams params;
  private List<AuthSourceConfig> authSources;

  // For Gson.
  private LoginFlowConfig() {
  }

  @Nonnull
  public static LoginFlowConfig make(ConfigParams params, Iterable<AuthSourceConfig> authSources) {
    Preconditions.checkNotNull(params);
    LoginFlowConfig config = new LoginFlowConfig();
    config.version = CURRENT_VERSION;
    config.params = params;
    config.authSources = ImmutableList.copyOf(authSources);
    return config;
  }

  @Nonnull
  public static LoginFlowConfig makeDefault() {
    return make(ConfigParams.makeDefault(), ImmutableList.<AuthSourceConfig>of());
  }

  public int getVersion() {
    return version;
  }

  @Nonnull
  public ConfigParams getParams() {
    return (params == null) ? ConfigParams.makeDefault() : params;
  }

  @Nonnull
  public ImmutableList<AuthSourceConfig> getAuthSources() {
    return (authSources == null)
        ? ImmutableList.<AuthSourceConfig>of()
        : ImmutableList.copyOf(authSources);
  }

  /**
   * Gets the configuration for a given auth source.
   *
   * @param id The auth source's ID.
   * @return The configuration, or {@code null} if there's no such source.
   */
  @Nullable
  public AuthSourceConfig getAuthSource(String id) {
    for (AuthSourceConfig authSource : getAuthSources()) {
      if (id.equals(authSource.getId())) {
        return authSource;
      }
    }
    return null;
  }
}
