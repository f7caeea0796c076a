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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.enterprise.loginflow.config.AuthSourceConfig;
import com.google.enterprise.loginflow.config.ConfigSingleton;
import com.google.enterprise.loginflow.config.LoginFlowConfig;
import com.google.inject.Singleton;

import java.io.IOException;
import java.util.Map;
import java.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;

/**
 * Resolves auth-source IDs to backends.  Backends named in the configuration
 * are rebuilt whenever the configuration changes.  Backends registered in code
 * take precedence over configured ones with the same ID.
 */
@Singleton
@ThreadSafe
public class AuthSourceRegistry {
  private static final Logger logger = Logger.getLogger(AuthSourceRegistry.class.getName());

  @GuardedBy("this") private final Map<String, AuthSource> registered = Maps.newHashMap();
  @GuardedBy("this") private LoginFlowConfig lastConfig;
  @GuardedBy("this") private ImmutableMap<String, AuthSource> configured = ImmutableMap.of();

  @Inject
  private AuthSourceRegistry() {
  }

  @VisibleForTesting
  public static AuthSourceRegistry make() {
    return new AuthSourceRegistry();
  }

  /**
   * Registers a backend that isn't described by the configuration.
   */
  public synchronized void register(AuthSource authSource) {
    Preconditions.checkNotNull(authSource);
    registered.put(authSource.getAuthId(), authSource);
  }

  /**
   * Gets the backend with a given ID.
   *
   * @param authId The backend's ID.
   * @return The backend, or {@code null} if there's none with that ID.
   * @throws IOException if the configuration can't be read.
   */
  @Nullable
  public synchronized AuthSource getById(String authId)
      throws IOException {
    AuthSource authSource = registered.get(authId);
    if (authSource != null) {
      return authSource;
    }
    LoginFlowConfig config = ConfigSingleton.getConfig();
    if (config != lastConfig) {
      configured = makeAuthSources(config);
      lastConfig = config;
    }
    return configured.get(authId);
  }

  /**
   * Gets the backend with a given ID, which must be of a given kind.
   *
   * @param authId The backend's ID.
   * @param clazz The kind of backend the caller needs.
   * @return The backend.
   * @throws UnknownAuthSourceException if there's no such backend, or if it is
   *     of another kind.
   * @throws IOException if the configuration can't be read.
   */
  @Nonnull
  public <T extends AuthSource> T getById(String authId, Class<T> clazz)
      throws UnknownAuthSourceException, IOException {
    AuthSource authSource = getById(authId);
    if (authSource == null) {
      throw new UnknownAuthSourceException("No auth source with ID " + authId);
    }
    if (!clazz.isInstance(authSource)) {
      throw new UnknownAuthSourceException("Auth source " + authId + " is not a "
          + clazz.getSimpleName());
    }
    return clazz.cast(authSource);
  }

  private static ImmutableMap<String, AuthSource> makeAuthSources(LoginFlowConfig config) {
    ImmutableMap.Builder<String, AuthSource> builder = ImmutableMap.builder();
    for (AuthSourceConfig authSourceConfig : config.getAuthSources()) {
      builder.put(authSourceConfig.getId(), makeAuthSource(authSourceConfig));
    }
    ImmutableMap<String, AuthSource> authSources = builder.build();
    logger.info("Loaded auth sources " + authSources.keySet());
    return authSources;
  }

  @VisibleForTesting
  static AuthSource makeAuthSource(AuthSourceConfig config) {
    switch (config.getType()) {
      case USERPASS:
        return new StaticUserPassAuthSource(config);
      case USERPASS_ORG:
        return new StaticUserPassOrgAuthSource(config);
      default:
        throw new IllegalArgumentException("Unknown auth source type: " + config.getType());
    }
  }
}
