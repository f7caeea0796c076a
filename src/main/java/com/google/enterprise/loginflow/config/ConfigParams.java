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

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Global parameters of the login flow.  Missing values take their defaults.
 */
@Immutable
public final class ConfigParams {

  /** Eight hours, the usual lifetime of an SSO login attempt. */
  public static final long DEFAULT_STATE_TTL_SECONDS = 8 * 60 * 60;
  public static final String STATE_STORE_MEMORY = "memory";
  public static final String STATE_STORE_REDIS = "redis";
  public static final String DEFAULT_LOGIN_URL_BASE = "/";

  private Long stateTtlSeconds;
  private String stateStore;
  private String redisConnectionString;
  private String loginUrlBase;

  // For Gson.
  private ConfigParams() {
  }

  @Nonnull
  public static ConfigParams makeDefault() {
    return new ConfigParams();
  }

  @Nonnull
  public static ConfigParams make(long stateTtlSeconds, String stateStore,
      @Nullable String redisConnectionString, String loginUrlBase) {
    ConfigParams params = new ConfigParams();
    params.stateTtlSeconds = stateTtlSeconds;
    params.stateStore = stateStore;
    params.redisConnectionString = redisConnectionString;
    params.loginUrlBase = loginUrlBase;
    return params;
  }

  /**
   * Gets how long a saved state lives before it expires.
   */
  public long getStateTtlSeconds() {
    return (stateTtlSeconds == null) ? DEFAULT_STATE_TTL_SECONDS : stateTtlSeconds;
  }

  /**
   * Gets the kind of state store: {@link #STATE_STORE_MEMORY} or
   * {@link #STATE_STORE_REDIS}.
   */
  @Nonnull
  public String getStateStore() {
    return Strings.isNullOrEmpty(stateStore) ? STATE_STORE_MEMORY : stateStore;
  }

  @Nullable
  public String getRedisConnectionString() {
    return redisConnectionString;
  }

  /**
   * Gets the URL prefix under which the login servlets are mounted.
   */
  @Nonnull
  public String getLoginUrlBase() {
    String base = Strings.isNullOrEmpty(loginUrlBase) ? DEFAULT_LOGIN_URL_BASE : loginUrlBase;
    return base.endsWith("/") ? base : base + "/";
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("stateTtlSeconds", getStateTtlSeconds())
        .add("stateStore", getStateStore())
        .add("loginUrlBase", getLoginUrlBase())
        .toString();
  }
}
