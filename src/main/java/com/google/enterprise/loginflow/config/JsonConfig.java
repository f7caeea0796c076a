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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.Sets;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;
import com.google.inject.Singleton;

import java.io.IOException;
import java.io.Reader;
import java.util.Set;
import java.util.logging.Logger;

import javax.annotation.concurrent.Immutable;
import javax.inject.Inject;

/**
 * JsonConfig reads the login-flow configuration from a JSON file.
 */
@Immutable
@Singleton
public class JsonConfig extends ConfigCodec {
  private static final Logger logger = Logger.getLogger(JsonConfig.class.getName());

  @Inject
  private JsonConfig() {
  }

  @VisibleForTesting
  public static JsonConfig make() {
    return new JsonConfig();
  }

  @Override
  protected LoginFlowConfig readConfigInternal(Reader reader)
      throws IOException, ConfigException {
    JsonElement je;
    try {
      je = JsonParser.parseReader(reader);
    } catch (JsonIOException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      throw new ConfigException(e);
    } catch (JsonSyntaxException e) {
      // Truncated input also lands here, wrapping an EOFException.
      throw new ConfigException("Malformed JSON config", e);
    }
    if (!je.isJsonObject()) {
      throw new ConfigException("Configuration must be a JSON object");
    }

    LoginFlowConfig config;
    try {
      config = ConfigSingleton.getGson().fromJson(je, LoginFlowConfig.class);
    } catch (JsonParseException e) {
      throw new ConfigException("Unable to parse JSON config", e);
    }
    if (config == null) {
      throw new ConfigException("Unable to parse JSON config");
    }
    if (config.getVersion() != LoginFlowConfig.CURRENT_VERSION) {
      throw new ConfigException("Unknown config version: " + config.getVersion());
    }
    checkParams(config.getParams());
    checkAuthSources(config);
    logger.info("Read configuration with " + config.getAuthSources().size() + " auth sources");
    return config;
  }

  private static void checkParams(ConfigParams params)
      throws ConfigException {
    if (params.getStateTtlSeconds() <= 0) {
      throw new ConfigException("stateTtlSeconds must be positive");
    }
    String store = params.getStateStore();
    if (ConfigParams.STATE_STORE_REDIS.equals(store)) {
      if (Strings.isNullOrEmpty(params.getRedisConnectionString())) {
        throw new ConfigException("The redis state store needs a redisConnectionString");
      }
    } else if (!ConfigParams.STATE_STORE_MEMORY.equals(store)) {
      throw new ConfigException("Unknown state store: " + store);
    }
  }

  private static void checkAuthSources(LoginFlowConfig config)
      throws ConfigException {
    Set<String> ids = Sets.newHashSet();
    for (AuthSourceConfig authSource : config.getAuthSources()) {
      String id = authSource.getId();
      if (Strings.isNullOrEmpty(id)) {
        throw new ConfigException("Auth source without an id");
      }
      if (!ids.add(id)) {
        throw new ConfigException("Duplicate auth source id: " + id);
      }
      if (authSource.getType() == null) {
        throw new ConfigException("Auth source " + id + " has a missing or unknown type");
      }
      for (String username : authSource.getUsers().keySet()) {
        for (String orgId : authSource.getUsers().get(username).getOrganizations()) {
          if (!authSource.getOrganizations().containsKey(orgId)) {
            throw new ConfigException("User " + username + " of auth source " + id
                + " belongs to unknown organization " + orgId);
          }
        }
      }
    }
  }
}
