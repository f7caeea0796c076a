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

import com.google.enterprise.loginflow.config.ConfigParams;
import com.google.enterprise.loginflow.config.ConfigSingleton;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

import java.io.IOException;
import java.util.logging.Logger;

/**
 * Guice configuration for this package.  The kind of state store is chosen by
 * the configuration when it is first needed.
 */
public final class StateGuiceModule extends AbstractModule {
  private static final Logger logger = Logger.getLogger(StateGuiceModule.class.getName());

  @Override
  protected void configure() {
  }

  @Provides
  @Singleton
  StateStore provideStateStore()
      throws IOException {
    return makeStateStore(ConfigSingleton.getParams());
  }

  static StateStore makeStateStore(ConfigParams params) {
    if (ConfigParams.STATE_STORE_REDIS.equals(params.getStateStore())) {
      logger.info("Using redis state store");
      return new RedisStateStore(params.getRedisConnectionString(), params.getStateTtlSeconds());
    }
    logger.info("Using in-memory state store");
    return new InMemoryStateStore(params.getStateTtlSeconds());
  }
}
