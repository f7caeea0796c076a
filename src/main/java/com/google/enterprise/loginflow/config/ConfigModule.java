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
import com.google.inject.AbstractModule;
import com.google.inject.name.Names;

/**
 * Guice configuration for this package.
 */
public final class ConfigModule extends AbstractModule {
  private final String configFile;

  public ConfigModule(String configFile) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(configFile));
    this.configFile = configFile;
  }

  @Override
  protected void configure() {
    bind(String.class).annotatedWith(Names.named("configFile")).toInstance(configFile);
    bind(ConfigCodec.class).to(JsonConfig.class);
    bind(ConfigSingleton.class);
    requestStaticInjection(ConfigSingleton.class);
  }
}
