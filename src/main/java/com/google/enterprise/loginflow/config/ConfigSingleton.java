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
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.enterprise.loginflow.common.FileUtil;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.inject.Injector;
import com.google.inject.Singleton;
import com.google.inject.name.Named;

import java.io.File;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;

/**
 * A singleton class to access the login-flow configuration.
 */
@Singleton
@ThreadSafe
public class ConfigSingleton {
  private static final Logger logger = Logger.getLogger(ConfigSingleton.class.getName());

  @Inject private static Injector injector;
  @Inject private static ConfigSingleton instance;
  @GuardedBy("ConfigSingleton.class") private static LoginFlowConfig configOverride = null;
  @GuardedBy("ConfigSingleton.class") private static Gson gson = makeGson();

  private final ConfigCodec configCodec;
  private final String configFilename;
  /** The modification time of the configuration file when last read. */
  @GuardedBy("this") private long configTime;
  /** The parsed configuration file. */
  @GuardedBy("this") private LoginFlowConfig config;

  @Inject
  private ConfigSingleton(ConfigCodec configCodec, @Named("configFile") String configFilename) {
    Preconditions.checkNotNull(configCodec);
    Preconditions.checkArgument(!Strings.isNullOrEmpty(configFilename));
    this.configCodec = configCodec;
    this.configFilename = configFilename;
    logger.info("Config file " + configFilename);
    resetInternal();
  }

  /**
   * @return The application's Guice injector.
   */
  public static Injector getInjector() {
    return injector;
  }

  /**
   * A convenience method that invokes the injector.
   *
   * @param clazz The class to instantiate.
   * @return An instance of the given class.
   */
  public static <T> T getInstance(Class<T> clazz) {
    return injector.getInstance(clazz);
  }

  @VisibleForTesting
  public static synchronized void reset() {
    configOverride = null;
    if (instance != null) {
      instance.resetInternal();
    }
  }

  private synchronized void resetInternal() {
    configTime = 0;
    config = null;
  }

  private static Gson makeGson() {
    GsonBuilder builder = new GsonBuilder();
    builder.setPrettyPrinting();
    return builder.create();
  }

  public static synchronized Gson getGson() {
    return gson;
  }

  /**
   * @return The current configuration.
   * @throws IOException if there are I/O errors reading the configuration.
   */
  public static synchronized LoginFlowConfig getConfig()
      throws IOException {
    if (configOverride != null) {
      return configOverride;
    }
    Preconditions.checkState(instance != null, "ConfigSingleton hasn't been injected");
    return instance.getConfigInternal();
  }

  @VisibleForTesting
  public static synchronized void setConfig(LoginFlowConfig config) {
    configOverride = config;
  }

  private synchronized LoginFlowConfig getConfigInternal()
      throws IOException {
    logger.fine("About to read config " + configFilename);

    File file = FileUtil.getContextFile(configFilename);
    // Re-read until the mod time before and after the read agree, so a write
    // that races with the read is picked up.
    while (true) {
      long time = file.lastModified();
      if (time == 0) {
        throw new IOException("No such file: " + file);
      }
      if (time == configTime) {
        break;
      }
      try {
        config = configCodec.readConfig(file);
      } catch (ConfigException e) {
        logger.log(Level.SEVERE, "Error parsing config file. Returning default config.", e);
        config = LoginFlowConfig.makeDefault();
      }
      configTime = time;
    }
    return config;
  }

  /** @see LoginFlowConfig#getParams */
  public static ConfigParams getParams() throws IOException {
    return getConfig().getParams();
  }
}
