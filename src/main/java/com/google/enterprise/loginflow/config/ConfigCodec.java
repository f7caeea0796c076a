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

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * An abstract interface for reading configurations.
 */
public abstract class ConfigCodec {

  /**
   * Reads a configuration from a file.
   *
   * @param file The file to read from.
   * @return The configuration.
   * @throws IOException if there are I/O errors reading the file.
   * @throws ConfigException if the file's contents can't be parsed.
   */
  public LoginFlowConfig readConfig(File file)
      throws IOException, ConfigException {
    try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return readConfig(reader);
    }
  }

  /**
   * Reads a configuration from a reader.
   */
  public LoginFlowConfig readConfig(Reader reader)
      throws IOException, ConfigException {
    return readConfigInternal(reader);
  }

  protected abstract LoginFlowConfig readConfigInternal(Reader reader)
      throws IOException, ConfigException;
}
