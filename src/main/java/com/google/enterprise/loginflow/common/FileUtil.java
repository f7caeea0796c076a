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

package com.google.enterprise.loginflow.common;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;

/**
 * Resolves configuration files relative to the web application's context
 * directory.
 */
public class FileUtil {

  private static String contextDirectory = ".";

  // don't instantiate
  private FileUtil() {
  }

  /**
   * Points the context directory at the root of the test class path, where
   * test configuration files live.
   */
  @VisibleForTesting
  public static synchronized void initializeTestDirectories() {
    URL root = FileUtil.class.getResource("/");
    Preconditions.checkState(root != null, "No class path root");
    try {
      contextDirectory = new File(root.toURI()).getPath();
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }

  public static synchronized String getContextDirectory() {
    return contextDirectory;
  }

  public static synchronized void setContextDirectory(String directory) {
    Preconditions.checkNotNull(directory);
    contextDirectory = directory;
  }

  public static File getContextFile(String filename) {
    Preconditions.checkNotNull(filename);
    return getContextFile(new File(filename));
  }

  public static File getContextFile(File file) {
    Preconditions.checkNotNull(file);
    return (file.isAbsolute()) ? file : new File(getContextDirectory(), file.toString());
  }
}
