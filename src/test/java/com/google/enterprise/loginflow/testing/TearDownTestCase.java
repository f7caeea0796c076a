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

package com.google.enterprise.loginflow.testing;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Lists;
import java.util.LinkedList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.concurrent.GuardedBy;
import junit.framework.TestCase;

/**
 * A test case that runs registered tear-down actions, most recent first, even
 * when the test or an earlier action fails.
 */
public abstract class TearDownTestCase extends TestCase {
  private static final Logger logger = Logger.getLogger(TearDownTestCase.class.getName());

  @GuardedBy("stack")
  private final LinkedList<TearDown> stack = new LinkedList<>();

  public TearDownTestCase() {}

  public TearDownTestCase(String name) {
    super(name);
  }

  /** Registers a TearDown implementor which will be run during {@link #tearDown()} */
  public final void addTearDown(TearDown tearDown) {
    synchronized (stack) {
      stack.addFirst(checkNotNull(tearDown));
    }
  }

  @Override
  protected void tearDown() {
    List<TearDown> stackCopy;
    synchronized (stack) {
      stackCopy = Lists.newArrayList(stack);
      stack.clear();
    }
    for (TearDown tearDown : stackCopy) {
      try {
        tearDown.tearDown();
      } catch (Throwable t) {
        logger.log(Level.INFO, "exception thrown during tearDown", t);
      }
    }
  }

  // Override to run setUp() inside the try block, not outside
  @Override
  public final void runBare() throws Throwable {
    try {
      setUp();
      runTest();
    } finally {
      tearDown();
    }
  }

  /**
   * A single tear-down operation.
   */
  public interface TearDown {
    void tearDown() throws Exception;
  }
}
