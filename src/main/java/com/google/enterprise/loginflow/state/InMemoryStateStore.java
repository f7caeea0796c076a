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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import javax.annotation.concurrent.ThreadSafe;

import org.joda.time.DateTimeUtils;

/**
 * A state store that keeps states in memory.  Suitable for a single server.
 */
@ThreadSafe
public final class InMemoryStateStore implements StateStore {
  private static final Logger logger = Logger.getLogger(InMemoryStateStore.class.getName());

  /**
   * A ticker that follows the Joda clock, so tests can move time forward.
   */
  private static final Ticker JODA_TICKER = new Ticker() {
    @Override
    public long read() {
      return TimeUnit.MILLISECONDS.toNanos(DateTimeUtils.currentTimeMillis());
    }
  };

  private final Cache<String, StoredState> states;

  public InMemoryStateStore(long ttlSeconds) {
    Preconditions.checkArgument(ttlSeconds > 0);
    states = CacheBuilder.newBuilder()
        .expireAfterWrite(ttlSeconds, TimeUnit.SECONDS)
        .ticker(JODA_TICKER)
        .build();
  }

  @Override
  public String save(AuthnState state, AuthnStage stage) {
    StoredState stored = new StoredState(stage, state);
    while (true) {
      String stateId = StateIds.generateId();
      if (states.asMap().putIfAbsent(stateId, stored) == null) {
        logger.fine(StateIds.logMessage(stateId, "saved under stage " + stage.getTag()));
        return stateId;
      }
    }
  }

  @Override
  public AuthnState load(String stateId, AuthnStage expectedStage)
      throws NoStateException, StageMismatchException {
    if (!StateIds.isValidId(stateId)) {
      throw new NoStateException("Malformed state ID");
    }
    StoredState stored = states.getIfPresent(stateId);
    if (stored == null) {
      throw new NoStateException("No state with ID " + stateId + "; it may have expired");
    }
    return stored.checkStage(expectedStage);
  }

  @VisibleForTesting
  long size() {
    states.cleanUp();
    return states.size();
  }
}
