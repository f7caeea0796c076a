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

import io.lettuce.core.RedisClient;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.RedisCodec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

import javax.annotation.concurrent.ThreadSafe;

/**
 * A state store backed by Redis.  Each save is a {@code SET ... EX ttl NX}, so
 * an existing entry is never overwritten and every entry expires on its own.
 */
@ThreadSafe
public final class RedisStateStore implements StateStore {
  private static final Logger logger = Logger.getLogger(RedisStateStore.class.getName());

  private static final String KEY_PREFIX = "loginflow:state:";
  private static final String SET_OK = "OK";

  private final RedisCommands<String, Object> redisCommands;
  private final SetArgs saveArgs;

  public RedisStateStore(String redisConnectionString, long ttlSeconds) {
    this(connect(redisConnectionString), ttlSeconds);
  }

  @VisibleForTesting
  RedisStateStore(RedisCommands<String, Object> redisCommands, long ttlSeconds) {
    Preconditions.checkNotNull(redisCommands);
    Preconditions.checkArgument(ttlSeconds > 0);
    this.redisCommands = redisCommands;
    saveArgs = SetArgs.Builder.ex(ttlSeconds).nx();
  }

  private static RedisCommands<String, Object> connect(String redisConnectionString) {
    RedisClient redisClient = RedisClient.create(redisConnectionString);
    StatefulRedisConnection<String, Object> connection
        = redisClient.connect(new SerializedObjectCodec());
    return connection.sync();
  }

  @Override
  public String save(AuthnState state, AuthnStage stage)
      throws IOException {
    StoredState stored = new StoredState(stage, state);
    while (true) {
      String stateId = StateIds.generateId();
      String reply;
      try {
        reply = redisCommands.set(KEY_PREFIX + stateId, stored, saveArgs);
      } catch (RuntimeException e) {
        throw new IOException("Unable to save state", e);
      }
      if (SET_OK.equals(reply)) {
        logger.fine(StateIds.logMessage(stateId, "saved under stage " + stage.getTag()));
        return stateId;
      }
      // NX refused the write: the ID is taken.
    }
  }

  @Override
  public AuthnState load(String stateId, AuthnStage expectedStage)
      throws NoStateException, StageMismatchException, IOException {
    if (!StateIds.isValidId(stateId)) {
      throw new NoStateException("Malformed state ID");
    }
    Object value;
    try {
      value = redisCommands.get(KEY_PREFIX + stateId);
    } catch (RuntimeException e) {
      throw new IOException("Unable to load state " + stateId, e);
    }
    if (value == null) {
      throw new NoStateException("No state with ID " + stateId + "; it may have expired");
    }
    if (!(value instanceof StoredState)) {
      throw new NoStateException("Unreadable state with ID " + stateId);
    }
    return ((StoredState) value).checkStage(expectedStage);
  }

  /**
   * A codec that stores values with Java serialization.
   */
  @VisibleForTesting
  static final class SerializedObjectCodec implements RedisCodec<String, Object> {
    private static final Charset charset = StandardCharsets.UTF_8;

    @Override
    public String decodeKey(ByteBuffer bytes) {
      return charset.decode(bytes).toString();
    }

    @Override
    public Object decodeValue(ByteBuffer bytes) {
      try {
        byte[] array = new byte[bytes.remaining()];
        bytes.get(array);
        ObjectInputStream is = new ObjectInputStream(new ByteArrayInputStream(array));
        return is.readObject();
      } catch (IOException | ClassNotFoundException e) {
        throw new IllegalStateException("Unable to decode stored state", e);
      }
    }

    @Override
    public ByteBuffer encodeKey(String key) {
      return charset.encode(key);
    }

    @Override
    public ByteBuffer encodeValue(Object value) {
      try {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ObjectOutputStream os = new ObjectOutputStream(bytes);
        os.writeObject(value);
        os.flush();
        byte[] array = bytes.toByteArray();
        logger.fine("State size in bytes: " + array.length);
        return ByteBuffer.wrap(array);
      } catch (IOException e) {
        throw new IllegalStateException("Unable to encode state", e);
      }
    }
  }
}
