/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.gridwire.serializer;

import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_UUID;
import static org.gridwire.serializer.SerializationConstants.JAVA_DEFAULT_TYPE_BIG_DECIMAL;
import static org.gridwire.serializer.SerializationConstants.JAVA_DEFAULT_TYPE_BIG_INTEGER;
import static org.gridwire.serializer.SerializationConstants.JAVA_DEFAULT_TYPE_CLASS;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Primitives;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;
import org.gridwire.exception.SerializationException;
import org.gridwire.memory.MemoryBuffer;

/** Serializers for the JDK value types shared with JVM cluster members. */
public class Serializers {

  /** Most significant bits then least significant bits, both int64. */
  public static final class UuidSerializer extends Serializer<UUID> {

    public UuidSerializer() {
      super(CONSTANT_TYPE_UUID);
    }

    @Override
    public void write(MemoryBuffer buffer, UUID value) {
      buffer.writeInt64(value.getMostSignificantBits());
      buffer.writeInt64(value.getLeastSignificantBits());
    }

    @Override
    public UUID read(MemoryBuffer buffer) {
      long most = buffer.readInt64();
      long least = buffer.readInt64();
      return new UUID(most, least);
    }
  }

  /** Two's complement, big-endian magnitude bytes regardless of the buffer order. */
  public static final class BigIntegerSerializer extends Serializer<BigInteger> {

    public BigIntegerSerializer() {
      super(JAVA_DEFAULT_TYPE_BIG_INTEGER);
    }

    @Override
    public void write(MemoryBuffer buffer, BigInteger value) {
      buffer.writeBytesAndSize(value.toByteArray());
    }

    @Override
    public BigInteger read(MemoryBuffer buffer) {
      return new BigInteger(buffer.readBytesAndSize());
    }
  }

  /** Unscaled value as in {@link BigIntegerSerializer}, then the int32 scale. */
  public static final class BigDecimalSerializer extends Serializer<BigDecimal> {

    public BigDecimalSerializer() {
      super(JAVA_DEFAULT_TYPE_BIG_DECIMAL);
    }

    @Override
    public void write(MemoryBuffer buffer, BigDecimal value) {
      buffer.writeBytesAndSize(value.unscaledValue().toByteArray());
      buffer.writeInt32(value.scale());
    }

    @Override
    public BigDecimal read(MemoryBuffer buffer) {
      BigInteger unscaled = new BigInteger(buffer.readBytesAndSize());
      int scale = buffer.readInt32();
      return new BigDecimal(unscaled, scale);
    }
  }

  /** Writes the binary class name and loads the class lazily (without initializing it) on read. */
  @SuppressWarnings("rawtypes")
  public static final class ClassSerializer extends Serializer<Class> {
    private static final ImmutableMap<String, Class<?>> PRIMITIVE_TYPES;

    static {
      ImmutableMap.Builder<String, Class<?>> builder = ImmutableMap.builder();
      for (Class<?> type : Primitives.allPrimitiveTypes()) {
        builder.put(type.getName(), type);
      }
      PRIMITIVE_TYPES = builder.build();
    }

    private final ClassLoader classLoader;

    public ClassSerializer(ClassLoader classLoader) {
      super(JAVA_DEFAULT_TYPE_CLASS);
      this.classLoader = Preconditions.checkNotNull(classLoader);
    }

    @Override
    public void write(MemoryBuffer buffer, Class value) {
      buffer.writeString(value.getName());
    }

    @Override
    public Class read(MemoryBuffer buffer) {
      String className = buffer.readString();
      Class<?> primitive = PRIMITIVE_TYPES.get(className);
      if (primitive != null) {
        return primitive;
      }
      try {
        return Class.forName(className, false, classLoader);
      } catch (ClassNotFoundException e) {
        throw new SerializationException("Class " + className + " can not be loaded", e);
      }
    }
  }
}
