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

import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_BOOLEAN;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_BYTE;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_CHAR;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_DOUBLE;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_FLOAT;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_INTEGER;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_LONG;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_NULL;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_SHORT;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_STRING;

import org.gridwire.memory.MemoryBuffer;

/**
 * Serializers for null, booleans, characters, strings and the fixed-width numbers.
 *
 * <p>The numeric serializers accept any {@link Number} and narrow it to their own width, so the
 * serializer picked for the logical {@code number} kind can take an {@code AtomicLong} or a user
 * {@code Number} implementation. They always read back the boxed type of their width.
 */
public class PrimitiveSerializers {

  public static final class NullSerializer extends Serializer<Object> {

    public NullSerializer() {
      super(CONSTANT_TYPE_NULL);
    }

    @Override
    public void write(MemoryBuffer buffer, Object value) {}

    @Override
    public Object read(MemoryBuffer buffer) {
      return null;
    }
  }

  public static final class BooleanSerializer extends Serializer<Boolean> {

    public BooleanSerializer() {
      super(CONSTANT_TYPE_BOOLEAN);
    }

    @Override
    public void write(MemoryBuffer buffer, Boolean value) {
      buffer.writeBoolean(value);
    }

    @Override
    public Boolean read(MemoryBuffer buffer) {
      return buffer.readBoolean();
    }
  }

  public static final class ByteSerializer extends Serializer<Number> {

    public ByteSerializer() {
      super(CONSTANT_TYPE_BYTE);
    }

    @Override
    public void write(MemoryBuffer buffer, Number value) {
      buffer.writeByte(value.byteValue());
    }

    @Override
    public Byte read(MemoryBuffer buffer) {
      return buffer.readByte();
    }
  }

  public static final class CharSerializer extends Serializer<Character> {

    public CharSerializer() {
      super(CONSTANT_TYPE_CHAR);
    }

    @Override
    public void write(MemoryBuffer buffer, Character value) {
      buffer.writeChar(value);
    }

    @Override
    public Character read(MemoryBuffer buffer) {
      return buffer.readChar();
    }
  }

  public static final class ShortSerializer extends Serializer<Number> {

    public ShortSerializer() {
      super(CONSTANT_TYPE_SHORT);
    }

    @Override
    public void write(MemoryBuffer buffer, Number value) {
      buffer.writeInt16(value.shortValue());
    }

    @Override
    public Short read(MemoryBuffer buffer) {
      return buffer.readInt16();
    }
  }

  public static final class IntegerSerializer extends Serializer<Number> {

    public IntegerSerializer() {
      super(CONSTANT_TYPE_INTEGER);
    }

    @Override
    public void write(MemoryBuffer buffer, Number value) {
      buffer.writeInt32(value.intValue());
    }

    @Override
    public Integer read(MemoryBuffer buffer) {
      return buffer.readInt32();
    }
  }

  public static final class LongSerializer extends Serializer<Number> {

    public LongSerializer() {
      super(CONSTANT_TYPE_LONG);
    }

    @Override
    public void write(MemoryBuffer buffer, Number value) {
      buffer.writeInt64(value.longValue());
    }

    @Override
    public Long read(MemoryBuffer buffer) {
      return buffer.readInt64();
    }
  }

  public static final class FloatSerializer extends Serializer<Number> {

    public FloatSerializer() {
      super(CONSTANT_TYPE_FLOAT);
    }

    @Override
    public void write(MemoryBuffer buffer, Number value) {
      buffer.writeFloat32(value.floatValue());
    }

    @Override
    public Float read(MemoryBuffer buffer) {
      return buffer.readFloat32();
    }
  }

  public static final class DoubleSerializer extends Serializer<Number> {

    public DoubleSerializer() {
      super(CONSTANT_TYPE_DOUBLE);
    }

    @Override
    public void write(MemoryBuffer buffer, Number value) {
      buffer.writeFloat64(value.doubleValue());
    }

    @Override
    public Double read(MemoryBuffer buffer) {
      return buffer.readFloat64();
    }
  }

  public static final class StringSerializer extends Serializer<String> {

    public StringSerializer() {
      super(CONSTANT_TYPE_STRING);
    }

    @Override
    public void write(MemoryBuffer buffer, String value) {
      buffer.writeString(value);
    }

    @Override
    public String read(MemoryBuffer buffer) {
      return buffer.readString();
    }
  }
}
