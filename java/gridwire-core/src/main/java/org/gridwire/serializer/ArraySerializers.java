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

import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_BOOLEAN_ARRAY;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_BYTE_ARRAY;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_CHAR_ARRAY;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_DOUBLE_ARRAY;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_FLOAT_ARRAY;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_INTEGER_ARRAY;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_LONG_ARRAY;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_SHORT_ARRAY;
import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_STRING_ARRAY;

import java.nio.ByteBuffer;
import org.gridwire.memory.MemoryBuffer;

/**
 * Serializers for arrays of the scalar kinds. Every array is written as an int32 length followed
 * by its elements, a null array as length {@code -1}.
 *
 * <p>Besides the matching primitive array, each serializer accepts an {@code Object[]} (for
 * example an {@code Integer[]} or a mixed {@code Object[]} whose first element picked this
 * serializer) and converts it element-wise, writing null elements as zero or {@code false}.
 * Reading always produces the primitive array.
 */
public class ArraySerializers {
  private static final Integer ZERO = 0;

  private static int checkedLength(MemoryBuffer buffer, int elementSize) {
    int length = buffer.readInt32();
    if (length != MemoryBuffer.NULL_ARRAY_LENGTH) {
      buffer.checkReadableBytes((int) Math.min(Integer.MAX_VALUE, (long) length * elementSize));
    }
    return length;
  }

  /** Null elements of a boxed array are written as zero. */
  private static Number number(Object element) {
    return element == null ? ZERO : (Number) element;
  }

  public static final class ByteArraySerializer extends Serializer<Object> {

    public ByteArraySerializer() {
      super(CONSTANT_TYPE_BYTE_ARRAY);
    }

    @Override
    public void write(MemoryBuffer buffer, Object value) {
      buffer.writeBytesAndSize(toBytes(value));
    }

    @Override
    public byte[] read(MemoryBuffer buffer) {
      return buffer.readBytesAndSize();
    }

    private static byte[] toBytes(Object value) {
      if (value instanceof byte[]) {
        return (byte[]) value;
      }
      if (value instanceof ByteBuffer) {
        ByteBuffer source = ((ByteBuffer) value).duplicate();
        byte[] bytes = new byte[source.remaining()];
        source.get(bytes);
        return bytes;
      }
      Object[] elements = (Object[]) value;
      byte[] bytes = new byte[elements.length];
      for (int i = 0; i < elements.length; i++) {
        bytes[i] = number(elements[i]).byteValue();
      }
      return bytes;
    }
  }

  public static final class BooleanArraySerializer extends Serializer<Object> {

    public BooleanArraySerializer() {
      super(CONSTANT_TYPE_BOOLEAN_ARRAY);
    }

    @Override
    public void write(MemoryBuffer buffer, Object value) {
      boolean[] array;
      if (value instanceof boolean[]) {
        array = (boolean[]) value;
      } else {
        Object[] elements = (Object[]) value;
        array = new boolean[elements.length];
        for (int i = 0; i < elements.length; i++) {
          array[i] = Boolean.TRUE.equals(elements[i]);
        }
      }
      buffer.writeInt32(array.length);
      for (boolean b : array) {
        buffer.writeBoolean(b);
      }
    }

    @Override
    public boolean[] read(MemoryBuffer buffer) {
      int length = checkedLength(buffer, 1);
      if (length == MemoryBuffer.NULL_ARRAY_LENGTH) {
        return null;
      }
      boolean[] array = new boolean[length];
      for (int i = 0; i < length; i++) {
        array[i] = buffer.readBoolean();
      }
      return array;
    }
  }

  public static final class CharArraySerializer extends Serializer<Object> {

    public CharArraySerializer() {
      super(CONSTANT_TYPE_CHAR_ARRAY);
    }

    @Override
    public void write(MemoryBuffer buffer, Object value) {
      char[] array;
      if (value instanceof char[]) {
        array = (char[]) value;
      } else {
        Object[] elements = (Object[]) value;
        array = new char[elements.length];
        for (int i = 0; i < elements.length; i++) {
          array[i] = elements[i] == null ? 0 : (Character) elements[i];
        }
      }
      buffer.writeInt32(array.length);
      for (char c : array) {
        buffer.writeChar(c);
      }
    }

    @Override
    public char[] read(MemoryBuffer buffer) {
      int length = checkedLength(buffer, 2);
      if (length == MemoryBuffer.NULL_ARRAY_LENGTH) {
        return null;
      }
      char[] array = new char[length];
      for (int i = 0; i < length; i++) {
        array[i] = buffer.readChar();
      }
      return array;
    }
  }

  public static final class ShortArraySerializer extends Serializer<Object> {

    public ShortArraySerializer() {
      super(CONSTANT_TYPE_SHORT_ARRAY);
    }

    @Override
    public void write(MemoryBuffer buffer, Object value) {
      short[] array;
      if (value instanceof short[]) {
        array = (short[]) value;
      } else {
        Object[] elements = (Object[]) value;
        array = new short[elements.length];
        for (int i = 0; i < elements.length; i++) {
          array[i] = number(elements[i]).shortValue();
        }
      }
      buffer.writeInt32(array.length);
      for (short s : array) {
        buffer.writeInt16(s);
      }
    }

    @Override
    public short[] read(MemoryBuffer buffer) {
      int length = checkedLength(buffer, 2);
      if (length == MemoryBuffer.NULL_ARRAY_LENGTH) {
        return null;
      }
      short[] array = new short[length];
      for (int i = 0; i < length; i++) {
        array[i] = buffer.readInt16();
      }
      return array;
    }
  }

  public static final class IntegerArraySerializer extends Serializer<Object> {

    public IntegerArraySerializer() {
      super(CONSTANT_TYPE_INTEGER_ARRAY);
    }

    @Override
    public void write(MemoryBuffer buffer, Object value) {
      int[] array;
      if (value instanceof int[]) {
        array = (int[]) value;
      } else {
        Object[] elements = (Object[]) value;
        array = new int[elements.length];
        for (int i = 0; i < elements.length; i++) {
          array[i] = number(elements[i]).intValue();
        }
      }
      buffer.writeInt32(array.length);
      for (int v : array) {
        buffer.writeInt32(v);
      }
    }

    @Override
    public int[] read(MemoryBuffer buffer) {
      int length = checkedLength(buffer, 4);
      if (length == MemoryBuffer.NULL_ARRAY_LENGTH) {
        return null;
      }
      int[] array = new int[length];
      for (int i = 0; i < length; i++) {
        array[i] = buffer.readInt32();
      }
      return array;
    }
  }

  public static final class LongArraySerializer extends Serializer<Object> {

    public LongArraySerializer() {
      super(CONSTANT_TYPE_LONG_ARRAY);
    }

    @Override
    public void write(MemoryBuffer buffer, Object value) {
      long[] array;
      if (value instanceof long[]) {
        array = (long[]) value;
      } else {
        Object[] elements = (Object[]) value;
        array = new long[elements.length];
        for (int i = 0; i < elements.length; i++) {
          array[i] = number(elements[i]).longValue();
        }
      }
      buffer.writeInt32(array.length);
      for (long v : array) {
        buffer.writeInt64(v);
      }
    }

    @Override
    public long[] read(MemoryBuffer buffer) {
      int length = checkedLength(buffer, 8);
      if (length == MemoryBuffer.NULL_ARRAY_LENGTH) {
        return null;
      }
      long[] array = new long[length];
      for (int i = 0; i < length; i++) {
        array[i] = buffer.readInt64();
      }
      return array;
    }
  }

  public static final class FloatArraySerializer extends Serializer<Object> {

    public FloatArraySerializer() {
      super(CONSTANT_TYPE_FLOAT_ARRAY);
    }

    @Override
    public void write(MemoryBuffer buffer, Object value) {
      float[] array;
      if (value instanceof float[]) {
        array = (float[]) value;
      } else {
        Object[] elements = (Object[]) value;
        array = new float[elements.length];
        for (int i = 0; i < elements.length; i++) {
          array[i] = number(elements[i]).floatValue();
        }
      }
      buffer.writeInt32(array.length);
      for (float v : array) {
        buffer.writeFloat32(v);
      }
    }

    @Override
    public float[] read(MemoryBuffer buffer) {
      int length = checkedLength(buffer, 4);
      if (length == MemoryBuffer.NULL_ARRAY_LENGTH) {
        return null;
      }
      float[] array = new float[length];
      for (int i = 0; i < length; i++) {
        array[i] = buffer.readFloat32();
      }
      return array;
    }
  }

  public static final class DoubleArraySerializer extends Serializer<Object> {

    public DoubleArraySerializer() {
      super(CONSTANT_TYPE_DOUBLE_ARRAY);
    }

    @Override
    public void write(MemoryBuffer buffer, Object value) {
      double[] array;
      if (value instanceof double[]) {
        array = (double[]) value;
      } else {
        Object[] elements = (Object[]) value;
        array = new double[elements.length];
        for (int i = 0; i < elements.length; i++) {
          array[i] = number(elements[i]).doubleValue();
        }
      }
      buffer.writeInt32(array.length);
      for (double v : array) {
        buffer.writeFloat64(v);
      }
    }

    @Override
    public double[] read(MemoryBuffer buffer) {
      int length = checkedLength(buffer, 8);
      if (length == MemoryBuffer.NULL_ARRAY_LENGTH) {
        return null;
      }
      double[] array = new double[length];
      for (int i = 0; i < length; i++) {
        array[i] = buffer.readFloat64();
      }
      return array;
    }
  }

  public static final class StringArraySerializer extends Serializer<Object[]> {

    public StringArraySerializer() {
      super(CONSTANT_TYPE_STRING_ARRAY);
    }

    @Override
    public void write(MemoryBuffer buffer, Object[] value) {
      buffer.writeInt32(value.length);
      for (Object s : value) {
        buffer.writeString((String) s);
      }
    }

    @Override
    public String[] read(MemoryBuffer buffer) {
      // every string carries at least its int32 length
      int length = checkedLength(buffer, 4);
      if (length == MemoryBuffer.NULL_ARRAY_LENGTH) {
        return null;
      }
      String[] array = new String[length];
      for (int i = 0; i < length; i++) {
        array[i] = buffer.readString();
      }
      return array;
    }
  }
}
