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

package org.gridwire.memory;

import static com.google.common.base.Preconditions.checkArgument;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A heap byte cursor used for both writing and reading serialized values. The buffer keeps
 * independent reader and writer indexes and grows on write operations.
 *
 * <p>Unlike a {@link java.nio.ByteBuffer}, the byte order is fixed at construction for the whole
 * lifetime of the buffer: every multi-byte value, header fields included, is written and read in
 * that order. Members of a cluster must agree on it out-of-band.
 *
 * <p>Variable length values use the cluster's conventions:
 *
 * <ul>
 *   <li>strings are UTF-8 prefixed with their int32 byte length, {@code -1} for null.
 *   <li>byte arrays are prefixed with their int32 length, {@code -1} for null.
 * </ul>
 *
 * <p>Instances are not thread safe and must be owned by a single operation.
 */
public final class MemoryBuffer {
  public static final int DEFAULT_CAPACITY = 64;
  public static final int NULL_ARRAY_LENGTH = -1;
  static final int BUFFER_GROW_STEP_THRESHOLD = 100 * 1024 * 1024;

  private final boolean bigEndian;
  private byte[] heapMemory;
  private int size;
  private int readerIndex;
  private int writerIndex;

  private MemoryBuffer(byte[] bytes, int readerIndex, int writerIndex, boolean bigEndian) {
    this.heapMemory = bytes;
    this.size = bytes.length;
    this.readerIndex = readerIndex;
    this.writerIndex = writerIndex;
    this.bigEndian = bigEndian;
  }

  /** Creates an empty buffer for writing. */
  public static MemoryBuffer allocate(int initialCapacity, boolean bigEndian) {
    checkArgument(initialCapacity >= 0, "Negative capacity %s", initialCapacity);
    return new MemoryBuffer(new byte[initialCapacity], 0, 0, bigEndian);
  }

  public static MemoryBuffer allocate(boolean bigEndian) {
    return allocate(DEFAULT_CAPACITY, bigEndian);
  }

  /**
   * Wraps {@code bytes} for reading. The whole array is readable and the reader starts at {@code
   * offset}. The array is not copied.
   */
  public static MemoryBuffer wrap(byte[] bytes, int offset, boolean bigEndian) {
    if (bytes == null) {
      throw new NullPointerException("buffer");
    }
    if (offset < 0 || offset > bytes.length) {
      throw new IndexOutOfBoundsException(
          String.format("offset: %d (expected: 0 <= offset <= size(%d))", offset, bytes.length));
    }
    return new MemoryBuffer(bytes, offset, bytes.length, bigEndian);
  }

  public static MemoryBuffer wrap(byte[] bytes, boolean bigEndian) {
    return wrap(bytes, 0, bigEndian);
  }

  public boolean isBigEndian() {
    return bigEndian;
  }

  public ByteOrder order() {
    return bigEndian ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
  }

  /** Capacity of the backing array. */
  public int size() {
    return size;
  }

  // -------------------------------------------------------------------------
  //                    Random Access get() and put() methods
  // -------------------------------------------------------------------------

  public byte getByte(int index) {
    checkPosition(index, 1);
    return heapMemory[index];
  }

  public int getInt32(int index) {
    checkPosition(index, 4);
    return getInt32Unchecked(index);
  }

  public void putInt32(int index, int value) {
    checkPosition(index, 4);
    putInt32Unchecked(index, value);
  }

  /** Copies {@code length} bytes starting at {@code index} into a new array. */
  public byte[] getBytes(int index, int length) {
    checkPosition(index, length);
    return Arrays.copyOfRange(heapMemory, index, index + length);
  }

  private void checkPosition(int index, int length) {
    if (index < 0 || length < 0 || index > size - length) {
      throw new IndexOutOfBoundsException(
          String.format("index: %d, length: %d (expected: range(0, %d))", index, length, size));
    }
  }

  private int getInt32Unchecked(int index) {
    byte[] mem = heapMemory;
    if (bigEndian) {
      return (mem[index] & 0xff) << 24
          | (mem[index + 1] & 0xff) << 16
          | (mem[index + 2] & 0xff) << 8
          | (mem[index + 3] & 0xff);
    }
    return (mem[index] & 0xff)
        | (mem[index + 1] & 0xff) << 8
        | (mem[index + 2] & 0xff) << 16
        | (mem[index + 3] & 0xff) << 24;
  }

  private void putInt32Unchecked(int index, int value) {
    byte[] mem = heapMemory;
    if (bigEndian) {
      mem[index] = (byte) (value >>> 24);
      mem[index + 1] = (byte) (value >>> 16);
      mem[index + 2] = (byte) (value >>> 8);
      mem[index + 3] = (byte) value;
    } else {
      mem[index] = (byte) value;
      mem[index + 1] = (byte) (value >>> 8);
      mem[index + 2] = (byte) (value >>> 16);
      mem[index + 3] = (byte) (value >>> 24);
    }
  }

  private long getInt64Unchecked(int index) {
    long high = getInt32Unchecked(index) & 0xffffffffL;
    long low = getInt32Unchecked(index + 4) & 0xffffffffL;
    return bigEndian ? (high << 32) | low : (low << 32) | high;
  }

  private void putInt64Unchecked(int index, long value) {
    if (bigEndian) {
      putInt32Unchecked(index, (int) (value >>> 32));
      putInt32Unchecked(index + 4, (int) value);
    } else {
      putInt32Unchecked(index, (int) value);
      putInt32Unchecked(index + 4, (int) (value >>> 32));
    }
  }

  private short getInt16Unchecked(int index) {
    byte[] mem = heapMemory;
    if (bigEndian) {
      return (short) ((mem[index] & 0xff) << 8 | (mem[index + 1] & 0xff));
    }
    return (short) ((mem[index] & 0xff) | (mem[index + 1] & 0xff) << 8);
  }

  private void putInt16Unchecked(int index, short value) {
    byte[] mem = heapMemory;
    if (bigEndian) {
      mem[index] = (byte) (value >>> 8);
      mem[index + 1] = (byte) value;
    } else {
      mem[index] = (byte) value;
      mem[index + 1] = (byte) (value >>> 8);
    }
  }

  // -------------------------------------------------------------------------
  //                          Write Methods
  // -------------------------------------------------------------------------

  /** Returns the {@code writerIndex} of this buffer. */
  public int writerIndex() {
    return writerIndex;
  }

  /**
   * Sets the {@code writerIndex} of this buffer.
   *
   * @throws IndexOutOfBoundsException if the specified {@code writerIndex} is less than {@code 0}
   *     or greater than {@code this.size}
   */
  public void writerIndex(int writerIndex) {
    if (writerIndex < 0 || writerIndex > size) {
      throw new IndexOutOfBoundsException(
          String.format(
              "writerIndex: %d (expected: 0 <= writerIndex <= size(%d))", writerIndex, size));
    }
    this.writerIndex = writerIndex;
  }

  public void writeBoolean(boolean value) {
    writeByte(value ? 1 : 0);
  }

  public void writeByte(byte value) {
    final int writerIdx = writerIndex;
    final int newIdx = writerIdx + 1;
    ensure(newIdx);
    heapMemory[writerIdx] = value;
    writerIndex = newIdx;
  }

  public void writeByte(int value) {
    writeByte((byte) value);
  }

  public void writeChar(char value) {
    writeInt16((short) value);
  }

  public void writeInt16(short value) {
    final int writerIdx = writerIndex;
    final int newIdx = writerIdx + 2;
    ensure(newIdx);
    putInt16Unchecked(writerIdx, value);
    writerIndex = newIdx;
  }

  public void writeInt32(int value) {
    final int writerIdx = writerIndex;
    final int newIdx = writerIdx + 4;
    ensure(newIdx);
    putInt32Unchecked(writerIdx, value);
    writerIndex = newIdx;
  }

  public void writeInt64(long value) {
    final int writerIdx = writerIndex;
    final int newIdx = writerIdx + 8;
    ensure(newIdx);
    putInt64Unchecked(writerIdx, value);
    writerIndex = newIdx;
  }

  public void writeFloat32(float value) {
    writeInt32(Float.floatToRawIntBits(value));
  }

  public void writeFloat64(double value) {
    writeInt64(Double.doubleToRawLongBits(value));
  }

  public void writeBytes(byte[] bytes) {
    writeBytes(bytes, 0, bytes.length);
  }

  public void writeBytes(byte[] bytes, int offset, int length) {
    final int writerIdx = writerIndex;
    final int newIdx = writerIdx + length;
    ensure(newIdx);
    System.arraycopy(bytes, offset, heapMemory, writerIdx, length);
    writerIndex = newIdx;
  }

  /** Writes an int32 length followed by the bytes, or {@code -1} for null. */
  public void writeBytesAndSize(byte[] bytes) {
    if (bytes == null) {
      writeInt32(NULL_ARRAY_LENGTH);
      return;
    }
    writeInt32(bytes.length);
    writeBytes(bytes);
  }

  /** Writes an int32 UTF-8 byte length followed by the encoded bytes, or {@code -1} for null. */
  public void writeString(String value) {
    if (value == null) {
      writeInt32(NULL_ARRAY_LENGTH);
      return;
    }
    writeBytesAndSize(value.getBytes(StandardCharsets.UTF_8));
  }

  /** Grows the backing array so that at least {@code length} bytes are addressable. */
  public void ensure(int length) {
    if (length > size) {
      growBuffer(length);
    }
  }

  private void growBuffer(int length) {
    int newSize =
        length < BUFFER_GROW_STEP_THRESHOLD
            ? length << 2
            : (int) Math.min(length * 1.5d, Integer.MAX_VALUE - 8);
    heapMemory = Arrays.copyOf(heapMemory, newSize);
    size = newSize;
  }

  /** Returns a copy of the written bytes, {@code [0, writerIndex)}. */
  public byte[] toByteArray() {
    return Arrays.copyOf(heapMemory, writerIndex);
  }

  // -------------------------------------------------------------------------
  //                          Read Methods
  // -------------------------------------------------------------------------

  /** Returns the {@code readerIndex} of this buffer. */
  public int readerIndex() {
    return readerIndex;
  }

  /**
   * Sets the {@code readerIndex} of this buffer.
   *
   * @throws IndexOutOfBoundsException if the specified {@code readerIndex} is less than {@code 0}
   *     or greater than the {@code writerIndex}
   */
  public void readerIndex(int readerIndex) {
    if (readerIndex < 0 || readerIndex > writerIndex) {
      throw new IndexOutOfBoundsException(
          String.format(
              "readerIndex: %d (expected: 0 <= readerIndex <= writerIndex(%d))",
              readerIndex, writerIndex));
    }
    this.readerIndex = readerIndex;
  }

  /** Number of bytes between the reader and the writer index. */
  public int remaining() {
    return writerIndex - readerIndex;
  }

  /**
   * Advances the reader index by {@code length}, returning the old index.
   *
   * @throws IndexOutOfBoundsException if fewer than {@code length} bytes remain
   */
  private int advanceReader(int length) {
    int readerIdx = readerIndex;
    // use subtract to avoid overflow
    if (length < 0 || readerIdx > writerIndex - length) {
      throw new IndexOutOfBoundsException(
          String.format(
              "readerIndex(%d) + length(%d) exceeds writerIndex(%d): %s",
              readerIdx, length, writerIndex, this));
    }
    readerIndex = readerIdx + length;
    return readerIdx;
  }

  public boolean readBoolean() {
    return heapMemory[advanceReader(1)] != 0;
  }

  public byte readByte() {
    return heapMemory[advanceReader(1)];
  }

  public int readUnsignedByte() {
    return heapMemory[advanceReader(1)] & 0xff;
  }

  public char readChar() {
    return (char) getInt16Unchecked(advanceReader(2));
  }

  public short readInt16() {
    return getInt16Unchecked(advanceReader(2));
  }

  public int readInt32() {
    return getInt32Unchecked(advanceReader(4));
  }

  public long readInt64() {
    return getInt64Unchecked(advanceReader(8));
  }

  public float readFloat32() {
    return Float.intBitsToFloat(readInt32());
  }

  public double readFloat64() {
    return Double.longBitsToDouble(readInt64());
  }

  public byte[] readBytes(int length) {
    int readerIdx = advanceReader(length);
    return Arrays.copyOfRange(heapMemory, readerIdx, readerIdx + length);
  }

  /** Reads a value written by {@link #writeBytesAndSize(byte[])}. */
  public byte[] readBytesAndSize() {
    int length = readInt32();
    if (length == NULL_ARRAY_LENGTH) {
      return null;
    }
    return readBytes(length);
  }

  /** Reads a value written by {@link #writeString(String)}. */
  public String readString() {
    int length = readInt32();
    if (length == NULL_ARRAY_LENGTH) {
      return null;
    }
    int readerIdx = advanceReader(length);
    return new String(heapMemory, readerIdx, length, StandardCharsets.UTF_8);
  }

  /**
   * Checks that at least {@code minimumReadableBytes} remain. Used by array readers before
   * allocating so that a corrupted length fails fast instead of allocating a huge array.
   */
  public void checkReadableBytes(int minimumReadableBytes) {
    if (minimumReadableBytes < 0 || remaining() < minimumReadableBytes) {
      throw new IndexOutOfBoundsException(
          String.format(
              "readerIndex(%d) + length(%d) exceeds writerIndex(%d): %s",
              readerIndex, minimumReadableBytes, writerIndex, this));
    }
  }

  @Override
  public String toString() {
    return "MemoryBuffer{"
        + "size="
        + size
        + ", readerIndex="
        + readerIndex
        + ", writerIndex="
        + writerIndex
        + ", order="
        + order()
        + '}';
  }
}
