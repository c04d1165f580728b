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

package org.gridwire.serialization;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.util.Arrays;
import org.gridwire.memory.MemoryBuffer;

/** A {@link Data} backed by a heap byte array. */
public final class HeapData implements Data {
  public static final int PARTITION_HASH_OFFSET = 0;
  public static final int TYPE_OFFSET = 4;
  public static final int DATA_OFFSET = 8;
  public static final int HEAP_DATA_OVERHEAD = DATA_OFFSET;

  private static final int MURMUR_SEED = 0x01000193;
  private static final HashFunction PAYLOAD_HASH = Hashing.murmur3_32_fixed(MURMUR_SEED);

  private final byte[] payload;
  private final boolean bigEndian;

  /**
   * Creates an envelope over a copy of {@code payload}.
   *
   * @throws IllegalArgumentException if the array is non-empty but too short for a header
   */
  public HeapData(byte[] payload, boolean bigEndian) {
    this(payload, bigEndian, true);
  }

  private HeapData(byte[] payload, boolean bigEndian, boolean copy) {
    Preconditions.checkNotNull(payload, "payload");
    if (payload.length > 0 && payload.length < HEAP_DATA_OVERHEAD) {
      throw new IllegalArgumentException(
          "Data should be either empty or should contain more than "
              + HEAP_DATA_OVERHEAD
              + " bytes! -> "
              + Arrays.toString(payload));
    }
    this.payload = copy ? payload.clone() : payload;
    this.bigEndian = bigEndian;
  }

  /** Wraps a freshly written array that no one else references. */
  static HeapData wrapOwned(byte[] payload, boolean bigEndian) {
    return new HeapData(payload, bigEndian, false);
  }

  @Override
  public byte[] toByteArray() {
    return payload.clone();
  }

  @Override
  public int getType() {
    if (totalSize() == 0) {
      return 0;
    }
    return readHeaderInt(TYPE_OFFSET);
  }

  @Override
  public int totalSize() {
    return payload.length;
  }

  @Override
  public int dataSize() {
    return Math.max(totalSize() - HEAP_DATA_OVERHEAD, 0);
  }

  @Override
  public boolean hasPartitionHash() {
    return payload.length >= HEAP_DATA_OVERHEAD && readHeaderInt(PARTITION_HASH_OFFSET) != 0;
  }

  @Override
  public int getPartitionHash() {
    if (hasPartitionHash()) {
      return readHeaderInt(PARTITION_HASH_OFFSET);
    }
    return hashCode();
  }

  @Override
  public boolean isBigEndian() {
    return bigEndian;
  }

  /** Opens a reader positioned at the first payload byte. */
  MemoryBuffer payloadReader() {
    return MemoryBuffer.wrap(payload, DATA_OFFSET, bigEndian);
  }

  private int readHeaderInt(int offset) {
    return MemoryBuffer.wrap(payload, bigEndian).getInt32(offset);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Data)) {
      return false;
    }
    Data data = (Data) o;
    if (getType() != data.getType()) {
      return false;
    }
    return Arrays.equals(payload, data.toByteArray());
  }

  /** MurmurHash3 x86 32-bit of the payload bytes, header excluded. */
  @Override
  public int hashCode() {
    return PAYLOAD_HASH.hashBytes(payload, Math.min(DATA_OFFSET, payload.length), dataSize())
        .asInt();
  }

  @Override
  public String toString() {
    return "HeapData{"
        + "type="
        + getType()
        + ", hashCode="
        + hashCode()
        + ", partitionHash="
        + getPartitionHash()
        + ", totalSize="
        + totalSize()
        + ", dataSize="
        + dataSize()
        + '}';
  }
}
