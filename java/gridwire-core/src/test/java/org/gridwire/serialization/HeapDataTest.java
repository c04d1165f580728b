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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import com.google.common.hash.Hashing;
import org.gridwire.GridwireTestBase;
import org.gridwire.memory.MemoryBuffer;
import org.testng.annotations.Test;

public class HeapDataTest extends GridwireTestBase {

  private static byte[] envelope(boolean bigEndian, int partitionHash, int type, int payload) {
    MemoryBuffer buffer = MemoryBuffer.allocate(bigEndian);
    buffer.writeInt32(partitionHash);
    buffer.writeInt32(type);
    buffer.writeInt32(payload);
    return buffer.toByteArray();
  }

  @Test(dataProvider = "byteOrders")
  public void testHeader(boolean bigEndian) {
    HeapData data = new HeapData(envelope(bigEndian, 77, -7, 14), bigEndian);
    assertEquals(data.getType(), -7);
    assertEquals(data.totalSize(), 12);
    assertEquals(data.dataSize(), 4);
    assertTrue(data.hasPartitionHash());
    assertEquals(data.getPartitionHash(), 77);
    assertEquals(data.isBigEndian(), bigEndian);
  }

  @Test
  public void testHashCodeIsMurmurOfPayload() {
    byte[] bytes = envelope(true, 0, -7, 14);
    HeapData data = new HeapData(bytes, true);
    int expected =
        Hashing.murmur3_32_fixed(0x01000193)
            .hashBytes(new byte[] {0, 0, 0, 14})
            .asInt();
    assertEquals(data.hashCode(), expected);
    assertFalse(data.hasPartitionHash());
    assertEquals(data.getPartitionHash(), expected);
  }

  @Test
  public void testHashCodeIgnoresHeader() {
    HeapData first = new HeapData(envelope(true, 1, -7, 14), true);
    HeapData second = new HeapData(envelope(true, 2, -7, 14), true);
    assertEquals(first.hashCode(), second.hashCode());
    assertNotEquals(first, second);
    assertEquals(first, new HeapData(envelope(true, 1, -7, 14), true));
  }

  @Test
  public void testEmptyAndInvalid() {
    HeapData empty = new HeapData(new byte[0], true);
    assertEquals(empty.getType(), 0);
    assertEquals(empty.totalSize(), 0);
    assertEquals(empty.dataSize(), 0);
    assertThrows(IllegalArgumentException.class, () -> new HeapData(new byte[7], true));
    assertThrows(NullPointerException.class, () -> new HeapData(null, true));
  }

  @Test
  public void testToByteArrayIsACopy() {
    byte[] bytes = envelope(true, 0, -7, 14);
    HeapData data = new HeapData(bytes, true);
    byte[] copy = data.toByteArray();
    copy[11] = 99;
    assertEquals(data.toByteArray()[11], 14);
  }

  @Test
  public void testConstructorCopiesPayload() {
    byte[] bytes = envelope(true, 5, -7, 14);
    HeapData data = new HeapData(bytes, true);
    bytes[7] = 0;
    bytes[11] = 99;
    assertEquals(data.getType(), -7);
    assertEquals(data, new HeapData(envelope(true, 5, -7, 14), true));
  }
}
