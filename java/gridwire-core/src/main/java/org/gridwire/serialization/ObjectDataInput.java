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

import org.gridwire.memory.MemoryBuffer;

/** Read side of {@link ObjectDataOutput}. */
public final class ObjectDataInput {
  private final MemoryBuffer buffer;
  private final SerializationService service;

  public ObjectDataInput(MemoryBuffer buffer, SerializationService service) {
    this.buffer = buffer;
    this.service = service;
  }

  public MemoryBuffer getBuffer() {
    return buffer;
  }

  public boolean readBoolean() {
    return buffer.readBoolean();
  }

  public byte readByte() {
    return buffer.readByte();
  }

  public char readChar() {
    return buffer.readChar();
  }

  public short readShort() {
    return buffer.readInt16();
  }

  public int readInt() {
    return buffer.readInt32();
  }

  public long readLong() {
    return buffer.readInt64();
  }

  public float readFloat() {
    return buffer.readFloat32();
  }

  public double readDouble() {
    return buffer.readFloat64();
  }

  public String readString() {
    return buffer.readString();
  }

  public byte[] readByteArray() {
    return buffer.readBytesAndSize();
  }

  public <T> T readObject() {
    return service.readObject(buffer);
  }
}
