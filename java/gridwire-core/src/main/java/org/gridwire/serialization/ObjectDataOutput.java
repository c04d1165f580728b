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

/**
 * The output handed to {@link org.gridwire.serializer.identified.IdentifiedDataSerializable}
 * implementations: a {@link MemoryBuffer} that can also embed nested values.
 */
public final class ObjectDataOutput {
  private final MemoryBuffer buffer;
  private final SerializationService service;

  public ObjectDataOutput(MemoryBuffer buffer, SerializationService service) {
    this.buffer = buffer;
    this.service = service;
  }

  public MemoryBuffer getBuffer() {
    return buffer;
  }

  public void writeBoolean(boolean value) {
    buffer.writeBoolean(value);
  }

  public void writeByte(int value) {
    buffer.writeByte(value);
  }

  public void writeChar(char value) {
    buffer.writeChar(value);
  }

  public void writeShort(short value) {
    buffer.writeInt16(value);
  }

  public void writeInt(int value) {
    buffer.writeInt32(value);
  }

  public void writeLong(long value) {
    buffer.writeInt64(value);
  }

  public void writeFloat(float value) {
    buffer.writeFloat32(value);
  }

  public void writeDouble(double value) {
    buffer.writeFloat64(value);
  }

  public void writeString(String value) {
    buffer.writeString(value);
  }

  public void writeByteArray(byte[] value) {
    buffer.writeBytesAndSize(value);
  }

  /** Embeds any serializable value, prefixed by its type id. */
  public void writeObject(Object value) {
    service.writeObject(buffer, value);
  }
}
