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

package org.gridwire.serializer.portable;

/** Named field sink handed to {@link Portable#writePortable}. */
public interface PortableWriter {

  int getVersion();

  void writeByte(String fieldName, byte value);

  void writeBoolean(String fieldName, boolean value);

  void writeChar(String fieldName, char value);

  void writeShort(String fieldName, short value);

  void writeInt(String fieldName, int value);

  void writeLong(String fieldName, long value);

  void writeFloat(String fieldName, float value);

  void writeDouble(String fieldName, double value);

  void writeUTF(String fieldName, String value);

  void writeByteArray(String fieldName, byte[] value);

  void writeIntArray(String fieldName, int[] value);

  void writeLongArray(String fieldName, long[] value);

  void writeDoubleArray(String fieldName, double[] value);

  void writeUTFArray(String fieldName, String[] value);

  /** Writes a nested portable, which may be null. */
  void writePortable(String fieldName, Portable value);
}
