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

import java.util.Set;

/**
 * Named field source handed to {@link Portable#readPortable}. Reading a missing field, or a field
 * with a different type, fails with a {@link org.gridwire.exception.SerializationException}.
 */
public interface PortableReader {

  /** Version the value was written with. */
  int getVersion();

  boolean hasField(String fieldName);

  Set<String> getFieldNames();

  /** Returns the type of the field, or null if there is no such field. */
  FieldType getFieldType(String fieldName);

  byte readByte(String fieldName);

  boolean readBoolean(String fieldName);

  char readChar(String fieldName);

  short readShort(String fieldName);

  int readInt(String fieldName);

  long readLong(String fieldName);

  float readFloat(String fieldName);

  double readDouble(String fieldName);

  String readUTF(String fieldName);

  byte[] readByteArray(String fieldName);

  int[] readIntArray(String fieldName);

  long[] readLongArray(String fieldName);

  double[] readDoubleArray(String fieldName);

  String[] readUTFArray(String fieldName);

  <P extends Portable> P readPortable(String fieldName);
}
