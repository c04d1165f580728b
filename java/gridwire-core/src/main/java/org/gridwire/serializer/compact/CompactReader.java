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

package org.gridwire.serializer.compact;

/**
 * Named field source handed to {@link CompactSerializer#read}. Reading a field that is missing
 * from the schema, or with the wrong kind, fails with a {@link
 * org.gridwire.exception.SerializationException}; use {@link #getFieldKind(String)} to read data
 * written by an older or newer version of a type.
 */
public interface CompactReader {

  /** Returns the kind of the field, or {@link FieldKind#NOT_AVAILABLE} if there is none. */
  FieldKind getFieldKind(String fieldName);

  boolean readBoolean(String fieldName);

  byte readInt8(String fieldName);

  short readInt16(String fieldName);

  int readInt32(String fieldName);

  long readInt64(String fieldName);

  float readFloat32(String fieldName);

  double readFloat64(String fieldName);

  String readString(String fieldName);

  <T> T readCompact(String fieldName);
}
