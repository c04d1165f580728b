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
 * A compact value accessed by field name, without a class of its own. Produced when reading a
 * type that has no registered {@link CompactSerializer}, and writable like any compact value.
 */
public interface GenericRecord {

  String getTypeName();

  boolean hasField(String fieldName);

  FieldKind getFieldKind(String fieldName);

  boolean getBoolean(String fieldName);

  byte getInt8(String fieldName);

  short getInt16(String fieldName);

  int getInt32(String fieldName);

  long getInt64(String fieldName);

  float getFloat32(String fieldName);

  double getFloat64(String fieldName);

  String getString(String fieldName);

  /** Returns a nested compact field, as a {@link GenericRecord} or a deserialized object. */
  <T> T getCompact(String fieldName);

  /** Returns an empty builder for another record of the same type name. */
  GenericRecordBuilder newBuilder();
}
