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

import com.google.common.base.Preconditions;
import java.util.HashMap;

/** Builds a {@link GenericRecord} field by field. Each field may be set once. */
public final class GenericRecordBuilder {
  private final String typeName;
  private final FieldValues fields = new FieldValues();

  private GenericRecordBuilder(String typeName) {
    this.typeName = Preconditions.checkNotNull(typeName, "typeName");
  }

  public static GenericRecordBuilder compact(String typeName) {
    return new GenericRecordBuilder(typeName);
  }

  public GenericRecordBuilder setBoolean(String fieldName, boolean value) {
    fields.put(fieldName, FieldKind.BOOLEAN, value);
    return this;
  }

  public GenericRecordBuilder setInt8(String fieldName, byte value) {
    fields.put(fieldName, FieldKind.INT8, value);
    return this;
  }

  public GenericRecordBuilder setInt16(String fieldName, short value) {
    fields.put(fieldName, FieldKind.INT16, value);
    return this;
  }

  public GenericRecordBuilder setInt32(String fieldName, int value) {
    fields.put(fieldName, FieldKind.INT32, value);
    return this;
  }

  public GenericRecordBuilder setInt64(String fieldName, long value) {
    fields.put(fieldName, FieldKind.INT64, value);
    return this;
  }

  public GenericRecordBuilder setFloat32(String fieldName, float value) {
    fields.put(fieldName, FieldKind.FLOAT32, value);
    return this;
  }

  public GenericRecordBuilder setFloat64(String fieldName, double value) {
    fields.put(fieldName, FieldKind.FLOAT64, value);
    return this;
  }

  public GenericRecordBuilder setString(String fieldName, String value) {
    fields.put(fieldName, FieldKind.STRING, value);
    return this;
  }

  public GenericRecordBuilder setGenericRecord(String fieldName, GenericRecord value) {
    fields.put(fieldName, FieldKind.COMPACT, value);
    return this;
  }

  public GenericRecord build() {
    return new CompactGenericRecord(
        new Schema(typeName, fields.descriptors()), new HashMap<>(fields.values()));
  }
}
