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

import java.util.Map;
import java.util.Objects;

/** {@link GenericRecord} backed by a schema and its decoded field values. */
public final class CompactGenericRecord extends FieldAccess implements GenericRecord {

  CompactGenericRecord(Schema schema, Map<String, Object> values) {
    super(schema, values);
  }

  public Schema getSchema() {
    return schema;
  }

  Map<String, Object> getValues() {
    return values;
  }

  @Override
  public String getTypeName() {
    return schema.getTypeName();
  }

  @Override
  public boolean hasField(String fieldName) {
    return schema.getField(fieldName) != null;
  }

  @Override
  public boolean getBoolean(String fieldName) {
    return getBooleanValue(fieldName);
  }

  @Override
  public byte getInt8(String fieldName) {
    return getInt8Value(fieldName);
  }

  @Override
  public short getInt16(String fieldName) {
    return getInt16Value(fieldName);
  }

  @Override
  public int getInt32(String fieldName) {
    return getInt32Value(fieldName);
  }

  @Override
  public long getInt64(String fieldName) {
    return getInt64Value(fieldName);
  }

  @Override
  public float getFloat32(String fieldName) {
    return getFloat32Value(fieldName);
  }

  @Override
  public double getFloat64(String fieldName) {
    return getFloat64Value(fieldName);
  }

  @Override
  public String getString(String fieldName) {
    return getStringValue(fieldName);
  }

  @SuppressWarnings("unchecked")
  @Override
  public <T> T getCompact(String fieldName) {
    return (T) get(fieldName, FieldKind.COMPACT);
  }

  @Override
  public GenericRecordBuilder newBuilder() {
    return GenericRecordBuilder.compact(schema.getTypeName());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CompactGenericRecord)) {
      return false;
    }
    CompactGenericRecord that = (CompactGenericRecord) o;
    return schema.equals(that.schema) && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema, values);
  }

  @Override
  public String toString() {
    return schema.getTypeName() + values;
  }
}
