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
import org.gridwire.exception.SerializationException;

/** Kind-checked access to decoded field values, shared by readers and generic records. */
abstract class FieldAccess {
  protected final Schema schema;
  protected final Map<String, Object> values;

  FieldAccess(Schema schema, Map<String, Object> values) {
    this.schema = schema;
    this.values = values;
  }

  public FieldKind getFieldKind(String fieldName) {
    FieldDescriptor field = schema.getField(fieldName);
    return field == null ? FieldKind.NOT_AVAILABLE : field.getKind();
  }

  Object get(String fieldName, FieldKind kind) {
    FieldDescriptor field = schema.getField(fieldName);
    if (field == null) {
      throw new SerializationException(
          "Unknown field name '" + fieldName + "' for " + schema.getTypeName());
    }
    if (field.getKind() != kind) {
      throw new SerializationException(
          String.format(
              "Mismatched field kind for '%s' of %s: expected %s, found %s",
              fieldName, schema.getTypeName(), kind, field.getKind()));
    }
    return values.get(fieldName);
  }

  boolean getBooleanValue(String fieldName) {
    return (Boolean) get(fieldName, FieldKind.BOOLEAN);
  }

  byte getInt8Value(String fieldName) {
    return (Byte) get(fieldName, FieldKind.INT8);
  }

  short getInt16Value(String fieldName) {
    return (Short) get(fieldName, FieldKind.INT16);
  }

  int getInt32Value(String fieldName) {
    return (Integer) get(fieldName, FieldKind.INT32);
  }

  long getInt64Value(String fieldName) {
    return (Long) get(fieldName, FieldKind.INT64);
  }

  float getFloat32Value(String fieldName) {
    return (Float) get(fieldName, FieldKind.FLOAT32);
  }

  double getFloat64Value(String fieldName) {
    return (Double) get(fieldName, FieldKind.FLOAT64);
  }

  String getStringValue(String fieldName) {
    return (String) get(fieldName, FieldKind.STRING);
  }
}
