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

/** Records what a {@link CompactSerializer} writes, before it is encoded against a schema. */
final class DefaultCompactWriter implements CompactWriter {
  private final FieldValues fields = new FieldValues();

  FieldValues fields() {
    return fields;
  }

  @Override
  public void writeBoolean(String fieldName, boolean value) {
    fields.put(fieldName, FieldKind.BOOLEAN, value);
  }

  @Override
  public void writeInt8(String fieldName, byte value) {
    fields.put(fieldName, FieldKind.INT8, value);
  }

  @Override
  public void writeInt16(String fieldName, short value) {
    fields.put(fieldName, FieldKind.INT16, value);
  }

  @Override
  public void writeInt32(String fieldName, int value) {
    fields.put(fieldName, FieldKind.INT32, value);
  }

  @Override
  public void writeInt64(String fieldName, long value) {
    fields.put(fieldName, FieldKind.INT64, value);
  }

  @Override
  public void writeFloat32(String fieldName, float value) {
    fields.put(fieldName, FieldKind.FLOAT32, value);
  }

  @Override
  public void writeFloat64(String fieldName, double value) {
    fields.put(fieldName, FieldKind.FLOAT64, value);
  }

  @Override
  public void writeString(String fieldName, String value) {
    fields.put(fieldName, FieldKind.STRING, value);
  }

  @Override
  public void writeCompact(String fieldName, Object value) {
    fields.put(fieldName, FieldKind.COMPACT, value);
  }
}
