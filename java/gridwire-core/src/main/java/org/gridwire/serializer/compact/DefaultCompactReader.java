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

/** Serves the decoded fields of one compact value to its {@link CompactSerializer}. */
final class DefaultCompactReader extends FieldAccess implements CompactReader {

  DefaultCompactReader(Schema schema, Map<String, Object> values) {
    super(schema, values);
  }

  @Override
  public boolean readBoolean(String fieldName) {
    return getBooleanValue(fieldName);
  }

  @Override
  public byte readInt8(String fieldName) {
    return getInt8Value(fieldName);
  }

  @Override
  public short readInt16(String fieldName) {
    return getInt16Value(fieldName);
  }

  @Override
  public int readInt32(String fieldName) {
    return getInt32Value(fieldName);
  }

  @Override
  public long readInt64(String fieldName) {
    return getInt64Value(fieldName);
  }

  @Override
  public float readFloat32(String fieldName) {
    return getFloat32Value(fieldName);
  }

  @Override
  public double readFloat64(String fieldName) {
    return getFloat64Value(fieldName);
  }

  @Override
  public String readString(String fieldName) {
    return getStringValue(fieldName);
  }

  @SuppressWarnings("unchecked")
  @Override
  public <T> T readCompact(String fieldName) {
    return (T) get(fieldName, FieldKind.COMPACT);
  }
}
