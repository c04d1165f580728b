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

/** Named field sink handed to {@link CompactSerializer#write}. Each field is written once. */
public interface CompactWriter {

  void writeBoolean(String fieldName, boolean value);

  void writeInt8(String fieldName, byte value);

  void writeInt16(String fieldName, short value);

  void writeInt32(String fieldName, int value);

  void writeInt64(String fieldName, long value);

  void writeFloat32(String fieldName, float value);

  void writeFloat64(String fieldName, double value);

  void writeString(String fieldName, String value);

  /** Writes a nested compact value, which may be null. */
  void writeCompact(String fieldName, Object value);
}
