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

package org.gridwire.serialization;

import org.gridwire.memory.MemoryBuffer;
import org.gridwire.serializer.compact.Schema;

/**
 * Converts values to and from {@link Data}, the binary envelope understood by every cluster
 * member. Implementations are safe for concurrent use once constructed.
 */
public interface SerializationService {

  /**
   * Serializes {@code value} with the default partitioning strategy.
   *
   * @see #toData(Object, PartitioningStrategy)
   */
  Data toData(Object value);

  /**
   * Serializes {@code value} into a new envelope. A {@link Data} argument is returned unchanged.
   *
   * @throws org.gridwire.exception.UnserializableValueException if value is {@link Absent}
   * @throws org.gridwire.exception.SerializerNotFoundException if no serializer matches
   */
  Data toData(Object value, PartitioningStrategy strategy);

  /**
   * Reads the value held by {@code data}. Null and anything that is not a {@link Data} are returned
   * unchanged.
   *
   * @throws org.gridwire.exception.DeserializerNotFoundException if the type id is unknown
   */
  <T> T toObject(Object data);

  /** Writes the type id and payload of {@code value}, without partition hash, for nesting. */
  void writeObject(MemoryBuffer buffer, Object value);

  /** Reads a value written by {@link #writeObject(MemoryBuffer, Object)}. */
  <T> T readObject(MemoryBuffer buffer);

  /** Binds a known compact schema to a class so writes reuse it instead of rebuilding it. */
  void registerSchemaToClass(Schema schema, Class<?> type);

  boolean isData(Object value);

  /** Whether envelopes produced by this service are big-endian. */
  boolean isBigEndian();
}
