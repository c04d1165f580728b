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

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/** Types of portable fields, with their wire ids. */
public enum FieldType {
  PORTABLE(0),
  BYTE(1),
  BOOLEAN(2),
  CHAR(3),
  SHORT(4),
  INT(5),
  LONG(6),
  FLOAT(7),
  DOUBLE(8),
  UTF(9),
  BYTE_ARRAY(11),
  INT_ARRAY(15),
  LONG_ARRAY(16),
  DOUBLE_ARRAY(18),
  UTF_ARRAY(19);

  private static final Int2ObjectMap<FieldType> BY_ID = new Int2ObjectOpenHashMap<>();

  static {
    for (FieldType type : values()) {
      BY_ID.put(type.id, type);
    }
  }

  private final int id;

  FieldType(int id) {
    this.id = id;
  }

  public int getId() {
    return id;
  }

  /** Returns the type with {@code id}, or null. */
  public static FieldType of(int id) {
    return BY_ID.get(id);
  }
}
