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

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/** Kinds of compact fields. The id takes part in the schema fingerprint. */
public enum FieldKind {
  NOT_AVAILABLE(0),
  BOOLEAN(1),
  INT8(3),
  INT16(7),
  INT32(9),
  INT64(11),
  FLOAT32(13),
  FLOAT64(15),
  STRING(17),
  COMPACT(29);

  private static final Int2ObjectMap<FieldKind> BY_ID = new Int2ObjectOpenHashMap<>();

  static {
    for (FieldKind kind : values()) {
      BY_ID.put(kind.id, kind);
    }
  }

  private final int id;

  FieldKind(int id) {
    this.id = id;
  }

  public int getId() {
    return id;
  }

  /** Returns the kind with {@code id}, or {@link #NOT_AVAILABLE} for an unknown id. */
  public static FieldKind of(int id) {
    FieldKind kind = BY_ID.get(id);
    return kind == null ? NOT_AVAILABLE : kind;
  }
}
