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

package org.gridwire.serializer;

import org.gridwire.memory.MemoryBuffer;

/**
 * Converts values of one kind to and from their payload bytes. A serializer never writes the
 * envelope header, only the payload following it.
 *
 * <p>Implementations must be deterministic: the same value always produces the same bytes under the
 * same configuration, and {@link #read} consumes exactly the bytes {@link #write} produced. A
 * serializer holds no mutable state shared between calls, so one instance may be used by many
 * threads at once.
 *
 * <p>Built-in serializers use the cluster's reserved type ids, which are zero or negative. User
 * supplied serializers must use ids {@code >= 1}.
 *
 * @param <T> type of the values handled by this serializer
 */
public abstract class Serializer<T> {
  protected final int typeId;

  protected Serializer(int typeId) {
    this.typeId = typeId;
  }

  /** Type id written to the envelope header, stable for the lifetime of the registry. */
  public final int getTypeId() {
    return typeId;
  }

  public abstract void write(MemoryBuffer buffer, T value);

  public abstract T read(MemoryBuffer buffer);

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{typeId=" + typeId + '}';
  }
}
