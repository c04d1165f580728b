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

package org.gridwire.config;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.gridwire.serializer.compact.CompactSerializer;

/** Compact serializers to install into the compact serializer at construction. */
public final class CompactSerializationConfig {
  static final CompactSerializationConfig EMPTY =
      new CompactSerializationConfig(ImmutableList.<CompactSerializer<?>>of());

  private final ImmutableList<CompactSerializer<?>> serializers;

  private CompactSerializationConfig(ImmutableList<CompactSerializer<?>> serializers) {
    this.serializers = serializers;
  }

  public static CompactSerializationConfig of(CompactSerializer<?>... serializers) {
    Preconditions.checkNotNull(serializers, "serializers");
    return new CompactSerializationConfig(ImmutableList.copyOf(serializers));
  }

  public List<CompactSerializer<?>> getSerializers() {
    return serializers;
  }

  /** Returns a config with {@code serializer} appended. */
  public CompactSerializationConfig withSerializer(CompactSerializer<?> serializer) {
    Preconditions.checkNotNull(serializer, "serializer");
    return new CompactSerializationConfig(
        ImmutableList.<CompactSerializer<?>>builder().addAll(serializers).add(serializer).build());
  }
}
