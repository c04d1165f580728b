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

package org.gridwire.resolver;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.gridwire.config.NumberType;
import org.gridwire.exception.DuplicateSerializerIdException;
import org.gridwire.exception.DuplicateSerializerNameException;
import org.gridwire.serializer.Serializer;

/**
 * Maps serializer names to type ids and type ids to serializers. Built once through a {@link
 * Builder} and immutable afterwards, so lookups need no synchronization.
 *
 * <p>Built-in serializers are registered under their {@link TypeKind#registryName()}, arrays
 * under {@link TypeKind#arrayRegistryName()}. The other reserved names are the constants of this
 * class.
 */
public final class SerializerRegistry {
  public static final String ARRAY_SUFFIX = "Array";
  public static final String COMPACT = "!compact";
  public static final String IDENTIFIED = "identified";
  public static final String PORTABLE = "!portable";
  public static final String JSON = "!json";
  public static final String GLOBAL = "!global";
  public static final String CUSTOM_PREFIX = "!custom";

  private final ImmutableMap<String, Integer> nameToId;
  private final Int2ObjectMap<Serializer<?>> idToSerializer;
  private final NumberType defaultNumberType;

  private SerializerRegistry(Builder builder) {
    this.nameToId = ImmutableMap.copyOf(builder.nameToId);
    this.idToSerializer =
        Int2ObjectMaps.unmodifiable(new Int2ObjectOpenHashMap<>(builder.idToSerializer));
    this.defaultNumberType = builder.defaultNumberType;
  }

  public static Builder builder(NumberType defaultNumberType) {
    return new Builder(defaultNumberType);
  }

  /** Name of the custom serializer with {@code typeId}. */
  public static String customName(int typeId) {
    return CUSTOM_PREFIX + typeId;
  }

  /** Returns the serializer with {@code typeId}, or null. */
  public Serializer<?> findSerializerById(int typeId) {
    return idToSerializer.get(typeId);
  }

  /**
   * Returns the serializer registered under {@code name}, or under {@code name + "Array"} when
   * {@code isArray} is set, or null. The logical names {@code number} and {@code buffer} are
   * looked up as the default number type and {@code byteArray}.
   */
  public Serializer<?> findSerializerByName(String name, boolean isArray) {
    String converted;
    if (TypeKind.NUMBER.registryName().equals(name)) {
      converted = defaultNumberType.kind().registryName();
    } else if (TypeKind.BUFFER.registryName().equals(name)) {
      converted = TypeKind.BYTE.arrayRegistryName();
    } else {
      converted = name;
    }
    Integer typeId = nameToId.get(isArray ? converted + ARRAY_SUFFIX : converted);
    return typeId == null ? null : idToSerializer.get(typeId.intValue());
  }

  public Serializer<?> findSerializer(TypeKind kind, boolean isArray) {
    return findSerializerByName(kind.registryName(), isArray);
  }

  public boolean contains(String name) {
    return nameToId.containsKey(name);
  }

  public Set<String> getNames() {
    return nameToId.keySet();
  }

  public int size() {
    return nameToId.size();
  }

  public NumberType getDefaultNumberType() {
    return defaultNumberType;
  }

  @Override
  public String toString() {
    return "SerializerRegistry" + nameToId;
  }

  /** Collects registrations; not thread safe. */
  public static final class Builder {
    private final Map<String, Integer> nameToId = new LinkedHashMap<>();
    private final Int2ObjectMap<Serializer<?>> idToSerializer = new Int2ObjectOpenHashMap<>();
    private final NumberType defaultNumberType;

    private Builder(NumberType defaultNumberType) {
      this.defaultNumberType = Preconditions.checkNotNull(defaultNumberType);
    }

    /**
     * Registers {@code serializer} under {@code name}.
     *
     * @throws DuplicateSerializerNameException if the name is taken
     * @throws DuplicateSerializerIdException if the serializer's type id is taken
     */
    public Builder register(String name, Serializer<?> serializer) {
      Preconditions.checkNotNull(name, "name");
      Preconditions.checkNotNull(serializer, "serializer");
      if (nameToId.containsKey(name)) {
        throw new DuplicateSerializerNameException(name);
      }
      int typeId = serializer.getTypeId();
      if (idToSerializer.containsKey(typeId)) {
        throw new DuplicateSerializerIdException(name, typeId);
      }
      nameToId.put(name, typeId);
      idToSerializer.put(typeId, serializer);
      return this;
    }

    public boolean contains(String name) {
      return nameToId.containsKey(name);
    }

    public SerializerRegistry build() {
      return new SerializerRegistry(this);
    }
  }
}
