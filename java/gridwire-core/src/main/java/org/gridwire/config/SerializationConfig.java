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
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.gridwire.resolver.SerializerRegistration;
import org.gridwire.serializer.Serializer;
import org.gridwire.serializer.identified.DataSerializableFactory;
import org.gridwire.serializer.portable.PortableFactory;

/**
 * Immutable options of a {@link org.gridwire.serialization.DefaultSerializationService}, created
 * with {@link #builder()}.
 */
public final class SerializationConfig {
  private final NumberType defaultNumberType;
  private final boolean bigEndian;
  private final JsonStringDeserializationPolicy jsonStringDeserializationPolicy;
  private final ImmutableMap<Integer, DataSerializableFactory> dataSerializableFactories;
  private final ImmutableMap<Integer, PortableFactory> portableFactories;
  private final int portableVersion;
  private final ImmutableList<Serializer<?>> customSerializers;
  private final CompactSerializationConfig compact;
  private final Serializer<?> globalSerializer;
  private final ImmutableList<SerializerRegistration> serializerRegistrations;
  private final boolean discoverSerializerRegistrations;
  private final ClassLoader classLoader;

  private SerializationConfig(Builder builder) {
    this.defaultNumberType = builder.defaultNumberType;
    this.bigEndian = builder.bigEndian;
    this.jsonStringDeserializationPolicy = builder.jsonStringDeserializationPolicy;
    this.dataSerializableFactories = ImmutableMap.copyOf(builder.dataSerializableFactories);
    this.portableFactories = ImmutableMap.copyOf(builder.portableFactories);
    this.portableVersion = builder.portableVersion;
    this.customSerializers = builder.customSerializers.build();
    this.compact = builder.compact;
    this.globalSerializer = builder.globalSerializer;
    this.serializerRegistrations = builder.serializerRegistrations.build();
    this.discoverSerializerRegistrations = builder.discoverSerializerRegistrations;
    this.classLoader = builder.classLoader;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A config with every option at its default. */
  public static SerializationConfig defaults() {
    return builder().build();
  }

  public NumberType getDefaultNumberType() {
    return defaultNumberType;
  }

  public boolean isBigEndian() {
    return bigEndian;
  }

  public JsonStringDeserializationPolicy getJsonStringDeserializationPolicy() {
    return jsonStringDeserializationPolicy;
  }

  public Map<Integer, DataSerializableFactory> getDataSerializableFactories() {
    return dataSerializableFactories;
  }

  public Map<Integer, PortableFactory> getPortableFactories() {
    return portableFactories;
  }

  public int getPortableVersion() {
    return portableVersion;
  }

  public List<Serializer<?>> getCustomSerializers() {
    return customSerializers;
  }

  public CompactSerializationConfig getCompact() {
    return compact;
  }

  /** Returns the global serializer, or null if none is configured. */
  public Serializer<?> getGlobalSerializer() {
    return globalSerializer;
  }

  public List<SerializerRegistration> getSerializerRegistrations() {
    return serializerRegistrations;
  }

  public boolean isDiscoverSerializerRegistrations() {
    return discoverSerializerRegistrations;
  }

  /** Returns the loader used to resolve class names, or null for the context class loader. */
  public ClassLoader getClassLoader() {
    return classLoader;
  }

  @Override
  public String toString() {
    return "SerializationConfig{"
        + "defaultNumberType="
        + defaultNumberType
        + ", bigEndian="
        + bigEndian
        + ", jsonStringDeserializationPolicy="
        + jsonStringDeserializationPolicy
        + ", dataSerializableFactories="
        + dataSerializableFactories.keySet()
        + ", portableFactories="
        + portableFactories.keySet()
        + ", portableVersion="
        + portableVersion
        + ", customSerializers="
        + customSerializers
        + ", globalSerializer="
        + globalSerializer
        + '}';
  }

  public static final class Builder {
    private NumberType defaultNumberType = NumberType.DOUBLE;
    private boolean bigEndian = true;
    private JsonStringDeserializationPolicy jsonStringDeserializationPolicy =
        JsonStringDeserializationPolicy.EAGER;
    private final Map<Integer, DataSerializableFactory> dataSerializableFactories =
        new LinkedHashMap<>();
    private final Map<Integer, PortableFactory> portableFactories = new LinkedHashMap<>();
    private int portableVersion;
    private final ImmutableList.Builder<Serializer<?>> customSerializers = ImmutableList.builder();
    private CompactSerializationConfig compact = CompactSerializationConfig.EMPTY;
    private Serializer<?> globalSerializer;
    private final ImmutableList.Builder<SerializerRegistration> serializerRegistrations =
        ImmutableList.builder();
    private boolean discoverSerializerRegistrations;
    private ClassLoader classLoader;

    private Builder() {}

    public Builder withDefaultNumberType(NumberType defaultNumberType) {
      this.defaultNumberType = Preconditions.checkNotNull(defaultNumberType);
      return this;
    }

    public Builder withBigEndian(boolean bigEndian) {
      this.bigEndian = bigEndian;
      return this;
    }

    public Builder withJsonStringDeserializationPolicy(JsonStringDeserializationPolicy policy) {
      this.jsonStringDeserializationPolicy = Preconditions.checkNotNull(policy);
      return this;
    }

    public Builder withDataSerializableFactory(int factoryId, DataSerializableFactory factory) {
      dataSerializableFactories.put(factoryId, Preconditions.checkNotNull(factory));
      return this;
    }

    public Builder withPortableFactory(int factoryId, PortableFactory factory) {
      portableFactories.put(factoryId, Preconditions.checkNotNull(factory));
      return this;
    }

    public Builder withPortableVersion(int portableVersion) {
      Preconditions.checkArgument(
          portableVersion >= 0, "Portable version must be non-negative: %s", portableVersion);
      this.portableVersion = portableVersion;
      return this;
    }

    /**
     * Adds a serializer for {@link org.gridwire.serialization.CustomSerializable} values whose
     * custom serializer id equals the serializer's type id.
     */
    public Builder withCustomSerializer(Serializer<?> serializer) {
      Preconditions.checkNotNull(serializer);
      Preconditions.checkArgument(
          serializer.getTypeId() >= 1,
          "Custom serializer id must be greater than or equal to 1: %s",
          serializer.getTypeId());
      customSerializers.add(serializer);
      return this;
    }

    public Builder withCompact(CompactSerializationConfig compact) {
      this.compact = Preconditions.checkNotNull(compact);
      return this;
    }

    /** Sets the serializer used for values no other serializer handles. */
    public Builder withGlobalSerializer(Serializer<?> globalSerializer) {
      Preconditions.checkNotNull(globalSerializer);
      Preconditions.checkArgument(
          globalSerializer.getTypeId() >= 1,
          "Global serializer id must be greater than or equal to 1: %s",
          globalSerializer.getTypeId());
      this.globalSerializer = globalSerializer;
      return this;
    }

    public Builder withSerializerRegistration(SerializerRegistration registration) {
      serializerRegistrations.add(Preconditions.checkNotNull(registration));
      return this;
    }

    /** Also installs the registrations found by {@link java.util.ServiceLoader}. */
    public Builder withDiscoverSerializerRegistrations(boolean discover) {
      this.discoverSerializerRegistrations = discover;
      return this;
    }

    public Builder withClassLoader(ClassLoader classLoader) {
      this.classLoader = classLoader;
      return this;
    }

    public SerializationConfig build() {
      return new SerializationConfig(this);
    }
  }
}
