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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import org.gridwire.cluster.ClusterDataFactory;
import org.gridwire.config.CompactSerializationConfig;
import org.gridwire.config.JsonStringDeserializationPolicy;
import org.gridwire.config.SerializationConfig;
import org.gridwire.core.RestValue;
import org.gridwire.exception.DeserializerNotFoundException;
import org.gridwire.exception.PartitionKeyRecursionException;
import org.gridwire.memory.MemoryBuffer;
import org.gridwire.resolver.SerializerRegistration;
import org.gridwire.resolver.SerializerRegistry;
import org.gridwire.resolver.SerializerResolver;
import org.gridwire.resolver.TypeKind;
import org.gridwire.resolver.ValueClassifier;
import org.gridwire.serializer.ArraySerializers;
import org.gridwire.serializer.JsonSerializers;
import org.gridwire.serializer.PrimitiveSerializers;
import org.gridwire.serializer.Serializer;
import org.gridwire.serializer.Serializers;
import org.gridwire.serializer.TimeSerializers;
import org.gridwire.serializer.collection.ListSerializers;
import org.gridwire.serializer.compact.CompactSerializer;
import org.gridwire.serializer.compact.CompactStreamSerializer;
import org.gridwire.serializer.compact.InMemorySchemaService;
import org.gridwire.serializer.compact.Schema;
import org.gridwire.serializer.compact.SchemaService;
import org.gridwire.serializer.identified.DataSerializableFactory;
import org.gridwire.serializer.identified.IdentifiedDataSerializableSerializer;
import org.gridwire.serializer.portable.PortableSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@link SerializationService} of a client. The registry is built once in the constructor:
 * default serializers first, then custom serializers, compact serializers, {@link
 * SerializerRegistration} hooks and finally the global serializer. It is read-only afterwards, so
 * an instance can be shared by any number of threads.
 */
@SuppressWarnings({"rawtypes", "unchecked"})
public class DefaultSerializationService implements SerializationService {
  private static final Logger LOG = LoggerFactory.getLogger(DefaultSerializationService.class);

  /** Deepest chain of {@link PartitionAware} keys serialized for one value. */
  public static final int MAX_PARTITION_KEY_DEPTH = 16;

  private final SerializationConfig config;
  private final boolean bigEndian;
  private final CompactStreamSerializer compactSerializer;
  private final SerializerRegistry registry;
  private final SerializerResolver resolver;

  public DefaultSerializationService(SerializationConfig config) {
    this(config, new InMemorySchemaService());
  }

  public DefaultSerializationService(SerializationConfig config, SchemaService schemaService) {
    this.config = Preconditions.checkNotNull(config, "config");
    this.bigEndian = config.isBigEndian();
    this.compactSerializer = new CompactStreamSerializer(schemaService);
    SerializerRegistry.Builder builder = SerializerRegistry.builder(config.getDefaultNumberType());
    registerDefaultSerializers(builder);
    registerCustomSerializers(builder);
    registerCompactSerializers(config.getCompact());
    applySerializerRegistrations(builder);
    registerGlobalSerializer(builder);
    this.registry = builder.build();
    this.resolver = new SerializerResolver(registry, new ValueClassifier(this::isCompactValue));
    LOG.debug(
        "Created serialization service with {} serializers, config {}", registry.size(), config);
  }

  private boolean isCompactValue(Object value) {
    return compactSerializer.isCompactValue(value);
  }

  private void registerDefaultSerializers(SerializerRegistry.Builder builder) {
    builder.register(TypeKind.STRING.registryName(), new PrimitiveSerializers.StringSerializer());
    builder.register(TypeKind.DOUBLE.registryName(), new PrimitiveSerializers.DoubleSerializer());
    builder.register(TypeKind.BYTE.registryName(), new PrimitiveSerializers.ByteSerializer());
    builder.register(TypeKind.BOOLEAN.registryName(), new PrimitiveSerializers.BooleanSerializer());
    builder.register(TypeKind.NULL.registryName(), new PrimitiveSerializers.NullSerializer());
    builder.register(TypeKind.SHORT.registryName(), new PrimitiveSerializers.ShortSerializer());
    builder.register(TypeKind.INTEGER.registryName(), new PrimitiveSerializers.IntegerSerializer());
    builder.register(TypeKind.LONG.registryName(), new PrimitiveSerializers.LongSerializer());
    builder.register(TypeKind.FLOAT.registryName(), new PrimitiveSerializers.FloatSerializer());
    builder.register(TypeKind.CHAR.registryName(), new PrimitiveSerializers.CharSerializer());
    builder.register(TypeKind.DATE.registryName(), new TimeSerializers.DateSerializer());
    builder.register(TypeKind.LOCAL_DATE.registryName(), new TimeSerializers.LocalDateSerializer());
    builder.register(TypeKind.LOCAL_TIME.registryName(), new TimeSerializers.LocalTimeSerializer());
    builder.register(
        TypeKind.LOCAL_DATE_TIME.registryName(), new TimeSerializers.LocalDateTimeSerializer());
    builder.register(
        TypeKind.OFFSET_DATE_TIME.registryName(), new TimeSerializers.OffsetDateTimeSerializer());
    builder.register(
        TypeKind.BYTE.arrayRegistryName(), new ArraySerializers.ByteArraySerializer());
    builder.register(
        TypeKind.CHAR.arrayRegistryName(), new ArraySerializers.CharArraySerializer());
    builder.register(
        TypeKind.BOOLEAN.arrayRegistryName(), new ArraySerializers.BooleanArraySerializer());
    builder.register(
        TypeKind.SHORT.arrayRegistryName(), new ArraySerializers.ShortArraySerializer());
    builder.register(
        TypeKind.INTEGER.arrayRegistryName(), new ArraySerializers.IntegerArraySerializer());
    builder.register(
        TypeKind.LONG.arrayRegistryName(), new ArraySerializers.LongArraySerializer());
    builder.register(
        TypeKind.DOUBLE.arrayRegistryName(), new ArraySerializers.DoubleArraySerializer());
    builder.register(
        TypeKind.STRING.arrayRegistryName(), new ArraySerializers.StringArraySerializer());
    builder.register(TypeKind.JAVA_CLASS.registryName(), new Serializers.ClassSerializer(loader()));
    builder.register(
        TypeKind.FLOAT.arrayRegistryName(), new ArraySerializers.FloatArraySerializer());
    builder.register(
        TypeKind.ARRAY_LIST.registryName(), new ListSerializers.ArrayListSerializer(this));
    builder.register(
        TypeKind.LINKED_LIST.registryName(), new ListSerializers.LinkedListSerializer(this));
    builder.register(TypeKind.UUID.registryName(), new Serializers.UuidSerializer());
    builder.register(TypeKind.BIG_DECIMAL.registryName(), new Serializers.BigDecimalSerializer());
    builder.register(TypeKind.BIG_INTEGER.registryName(), new Serializers.BigIntegerSerializer());
    builder.register(
        TypeKind.JAVA_ARRAY.registryName(), new ListSerializers.JavaArraySerializer(this));
    builder.register(SerializerRegistry.COMPACT, compactSerializer);
    builder.register(SerializerRegistry.IDENTIFIED, createIdentifiedSerializer());
    builder.register(
        SerializerRegistry.PORTABLE,
        new PortableSerializer(config.getPortableFactories(), config.getPortableVersion()));
    if (config.getJsonStringDeserializationPolicy() == JsonStringDeserializationPolicy.EAGER) {
      builder.register(SerializerRegistry.JSON, new JsonSerializers.JsonSerializer());
    } else {
      builder.register(SerializerRegistry.JSON, new JsonSerializers.JsonValueSerializer());
    }
  }

  private ClassLoader loader() {
    ClassLoader loader = config.getClassLoader();
    if (loader == null) {
      loader = Thread.currentThread().getContextClassLoader();
    }
    return loader != null ? loader : DefaultSerializationService.class.getClassLoader();
  }

  private IdentifiedDataSerializableSerializer createIdentifiedSerializer() {
    Map<Integer, DataSerializableFactory> factories =
        new LinkedHashMap<>(config.getDataSerializableFactories());
    putReservedFactory(factories, ClusterDataFactory.FACTORY_ID, new ClusterDataFactory());
    putReservedFactory(factories, RestValue.FACTORY_ID, new RestValue.Factory());
    return new IdentifiedDataSerializableSerializer(this, factories);
  }

  private static void putReservedFactory(
      Map<Integer, DataSerializableFactory> factories, int factoryId, DataSerializableFactory f) {
    DataSerializableFactory previous = factories.put(factoryId, f);
    if (previous != null) {
      LOG.warn(
          "Factory id {} is reserved, data serializable factory {} is replaced by {}",
          factoryId,
          previous,
          f.getClass().getName());
    }
  }

  private void registerCustomSerializers(SerializerRegistry.Builder builder) {
    for (Serializer<?> serializer : config.getCustomSerializers()) {
      builder.register(SerializerRegistry.customName(serializer.getTypeId()), serializer);
    }
  }

  private void registerCompactSerializers(CompactSerializationConfig compact) {
    for (CompactSerializer<?> serializer : compact.getSerializers()) {
      compactSerializer.registerSerializer(serializer);
    }
  }

  private void applySerializerRegistrations(SerializerRegistry.Builder builder) {
    List<SerializerRegistration> registrations =
        new ArrayList<>(config.getSerializerRegistrations());
    if (config.isDiscoverSerializerRegistrations()) {
      for (SerializerRegistration registration :
          ServiceLoader.load(SerializerRegistration.class, loader())) {
        LOG.info("Discovered serializer registration {}", registration.getClass().getName());
        registrations.add(registration);
      }
    }
    for (SerializerRegistration registration : registrations) {
      if (registration.isApplicable(config)) {
        registration.registerSerializers(builder, this);
      } else {
        LOG.debug("Skipped serializer registration {}", registration.getClass().getName());
      }
    }
  }

  private void registerGlobalSerializer(SerializerRegistry.Builder builder) {
    Serializer<?> globalSerializer = config.getGlobalSerializer();
    if (globalSerializer != null) {
      builder.register(SerializerRegistry.GLOBAL, globalSerializer);
    }
  }

  @Override
  public Data toData(Object value) {
    return toData(value, PartitioningStrategy.DEFAULT);
  }

  @Override
  public Data toData(Object value, PartitioningStrategy strategy) {
    Preconditions.checkNotNull(strategy, "strategy");
    return toData(value, strategy, 0);
  }

  private Data toData(Object value, PartitioningStrategy strategy, int depth) {
    if (value instanceof Data) {
      return (Data) value;
    }
    if (depth > MAX_PARTITION_KEY_DEPTH) {
      throw new PartitionKeyRecursionException(MAX_PARTITION_KEY_DEPTH, value);
    }
    Serializer serializer = resolver.resolve(value);
    int partitionHash = computePartitionHash(value, strategy, depth);
    MemoryBuffer buffer = MemoryBuffer.allocate(bigEndian);
    buffer.writeInt32(partitionHash);
    buffer.writeInt32(serializer.getTypeId());
    serializer.write(buffer, value);
    return HeapData.wrapOwned(buffer.toByteArray(), bigEndian);
  }

  private int computePartitionHash(Object value, PartitioningStrategy strategy, int depth) {
    if (value instanceof PartitionAware) {
      Object partitionKey = ((PartitionAware<?>) value).getPartitionKey();
      if (partitionKey != null) {
        Data keyData = toData(partitionKey, PartitioningStrategy.DEFAULT, depth + 1);
        return strategy.computePartitionHash(keyData);
      }
    }
    return strategy.computePartitionHash(value);
  }

  @Override
  public <T> T toObject(Object data) {
    if (!(data instanceof Data)) {
      return (T) data;
    }
    Data envelope = (Data) data;
    if (envelope.totalSize() == 0) {
      return null;
    }
    int typeId = envelope.getType();
    Serializer serializer = registry.findSerializerById(typeId);
    if (serializer == null) {
      throw new DeserializerNotFoundException(typeId);
    }
    MemoryBuffer buffer;
    if (envelope instanceof HeapData) {
      buffer = ((HeapData) envelope).payloadReader();
    } else {
      buffer =
          MemoryBuffer.wrap(envelope.toByteArray(), HeapData.DATA_OFFSET, envelope.isBigEndian());
    }
    return (T) serializer.read(buffer);
  }

  @Override
  public void writeObject(MemoryBuffer buffer, Object value) {
    Serializer serializer = resolver.resolve(value);
    buffer.writeInt32(serializer.getTypeId());
    serializer.write(buffer, value);
  }

  @Override
  public <T> T readObject(MemoryBuffer buffer) {
    int typeId = buffer.readInt32();
    Serializer serializer = registry.findSerializerById(typeId);
    if (serializer == null) {
      throw new DeserializerNotFoundException(typeId);
    }
    return (T) serializer.read(buffer);
  }

  @Override
  public void registerSchemaToClass(Schema schema, Class<?> type) {
    compactSerializer.registerSchemaToClass(schema, type);
  }

  @Override
  public boolean isData(Object value) {
    return value instanceof Data;
  }

  @Override
  public boolean isBigEndian() {
    return bigEndian;
  }

  /**
   * Returns the serializer {@link #toData(Object)} would use for {@code value}.
   *
   * @throws org.gridwire.exception.UnserializableValueException if value is {@link Absent}
   */
  public Serializer<?> findSerializerFor(Object value) {
    return resolver.resolve(value);
  }

  public SerializerRegistry getRegistry() {
    return registry;
  }

  public SerializationConfig getConfig() {
    return config;
  }
}
