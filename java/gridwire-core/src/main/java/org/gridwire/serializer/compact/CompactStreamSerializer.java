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

import static org.gridwire.serializer.SerializationConstants.TYPE_COMPACT;

import com.google.common.base.Preconditions;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.gridwire.exception.SerializationException;
import org.gridwire.memory.MemoryBuffer;
import org.gridwire.serializer.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializer for compact values: instances of classes with a registered {@link
 * CompactSerializer}, and {@link GenericRecord}s.
 *
 * <p>The payload is the int64 schema id followed by the field values in schema order. Nested
 * compact fields are a boolean presence flag followed by the nested payload. The schema itself
 * travels through the {@link SchemaService}; reading a payload whose schema is not known there
 * fails.
 */
@SuppressWarnings({"rawtypes", "unchecked"})
public final class CompactStreamSerializer extends Serializer<Object> {
  private static final Logger LOG = LoggerFactory.getLogger(CompactStreamSerializer.class);

  private final SchemaService schemaService;
  private final ConcurrentMap<Class<?>, CompactSerializer<?>> classToSerializer =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<String, CompactSerializer<?>> typeNameToSerializer =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<Class<?>, Schema> classToSchema = new ConcurrentHashMap<>();
  private final Set<String> genericTypeNames = ConcurrentHashMap.newKeySet();

  public CompactStreamSerializer(SchemaService schemaService) {
    super(TYPE_COMPACT);
    this.schemaService = Preconditions.checkNotNull(schemaService, "schemaService");
  }

  public void registerSerializer(CompactSerializer<?> serializer) {
    Preconditions.checkNotNull(serializer, "serializer");
    Class<?> cls = Preconditions.checkNotNull(serializer.getCompactClass(), "compact class");
    String typeName = Preconditions.checkNotNull(serializer.getTypeName(), "type name");
    CompactSerializer<?> previous = classToSerializer.putIfAbsent(cls, serializer);
    Preconditions.checkArgument(
        previous == null || previous == serializer,
        "Class %s is already registered with compact serializer %s",
        cls,
        previous);
    previous = typeNameToSerializer.putIfAbsent(typeName, serializer);
    Preconditions.checkArgument(
        previous == null || previous == serializer,
        "Type name %s is already registered with compact serializer %s",
        typeName,
        previous);
    LOG.debug("Registered compact serializer for {} as type name {}", cls.getName(), typeName);
  }

  public boolean isRegisteredAsCompact(Class<?> cls) {
    return classToSerializer.containsKey(cls);
  }

  /** Whether {@code value} is written by this serializer. */
  public boolean isCompactValue(Object value) {
    return value instanceof CompactGenericRecord || isRegisteredAsCompact(value.getClass());
  }

  /**
   * Binds {@code schema} to {@code cls}, so writes of {@code cls} are encoded against it instead of
   * a schema derived from the first written instance.
   */
  public void registerSchemaToClass(Schema schema, Class<?> cls) {
    Preconditions.checkNotNull(schema, "schema");
    Preconditions.checkNotNull(cls, "class");
    schemaService.put(schema);
    classToSchema.put(cls, schema);
  }

  @Override
  public void write(MemoryBuffer buffer, Object value) {
    if (value instanceof CompactGenericRecord) {
      CompactGenericRecord record = (CompactGenericRecord) value;
      Schema schema = record.getSchema();
      schemaService.put(schema);
      buffer.writeInt64(schema.getSchemaId());
      writeFields(buffer, schema, record.getValues());
      return;
    }
    CompactSerializer serializer = classToSerializer.get(value.getClass());
    if (serializer == null) {
      throw new SerializationException(
          "No compact serializer is registered for " + value.getClass().getName());
    }
    DefaultCompactWriter writer = new DefaultCompactWriter();
    serializer.write(writer, value);
    FieldValues fields = writer.fields();
    Schema schema = classToSchema.get(value.getClass());
    if (schema == null) {
      schema = new Schema(serializer.getTypeName(), fields.descriptors());
      schemaService.put(schema);
      Schema existing = classToSchema.putIfAbsent(value.getClass(), schema);
      if (existing != null) {
        schema = existing;
      }
    }
    checkWrittenFields(schema, fields);
    buffer.writeInt64(schema.getSchemaId());
    writeFields(buffer, schema, fields.values());
  }

  private static void checkWrittenFields(Schema schema, FieldValues fields) {
    for (FieldDescriptor written : fields.descriptors()) {
      FieldDescriptor field = schema.getField(written.getFieldName());
      if (field == null) {
        throw new SerializationException(
            String.format(
                "Field '%s' is not in the schema of %s",
                written.getFieldName(), schema.getTypeName()));
      }
      if (field.getKind() != written.getKind()) {
        throw new SerializationException(
            String.format(
                "Field '%s' of %s is written as %s but the schema declares %s",
                field.getFieldName(), schema.getTypeName(), written.getKind(), field.getKind()));
      }
    }
  }

  private void writeFields(MemoryBuffer buffer, Schema schema, Map<String, Object> values) {
    for (FieldDescriptor field : schema.getFields()) {
      String name = field.getFieldName();
      if (!values.containsKey(name)) {
        throw new SerializationException(
            "Field '" + name + "' of " + schema.getTypeName() + " is not written");
      }
      Object value = values.get(name);
      switch (field.getKind()) {
        case BOOLEAN:
          buffer.writeBoolean((Boolean) value);
          break;
        case INT8:
          buffer.writeByte(((Number) value).byteValue());
          break;
        case INT16:
          buffer.writeInt16(((Number) value).shortValue());
          break;
        case INT32:
          buffer.writeInt32(((Number) value).intValue());
          break;
        case INT64:
          buffer.writeInt64(((Number) value).longValue());
          break;
        case FLOAT32:
          buffer.writeFloat32(((Number) value).floatValue());
          break;
        case FLOAT64:
          buffer.writeFloat64(((Number) value).doubleValue());
          break;
        case STRING:
          buffer.writeString((String) value);
          break;
        case COMPACT:
          writeNested(buffer, name, value);
          break;
        default:
          throw new SerializationException("Unsupported field kind " + field.getKind());
      }
    }
  }

  private void writeNested(MemoryBuffer buffer, String fieldName, Object value) {
    if (value == null) {
      buffer.writeBoolean(false);
      return;
    }
    if (!isCompactValue(value)) {
      throw new SerializationException(
          "Field '" + fieldName + "' holds " + value.getClass().getName()
              + ", which is not a compact value");
    }
    buffer.writeBoolean(true);
    write(buffer, value);
  }

  @Override
  public Object read(MemoryBuffer buffer) {
    long schemaId = buffer.readInt64();
    Schema schema = schemaService.get(schemaId);
    if (schema == null) {
      throw new SerializationException("The schema can not be found with id " + schemaId);
    }
    Map<String, Object> values = readFields(buffer, schema);
    CompactSerializer serializer = typeNameToSerializer.get(schema.getTypeName());
    if (serializer == null) {
      if (genericTypeNames.add(schema.getTypeName())) {
        LOG.warn(
            "No compact serializer is registered for type name {}, reading it as a GenericRecord",
            schema.getTypeName());
      }
      return new CompactGenericRecord(schema, values);
    }
    return serializer.read(new DefaultCompactReader(schema, values));
  }

  private Map<String, Object> readFields(MemoryBuffer buffer, Schema schema) {
    Map<String, Object> values = new HashMap<>();
    for (FieldDescriptor field : schema.getFields()) {
      Object value;
      switch (field.getKind()) {
        case BOOLEAN:
          value = buffer.readBoolean();
          break;
        case INT8:
          value = buffer.readByte();
          break;
        case INT16:
          value = buffer.readInt16();
          break;
        case INT32:
          value = buffer.readInt32();
          break;
        case INT64:
          value = buffer.readInt64();
          break;
        case FLOAT32:
          value = buffer.readFloat32();
          break;
        case FLOAT64:
          value = buffer.readFloat64();
          break;
        case STRING:
          value = buffer.readString();
          break;
        case COMPACT:
          value = buffer.readBoolean() ? read(buffer) : null;
          break;
        default:
          throw new SerializationException("Unsupported field kind " + field.getKind());
      }
      values.put(field.getFieldName(), value);
    }
    return values;
  }
}
