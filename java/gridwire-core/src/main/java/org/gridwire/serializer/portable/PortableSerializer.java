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

import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_PORTABLE;

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.gridwire.exception.SerializationException;
import org.gridwire.memory.MemoryBuffer;
import org.gridwire.serializer.ArraySerializers.DoubleArraySerializer;
import org.gridwire.serializer.ArraySerializers.IntegerArraySerializer;
import org.gridwire.serializer.ArraySerializers.LongArraySerializer;
import org.gridwire.serializer.ArraySerializers.StringArraySerializer;
import org.gridwire.serializer.Serializer;

/**
 * Serializer for {@link Portable} values.
 *
 * <p>The payload is the int32 factory id, class id and version, the int32 field count, then each
 * field as its name, its {@link FieldType} id byte and its value. Nested portables are a boolean
 * null flag followed by a nested payload.
 */
public final class PortableSerializer extends Serializer<Portable> {
  private static final IntegerArraySerializer INT_ARRAY = new IntegerArraySerializer();
  private static final LongArraySerializer LONG_ARRAY = new LongArraySerializer();
  private static final DoubleArraySerializer DOUBLE_ARRAY = new DoubleArraySerializer();
  private static final StringArraySerializer UTF_ARRAY = new StringArraySerializer();

  private final Int2ObjectMap<PortableFactory> factories;
  private final int portableVersion;

  public PortableSerializer(Map<Integer, PortableFactory> factories, int portableVersion) {
    super(CONSTANT_TYPE_PORTABLE);
    Preconditions.checkArgument(
        portableVersion >= 0, "Invalid portable version %s", portableVersion);
    this.factories = Int2ObjectMaps.unmodifiable(new Int2ObjectOpenHashMap<>(factories));
    this.portableVersion = portableVersion;
  }

  @Override
  public void write(MemoryBuffer buffer, Portable value) {
    int version =
        value instanceof VersionedPortable
            ? ((VersionedPortable) value).getClassVersion()
            : portableVersion;
    buffer.writeInt32(value.getFactoryId());
    buffer.writeInt32(value.getClassId());
    buffer.writeInt32(version);
    int fieldCountIndex = buffer.writerIndex();
    buffer.writeInt32(0);
    DefaultPortableWriter writer = new DefaultPortableWriter(buffer, version);
    value.writePortable(writer);
    buffer.putInt32(fieldCountIndex, writer.fieldCount());
  }

  @Override
  public Portable read(MemoryBuffer buffer) {
    int factoryId = buffer.readInt32();
    int classId = buffer.readInt32();
    PortableFactory factory = factories.get(factoryId);
    if (factory == null) {
      throw new SerializationException(
          "Could not find PortableFactory for factory-id: " + factoryId);
    }
    Portable portable = factory.create(classId);
    if (portable == null) {
      throw new SerializationException(
          "Could not create Portable for class-id: " + classId + " of factory-id: " + factoryId);
    }
    int version = buffer.readInt32();
    int fieldCount = buffer.readInt32();
    Map<String, FieldType> types = new LinkedHashMap<>();
    Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 0; i < fieldCount; i++) {
      String name = buffer.readString();
      int typeId = buffer.readByte();
      FieldType type = FieldType.of(typeId);
      if (type == null) {
        throw new SerializationException("Unknown portable field type " + typeId + " for " + name);
      }
      types.put(name, type);
      values.put(name, readField(buffer, type));
    }
    portable.readPortable(new DefaultPortableReader(version, types, values));
    return portable;
  }

  private Object readField(MemoryBuffer buffer, FieldType type) {
    switch (type) {
      case PORTABLE:
        boolean isNull = buffer.readBoolean();
        return isNull ? null : read(buffer);
      case BYTE:
        return buffer.readByte();
      case BOOLEAN:
        return buffer.readBoolean();
      case CHAR:
        return buffer.readChar();
      case SHORT:
        return buffer.readInt16();
      case INT:
        return buffer.readInt32();
      case LONG:
        return buffer.readInt64();
      case FLOAT:
        return buffer.readFloat32();
      case DOUBLE:
        return buffer.readFloat64();
      case UTF:
        return buffer.readString();
      case BYTE_ARRAY:
        return buffer.readBytesAndSize();
      case INT_ARRAY:
        return INT_ARRAY.read(buffer);
      case LONG_ARRAY:
        return LONG_ARRAY.read(buffer);
      case DOUBLE_ARRAY:
        return DOUBLE_ARRAY.read(buffer);
      case UTF_ARRAY:
        return UTF_ARRAY.read(buffer);
      default:
        throw new SerializationException("Unsupported portable field type " + type);
    }
  }

  private final class DefaultPortableWriter implements PortableWriter {
    private final MemoryBuffer buffer;
    private final int version;
    private final Set<String> written = new HashSet<>();

    DefaultPortableWriter(MemoryBuffer buffer, int version) {
      this.buffer = buffer;
      this.version = version;
    }

    int fieldCount() {
      return written.size();
    }

    private void writeHeader(String fieldName, FieldType type) {
      Preconditions.checkNotNull(fieldName, "fieldName");
      if (!written.add(fieldName)) {
        throw new SerializationException("Field '" + fieldName + "' is already written");
      }
      buffer.writeString(fieldName);
      buffer.writeByte(type.getId());
    }

    @Override
    public int getVersion() {
      return version;
    }

    @Override
    public void writeByte(String fieldName, byte value) {
      writeHeader(fieldName, FieldType.BYTE);
      buffer.writeByte(value);
    }

    @Override
    public void writeBoolean(String fieldName, boolean value) {
      writeHeader(fieldName, FieldType.BOOLEAN);
      buffer.writeBoolean(value);
    }

    @Override
    public void writeChar(String fieldName, char value) {
      writeHeader(fieldName, FieldType.CHAR);
      buffer.writeChar(value);
    }

    @Override
    public void writeShort(String fieldName, short value) {
      writeHeader(fieldName, FieldType.SHORT);
      buffer.writeInt16(value);
    }

    @Override
    public void writeInt(String fieldName, int value) {
      writeHeader(fieldName, FieldType.INT);
      buffer.writeInt32(value);
    }

    @Override
    public void writeLong(String fieldName, long value) {
      writeHeader(fieldName, FieldType.LONG);
      buffer.writeInt64(value);
    }

    @Override
    public void writeFloat(String fieldName, float value) {
      writeHeader(fieldName, FieldType.FLOAT);
      buffer.writeFloat32(value);
    }

    @Override
    public void writeDouble(String fieldName, double value) {
      writeHeader(fieldName, FieldType.DOUBLE);
      buffer.writeFloat64(value);
    }

    @Override
    public void writeUTF(String fieldName, String value) {
      writeHeader(fieldName, FieldType.UTF);
      buffer.writeString(value);
    }

    @Override
    public void writeByteArray(String fieldName, byte[] value) {
      writeHeader(fieldName, FieldType.BYTE_ARRAY);
      buffer.writeBytesAndSize(value);
    }

    @Override
    public void writeIntArray(String fieldName, int[] value) {
      writeHeader(fieldName, FieldType.INT_ARRAY);
      writeArray(INT_ARRAY, value);
    }

    @Override
    public void writeLongArray(String fieldName, long[] value) {
      writeHeader(fieldName, FieldType.LONG_ARRAY);
      writeArray(LONG_ARRAY, value);
    }

    @Override
    public void writeDoubleArray(String fieldName, double[] value) {
      writeHeader(fieldName, FieldType.DOUBLE_ARRAY);
      writeArray(DOUBLE_ARRAY, value);
    }

    @Override
    public void writeUTFArray(String fieldName, String[] value) {
      writeHeader(fieldName, FieldType.UTF_ARRAY);
      if (value == null) {
        buffer.writeInt32(MemoryBuffer.NULL_ARRAY_LENGTH);
      } else {
        UTF_ARRAY.write(buffer, value);
      }
    }

    private void writeArray(Serializer<Object> serializer, Object value) {
      if (value == null) {
        buffer.writeInt32(MemoryBuffer.NULL_ARRAY_LENGTH);
      } else {
        serializer.write(buffer, value);
      }
    }

    @Override
    public void writePortable(String fieldName, Portable value) {
      writeHeader(fieldName, FieldType.PORTABLE);
      buffer.writeBoolean(value == null);
      if (value != null) {
        PortableSerializer.this.write(buffer, value);
      }
    }
  }

  private static final class DefaultPortableReader implements PortableReader {
    private final int version;
    private final Map<String, FieldType> types;
    private final Map<String, Object> values;

    DefaultPortableReader(int version, Map<String, FieldType> types, Map<String, Object> values) {
      this.version = version;
      this.types = types;
      this.values = values;
    }

    private Object get(String fieldName, FieldType expected) {
      FieldType type = types.get(fieldName);
      if (type == null) {
        throw new SerializationException("Unknown field name: '" + fieldName + "'");
      }
      if (type != expected) {
        throw new SerializationException(
            String.format(
                "Wrong field type for '%s': expected %s, found %s", fieldName, expected, type));
      }
      return values.get(fieldName);
    }

    @Override
    public int getVersion() {
      return version;
    }

    @Override
    public boolean hasField(String fieldName) {
      return types.containsKey(fieldName);
    }

    @Override
    public Set<String> getFieldNames() {
      return Collections.unmodifiableSet(types.keySet());
    }

    @Override
    public FieldType getFieldType(String fieldName) {
      return types.get(fieldName);
    }

    @Override
    public byte readByte(String fieldName) {
      return (Byte) get(fieldName, FieldType.BYTE);
    }

    @Override
    public boolean readBoolean(String fieldName) {
      return (Boolean) get(fieldName, FieldType.BOOLEAN);
    }

    @Override
    public char readChar(String fieldName) {
      return (Character) get(fieldName, FieldType.CHAR);
    }

    @Override
    public short readShort(String fieldName) {
      return (Short) get(fieldName, FieldType.SHORT);
    }

    @Override
    public int readInt(String fieldName) {
      return (Integer) get(fieldName, FieldType.INT);
    }

    @Override
    public long readLong(String fieldName) {
      return (Long) get(fieldName, FieldType.LONG);
    }

    @Override
    public float readFloat(String fieldName) {
      return (Float) get(fieldName, FieldType.FLOAT);
    }

    @Override
    public double readDouble(String fieldName) {
      return (Double) get(fieldName, FieldType.DOUBLE);
    }

    @Override
    public String readUTF(String fieldName) {
      return (String) get(fieldName, FieldType.UTF);
    }

    @Override
    public byte[] readByteArray(String fieldName) {
      return (byte[]) get(fieldName, FieldType.BYTE_ARRAY);
    }

    @Override
    public int[] readIntArray(String fieldName) {
      return (int[]) get(fieldName, FieldType.INT_ARRAY);
    }

    @Override
    public long[] readLongArray(String fieldName) {
      return (long[]) get(fieldName, FieldType.LONG_ARRAY);
    }

    @Override
    public double[] readDoubleArray(String fieldName) {
      return (double[]) get(fieldName, FieldType.DOUBLE_ARRAY);
    }

    @Override
    public String[] readUTFArray(String fieldName) {
      return (String[]) get(fieldName, FieldType.UTF_ARRAY);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <P extends Portable> P readPortable(String fieldName) {
      return (P) get(fieldName, FieldType.PORTABLE);
    }
  }
}
