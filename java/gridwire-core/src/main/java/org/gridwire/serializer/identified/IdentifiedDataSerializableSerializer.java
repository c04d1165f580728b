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

package org.gridwire.serializer.identified;

import static org.gridwire.serializer.SerializationConstants.CONSTANT_TYPE_DATA_SERIALIZABLE;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.Map;
import org.gridwire.exception.SerializationException;
import org.gridwire.memory.MemoryBuffer;
import org.gridwire.serialization.ObjectDataInput;
import org.gridwire.serialization.ObjectDataOutput;
import org.gridwire.serialization.SerializationService;
import org.gridwire.serializer.Serializer;

/**
 * Serializer for {@link IdentifiedDataSerializable} values.
 *
 * <p>The payload is a boolean marker ({@code true}, identified), the int32 factory id, the int32
 * class id, then whatever {@link IdentifiedDataSerializable#writeData} writes.
 */
public final class IdentifiedDataSerializableSerializer
    extends Serializer<IdentifiedDataSerializable> {
  private final SerializationService service;
  private final Int2ObjectMap<DataSerializableFactory> factories;

  public IdentifiedDataSerializableSerializer(
      SerializationService service, Map<Integer, DataSerializableFactory> factories) {
    super(CONSTANT_TYPE_DATA_SERIALIZABLE);
    this.service = service;
    this.factories = Int2ObjectMaps.unmodifiable(new Int2ObjectOpenHashMap<>(factories));
  }

  @Override
  public void write(MemoryBuffer buffer, IdentifiedDataSerializable value) {
    buffer.writeBoolean(true);
    buffer.writeInt32(value.getFactoryId());
    buffer.writeInt32(value.getClassId());
    value.writeData(new ObjectDataOutput(buffer, service));
  }

  @Override
  public IdentifiedDataSerializable read(MemoryBuffer buffer) {
    boolean identified = buffer.readBoolean();
    if (!identified) {
      throw new SerializationException(
          "Native clients only support IdentifiedDataSerializable!");
    }
    int factoryId = buffer.readInt32();
    int classId = buffer.readInt32();
    DataSerializableFactory factory = factories.get(factoryId);
    if (factory == null) {
      throw new SerializationException(
          "There is no suitable DataSerializableFactory for factory id " + factoryId);
    }
    IdentifiedDataSerializable value = factory.create(classId);
    if (value == null) {
      throw new SerializationException(
          String.format(
              "Factory %d can not create an instance of class id %d", factoryId, classId));
    }
    value.readData(new ObjectDataInput(buffer, service));
    return value;
  }

  public boolean hasFactory(int factoryId) {
    return factories.containsKey(factoryId);
  }
}
