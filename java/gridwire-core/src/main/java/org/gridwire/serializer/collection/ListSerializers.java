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

package org.gridwire.serializer.collection;

import static org.gridwire.serializer.SerializationConstants.JAVA_DEFAULT_TYPE_ARRAY;
import static org.gridwire.serializer.SerializationConstants.JAVA_DEFAULT_TYPE_ARRAY_LIST;
import static org.gridwire.serializer.SerializationConstants.JAVA_DEFAULT_TYPE_LINKED_LIST;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import org.gridwire.exception.SerializationException;
import org.gridwire.memory.MemoryBuffer;
import org.gridwire.serialization.SerializationService;
import org.gridwire.serializer.Serializer;

/**
 * Serializers for lists and {@code Object[]}: an int32 size followed by each element written
 * with {@link SerializationService#writeObject}, so elements keep their own type ids.
 */
public class ListSerializers {

  abstract static class NestingSerializer<T> extends Serializer<T> {
    protected final SerializationService service;

    NestingSerializer(SerializationService service, int typeId) {
      super(typeId);
      this.service = service;
    }

    void writeElements(MemoryBuffer buffer, Iterable<?> elements, int size) {
      buffer.writeInt32(size);
      for (Object element : elements) {
        service.writeObject(buffer, element);
      }
    }

    int readSize(MemoryBuffer buffer) {
      int size = buffer.readInt32();
      if (size < 0) {
        throw new SerializationException("Invalid collection size " + size);
      }
      // every element carries at least its type id
      buffer.checkReadableBytes((int) Math.min(Integer.MAX_VALUE, 4L * size));
      return size;
    }
  }

  public static final class ArrayListSerializer extends NestingSerializer<List<?>> {

    public ArrayListSerializer(SerializationService service) {
      super(service, JAVA_DEFAULT_TYPE_ARRAY_LIST);
    }

    @Override
    public void write(MemoryBuffer buffer, List<?> value) {
      writeElements(buffer, value, value.size());
    }

    @Override
    public ArrayList<Object> read(MemoryBuffer buffer) {
      int size = readSize(buffer);
      ArrayList<Object> list = new ArrayList<>(size);
      for (int i = 0; i < size; i++) {
        list.add(service.readObject(buffer));
      }
      return list;
    }
  }

  public static final class LinkedListSerializer extends NestingSerializer<List<?>> {

    public LinkedListSerializer(SerializationService service) {
      super(service, JAVA_DEFAULT_TYPE_LINKED_LIST);
    }

    @Override
    public void write(MemoryBuffer buffer, List<?> value) {
      writeElements(buffer, value, value.size());
    }

    @Override
    public LinkedList<Object> read(MemoryBuffer buffer) {
      int size = readSize(buffer);
      LinkedList<Object> list = new LinkedList<>();
      for (int i = 0; i < size; i++) {
        list.add(service.readObject(buffer));
      }
      return list;
    }
  }

  /** Reads {@code Object[]} sent by members that write arrays of arbitrary elements. */
  public static final class JavaArraySerializer extends NestingSerializer<Object[]> {

    public JavaArraySerializer(SerializationService service) {
      super(service, JAVA_DEFAULT_TYPE_ARRAY);
    }

    @Override
    public void write(MemoryBuffer buffer, Object[] value) {
      buffer.writeInt32(value.length);
      for (Object element : value) {
        service.writeObject(buffer, element);
      }
    }

    @Override
    public Object[] read(MemoryBuffer buffer) {
      int size = readSize(buffer);
      Object[] array = new Object[size];
      for (int i = 0; i < size; i++) {
        array[i] = service.readObject(buffer);
      }
      return array;
    }
  }
}
