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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import org.gridwire.GridwireTestBase;
import org.gridwire.config.NumberType;
import org.gridwire.exception.DuplicateSerializerIdException;
import org.gridwire.exception.DuplicateSerializerNameException;
import org.gridwire.serializer.ArraySerializers;
import org.gridwire.serializer.PrimitiveSerializers;
import org.gridwire.serializer.Serializer;
import org.testng.annotations.Test;

public class SerializerRegistryTest extends GridwireTestBase {

  @Test
  public void testDuplicateName() {
    SerializerRegistry.Builder builder = SerializerRegistry.builder(NumberType.DOUBLE);
    builder.register("string", new PrimitiveSerializers.StringSerializer());
    DuplicateSerializerNameException e =
        expectThrows(
            DuplicateSerializerNameException.class,
            () -> builder.register("string", new PrimitiveSerializers.LongSerializer()));
    assertEquals(e.getName(), "string");
  }

  @Test
  public void testDuplicateId() {
    SerializerRegistry.Builder builder = SerializerRegistry.builder(NumberType.DOUBLE);
    builder.register("string", new PrimitiveSerializers.StringSerializer());
    DuplicateSerializerIdException e =
        expectThrows(
            DuplicateSerializerIdException.class,
            () -> builder.register("text", new PrimitiveSerializers.StringSerializer()));
    assertEquals(e.getTypeId(), -11);
    assertFalse(builder.contains("text"));
  }

  @Test
  public void testLookups() {
    Serializer<?> integer = new PrimitiveSerializers.IntegerSerializer();
    Serializer<?> integerArray = new ArraySerializers.IntegerArraySerializer();
    SerializerRegistry registry =
        SerializerRegistry.builder(NumberType.INTEGER)
            .register("integer", integer)
            .register("integerArray", integerArray)
            .build();
    assertSame(registry.findSerializerById(-7), integer);
    assertNull(registry.findSerializerById(-8));
    assertSame(registry.findSerializerByName("integer", false), integer);
    assertSame(registry.findSerializerByName("integer", true), integerArray);
    assertSame(registry.findSerializer(TypeKind.INTEGER, true), integerArray);
    assertNull(registry.findSerializerByName("long", false));
    assertEquals(registry.size(), 2);
  }

  @Test
  public void testNumberAndBufferNormalization() {
    Serializer<?> dbl = new PrimitiveSerializers.DoubleSerializer();
    Serializer<?> byteArray = new ArraySerializers.ByteArraySerializer();
    SerializerRegistry registry =
        SerializerRegistry.builder(NumberType.DOUBLE)
            .register("double", dbl)
            .register("byteArray", byteArray)
            .build();
    assertSame(registry.findSerializerByName("number", false), dbl);
    assertSame(registry.findSerializer(TypeKind.NUMBER, false), dbl);
    assertNull(registry.findSerializerByName("number", true));
    assertSame(registry.findSerializerByName("buffer", false), byteArray);
    // an array of buffers is not a byte array
    assertNull(registry.findSerializerByName("buffer", true));
  }

  @Test
  public void testFrozen() {
    SerializerRegistry registry =
        SerializerRegistry.builder(NumberType.DOUBLE)
            .register("null", new PrimitiveSerializers.NullSerializer())
            .build();
    assertThrows(UnsupportedOperationException.class, () -> registry.getNames().add("x"));
    assertTrue(registry.contains("null"));
    assertEquals(SerializerRegistry.customName(5), "!custom5");
  }
}
