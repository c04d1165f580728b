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
import static org.testng.Assert.assertThrows;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.gridwire.GridwireTestBase;
import org.gridwire.config.CompactSerializationConfig;
import org.gridwire.config.NumberType;
import org.gridwire.config.SerializationConfig;
import org.gridwire.exception.SerializerNotFoundException;
import org.gridwire.exception.UnserializableValueException;
import org.gridwire.resolver.Classification.Category;
import org.gridwire.serialization.Absent;
import org.gridwire.serialization.CustomSerializable;
import org.gridwire.serialization.DefaultSerializationService;
import org.gridwire.serialization.ObjectDataInput;
import org.gridwire.serialization.ObjectDataOutput;
import org.gridwire.serializer.PrimitiveSerializers;
import org.gridwire.serializer.SerializationConstants;
import org.gridwire.serializer.compact.CompactReader;
import org.gridwire.serializer.compact.CompactSerializer;
import org.gridwire.serializer.compact.CompactWriter;
import org.gridwire.serializer.compact.GenericRecordBuilder;
import org.gridwire.serializer.identified.IdentifiedDataSerializable;
import org.gridwire.serializer.portable.Portable;
import org.gridwire.serializer.portable.PortableReader;
import org.gridwire.serializer.portable.PortableWriter;
import org.testng.annotations.Test;

public class SerializerResolverTest extends GridwireTestBase {

  /** Matches every structured category at once. */
  public static class Everything
      implements IdentifiedDataSerializable, Portable, CustomSerializable {
    @Override
    public int getFactoryId() {
      return 1;
    }

    @Override
    public int getClassId() {
      return 1;
    }

    @Override
    public void writeData(ObjectDataOutput out) {}

    @Override
    public void readData(ObjectDataInput in) {}

    @Override
    public void writePortable(PortableWriter writer) {}

    @Override
    public void readPortable(PortableReader reader) {}

    @Override
    public int getCustomSerializerId() {
      return 3;
    }
  }

  public static class PortableAndCustom implements Portable, CustomSerializable {
    @Override
    public int getFactoryId() {
      return 1;
    }

    @Override
    public int getClassId() {
      return 1;
    }

    @Override
    public void writePortable(PortableWriter writer) {}

    @Override
    public void readPortable(PortableReader reader) {}

    @Override
    public int getCustomSerializerId() {
      return 3;
    }
  }

  public static class EverythingCompactSerializer implements CompactSerializer<Everything> {
    @Override
    public Class<Everything> getCompactClass() {
      return Everything.class;
    }

    @Override
    public String getTypeName() {
      return "everything";
    }

    @Override
    public Everything read(CompactReader reader) {
      return new Everything();
    }

    @Override
    public void write(CompactWriter writer, Everything value) {}
  }

  private static int typeIdOf(DefaultSerializationService service, Object value) {
    return service.findSerializerFor(value).getTypeId();
  }

  @Test
  public void testStructuredPrecedence() {
    DefaultSerializationService plain = newService();
    assertEquals(
        typeIdOf(plain, new Everything()), SerializationConstants.CONSTANT_TYPE_DATA_SERIALIZABLE);
    assertEquals(
        typeIdOf(plain, new PortableAndCustom()), SerializationConstants.CONSTANT_TYPE_PORTABLE);

    DefaultSerializationService compact =
        newService(
            SerializationConfig.builder()
                .withCompact(CompactSerializationConfig.of(new EverythingCompactSerializer())));
    assertEquals(typeIdOf(compact, new Everything()), SerializationConstants.TYPE_COMPACT);
    assertEquals(
        typeIdOf(compact, GenericRecordBuilder.compact("x").setInt32("a", 1).build()),
        SerializationConstants.TYPE_COMPACT);
  }

  @Test
  public void testClassification() {
    ValueClassifier classifier = new ValueClassifier(value -> false);
    assertEquals(classifier.classify(null).getCategory(), Category.NULL);
    assertEquals(classifier.classify("s").getKind(), TypeKind.STRING);
    assertEquals(classifier.classify(new AtomicLong()).getKind(), TypeKind.NUMBER);
    assertEquals(classifier.classify(BigInteger.ONE).getKind(), TypeKind.BIG_INTEGER);
    assertEquals(classifier.classify(ByteBuffer.allocate(1)).getKind(), TypeKind.BUFFER);
    assertEquals(classifier.classify(new UUID(0, 0)).getKind(), TypeKind.UUID);
    assertEquals(classifier.classify(new LinkedList<>()).getKind(), TypeKind.LINKED_LIST);
    assertEquals(
        classifier.classify(Collections.emptyList()).getKind(), TypeKind.ARRAY_LIST);
    assertEquals(classifier.classify(new Object()).getCategory(), Category.FALLBACK);

    Classification array = classifier.classify(new Object[] {"a", 1});
    assertEquals(array.getCategory(), Category.ARRAY);
    assertEquals(array.getKind(), TypeKind.STRING);
    assertEquals(classifier.classify(new Object[0]).getKind(), TypeKind.NUMBER);
    assertEquals(classifier.classify(new long[0]).getKind(), TypeKind.LONG);
    assertEquals(classifier.classify(new String[0]).getKind(), TypeKind.STRING);

    CustomSerializable tagged = () -> 7;
    Classification custom = classifier.classify(tagged);
    assertEquals(custom.getCategory(), Category.CUSTOM_TAGGED);
    assertEquals(custom.getCustomSerializerId(), 7);
    CustomSerializable untagged = () -> 0;
    assertEquals(classifier.classify(untagged).getCategory(), Category.FALLBACK);
  }

  @Test
  public void testFirstElementDecidesArrayType() {
    DefaultSerializationService service = newService();
    // only the first element is inspected
    assertEquals(
        typeIdOf(service, new Object[] {1, 2.5, 3}),
        SerializationConstants.CONSTANT_TYPE_INTEGER_ARRAY);
    assertEquals(
        typeIdOf(service, new Object[] {"a", "b"}),
        SerializationConstants.CONSTANT_TYPE_STRING_ARRAY);
    assertEquals(
        typeIdOf(service, new Object[] {null, "b"}),
        SerializationConstants.JSON_SERIALIZATION_TYPE);
    assertEquals(
        typeIdOf(service, new Object[] {new UUID(1, 1)}),
        SerializationConstants.JSON_SERIALIZATION_TYPE);
  }

  @Test
  public void testListsAndScalars() {
    DefaultSerializationService service = newService();
    assertEquals(
        typeIdOf(service, new ArrayList<>()), SerializationConstants.JAVA_DEFAULT_TYPE_ARRAY_LIST);
    assertEquals(
        typeIdOf(service, new LinkedList<>()),
        SerializationConstants.JAVA_DEFAULT_TYPE_LINKED_LIST);
    assertEquals(typeIdOf(service, null), SerializationConstants.CONSTANT_TYPE_NULL);
    assertEquals(typeIdOf(service, 'c'), SerializationConstants.CONSTANT_TYPE_CHAR);
    assertEquals(typeIdOf(service, Object.class), SerializationConstants.JAVA_DEFAULT_TYPE_CLASS);
  }

  @Test
  public void testAbsent() {
    assertThrows(
        UnserializableValueException.class,
        () -> newService().findSerializerFor(Absent.INSTANCE));
  }

  @Test
  public void testChainExhausted() {
    SerializerRegistry registry =
        SerializerRegistry.builder(NumberType.DOUBLE)
            .register("string", new PrimitiveSerializers.StringSerializer())
            .build();
    SerializerResolver resolver = new SerializerResolver(registry, new ValueClassifier(v -> false));
    assertEquals(resolver.resolve("s").getTypeId(), SerializationConstants.CONSTANT_TYPE_STRING);
    assertThrows(SerializerNotFoundException.class, () -> resolver.resolve(new Object()));
    // no null serializer either
    assertThrows(SerializerNotFoundException.class, () -> resolver.resolve(null));
  }
}
