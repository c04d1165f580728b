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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import org.gridwire.GridwireTestBase;
import org.gridwire.config.NumberType;
import org.gridwire.config.SerializationConfig;
import org.gridwire.core.RestValue;
import org.gridwire.exception.DeserializerNotFoundException;
import org.gridwire.exception.PartitionKeyRecursionException;
import org.gridwire.exception.UnserializableValueException;
import org.gridwire.memory.MemoryBuffer;
import org.gridwire.serializer.PrimitiveSerializers;
import org.gridwire.serializer.SerializationConstants;
import org.gridwire.serializer.Serializer;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class DefaultSerializationServiceTest extends GridwireTestBase {

  @lombok.Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Order implements PartitionAware<String> {
    private String partitionKey;
    private int quantity;
  }

  /** Partition key that names itself, which can never terminate. */
  public static class SelfKeyed implements PartitionAware<Object> {
    @Override
    public Object getPartitionKey() {
      return this;
    }
  }

  @lombok.Data
  @AllArgsConstructor
  public static class Routed implements PartitionHashAware {
    private String name;

    @Override
    public int getPartitionHash() {
      return 4242;
    }
  }

  @lombok.Data
  @AllArgsConstructor
  public static class Point implements CustomSerializable {
    private int x;
    private int y;

    @Override
    public int getCustomSerializerId() {
      return 10;
    }
  }

  public static class PointSerializer extends Serializer<Point> {
    public PointSerializer() {
      super(10);
    }

    @Override
    public void write(MemoryBuffer buffer, Point value) {
      buffer.writeInt32(value.getX());
      buffer.writeInt32(value.getY());
    }

    @Override
    public Point read(MemoryBuffer buffer) {
      return new Point(buffer.readInt32(), buffer.readInt32());
    }
  }

  /** Writes any value as its {@code toString()}. */
  public static class ToStringSerializer extends Serializer<Object> {
    public ToStringSerializer() {
      super(20);
    }

    @Override
    public void write(MemoryBuffer buffer, Object value) {
      buffer.writeString(String.valueOf(value));
    }

    @Override
    public Object read(MemoryBuffer buffer) {
      return buffer.readString();
    }
  }

  @DataProvider
  public static Object[][] values() {
    return new Object[][] {
      {14},
      {545.3},
      {Long.MIN_VALUE},
      {(byte) -7},
      {(short) 300},
      {1.25f},
      {'c'},
      {true},
      {new boolean[] {true, false, false, true}},
      {new Boolean[] {true, false}},
      {new String[] {"client", "test"}},
      {new String[] {""}},
      {""},
      {"client"},
      {"1⚐中💦2😭‍🙆😔5"},
      {"Iñtërnâtiônàlizætiøn"},
      {"@Aǟڠዠ𝌆"},
      {new Integer[] {12, 56, 54, 12}},
      {new Double[] {43546.6, 2343.4, 8988.0, 4.0}},
      {new Double[] {23545798.6}},
      {new byte[] {1, 2, 3}},
      {new char[] {'a', '中'}},
      {new short[] {1, -1}},
      {new int[] {Integer.MAX_VALUE, 0}},
      {new long[] {Long.MAX_VALUE, -1}},
      {new float[] {0.5f}},
      {new double[] {}},
      {null},
      {ImmutableMap.of("abc", "abc", "five", 5L)},
      {new BigInteger("-123456789012345678901234567890")},
      {new BigDecimal("12345.67890")},
      {new UUID(1, 2)},
      {new Date(1_600_000_000_123L)},
      {LocalDate.of(2022, 2, 28)},
      {LocalTime.of(23, 59, 58, 123_456_789)},
      {LocalDateTime.of(1999, 12, 31, 23, 59, 59, 1)},
      {OffsetDateTime.of(2021, 6, 1, 10, 30, 0, 0, ZoneOffset.ofHoursMinutes(5, 30))},
      {String.class},
      {int.class},
      {new ArrayList<>(Arrays.asList(1, "two", null, 3.0))},
      {new LinkedList<>(Arrays.asList("a", "b"))},
      {new RestValue(
          "{\"test\":\"data\"}".getBytes(StandardCharsets.UTF_8),
          "text/plain".getBytes(StandardCharsets.UTF_8))}
    };
  }

  @Test(dataProvider = "values")
  public void testRoundTrip(Object value) {
    serDeCheck(newService(), value);
  }

  @Test(dataProvider = "values")
  public void testRoundTripLittleEndian(Object value) {
    serDeCheck(newService(SerializationConfig.builder().withBigEndian(false)), value);
  }

  @Test
  public void testByteBufferIsWrittenAsByteArray() {
    DefaultSerializationService service = newService();
    Data data = service.toData(ByteBuffer.wrap("abc".getBytes(StandardCharsets.UTF_8)));
    assertEquals(data.getType(), SerializationConstants.CONSTANT_TYPE_BYTE_ARRAY);
    byte[] bytes = service.toObject(data);
    assertEquals(new String(bytes, StandardCharsets.UTF_8), "abc");
  }

  @Test
  public void testArrayOfPlainObjectsFallsBackToJson() {
    DefaultSerializationService service = newService();
    Object[] value = {ImmutableMap.of("foo", "bar"), ImmutableMap.of("bar", "baz")};
    Data data = service.toData(value);
    assertEquals(data.getType(), SerializationConstants.JSON_SERIALIZATION_TYPE);
    List<?> result = service.toObject(data);
    assertEquals(result, Arrays.asList(value));
  }

  @Test
  public void testNestedPlainStructure() {
    DefaultSerializationService service = newService();
    Map<String, Object> value =
        ImmutableMap.of(
            "name", "order", "lines", ImmutableList.of(ImmutableMap.of("sku", "a", "n", 2L)));
    // a list inside a map is JSON, not a list serializer
    assertEquals(
        service.toData(value).getType(), SerializationConstants.JSON_SERIALIZATION_TYPE);
    Map<String, Object> result = serDe(service, value);
    assertEquals(result, value);
  }

  @Test
  public void testIdempotence() {
    DefaultSerializationService service = newService();
    Data data = service.toData("value");
    assertSame(service.toData(data), data);
    assertEquals(service.toData(service.toData("value")), data);
  }

  @Test(dataProvider = "values")
  public void testDeterminism(Object value) {
    DefaultSerializationService service = newService();
    byte[] first = service.toData(value).toByteArray();
    assertEquals(service.toData(value).toByteArray(), first);
    assertEquals(newService().toData(value).toByteArray(), first);
  }

  @Test
  public void testIntegerRoundTrip() {
    DefaultSerializationService service = newService();
    Data data = service.toData(14);
    assertEquals(data.getType(), SerializationConstants.CONSTANT_TYPE_INTEGER);
    Integer result = service.toObject(data);
    assertEquals(result.intValue(), 14);
  }

  @Test(dataProvider = "numberTypes")
  public void testEmptyArray(NumberType numberType) {
    DefaultSerializationService service =
        newService(SerializationConfig.builder().withDefaultNumberType(numberType));
    Object result = serDe(service, new Object[0]);
    assertTrue(result.getClass().isArray());
    assertEquals(java.lang.reflect.Array.getLength(result), 0);
  }

  @Test
  public void testEmptyArrayWithByteNumberType() {
    DefaultSerializationService service =
        newService(SerializationConfig.builder().withDefaultNumberType(NumberType.BYTE));
    Data data = service.toData(new Object[0]);
    assertEquals(data.getType(), SerializationConstants.CONSTANT_TYPE_BYTE_ARRAY);
    assertEquals((byte[]) service.toObject(data), new byte[0]);
  }

  @Test
  public void testBoxedArrayNullElementsAreWrittenAsZero() {
    DefaultSerializationService service = newService();
    assertDeepEquals(serDe(service, new Integer[] {1, null, 3}), new int[] {1, 0, 3});
    assertDeepEquals(serDe(service, new Long[] {9L, null}), new long[] {9L, 0L});
    assertDeepEquals(serDe(service, new Double[] {1.5, null}), new double[] {1.5, 0});
    assertDeepEquals(serDe(service, new Byte[] {1, null}), new byte[] {1, 0});
    assertDeepEquals(serDe(service, new Boolean[] {true, null}), new boolean[] {true, false});
    assertDeepEquals(serDe(service, new Character[] {'a', null}), new char[] {'a', 0});
    // a leading null gives no element kind, so the array goes to JSON
    Data leadingNull = service.toData(new Integer[] {null, 1});
    assertEquals(leadingNull.getType(), SerializationConstants.JSON_SERIALIZATION_TYPE);
    List<?> result = service.toObject(leadingNull);
    assertEquals(result, Arrays.asList(null, 1L));
  }

  @Test
  public void testDefaultNumberTypeChangesEncoding() {
    DefaultSerializationService integers =
        newService(SerializationConfig.builder().withDefaultNumberType(NumberType.INTEGER));
    DefaultSerializationService longs =
        newService(SerializationConfig.builder().withDefaultNumberType(NumberType.LONG));

    Data asInteger = integers.toData(new AtomicLong(7));
    Data asLong = longs.toData(new AtomicLong(7));
    assertEquals(asInteger.getType(), SerializationConstants.CONSTANT_TYPE_INTEGER);
    assertEquals(asLong.getType(), SerializationConstants.CONSTANT_TYPE_LONG);
    assertEquals((Object) integers.toObject(asInteger), 7);
    assertEquals((Object) longs.toObject(asLong), 7L);

    assertEquals(
        integers.toData(new Object[0]).getType(),
        SerializationConstants.CONSTANT_TYPE_INTEGER_ARRAY);
    assertEquals(
        longs.toData(new Object[0]).getType(), SerializationConstants.CONSTANT_TYPE_LONG_ARRAY);
    assertEquals(
        longs.toData(new Object[] {new AtomicInteger(3)}).getType(),
        SerializationConstants.CONSTANT_TYPE_LONG_ARRAY);

    // fixed-width boxes keep their own type
    assertEquals(longs.toData(3).getType(), SerializationConstants.CONSTANT_TYPE_INTEGER);
  }

  @Test
  public void testDefaultNumberTypeIsDouble() {
    DefaultSerializationService service = newService();
    Data data = service.toData(new AtomicInteger(3));
    assertEquals(data.getType(), SerializationConstants.CONSTANT_TYPE_DOUBLE);
    assertEquals((Object) service.toObject(data), 3.0d);
  }

  @Test
  public void testPartitionKeyHash() {
    DefaultSerializationService service = newService();
    Order order = new Order("key", 3);
    Data data = service.toData(order);
    assertEquals(data.getPartitionHash(), service.toData("key").getPartitionHash());
    assertTrue(data.hasPartitionHash());
  }

  @Test
  public void testStrategyReceivesSerializedPartitionKey() {
    DefaultSerializationService service = newService();
    AtomicReference<Object> seen = new AtomicReference<>();
    Data data =
        service.toData(
            new Order("key", 3),
            value -> {
              seen.set(value);
              return 99;
            });
    assertEquals(seen.get(), service.toData("key"));
    assertEquals(data.getPartitionHash(), 99);
  }

  @Test
  public void testNullPartitionKeyUsesValue() {
    DefaultSerializationService service = newService();
    AtomicReference<Object> seen = new AtomicReference<>();
    Order order = new Order(null, 1);
    Data data =
        service.toData(
            order,
            value -> {
              seen.set(value);
              return 0;
            });
    assertSame(seen.get(), order);
    assertFalse(data.hasPartitionHash());
  }

  @Test
  public void testPartitionHashAwareValue() {
    DefaultSerializationService service = newService();
    Data data = service.toData(new Routed("a"));
    assertEquals(data.getPartitionHash(), 4242);
    assertEquals(service.toData("plain").hasPartitionHash(), false);
  }

  @Test
  public void testPartitionKeyCycle() {
    assertThrows(PartitionKeyRecursionException.class, () -> newService().toData(new SelfKeyed()));
  }

  @Test
  public void testUnknownTypeId() {
    MemoryBuffer buffer = MemoryBuffer.allocate(true);
    buffer.writeInt32(0);
    buffer.writeInt32(12345);
    buffer.writeInt32(1);
    HeapData data = new HeapData(buffer.toByteArray(), true);
    DeserializerNotFoundException e =
        expectThrows(DeserializerNotFoundException.class, () -> newService().toObject(data));
    assertEquals(e.getTypeId(), 12345);
    assertTrue(e.getMessage().contains("12345"), e.getMessage());
  }

  @Test
  public void testAbsentValue() {
    DefaultSerializationService service = newService();
    assertThrows(UnserializableValueException.class, () -> service.toData(Absent.INSTANCE));
    assertThrows(
        UnserializableValueException.class,
        () -> service.writeObject(MemoryBuffer.allocate(true), Absent.INSTANCE));
  }

  @Test
  public void testToObjectPassThrough() {
    DefaultSerializationService service = newService();
    assertNull(service.toObject(null));
    Object plain = "not data";
    assertSame(service.toObject(plain), plain);
    assertNull(service.toObject(new HeapData(new byte[0], true)));
    assertTrue(service.isData(service.toData(1)));
    assertFalse(service.isData(1));
  }

  @Test(dataProvider = "byteOrders")
  public void testHeaderByteOrder(boolean bigEndian) {
    DefaultSerializationService service =
        newService(SerializationConfig.builder().withBigEndian(bigEndian));
    byte[] bytes = service.toData(14).toByteArray();
    assertEquals(bytes.length, 12);
    assertEquals(MemoryBuffer.wrap(bytes, bigEndian).getInt32(HeapData.TYPE_OFFSET), -7);
    assertEquals(MemoryBuffer.wrap(bytes, bigEndian).getInt32(HeapData.DATA_OFFSET), 14);
    assertEquals(bytes[HeapData.TYPE_OFFSET] == -1, bigEndian);
    assertEquals(service.isBigEndian(), bigEndian);
  }

  @Test
  public void testWriteAndReadObject() {
    DefaultSerializationService service = newService();
    MemoryBuffer buffer = MemoryBuffer.allocate(true);
    service.writeObject(buffer, "nested");
    service.writeObject(buffer, 7L);
    service.writeObject(buffer, null);
    assertEquals(buffer.getInt32(0), SerializationConstants.CONSTANT_TYPE_STRING);
    assertEquals((String) service.readObject(buffer), "nested");
    assertEquals((long) (Long) service.readObject(buffer), 7L);
    assertNull(service.readObject(buffer));

    MemoryBuffer unknown = MemoryBuffer.allocate(true);
    unknown.writeInt32(777);
    assertThrows(DeserializerNotFoundException.class, () -> service.readObject(unknown));
  }

  @Test
  public void testCustomSerializer() {
    DefaultSerializationService service =
        newService(SerializationConfig.builder().withCustomSerializer(new PointSerializer()));
    Data data = service.toData(new Point(1, 2));
    assertEquals(data.getType(), 10);
    assertEquals(data.dataSize(), 8);
    assertEquals(service.toObject(data), new Point(1, 2));
    assertTrue(service.getRegistry().contains("!custom10"));
  }

  @Test
  public void testCustomTaggedValueWithoutSerializerFallsBack() {
    DefaultSerializationService service = newService();
    Data data = service.toData(new Point(1, 2));
    assertEquals(data.getType(), SerializationConstants.JSON_SERIALIZATION_TYPE);
    assertEquals(service.toObject(data), ImmutableMap.of("x", 1L, "y", 2L));
  }

  @Test
  public void testGlobalSerializer() {
    DefaultSerializationService service =
        newService(SerializationConfig.builder().withGlobalSerializer(new ToStringSerializer()));
    Data data = service.toData(ImmutableMap.of("a", 1));
    assertEquals(data.getType(), 20);
    assertEquals((String) service.toObject(data), "{a=1}");
    // built-in kinds still win over the global serializer
    assertEquals(service.toData("s").getType(), SerializationConstants.CONSTANT_TYPE_STRING);
  }

  @Test
  public void testInvalidUserSerializerIds() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            SerializationConfig.builder()
                .withCustomSerializer(new PrimitiveSerializers.IntegerSerializer()));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            SerializationConfig.builder()
                .withGlobalSerializer(new PrimitiveSerializers.NullSerializer()));
  }
}
