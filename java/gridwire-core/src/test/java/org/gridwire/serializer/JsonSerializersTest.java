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

package org.gridwire.serializer;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.gridwire.GridwireTestBase;
import org.gridwire.config.JsonStringDeserializationPolicy;
import org.gridwire.config.SerializationConfig;
import org.gridwire.core.JsonValue;
import org.gridwire.exception.SerializationException;
import org.gridwire.memory.MemoryBuffer;
import org.gridwire.serialization.Data;
import org.gridwire.serialization.DefaultSerializationService;
import org.testng.annotations.Test;

public class JsonSerializersTest extends GridwireTestBase {

  public static class Settings {
    public String mode = "fast";
    public int retries = 3;
    public String note;
  }

  public static class Meeting {
    public String title = "sync";
    public LocalDateTime start = LocalDateTime.of(2024, 5, 6, 7, 8, 9);
    public OffsetDateTime end = OffsetDateTime.of(2024, 5, 6, 8, 0, 30, 0, ZoneOffset.UTC);
  }

  @Test
  public void testEagerPolicyParsesDocuments() {
    DefaultSerializationService service = newService();
    Data data = service.toData(new Settings());
    assertEquals(data.getType(), SerializationConstants.JSON_SERIALIZATION_TYPE);
    Map<String, Object> expected = new HashMap<>();
    expected.put("mode", "fast");
    expected.put("retries", 3L);
    expected.put("note", null);
    Map<String, Object> result = service.toObject(data);
    assertEquals(result, expected);
  }

  @Test
  public void testNoDeserializationPolicyKeepsJsonValue() {
    DefaultSerializationService service =
        newService(
            SerializationConfig.builder()
                .withJsonStringDeserializationPolicy(
                    JsonStringDeserializationPolicy.NO_DESERIALIZATION));
    Object result = service.toObject(service.toData(ImmutableMap.of("k", ImmutableList.of(1, 2))));
    assertEquals(result, new JsonValue("{\"k\":[1,2]}"));
  }

  @Test
  public void testJsonValueIsWrittenRaw() {
    DefaultSerializationService service = newService();
    JsonValue value = new JsonValue("{\"name\":\"<b>\",\"n\":1.5}");
    MemoryBuffer buffer = MemoryBuffer.allocate(false);
    new JsonSerializers.JsonSerializer().write(buffer, value);
    assertEquals(buffer.readString(), value.getValue());
    Map<String, Object> result = service.toObject(service.toData(value));
    assertEquals(result, ImmutableMap.of("name", "<b>", "n", 1.5));
  }

  @SuppressWarnings("unchecked")
  @Test
  public void testNumbersAndArrays() {
    JsonSerializers.JsonSerializer serializer = new JsonSerializers.JsonSerializer();
    MemoryBuffer buffer = MemoryBuffer.allocate(true);
    buffer.writeString("[1, 2.5, \"x\", true, null]");
    List<Object> result = (List<Object>) serializer.read(buffer);
    assertEquals(result.get(0), 1L);
    assertEquals(result.get(1), 2.5);
    assertEquals(result.get(2), "x");
    assertEquals(result.get(3), Boolean.TRUE);
    assertNull(result.get(4));
  }

  @Test
  public void testInvalidDocument() {
    JsonSerializers.JsonSerializer serializer = new JsonSerializers.JsonSerializer();
    MemoryBuffer buffer = MemoryBuffer.allocate(true);
    buffer.writeString("{\"a\":");
    assertThrows(SerializationException.class, () -> serializer.read(buffer));
  }

  @Test
  public void testHtmlIsNotEscaped() {
    MemoryBuffer buffer = MemoryBuffer.allocate(true);
    new JsonSerializers.JsonValueSerializer().write(buffer, ImmutableMap.of("tag", "<a href='x'>"));
    String json = buffer.readString();
    assertTrue(json.contains("<a href='x'>"), json);
  }

  @Test
  public void testTimeValuesAsIsoStrings() {
    DefaultSerializationService service = newService();
    Data data = service.toData(new Object[] {LocalDate.of(2020, 1, 2), LocalTime.of(10, 15, 30)});
    assertEquals(data.getType(), SerializationConstants.JSON_SERIALIZATION_TYPE);
    List<?> dates = service.toObject(data);
    assertEquals(dates, Arrays.asList("2020-01-02", "10:15:30"));
    Map<String, Object> meeting = service.toObject(service.toData(new Meeting()));
    assertEquals(
        meeting,
        ImmutableMap.of(
            "title", "sync", "start", "2024-05-06T07:08:09", "end", "2024-05-06T08:00:30Z"));
  }

  @Test
  public void testUnwritableValue() {
    // java.time.Duration has no adapter and its fields are not accessible
    DefaultSerializationService service = newService();
    assertThrows(SerializationException.class, () -> service.toData(Duration.ofSeconds(5)));
  }
}
