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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.gridwire.GridwireTestBase;
import org.gridwire.cluster.Address;
import org.gridwire.cluster.ClusterDataFactory;
import org.gridwire.config.SerializationConfig;
import org.gridwire.core.RestValue;
import org.gridwire.exception.SerializationException;
import org.gridwire.memory.MemoryBuffer;
import org.gridwire.serialization.DefaultSerializationService;
import org.gridwire.serialization.HeapData;
import org.gridwire.serialization.ObjectDataInput;
import org.gridwire.serialization.ObjectDataOutput;
import org.gridwire.serializer.SerializationConstants;
import org.testng.annotations.Test;

public class IdentifiedDataSerializableSerializerTest extends GridwireTestBase {
  static final int FACTORY_ID = 7;
  static final int TASK_CLASS_ID = 1;

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Task implements IdentifiedDataSerializable {
    private String name;
    private int priority;
    private long deadline;
    private double weight;
    private boolean done;
    private byte[] payload;
    private Object attachment;

    @Override
    public int getFactoryId() {
      return FACTORY_ID;
    }

    @Override
    public int getClassId() {
      return TASK_CLASS_ID;
    }

    @Override
    public void writeData(ObjectDataOutput out) {
      out.writeString(name);
      out.writeInt(priority);
      out.writeLong(deadline);
      out.writeDouble(weight);
      out.writeBoolean(done);
      out.writeByteArray(payload);
      out.writeObject(attachment);
    }

    @Override
    public void readData(ObjectDataInput in) {
      name = in.readString();
      priority = in.readInt();
      deadline = in.readLong();
      weight = in.readDouble();
      done = in.readBoolean();
      payload = in.readByteArray();
      attachment = in.readObject();
    }
  }

  static IdentifiedDataSerializable create(int classId) {
    return classId == TASK_CLASS_ID ? new Task() : null;
  }

  private static DefaultSerializationService taskService() {
    return newService(
        SerializationConfig.builder()
            .withDataSerializableFactory(
                FACTORY_ID, IdentifiedDataSerializableSerializerTest::create));
  }

  @Test(dataProvider = "byteOrders")
  public void testRoundTrip(boolean bigEndian) {
    DefaultSerializationService service =
        newService(
            SerializationConfig.builder()
                .withBigEndian(bigEndian)
                .withDataSerializableFactory(
                    FACTORY_ID, IdentifiedDataSerializableSerializerTest::create));
    List<Object> attachment = new ArrayList<>(Arrays.asList("a", 1, 2.5));
    Task task = new Task("build", 3, 1_700_000_000_000L, 0.5, true, new byte[] {9}, attachment);
    assertEquals(
        service.toData(task).getType(), SerializationConstants.CONSTANT_TYPE_DATA_SERIALIZABLE);
    Task result = serDe(service, task);
    assertEquals(result, task);
    Task empty = serDe(service, new Task());
    assertNull(empty.getName());
    assertNull(empty.getAttachment());
  }

  @Test
  public void testPayloadLayout() {
    DefaultSerializationService service = taskService();
    byte[] bytes = service.toData(new Task()).toByteArray();
    MemoryBuffer payload = MemoryBuffer.wrap(bytes, 8, service.isBigEndian());
    assertTrue(payload.readBoolean());
    assertEquals(payload.readInt32(), FACTORY_ID);
    assertEquals(payload.readInt32(), TASK_CLASS_ID);
  }

  @Test
  public void testUnknownFactory() {
    org.gridwire.serialization.Data data = taskService().toData(new Task());
    SerializationException e =
        expectThrows(SerializationException.class, () -> newService().toObject(data));
    assertTrue(e.getMessage().contains("factory id " + FACTORY_ID));
  }

  @Test
  public void testUnknownClass() {
    DefaultSerializationService service =
        newService(
            SerializationConfig.builder().withDataSerializableFactory(FACTORY_ID, id -> null));
    org.gridwire.serialization.Data data = service.toData(new Task());
    assertThrows(SerializationException.class, () -> service.toObject(data));
  }

  @Test
  public void testNonIdentifiedPayloadRejected() {
    DefaultSerializationService service = taskService();
    byte[] bytes = service.toData(new Task()).toByteArray();
    // clear the identified marker
    bytes[8] = 0;
    SerializationException e =
        expectThrows(
            SerializationException.class,
            () -> service.toObject(new HeapData(bytes, service.isBigEndian())));
    assertTrue(e.getMessage().contains("IdentifiedDataSerializable"));
  }

  @Test
  public void testAddress() {
    DefaultSerializationService service = newService();
    Address v4 = new Address("10.0.0.1", 5701);
    Address v6 = new Address("fe80::1", 5702);
    Address result = serDe(service, v4);
    assertEquals(result, v4);
    assertTrue(result.isIPv4());
    result = serDe(service, v6);
    assertEquals(result, v6);
    assertFalse(result.isIPv4());
    assertTrue(result.isIPv6());
  }

  @Test
  public void testRestValue() {
    DefaultSerializationService service = newService();
    RestValue value =
        new RestValue(
            "{\"a\":1}".getBytes(StandardCharsets.UTF_8),
            "application/json".getBytes(StandardCharsets.UTF_8));
    RestValue result = serDe(service, value);
    assertEquals(result, value);
    assertEquals(result.getValue(), "{\"a\":1}");
    assertEquals(result.getContentType(), "application/json");
  }

  @Test
  public void testReservedFactoryCannotBeReplaced() {
    DefaultSerializationService service =
        newService(
            SerializationConfig.builder()
                .withDataSerializableFactory(ClusterDataFactory.FACTORY_ID, id -> null));
    Address address = new Address("127.0.0.1", 1);
    assertEquals(serDe(service, address), address);
  }
}
