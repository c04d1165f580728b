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

package org.gridwire;

import static org.testng.Assert.assertEquals;

import java.lang.reflect.Array;
import java.util.List;
import org.gridwire.config.NumberType;
import org.gridwire.config.SerializationConfig;
import org.gridwire.serialization.Data;
import org.gridwire.serialization.DefaultSerializationService;
import org.gridwire.serialization.SerializationService;
import org.testng.annotations.DataProvider;

/** Shared data providers and round-trip helpers. */
public abstract class GridwireTestBase {

  @DataProvider
  public static Object[][] byteOrders() {
    return new Object[][] {{true}, {false}};
  }

  @DataProvider
  public static Object[][] numberTypes() {
    NumberType[] types = NumberType.values();
    Object[][] params = new Object[types.length][];
    for (int i = 0; i < types.length; i++) {
      params[i] = new Object[] {types[i]};
    }
    return params;
  }

  public static DefaultSerializationService newService() {
    return new DefaultSerializationService(SerializationConfig.defaults());
  }

  public static DefaultSerializationService newService(SerializationConfig.Builder builder) {
    return new DefaultSerializationService(builder.build());
  }

  public static <T> T serDe(SerializationService service, Object value) {
    Data data = service.toData(value);
    return service.toObject(data);
  }

  public static Object serDeCheck(SerializationService service, Object value) {
    Object result = serDe(service, value);
    assertDeepEquals(result, value);
    return result;
  }

  /** Compares arrays element-wise, including primitive arrays and nested arrays. */
  public static void assertDeepEquals(Object actual, Object expected) {
    if (expected != null && expected.getClass().isArray()) {
      assertEquals(actual.getClass().isArray(), true, "Not an array: " + actual);
      int length = Array.getLength(expected);
      assertEquals(Array.getLength(actual), length);
      for (int i = 0; i < length; i++) {
        assertDeepEquals(Array.get(actual, i), Array.get(expected, i));
      }
    } else if (expected instanceof List) {
      List<?> expectedList = (List<?>) expected;
      List<?> actualList = (List<?>) actual;
      assertEquals(actualList.size(), expectedList.size());
      for (int i = 0; i < expectedList.size(); i++) {
        assertDeepEquals(actualList.get(i), expectedList.get(i));
      }
    } else {
      assertEquals(actual, expected);
    }
  }
}
