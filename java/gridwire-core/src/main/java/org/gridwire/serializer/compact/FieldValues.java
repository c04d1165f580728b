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

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.gridwire.exception.SerializationException;

/** Field kinds and values collected from a {@link CompactWriter} or a record builder. */
final class FieldValues {
  private final Map<String, FieldDescriptor> descriptors = new LinkedHashMap<>();
  // may hold null for string and compact fields
  private final Map<String, Object> values = new HashMap<>();

  void put(String fieldName, FieldKind kind, Object value) {
    if (descriptors.containsKey(fieldName)) {
      throw new SerializationException("Field can only be written once: " + fieldName);
    }
    descriptors.put(fieldName, new FieldDescriptor(fieldName, kind));
    values.put(fieldName, value);
  }

  Collection<FieldDescriptor> descriptors() {
    return descriptors.values();
  }

  FieldDescriptor descriptor(String fieldName) {
    return descriptors.get(fieldName);
  }

  Map<String, Object> values() {
    return values;
  }
}
