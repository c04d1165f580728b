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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Describes the fields of a compact type. Fields are kept sorted by name, which fixes both the
 * payload field order and the fingerprint, so two schemas with the same type name and fields
 * have the same {@link #getSchemaId()} whatever order the fields were declared in.
 */
public final class Schema {
  private final String typeName;
  private final ImmutableList<FieldDescriptor> fields;
  private final ImmutableMap<String, FieldDescriptor> fieldsByName;
  private final long schemaId;

  public Schema(String typeName, Collection<FieldDescriptor> fields) {
    Preconditions.checkNotNull(typeName, "typeName");
    List<FieldDescriptor> sorted = new ArrayList<>(fields);
    sorted.sort(Comparator.comparing(FieldDescriptor::getFieldName));
    ImmutableMap.Builder<String, FieldDescriptor> byName = ImmutableMap.builder();
    for (FieldDescriptor field : sorted) {
      byName.put(field.getFieldName(), field);
    }
    this.typeName = typeName;
    this.fields = ImmutableList.copyOf(sorted);
    // duplicate field names fail here
    this.fieldsByName = byName.build();
    this.schemaId = RabinFingerprint.fingerprint64(this);
  }

  public String getTypeName() {
    return typeName;
  }

  public long getSchemaId() {
    return schemaId;
  }

  public List<FieldDescriptor> getFields() {
    return fields;
  }

  public int getFieldCount() {
    return fields.size();
  }

  /** Returns the field named {@code fieldName}, or null. */
  public FieldDescriptor getField(String fieldName) {
    return fieldsByName.get(fieldName);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Schema)) {
      return false;
    }
    Schema that = (Schema) o;
    return schemaId == that.schemaId
        && typeName.equals(that.typeName)
        && fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(schemaId);
  }

  @Override
  public String toString() {
    return "Schema{typeName='" + typeName + "', schemaId=" + schemaId + ", fields=" + fields + '}';
  }
}
