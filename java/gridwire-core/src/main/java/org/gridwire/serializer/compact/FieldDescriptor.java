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
import java.util.Objects;

/** Name and kind of one compact field. */
public final class FieldDescriptor {
  private final String fieldName;
  private final FieldKind kind;

  public FieldDescriptor(String fieldName, FieldKind kind) {
    Preconditions.checkNotNull(fieldName, "fieldName");
    Preconditions.checkArgument(
        kind != null && kind != FieldKind.NOT_AVAILABLE, "Invalid kind %s for %s", kind, fieldName);
    this.fieldName = fieldName;
    this.kind = kind;
  }

  public String getFieldName() {
    return fieldName;
  }

  public FieldKind getKind() {
    return kind;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FieldDescriptor that = (FieldDescriptor) o;
    return fieldName.equals(that.fieldName) && kind == that.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(fieldName, kind);
  }

  @Override
  public String toString() {
    return fieldName + ":" + kind;
  }
}
