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

package org.gridwire.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.gridwire.serialization.ObjectDataInput;
import org.gridwire.serialization.ObjectDataOutput;
import org.gridwire.serializer.identified.DataSerializableFactory;
import org.gridwire.serializer.identified.IdentifiedDataSerializable;

/**
 * A value stored through the cluster's REST endpoint: raw bytes plus their content type, both
 * written as length-prefixed byte arrays.
 */
public final class RestValue implements IdentifiedDataSerializable {
  public static final int FACTORY_ID = -25;
  public static final int CLASS_ID = 1;

  private byte[] value;
  private byte[] contentType;

  public RestValue() {}

  public RestValue(byte[] value, byte[] contentType) {
    this.value = value;
    this.contentType = contentType;
  }

  /** The value bytes decoded as UTF-8. */
  public String getValue() {
    return value == null ? null : new String(value, StandardCharsets.UTF_8);
  }

  /** The content type bytes decoded as UTF-8. */
  public String getContentType() {
    return contentType == null ? null : new String(contentType, StandardCharsets.UTF_8);
  }

  public byte[] getValueBytes() {
    return value;
  }

  @Override
  public int getFactoryId() {
    return FACTORY_ID;
  }

  @Override
  public int getClassId() {
    return CLASS_ID;
  }

  @Override
  public void writeData(ObjectDataOutput out) {
    out.writeByteArray(value);
    out.writeByteArray(contentType);
  }

  @Override
  public void readData(ObjectDataInput in) {
    value = in.readByteArray();
    contentType = in.readByteArray();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RestValue)) {
      return false;
    }
    RestValue that = (RestValue) o;
    return Arrays.equals(value, that.value) && Arrays.equals(contentType, that.contentType);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(value) + Arrays.hashCode(contentType);
  }

  @Override
  public String toString() {
    return "RestValue{contentType='" + getContentType() + "', value=\"" + getValue() + "\"}";
  }

  /** Reserved factory creating {@link RestValue}s. */
  public static final class Factory implements DataSerializableFactory {
    @Override
    public IdentifiedDataSerializable create(int classId) {
      return classId == CLASS_ID ? new RestValue() : null;
    }
  }
}
