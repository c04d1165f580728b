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

package org.gridwire.cluster;

import com.google.common.base.Preconditions;
import java.util.Objects;
import org.gridwire.serialization.ObjectDataInput;
import org.gridwire.serialization.ObjectDataOutput;
import org.gridwire.serializer.identified.IdentifiedDataSerializable;

/** Network address of a cluster member, as exchanged in cluster data. */
public final class Address implements IdentifiedDataSerializable {
  public static final byte IPV4 = 4;
  public static final byte IPV6 = 6;

  private String host;
  private int port;
  private byte type;

  /** Empty instance for {@link ClusterDataFactory}. */
  Address() {}

  public Address(String host, int port) {
    Preconditions.checkNotNull(host, "host");
    Preconditions.checkArgument(port >= 0 && port <= 0xFFFF, "Invalid port %s", port);
    this.host = host;
    this.port = port;
    this.type = host.indexOf(':') >= 0 ? IPV6 : IPV4;
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public boolean isIPv4() {
    return type == IPV4;
  }

  public boolean isIPv6() {
    return type == IPV6;
  }

  @Override
  public int getFactoryId() {
    return ClusterDataFactory.FACTORY_ID;
  }

  @Override
  public int getClassId() {
    return ClusterDataFactory.ADDRESS;
  }

  @Override
  public void writeData(ObjectDataOutput out) {
    out.writeInt(port);
    out.writeByte(type);
    out.writeString(host);
  }

  @Override
  public void readData(ObjectDataInput in) {
    port = in.readInt();
    type = in.readByte();
    host = in.readString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Address address = (Address) o;
    return port == address.port && type == address.type && Objects.equals(host, address.host);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, port, type);
  }

  @Override
  public String toString() {
    return (isIPv6() ? "[" + host + "]" : host) + ":" + port;
  }
}
