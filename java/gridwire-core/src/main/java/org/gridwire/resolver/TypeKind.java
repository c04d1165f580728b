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

/**
 * Built-in value kinds. Each kind has a canonical registry name; the serializer for an array of
 * the kind is registered under that name with an {@code Array} suffix.
 *
 * <p>{@link #NUMBER} and {@link #BUFFER} are logical kinds with no serializer of their own: they
 * are normalized to the configured default number type and to {@code byteArray} on lookup.
 * {@link #OBJECT} is everything else and never has a built-in serializer.
 */
public enum TypeKind {
  NULL("null"),
  BOOLEAN("boolean"),
  BYTE("byte"),
  CHAR("char"),
  SHORT("short"),
  INTEGER("integer"),
  LONG("long"),
  FLOAT("float"),
  DOUBLE("double"),
  STRING("string"),
  UUID("uuid"),
  DATE("date"),
  LOCAL_DATE("localDate"),
  LOCAL_TIME("localTime"),
  LOCAL_DATE_TIME("localDateTime"),
  OFFSET_DATE_TIME("offsetDateTime"),
  BIG_INTEGER("bigint"),
  BIG_DECIMAL("bigDecimal"),
  JAVA_CLASS("javaClass"),
  JAVA_ARRAY("javaArray"),
  ARRAY_LIST("arrayList"),
  LINKED_LIST("linkedList"),
  NUMBER("number"),
  BUFFER("buffer"),
  OBJECT("object");

  private final String registryName;

  TypeKind(String registryName) {
    this.registryName = registryName;
  }

  public String registryName() {
    return registryName;
  }

  /** Registry name of the serializer handling arrays of this kind. */
  public String arrayRegistryName() {
    return registryName + SerializerRegistry.ARRAY_SUFFIX;
  }
}
