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

/** Type ids reserved by the cluster for built-in serializers. */
public final class SerializationConstants {
  public static final int CONSTANT_TYPE_NULL = 0;
  public static final int CONSTANT_TYPE_PORTABLE = -1;
  public static final int CONSTANT_TYPE_DATA_SERIALIZABLE = -2;
  public static final int CONSTANT_TYPE_BYTE = -3;
  public static final int CONSTANT_TYPE_BOOLEAN = -4;
  public static final int CONSTANT_TYPE_CHAR = -5;
  public static final int CONSTANT_TYPE_SHORT = -6;
  public static final int CONSTANT_TYPE_INTEGER = -7;
  public static final int CONSTANT_TYPE_LONG = -8;
  public static final int CONSTANT_TYPE_FLOAT = -9;
  public static final int CONSTANT_TYPE_DOUBLE = -10;
  public static final int CONSTANT_TYPE_STRING = -11;
  public static final int CONSTANT_TYPE_BYTE_ARRAY = -12;
  public static final int CONSTANT_TYPE_BOOLEAN_ARRAY = -13;
  public static final int CONSTANT_TYPE_CHAR_ARRAY = -14;
  public static final int CONSTANT_TYPE_SHORT_ARRAY = -15;
  public static final int CONSTANT_TYPE_INTEGER_ARRAY = -16;
  public static final int CONSTANT_TYPE_LONG_ARRAY = -17;
  public static final int CONSTANT_TYPE_FLOAT_ARRAY = -18;
  public static final int CONSTANT_TYPE_DOUBLE_ARRAY = -19;
  public static final int CONSTANT_TYPE_STRING_ARRAY = -20;
  public static final int CONSTANT_TYPE_UUID = -21;

  public static final int JAVA_DEFAULT_TYPE_CLASS = -24;
  public static final int JAVA_DEFAULT_TYPE_DATE = -25;
  public static final int JAVA_DEFAULT_TYPE_BIG_INTEGER = -26;
  public static final int JAVA_DEFAULT_TYPE_BIG_DECIMAL = -27;
  public static final int JAVA_DEFAULT_TYPE_ARRAY = -28;
  public static final int JAVA_DEFAULT_TYPE_ARRAY_LIST = -29;
  public static final int JAVA_DEFAULT_TYPE_LINKED_LIST = -30;

  public static final int JAVA_DEFAULT_TYPE_LOCAL_DATE = -51;
  public static final int JAVA_DEFAULT_TYPE_LOCAL_TIME = -52;
  public static final int JAVA_DEFAULT_TYPE_LOCAL_DATE_TIME = -53;
  public static final int JAVA_DEFAULT_TYPE_OFFSET_DATE_TIME = -54;
  public static final int TYPE_COMPACT = -55;

  public static final int JSON_SERIALIZATION_TYPE = -130;

  private SerializationConstants() {}
}
