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

import static org.gridwire.serializer.SerializationConstants.JSON_SERIALIZATION_TYPE;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.function.Function;
import org.gridwire.core.JsonValue;
import org.gridwire.exception.SerializationException;
import org.gridwire.memory.MemoryBuffer;

/**
 * Fallback serializers writing values as JSON strings. Both share a type id; only one of them is
 * registered, depending on the configured {@link
 * org.gridwire.config.JsonStringDeserializationPolicy}.
 */
public class JsonSerializers {
  static final Gson GSON =
      new GsonBuilder()
          .serializeNulls()
          .disableHtmlEscaping()
          .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
          .registerTypeAdapter(LocalDate.class, isoAdapter(LocalDate::parse))
          .registerTypeAdapter(LocalTime.class, isoAdapter(LocalTime::parse))
          .registerTypeAdapter(LocalDateTime.class, isoAdapter(LocalDateTime::parse))
          .registerTypeAdapter(OffsetDateTime.class, isoAdapter(OffsetDateTime::parse))
          .create();

  /** Writes a {@code java.time} value as its ISO-8601 string. */
  private static <T> TypeAdapter<T> isoAdapter(Function<String, T> parser) {
    return new TypeAdapter<T>() {
      @Override
      public void write(JsonWriter out, T value) throws IOException {
        out.value(value.toString());
      }

      @Override
      public T read(JsonReader in) throws IOException {
        return parser.apply(in.nextString());
      }
    }.nullSafe();
  }

  static String toJson(Object value) {
    if (value instanceof JsonValue) {
      return ((JsonValue) value).getValue();
    }
    try {
      return GSON.toJson(value);
    } catch (JsonParseException e) {
      throw new SerializationException(
          "Can not write " + value.getClass().getName() + " as JSON", e);
    }
  }

  /**
   * Parses documents on read into maps, lists, strings, booleans, {@code Long}s for integral
   * numbers and {@code Double}s otherwise.
   */
  public static final class JsonSerializer extends Serializer<Object> {

    public JsonSerializer() {
      super(JSON_SERIALIZATION_TYPE);
    }

    @Override
    public void write(MemoryBuffer buffer, Object value) {
      buffer.writeString(toJson(value));
    }

    @Override
    public Object read(MemoryBuffer buffer) {
      String json = buffer.readString();
      try {
        return GSON.fromJson(json, Object.class);
      } catch (JsonParseException e) {
        throw new SerializationException("Invalid JSON payload", e);
      }
    }
  }

  /** Keeps documents as {@link JsonValue}s on read. */
  public static final class JsonValueSerializer extends Serializer<Object> {

    public JsonValueSerializer() {
      super(JSON_SERIALIZATION_TYPE);
    }

    @Override
    public void write(MemoryBuffer buffer, Object value) {
      buffer.writeString(toJson(value));
    }

    @Override
    public JsonValue read(MemoryBuffer buffer) {
      return new JsonValue(buffer.readString());
    }
  }
}
