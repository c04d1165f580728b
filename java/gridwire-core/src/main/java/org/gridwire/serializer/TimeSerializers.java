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

import static org.gridwire.serializer.SerializationConstants.JAVA_DEFAULT_TYPE_DATE;
import static org.gridwire.serializer.SerializationConstants.JAVA_DEFAULT_TYPE_LOCAL_DATE;
import static org.gridwire.serializer.SerializationConstants.JAVA_DEFAULT_TYPE_LOCAL_DATE_TIME;
import static org.gridwire.serializer.SerializationConstants.JAVA_DEFAULT_TYPE_LOCAL_TIME;
import static org.gridwire.serializer.SerializationConstants.JAVA_DEFAULT_TYPE_OFFSET_DATE_TIME;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import org.gridwire.memory.MemoryBuffer;

/** Serializers for {@link Date} and the {@code java.time} local and offset types. */
public class TimeSerializers {

  static void writeLocalDate(MemoryBuffer buffer, LocalDate date) {
    buffer.writeInt32(date.getYear());
    buffer.writeByte(date.getMonthValue());
    buffer.writeByte(date.getDayOfMonth());
  }

  static LocalDate readLocalDate(MemoryBuffer buffer) {
    int year = buffer.readInt32();
    int month = buffer.readByte();
    int day = buffer.readByte();
    return LocalDate.of(year, month, day);
  }

  static void writeLocalTime(MemoryBuffer buffer, LocalTime time) {
    buffer.writeByte(time.getHour());
    buffer.writeByte(time.getMinute());
    buffer.writeByte(time.getSecond());
    buffer.writeInt32(time.getNano());
  }

  static LocalTime readLocalTime(MemoryBuffer buffer) {
    int hour = buffer.readByte();
    int minute = buffer.readByte();
    int second = buffer.readByte();
    int nano = buffer.readInt32();
    return LocalTime.of(hour, minute, second, nano);
  }

  /** Epoch milliseconds as an int64. */
  public static final class DateSerializer extends Serializer<Date> {

    public DateSerializer() {
      super(JAVA_DEFAULT_TYPE_DATE);
    }

    @Override
    public void write(MemoryBuffer buffer, Date value) {
      buffer.writeInt64(value.getTime());
    }

    @Override
    public Date read(MemoryBuffer buffer) {
      return new Date(buffer.readInt64());
    }
  }

  /** int32 year, int8 month, int8 day of month. */
  public static final class LocalDateSerializer extends Serializer<LocalDate> {

    public LocalDateSerializer() {
      super(JAVA_DEFAULT_TYPE_LOCAL_DATE);
    }

    @Override
    public void write(MemoryBuffer buffer, LocalDate value) {
      writeLocalDate(buffer, value);
    }

    @Override
    public LocalDate read(MemoryBuffer buffer) {
      return readLocalDate(buffer);
    }
  }

  /** int8 hour, int8 minute, int8 second, int32 nano of second. */
  public static final class LocalTimeSerializer extends Serializer<LocalTime> {

    public LocalTimeSerializer() {
      super(JAVA_DEFAULT_TYPE_LOCAL_TIME);
    }

    @Override
    public void write(MemoryBuffer buffer, LocalTime value) {
      writeLocalTime(buffer, value);
    }

    @Override
    public LocalTime read(MemoryBuffer buffer) {
      return readLocalTime(buffer);
    }
  }

  public static final class LocalDateTimeSerializer extends Serializer<LocalDateTime> {

    public LocalDateTimeSerializer() {
      super(JAVA_DEFAULT_TYPE_LOCAL_DATE_TIME);
    }

    @Override
    public void write(MemoryBuffer buffer, LocalDateTime value) {
      writeLocalDate(buffer, value.toLocalDate());
      writeLocalTime(buffer, value.toLocalTime());
    }

    @Override
    public LocalDateTime read(MemoryBuffer buffer) {
      LocalDate date = readLocalDate(buffer);
      return LocalDateTime.of(date, readLocalTime(buffer));
    }
  }

  /** Local date-time followed by the int32 offset in seconds. */
  public static final class OffsetDateTimeSerializer extends Serializer<OffsetDateTime> {

    public OffsetDateTimeSerializer() {
      super(JAVA_DEFAULT_TYPE_OFFSET_DATE_TIME);
    }

    @Override
    public void write(MemoryBuffer buffer, OffsetDateTime value) {
      writeLocalDate(buffer, value.toLocalDate());
      writeLocalTime(buffer, value.toLocalTime());
      buffer.writeInt32(value.getOffset().getTotalSeconds());
    }

    @Override
    public OffsetDateTime read(MemoryBuffer buffer) {
      LocalDate date = readLocalDate(buffer);
      LocalTime time = readLocalTime(buffer);
      ZoneOffset offset = ZoneOffset.ofTotalSeconds(buffer.readInt32());
      return OffsetDateTime.of(date, time, offset);
    }
  }
}
