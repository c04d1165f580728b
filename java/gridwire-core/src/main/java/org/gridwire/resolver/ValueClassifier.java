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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.LinkedList;
import java.util.List;
import java.util.function.Predicate;
import org.gridwire.serialization.CustomSerializable;
import org.gridwire.serializer.identified.IdentifiedDataSerializable;
import org.gridwire.serializer.portable.Portable;

/** Assigns every value its {@link Classification}, checking categories in precedence order. */
public final class ValueClassifier {
  private final Predicate<Object> compactValue;

  /**
   * @param compactValue tells whether a non-null value is written by the compact serializer
   */
  public ValueClassifier(Predicate<Object> compactValue) {
    this.compactValue = compactValue;
  }

  public Classification classify(Object value) {
    if (value == null) {
      return Classification.NULL;
    }
    if (compactValue.test(value)) {
      return Classification.COMPACT;
    }
    if (value instanceof IdentifiedDataSerializable) {
      return Classification.IDENTIFIED;
    }
    if (value instanceof Portable) {
      return Classification.PORTABLE;
    }
    Class<?> cls = value.getClass();
    if (cls.isArray()) {
      return Classification.array(elementKind(value));
    }
    TypeKind kind = kindOf(value);
    if (kind != TypeKind.OBJECT) {
      return Classification.scalar(kind);
    }
    if (value instanceof CustomSerializable) {
      int id = ((CustomSerializable) value).getCustomSerializerId();
      if (id >= 1) {
        return Classification.customTagged(id);
      }
    }
    return Classification.FALLBACK;
  }

  /**
   * Element kind of an array. Primitive arrays and {@code String[]} are typed by their component
   * type; any other array by its first element, or as {@link TypeKind#NUMBER} when empty. The
   * remaining elements are not inspected.
   */
  static TypeKind elementKind(Object array) {
    Class<?> component = array.getClass().getComponentType();
    if (component.isPrimitive()) {
      return primitiveKind(component);
    }
    if (component == String.class) {
      return TypeKind.STRING;
    }
    Object[] elements = (Object[]) array;
    if (elements.length == 0) {
      return TypeKind.NUMBER;
    }
    return kindOf(elements[0]);
  }

  private static TypeKind primitiveKind(Class<?> component) {
    if (component == byte.class) {
      return TypeKind.BYTE;
    } else if (component == boolean.class) {
      return TypeKind.BOOLEAN;
    } else if (component == char.class) {
      return TypeKind.CHAR;
    } else if (component == short.class) {
      return TypeKind.SHORT;
    } else if (component == int.class) {
      return TypeKind.INTEGER;
    } else if (component == long.class) {
      return TypeKind.LONG;
    } else if (component == float.class) {
      return TypeKind.FLOAT;
    } else {
      return TypeKind.DOUBLE;
    }
  }

  /** Scalar kind of a value, {@link TypeKind#OBJECT} when it has none. */
  public static TypeKind kindOf(Object value) {
    if (value == null) {
      return TypeKind.NULL;
    }
    if (value instanceof String) {
      return TypeKind.STRING;
    }
    if (value instanceof Number) {
      return numberKind((Number) value);
    }
    if (value instanceof Boolean) {
      return TypeKind.BOOLEAN;
    }
    if (value instanceof Character) {
      return TypeKind.CHAR;
    }
    if (value instanceof java.util.UUID) {
      return TypeKind.UUID;
    }
    if (value instanceof Date) {
      return TypeKind.DATE;
    }
    if (value instanceof LocalDate) {
      return TypeKind.LOCAL_DATE;
    }
    if (value instanceof LocalTime) {
      return TypeKind.LOCAL_TIME;
    }
    if (value instanceof LocalDateTime) {
      return TypeKind.LOCAL_DATE_TIME;
    }
    if (value instanceof OffsetDateTime) {
      return TypeKind.OFFSET_DATE_TIME;
    }
    if (value instanceof Class) {
      return TypeKind.JAVA_CLASS;
    }
    if (value instanceof ByteBuffer) {
      return TypeKind.BUFFER;
    }
    if (value instanceof LinkedList) {
      return TypeKind.LINKED_LIST;
    }
    if (value instanceof List) {
      return TypeKind.ARRAY_LIST;
    }
    return TypeKind.OBJECT;
  }

  private static TypeKind numberKind(Number value) {
    Class<?> cls = value.getClass();
    if (cls == Integer.class) {
      return TypeKind.INTEGER;
    } else if (cls == Double.class) {
      return TypeKind.DOUBLE;
    } else if (cls == Long.class) {
      return TypeKind.LONG;
    } else if (cls == Float.class) {
      return TypeKind.FLOAT;
    } else if (cls == Short.class) {
      return TypeKind.SHORT;
    } else if (cls == Byte.class) {
      return TypeKind.BYTE;
    } else if (value instanceof BigInteger) {
      return TypeKind.BIG_INTEGER;
    } else if (value instanceof BigDecimal) {
      return TypeKind.BIG_DECIMAL;
    }
    return TypeKind.NUMBER;
  }
}
