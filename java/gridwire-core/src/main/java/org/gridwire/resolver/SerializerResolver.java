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

import com.google.common.base.Preconditions;
import org.gridwire.exception.SerializerNotFoundException;
import org.gridwire.exception.UnserializableValueException;
import org.gridwire.serialization.Absent;
import org.gridwire.serializer.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the serializer for a value. Precedence, first match wins:
 *
 * <ol>
 *   <li>null
 *   <li>compact values
 *   <li>{@link org.gridwire.serializer.identified.IdentifiedDataSerializable}
 *   <li>{@link org.gridwire.serializer.portable.Portable}
 *   <li>built-in scalar and array kinds
 *   <li>{@link org.gridwire.serialization.CustomSerializable} values with a registered id
 *   <li>the global serializer
 *   <li>JSON
 * </ol>
 *
 * <p>A built-in kind without a registered serializer, such as an array whose first element is a
 * map, continues down the chain instead of failing.
 */
public final class SerializerResolver {
  private static final Logger LOG = LoggerFactory.getLogger(SerializerResolver.class);

  private final SerializerRegistry registry;
  private final ValueClassifier classifier;

  public SerializerResolver(SerializerRegistry registry, ValueClassifier classifier) {
    this.registry = Preconditions.checkNotNull(registry);
    this.classifier = Preconditions.checkNotNull(classifier);
  }

  /**
   * Returns the serializer for {@code value}.
   *
   * @throws UnserializableValueException if value is {@link Absent#INSTANCE}
   * @throws SerializerNotFoundException if no serializer matches
   */
  public Serializer<?> resolve(Object value) {
    if (value == Absent.INSTANCE) {
      throw new UnserializableValueException("Absent value can not be serialized.");
    }
    Classification classification = classifier.classify(value);
    Serializer<?> serializer;
    switch (classification.getCategory()) {
      case NULL:
        serializer = registry.findSerializer(TypeKind.NULL, false);
        break;
      case COMPACT:
        serializer = registry.findSerializerByName(SerializerRegistry.COMPACT, false);
        break;
      case IDENTIFIED:
        serializer = registry.findSerializerByName(SerializerRegistry.IDENTIFIED, false);
        break;
      case PORTABLE:
        serializer = registry.findSerializerByName(SerializerRegistry.PORTABLE, false);
        break;
      case SCALAR:
        serializer = registry.findSerializer(classification.getKind(), false);
        break;
      case ARRAY:
        serializer = registry.findSerializer(classification.getKind(), true);
        break;
      case CUSTOM_TAGGED:
        serializer = registry.findSerializerById(classification.getCustomSerializerId());
        break;
      case FALLBACK:
        serializer = null;
        break;
      default:
        throw new IllegalStateException("Unexpected classification " + classification);
    }
    if (serializer != null) {
      return serializer;
    }
    serializer = registry.findSerializerByName(SerializerRegistry.GLOBAL, false);
    if (serializer == null) {
      serializer = registry.findSerializerByName(SerializerRegistry.JSON, false);
    }
    if (serializer == null) {
      throw new SerializerNotFoundException(value);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug(
          "{} of {} falls back to {}",
          classification,
          value == null ? null : value.getClass().getName(),
          serializer);
    }
    return serializer;
  }

  public Classification classify(Object value) {
    return classifier.classify(value);
  }

  public SerializerRegistry getRegistry() {
    return registry;
  }
}
