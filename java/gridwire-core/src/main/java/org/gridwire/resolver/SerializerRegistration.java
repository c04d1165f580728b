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

import org.gridwire.config.SerializationConfig;
import org.gridwire.serialization.SerializationService;

/**
 * Hook for modules to install serializers into a service's registry while it is built, after the
 * custom serializers and before the global one.
 *
 * <p>Hooks are passed through {@link SerializationConfig.Builder#withSerializerRegistration} or,
 * when {@link SerializationConfig#isDiscoverSerializerRegistrations()} is set, discovered through
 * service loading.
 */
public interface SerializerRegistration {

  /**
   * Registers serializers. {@code service} is the service under construction, for serializers that
   * write nested values; it must not serialize anything before construction completes.
   */
  void registerSerializers(SerializerRegistry.Builder registry, SerializationService service);

  /**
   * Check if this registration is applicable for the given configuration. This allows
   * registrations to opt out without registering anything.
   */
  default boolean isApplicable(SerializationConfig config) {
    return true;
  }
}
