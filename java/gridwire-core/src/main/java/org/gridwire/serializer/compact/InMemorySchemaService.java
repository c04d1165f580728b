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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A {@link SchemaService} holding schemas in a local concurrent map. */
public class InMemorySchemaService implements SchemaService {
  private static final Logger LOG = LoggerFactory.getLogger(InMemorySchemaService.class);

  private final ConcurrentMap<Long, Schema> schemas = new ConcurrentHashMap<>();

  @Override
  public Schema get(long schemaId) {
    return schemas.get(schemaId);
  }

  @Override
  public void put(Schema schema) {
    if (schemas.putIfAbsent(schema.getSchemaId(), schema) == null) {
      LOG.debug("Registered schema {}", schema);
    }
  }

  public int size() {
    return schemas.size();
  }
}
