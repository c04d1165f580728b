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

package org.gridwire.serialization;

/** Computes the partition hash stored in an envelope header. */
@FunctionalInterface
public interface PartitioningStrategy {

  /**
   * Returns {@link PartitionHashAware#getPartitionHash()} for values exposing one (every {@link
   * Data} does), otherwise {@code 0}, which tells the cluster to hash the payload itself.
   */
  PartitioningStrategy DEFAULT =
      value -> value instanceof PartitionHashAware
          ? ((PartitionHashAware) value).getPartitionHash()
          : 0;

  /**
   * @param value the value being serialized, or the {@link Data} of its partition key
   */
  int computePartitionHash(Object value);
}
