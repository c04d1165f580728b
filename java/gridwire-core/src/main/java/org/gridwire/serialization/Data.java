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

/**
 * The immutable wire unit exchanged with the cluster.
 *
 * <pre>
 * [ partitionHash: int32 ][ typeId: int32 ][ payload: serializer defined ]
 * </pre>
 *
 * <p>Both header fields and the payload use the byte order of the service that produced the
 * envelope. Implementations are immutable and may be shared between threads.
 */
public interface Data extends PartitionHashAware {

  /** Returns a copy of the whole envelope, header included. */
  byte[] toByteArray();

  /** Type id of the serializer that wrote the payload. */
  int getType();

  /** Size of the whole envelope in bytes. */
  int totalSize();

  /** Size of the payload in bytes. */
  int dataSize();

  /** Whether the header carries an explicit, non-zero partition hash. */
  boolean hasPartitionHash();

  /**
   * Returns the header's partition hash if it has one, otherwise the hash of the payload bytes.
   */
  @Override
  int getPartitionHash();

  /** Whether the header and payload are big-endian. */
  boolean isBigEndian();
}
