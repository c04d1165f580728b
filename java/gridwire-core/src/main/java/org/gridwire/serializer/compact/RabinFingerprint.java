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

import java.nio.charset.StandardCharsets;

/**
 * 64-bit Rabin fingerprint used as the schema id. Every member must compute the same id for the
 * same schema, so the encoding of the inputs is fixed: ints are fed little-endian, strings as
 * their UTF-8 byte count followed by the bytes.
 */
final class RabinFingerprint {
  static final long INIT = 0xc15d213aa4d7a795L;
  private static final long[] FP_TABLE = new long[256];

  static {
    for (int i = 0; i < 256; i++) {
      long fp = i;
      for (int j = 0; j < 8; j++) {
        fp = (fp >>> 1) ^ (INIT & -(fp & 1L));
      }
      FP_TABLE[i] = fp;
    }
  }

  private RabinFingerprint() {}

  static long fingerprint64(Schema schema) {
    long fp = fingerprint64(INIT, schema.getTypeName());
    fp = fingerprint64(fp, schema.getFieldCount());
    for (FieldDescriptor field : schema.getFields()) {
      fp = fingerprint64(fp, field.getFieldName());
      fp = fingerprint64(fp, field.getKind().getId());
    }
    return fp;
  }

  static long fingerprint64(long fp, byte b) {
    return (fp >>> 8) ^ FP_TABLE[(int) (fp ^ b) & 0xff];
  }

  static long fingerprint64(long fp, int v) {
    fp = fingerprint64(fp, (byte) (v & 0xff));
    fp = fingerprint64(fp, (byte) ((v >>> 8) & 0xff));
    fp = fingerprint64(fp, (byte) ((v >>> 16) & 0xff));
    fp = fingerprint64(fp, (byte) ((v >>> 24) & 0xff));
    return fp;
  }

  static long fingerprint64(long fp, String value) {
    if (value == null) {
      return fingerprint64(fp, -1);
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    fp = fingerprint64(fp, bytes.length);
    for (byte b : bytes) {
      fp = fingerprint64(fp, b);
    }
    return fp;
  }
}
