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

/**
 * How a value is dispatched. The {@link Category} is a closed set checked in precedence order;
 * {@link #getKind()} is only meaningful for {@link Category#SCALAR} and {@link Category#ARRAY},
 * where it names the element kind, and {@link #getCustomSerializerId()} only for {@link
 * Category#CUSTOM_TAGGED}.
 */
public final class Classification {

  public enum Category {
    NULL,
    COMPACT,
    IDENTIFIED,
    PORTABLE,
    SCALAR,
    ARRAY,
    CUSTOM_TAGGED,
    FALLBACK
  }

  static final Classification NULL = new Classification(Category.NULL, TypeKind.NULL, 0);
  static final Classification COMPACT = new Classification(Category.COMPACT, TypeKind.OBJECT, 0);
  static final Classification IDENTIFIED =
      new Classification(Category.IDENTIFIED, TypeKind.OBJECT, 0);
  static final Classification PORTABLE = new Classification(Category.PORTABLE, TypeKind.OBJECT, 0);
  static final Classification FALLBACK = new Classification(Category.FALLBACK, TypeKind.OBJECT, 0);

  private final Category category;
  private final TypeKind kind;
  private final int customSerializerId;

  private Classification(Category category, TypeKind kind, int customSerializerId) {
    this.category = category;
    this.kind = kind;
    this.customSerializerId = customSerializerId;
  }

  static Classification scalar(TypeKind kind) {
    return new Classification(Category.SCALAR, kind, 0);
  }

  static Classification array(TypeKind elementKind) {
    return new Classification(Category.ARRAY, elementKind, 0);
  }

  static Classification customTagged(int customSerializerId) {
    Preconditions.checkArgument(customSerializerId >= 1);
    return new Classification(Category.CUSTOM_TAGGED, TypeKind.OBJECT, customSerializerId);
  }

  public Category getCategory() {
    return category;
  }

  public TypeKind getKind() {
    return kind;
  }

  public int getCustomSerializerId() {
    return customSerializerId;
  }

  @Override
  public String toString() {
    switch (category) {
      case SCALAR:
        return "SCALAR(" + kind.registryName() + ")";
      case ARRAY:
        return "ARRAY(" + kind.registryName() + ")";
      case CUSTOM_TAGGED:
        return "CUSTOM_TAGGED(" + customSerializerId + ")";
      default:
        return category.name();
    }
  }
}
