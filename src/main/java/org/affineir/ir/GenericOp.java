/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.affineir.ir;

import java.util.List;
import java.util.Set;

/**
 * An operation that this library has no specific knowledge of (e.g. arithmetic, a function
 * return, or a vector transfer). It is identified by name, and its behavior is described only by
 * its traits.
 */
public final class GenericOp extends Operation {

  private final String name;

  private GenericOp(
      IrContext context,
      String name,
      Set<Trait> traits,
      List<? extends Value> operands,
      List<Type> resultTypes,
      int numRegions) {
    super(context, OpKind.GENERIC, traits, operands, resultTypes, numRegions);
    this.name = name;
  }

  public static GenericOp create(
      OpBuilder builder,
      String name,
      Set<Trait> traits,
      List<? extends Value> operands,
      List<Type> resultTypes,
      int numRegions) {
    return builder.insert(
        new GenericOp(builder.context(), name, traits, operands, resultTypes, numRegions));
  }

  /** Creates a generic operation with no regions. */
  public static GenericOp create(
      OpBuilder builder,
      String name,
      Set<Trait> traits,
      List<? extends Value> operands,
      List<Type> resultTypes) {
    return create(builder, name, traits, operands, resultTypes, 0);
  }

  @Override
  public String name() {
    return name;
  }
}
