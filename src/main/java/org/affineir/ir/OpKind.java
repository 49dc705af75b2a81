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

/**
 * The kinds of Operation. Every operation defined by this library has its own kind; operations
 * from elsewhere (e.g. arithmetic, returns, vector transfers) are {@link #GENERIC} and identified
 * by name.
 */
public enum OpKind {
  CONSTANT("arith.constant"),
  APPLY("affine.apply"),
  MIN("affine.min"),
  MAX("affine.max"),
  FOR("affine.for"),
  PARALLEL("affine.parallel"),
  IF("affine.if"),
  YIELD("affine.yield"),
  LOAD("affine.load"),
  STORE("affine.store"),
  VECTOR_LOAD("affine.vector_load"),
  VECTOR_STORE("affine.vector_store"),
  PREFETCH("affine.prefetch"),
  DIM("memref.dim"),
  ALLOC("memref.alloc"),
  VIEW("memref.view"),
  SUBVIEW("memref.subview"),
  FUNC("func.func"),
  EXECUTE_REGION("scf.execute_region"),
  GENERIC(null);

  /** The printed name of operations of this kind; null for {@link #GENERIC}. */
  final String opName;

  OpKind(String opName) {
    this.opName = opName;
  }
}
