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

package org.affineir.affine;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Set;
import org.affineir.expr.AffineExprContext;
import org.affineir.expr.AffineMap;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpKind;
import org.affineir.ir.Operation;
import org.affineir.ir.RewritePattern;
import org.affineir.ir.Trait;
import org.affineir.ir.Type;
import org.affineir.ir.Type.MemRefType;
import org.affineir.ir.Value;

/**
 * Base class for operations that read or write an element (or a vector of elements) of a memref.
 * The subscripts are the results of an AffineMap applied to the index operands that follow the
 * memref operand.
 */
public abstract class AffineAccessOp extends Operation implements AffineMapUser {

  private AffineMap map;

  AffineAccessOp(
      IrContext context,
      OpKind kind,
      AffineMap map,
      List<? extends Value> operands,
      List<Type> resultTypes) {
    super(context, kind, Set.<Trait>of(), operands, resultTypes, 0);
    this.map = map;
  }

  /** Returns the map from the memref's rank to its subscripts when none is given. */
  static AffineMap defaultMap(AffineExprContext exprs, Value memref) {
    Preconditions.checkArgument(
        memref.type() instanceof MemRefType, "%s is not a memref", memref.type());
    return AffineMap.identity(exprs, ((MemRefType) memref.type()).rank());
  }

  static void checkMap(AffineMap map, Value memref, List<? extends Value> indices) {
    Preconditions.checkArgument(
        memref.type() instanceof MemRefType type && type.rank() == map.numResults(),
        "%s does not have one result per dimension of %s",
        map,
        memref.type());
    Preconditions.checkArgument(
        map.numInputs() == indices.size(),
        "%s has %s inputs but %s indices",
        map,
        map.numInputs(),
        indices.size());
  }

  /** The position of the memref operand; the map operands follow it. */
  abstract int memRefOperandIndex();

  /** True for operations that write to the memref. */
  public abstract boolean isWrite();

  public Value memref() {
    return operand(memRefOperandIndex());
  }

  public MemRefType memRefType() {
    return (MemRefType) memref().type();
  }

  /** The type of the value read or written. */
  public abstract Type valueType();

  @Override
  public AffineMap map() {
    return map;
  }

  @Override
  public List<Value> mapOperands() {
    return operands().subList(memRefOperandIndex() + 1, numOperands());
  }

  public List<Value> indices() {
    return mapOperands();
  }

  @Override
  public void setMap(AffineMap map, List<? extends Value> operands) {
    checkMap(map, memref(), operands);
    this.map = map;
    int start = memRefOperandIndex() + 1;
    setOperands(start, numOperands() - start, operands);
  }

  /** Returns the access map with its operands. */
  public AffineValueMap accessValueMap() {
    return new AffineValueMap(map, mapOperands());
  }

  /**
   * Checks the memref, map and subscript operands that all access operations share; subclasses
   * check the type of the value read or written.
   */
  @Override
  public boolean verify() {
    if (!(memref().type() instanceof MemRefType type)) {
      return emitOpError("expects a memref operand, not %s", memref().type());
    }
    if (map.numResults() != type.rank()) {
      return emitOpError("affine map num results must equal memref rank");
    }
    List<Value> indices = mapOperands();
    if (indices.size() != map.numInputs()) {
      return emitOpError("expects as many subscripts as affine map inputs");
    }
    for (Value index : indices) {
      if (!index.type().isIndex()) {
        return emitOpError("index to load must have 'index' type");
      }
    }
    return AffineLegality.verifyDimAndSymbolIdentifiers(this, indices, map.numDims());
  }

  @Override
  public List<RewritePattern> canonicalizationPatterns() {
    return List.of(ComposeMapOperands.INSTANCE);
  }

  @Override
  protected String attributesString() {
    return "map = " + map;
  }
}
