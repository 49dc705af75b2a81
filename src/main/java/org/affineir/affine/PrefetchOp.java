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
import java.util.ArrayList;
import java.util.List;
import org.affineir.expr.AffineMap;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.OpKind;
import org.affineir.ir.Type;
import org.affineir.ir.Value;

/**
 * Hints that the element of a memref at the subscripts given by the map will soon be read or
 * written. A prefetch has no results and never changes the memref's contents, but it is ordered
 * with the accesses around it so it is never erased as dead.
 */
public final class PrefetchOp extends AffineAccessOp {

  /** Locality hints run from 0 (no temporal locality) to 3 (keep in cache). */
  public static final int MAX_LOCALITY_HINT = 3;

  private final boolean forWrite;
  private final int localityHint;
  private final boolean dataCache;

  private PrefetchOp(
      IrContext context,
      AffineMap map,
      List<Value> operands,
      boolean forWrite,
      int localityHint,
      boolean dataCache) {
    super(context, OpKind.PREFETCH, map, operands, List.of());
    this.forWrite = forWrite;
    this.localityHint = localityHint;
    this.dataCache = dataCache;
  }

  public static PrefetchOp create(
      OpBuilder builder,
      Value memref,
      AffineMap map,
      List<? extends Value> mapOperands,
      boolean forWrite,
      int localityHint,
      boolean dataCache) {
    checkMap(map, memref, mapOperands);
    Preconditions.checkArgument(
        localityHint >= 0 && localityHint <= MAX_LOCALITY_HINT,
        "locality hint must be in the range 0 to %s, not %s",
        MAX_LOCALITY_HINT,
        localityHint);
    List<Value> operands = new ArrayList<>();
    operands.add(memref);
    operands.addAll(mapOperands);
    return builder.insert(
        new PrefetchOp(builder.context(), map, operands, forWrite, localityHint, dataCache));
  }

  /** Creates a data-cache prefetch whose subscripts are {@code indices} (the identity map). */
  public static PrefetchOp create(
      OpBuilder builder,
      Value memref,
      List<? extends Value> indices,
      boolean forWrite,
      int localityHint) {
    AffineMap map = defaultMap(builder.exprs(), memref);
    return create(builder, memref, map, indices, forWrite, localityHint, true);
  }

  @Override
  int memRefOperandIndex() {
    return 0;
  }

  /** Always false: a prefetch for write still leaves the memref unchanged. */
  @Override
  public boolean isWrite() {
    return false;
  }

  /** True if the prefetched element is expected to be written rather than read. */
  public boolean forWrite() {
    return forWrite;
  }

  public int localityHint() {
    return localityHint;
  }

  /** True for a data-cache prefetch, false for an instruction-cache prefetch. */
  public boolean dataCache() {
    return dataCache;
  }

  @Override
  public Type valueType() {
    return memRefType().elementType();
  }

  @Override
  protected String attributesString() {
    return String.format(
        "%s, %s, locality<%s>, %s",
        super.attributesString(),
        forWrite ? "write" : "read",
        localityHint,
        dataCache ? "data" : "instr");
  }
}
