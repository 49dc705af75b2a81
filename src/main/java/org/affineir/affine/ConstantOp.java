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

import java.util.EnumSet;
import java.util.List;
import org.affineir.ir.ConstantLike;
import org.affineir.ir.ConstantMaterializer;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpBuilder;
import org.affineir.ir.OpKind;
import org.affineir.ir.Operation;
import org.affineir.ir.Trait;
import org.affineir.ir.Type;
import org.affineir.ir.Value;

/** An integer or index constant. */
public final class ConstantOp extends Operation implements ConstantLike {

  /** Materializes folded constants as ConstantOps. */
  public static final ConstantMaterializer MATERIALIZER = ConstantOp::materialize;

  private final long value;

  private ConstantOp(IrContext context, long value, Type type) {
    super(
        context,
        OpKind.CONSTANT,
        EnumSet.of(Trait.CONSTANT_LIKE, Trait.NO_MEMORY_EFFECT),
        List.of(),
        List.of(type),
        0);
    this.value = value;
  }

  /** Creates an index constant. */
  public static ConstantOp create(OpBuilder builder, long value) {
    return create(builder, value, Type.INDEX);
  }

  public static ConstantOp create(OpBuilder builder, long value, Type type) {
    return builder.insert(new ConstantOp(builder.context(), value, type));
  }

  /** Creates a constant and returns its result. */
  public static Value materialize(OpBuilder builder, long value, Type type) {
    return create(builder, value, type).result();
  }

  @Override
  public long value() {
    return value;
  }

  @Override
  public boolean verify() {
    Type type = result().type();
    if (type != Type.INDEX && type != Type.I1 && type != Type.I32 && type != Type.I64) {
      return emitOpError("requires an integer or index result type, not %s", type);
    }
    return true;
  }

  @Override
  protected String attributesString() {
    return "value = " + value + " : " + result().type();
  }
}
