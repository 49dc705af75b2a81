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
import org.affineir.ir.Block;
import org.affineir.ir.BlockArgument;
import org.affineir.ir.IrContext;
import org.affineir.ir.OpKind;
import org.affineir.ir.Operation;
import org.affineir.ir.Trait;
import org.affineir.ir.Type;

/**
 * A function: a single region whose entry block arguments are the function's parameters. Its body
 * is an affine scope, and it is isolated from above, so values defined outside it are never valid
 * symbols inside it.
 */
public final class FuncOp extends Operation {

  private final String symbolName;

  private FuncOp(IrContext context, String symbolName) {
    super(
        context,
        OpKind.FUNC,
        EnumSet.of(Trait.SCOPE, Trait.ISOLATED_FROM_ABOVE),
        List.of(),
        List.of(),
        1);
    this.symbolName = symbolName;
  }

  /** Creates a top-level function with an empty entry block. */
  public static FuncOp create(IrContext context, String name, List<Type> argTypes) {
    FuncOp result = new FuncOp(context, name);
    Block entry = result.region(0).addBlock();
    argTypes.forEach(entry::addArgument);
    return result;
  }

  public static FuncOp create(IrContext context, String name, Type... argTypes) {
    return create(context, name, List.of(argTypes));
  }

  public String symbolName() {
    return symbolName;
  }

  public Block body() {
    return region(0).front();
  }

  public BlockArgument argument(int i) {
    return body().argument(i);
  }

  @Override
  protected String attributesString() {
    return "sym_name = \"" + symbolName + "\"";
  }
}
