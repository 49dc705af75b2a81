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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Longs;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.affineir.expr.AffineMap;

/**
 * The type of a {@link Value}. Scalar types are singletons ({@link #INDEX}, {@link #I1}, {@link
 * #I8}, {@link #I32}, {@link #I64}, {@link #F32}, {@link #F64}); {@link MemRefType} and {@link
 * VectorType} instances are compared structurally.
 */
public abstract class Type {

  /** The type of loop induction variables, subscripts and sizes. */
  public static final Type INDEX = new Scalar("index");

  public static final Type I1 = new Scalar("i1");
  public static final Type I8 = new Scalar("i8");
  public static final Type I32 = new Scalar("i32");
  public static final Type I64 = new Scalar("i64");
  public static final Type F32 = new Scalar("f32");
  public static final Type F64 = new Scalar("f64");

  Type() {}

  public boolean isIndex() {
    return this == INDEX;
  }

  /** A type with no structure beyond its name. */
  private static final class Scalar extends Type {
    final String name;

    Scalar(String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * A shaped buffer type. Each dimension is either a non-negative static size or {@link #DYNAMIC};
   * the layout, if not empty, is a list of maps from subscripts to an underlying index space.
   */
  public static final class MemRefType extends Type {
    /** The size of a dimension that is only known at run time. */
    public static final long DYNAMIC = -1;

    private final ImmutableList<Long> shape;
    private final Type elementType;
    private final ImmutableList<AffineMap> layout;

    private MemRefType(
        ImmutableList<Long> shape, Type elementType, ImmutableList<AffineMap> layout) {
      this.shape = shape;
      this.elementType = elementType;
      this.layout = layout;
    }

    public static MemRefType of(Type elementType, long... shape) {
      return of(Longs.asList(shape), elementType, ImmutableList.of());
    }

    public static MemRefType of(List<Long> shape, Type elementType, List<AffineMap> layout) {
      for (long size : shape) {
        Preconditions.checkArgument(size >= 0 || size == DYNAMIC, "bad dimension size %s", size);
      }
      return new MemRefType(
          ImmutableList.copyOf(shape), elementType, ImmutableList.copyOf(layout));
    }

    public ImmutableList<Long> shape() {
      return shape;
    }

    public int rank() {
      return shape.size();
    }

    public long dimSize(int i) {
      return shape.get(i);
    }

    public Type elementType() {
      return elementType;
    }

    public ImmutableList<AffineMap> layout() {
      return layout;
    }

    public boolean isDynamicDim(int i) {
      return shape.get(i) == DYNAMIC;
    }

    public int numDynamicDims() {
      return (int) shape.stream().filter(s -> s == DYNAMIC).count();
    }

    /**
     * Given a dynamic dimension, returns its position among the dynamic dimensions (i.e. the number
     * of dynamic dimensions that precede it).
     */
    public int dynamicDimIndex(int i) {
      Preconditions.checkArgument(isDynamicDim(i), "dimension %s is static", i);
      int result = 0;
      for (int j = 0; j < i; j++) {
        if (isDynamicDim(j)) {
          result++;
        }
      }
      return result;
    }

    public boolean hasStaticShape() {
      return !shape.contains(DYNAMIC);
    }

    /** True if the layout is absent or a single identity map. */
    public boolean hasIdentityLayout() {
      return layout.isEmpty() || (layout.size() == 1 && layout.get(0).isIdentity());
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof MemRefType other)
          && shape.equals(other.shape)
          && elementType.equals(other.elementType)
          && layout.equals(other.layout);
    }

    @Override
    public int hashCode() {
      return Objects.hash(shape, elementType, layout);
    }

    @Override
    public String toString() {
      String dims =
          shape.stream()
              .map(s -> (s == DYNAMIC) ? "?" : s.toString())
              .collect(Collectors.joining("x"));
      String result = "memref<" + (dims.isEmpty() ? "" : dims + "x") + elementType;
      if (!layout.isEmpty()) {
        result += ", " + layout.stream().map(AffineMap::toString).collect(Collectors.joining(", "));
      }
      return result + ">";
    }
  }

  /** A fixed-size vector of scalars. */
  public static final class VectorType extends Type {
    private final ImmutableList<Long> shape;
    private final Type elementType;

    private VectorType(ImmutableList<Long> shape, Type elementType) {
      this.shape = shape;
      this.elementType = elementType;
    }

    public static VectorType of(Type elementType, long... shape) {
      Preconditions.checkArgument(shape.length > 0, "vectors must have at least one dimension");
      for (long size : shape) {
        Preconditions.checkArgument(size > 0, "bad vector size %s", size);
      }
      return new VectorType(ImmutableList.copyOf(Longs.asList(shape)), elementType);
    }

    public ImmutableList<Long> shape() {
      return shape;
    }

    public int rank() {
      return shape.size();
    }

    public Type elementType() {
      return elementType;
    }

    @Override
    public boolean equals(Object obj) {
      return (obj instanceof VectorType other)
          && shape.equals(other.shape)
          && elementType.equals(other.elementType);
    }

    @Override
    public int hashCode() {
      return Objects.hash(shape, elementType);
    }

    @Override
    public String toString() {
      return "vector<"
          + shape.stream().map(String::valueOf).collect(Collectors.joining("x"))
          + "x"
          + elementType
          + ">";
    }
  }
}
