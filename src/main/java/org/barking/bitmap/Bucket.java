/*
 * Copyright 2025 The Barking Bitmap Authors
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

package org.barking.bitmap;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.function.BinaryOperator;
import java.util.function.IntConsumer;
import org.barking.util.Ordered;
import org.barking.util.SizeOf;

/**
 * A Bucket is a mutable set of unsigned 16-bit values: the low halves of all the elements of a
 * {@link CompressedBitSet} that share one high half.
 *
 * <p>A Bucket's contents are held in exactly one of two representations:
 *
 * <ul>
 *   <li>{@link Kind#SPARSE}: a strictly ascending {@code char[]}, two bytes per element; or
 *   <li>{@link Kind#DENSE}: a 65,536-bit vector, a flat 8KB regardless of how many elements it
 *       holds.
 * </ul>
 *
 * <p>Sparse is cheaper while a bucket has fewer than {@link #CONVERSION_THRESHOLD} elements, and
 * Dense at or above it. {@link #add} and {@link #remove} never change the representation; only
 * {@link #normalize} does, and the results of {@link Op#apply} are always normalized. A Bucket may
 * therefore be temporarily in the more expensive representation, but its membership never depends
 * on which one it is in.
 *
 * <p>Buckets are not thread-safe.
 */
public final class Bucket {

  /** The number of distinct values a Bucket can hold. */
  public static final int CAPACITY = 1 << 16;

  /**
   * A Bucket with at least this many elements is cheaper as {@link Kind#DENSE}; with fewer, as
   * {@link Kind#SPARSE}. At this size the two representations use the same memory.
   */
  public static final int CONVERSION_THRESHOLD = 4096;

  /** The number of longs in a Dense bit vector. */
  public static final int DENSE_WORDS = CAPACITY / Long.SIZE;

  /** Identifies a Bucket's current representation. */
  public enum Kind {
    SPARSE,
    DENSE
  }

  private Representation contents;

  /** Creates an empty Bucket. */
  public Bucket() {
    this(new Sparse());
  }

  private Bucket(Representation contents) {
    this.contents = contents;
  }

  /** Returns this Bucket's current representation. */
  public Kind kind() {
    return contents.kind();
  }

  /** Returns the number of values in this Bucket. */
  public int cardinality() {
    return contents.cardinality();
  }

  /** Returns true if this Bucket contains no values. */
  public boolean isEmpty() {
    return contents.isEmpty();
  }

  /**
   * Returns true if this Bucket contains {@code low}.
   *
   * <p>{@code low} must be in {@code 0..0xFFFF}.
   */
  public boolean contains(int low) {
    checkLow(low);
    return contents.contains(low);
  }

  /**
   * Returns false if this Bucket already contains {@code low}. Otherwise adds {@code low} and
   * returns true.
   *
   * <p>{@code low} must be in {@code 0..0xFFFF}.
   */
  @CanIgnoreReturnValue
  public boolean add(int low) {
    checkLow(low);
    return contents.add(low);
  }

  /**
   * Returns false if this Bucket does not contain {@code low}. Otherwise removes {@code low} and
   * returns true.
   *
   * <p>{@code low} must be in {@code 0..0xFFFF}.
   */
  @CanIgnoreReturnValue
  public boolean remove(int low) {
    checkLow(low);
    return contents.remove(low);
  }

  /** Removes all values; the Bucket is left Sparse. */
  public void clear() {
    contents = new Sparse();
  }

  /**
   * Switches this Bucket to whichever representation is cheaper for its current cardinality, and
   * returns it.
   */
  @CanIgnoreReturnValue
  public Bucket normalize() {
    convertTo(preferredKind(contents.cardinality()));
    return this;
  }

  /** Returns a new Bucket with the same values as this one and no shared state. */
  public Bucket copy() {
    return new Bucket(contents.copy());
  }

  /** Returns an estimate of the number of heap bytes used by this Bucket. */
  public long sizeInBytes() {
    return SizeOf.object(SizeOf.PTR) + contents.sizeInBytes();
  }

  /** Returns a new, normalized Bucket containing the values that are in both arguments. */
  public static Bucket intersect(Bucket x, Bucket y) {
    return Op.INTERSECTION.apply(x, y);
  }

  /** Returns a new, normalized Bucket containing the values that are in either argument. */
  public static Bucket unite(Bucket x, Bucket y) {
    return Op.UNION.apply(x, y);
  }

  /** Returns the representation that is cheaper for a Bucket with the given number of values. */
  static Kind preferredKind(int cardinality) {
    return (cardinality >= CONVERSION_THRESHOLD) ? Kind.DENSE : Kind.SPARSE;
  }

  /** Converts this Bucket to the given representation, without changing its contents. */
  void convertTo(Kind kind) {
    if (contents.kind() == kind) {
      return;
    } else if (contents instanceof Sparse sparse) {
      contents = sparse.toDense();
    } else {
      contents = ((Dense) contents).toSparse();
    }
  }

  /** Calls {@code action} with each value in this Bucket, in ascending order. */
  void forEach(IntConsumer action) {
    contents.forEach(action);
  }

  /** Returns true if the internal invariants of this Bucket's representation hold. */
  @VisibleForTesting
  boolean isWellFormed() {
    return contents.isWellFormed();
  }

  private static void checkLow(int low) {
    Preconditions.checkArgument((low & ~0xFFFF) == 0, "Not a 16-bit value: %s", low);
  }

  /** Two Buckets are equal if they contain the same values, regardless of representation. */
  @Override
  public boolean equals(Object obj) {
    return (obj instanceof Bucket other) && sameValues(contents, other.contents);
  }

  @Override
  public int hashCode() {
    Hasher hasher = new Hasher();
    contents.forEach(hasher);
    return hasher.hash;
  }

  @Override
  public String toString() {
    RunFormatter formatter = new RunFormatter();
    contents.forEach(formatter::accept);
    return kind() + formatter.build();
  }

  private static boolean sameValues(Representation x, Representation y) {
    if (x instanceof Sparse xSparse && y instanceof Sparse ySparse) {
      return Arrays.equals(xSparse.values, 0, xSparse.size, ySparse.values, 0, ySparse.size);
    } else if (x instanceof Dense xDense && y instanceof Dense yDense) {
      return Arrays.equals(xDense.words, yDense.words);
    }
    Sparse sparse = (Sparse) ((x instanceof Sparse) ? x : y);
    Dense dense = (Dense) ((x instanceof Dense) ? x : y);
    if (sparse.size != dense.cardinality()) {
      return false;
    }
    for (int i = 0; i < sparse.size; i++) {
      if (!dense.contains(sparse.values[i])) {
        return false;
      }
    }
    return true;
  }

  /** Computes a hash from a sequence of values; the same values give the same hash. */
  private static class Hasher implements IntConsumer {
    int hash = 1;

    @Override
    public void accept(int value) {
      hash = hash * 31 + value;
    }
  }

  /**
   * An Op is an elementwise binary operation on Buckets. Each Op chooses an algorithm based on the
   * representations of its arguments; the result is always a new, normalized Bucket that shares no
   * state with either argument.
   */
  public enum Op implements BinaryOperator<Bucket> {
    /** The UNION of two Buckets contains the values that are in either of the arguments. */
    UNION {
      @Override
      Representation apply(Sparse x, Sparse y) {
        int maxSize = x.size + y.size;
        if (maxSize < CONVERSION_THRESHOLD) {
          // The result can't reach the threshold, so a sorted merge gives us the final form.
          char[] values = new char[maxSize];
          int size = Ordered.union(x.values, x.size, y.values, y.size, values);
          return new Sparse(values, size);
        }
        // Optimistically assume that the result will be dense; normalize() fixes it if not.
        Dense result = new Dense();
        x.setAllIn(result);
        y.setAllIn(result);
        return result;
      }

      @Override
      Representation apply(Sparse x, Dense y) {
        Dense result = y.copy();
        x.setAllIn(result);
        return result;
      }

      @Override
      Representation apply(Dense x, Dense y) {
        long[] words = new long[DENSE_WORDS];
        for (int i = 0; i < DENSE_WORDS; i++) {
          words[i] = x.words[i] | y.words[i];
        }
        return new Dense(words);
      }
    },

    /** The INTERSECTION of two Buckets contains the values that are in both of the arguments. */
    INTERSECTION {
      @Override
      Representation apply(Sparse x, Sparse y) {
        int maxSize = Math.min(x.size, y.size);
        if (maxSize == 0) {
          return new Sparse();
        }
        char[] values = new char[maxSize];
        int size = Ordered.intersect(x.values, x.size, y.values, y.size, values);
        return new Sparse(values, size);
      }

      @Override
      Representation apply(Sparse x, Dense y) {
        if (x.size == 0) {
          return new Sparse();
        }
        char[] values = new char[x.size];
        int size = 0;
        for (int i = 0; i < x.size; i++) {
          char v = x.values[i];
          if (y.contains(v)) {
            values[size++] = v;
          }
        }
        return new Sparse(values, size);
      }

      @Override
      Representation apply(Dense x, Dense y) {
        long[] words = new long[DENSE_WORDS];
        for (int i = 0; i < DENSE_WORDS; i++) {
          words[i] = x.words[i] & y.words[i];
        }
        return new Dense(words);
      }
    };

    /**
     * Applies this Op to the given Buckets and returns the (normalized) result. Neither argument is
     * modified; they may be the same Bucket.
     */
    @Override
    public final Bucket apply(Bucket x, Bucket y) {
      return new Bucket(apply(x.contents, y.contents)).normalize();
    }

    /** Chooses the implementation for this pair of representations. */
    final Representation apply(Representation x, Representation y) {
      if (x instanceof Sparse xSparse) {
        if (y instanceof Sparse ySparse) {
          return apply(xSparse, ySparse);
        } else {
          return apply(xSparse, (Dense) y);
        }
      } else if (y instanceof Sparse ySparse) {
        // Both Ops are symmetric, so we only need to implement one of the mixed cases.
        return apply(ySparse, (Dense) x);
      } else {
        return apply((Dense) x, (Dense) y);
      }
    }

    abstract Representation apply(Sparse x, Sparse y);

    abstract Representation apply(Sparse x, Dense y);

    abstract Representation apply(Dense x, Dense y);
  }

  /** The contents of a Bucket: always exactly one of Sparse or Dense. */
  private abstract static sealed class Representation permits Sparse, Dense {
    abstract Kind kind();

    abstract int cardinality();

    abstract boolean isEmpty();

    abstract boolean contains(int low);

    abstract boolean add(int low);

    abstract boolean remove(int low);

    abstract Representation copy();

    /** Calls {@code action} with each value, in ascending order. */
    abstract void forEach(IntConsumer action);

    abstract long sizeInBytes();

    abstract boolean isWellFormed();
  }

  /** Holds the values in ascending order, without duplicates, in {@code values[0..size-1]}. */
  private static final class Sparse extends Representation {
    private static final char[] EMPTY_VALUES = new char[0];

    /** The first {@link #size} elements are in use; the rest are unspecified. */
    char[] values;

    int size;

    Sparse() {
      this(EMPTY_VALUES, 0);
    }

    /** Takes ownership of the given array. */
    Sparse(char[] values, int size) {
      this.values = values;
      this.size = size;
      assert isWellFormed();
    }

    @Override
    Kind kind() {
      return Kind.SPARSE;
    }

    @Override
    int cardinality() {
      return size;
    }

    @Override
    boolean isEmpty() {
      return size == 0;
    }

    @Override
    boolean contains(int low) {
      return Ordered.search(low, values, size) >= 0;
    }

    @Override
    boolean add(int low) {
      int pos = Ordered.search(low, values, size);
      if (pos >= 0) {
        return false;
      }
      pos = -(pos + 1);
      if (size == values.length) {
        values = Arrays.copyOf(values, grownLength(size));
      }
      // Shift up everything from the insertion point to keep values sorted.
      System.arraycopy(values, pos, values, pos + 1, size - pos);
      values[pos] = (char) low;
      ++size;
      assert isWellFormed();
      return true;
    }

    @Override
    boolean remove(int low) {
      int pos = Ordered.search(low, values, size);
      if (pos < 0) {
        return false;
      }
      --size;
      System.arraycopy(values, pos + 1, values, pos, size - pos);
      assert isWellFormed();
      return true;
    }

    /** Grows by about 50%, but never past {@link #CAPACITY}. */
    private static int grownLength(int length) {
      assert length < CAPACITY;
      return Math.min(CAPACITY, length + (length >> 1) + 4);
    }

    /** Sets the bit for each of our values in {@code dense}. */
    void setAllIn(Dense dense) {
      for (int i = 0; i < size; i++) {
        dense.set(values[i]);
      }
    }

    Dense toDense() {
      Dense result = new Dense();
      setAllIn(result);
      return result;
    }

    @Override
    Sparse copy() {
      return (size == 0) ? new Sparse() : new Sparse(Arrays.copyOf(values, size), size);
    }

    @Override
    void forEach(IntConsumer action) {
      for (int i = 0; i < size; i++) {
        action.accept(values[i]);
      }
    }

    @Override
    long sizeInBytes() {
      return SizeOf.object(SizeOf.PTR + SizeOf.INT) + SizeOf.array(values);
    }

    @Override
    boolean isWellFormed() {
      return size >= 0
          && size <= values.length
          && values.length <= CAPACITY
          && Ordered.isStrictlyAscending(values, size);
    }
  }

  /** Holds value {@code v} as bit {@code v % 64} of {@code words[v / 64]}. */
  private static final class Dense extends Representation {
    final long[] words;

    Dense() {
      this(new long[DENSE_WORDS]);
    }

    /** Takes ownership of the given array. */
    Dense(long[] words) {
      this.words = words;
      assert isWellFormed();
    }

    @Override
    Kind kind() {
      return Kind.DENSE;
    }

    @Override
    int cardinality() {
      int result = 0;
      for (long w : words) {
        result += Long.bitCount(w);
      }
      return result;
    }

    @Override
    boolean isEmpty() {
      for (long w : words) {
        if (w != 0) {
          return false;
        }
      }
      return true;
    }

    @Override
    boolean contains(int low) {
      return (words[low / Long.SIZE] & (1L << (low % Long.SIZE))) != 0;
    }

    @Override
    boolean add(int low) {
      int word = low / Long.SIZE;
      long b = words[word];
      long bNew = b | (1L << (low % Long.SIZE));
      words[word] = bNew;
      return b != bNew;
    }

    @Override
    boolean remove(int low) {
      int word = low / Long.SIZE;
      long b = words[word];
      long bNew = b & ~(1L << (low % Long.SIZE));
      words[word] = bNew;
      return b != bNew;
    }

    /** Equivalent to {@link #add}, without the result. */
    void set(int low) {
      words[low / Long.SIZE] |= 1L << (low % Long.SIZE);
    }

    Sparse toSparse() {
      int n = cardinality();
      if (n == 0) {
        return new Sparse();
      }
      char[] values = new char[n];
      int pos = 0;
      for (int i = 0; i < DENSE_WORDS; i++) {
        for (long w = words[i]; w != 0; w &= (w - 1)) {
          values[pos++] = (char) (i * Long.SIZE + Long.numberOfTrailingZeros(w));
        }
      }
      assert pos == n;
      return new Sparse(values, n);
    }

    @Override
    Dense copy() {
      return new Dense(words.clone());
    }

    @Override
    void forEach(IntConsumer action) {
      for (int i = 0; i < DENSE_WORDS; i++) {
        for (long w = words[i]; w != 0; w &= (w - 1)) {
          action.accept(i * Long.SIZE + Long.numberOfTrailingZeros(w));
        }
      }
    }

    @Override
    long sizeInBytes() {
      return SizeOf.object(SizeOf.PTR) + SizeOf.array(words);
    }

    @Override
    boolean isWellFormed() {
      return words.length == DENSE_WORDS;
    }
  }
}
