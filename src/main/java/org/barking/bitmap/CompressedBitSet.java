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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import org.barking.util.SizeOf;
import org.jspecify.annotations.Nullable;

/**
 * A CompressedBitSet is a mutable set of unsigned 32-bit integers, stored as 65,536 {@link
 * Bucket}s: each value {@code v} is held as {@code v & 0xFFFF} in bucket {@code v >>> 16}.
 *
 * <p>Values are passed as Java ints, which are interpreted as unsigned; e.g. {@code -1} represents
 * 4294967295. Every int is a valid value, so none of these methods throw for any argument.
 *
 * <p>{@link #intersect} and {@link #unite} combine each pair of corresponding buckets
 * independently, choosing an algorithm based on the buckets' representations (see {@link
 * Bucket.Op}). {@link #add} and {@link #remove} never change a bucket's representation; call
 * {@link #normalize} to compact every bucket after a large batch of mutations.
 *
 * <p>CompressedBitSets are not thread-safe; callers that share one between threads must provide
 * their own locking around each operation.
 */
public final class CompressedBitSet {

  /** The number of buckets, one for each possible high half of a value. */
  public static final int NUM_BUCKETS = 1 << 16;

  /** Stands in for an absent bucket when combining sets; never stored or modified. */
  private static final Bucket EMPTY_BUCKET = new Bucket();

  /**
   * Buckets are allocated on first use; a null element is equivalent to an empty Bucket. Non-null
   * buckets are never shared with another CompressedBitSet.
   */
  private final @Nullable Bucket[] buckets = new Bucket[NUM_BUCKETS];

  /** Creates an empty CompressedBitSet. */
  public CompressedBitSet() {}

  /** Returns a new CompressedBitSet containing the given values. */
  public static CompressedBitSet of(int... values) {
    CompressedBitSet result = new CompressedBitSet();
    for (int v : values) {
      result.add(v);
    }
    return result;
  }

  /** Returns the index of the bucket that holds {@code value}. */
  public static int high(int value) {
    return value >>> 16;
  }

  /** Returns the representation of {@code value} within its bucket. */
  public static int low(int value) {
    return value & 0xFFFF;
  }

  /** Returns true if this set contains {@code value}. */
  public boolean contains(int value) {
    Bucket bucket = buckets[high(value)];
    return bucket != null && bucket.contains(low(value));
  }

  /**
   * Returns false if this set already contains {@code value}. Otherwise adds {@code value} and
   * returns true.
   */
  @CanIgnoreReturnValue
  public boolean add(int value) {
    int high = high(value);
    Bucket bucket = buckets[high];
    if (bucket == null) {
      bucket = new Bucket();
      buckets[high] = bucket;
    }
    return bucket.add(low(value));
  }

  /**
   * Returns false if this set does not contain {@code value}. Otherwise removes {@code value} and
   * returns true.
   */
  @CanIgnoreReturnValue
  public boolean remove(int value) {
    Bucket bucket = buckets[high(value)];
    return bucket != null && bucket.remove(low(value));
  }

  /** Removes all values from this set. */
  public void clear() {
    Arrays.fill(buckets, null);
  }

  /** Removes each value from this set that is not also in {@code other}. */
  public void intersect(CompressedBitSet other) {
    combine(Bucket.Op.INTERSECTION, other);
  }

  /** Adds each value in {@code other} to this set. */
  public void unite(CompressedBitSet other) {
    combine(Bucket.Op.UNION, other);
  }

  /**
   * Replaces each of our buckets with the result of applying {@code op} to it and the
   * corresponding bucket of {@code other}.
   */
  private void combine(Bucket.Op op, CompressedBitSet other) {
    // other may be this; that's OK since op.apply() never modifies its arguments.
    for (int i = 0; i < NUM_BUCKETS; i++) {
      Bucket mine = buckets[i];
      Bucket theirs = other.buckets[i];
      if (mine == null && theirs == null) {
        continue;
      }
      Bucket result =
          op.apply(
              (mine == null) ? EMPTY_BUCKET : mine, (theirs == null) ? EMPTY_BUCKET : theirs);
      buckets[i] = result.isEmpty() ? null : result;
    }
  }

  /** Switches every bucket to the representation that is cheapest for its current contents. */
  public void normalize() {
    for (int i = 0; i < NUM_BUCKETS; i++) {
      Bucket bucket = buckets[i];
      if (bucket != null) {
        buckets[i] = bucket.isEmpty() ? null : bucket.normalize();
      }
    }
  }

  /** Returns the number of values in this set. */
  public long cardinality() {
    long result = 0;
    for (Bucket bucket : buckets) {
      if (bucket != null) {
        result += bucket.cardinality();
      }
    }
    return result;
  }

  /** Returns true if this set contains no values. */
  public boolean isEmpty() {
    for (Bucket bucket : buckets) {
      if (bucket != null && !bucket.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the current representation of the bucket that would hold {@code value}. An unused
   * bucket is reported as {@link Bucket.Kind#SPARSE}.
   */
  public Bucket.Kind kindOf(int value) {
    Bucket bucket = buckets[high(value)];
    return (bucket == null) ? Bucket.Kind.SPARSE : bucket.kind();
  }

  /** Returns a new CompressedBitSet with the same values as this one and no shared state. */
  public CompressedBitSet copy() {
    CompressedBitSet result = new CompressedBitSet();
    for (int i = 0; i < NUM_BUCKETS; i++) {
      Bucket bucket = buckets[i];
      if (bucket != null) {
        result.buckets[i] = bucket.copy();
      }
    }
    return result;
  }

  /** Returns an estimate of the number of heap bytes used by this set. */
  public long sizeInBytes() {
    long result = SizeOf.object(SizeOf.PTR) + SizeOf.array(NUM_BUCKETS, SizeOf.PTR);
    for (Bucket bucket : buckets) {
      if (bucket != null) {
        result += bucket.sizeInBytes();
      }
    }
    return result;
  }

  /** Two CompressedBitSets are equal if they contain the same values. */
  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof CompressedBitSet other)) {
      return false;
    }
    for (int i = 0; i < NUM_BUCKETS; i++) {
      Bucket mine = buckets[i];
      Bucket theirs = other.buckets[i];
      if (mine == null) {
        if (theirs != null && !theirs.isEmpty()) {
          return false;
        }
      } else if (theirs == null ? !mine.isEmpty() : !mine.equals(theirs)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = 1;
    for (int i = 0; i < NUM_BUCKETS; i++) {
      Bucket bucket = buckets[i];
      // Empty buckets must not contribute, since they're equivalent to missing ones.
      if (bucket != null && !bucket.isEmpty()) {
        result = (result * 31 + i) * 31 + bucket.hashCode();
      }
    }
    return result;
  }

  /** Returns the values in this set in ascending (unsigned) order, e.g. {@code {5, 10..20}}. */
  @Override
  public String toString() {
    RunFormatter formatter = new RunFormatter();
    for (int i = 0; i < NUM_BUCKETS; i++) {
      Bucket bucket = buckets[i];
      if (bucket != null) {
        long base = ((long) i) << 16;
        bucket.forEach(low -> formatter.accept(base | low));
      }
    }
    return formatter.build();
  }
}
