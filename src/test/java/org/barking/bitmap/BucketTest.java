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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import java.util.function.IntPredicate;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.barking.bitmap.Bucket.Kind;
import org.barking.util.SizeOf;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class BucketTest {

  /** Asserts that {@code bucket} contains exactly the lows matching {@code expected}. */
  private static void checkContents(Bucket bucket, IntPredicate expected) {
    int count = 0;
    for (int low = 0; low < Bucket.CAPACITY; low++) {
      boolean isExpected = expected.test(low);
      if (bucket.contains(low) != isExpected) {
        assertWithMessage("contains(%s)", low).that(bucket.contains(low)).isEqualTo(isExpected);
      }
      if (isExpected) {
        ++count;
      }
    }
    assertThat(bucket.cardinality()).isEqualTo(count);
    assertThat(bucket.isWellFormed()).isTrue();
  }

  /** Returns a Bucket containing the given values, converted to the given representation. */
  static Bucket bucketOf(Kind kind, int... lows) {
    Bucket bucket = new Bucket();
    for (int low : lows) {
      bucket.add(low);
    }
    bucket.convertTo(kind);
    return bucket;
  }

  @Test
  public void addKeepsValuesSorted() {
    Bucket bucket = new Bucket();
    assertThat(bucket.add(50)).isTrue();
    assertThat(bucket.add(3)).isTrue();
    assertThat(bucket.add(0xFFFF)).isTrue();
    assertThat(bucket.add(40000)).isTrue();
    // A second add of the same value is a no-op.
    assertThat(bucket.add(3)).isFalse();
    assertThat(bucket.add(0)).isTrue();
    assertThat(bucket.toString()).isEqualTo("SPARSE{0, 3, 50, 40000, 65535}");
    assertThat(bucket.isWellFormed()).isTrue();
    // contains() relies on binary search, so each value must be found no matter the add order.
    for (int low : new int[] {0, 3, 50, 40000, 0xFFFF}) {
      assertThat(bucket.contains(low)).isTrue();
    }
    assertThat(bucket.contains(4)).isFalse();
    assertThat(bucket.cardinality()).isEqualTo(5);
  }

  @Test
  @Parameters({"SPARSE", "DENSE"})
  @TestCaseName("addAndRemove_{0}")
  public void addAndRemove(Kind kind) {
    Bucket bucket = bucketOf(kind, 1, 2, 3, 100, 0xFFFF);
    assertThat(bucket.kind()).isEqualTo(kind);
    assertThat(bucket.remove(2)).isTrue();
    assertThat(bucket.remove(2)).isFalse();
    // Removing an absent value is a no-op.
    assertThat(bucket.remove(99)).isFalse();
    assertThat(bucket.add(99)).isTrue();
    assertThat(bucket.add(99)).isFalse();
    assertThat(bucket.remove(0xFFFF)).isTrue();
    assertThat(bucket.remove(1)).isTrue();
    checkContents(bucket, low -> low == 3 || low == 99 || low == 100);
    // Neither add() nor remove() changes the representation.
    assertThat(bucket.kind()).isEqualTo(kind);
  }

  @Test
  public void addNeverConverts() {
    Bucket bucket = new Bucket();
    for (int low = 0; low < 5000; low++) {
      bucket.add(low * 3);
    }
    assertThat(bucket.kind()).isEqualTo(Kind.SPARSE);
    assertThat(bucket.cardinality()).isEqualTo(5000);
    assertThat(bucket.normalize().kind()).isEqualTo(Kind.DENSE);
    // Removing values doesn't convert it back, until it's normalized again.
    for (int low = 0; low < 1000; low++) {
      bucket.remove(low * 3);
    }
    assertThat(bucket.kind()).isEqualTo(Kind.DENSE);
    assertThat(bucket.normalize().kind()).isEqualTo(Kind.SPARSE);
    checkContents(bucket, low -> low % 3 == 0 && low >= 3000 && low < 15000);
  }

  /** Bucket sizes around the conversion threshold. */
  private static Object[] thresholdSizes() {
    return new Object[] {
      Bucket.CONVERSION_THRESHOLD - 1, Bucket.CONVERSION_THRESHOLD, Bucket.CONVERSION_THRESHOLD + 1
    };
  }

  /**
   * Adds {@code size} values to a bucket and checks that membership is correct both before and
   * after normalizing, and again after converting back.
   */
  @Test
  @Parameters(method = "thresholdSizes")
  @TestCaseName("thresholdCrossover_{0}")
  public void thresholdCrossover(int size) {
    // Multiples of 13 are spread over the whole range; add them in a scrambled order.
    Bucket bucket = new Bucket();
    for (int i = 0; i < size; i++) {
      int j = (i * 7919) % size;
      bucket.add(j * 13);
    }
    IntPredicate expected = low -> low % 13 == 0 && low / 13 < size;
    checkContents(bucket, expected);
    bucket.normalize();
    Kind expectedKind = (size >= Bucket.CONVERSION_THRESHOLD) ? Kind.DENSE : Kind.SPARSE;
    assertThat(bucket.kind()).isEqualTo(expectedKind);
    checkContents(bucket, expected);
    // Conversions are lossless in both directions.
    bucket.convertTo(Kind.SPARSE);
    checkContents(bucket, expected);
    bucket.convertTo(Kind.DENSE);
    checkContents(bucket, expected);
  }

  @Test
  public void fullBucket() {
    Bucket bucket = new Bucket();
    for (int low = 0; low < Bucket.CAPACITY; low++) {
      bucket.add(low);
    }
    assertThat(bucket.cardinality()).isEqualTo(Bucket.CAPACITY);
    assertThat(bucket.isWellFormed()).isTrue();
    assertThat(bucket.toString()).isEqualTo("SPARSE{0..65535}");
    bucket.normalize();
    assertThat(bucket.toString()).isEqualTo("DENSE{0..65535}");
    assertThat(bucket.add(12345)).isFalse();
  }

  @Test
  public void clear() {
    Bucket bucket = bucketOf(Kind.DENSE, 7, 8, 9);
    bucket.clear();
    assertThat(bucket.kind()).isEqualTo(Kind.SPARSE);
    assertThat(bucket.isEmpty()).isTrue();
    assertThat(bucket.contains(8)).isFalse();
    assertThat(bucket.toString()).isEqualTo("SPARSE{}");
  }

  @Test
  public void emptyBuckets() {
    Bucket sparse = new Bucket();
    Bucket dense = bucketOf(Kind.DENSE);
    assertThat(sparse.isEmpty()).isTrue();
    assertThat(dense.isEmpty()).isTrue();
    assertThat(dense.cardinality()).isEqualTo(0);
    assertThat(sparse).isEqualTo(dense);
    assertThat(dense.normalize().kind()).isEqualTo(Kind.SPARSE);
    assertThat(sparse.normalize().kind()).isEqualTo(Kind.SPARSE);
  }

  @Test
  public void lowValueOutOfRange() {
    Bucket bucket = new Bucket();
    assertThrows(IllegalArgumentException.class, () -> bucket.add(Bucket.CAPACITY));
    assertThrows(IllegalArgumentException.class, () -> bucket.remove(-1));
    assertThrows(IllegalArgumentException.class, () -> bucket.contains(0x12345));
    assertThat(bucket.isEmpty()).isTrue();
  }

  @Test
  public void equalityIgnoresRepresentation() {
    Bucket sparse = bucketOf(Kind.SPARSE, 1, 64, 65, 4000, 0xFFFF);
    Bucket dense = bucketOf(Kind.DENSE, 1, 64, 65, 4000, 0xFFFF);
    assertThat(sparse).isEqualTo(dense);
    assertThat(dense).isEqualTo(sparse);
    assertThat(sparse.hashCode()).isEqualTo(dense.hashCode());
    assertThat(dense.toString()).isEqualTo("DENSE{1, 64, 65, 4000, 65535}");
    dense.remove(4000);
    assertThat(sparse).isNotEqualTo(dense);
    dense.add(4001);
    assertThat(dense).isNotEqualTo(sparse);
    assertThat(sparse).isNotEqualTo(bucketOf(Kind.SPARSE, 1, 64, 65, 4000));
  }

  @Test
  @Parameters({"SPARSE", "DENSE"})
  @TestCaseName("copyIsIndependent_{0}")
  public void copyIsIndependent(Kind kind) {
    Bucket original = bucketOf(kind, 10, 20, 30);
    Bucket copy = original.copy();
    assertThat(copy).isEqualTo(original);
    assertThat(copy.kind()).isEqualTo(kind);
    copy.add(40);
    copy.remove(10);
    checkContents(original, low -> low == 10 || low == 20 || low == 30);
  }

  @Test
  public void sizeInBytes() {
    // At the threshold the sparse payload costs exactly as much as the dense one.
    assertThat(SizeOf.array(Bucket.CONVERSION_THRESHOLD, SizeOf.CHAR))
        .isEqualTo(SizeOf.array(Bucket.DENSE_WORDS, SizeOf.LONG));
    long denseSize = bucketOf(Kind.DENSE, 1).sizeInBytes();
    assertThat(denseSize).isEqualTo(8240L);
    Bucket sparse = new Bucket();
    assertThat(sparse.sizeInBytes()).isEqualTo(56L);
    for (int low = 0; low < 1000; low++) {
      sparse.add(low);
    }
    assertThat(sparse.sizeInBytes()).isGreaterThan(2000L);
    assertThat(sparse.sizeInBytes()).isLessThan(denseSize);
  }

  @Test
  public void preferredKind() {
    assertThat(Bucket.preferredKind(0)).isEqualTo(Kind.SPARSE);
    assertThat(Bucket.preferredKind(Bucket.CONVERSION_THRESHOLD - 1)).isEqualTo(Kind.SPARSE);
    assertThat(Bucket.preferredKind(Bucket.CONVERSION_THRESHOLD)).isEqualTo(Kind.DENSE);
    assertThat(Bucket.preferredKind(Bucket.CAPACITY)).isEqualTo(Kind.DENSE);
  }
}
