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

package org.barking.util;

/**
 * Static-only class with constants and methods for estimating the heap footprint of the objects a
 * bitmap is built from.
 *
 * <p>The estimates assume compressed pointers, which is the common case for heaps under 32GB.
 */
public class SizeOf {

  // Statics only
  private SizeOf() {}

  /** The number of bytes required for a pointer. */
  public static final int PTR = 4;

  /** The number of bytes required for a char (one unsigned 16-bit value). */
  public static final int CHAR = 2;

  /** The number of bytes required for an int. */
  public static final int INT = 4;

  /** The number of bytes required for a long. */
  public static final int LONG = 8;

  /** The number of additional bytes stored with a non-array object. */
  public static final int OBJECT_HEADER = 12;

  /** The number of additional bytes stored with an array object. */
  public static final int ARRAY_HEADER = 16;

  /** Rounds up to the nearest multiple of 8, the minimum unit of Java memory allocation. */
  public static long roundedAllocSize(long size) {
    return (size + 7) & ~7;
  }

  /**
   * Returns the number of bytes required for a java object, given the number of bytes required for
   * its fields.
   */
  public static long object(long fieldsSize) {
    return roundedAllocSize(OBJECT_HEADER + fieldsSize);
  }

  /**
   * Returns the number of bytes required for a Java array, given the number of elements and the
   * size of each element.
   *
   * <p>The elementSize should not be the size of an object referred to; those objects must be
   * accounted for separately.
   */
  public static long array(long length, long elementSize) {
    // Taken as longs so that the multiplication can't overflow.
    return roundedAllocSize(ARRAY_HEADER + length * elementSize);
  }

  /** Returns the number of bytes required for the given char[], or 0 if it is null. */
  public static long array(char[] array) {
    return (array == null) ? 0 : array(array.length, CHAR);
  }

  /** Returns the number of bytes required for the given long[], or 0 if it is null. */
  public static long array(long[] array) {
    return (array == null) ? 0 : array(array.length, LONG);
  }
}
