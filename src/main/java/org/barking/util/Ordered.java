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
 * A static-only class with methods for working with {@code char[]} prefixes whose elements are
 * unsigned 16-bit values in strictly ascending order (no duplicates).
 *
 * <p>Each method takes the array together with the number of elements in use; elements past that
 * point are ignored.
 */
public class Ordered {

  /**
   * Searches {@code values[0..size-1]} for {@code key}, assuming that they are strictly increasing.
   * If a match is found, returns its index; otherwise returns {@code -(i+1)} where {@code i} is the
   * index at which {@code key} should be inserted to preserve ordering.
   */
  public static int search(int key, char[] values, int size) {
    assert size <= values.length;
    int start = 0;
    int limit = size;
    // Values are distinct and non-negative, so key can't be found at an index greater than key.
    if (limit > key + 1) {
      limit = key + 1;
    }
    while (start < limit) {
      int mid = (start + limit) >>> 1;
      int v = values[mid];
      if (v < key) {
        start = mid + 1;
      } else if (v > key) {
        limit = mid;
      } else {
        return mid;
      }
    }
    return -(start + 1);
  }

  /**
   * Stores the values that appear in both {@code x[0..xSize-1]} and {@code y[0..ySize-1]} in
   * {@code dst}, in ascending order, and returns how many were stored.
   *
   * <p>{@code dst} must have room for at least {@code min(xSize, ySize)} elements.
   */
  public static int intersect(char[] x, int xSize, char[] y, int ySize, char[] dst) {
    assert dst.length >= Math.min(xSize, ySize);
    int i = 0;
    int j = 0;
    int n = 0;
    while (i < xSize && j < ySize) {
      char xv = x[i];
      char yv = y[j];
      if (xv < yv) {
        i++;
      } else if (xv > yv) {
        j++;
      } else {
        dst[n++] = xv;
        i++;
        j++;
      }
    }
    return n;
  }

  /**
   * Stores the values that appear in either {@code x[0..xSize-1]} or {@code y[0..ySize-1]} in
   * {@code dst}, in ascending order and without duplicates, and returns how many were stored.
   *
   * <p>{@code dst} must have room for at least {@code xSize + ySize} elements, and must not be
   * {@code x} or {@code y}.
   */
  public static int union(char[] x, int xSize, char[] y, int ySize, char[] dst) {
    assert dst.length >= xSize + ySize && dst != x && dst != y;
    int i = 0;
    int j = 0;
    int n = 0;
    while (i < xSize && j < ySize) {
      char xv = x[i];
      char yv = y[j];
      if (xv < yv) {
        dst[n++] = xv;
        i++;
      } else if (xv > yv) {
        dst[n++] = yv;
        j++;
      } else {
        dst[n++] = xv;
        i++;
        j++;
      }
    }
    // At most one of these has anything left to copy.
    System.arraycopy(x, i, dst, n, xSize - i);
    n += xSize - i;
    System.arraycopy(y, j, dst, n, ySize - j);
    n += ySize - j;
    return n;
  }

  /** Returns true if {@code values[0..size-1]} is strictly increasing. */
  public static boolean isStrictlyAscending(char[] values, int size) {
    for (int i = 1; i < size; i++) {
      if (values[i - 1] >= values[i]) {
        return false;
      }
    }
    return true;
  }

  private Ordered() {}
}
