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

import java.util.function.LongConsumer;

/**
 * Renders the members of a bitmap, given in ascending unsigned order, as a brace-enclosed list.
 * Values are taken as longs so that members above {@code Integer.MAX_VALUE} print as unsigned
 * 32-bit numbers. Three or more consecutive members collapse to {@code first..last}; two print
 * separately, e.g. {@code {1..4, 10, 11, 4294967295}}.
 */
class RunFormatter implements LongConsumer {
  private final StringBuilder sb = new StringBuilder("{");

  /** The first member of the run being accumulated, or -1 before any member has been seen. */
  private long first = -1;

  /** The last member of the run being accumulated; only meaningful if {@code first >= 0}. */
  private long last;

  @Override
  public void accept(long member) {
    if (first >= 0) {
      assert member > last;
      if (member == last + 1) {
        last = member;
        return;
      }
      flushRun();
    }
    first = member;
    last = member;
  }

  /** Appends the pending run, preceded by a separator unless it is the first. */
  private void flushRun() {
    if (sb.length() > 1) {
      sb.append(", ");
    }
    sb.append(first);
    long length = last - first + 1;
    if (length == 2) {
      sb.append(", ").append(last);
    } else if (length > 2) {
      sb.append("..").append(last);
    }
  }

  /** Returns the rendering of all members accepted so far; call at most once. */
  String build() {
    if (first >= 0) {
      flushRun();
    }
    return sb.append('}').toString();
  }
}
