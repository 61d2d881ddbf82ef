// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.pyveil.obfuscate;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Random;
import javax.annotation.Nullable;

/**
 * The single stream of random decisions of one run. With a seed, two runs over the same input and
 * config draw the same values in the same order and so produce the same output.
 */
public final class RandomSource {

  private final Random random;

  public RandomSource(@Nullable Long seed) {
    this.random = seed == null ? new Random() : new Random(seed);
  }

  /** Returns a uniform int in {@code [lo, hi]}. */
  public int nextInt(int lo, int hi) {
    Preconditions.checkArgument(lo <= hi, "empty range [%s, %s]", lo, hi);
    return lo + random.nextInt(hi - lo + 1);
  }

  /** Returns a uniform double in {@code [0, 1)}. */
  public double nextDouble() {
    return random.nextDouble();
  }

  /**
   * Decides whether an occurrence gated by {@code rate} fires. One value is consumed whatever the
   * rate, so changing a rate does not shift the decisions that follow.
   */
  public boolean draw(double rate) {
    double d = random.nextDouble();
    return rate >= 1.0 || d < rate;
  }

  /** Returns a uniformly chosen element. */
  public <T> T choose(List<T> values) {
    Preconditions.checkArgument(!values.isEmpty(), "nothing to choose from");
    return values.get(random.nextInt(values.size()));
  }
}
