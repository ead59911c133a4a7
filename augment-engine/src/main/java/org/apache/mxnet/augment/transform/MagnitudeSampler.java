/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.mxnet.augment.transform;

import java.util.Random;

/** Turns a bin of an {@link AugmentationEntry} into a concrete magnitude. */
public final class MagnitudeSampler {

    private MagnitudeSampler() {}

    /**
     * Returns the magnitude of the given bin, negated with probability 0.5 for signed entries.
     *
     * <p>Magnitude-free entries always give {@code 0.0} and draw nothing from {@code random}.
     *
     * @param entry the entry of the operation
     * @param bins the number of bins the magnitude range is split into
     * @param binIndex the bin to use
     * @param params the dimensions of the image being augmented
     * @param random the source of randomness for the sign
     * @return the magnitude
     * @throws IllegalArgumentException if {@code binIndex} is not in {@code [0, bins)}
     */
    public static double sample(
            AugmentationEntry entry,
            int bins,
            int binIndex,
            SamplingParams params,
            Random random) {
        if (entry.isMagnitudeFree()) {
            return 0.0;
        }
        if (binIndex < 0 || binIndex >= bins) {
            throw new IllegalArgumentException(
                    "Magnitude bin " + binIndex + " is out of range [0, " + bins + ')');
        }
        double magnitude = entry.magnitudes(bins, params.getHeight(), params.getWidth())[binIndex];
        if (entry.isSigned() && random.nextDouble() <= 0.5) {
            magnitude = -magnitude;
        }
        return magnitude;
    }

    /**
     * Draws a bin uniformly from {@code [0, binRange)} and returns its magnitude.
     *
     * @param entry the entry of the operation
     * @param bins the number of bins the magnitude range is split into
     * @param binRange the number of lowest bins to draw from, at most {@code bins}
     * @param params the dimensions of the image being augmented
     * @param random the source of randomness
     * @return the magnitude
     */
    public static double sampleRandomBin(
            AugmentationEntry entry,
            int bins,
            int binRange,
            SamplingParams params,
            Random random) {
        if (entry.isMagnitudeFree()) {
            return 0.0;
        }
        return sample(entry, bins, random.nextInt(binRange), params, random);
    }
}
