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
import org.apache.mxnet.augment.api.ndarray.NDImage;
import org.apache.mxnet.augment.image.Interpolation;

/** {@code TrivialAugmentWide} applies a single random operation with a random magnitude. */
public class TrivialAugmentWide extends AutoAugmentBase {

    private final int numMagnitudeBins;

    TrivialAugmentWide(Builder builder) {
        super(builder.interpolation, builder.fill);
        numMagnitudeBins = builder.numMagnitudeBins;
    }

    /**
     * Creates a builder to build a {@code TrivialAugmentWide}.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** {@inheritDoc} */
    @Override
    protected NDImage transformImage(NDImage image, SamplingParams params, Random random) {
        OperationEntry choice = AugmentationSpace.TRIVIAL_AUGMENT_WIDE.randomEntry(random);
        double magnitude =
                MagnitudeSampler.sampleRandomBin(
                        choice.getEntry(), numMagnitudeBins, numMagnitudeBins, params, random);
        return applyOperation(image, choice.getOperation(), magnitude);
    }

    /**
     * Returns the number of bins the magnitude ranges are split into.
     *
     * @return the number of bins
     */
    public int getNumMagnitudeBins() {
        return numMagnitudeBins;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "TrivialAugmentWide(num_magnitude_bins="
                + numMagnitudeBins
                + ", interpolation="
                + getInterpolation()
                + ", fill="
                + getFill()
                + ')';
    }

    /** The Builder to construct a {@link TrivialAugmentWide} object. */
    public static final class Builder extends BaseBuilder<Builder> {

        int numMagnitudeBins = 31;

        Builder() {
            super(Interpolation.NEAREST);
        }

        /**
         * Sets the number of bins the magnitude ranges are split into, 31 by default.
         *
         * @param numMagnitudeBins the number of bins
         * @return this {@code Builder}
         */
        public Builder optNumMagnitudeBins(int numMagnitudeBins) {
            this.numMagnitudeBins = numMagnitudeBins;
            return this;
        }

        /** {@inheritDoc} */
        @Override
        protected Builder self() {
            return this;
        }

        /**
         * Builds a {@link TrivialAugmentWide}.
         *
         * @return a new {@link TrivialAugmentWide}
         * @throws IllegalArgumentException if there is no bin
         */
        public TrivialAugmentWide build() {
            if (numMagnitudeBins < 1) {
                throw new IllegalArgumentException(
                        "numMagnitudeBins must be >= 1, got " + numMagnitudeBins);
            }
            return new TrivialAugmentWide(this);
        }
    }
}
