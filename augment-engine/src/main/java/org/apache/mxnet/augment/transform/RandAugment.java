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

/**
 * {@code RandAugment} applies a chain of operations drawn uniformly at random, each with a
 * random magnitude bin and without probability gating.
 */
public class RandAugment extends AutoAugmentBase {

    private final int numOps;
    private final int magnitude;
    private final int numMagnitudeBins;

    RandAugment(Builder builder) {
        super(builder.interpolation, builder.fill);
        numOps = builder.numOps;
        magnitude = builder.magnitude;
        numMagnitudeBins = builder.numMagnitudeBins;
    }

    /**
     * Creates a builder to build a {@code RandAugment}.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** {@inheritDoc} */
    @Override
    protected NDImage transformImage(NDImage image, SamplingParams params, Random random) {
        NDImage result = image;
        for (int i = 0; i < numOps; ++i) {
            OperationEntry choice = AugmentationSpace.RAND_AUGMENT.randomEntry(random);
            double m =
                    MagnitudeSampler.sampleRandomBin(
                            choice.getEntry(), numMagnitudeBins, numMagnitudeBins, params, random);
            result = applyOperation(result, choice.getOperation(), m);
        }
        return result;
    }

    /**
     * Returns the number of operations applied in a row.
     *
     * @return the number of operations
     */
    public int getNumOps() {
        return numOps;
    }

    /**
     * Returns the configured magnitude.
     *
     * <p>Bins are drawn at random on every call, so this value does not affect the output.
     *
     * @return the configured magnitude
     */
    public int getMagnitude() {
        return magnitude;
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
        return "RandAugment(num_ops="
                + numOps
                + ", magnitude="
                + magnitude
                + ", num_magnitude_bins="
                + numMagnitudeBins
                + ", interpolation="
                + getInterpolation()
                + ", fill="
                + getFill()
                + ')';
    }

    /** The Builder to construct a {@link RandAugment} object. */
    public static final class Builder extends BaseBuilder<Builder> {

        int numOps = 2;
        int magnitude = 9;
        int numMagnitudeBins = 31;

        Builder() {
            super(Interpolation.NEAREST);
        }

        /**
         * Sets the number of operations applied per call, 2 by default.
         *
         * @param numOps the number of operations
         * @return this {@code Builder}
         */
        public Builder optNumOps(int numOps) {
            this.numOps = numOps;
            return this;
        }

        /**
         * Sets the magnitude, 9 by default.
         *
         * @param magnitude the magnitude
         * @return this {@code Builder}
         */
        public Builder optMagnitude(int magnitude) {
            this.magnitude = magnitude;
            return this;
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
         * Builds a {@link RandAugment}.
         *
         * @return a new {@link RandAugment}
         * @throws IllegalArgumentException if {@code numOps} is negative or there is no bin
         */
        public RandAugment build() {
            if (numOps < 0) {
                throw new IllegalArgumentException("numOps must be >= 0, got " + numOps);
            }
            if (numMagnitudeBins < 1) {
                throw new IllegalArgumentException(
                        "numMagnitudeBins must be >= 1, got " + numMagnitudeBins);
            }
            return new RandAugment(this);
        }
    }
}
