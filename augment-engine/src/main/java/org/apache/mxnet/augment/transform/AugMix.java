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

import java.util.Arrays;
import java.util.Random;
import org.apache.mxnet.augment.api.ndarray.NDImage;
import org.apache.mxnet.augment.image.Interpolation;
import org.apache.mxnet.augment.util.Dirichlet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code AugMix} blends the original image with several randomly augmented copies of it.
 *
 * <p>Each chain applies a short sequence of random operations to the original image. The chains
 * and the original are mixed with weights drawn from a Dirichlet distribution, once per image of
 * a batch.
 */
public class AugMix extends AutoAugmentBase {

    private static final Logger logger = LoggerFactory.getLogger(AugMix.class);

    /** The number of bins the magnitude ranges are split into; severity selects the lowest. */
    public static final int NUM_MAGNITUDE_BINS = 10;

    private static final int MAX_CHAIN_DEPTH = 3;

    private final int severity;
    private final int mixtureWidth;
    private final int chainDepth;
    private final double alpha;
    private final boolean allOps;
    private final AugmentationSpace space;

    protected AugMix(Builder builder) {
        super(builder.interpolation, builder.fill);
        builder.validate();
        severity = builder.severity;
        mixtureWidth = builder.mixtureWidth;
        chainDepth = builder.chainDepth;
        alpha = builder.alpha;
        allOps = builder.allOps;
        space = allOps ? AugmentationSpace.AUG_MIX : AugmentationSpace.AUG_MIX_PARTIAL;
    }

    /**
     * Creates a builder to build an {@code AugMix}.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Draws the mixing weights of one image.
     *
     * <p>The original image gets {@code m[0]} of {@code m ~ Dirichlet(alpha, alpha)}; the chains
     * share {@code m[1]} according to a {@code Dirichlet(alpha, ..., alpha)} draw.
     *
     * @param random the source of randomness
     * @return the mixing weights
     */
    public MixtureWeights sampleWeights(Random random) {
        double[] m = sampleDirichlet(new double[] {alpha, alpha}, random);
        double[] concentration = new double[mixtureWidth];
        Arrays.fill(concentration, alpha);
        double[] chains = sampleDirichlet(concentration, random);
        for (int i = 0; i < chains.length; ++i) {
            chains[i] *= m[1];
        }
        return new MixtureWeights(m[0], chains);
    }

    /**
     * Draws one vector from {@code Dirichlet(concentration)}.
     *
     * @param concentration the concentration of each component
     * @param random the source of randomness
     * @return non-negative components summing to 1
     */
    protected double[] sampleDirichlet(double[] concentration, Random random) {
        return Dirichlet.sample(concentration, random);
    }

    /** {@inheritDoc} */
    @Override
    protected NDImage transformImage(NDImage image, SamplingParams params, Random random) {
        int batchSize = image.getBatchSize();
        if (batchSize == 0) {
            return image;
        }
        MixtureWeights[] weights = new MixtureWeights[batchSize];
        for (int i = 0; i < batchSize; ++i) {
            weights[i] = sampleWeights(random);
            logger.debug("Mixing weights of image {}: {}", i, weights[i]);
        }

        float[] original = image.toFloatArray();
        int plane = original.length / batchSize;
        double[] mix = new double[original.length];
        for (int k = 0; k < original.length; ++k) {
            mix[k] = weights[k / plane].getOriginalWeight() * original[k];
        }

        for (int chain = 0; chain < mixtureWidth; ++chain) {
            NDImage augmented = image;
            int depth = chainDepth > 0 ? chainDepth : random.nextInt(MAX_CHAIN_DEPTH) + 1;
            for (int d = 0; d < depth; ++d) {
                OperationEntry choice = space.randomEntry(random);
                double magnitude =
                        MagnitudeSampler.sampleRandomBin(
                                choice.getEntry(), NUM_MAGNITUDE_BINS, severity, params, random);
                augmented = applyOperation(augmented, choice.getOperation(), magnitude);
            }
            float[] values = augmented.toFloatArray();
            for (int k = 0; k < values.length; ++k) {
                mix[k] += weights[k / plane].getChainWeight(chain) * values[k];
            }
        }
        return NDImage.create(mix, image.getShape(), image.getDataType());
    }

    /**
     * Returns the severity, the number of lowest magnitude bins the chains sample from.
     *
     * @return the severity in {@code [1, 10]}
     */
    public int getSeverity() {
        return severity;
    }

    /**
     * Returns the number of augmentation chains.
     *
     * @return the number of chains
     */
    public int getMixtureWidth() {
        return mixtureWidth;
    }

    /**
     * Returns the fixed depth of each chain.
     *
     * @return the depth, or a non-positive value if each chain draws a depth in {@code [1, 3]}
     */
    public int getChainDepth() {
        return chainDepth;
    }

    /**
     * Returns the concentration of the mixing weights.
     *
     * @return the Dirichlet concentration
     */
    public double getAlpha() {
        return alpha;
    }

    /**
     * Returns whether the chains draw from the full catalogue.
     *
     * @return {@code false} if only the operations that do not overlap with common test
     *     corruptions are used
     */
    public boolean isAllOps() {
        return allOps;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "AugMix(severity="
                + severity
                + ", mixture_width="
                + mixtureWidth
                + ", chain_depth="
                + chainDepth
                + ", alpha="
                + alpha
                + ", all_ops="
                + allOps
                + ", interpolation="
                + getInterpolation()
                + ", fill="
                + getFill()
                + ')';
    }

    /** The Builder to construct an {@link AugMix} object. */
    public static final class Builder extends BaseBuilder<Builder> {

        int severity = 3;
        int mixtureWidth = 3;
        int chainDepth = -1;
        double alpha = 1.0;
        boolean allOps = true;

        Builder() {
            super(Interpolation.BILINEAR);
        }

        /**
         * Sets the severity in {@code [1, 10]}, 3 by default.
         *
         * @param severity the number of lowest magnitude bins chains draw from
         * @return this {@code Builder}
         */
        public Builder optSeverity(int severity) {
            this.severity = severity;
            return this;
        }

        /**
         * Sets the number of augmentation chains, 3 by default.
         *
         * @param mixtureWidth the number of chains
         * @return this {@code Builder}
         */
        public Builder optMixtureWidth(int mixtureWidth) {
            this.mixtureWidth = mixtureWidth;
            return this;
        }

        /**
         * Sets the number of operations of each chain; a value {@code <= 0}, the default, draws
         * a depth in {@code [1, 3]} for every chain.
         *
         * @param chainDepth the chain depth
         * @return this {@code Builder}
         */
        public Builder optChainDepth(int chainDepth) {
            this.chainDepth = chainDepth;
            return this;
        }

        /**
         * Sets the Dirichlet concentration, 1.0 by default.
         *
         * @param alpha the concentration
         * @return this {@code Builder}
         */
        public Builder optAlpha(double alpha) {
            this.alpha = alpha;
            return this;
        }

        /**
         * Sets whether the photometric operations are used as well, true by default.
         *
         * @param allOps whether all operations are used
         * @return this {@code Builder}
         */
        public Builder optAllOps(boolean allOps) {
            this.allOps = allOps;
            return this;
        }

        /** {@inheritDoc} */
        @Override
        protected Builder self() {
            return this;
        }

        void validate() {
            if (severity < 1 || severity > NUM_MAGNITUDE_BINS) {
                throw new IllegalArgumentException(
                        "The severity must be between [1, "
                                + NUM_MAGNITUDE_BINS
                                + "]. Got "
                                + severity
                                + " instead.");
            }
            if (mixtureWidth < 1) {
                throw new IllegalArgumentException(
                        "mixtureWidth must be >= 1, got " + mixtureWidth);
            }
            if (!(alpha > 0) || Double.isInfinite(alpha)) {
                throw new IllegalArgumentException(
                        "alpha must be positive and finite, got " + alpha);
            }
        }

        /**
         * Builds an {@link AugMix}.
         *
         * @return a new {@link AugMix}
         * @throws IllegalArgumentException if a parameter is out of range
         */
        public AugMix build() {
            return new AugMix(this);
        }
    }
}
