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

import java.util.List;
import java.util.Random;
import org.apache.mxnet.augment.api.ndarray.NDImage;
import org.apache.mxnet.augment.image.Fill;
import org.apache.mxnet.augment.image.Interpolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code AutoAugment} applies one of the sub-policies of a learned {@link AutoAugmentPolicy}.
 *
 * <p>Each call picks a sub-policy uniformly at random. Each of its two steps is applied with its
 * own probability and a fixed magnitude bin.
 */
public class AutoAugment extends AutoAugmentBase {

    private static final Logger logger = LoggerFactory.getLogger(AutoAugment.class);

    /** The number of bins the magnitude ranges of the policies are split into. */
    public static final int NUM_MAGNITUDE_BINS = 10;

    private final AutoAugmentPolicy policy;
    private final List<SubPolicy> subPolicies;

    AutoAugment(Builder builder) {
        super(builder.interpolation, builder.fill);
        policy = builder.policy;
        subPolicies = policy.getSubPolicies();
    }

    /**
     * Creates a builder to build an {@code AutoAugment}.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** {@inheritDoc} */
    @Override
    protected NDImage transformImage(NDImage image, SamplingParams params, Random random) {
        SubPolicy subPolicy = subPolicies.get(random.nextInt(subPolicies.size()));
        logger.debug("Applying sub-policy {} of {}", subPolicy, policy);
        return applySubPolicy(image, subPolicy, params, random);
    }

    NDImage applySubPolicy(
            NDImage image, SubPolicy subPolicy, SamplingParams params, Random random) {
        NDImage result = image;
        for (PolicyStep step : subPolicy.getSteps()) {
            if (random.nextDouble() > step.getProbability()) {
                continue;
            }
            AugmentationEntry entry = AugmentationSpace.AUTO_AUGMENT.lookup(step.getOperation());
            double magnitude =
                    step.hasMagnitudeBin()
                            ? MagnitudeSampler.sample(
                                    entry,
                                    NUM_MAGNITUDE_BINS,
                                    step.getMagnitudeBin(),
                                    params,
                                    random)
                            : 0.0;
            result = applyOperation(result, step.getOperation(), magnitude);
        }
        return result;
    }

    /**
     * Returns the policy of this {@code AutoAugment}.
     *
     * @return the policy
     */
    public AutoAugmentPolicy getPolicy() {
        return policy;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "AutoAugment(policy="
                + policy
                + ", interpolation="
                + getInterpolation()
                + ", fill="
                + getFill()
                + ')';
    }

    /** The Builder to construct an {@link AutoAugment} object. */
    public static final class Builder extends BaseBuilder<Builder> {

        AutoAugmentPolicy policy = AutoAugmentPolicy.IMAGENET;

        Builder() {
            super(Interpolation.NEAREST);
        }

        /**
         * Sets the policy to apply, {@link AutoAugmentPolicy#IMAGENET} by default.
         *
         * @param policy the policy
         * @return this {@code Builder}
         */
        public Builder optPolicy(AutoAugmentPolicy policy) {
            this.policy = policy;
            return this;
        }

        /**
         * Sets the policy to apply by name.
         *
         * @param policy the name of the policy, {@code imagenet}, {@code cifar10} or {@code svhn}
         * @return this {@code Builder}
         * @throws org.apache.mxnet.augment.api.exception.UnrecognizedPolicyException if no policy
         *     has the given name
         */
        public Builder optPolicy(String policy) {
            return optPolicy(AutoAugmentPolicy.fromValue(policy));
        }

        /** {@inheritDoc} */
        @Override
        protected Builder self() {
            return this;
        }

        /**
         * Builds a {@link AutoAugment} with the specified policy.
         *
         * @return a new {@link AutoAugment}
         */
        public AutoAugment build() {
            return new AutoAugment(this);
        }
    }
}
