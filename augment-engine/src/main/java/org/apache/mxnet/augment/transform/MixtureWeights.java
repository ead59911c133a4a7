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

/** The weights {@link AugMix} blends the original image and its augmentation chains with. */
public final class MixtureWeights {

    private final double originalWeight;
    private final double[] chainWeights;

    /**
     * Constructs {@code MixtureWeights}.
     *
     * @param originalWeight the weight of the original image
     * @param chainWeights the weight of each augmentation chain
     */
    public MixtureWeights(double originalWeight, double[] chainWeights) {
        this.originalWeight = originalWeight;
        this.chainWeights = chainWeights.clone();
    }

    /**
     * Returns the weight of the unaugmented image.
     *
     * @return the weight of the original
     */
    public double getOriginalWeight() {
        return originalWeight;
    }

    /**
     * Returns the weight of each augmentation chain.
     *
     * @return a copy of the chain weights
     */
    public double[] getChainWeights() {
        return chainWeights.clone();
    }

    double getChainWeight(int chain) {
        return chainWeights[chain];
    }

    /**
     * Returns the sum of all weights, 1 up to rounding.
     *
     * @return the sum of all weights
     */
    public double sum() {
        double sum = originalWeight;
        for (double weight : chainWeights) {
            sum += weight;
        }
        return sum;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "MixtureWeights(original="
                + originalWeight
                + ", chains="
                + Arrays.toString(chainWeights)
                + ')';
    }
}
