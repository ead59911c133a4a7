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

package org.apache.mxnet.augment.util;

import java.util.Random;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;

/**
 * Samples from the Dirichlet distribution.
 *
 * <p>A draw normalizes independent {@code Gamma(alpha_i, 1)} variates. The variates are kept in
 * log space: for {@code alpha < 1} a {@code Gamma(alpha)} variate is {@code Gamma(alpha + 1) *
 * U^(1/alpha)}, whose logarithm stays finite even when {@code U^(1/alpha)} underflows, so a
 * concentration close to zero still yields a valid, nearly one-hot draw. When even the
 * logarithms overflow, the draw is one-hot.
 */
public final class Dirichlet {

    private Dirichlet() {}

    /**
     * Draws one vector from {@code Dirichlet(concentration)}.
     *
     * @param concentration the positive concentration of each component
     * @param random the source of randomness
     * @return non-negative components summing to 1
     * @throws IllegalArgumentException if a concentration is not positive or none is given
     */
    public static double[] sample(double[] concentration, Random random) {
        if (concentration.length == 0) {
            throw new IllegalArgumentException("Dirichlet needs at least one component");
        }
        RandomGenerator generator = RandomGeneratorFactory.createRandomGenerator(random);
        double[] logGamma = new double[concentration.length];
        double[] scaled = new double[concentration.length];
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < concentration.length; ++i) {
            sampleLogGamma(concentration[i], generator, logGamma, scaled, i);
            max = Math.max(max, logGamma[i]);
        }
        double[] weights = new double[concentration.length];
        if (max == Double.NEGATIVE_INFINITY) {
            // every log variate overflowed, the draw collapses onto a single component
            int argmax = 0;
            for (int i = 1; i < scaled.length; ++i) {
                if (scaled[i] > scaled[argmax]) {
                    argmax = i;
                }
            }
            weights[argmax] = 1.0;
            return weights;
        }
        double sum = 0.0;
        for (int i = 0; i < weights.length; ++i) {
            weights[i] = Math.exp(logGamma[i] - max);
            sum += weights[i];
        }
        for (int i = 0; i < weights.length; ++i) {
            weights[i] /= sum;
        }
        return weights;
    }

    /**
     * Stores {@code log(Gamma(alpha))} at {@code logGamma[index]} and {@code alpha} times that
     * logarithm at {@code scaled[index]}. The scaled value stays finite when the logarithm itself
     * overflows for a tiny {@code alpha}.
     */
    private static void sampleLogGamma(
            double alpha,
            RandomGenerator generator,
            double[] logGamma,
            double[] scaled,
            int index) {
        if (!(alpha > 0) || Double.isInfinite(alpha)) {
            throw new IllegalArgumentException(
                    "Dirichlet concentration must be positive and finite, got " + alpha);
        }
        if (alpha >= 1.0) {
            double value = Math.log(new GammaDistribution(generator, alpha, 1.0).sample());
            logGamma[index] = value;
            scaled[index] = value;
            return;
        }
        double logBoosted = Math.log(new GammaDistribution(generator, alpha + 1.0, 1.0).sample());
        // 1 - nextDouble() lies in (0, 1]
        double logUniform = Math.log(1.0 - generator.nextDouble());
        logGamma[index] = logBoosted + logUniform / alpha;
        scaled[index] = alpha * logBoosted + logUniform;
    }
}
