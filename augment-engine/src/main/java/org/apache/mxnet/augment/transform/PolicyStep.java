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

/** One step of a {@link SubPolicy}: an operation, the probability to apply it and its bin. */
public final class PolicyStep {

    private static final int NO_MAGNITUDE = -1;

    private final Operation operation;
    private final double probability;
    private final int magnitudeBin;

    /**
     * Constructs a step of a magnitude-bearing operation.
     *
     * @param operation the operation
     * @param probability the probability in {@code [0, 1]} to apply the operation
     * @param magnitudeBin the magnitude bin of the operation
     */
    public PolicyStep(Operation operation, double probability, int magnitudeBin) {
        if (probability < 0 || probability > 1) {
            throw new IllegalArgumentException(
                    "Probability of " + operation + " must be in [0, 1], got " + probability);
        }
        this.operation = operation;
        this.probability = probability;
        this.magnitudeBin = magnitudeBin;
    }

    /**
     * Constructs a step of a magnitude-free operation.
     *
     * @param operation the operation
     * @param probability the probability in {@code [0, 1]} to apply the operation
     */
    public PolicyStep(Operation operation, double probability) {
        this(operation, probability, NO_MAGNITUDE);
    }

    /**
     * Returns the operation of this step.
     *
     * @return the operation
     */
    public Operation getOperation() {
        return operation;
    }

    /**
     * Returns the probability that this step runs.
     *
     * @return a probability in {@code [0, 1]}
     */
    public double getProbability() {
        return probability;
    }

    /**
     * Returns the magnitude bin of the step.
     *
     * @return the magnitude bin, or {@code -1} if the step has none
     */
    public int getMagnitudeBin() {
        return magnitudeBin;
    }

    /**
     * Returns whether this step carries a magnitude bin.
     *
     * @return {@code false} for magnitude-free operations
     */
    public boolean hasMagnitudeBin() {
        return magnitudeBin != NO_MAGNITUDE;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "("
                + operation
                + ", "
                + probability
                + ", "
                + (hasMagnitudeBin() ? String.valueOf(magnitudeBin) : "None")
                + ')';
    }
}
