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

/** An entry of an {@link AugmentationSpace}: how strong an operation may be and in which sense. */
public final class AugmentationEntry {

    private final MagnitudeFunction magnitudeFunction;
    private final boolean signed;

    /**
     * Constructs an {@code AugmentationEntry}.
     *
     * @param magnitudeFunction the magnitudes of the operation
     * @param signed whether a sampled magnitude has its sign flipped with probability 0.5
     */
    public AugmentationEntry(MagnitudeFunction magnitudeFunction, boolean signed) {
        this.magnitudeFunction = magnitudeFunction;
        this.signed = signed;
    }

    /**
     * Returns the magnitude of each bin.
     *
     * @param bins the number of bins
     * @param height the height of the image
     * @param width the width of the image
     * @return the magnitudes, empty for magnitude-free operations
     */
    public double[] magnitudes(int bins, int height, int width) {
        return magnitudeFunction.magnitudes(bins, height, width);
    }

    /**
     * Returns whether the operation takes no magnitude.
     *
     * @return whether the operation takes no magnitude
     */
    public boolean isMagnitudeFree() {
        return magnitudeFunction.isMagnitudeFree();
    }

    /**
     * Returns whether sampled magnitudes may be negated.
     *
     * @return whether sampled magnitudes may be negated
     */
    public boolean isSigned() {
        return signed;
    }
}
