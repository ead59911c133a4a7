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

/**
 * Computes the magnitudes an operation may take, one per bin, in increasing strength.
 *
 * <p>Ranges may depend on the size of the image being augmented, which is why the image height
 * and width are passed in.
 */
public interface MagnitudeFunction {

    /** The function of operations that take no magnitude. */
    MagnitudeFunction NONE =
            new MagnitudeFunction() {
                @Override
                public double[] magnitudes(int bins, int height, int width) {
                    return new double[0];
                }

                @Override
                public boolean isMagnitudeFree() {
                    return true;
                }
            };

    /**
     * Returns the magnitude of each bin.
     *
     * @param bins the number of bins
     * @param height the height of the image
     * @param width the width of the image
     * @return {@code bins} magnitudes, or an empty array for magnitude-free operations
     */
    double[] magnitudes(int bins, int height, int width);

    /**
     * Returns whether the operation takes no magnitude.
     *
     * @return whether the operation takes no magnitude
     */
    default boolean isMagnitudeFree() {
        return false;
    }

    /**
     * Returns a function spreading {@code bins} magnitudes evenly from {@code start} to {@code
     * end}, both included.
     *
     * @param start the magnitude of the first bin
     * @param end the magnitude of the last bin
     * @return the magnitude function
     */
    static MagnitudeFunction linspace(double start, double end) {
        return (bins, height, width) -> linspace(start, end, bins);
    }

    /**
     * Returns a function spreading magnitudes from 0 to a fraction of the image width.
     *
     * @param fraction the fraction of the width reached by the last bin
     * @return the magnitude function
     */
    static MagnitudeFunction linspaceOfWidth(double fraction) {
        return (bins, height, width) -> linspace(0.0, fraction * width, bins);
    }

    /**
     * Returns a function spreading magnitudes from 0 to a fraction of the image height.
     *
     * @param fraction the fraction of the height reached by the last bin
     * @return the magnitude function
     */
    static MagnitudeFunction linspaceOfHeight(double fraction) {
        return (bins, height, width) -> linspace(0.0, fraction * height, bins);
    }

    /**
     * Returns a function of posterize bit counts, decreasing from {@code maxBits} by {@code
     * spread} bits over the bins and rounded half to even.
     *
     * @param maxBits the bit count of the first bin
     * @param spread the number of bits removed by the last bin
     * @return the magnitude function
     */
    static MagnitudeFunction bits(int maxBits, double spread) {
        return (bins, height, width) -> {
            double[] magnitudes = new double[Math.max(bins, 0)];
            if (bins == 1) {
                magnitudes[0] = maxBits;
                return magnitudes;
            }
            double divisor = (bins - 1) / spread;
            for (int i = 0; i < magnitudes.length; ++i) {
                magnitudes[i] = Math.rint(maxBits - i / divisor);
            }
            return magnitudes;
        };
    }

    private static double[] linspace(double start, double end, int steps) {
        double[] values = new double[Math.max(steps, 0)];
        if (steps == 1) {
            values[0] = start;
            return values;
        }
        double step = (end - start) / (steps - 1);
        for (int i = 0; i < values.length; ++i) {
            values[i] = start + i * step;
        }
        if (steps > 1) {
            values[steps - 1] = end;
        }
        return values;
    }
}
