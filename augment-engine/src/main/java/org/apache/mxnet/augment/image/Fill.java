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

package org.apache.mxnet.augment.image;

import java.util.Arrays;
import java.util.Collection;

/**
 * The pixel value used for the area a geometric operation moves out of the image.
 *
 * <p>A fill is either one scalar used for every channel, or one value per channel.
 */
public final class Fill {

    private static final Fill ZERO = new Fill(new float[] {0f});

    private final float[] values;

    private Fill(float[] values) {
        this.values = values;
    }

    /**
     * Returns the fill that paints every channel black.
     *
     * @return the zero fill
     */
    public static Fill zero() {
        return ZERO;
    }

    /**
     * Returns a fill that uses the same value for every channel.
     *
     * @param value the fill value
     * @return a scalar fill
     */
    public static Fill of(float value) {
        return new Fill(new float[] {value});
    }

    /**
     * Returns a fill with one value per channel.
     *
     * @param values the per-channel values
     * @return a per-channel fill
     * @throws IllegalArgumentException if no value is given
     */
    public static Fill of(float... values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("A fill needs at least one value");
        }
        return new Fill(values.clone());
    }

    /**
     * Converts a loosely typed fill argument, a {@link Number}, a primitive number array or a
     * collection of numbers, to a {@code Fill}.
     *
     * @param fill the fill argument
     * @return the {@code Fill}
     * @throws IllegalArgumentException if the argument has an inappropriate type
     */
    public static Fill from(Object fill) {
        if (fill instanceof Fill) {
            return (Fill) fill;
        } else if (fill instanceof Number) {
            return of(((Number) fill).floatValue());
        } else if (fill instanceof float[]) {
            return of((float[]) fill);
        } else if (fill instanceof double[]) {
            double[] array = (double[]) fill;
            float[] values = new float[array.length];
            for (int i = 0; i < array.length; ++i) {
                values[i] = (float) array[i];
            }
            return of(values);
        } else if (fill instanceof int[]) {
            int[] array = (int[]) fill;
            float[] values = new float[array.length];
            for (int i = 0; i < array.length; ++i) {
                values[i] = array[i];
            }
            return of(values);
        } else if (fill instanceof Collection) {
            Collection<?> collection = (Collection<?>) fill;
            float[] values = new float[collection.size()];
            int i = 0;
            for (Object value : collection) {
                if (!(value instanceof Number)) {
                    throw new IllegalArgumentException("Got inappropriate fill arg: " + fill);
                }
                values[i++] = ((Number) value).floatValue();
            }
            return of(values);
        }
        throw new IllegalArgumentException("Got inappropriate fill arg: " + fill);
    }

    /**
     * Returns the fill value for the given channel.
     *
     * @param channel the channel index
     * @param channels the number of channels of the image being filled
     * @return the fill value of the channel
     * @throws IllegalArgumentException if a per-channel fill does not match the channel count
     */
    public float get(int channel, int channels) {
        if (values.length == 1) {
            return values[0];
        }
        if (values.length != channels) {
            throw new IllegalArgumentException(
                    "The number of fill values ("
                            + values.length
                            + ") does not match the number of channels ("
                            + channels
                            + ')');
        }
        return values[channel];
    }

    /** {@inheritDoc} */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(values, ((Fill) o).values);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        if (values.length == 1) {
            return String.valueOf(values[0]);
        }
        return Arrays.toString(values);
    }
}
