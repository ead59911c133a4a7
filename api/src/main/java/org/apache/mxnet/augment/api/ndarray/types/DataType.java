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

package org.apache.mxnet.augment.api.ndarray.types;

import org.apache.mxnet.augment.api.ndarray.NDImage;

/** An enum representing the value representation of the pixels held by an {@link NDImage}. */
public enum DataType {
    FLOAT32(Format.FLOATING, 1.0f),
    UINT8(Format.UINT, 255f);

    private enum Format {
        FLOATING,
        UINT
    }

    private final Format format;
    private final float maxValue;

    DataType(Format format, float maxValue) {
        this.format = format;
        this.maxValue = maxValue;
    }

    /**
     * Returns the largest pixel value of an image of this type: 255 for {@code uint8}, 1.0 for
     * floating images.
     *
     * @return the largest pixel value
     */
    public float getMaxValue() {
        return maxValue;
    }

    /**
     * Checks whether it is a floating data type.
     *
     * @return whether it is a floating data type
     */
    public boolean isFloating() {
        return format == Format.FLOATING;
    }

    /**
     * Checks whether it is an integer data type.
     *
     * @return whether it is an integer type
     */
    public boolean isInteger() {
        return format == Format.UINT;
    }

    /**
     * Casts a computed value to this data type.
     *
     * <p>Integer types clamp to their range and truncate toward zero, floating types keep the
     * value as is.
     *
     * @param value the value to cast
     * @return the value representable by this data type
     */
    public float cast(double value) {
        if (format == Format.UINT) {
            if (value <= 0 || Double.isNaN(value)) {
                return 0f;
            }
            if (value >= maxValue) {
                return maxValue;
            }
            return (float) (int) value;
        }
        return (float) value;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
