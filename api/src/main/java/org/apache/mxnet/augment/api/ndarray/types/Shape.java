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

import java.util.Arrays;
import java.util.stream.Collectors;
import org.apache.mxnet.augment.api.ndarray.NDImage;

/**
 * The dimensions of an {@link NDImage}.
 *
 * <p>Image shapes are laid out as {@code (..., C, H, W)}: the last three axes are channels,
 * height and width, any leading axes are batch axes.
 */
public final class Shape {

    private static final int IMAGE_AXES = 3;

    private final long[] dims;

    /**
     * Constructs a {@code Shape} from its dimensions.
     *
     * @param dims the size of each axis
     * @throws IllegalArgumentException if an axis has a negative size
     */
    public Shape(long... dims) {
        for (long d : dims) {
            if (d < 0) {
                throw new IllegalArgumentException(
                        "Axis sizes must be >= 0, got " + Arrays.toString(dims));
            }
        }
        this.dims = dims.clone();
    }

    /**
     * Returns the size of an axis, negative axes count from the end.
     *
     * @param axis the axis, {@code -1} being the width of an image shape
     * @return the size of the axis
     */
    public long get(int axis) {
        return dims[axis < 0 ? dims.length + axis : axis];
    }

    /**
     * Returns the number of elements, the product of all axes.
     *
     * @return the number of elements
     */
    public long size() {
        long total = 1;
        for (long d : dims) {
            total *= d;
        }
        return total;
    }

    /**
     * Returns the number of axes.
     *
     * @return the number of axes
     */
    public int dimension() {
        return dims.length;
    }

    /**
     * Returns whether this shape has the {@code C, H, W} trailing axes of an image.
     *
     * @return whether there are at least three axes
     */
    public boolean isImage() {
        return dims.length >= IMAGE_AXES;
    }

    /**
     * Returns the number of images described by this shape, the product of the leading batch
     * axes.
     *
     * @return the batch size, 1 for a single {@code (C, H, W)} image
     * @throws IllegalStateException if this is not an image shape
     */
    public long getBatchSize() {
        if (!isImage()) {
            throw new IllegalStateException("Not an image shape: " + this);
        }
        long total = 1;
        for (int i = 0; i < dims.length - IMAGE_AXES; ++i) {
            total *= dims[i];
        }
        return total;
    }

    /** {@inheritDoc} */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Shape)) {
            return false;
        }
        return Arrays.equals(dims, ((Shape) o).dims);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return Arrays.hashCode(dims);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return Arrays.stream(dims)
                .mapToObj(Long::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
