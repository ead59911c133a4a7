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

package org.apache.mxnet.augment.api.ndarray;

import java.util.Arrays;
import org.apache.mxnet.augment.api.ndarray.types.DataType;
import org.apache.mxnet.augment.api.ndarray.types.Shape;

/**
 * An immutable, dense image tensor.
 *
 * <p>An {@code NDImage} has the shape {@code (..., C, H, W)}. The last three axes are the
 * channels, height and width of one image; leading axes, if any, hold a batch of images that share
 * the same size. Pixels are stored as {@code float} values whatever the {@link DataType}: a {@link
 * DataType#UINT8} image holds integral values in {@code [0, 255]}, a {@link DataType#FLOAT32}
 * image holds values in {@code [0, 1]}.
 *
 * <p>Every operation producing pixels returns a new {@code NDImage}; the backing array is never
 * exposed, so an instance can be shared freely between threads.
 */
public final class NDImage {

    private final Shape shape;
    private final DataType dataType;
    private final float[] data;

    private NDImage(Shape shape, DataType dataType, float[] data) {
        this.shape = shape;
        this.dataType = dataType;
        this.data = data;
    }

    /**
     * Creates an {@code NDImage} from the given pixel values.
     *
     * <p>The values are copied and cast to the data type, see {@link DataType#cast(double)}.
     *
     * @param data the pixel values in row-major {@code (..., C, H, W)} order
     * @param shape the shape of the image
     * @param dataType the value representation of the image
     * @return a new {@code NDImage}
     * @throws IllegalArgumentException if the shape has fewer than 3 axes or does not match the
     *     data length
     */
    public static NDImage create(float[] data, Shape shape, DataType dataType) {
        validate(shape, data.length);
        float[] copy = new float[data.length];
        for (int i = 0; i < data.length; ++i) {
            copy[i] = dataType.cast(data[i]);
        }
        return new NDImage(shape, dataType, copy);
    }

    /**
     * Creates an {@code NDImage} from the given pixel values computed in double precision.
     *
     * @param data the pixel values in row-major {@code (..., C, H, W)} order
     * @param shape the shape of the image
     * @param dataType the value representation of the image
     * @return a new {@code NDImage}
     */
    public static NDImage create(double[] data, Shape shape, DataType dataType) {
        validate(shape, data.length);
        float[] copy = new float[data.length];
        for (int i = 0; i < data.length; ++i) {
            copy[i] = dataType.cast(data[i]);
        }
        return new NDImage(shape, dataType, copy);
    }

    /**
     * Creates a {@code uint8} {@code NDImage} from unsigned bytes.
     *
     * @param data the pixel values, interpreted as unsigned
     * @param shape the shape of the image
     * @return a new {@code NDImage}
     */
    public static NDImage create(byte[] data, Shape shape) {
        validate(shape, data.length);
        float[] values = new float[data.length];
        for (int i = 0; i < data.length; ++i) {
            values[i] = data[i] & 0xFF;
        }
        return new NDImage(shape, DataType.UINT8, values);
    }

    /**
     * Creates an {@code NDImage} filled with zeros.
     *
     * @param shape the shape of the image
     * @param dataType the value representation of the image
     * @return a new {@code NDImage}
     */
    public static NDImage zeros(Shape shape, DataType dataType) {
        return full(shape, 0f, dataType);
    }

    /**
     * Creates an {@code NDImage} filled with the given value.
     *
     * @param shape the shape of the image
     * @param value the value of every pixel
     * @param dataType the value representation of the image
     * @return a new {@code NDImage}
     */
    public static NDImage full(Shape shape, float value, DataType dataType) {
        validate(shape, shape.size());
        float[] values = new float[Math.toIntExact(shape.size())];
        Arrays.fill(values, dataType.cast(value));
        return new NDImage(shape, dataType, values);
    }

    private static void validate(Shape shape, long length) {
        if (!shape.isImage()) {
            throw new IllegalArgumentException(
                    "An image must have shape (..., C, H, W), got " + shape);
        }
        if (shape.size() != length) {
            throw new IllegalArgumentException(
                    "Data length " + length + " does not match shape " + shape);
        }
    }

    /**
     * Returns the {@link Shape} of this {@code NDImage}.
     *
     * @return the {@link Shape} of this {@code NDImage}
     */
    public Shape getShape() {
        return shape;
    }

    /**
     * Returns the {@link DataType} of this {@code NDImage}.
     *
     * @return the {@link DataType} of this {@code NDImage}
     */
    public DataType getDataType() {
        return dataType;
    }

    /**
     * Returns the number of channels.
     *
     * @return the number of channels
     */
    public int getChannels() {
        return Math.toIntExact(shape.get(-3));
    }

    /**
     * Returns the height of each image.
     *
     * @return the height of each image
     */
    public int getHeight() {
        return Math.toIntExact(shape.get(-2));
    }

    /**
     * Returns the width of each image.
     *
     * @return the width of each image
     */
    public int getWidth() {
        return Math.toIntExact(shape.get(-1));
    }

    /**
     * Returns the number of images held, the product of the leading batch axes.
     *
     * @return the number of images, 1 for an unbatched image
     */
    public int getBatchSize() {
        return Math.toIntExact(shape.getBatchSize());
    }

    /**
     * Returns the pixel at the given index of a {@code (N, C, H, W)} view of this image.
     *
     * @param image the index of the image within the batch
     * @param channel the channel
     * @param y the row
     * @param x the column
     * @return the pixel value
     */
    public float getFloat(int image, int channel, int y, int x) {
        int h = getHeight();
        int w = getWidth();
        return data[((image * getChannels() + channel) * h + y) * w + x];
    }

    /**
     * Returns a copy of the pixel values in row-major order.
     *
     * @return a copy of the pixel values
     */
    public float[] toFloatArray() {
        return data.clone();
    }

    /**
     * Returns the pixel values as unsigned bytes.
     *
     * @return the pixel values as bytes
     * @throws IllegalStateException if this is not a {@code uint8} image
     */
    public byte[] toByteArray() {
        if (dataType != DataType.UINT8) {
            throw new IllegalStateException("Only uint8 images convert to bytes, got " + dataType);
        }
        byte[] bytes = new byte[data.length];
        for (int i = 0; i < data.length; ++i) {
            bytes[i] = (byte) (int) data[i];
        }
        return bytes;
    }

    /**
     * Converts this image to another value representation, rescaling the pixel range.
     *
     * <p>{@code uint8} values are divided by 255; floating values are multiplied by {@code 256 -
     * 1e-3} and truncated so that the full {@code [0, 1]} range maps evenly onto 256 levels.
     *
     * @param type the target data type
     * @return the converted image, or this image if it already has the target type
     */
    public NDImage convertTo(DataType type) {
        if (type == dataType) {
            return this;
        }
        float[] values = new float[data.length];
        if (type.isFloating()) {
            for (int i = 0; i < data.length; ++i) {
                values[i] = data[i] / dataType.getMaxValue();
            }
        } else {
            double scale = type.getMaxValue() + 1 - 1e-3;
            for (int i = 0; i < data.length; ++i) {
                values[i] = type.cast(data[i] * scale);
            }
        }
        return new NDImage(shape, type, values);
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
        NDImage other = (NDImage) o;
        return dataType == other.dataType
                && shape.equals(other.shape)
                && Arrays.equals(data, other.data);
    }

    /** {@inheritDoc} */
    @Override
    public int hashCode() {
        return 31 * (31 * shape.hashCode() + dataType.hashCode()) + Arrays.hashCode(data);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "NDImage(shape=" + shape + ", dtype=" + dataType + ')';
    }
}
