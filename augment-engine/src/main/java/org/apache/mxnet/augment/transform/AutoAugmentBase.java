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

import java.awt.image.BufferedImage;
import java.util.Random;
import org.apache.mxnet.augment.api.ndarray.NDImage;
import org.apache.mxnet.augment.api.transform.Transform;
import org.apache.mxnet.augment.image.Fill;
import org.apache.mxnet.augment.image.ImageConverter;
import org.apache.mxnet.augment.image.Interpolation;

/**
 * The base class of the automatic augmentation strategies.
 *
 * <p>{@code AutoAugmentBase} unwraps the supported image values, hands the pixel tensor to {@link
 * #transformImage(NDImage, SamplingParams, Random)} and wraps the result back into the type of
 * the input. Every other input is returned as is.
 */
public abstract class AutoAugmentBase implements Transform {

    private final Interpolation interpolation;
    private final Fill fill;

    protected AutoAugmentBase(Interpolation interpolation, Fill fill) {
        this.interpolation = interpolation;
        this.fill = fill;
    }

    /** {@inheritDoc} */
    @Override
    public Object transform(Object input, Random random) {
        if (input instanceof NDImage) {
            return augment((NDImage) input, random);
        } else if (input instanceof BufferedImage) {
            NDImage image = ImageConverter.toNDImage((BufferedImage) input);
            return ImageConverter.toBufferedImage(augment(image, random));
        }
        return input;
    }

    /**
     * Augments a {@code (..., C, H, W)} image.
     *
     * @param image the image to augment
     * @param random the source of randomness for this call
     * @return a new augmented image, or {@code image} if no operation changed it
     */
    public NDImage augment(NDImage image, Random random) {
        return transformImage(image, SamplingParams.of(image), random);
    }

    /**
     * Applies the strategy to the pixel tensor.
     *
     * @param image the image to augment
     * @param params the dimensions of the image, read before the first operation
     * @param random the source of randomness for this call
     * @return the augmented image
     */
    protected abstract NDImage transformImage(NDImage image, SamplingParams params, Random random);

    protected NDImage applyOperation(NDImage image, Operation operation, double magnitude) {
        return OperationDispatcher.apply(image, operation, magnitude, interpolation, fill);
    }

    /**
     * Returns the resampling method of the geometric operations.
     *
     * @return the resampling method
     */
    public Interpolation getInterpolation() {
        return interpolation;
    }

    /**
     * Returns the fill of the geometric operations.
     *
     * @return the fill
     */
    public Fill getFill() {
        return fill;
    }

    /** The base builder of the automatic augmentation strategies. */
    public abstract static class BaseBuilder<T extends BaseBuilder<T>> {

        protected Interpolation interpolation;
        protected Fill fill = Fill.zero();

        protected BaseBuilder(Interpolation interpolation) {
            this.interpolation = interpolation;
        }

        /**
         * Sets the resampling method of the geometric operations.
         *
         * @param interpolation the resampling method
         * @return this {@code Builder}
         */
        public T optInterpolation(Interpolation interpolation) {
            this.interpolation = interpolation;
            return self();
        }

        /**
         * Sets the resampling method of the geometric operations by name.
         *
         * @param interpolation the name of the resampling method, {@code nearest} or {@code
         *     bilinear}
         * @return this {@code Builder}
         */
        public T optInterpolation(String interpolation) {
            return optInterpolation(Interpolation.fromValue(interpolation));
        }

        /**
         * Sets the fill of the geometric operations.
         *
         * @param fill a {@link Fill}, a number or a sequence of per-channel numbers
         * @return this {@code Builder}
         * @throws IllegalArgumentException if the fill has an inappropriate type
         */
        public T optFill(Object fill) {
            this.fill = fill == null ? Fill.zero() : Fill.from(fill);
            return self();
        }

        protected abstract T self();
    }
}
