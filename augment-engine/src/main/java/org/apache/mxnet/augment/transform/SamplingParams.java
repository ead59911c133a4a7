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

import org.apache.mxnet.augment.api.ndarray.NDImage;

/**
 * The image dimensions an augmentation call samples magnitudes for.
 *
 * <p>They are read once, before the first operation, and stay the same for the whole call.
 */
public final class SamplingParams {

    private final int height;
    private final int width;

    /**
     * Constructs {@code SamplingParams}.
     *
     * @param height the image height
     * @param width the image width
     */
    public SamplingParams(int height, int width) {
        this.height = height;
        this.width = width;
    }

    /**
     * Reads the sampling parameters of an image.
     *
     * @param image the image about to be augmented
     * @return the sampling parameters of the image
     */
    public static SamplingParams of(NDImage image) {
        return new SamplingParams(image.getHeight(), image.getWidth());
    }

    /**
     * Returns the image height.
     *
     * @return the image height
     */
    public int getHeight() {
        return height;
    }

    /**
     * Returns the image width.
     *
     * @return the image width
     */
    public int getWidth() {
        return width;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "SamplingParams(height=" + height + ", width=" + width + ')';
    }
}
