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
import org.apache.mxnet.augment.image.Fill;
import org.apache.mxnet.augment.image.ImageOps;
import org.apache.mxnet.augment.image.Interpolation;

/**
 * The image operations an augmentation policy chooses from.
 *
 * <p>Each constant knows how to apply itself with a concrete magnitude, so every operation has
 * exactly one implementation.
 */
public enum Operation {
    IDENTITY("Identity") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return image;
        }
    },
    SHEAR_X("ShearX") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.affine(
                    image,
                    0.0,
                    new int[] {0, 0},
                    1.0,
                    new double[] {Math.toDegrees(magnitude), 0.0},
                    interpolation,
                    fill);
        }
    },
    SHEAR_Y("ShearY") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.affine(
                    image,
                    0.0,
                    new int[] {0, 0},
                    1.0,
                    new double[] {0.0, Math.toDegrees(magnitude)},
                    interpolation,
                    fill);
        }
    },
    TRANSLATE_X("TranslateX") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.affine(
                    image,
                    0.0,
                    new int[] {(int) magnitude, 0},
                    1.0,
                    new double[] {0.0, 0.0},
                    interpolation,
                    fill);
        }
    },
    TRANSLATE_Y("TranslateY") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.affine(
                    image,
                    0.0,
                    new int[] {0, (int) magnitude},
                    1.0,
                    new double[] {0.0, 0.0},
                    interpolation,
                    fill);
        }
    },
    ROTATE("Rotate") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.rotate(image, magnitude, interpolation, fill);
        }
    },
    BRIGHTNESS("Brightness") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.adjustBrightness(image, 1.0 + magnitude);
        }
    },
    COLOR("Color") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.adjustSaturation(image, 1.0 + magnitude);
        }
    },
    CONTRAST("Contrast") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.adjustContrast(image, 1.0 + magnitude);
        }
    },
    SHARPNESS("Sharpness") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.adjustSharpness(image, 1.0 + magnitude);
        }
    },
    POSTERIZE("Posterize") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.posterize(image, (int) magnitude);
        }
    },
    SOLARIZE("Solarize") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            // thresholds are on the 0-255 scale
            double threshold = magnitude * image.getDataType().getMaxValue() / 255.0;
            return ImageOps.solarize(image, threshold);
        }
    },
    AUTO_CONTRAST("AutoContrast") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.autocontrast(image);
        }
    },
    EQUALIZE("Equalize") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.equalize(image);
        }
    },
    INVERT("Invert") {
        @Override
        NDImage apply(NDImage image, double magnitude, Interpolation interpolation, Fill fill) {
            return ImageOps.invert(image);
        }
    };

    private final String value;

    Operation(String value) {
        this.value = value;
    }

    /**
     * Applies the operation.
     *
     * @param image the image to transform
     * @param magnitude the strength of the operation, ignored by magnitude-free operations
     * @param interpolation the resampling method of geometric operations
     * @param fill the fill of geometric operations
     * @return the transformed image
     */
    abstract NDImage apply(
            NDImage image, double magnitude, Interpolation interpolation, Fill fill);

    /**
     * Returns the name of the operation as used in policy tables, for example {@code ShearX}.
     *
     * @return the name of the operation
     */
    public String getValue() {
        return value;
    }

    /**
     * Returns the {@code Operation} with the given name.
     *
     * @param value the name of the operation, for example {@code TranslateY}
     * @return the {@code Operation}
     * @throws UnsupportedOperationException if no operation has the given name
     */
    public static Operation fromValue(String value) {
        for (Operation operation : values()) {
            if (operation.value.equals(value)) {
                return operation;
            }
        }
        throw new UnsupportedOperationException("No transform available for " + value);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return value;
    }
}
