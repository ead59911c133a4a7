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

import org.apache.mxnet.augment.api.ndarray.NDImage;
import org.apache.mxnet.augment.api.ndarray.types.DataType;

/**
 * Geometric and photometric operations on {@link NDImage}s.
 *
 * <p>Every operation works on each image of a batch independently and returns a new {@code
 * NDImage} with the data type of its input. Pixel arithmetic is done in double precision; results
 * of {@code uint8} images are clamped to {@code [0, 255]} and truncated, except for resampling and
 * blurring which round to the nearest integer first.
 */
public final class ImageOps {

    private static final double SHARPNESS_CENTER_WEIGHT = 5.0;
    private static final double SHARPNESS_KERNEL_SUM = 13.0;

    private ImageOps() {}

    /**
     * Applies an affine transformation around the image center, keeping the image size.
     *
     * @param image the image to transform
     * @param angle the clockwise rotation angle in degrees
     * @param translate the horizontal and vertical translation in pixels
     * @param scale the overall scale
     * @param shear the x and y shear angles in degrees
     * @param interpolation the resampling method
     * @param fill the value of the pixels moved in from outside the image
     * @return the transformed image
     */
    public static NDImage affine(
            NDImage image,
            double angle,
            int[] translate,
            double scale,
            double[] shear,
            Interpolation interpolation,
            Fill fill) {
        if (translate.length != 2) {
            throw new IllegalArgumentException("translate should be a sequence of length 2");
        }
        if (shear.length != 2) {
            throw new IllegalArgumentException("shear should be a sequence of length 2");
        }
        if (scale <= 0.0) {
            throw new IllegalArgumentException("Argument scale should be positive");
        }
        double[] matrix =
                inverseAffineMatrix(angle, translate[0], translate[1], scale, shear[0], shear[1]);
        return applyGridTransform(image, matrix, interpolation, fill);
    }

    /**
     * Rotates the image counter-clockwise around its center, keeping the image size.
     *
     * @param image the image to rotate
     * @param angle the counter-clockwise rotation angle in degrees
     * @param interpolation the resampling method
     * @param fill the value of the pixels moved in from outside the image
     * @return the rotated image
     */
    public static NDImage rotate(
            NDImage image, double angle, Interpolation interpolation, Fill fill) {
        double[] matrix = inverseAffineMatrix(-angle, 0, 0, 1.0, 0, 0);
        return applyGridTransform(image, matrix, interpolation, fill);
    }

    /**
     * Computes the matrix mapping output coordinates to input coordinates, both relative to the
     * image center.
     *
     * <p>The forward transformation is {@code T * C * RSS * C^-1} with the translation {@code T},
     * the center shift {@code C} and the rotation-scale-shear {@code RSS}; the inverse is returned
     * as the first two rows of a 3x3 matrix.
     */
    static double[] inverseAffineMatrix(
            double angle, double tx, double ty, double scale, double shearX, double shearY) {
        double rot = Math.toRadians(angle);
        double sx = Math.toRadians(shearX);
        double sy = Math.toRadians(shearY);

        double a = Math.cos(rot - sy) / Math.cos(sy);
        double b = -Math.cos(rot - sy) * Math.tan(sx) / Math.cos(sy) - Math.sin(rot);
        double c = Math.sin(rot - sy) / Math.cos(sy);
        double d = -Math.sin(rot - sy) * Math.tan(sx) / Math.cos(sy) + Math.cos(rot);

        double[] matrix = {d / scale, -b / scale, 0.0, -c / scale, a / scale, 0.0};
        matrix[2] += matrix[0] * -tx + matrix[1] * -ty;
        matrix[5] += matrix[3] * -tx + matrix[4] * -ty;
        return matrix;
    }

    private static NDImage applyGridTransform(
            NDImage image, double[] matrix, Interpolation interpolation, Fill fill) {
        int batch = image.getBatchSize();
        int channels = image.getChannels();
        int h = image.getHeight();
        int w = image.getWidth();
        int plane = h * w;
        boolean round = image.getDataType().isInteger();
        float[] fills = new float[channels];
        for (int ch = 0; ch < channels; ++ch) {
            fills[ch] = fill.get(ch, channels);
        }

        float[] src = image.toFloatArray();
        float[] out = new float[src.length];
        double cx = (w - 1) * 0.5;
        double cy = (h - 1) * 0.5;
        for (int y = 0; y < h; ++y) {
            double yc = y - cy;
            for (int x = 0; x < w; ++x) {
                double xc = x - cx;
                double px = matrix[0] * xc + matrix[1] * yc + matrix[2] + cx;
                double py = matrix[3] * xc + matrix[4] * yc + matrix[5] + cy;
                int pixel = y * w + x;
                if (interpolation == Interpolation.NEAREST) {
                    int ix = (int) Math.rint(px);
                    int iy = (int) Math.rint(py);
                    boolean inside = ix >= 0 && ix < w && iy >= 0 && iy < h;
                    for (int n = 0; n < batch; ++n) {
                        for (int ch = 0; ch < channels; ++ch) {
                            int offset = (n * channels + ch) * plane;
                            out[offset + pixel] = inside ? src[offset + iy * w + ix] : fills[ch];
                        }
                    }
                } else {
                    sampleBilinear(src, out, px, py, pixel, batch, channels, h, w, fills, round);
                }
            }
        }
        return NDImage.create(out, image.getShape(), image.getDataType());
    }

    private static void sampleBilinear(
            float[] src,
            float[] out,
            double px,
            double py,
            int pixel,
            int batch,
            int channels,
            int h,
            int w,
            float[] fills,
            boolean round) {
        int plane = h * w;
        int x0 = (int) Math.floor(px);
        int y0 = (int) Math.floor(py);
        double fx = px - x0;
        double fy = py - y0;
        int[] xs = {x0, x0 + 1, x0, x0 + 1};
        int[] ys = {y0, y0, y0 + 1, y0 + 1};
        double[] weights = {(1 - fx) * (1 - fy), fx * (1 - fy), (1 - fx) * fy, fx * fy};
        // coverage of the sampling footprint by the image, the "mask" channel
        double mask = 0.0;
        for (int k = 0; k < 4; ++k) {
            if (xs[k] >= 0 && xs[k] < w && ys[k] >= 0 && ys[k] < h) {
                mask += weights[k];
            } else {
                weights[k] = 0.0;
            }
        }
        for (int n = 0; n < batch; ++n) {
            for (int ch = 0; ch < channels; ++ch) {
                int offset = (n * channels + ch) * plane;
                double value = 0.0;
                for (int k = 0; k < 4; ++k) {
                    if (weights[k] != 0.0) {
                        value += weights[k] * src[offset + ys[k] * w + xs[k]];
                    }
                }
                value = value * mask + (1.0 - mask) * fills[ch];
                out[offset + pixel] = (float) (round ? Math.rint(value) : value);
            }
        }
    }

    /**
     * Adjusts the brightness by blending with a black image.
     *
     * @param image the image to adjust
     * @param factor 0 gives a black image, 1 the original image, 2 doubles the brightness
     * @return the adjusted image
     */
    public static NDImage adjustBrightness(NDImage image, double factor) {
        checkFactor("brightness", factor);
        return blend(image, new float[1], factor, true);
    }

    /**
     * Adjusts the color saturation by blending with the grayscale image.
     *
     * <p>Single channel images are returned unchanged.
     *
     * @param image the image to adjust
     * @param factor 0 gives a grayscale image, 1 the original image
     * @return the adjusted image
     */
    public static NDImage adjustSaturation(NDImage image, double factor) {
        checkFactor("saturation", factor);
        int channels = checkColorChannels(image);
        if (channels == 1) {
            return image;
        }
        float[] gray = grayscale(image);
        int plane = image.getHeight() * image.getWidth();
        float[] degenerate = new float[Math.toIntExact(image.getShape().size())];
        for (int n = 0; n < image.getBatchSize(); ++n) {
            for (int ch = 0; ch < channels; ++ch) {
                System.arraycopy(
                        gray, n * plane, degenerate, (n * channels + ch) * plane, plane);
            }
        }
        return blend(image, degenerate, factor, false);
    }

    /**
     * Adjusts the contrast by blending with the mean gray level of each image.
     *
     * @param image the image to adjust
     * @param factor 0 gives a solid gray image, 1 the original image
     * @return the adjusted image
     */
    public static NDImage adjustContrast(NDImage image, double factor) {
        checkFactor("contrast", factor);
        int channels = checkColorChannels(image);
        int plane = image.getHeight() * image.getWidth();
        int imageSize = channels * plane;
        float[] values = channels == 3 ? grayscale(image) : image.toFloatArray();
        float[] degenerate = new float[Math.toIntExact(image.getShape().size())];
        for (int n = 0; n < image.getBatchSize(); ++n) {
            double sum = 0.0;
            for (int i = 0; i < plane; ++i) {
                sum += values[n * plane + i];
            }
            float mean = plane == 0 ? 0f : (float) (sum / plane);
            for (int i = 0; i < imageSize; ++i) {
                degenerate[n * imageSize + i] = mean;
            }
        }
        return blend(image, degenerate, factor, false);
    }

    /**
     * Adjusts the sharpness by blending with a smoothed copy of the image.
     *
     * <p>Images of height or width of at most 2 pixels are returned unchanged.
     *
     * @param image the image to adjust
     * @param factor 0 gives a blurred image, 1 the original image, 2 a sharpened image
     * @return the adjusted image
     */
    public static NDImage adjustSharpness(NDImage image, double factor) {
        checkFactor("sharpness", factor);
        int h = image.getHeight();
        int w = image.getWidth();
        if (h <= 2 || w <= 2) {
            return image;
        }
        boolean round = image.getDataType().isInteger();
        float[] src = image.toFloatArray();
        float[] degenerate = src.clone();
        int plane = h * w;
        int planes = image.getBatchSize() * image.getChannels();
        for (int p = 0; p < planes; ++p) {
            int offset = p * plane;
            for (int y = 1; y < h - 1; ++y) {
                for (int x = 1; x < w - 1; ++x) {
                    double sum = 0.0;
                    for (int dy = -1; dy <= 1; ++dy) {
                        for (int dx = -1; dx <= 1; ++dx) {
                            sum += src[offset + (y + dy) * w + x + dx];
                        }
                    }
                    int center = offset + y * w + x;
                    sum += (SHARPNESS_CENTER_WEIGHT - 1) * src[center];
                    double blurred = sum / SHARPNESS_KERNEL_SUM;
                    degenerate[center] = (float) (round ? Math.rint(blurred) : blurred);
                }
            }
        }
        return blend(image, degenerate, factor, false);
    }

    /**
     * Reduces the number of bits of each channel.
     *
     * <p>Floating images are quantized to 256 levels first and converted back afterwards.
     *
     * @param image the image to posterize
     * @param bits the number of bits to keep, in {@code [0, 8]}
     * @return the posterized image
     */
    public static NDImage posterize(NDImage image, int bits) {
        if (bits < 0 || bits > 8) {
            throw new IllegalArgumentException(
                    "The number of bits should be between 0 and 8. Got " + bits);
        }
        if (image.getDataType().isFloating()) {
            return posterize(image.convertTo(DataType.UINT8), bits)
                    .convertTo(image.getDataType());
        }
        int mask = -(1 << (8 - bits));
        float[] values = image.toFloatArray();
        for (int i = 0; i < values.length; ++i) {
            values[i] = ((int) values[i]) & mask;
        }
        return NDImage.create(values, image.getShape(), image.getDataType());
    }

    /**
     * Inverts every pixel value greater than or equal to the threshold.
     *
     * @param image the image to solarize
     * @param threshold the threshold, in the value range of the image
     * @return the solarized image
     */
    public static NDImage solarize(NDImage image, double threshold) {
        float bound = image.getDataType().getMaxValue();
        if (threshold > bound) {
            throw new IllegalArgumentException(
                    "Threshold " + threshold + " should be less than bound of img " + bound);
        }
        float[] values = image.toFloatArray();
        for (int i = 0; i < values.length; ++i) {
            if (values[i] >= threshold) {
                values[i] = bound - values[i];
            }
        }
        return NDImage.create(values, image.getShape(), image.getDataType());
    }

    /**
     * Stretches each channel so that its darkest pixel becomes 0 and its lightest the maximum
     * value. Constant channels are left unchanged.
     *
     * @param image the image to adjust
     * @return the adjusted image
     */
    public static NDImage autocontrast(NDImage image) {
        float bound = image.getDataType().getMaxValue();
        float[] values = image.toFloatArray();
        int plane = image.getHeight() * image.getWidth();
        int planes = image.getBatchSize() * image.getChannels();
        for (int p = 0; p < planes; ++p) {
            int offset = p * plane;
            float min = Float.POSITIVE_INFINITY;
            float max = Float.NEGATIVE_INFINITY;
            for (int i = offset; i < offset + plane; ++i) {
                min = Math.min(min, values[i]);
                max = Math.max(max, values[i]);
            }
            double scale;
            if (min == max) {
                min = 0f;
                scale = 1.0;
            } else {
                scale = bound / (double) (max - min);
            }
            for (int i = offset; i < offset + plane; ++i) {
                values[i] = (float) clamp((values[i] - min) * scale, bound);
            }
        }
        return NDImage.create(values, image.getShape(), image.getDataType());
    }

    /**
     * Equalizes the histogram of each channel.
     *
     * <p>Floating images are quantized to 256 levels first and converted back afterwards.
     *
     * @param image the image to equalize
     * @return the equalized image
     */
    public static NDImage equalize(NDImage image) {
        if (image.getDataType().isFloating()) {
            return equalize(image.convertTo(DataType.UINT8)).convertTo(image.getDataType());
        }
        float[] values = image.toFloatArray();
        int plane = image.getHeight() * image.getWidth();
        int planes = image.getBatchSize() * image.getChannels();
        for (int p = 0; p < planes; ++p) {
            equalizeChannel(values, p * plane, plane);
        }
        return NDImage.create(values, image.getShape(), image.getDataType());
    }

    private static void equalizeChannel(float[] values, int offset, int length) {
        long[] hist = new long[256];
        for (int i = offset; i < offset + length; ++i) {
            hist[(int) values[i]]++;
        }
        // pixels of every populated bin but the last one
        long last = 0;
        long total = 0;
        for (long count : hist) {
            if (count != 0) {
                total += last;
                last = count;
            }
        }
        long step = total / 255;
        if (step == 0) {
            return;
        }
        int[] lut = new int[256];
        long cumulative = 0;
        for (int i = 0; i < 255; ++i) {
            cumulative += hist[i];
            lut[i + 1] = (int) Math.min(255, (cumulative + step / 2) / step);
        }
        for (int i = offset; i < offset + length; ++i) {
            values[i] = lut[(int) values[i]];
        }
    }

    /**
     * Inverts the colors of the image.
     *
     * @param image the image to invert
     * @return the inverted image
     */
    public static NDImage invert(NDImage image) {
        float bound = image.getDataType().getMaxValue();
        float[] values = image.toFloatArray();
        for (int i = 0; i < values.length; ++i) {
            values[i] = bound - values[i];
        }
        return NDImage.create(values, image.getShape(), image.getDataType());
    }

    /**
     * Computes the luminance of RGB images, {@code 0.2989 R + 0.587 G + 0.114 B}, cast to the
     * image's data type.
     *
     * @param image an image with 3 channels
     * @return the luminance planes, one per image of the batch
     */
    static float[] grayscale(NDImage image) {
        DataType type = image.getDataType();
        int plane = image.getHeight() * image.getWidth();
        int batch = image.getBatchSize();
        float[] src = image.toFloatArray();
        float[] gray = new float[batch * plane];
        for (int n = 0; n < batch; ++n) {
            int offset = n * 3 * plane;
            for (int i = 0; i < plane; ++i) {
                double r = src[offset + i];
                double g = src[offset + plane + i];
                double b = src[offset + 2 * plane + i];
                gray[n * plane + i] = type.cast(0.2989 * r + 0.587 * g + 0.114 * b);
            }
        }
        return gray;
    }

    private static NDImage blend(NDImage image, float[] other, double ratio, boolean broadcast) {
        float bound = image.getDataType().getMaxValue();
        float[] values = image.toFloatArray();
        for (int i = 0; i < values.length; ++i) {
            double b = broadcast ? other[0] : other[i];
            values[i] = (float) clamp(ratio * values[i] + (1.0 - ratio) * b, bound);
        }
        return NDImage.create(values, image.getShape(), image.getDataType());
    }

    private static double clamp(double value, float bound) {
        return Math.max(0.0, Math.min(bound, value));
    }

    private static void checkFactor(String name, double factor) {
        if (factor < 0) {
            throw new IllegalArgumentException(name + " factor (" + factor + ") is negative.");
        }
    }

    private static int checkColorChannels(NDImage image) {
        int channels = image.getChannels();
        if (channels != 1 && channels != 3) {
            throw new IllegalArgumentException(
                    "Input image should have 1 or 3 channels, got " + channels);
        }
        return channels;
    }
}
