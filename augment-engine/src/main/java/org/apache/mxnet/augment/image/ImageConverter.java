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

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import org.apache.mxnet.augment.api.ndarray.NDImage;
import org.apache.mxnet.augment.api.ndarray.types.DataType;
import org.apache.mxnet.augment.api.ndarray.types.Shape;

/** Converts between AWT {@link BufferedImage}s and {@code uint8} {@link NDImage}s. */
public final class ImageConverter {

    private ImageConverter() {}

    /**
     * Converts a {@link BufferedImage} to a {@code (C, H, W)} {@code uint8} image.
     *
     * <p>Gray rasters give one channel, every other raster is read as RGB with three channels;
     * alpha is dropped.
     *
     * @param image the image to convert
     * @return the pixel tensor of the image
     */
    public static NDImage toNDImage(BufferedImage image) {
        int h = image.getHeight();
        int w = image.getWidth();
        int plane = h * w;
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            Raster raster = image.getRaster();
            float[] values = new float[plane];
            for (int y = 0; y < h; ++y) {
                for (int x = 0; x < w; ++x) {
                    values[y * w + x] = raster.getSample(x, y, 0);
                }
            }
            return NDImage.create(values, new Shape(1, h, w), DataType.UINT8);
        }
        float[] values = new float[3 * plane];
        for (int y = 0; y < h; ++y) {
            for (int x = 0; x < w; ++x) {
                int rgb = image.getRGB(x, y);
                int pixel = y * w + x;
                values[pixel] = (rgb >> 16) & 0xFF;
                values[plane + pixel] = (rgb >> 8) & 0xFF;
                values[2 * plane + pixel] = rgb & 0xFF;
            }
        }
        return NDImage.create(values, new Shape(3, h, w), DataType.UINT8);
    }

    /**
     * Converts a single {@code (C, H, W)} image with 1 or 3 channels to a {@link BufferedImage}.
     *
     * <p>Floating images are rescaled to {@code uint8} first.
     *
     * @param image the image to convert
     * @return a {@code TYPE_BYTE_GRAY} or {@code TYPE_INT_RGB} image
     * @throws IllegalArgumentException if the image is batched or has another channel count
     */
    public static BufferedImage toBufferedImage(NDImage image) {
        if (image.getShape().dimension() != 3) {
            throw new IllegalArgumentException(
                    "Only a single (C, H, W) image converts to a BufferedImage, got "
                            + image.getShape());
        }
        NDImage pixels = image.convertTo(DataType.UINT8);
        int channels = pixels.getChannels();
        int h = pixels.getHeight();
        int w = pixels.getWidth();
        if (channels == 1) {
            BufferedImage gray = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
            WritableRaster raster = gray.getRaster();
            for (int y = 0; y < h; ++y) {
                for (int x = 0; x < w; ++x) {
                    raster.setSample(x, y, 0, (int) pixels.getFloat(0, 0, y, x));
                }
            }
            return gray;
        } else if (channels == 3) {
            BufferedImage rgb = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
            for (int y = 0; y < h; ++y) {
                for (int x = 0; x < w; ++x) {
                    int r = (int) pixels.getFloat(0, 0, y, x);
                    int g = (int) pixels.getFloat(0, 1, y, x);
                    int b = (int) pixels.getFloat(0, 2, y, x);
                    rgb.setRGB(x, y, (r << 16) | (g << 8) | b);
                }
            }
            return rgb;
        }
        throw new IllegalArgumentException(
                "Only 1 or 3 channel images convert to a BufferedImage, got " + channels);
    }
}
