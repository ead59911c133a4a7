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
import org.apache.mxnet.augment.api.ndarray.types.Shape;
import org.apache.mxnet.augment.util.Assertions;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ImageOpsTest {

    private static NDImage ramp(int channels, int h, int w) {
        float[] values = new float[channels * h * w];
        for (int i = 0; i < values.length; ++i) {
            values[i] = i % 256;
        }
        return NDImage.create(values, new Shape(channels, h, w), DataType.UINT8);
    }

    private static NDImage uint8(Shape shape, float... values) {
        return NDImage.create(values, shape, DataType.UINT8);
    }

    @Test
    public void testTranslate() {
        NDImage image = uint8(new Shape(1, 1, 4), 1, 2, 3, 4);
        NDImage shifted =
                ImageOps.affine(
                        image,
                        0.0,
                        new int[] {1, 0},
                        1.0,
                        new double[] {0, 0},
                        Interpolation.NEAREST,
                        Fill.of(9f));
        Assert.assertEquals(shifted, uint8(new Shape(1, 1, 4), 9, 1, 2, 3));

        NDImage up =
                ImageOps.affine(
                        ramp(1, 3, 2),
                        0.0,
                        new int[] {0, -1},
                        1.0,
                        new double[] {0, 0},
                        Interpolation.NEAREST,
                        Fill.zero());
        Assert.assertEquals(up, uint8(new Shape(1, 3, 2), 2, 3, 4, 5, 0, 0));
    }

    @Test
    public void testTranslateBilinearFill() {
        NDImage image =
                NDImage.create(
                        new float[] {0.1f, 0.2f, 0.3f}, new Shape(1, 1, 3), DataType.FLOAT32);
        NDImage shifted =
                ImageOps.affine(
                        image,
                        0.0,
                        new int[] {1, 0},
                        1.0,
                        new double[] {0, 0},
                        Interpolation.BILINEAR,
                        Fill.of(0.5f));
        Assertions.assertAlmostEquals(
                shifted,
                NDImage.create(
                        new float[] {0.5f, 0.1f, 0.2f}, new Shape(1, 1, 3), DataType.FLOAT32));
    }

    @Test
    public void testIdentityAffine() {
        NDImage image = ramp(3, 5, 4);
        for (Interpolation interpolation : Interpolation.values()) {
            NDImage same =
                    ImageOps.affine(
                            image,
                            0.0,
                            new int[] {0, 0},
                            1.0,
                            new double[] {0, 0},
                            interpolation,
                            Fill.zero());
            Assert.assertEquals(same, image);
        }
    }

    @Test
    public void testRotate() {
        NDImage image = uint8(new Shape(1, 3, 3), 0, 1, 2, 3, 4, 5, 6, 7, 8);
        NDImage rotated = ImageOps.rotate(image, 90, Interpolation.NEAREST, Fill.zero());
        // counter-clockwise: the right column becomes the top row
        Assert.assertEquals(rotated, uint8(new Shape(1, 3, 3), 2, 5, 8, 1, 4, 7, 0, 3, 6));
    }

    @Test
    public void testBatchedAffineMatchesSingle() {
        NDImage single = ramp(3, 6, 6);
        float[] values = single.toFloatArray();
        float[] batch = new float[values.length * 2];
        System.arraycopy(values, 0, batch, 0, values.length);
        System.arraycopy(values, 0, batch, values.length, values.length);
        NDImage batched = NDImage.create(batch, new Shape(2, 3, 6, 6), DataType.UINT8);

        NDImage expected = ImageOps.rotate(single, 30, Interpolation.BILINEAR, Fill.of(3f));
        NDImage actual = ImageOps.rotate(batched, 30, Interpolation.BILINEAR, Fill.of(3f));
        float[] result = actual.toFloatArray();
        float[] first = new float[values.length];
        float[] second = new float[values.length];
        System.arraycopy(result, 0, first, 0, values.length);
        System.arraycopy(result, values.length, second, 0, values.length);
        Assert.assertEquals(first, expected.toFloatArray());
        Assert.assertEquals(second, expected.toFloatArray());
    }

    @Test
    public void testPerChannelFill() {
        NDImage image = NDImage.zeros(new Shape(3, 2, 2), DataType.UINT8);
        NDImage shifted =
                ImageOps.affine(
                        image,
                        0.0,
                        new int[] {5, 0},
                        1.0,
                        new double[] {0, 0},
                        Interpolation.NEAREST,
                        Fill.of(10f, 20f, 30f));
        Assert.assertEquals(shifted.getFloat(0, 0, 0, 0), 10f);
        Assert.assertEquals(shifted.getFloat(0, 1, 1, 1), 20f);
        Assert.assertEquals(shifted.getFloat(0, 2, 0, 1), 30f);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testFillChannelMismatch() {
        ImageOps.rotate(ramp(3, 2, 2), 10, Interpolation.NEAREST, Fill.of(1f, 2f));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidTranslate() {
        ImageOps.affine(
                ramp(1, 2, 2),
                0.0,
                new int[] {1},
                1.0,
                new double[] {0, 0},
                Interpolation.NEAREST,
                Fill.zero());
    }

    @Test
    public void testBrightness() {
        NDImage image = uint8(new Shape(1, 1, 3), 0, 100, 200);
        Assert.assertEquals(
                ImageOps.adjustBrightness(image, 2.0), uint8(new Shape(1, 1, 3), 0, 200, 255));
        Assert.assertEquals(
                ImageOps.adjustBrightness(image, 0.0), uint8(new Shape(1, 1, 3), 0, 0, 0));
        Assert.assertEquals(ImageOps.adjustBrightness(image, 1.0), image);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeFactor() {
        ImageOps.adjustBrightness(ramp(1, 2, 2), -0.1);
    }

    @Test
    public void testSaturation() {
        NDImage red = uint8(new Shape(3, 1, 1), 255, 0, 0);
        // 0.2989 * 255 = 76.2
        Assert.assertEquals(
                ImageOps.adjustSaturation(red, 0.0), uint8(new Shape(3, 1, 1), 76, 76, 76));
        Assert.assertEquals(ImageOps.adjustSaturation(red, 1.0), red);

        NDImage gray = ramp(1, 2, 2);
        Assert.assertSame(ImageOps.adjustSaturation(gray, 0.0), gray);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSaturationChannels() {
        ImageOps.adjustSaturation(ramp(2, 2, 2), 0.5);
    }

    @Test
    public void testContrast() {
        NDImage image = uint8(new Shape(1, 2, 2), 0, 10, 20, 30);
        Assert.assertEquals(
                ImageOps.adjustContrast(image, 0.0), uint8(new Shape(1, 2, 2), 15, 15, 15, 15));
        Assert.assertEquals(ImageOps.adjustContrast(image, 1.0), image);
    }

    @Test
    public void testSharpness() {
        NDImage image = uint8(new Shape(1, 3, 3), 0, 0, 0, 0, 255, 0, 0, 0, 0);
        // (255 + 4 * 255) / 13 = 98.08
        Assert.assertEquals(
                ImageOps.adjustSharpness(image, 0.0),
                uint8(new Shape(1, 3, 3), 0, 0, 0, 0, 98, 0, 0, 0, 0));
        Assert.assertEquals(ImageOps.adjustSharpness(image, 1.0), image);

        NDImage small = ramp(3, 2, 5);
        Assert.assertSame(ImageOps.adjustSharpness(small, 0.0), small);
    }

    @Test
    public void testPosterize() {
        NDImage image = uint8(new Shape(1, 1, 3), 171, 15, 255);
        Assert.assertEquals(ImageOps.posterize(image, 4), uint8(new Shape(1, 1, 3), 160, 0, 240));
        Assert.assertEquals(ImageOps.posterize(image, 0), uint8(new Shape(1, 1, 3), 0, 0, 0));
        Assert.assertEquals(ImageOps.posterize(image, 8), image);

        NDImage floats = image.convertTo(DataType.FLOAT32);
        Assert.assertEquals(ImageOps.posterize(floats, 4).getDataType(), DataType.FLOAT32);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testPosterizeBits() {
        ImageOps.posterize(ramp(1, 2, 2), 9);
    }

    @Test
    public void testSolarize() {
        NDImage zeros = NDImage.zeros(new Shape(3, 4, 4), DataType.UINT8);
        Assert.assertEquals(ImageOps.solarize(zeros, 128), zeros);

        NDImage image = uint8(new Shape(1, 1, 3), 100, 128, 250);
        Assert.assertEquals(
                ImageOps.solarize(image, 128), uint8(new Shape(1, 1, 3), 100, 127, 5));
        Assert.assertEquals(
                ImageOps.solarize(image, 0), uint8(new Shape(1, 1, 3), 155, 127, 5));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSolarizeThreshold() {
        ImageOps.solarize(ramp(1, 2, 2).convertTo(DataType.FLOAT32), 2.0);
    }

    @Test
    public void testAutocontrast() {
        NDImage image = uint8(new Shape(2, 1, 4), 10, 61, 112, 10, 7, 7, 7, 7);
        Assert.assertEquals(
                ImageOps.autocontrast(image),
                uint8(new Shape(2, 1, 4), 0, 127, 255, 0, 7, 7, 7, 7));
    }

    @Test
    public void testEqualize() {
        float[] values = new float[32 * 32];
        for (int i = 0; i < values.length; ++i) {
            values[i] = i < values.length / 2 ? 10 : 20;
        }
        NDImage image = NDImage.create(values, new Shape(1, 32, 32), DataType.UINT8);
        NDImage equalized = ImageOps.equalize(image);
        Assert.assertEquals(equalized.getFloat(0, 0, 0, 0), 0f);
        Assert.assertEquals(equalized.getFloat(0, 0, 31, 31), 255f);

        NDImage constant = NDImage.full(new Shape(3, 4, 4), 42f, DataType.UINT8);
        Assert.assertEquals(ImageOps.equalize(constant), constant);
    }

    @Test
    public void testInvert() {
        NDImage image = uint8(new Shape(1, 1, 3), 0, 100, 255);
        Assert.assertEquals(ImageOps.invert(image), uint8(new Shape(1, 1, 3), 255, 155, 0));

        NDImage floats =
                NDImage.create(new float[] {0.25f, 1f}, new Shape(1, 1, 2), DataType.FLOAT32);
        Assertions.assertAlmostEquals(
                ImageOps.invert(floats),
                NDImage.create(new float[] {0.75f, 0f}, new Shape(1, 1, 2), DataType.FLOAT32));
    }

    @Test
    public void testInputNotMutated() {
        NDImage image = ramp(3, 4, 4);
        float[] before = image.toFloatArray();
        ImageOps.invert(image);
        ImageOps.rotate(image, 45, Interpolation.BILINEAR, Fill.zero());
        ImageOps.adjustSharpness(image, 2.0);
        Assert.assertEquals(image.toFloatArray(), before);
    }
}
