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
import org.apache.mxnet.augment.api.ndarray.NDImage;
import org.apache.mxnet.augment.api.ndarray.types.DataType;
import org.apache.mxnet.augment.api.ndarray.types.Shape;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ImageConverterTest {

    @Test
    public void testRgb() {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, 0xFF8000);
        image.setRGB(1, 0, 0x0000FF);
        NDImage array = ImageConverter.toNDImage(image);
        Assert.assertEquals(array.getShape(), new Shape(3, 1, 2));
        Assert.assertEquals(array.getDataType(), DataType.UINT8);
        Assert.assertEquals(array.toFloatArray(), new float[] {255, 0, 128, 0, 0, 255});

        BufferedImage back = ImageConverter.toBufferedImage(array);
        Assert.assertEquals(back.getType(), BufferedImage.TYPE_INT_RGB);
        Assert.assertEquals(back.getRGB(0, 0) & 0xFFFFFF, 0xFF8000);
        Assert.assertEquals(back.getRGB(1, 0) & 0xFFFFFF, 0x0000FF);
    }

    @Test
    public void testGray() {
        BufferedImage image = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_GRAY);
        image.getRaster().setSample(1, 0, 0, 200);
        NDImage array = ImageConverter.toNDImage(image);
        Assert.assertEquals(array.getShape(), new Shape(1, 2, 2));
        Assert.assertEquals(array.toFloatArray(), new float[] {0, 200, 0, 0});

        BufferedImage back = ImageConverter.toBufferedImage(array);
        Assert.assertEquals(back.getType(), BufferedImage.TYPE_BYTE_GRAY);
        Assert.assertEquals(back.getRaster().getSample(1, 0, 0), 200);
    }

    @Test
    public void testFloatImage() {
        NDImage array = NDImage.full(new Shape(3, 2, 2), 1f, DataType.FLOAT32);
        BufferedImage image = ImageConverter.toBufferedImage(array);
        Assert.assertEquals(image.getRGB(1, 1) & 0xFFFFFF, 0xFFFFFF);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testBatchedImage() {
        ImageConverter.toBufferedImage(NDImage.zeros(new Shape(2, 3, 2, 2), DataType.UINT8));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testChannelCount() {
        ImageConverter.toBufferedImage(NDImage.zeros(new Shape(4, 2, 2), DataType.UINT8));
    }
}
