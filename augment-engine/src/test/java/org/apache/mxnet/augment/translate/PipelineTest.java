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

package org.apache.mxnet.augment.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.apache.mxnet.augment.api.ndarray.NDImage;
import org.apache.mxnet.augment.api.ndarray.types.DataType;
import org.apache.mxnet.augment.api.ndarray.types.Shape;
import org.apache.mxnet.augment.api.transform.Transform;
import org.apache.mxnet.augment.transform.AugMix;
import org.apache.mxnet.augment.transform.AutoAugment;
import org.apache.mxnet.augment.transform.RandAugment;
import org.apache.mxnet.augment.transform.TrivialAugmentWide;
import org.testng.Assert;
import org.testng.annotations.Test;

public class PipelineTest {

    private static NDImage image() {
        float[] values = new float[3 * 10 * 10];
        for (int i = 0; i < values.length; ++i) {
            values[i] = (i * 37) % 256;
        }
        return NDImage.create(values, new Shape(3, 10, 10), DataType.UINT8);
    }

    @Test
    public void testOrder() {
        List<String> calls = new ArrayList<>();
        Transform first =
                (input, random) -> {
                    calls.add("first");
                    return input + "-a";
                };
        Transform second =
                (input, random) -> {
                    calls.add("second");
                    return input + "-b";
                };
        Pipeline pipeline = new Pipeline(second).insert(0, first);
        Assert.assertEquals(pipeline.transform("x", new Random(0)), "x-a-b");
        Assert.assertEquals(calls.size(), 2);
        Assert.assertEquals(calls.get(0), "first");
        Assert.assertEquals(pipeline.getTransforms().size(), 2);
    }

    @Test
    public void testSharedRandom() {
        Pipeline pipeline =
                new Pipeline()
                        .add(AutoAugment.builder().build())
                        .add(RandAugment.builder().build())
                        .add(TrivialAugmentWide.builder().build())
                        .add(AugMix.builder().build());
        NDImage input = image();
        Object a = pipeline.transform(input, new Random(42));
        Object b = pipeline.transform(input, new Random(42));
        Assert.assertEquals(a, b);
        Assert.assertEquals(((NDImage) a).getShape(), input.getShape());
    }

    @Test
    public void testPassthrough() {
        Pipeline pipeline =
                new Pipeline(RandAugment.builder().build(), AugMix.builder().build());
        Object label = "dog";
        Assert.assertSame(pipeline.transform(label), label);
        NDImage input = image();
        Assert.assertSame(new Pipeline().transform(input), input);
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testTransformsAreReadOnly() {
        new Pipeline().getTransforms().add((input, random) -> input);
    }
}
