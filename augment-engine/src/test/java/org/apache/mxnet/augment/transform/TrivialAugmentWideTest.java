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

import java.util.EnumSet;
import java.util.Random;
import java.util.Set;
import org.apache.mxnet.augment.api.ndarray.NDImage;
import org.apache.mxnet.augment.api.ndarray.types.Shape;
import org.apache.mxnet.augment.image.Fill;
import org.apache.mxnet.augment.image.Interpolation;
import org.testng.Assert;
import org.testng.annotations.Test;

public class TrivialAugmentWideTest {

    @Test
    public void testSingleOperation() {
        NDImage image = AutoAugmentTest.randomImage(new Shape(3, 16, 16), 7);
        TrivialAugmentWide trivialAugment =
                TrivialAugmentWide.builder().optFill(new int[] {1, 2, 3}).build();
        Set<Operation> seen = EnumSet.noneOf(Operation.class);
        for (long seed = 0; seed < 100; ++seed) {
            Random random = new Random(seed);
            OperationEntry choice = AugmentationSpace.TRIVIAL_AUGMENT_WIDE.randomEntry(random);
            double magnitude =
                    MagnitudeSampler.sampleRandomBin(
                            choice.getEntry(), 31, 31, SamplingParams.of(image), random);
            NDImage expected =
                    OperationDispatcher.apply(
                            image,
                            choice.getOperation(),
                            magnitude,
                            Interpolation.NEAREST,
                            Fill.of(1f, 2f, 3f));
            Assert.assertEquals(trivialAugment.augment(image, new Random(seed)), expected);
            seen.add(choice.getOperation());
        }
        Assert.assertTrue(seen.size() > 10, "Too few operations drawn: " + seen);
    }

    @Test
    public void testBinCount() {
        NDImage image = AutoAugmentTest.randomImage(new Shape(1, 8, 8), 8);
        TrivialAugmentWide trivialAugment =
                TrivialAugmentWide.builder()
                        .optNumMagnitudeBins(5)
                        .optInterpolation("bilinear")
                        .build();
        Assert.assertEquals(trivialAugment.getNumMagnitudeBins(), 5);
        Assert.assertEquals(trivialAugment.getInterpolation(), Interpolation.BILINEAR);
        Assert.assertEquals(
                trivialAugment.augment(image, new Random(1)),
                trivialAugment.augment(image, new Random(1)));
        Assert.assertEquals(
                trivialAugment.toString(),
                "TrivialAugmentWide(num_magnitude_bins=5, interpolation=bilinear, fill=0.0)");
    }

    @Test
    public void testPassthrough() {
        Object mask = Boolean.TRUE;
        Assert.assertSame(TrivialAugmentWide.builder().build().transform(mask), mask);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidFill() {
        TrivialAugmentWide.builder().optFill("black");
    }
}
