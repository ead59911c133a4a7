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

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Random;
import org.apache.mxnet.augment.api.exception.AugmentException;
import org.apache.mxnet.augment.api.exception.UnrecognizedPolicyException;
import org.apache.mxnet.augment.api.ndarray.NDImage;
import org.apache.mxnet.augment.api.ndarray.types.DataType;
import org.apache.mxnet.augment.api.ndarray.types.Shape;
import org.apache.mxnet.augment.image.ImageOps;
import org.apache.mxnet.augment.image.Interpolation;
import org.testng.Assert;
import org.testng.annotations.Test;

public class AutoAugmentTest {

    static NDImage randomImage(Shape shape, long seed) {
        Random random = new Random(seed);
        float[] values = new float[Math.toIntExact(shape.size())];
        for (int i = 0; i < values.length; ++i) {
            values[i] = random.nextInt(256);
        }
        return NDImage.create(values, shape, DataType.UINT8);
    }

    @Test
    public void testPolicyTables() {
        for (AutoAugmentPolicy policy : AutoAugmentPolicy.values()) {
            List<SubPolicy> subPolicies = policy.getSubPolicies();
            Assert.assertEquals(subPolicies.size(), 25, policy.toString());
            for (SubPolicy subPolicy : subPolicies) {
                Assert.assertEquals(subPolicy.getSteps().size(), 2);
                for (PolicyStep step : subPolicy.getSteps()) {
                    AugmentationEntry entry =
                            AugmentationSpace.AUTO_AUGMENT.lookup(step.getOperation());
                    Assert.assertEquals(step.hasMagnitudeBin(), !entry.isMagnitudeFree());
                }
            }
        }

        SubPolicy first = AutoAugmentPolicy.IMAGENET.getSubPolicies().get(0);
        PolicyStep posterize = first.getSteps().get(0);
        Assert.assertEquals(posterize.getOperation(), Operation.POSTERIZE);
        Assert.assertEquals(posterize.getProbability(), 0.4);
        Assert.assertEquals(posterize.getMagnitudeBin(), 8);
        Assert.assertEquals(first.getSteps().get(1).getOperation(), Operation.ROTATE);

        PolicyStep autoContrast =
                AutoAugmentPolicy.IMAGENET.getSubPolicies().get(1).getSteps().get(1);
        Assert.assertEquals(autoContrast.getOperation(), Operation.AUTO_CONTRAST);
        Assert.assertFalse(autoContrast.hasMagnitudeBin());
        Assert.assertEquals(autoContrast.getMagnitudeBin(), -1);

        SubPolicy last = AutoAugmentPolicy.SVHN.getSubPolicies().get(24);
        Assert.assertEquals(last.toString(), "[(ShearX, 0.7, 2), (Invert, 0.1, None)]");
    }

    @Test
    public void testDeterministic() {
        NDImage image = randomImage(new Shape(3, 24, 24), 1);
        for (AutoAugmentPolicy policy : AutoAugmentPolicy.values()) {
            AutoAugment autoAugment = AutoAugment.builder().optPolicy(policy).build();
            for (long seed = 0; seed < 20; ++seed) {
                NDImage a = autoAugment.augment(image, new Random(seed));
                NDImage b = autoAugment.augment(image, new Random(seed));
                Assert.assertEquals(a, b);
                Assert.assertEquals(a.getShape(), image.getShape());
            }
        }
    }

    @Test
    public void testProbabilityGate() {
        NDImage image = randomImage(new Shape(3, 8, 8), 2);
        AutoAugment autoAugment = AutoAugment.builder().build();
        SubPolicy subPolicy =
                new SubPolicy(
                        new PolicyStep(Operation.INVERT, 1.0),
                        new PolicyStep(Operation.ROTATE, 0.0, 9));
        SamplingParams params = SamplingParams.of(image);
        for (long seed = 0; seed < 10; ++seed) {
            NDImage result =
                    autoAugment.applySubPolicy(image, subPolicy, params, new Random(seed));
            Assert.assertEquals(result, ImageOps.invert(image));
        }
    }

    @Test
    public void testFixedBin() {
        NDImage image = randomImage(new Shape(3, 8, 8), 3);
        AutoAugment autoAugment = AutoAugment.builder().build();
        // bin 2 of Posterize keeps 7 bits
        SubPolicy subPolicy =
                new SubPolicy(
                        new PolicyStep(Operation.POSTERIZE, 1.0, 2),
                        new PolicyStep(Operation.EQUALIZE, 0.0));
        NDImage result =
                autoAugment.applySubPolicy(
                        image, subPolicy, SamplingParams.of(image), new Random(0));
        Assert.assertEquals(result, ImageOps.posterize(image, 7));
    }

    @Test
    public void testPassthrough() {
        AutoAugment autoAugment = AutoAugment.builder().optPolicy("svhn").build();
        String label = "cat";
        Assert.assertSame(autoAugment.transform(label, new Random(0)), label);
        Integer index = 3;
        Assert.assertSame(autoAugment.transform(index), index);
        Assert.assertNull(autoAugment.transform(null, new Random(0)));
    }

    @Test
    public void testBufferedImage() {
        BufferedImage image = new BufferedImage(12, 10, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 10; ++y) {
            for (int x = 0; x < 12; ++x) {
                image.setRGB(x, y, (x * 20) << 16 | (y * 20) << 8 | 90);
            }
        }
        Object result = AutoAugment.builder().build().transform(image, new Random(4));
        Assert.assertTrue(result instanceof BufferedImage);
        BufferedImage output = (BufferedImage) result;
        Assert.assertEquals(output.getWidth(), 12);
        Assert.assertEquals(output.getHeight(), 10);
    }

    @Test
    public void testBatch() {
        NDImage image = randomImage(new Shape(2, 3, 8, 8), 5);
        NDImage result = AutoAugment.builder().build().augment(image, new Random(6));
        Assert.assertEquals(result.getShape(), image.getShape());
    }

    @Test(expectedExceptions = UnrecognizedPolicyException.class)
    public void testUnrecognizedPolicy() {
        AutoAugment.builder().optPolicy("coco").build();
    }

    @Test
    public void testToString() {
        AutoAugment autoAugment =
                AutoAugment.builder()
                        .optPolicy(AutoAugmentPolicy.CIFAR10)
                        .optInterpolation(Interpolation.BILINEAR)
                        .optFill(128)
                        .build();
        Assert.assertEquals(
                autoAugment.toString(),
                "AutoAugment(policy=cifar10, interpolation=bilinear, fill=128.0)");
        Assert.assertEquals(autoAugment.getPolicy(), AutoAugmentPolicy.CIFAR10);
    }

    @Test(expectedExceptions = AugmentException.class)
    public void testTableSize() {
        String json = "[[[\"Invert\", 0.5, null], [\"Equalize\", 0.5, null]]]";
        JsonArray table = JsonParser.parseString(json).getAsJsonArray();
        PolicyTables.parse(AutoAugmentPolicy.IMAGENET, table);
    }

    @Test
    public void testInvalidSteps() {
        String[] steps = {
            "[\"Equalize\", 0.5, 3]", "[\"Rotate\", 0.5, null]", "[\"Rotate\", 0.5, 10]",
            "[\"Rotate\", 1.5, 1]", "[\"Rotate\", 0.5]"
        };
        for (String step : steps) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < 25; ++i) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append('[').append(step).append(", [\"Invert\", 0.5, null]]");
            }
            sb.append(']');
            JsonArray table = JsonParser.parseString(sb.toString()).getAsJsonArray();
            try {
                PolicyTables.parse(AutoAugmentPolicy.SVHN, table);
                Assert.fail("Expected AugmentException for step " + step);
            } catch (AugmentException e) {
                Assert.assertNotNull(e.getMessage());
            }
        }
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testUnknownOperationInTable() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < 25; ++i) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append("[[\"Cutout\", 0.5, 1], [\"Invert\", 0.5, null]]");
        }
        sb.append(']');
        JsonArray table = JsonParser.parseString(sb.toString()).getAsJsonArray();
        PolicyTables.parse(AutoAugmentPolicy.CIFAR10, table);
    }
}
