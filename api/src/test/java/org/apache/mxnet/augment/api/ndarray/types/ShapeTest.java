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

package org.apache.mxnet.augment.api.ndarray.types;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ShapeTest {

    @Test
    public void testSizeAndDimension() {
        Shape shape = new Shape(2, 3, 4, 5);
        Assert.assertEquals(shape.dimension(), 4);
        Assert.assertEquals(shape.size(), 120);
        Assert.assertEquals(shape.get(-1), 5);
        Assert.assertEquals(shape.get(0), 2);
        Assert.assertEquals(new Shape().size(), 1);
    }

    @Test
    public void testBatchSize() {
        Assert.assertEquals(new Shape(3, 4, 5).getBatchSize(), 1);
        Assert.assertEquals(new Shape(2, 3, 4, 5).getBatchSize(), 2);
        Assert.assertEquals(new Shape(2, 6, 3, 4, 5).getBatchSize(), 12);
        Assert.assertEquals(new Shape(0, 3, 4, 5).getBatchSize(), 0);
        Assert.assertTrue(new Shape(1, 1, 1).isImage());
        Assert.assertFalse(new Shape(4, 5).isImage());
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testBatchSizeOfNonImage() {
        new Shape(4, 5).getBatchSize();
    }

    @Test
    public void testImmutable() {
        long[] dims = {3, 4, 4};
        Shape shape = new Shape(dims);
        dims[0] = 1;
        Assert.assertEquals(shape, new Shape(3, 4, 4));
        Assert.assertEquals(shape.hashCode(), new Shape(3, 4, 4).hashCode());
        Assert.assertEquals(shape.toString(), "(3, 4, 4)");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeDimension() {
        new Shape(3, -1, 4);
    }
}
