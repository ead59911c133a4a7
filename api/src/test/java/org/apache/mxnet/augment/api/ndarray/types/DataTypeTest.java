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

public class DataTypeTest {

    @Test
    public void testCastUint8() {
        Assert.assertEquals(DataType.UINT8.cast(-3.5), 0f);
        Assert.assertEquals(DataType.UINT8.cast(Double.NaN), 0f);
        Assert.assertEquals(DataType.UINT8.cast(12.9), 12f);
        Assert.assertEquals(DataType.UINT8.cast(300), 255f);
    }

    @Test
    public void testCastFloat() {
        Assert.assertEquals(DataType.FLOAT32.cast(0.25), 0.25f);
        Assert.assertEquals(DataType.FLOAT32.cast(-0.5), -0.5f);
    }

    @Test
    public void testProperties() {
        Assert.assertEquals(DataType.FLOAT32.toString(), "float32");
        Assert.assertTrue(DataType.FLOAT32.isFloating());
        Assert.assertFalse(DataType.FLOAT32.isInteger());
        Assert.assertTrue(DataType.UINT8.isInteger());
        Assert.assertEquals(DataType.FLOAT32.getMaxValue(), 1f);
        Assert.assertEquals(DataType.UINT8.getMaxValue(), 255f);
    }
}
