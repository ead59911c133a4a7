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

package org.apache.mxnet.augment.api.transform;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * An interface to apply a random augmentation to an input.
 *
 * <p>A transform recognizes the image values it knows how to augment and returns every other
 * input unchanged, so it can be applied to any element of a training sample.
 */
public interface Transform {

    /**
     * Applies the {@code Transform} to the given input, drawing every random decision from the
     * given generator.
     *
     * @param input the value on which the {@code Transform} is applied
     * @param random the source of randomness for this call
     * @return the output of the {@code Transform}, or {@code input} itself if it is not an image
     */
    Object transform(Object input, Random random);

    /**
     * Applies the {@code Transform} to the given input using the ambient per-thread generator.
     *
     * @param input the value on which the {@code Transform} is applied
     * @return the output of the {@code Transform}, or {@code input} itself if it is not an image
     */
    default Object transform(Object input) {
        return transform(input, ThreadLocalRandom.current());
    }
}
