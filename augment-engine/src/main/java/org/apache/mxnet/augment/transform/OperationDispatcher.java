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

import org.apache.mxnet.augment.api.ndarray.NDImage;
import org.apache.mxnet.augment.image.Fill;
import org.apache.mxnet.augment.image.Interpolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Applies an {@link Operation} with a concrete magnitude to an image. */
public final class OperationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(OperationDispatcher.class);

    private OperationDispatcher() {}

    /**
     * Applies the operation to the image.
     *
     * <p>The interpolation and the fill are only used by the geometric operations. The input image
     * is left untouched.
     *
     * @param image the image to transform
     * @param operation the operation to apply
     * @param magnitude the strength of the operation
     * @param interpolation the resampling method
     * @param fill the value of pixels moved in from outside the image
     * @return the transformed image
     */
    public static NDImage apply(
            NDImage image,
            Operation operation,
            double magnitude,
            Interpolation interpolation,
            Fill fill) {
        if (logger.isTraceEnabled()) {
            logger.trace("Applying {} with magnitude {} to {}", operation, magnitude, image);
        }
        return operation.apply(image, magnitude, interpolation, fill);
    }
}
