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

/** Enumerates the resampling methods of the geometric image operations. */
public enum Interpolation {
    NEAREST,
    BILINEAR;

    /**
     * Returns the {@code Interpolation} with the given name, case insensitive.
     *
     * @param value the name, for example {@code "bilinear"}
     * @return the {@code Interpolation}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Interpolation fromValue(String value) {
        for (Interpolation interpolation : values()) {
            if (interpolation.name().equalsIgnoreCase(value)) {
                return interpolation;
            }
        }
        throw new IllegalArgumentException("Unsupported interpolation mode: " + value);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
