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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** An ordered pair of {@link PolicyStep}s applied one after the other. */
public final class SubPolicy {

    private final List<PolicyStep> steps;

    /**
     * Constructs a {@code SubPolicy}.
     *
     * @param first the step applied first
     * @param second the step applied second
     */
    public SubPolicy(PolicyStep first, PolicyStep second) {
        steps = Collections.unmodifiableList(Arrays.asList(first, second));
    }

    /**
     * Returns the two steps in application order.
     *
     * @return an unmodifiable list of the steps
     */
    public List<PolicyStep> getSteps() {
        return steps;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return steps.toString();
    }
}
