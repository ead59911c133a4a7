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

import java.util.List;
import org.apache.mxnet.augment.api.exception.UnrecognizedPolicyException;

/** The learned policies {@link AutoAugment} can apply. */
public enum AutoAugmentPolicy {
    IMAGENET("imagenet"),
    CIFAR10("cifar10"),
    SVHN("svhn");

    private final String value;

    AutoAugmentPolicy(String value) {
        this.value = value;
    }

    /**
     * Returns the name of the policy, as used in configuration and in the policy resource.
     *
     * @return the name of the policy
     */
    public String getValue() {
        return value;
    }

    /**
     * Returns the 25 sub-policies of this policy.
     *
     * @return the sub-policies
     */
    public List<SubPolicy> getSubPolicies() {
        return PolicyTables.getSubPolicies(this);
    }

    /**
     * Returns the {@code AutoAugmentPolicy} with the given name, ignoring case.
     *
     * @param value the name of the policy
     * @return the {@code AutoAugmentPolicy}
     * @throws UnrecognizedPolicyException if no policy has the given name
     */
    public static AutoAugmentPolicy fromValue(String value) {
        for (AutoAugmentPolicy policy : values()) {
            if (policy.value.equalsIgnoreCase(value)) {
                return policy;
            }
        }
        throw new UnrecognizedPolicyException(
                "The provided policy " + value + " is not recognized.");
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return value;
    }
}
