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

/** An {@link Operation} drawn from an {@link AugmentationSpace}, together with its entry. */
public final class OperationEntry {

    private final Operation operation;
    private final AugmentationEntry entry;

    OperationEntry(Operation operation, AugmentationEntry entry) {
        this.operation = operation;
        this.entry = entry;
    }

    /**
     * Returns the drawn operation.
     *
     * @return the operation
     */
    public Operation getOperation() {
        return operation;
    }

    /**
     * Returns the magnitude range of the drawn operation.
     *
     * @return the catalogue entry
     */
    public AugmentationEntry getEntry() {
        return entry;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return operation.toString();
    }
}
