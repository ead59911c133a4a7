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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * The catalogue of operations an augmentation strategy draws from, with the magnitude range of
 * each.
 *
 * <p>An {@code AugmentationSpace} is immutable and can be shared between threads.
 */
public final class AugmentationSpace {

    /** The operations of {@link AutoAugment} policies. */
    public static final AugmentationSpace AUTO_AUGMENT =
            new Builder()
                    .add(Operation.SHEAR_X, MagnitudeFunction.linspace(0.0, 0.3), true)
                    .add(Operation.SHEAR_Y, MagnitudeFunction.linspace(0.0, 0.3), true)
                    .add(
                            Operation.TRANSLATE_X,
                            MagnitudeFunction.linspaceOfWidth(150.0 / 331.0),
                            true)
                    .add(
                            Operation.TRANSLATE_Y,
                            MagnitudeFunction.linspaceOfHeight(150.0 / 331.0),
                            true)
                    .add(Operation.ROTATE, MagnitudeFunction.linspace(0.0, 30.0), true)
                    .add(Operation.BRIGHTNESS, MagnitudeFunction.linspace(0.0, 0.9), true)
                    .add(Operation.COLOR, MagnitudeFunction.linspace(0.0, 0.9), true)
                    .add(Operation.CONTRAST, MagnitudeFunction.linspace(0.0, 0.9), true)
                    .add(Operation.SHARPNESS, MagnitudeFunction.linspace(0.0, 0.9), true)
                    .add(Operation.POSTERIZE, MagnitudeFunction.bits(8, 4), false)
                    .add(Operation.SOLARIZE, MagnitudeFunction.linspace(255.0, 0.0), false)
                    .add(Operation.AUTO_CONTRAST, MagnitudeFunction.NONE, false)
                    .add(Operation.EQUALIZE, MagnitudeFunction.NONE, false)
                    .add(Operation.INVERT, MagnitudeFunction.NONE, false)
                    .build();

    /** The operations of {@link RandAugment}. */
    public static final AugmentationSpace RAND_AUGMENT =
            new Builder()
                    .add(Operation.IDENTITY, MagnitudeFunction.NONE, false)
                    .add(Operation.SHEAR_X, MagnitudeFunction.linspace(0.0, 0.3), true)
                    .add(Operation.SHEAR_Y, MagnitudeFunction.linspace(0.0, 0.3), true)
                    .add(
                            Operation.TRANSLATE_X,
                            MagnitudeFunction.linspaceOfWidth(150.0 / 331.0),
                            true)
                    .add(
                            Operation.TRANSLATE_Y,
                            MagnitudeFunction.linspaceOfHeight(150.0 / 331.0),
                            true)
                    .add(Operation.ROTATE, MagnitudeFunction.linspace(0.0, 30.0), true)
                    .add(Operation.BRIGHTNESS, MagnitudeFunction.linspace(0.0, 0.9), true)
                    .add(Operation.COLOR, MagnitudeFunction.linspace(0.0, 0.9), true)
                    .add(Operation.CONTRAST, MagnitudeFunction.linspace(0.0, 0.9), true)
                    .add(Operation.SHARPNESS, MagnitudeFunction.linspace(0.0, 0.9), true)
                    .add(Operation.POSTERIZE, MagnitudeFunction.bits(8, 4), false)
                    .add(Operation.SOLARIZE, MagnitudeFunction.linspace(255.0, 0.0), false)
                    .add(Operation.AUTO_CONTRAST, MagnitudeFunction.NONE, false)
                    .add(Operation.EQUALIZE, MagnitudeFunction.NONE, false)
                    .build();

    /** The wide magnitude ranges of {@link TrivialAugmentWide}. */
    public static final AugmentationSpace TRIVIAL_AUGMENT_WIDE =
            new Builder()
                    .add(Operation.IDENTITY, MagnitudeFunction.NONE, false)
                    .add(Operation.SHEAR_X, MagnitudeFunction.linspace(0.0, 0.99), true)
                    .add(Operation.SHEAR_Y, MagnitudeFunction.linspace(0.0, 0.99), true)
                    .add(Operation.TRANSLATE_X, MagnitudeFunction.linspace(0.0, 32.0), true)
                    .add(Operation.TRANSLATE_Y, MagnitudeFunction.linspace(0.0, 32.0), true)
                    .add(Operation.ROTATE, MagnitudeFunction.linspace(0.0, 135.0), true)
                    .add(Operation.BRIGHTNESS, MagnitudeFunction.linspace(0.0, 0.99), true)
                    .add(Operation.COLOR, MagnitudeFunction.linspace(0.0, 0.99), true)
                    .add(Operation.CONTRAST, MagnitudeFunction.linspace(0.0, 0.99), true)
                    .add(Operation.SHARPNESS, MagnitudeFunction.linspace(0.0, 0.99), true)
                    .add(Operation.POSTERIZE, MagnitudeFunction.bits(8, 6), false)
                    .add(Operation.SOLARIZE, MagnitudeFunction.linspace(255.0, 0.0), false)
                    .add(Operation.AUTO_CONTRAST, MagnitudeFunction.NONE, false)
                    .add(Operation.EQUALIZE, MagnitudeFunction.NONE, false)
                    .build();

    /** The geometric and tonal operations {@link AugMix} uses when not all ops are enabled. */
    public static final AugmentationSpace AUG_MIX_PARTIAL =
            new Builder()
                    .add(Operation.SHEAR_X, MagnitudeFunction.linspace(0.0, 0.3), true)
                    .add(Operation.SHEAR_Y, MagnitudeFunction.linspace(0.0, 0.3), true)
                    .add(Operation.TRANSLATE_X, MagnitudeFunction.linspaceOfWidth(1.0 / 3.0), true)
                    .add(Operation.TRANSLATE_Y, MagnitudeFunction.linspaceOfHeight(1.0 / 3.0), true)
                    .add(Operation.ROTATE, MagnitudeFunction.linspace(0.0, 30.0), true)
                    .add(Operation.POSTERIZE, MagnitudeFunction.bits(4, 4), false)
                    .add(Operation.SOLARIZE, MagnitudeFunction.linspace(255.0, 0.0), false)
                    .add(Operation.AUTO_CONTRAST, MagnitudeFunction.NONE, false)
                    .add(Operation.EQUALIZE, MagnitudeFunction.NONE, false)
                    .build();

    /** All operations of {@link AugMix}. */
    public static final AugmentationSpace AUG_MIX =
            new Builder(AUG_MIX_PARTIAL)
                    .add(Operation.BRIGHTNESS, MagnitudeFunction.linspace(0.0, 0.9), true)
                    .add(Operation.COLOR, MagnitudeFunction.linspace(0.0, 0.9), true)
                    .add(Operation.CONTRAST, MagnitudeFunction.linspace(0.0, 0.9), true)
                    .add(Operation.SHARPNESS, MagnitudeFunction.linspace(0.0, 0.9), true)
                    .build();

    private final Map<Operation, AugmentationEntry> entries;
    private final List<Operation> operations;

    private AugmentationSpace(Builder builder) {
        entries = Collections.unmodifiableMap(new EnumMap<>(builder.entries));
        operations = Collections.unmodifiableList(new ArrayList<>(builder.operations));
    }

    /**
     * Returns the entry of the given operation.
     *
     * @param operation the operation
     * @return the entry of the operation
     * @throws UnsupportedOperationException if the operation is not part of this space
     */
    public AugmentationEntry lookup(Operation operation) {
        AugmentationEntry entry = entries.get(operation);
        if (entry == null) {
            throw new UnsupportedOperationException(
                    "No transform available for " + operation + " in " + operations);
        }
        return entry;
    }

    /**
     * Draws an operation uniformly from this space.
     *
     * @param random the source of randomness
     * @return the operation and its entry
     */
    public OperationEntry randomEntry(Random random) {
        Operation operation = operations.get(random.nextInt(operations.size()));
        return new OperationEntry(operation, entries.get(operation));
    }

    /**
     * Returns whether the operation is part of this space.
     *
     * @param operation the operation
     * @return whether the operation is part of this space
     */
    public boolean contains(Operation operation) {
        return entries.containsKey(operation);
    }

    /**
     * Returns the operations of this space in their declaration order.
     *
     * @return the operations of this space
     */
    public List<Operation> getOperations() {
        return operations;
    }

    /**
     * Returns the number of operations.
     *
     * @return the number of operations
     */
    public int size() {
        return operations.size();
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return operations.toString();
    }

    private static final class Builder {

        private final Map<Operation, AugmentationEntry> entries = new EnumMap<>(Operation.class);
        private final List<Operation> operations = new ArrayList<>();

        Builder() {}

        Builder(AugmentationSpace base) {
            entries.putAll(base.entries);
            operations.addAll(base.operations);
        }

        Builder add(Operation operation, MagnitudeFunction magnitudes, boolean signed) {
            entries.put(operation, new AugmentationEntry(magnitudes, signed));
            operations.add(operation);
            return this;
        }

        AugmentationSpace build() {
            return new AugmentationSpace(this);
        }
    }
}
