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

package org.apache.mxnet.augment.translate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.apache.mxnet.augment.api.transform.Transform;

/**
 * {@code Pipeline} allows applying multiple transforms on an input, one after the other.
 *
 * <p>All transforms of one call draw from the same {@link Random}, so a seeded pipeline is
 * reproducible as a whole. Inputs a transform does not recognize flow through unchanged.
 */
public class Pipeline implements Transform {

    private List<Transform> transforms;

    /** Creates a new instance of {@code Pipeline} that has no {@link Transform} defined yet. */
    public Pipeline() {
        transforms = new ArrayList<>();
    }

    /**
     * Creates a new instance of {@code Pipeline} that can apply the given transforms on its input.
     *
     * @param transforms the transforms to be applied when the {@link #transform(Object, Random)
     *     transform} method is called on this object
     */
    public Pipeline(Transform... transforms) {
        this.transforms = new ArrayList<>(Arrays.asList(transforms));
    }

    /**
     * Adds the given {@link Transform} to the list of transforms to be applied on the input when
     * the {@link #transform(Object, Random) transform} method is called on this object.
     *
     * @param transform the {@link Transform} to be added
     * @return this {@code Pipeline}
     */
    public Pipeline add(Transform transform) {
        transforms.add(transform);
        return this;
    }

    /**
     * Inserts the given {@link Transform} to the list of transforms at the given position.
     *
     * @param position the position at which the {@link Transform} must be inserted
     * @param transform the {@code Transform} to be inserted
     * @return this {@code Pipeline}
     */
    public Pipeline insert(int position, Transform transform) {
        transforms.add(position, transform);
        return this;
    }

    /**
     * Returns the transforms of this {@code Pipeline} in the order they are applied.
     *
     * @return an unmodifiable view of the transforms
     */
    public List<Transform> getTransforms() {
        return Collections.unmodifiableList(transforms);
    }

    /**
     * Applies the transforms configured in this object on the input.
     *
     * @param input the input on which the transforms are to be applied
     * @param random the source of randomness shared by all transforms
     * @return the output after applying the transforms
     */
    @Override
    public Object transform(Object input, Random random) {
        Object output = input;
        for (Transform transform : transforms) {
            output = transform.transform(output, random);
        }
        return output;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "Pipeline" + transforms;
    }
}
