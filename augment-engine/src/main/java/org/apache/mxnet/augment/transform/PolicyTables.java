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

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.mxnet.augment.api.exception.AugmentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Loads the {@link AutoAugmentPolicy} tables from the classpath. */
final class PolicyTables {

    private static final Logger logger = LoggerFactory.getLogger(PolicyTables.class);

    static final String RESOURCE = "auto_augment_policies.json";
    static final int NUM_SUB_POLICIES = 25;

    private static volatile Map<AutoAugmentPolicy, List<SubPolicy>> tables;

    private PolicyTables() {}

    static List<SubPolicy> getSubPolicies(AutoAugmentPolicy policy) {
        Map<AutoAugmentPolicy, List<SubPolicy>> loaded = tables;
        if (loaded == null) {
            synchronized (PolicyTables.class) {
                loaded = tables;
                if (loaded == null) {
                    loaded = load();
                    tables = loaded;
                }
            }
        }
        return loaded.get(policy);
    }

    private static Map<AutoAugmentPolicy, List<SubPolicy>> load() {
        try (InputStream is = PolicyTables.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is == null) {
                throw new AugmentException("Policy resource not found: " + RESOURCE);
            }
            Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8);
            JsonObject json = new Gson().fromJson(reader, JsonObject.class);
            Map<AutoAugmentPolicy, List<SubPolicy>> map = new EnumMap<>(AutoAugmentPolicy.class);
            for (AutoAugmentPolicy policy : AutoAugmentPolicy.values()) {
                JsonArray array = json.getAsJsonArray(policy.getValue());
                if (array == null) {
                    throw new AugmentException("Missing policy table: " + policy);
                }
                map.put(policy, parse(policy, array));
            }
            logger.debug("Loaded {} policy tables from {}", map.size(), RESOURCE);
            return Collections.unmodifiableMap(map);
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new AugmentException("Failed to load policy tables from " + RESOURCE, e);
        }
    }

    static List<SubPolicy> parse(AutoAugmentPolicy policy, JsonArray array) {
        if (array.size() != NUM_SUB_POLICIES) {
            throw new AugmentException(
                    "Policy "
                            + policy
                            + " must have "
                            + NUM_SUB_POLICIES
                            + " sub-policies, got "
                            + array.size());
        }
        List<SubPolicy> subPolicies = new ArrayList<>(NUM_SUB_POLICIES);
        for (JsonElement element : array) {
            JsonArray steps = element.getAsJsonArray();
            if (steps.size() != 2) {
                throw new AugmentException(
                        "Sub-policy of " + policy + " must have 2 steps: " + steps);
            }
            subPolicies.add(new SubPolicy(parseStep(steps.get(0)), parseStep(steps.get(1))));
        }
        return Collections.unmodifiableList(subPolicies);
    }

    private static PolicyStep parseStep(JsonElement element) {
        JsonArray step = element.getAsJsonArray();
        if (step.size() != 3) {
            throw new AugmentException("Policy step must have 3 elements: " + step);
        }
        Operation operation = Operation.fromValue(step.get(0).getAsString());
        double probability = step.get(1).getAsDouble();
        JsonElement bin = step.get(2);
        boolean magnitudeFree = AugmentationSpace.AUTO_AUGMENT.lookup(operation).isMagnitudeFree();
        try {
            if (bin.isJsonNull()) {
                if (!magnitudeFree) {
                    throw new AugmentException("Missing magnitude bin in step " + step);
                }
                return new PolicyStep(operation, probability);
            }
            if (magnitudeFree) {
                throw new AugmentException(operation + " takes no magnitude bin: " + step);
            }
            int magnitudeBin = bin.getAsInt();
            if (magnitudeBin < 0 || magnitudeBin >= AutoAugment.NUM_MAGNITUDE_BINS) {
                throw new AugmentException("Magnitude bin out of range in step " + step);
            }
            return new PolicyStep(operation, probability, magnitudeBin);
        } catch (IllegalArgumentException e) {
            throw new AugmentException("Invalid policy step " + step, e);
        }
    }
}
