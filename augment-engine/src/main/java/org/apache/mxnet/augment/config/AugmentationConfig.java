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

package org.apache.mxnet.augment.config;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.mxnet.augment.api.exception.AugmentException;
import org.apache.mxnet.augment.api.transform.Transform;
import org.apache.mxnet.augment.image.Fill;
import org.apache.mxnet.augment.image.Interpolation;
import org.apache.mxnet.augment.transform.AugMix;
import org.apache.mxnet.augment.transform.AutoAugment;
import org.apache.mxnet.augment.transform.AutoAugmentBase;
import org.apache.mxnet.augment.transform.RandAugment;
import org.apache.mxnet.augment.transform.TrivialAugmentWide;
import org.apache.mxnet.augment.translate.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link Transform}s from JSON configuration documents.
 *
 * <p>A document is either a single strategy, for example:
 *
 * <pre>
 * {"type": "rand_augment", "num_ops": 2, "num_magnitude_bins": 31, "fill": [0, 0, 0]}
 * </pre>
 *
 * <p>or a pipeline of strategies applied in order:
 *
 * <pre>
 * {"pipeline": [{"type": "auto_augment", "policy": "cifar10"}, {"type": "aug_mix"}]}
 * </pre>
 *
 * <p>The {@code type} is one of {@code auto_augment}, {@code rand_augment}, {@code
 * trivial_augment_wide} and {@code aug_mix}. Keys that are left out take the value of {@link
 * AugmentDefaults}, then the default of the strategy.
 */
public final class AugmentationConfig {

    private static final Logger logger = LoggerFactory.getLogger(AugmentationConfig.class);

    private AugmentationConfig() {}

    /**
     * Builds the transform described by a JSON string, using the classpath defaults.
     *
     * @param json the configuration document
     * @return the configured transform
     * @throws AugmentException if the document is malformed or the defaults cannot be read
     * @throws IllegalArgumentException if a value is invalid
     */
    public static Transform fromJson(String json) {
        return fromReader(new StringReader(json));
    }

    /**
     * Builds the transform described by a JSON file, using the classpath defaults.
     *
     * @param path the path to the configuration document
     * @return the configured transform
     * @throws IOException if the file could not be read
     */
    public static Transform fromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromReader(reader);
        }
    }

    /**
     * Builds the transform described by a JSON document, using the classpath defaults.
     *
     * @param reader the reader of the configuration document
     * @return the configured transform
     * @throws AugmentException if the document is malformed or the defaults cannot be read
     */
    public static Transform fromReader(Reader reader) {
        AugmentDefaults defaults;
        try {
            defaults = AugmentDefaults.fromClasspath();
        } catch (IOException e) {
            throw new AugmentException("Failed to read " + AugmentDefaults.RESOURCE, e);
        }
        JsonObject json;
        try {
            json = new Gson().fromJson(reader, JsonObject.class);
        } catch (JsonParseException e) {
            throw new AugmentException("Malformed augmentation config", e);
        }
        if (json == null) {
            throw new AugmentException("Empty augmentation config");
        }
        return fromJson(json, defaults);
    }

    /**
     * Builds the transform described by a parsed JSON document.
     *
     * @param json the configuration document
     * @param defaults the defaults of keys the document leaves out
     * @return the configured transform
     * @throws IllegalArgumentException if a value is invalid
     */
    public static Transform fromJson(JsonObject json, AugmentDefaults defaults) {
        if (json.has("pipeline")) {
            JsonElement element = json.get("pipeline");
            if (!element.isJsonArray()) {
                throw new IllegalArgumentException("pipeline must be an array: " + element);
            }
            Pipeline pipeline = new Pipeline();
            for (JsonElement stage : element.getAsJsonArray()) {
                if (!stage.isJsonObject()) {
                    throw new IllegalArgumentException(
                            "Pipeline stage must be an object: " + stage);
                }
                pipeline.add(fromJson(stage.getAsJsonObject(), defaults));
            }
            logger.debug("Configured {}", pipeline);
            return pipeline;
        }
        Transform transform = createStrategy(json, defaults);
        logger.debug("Configured {}", transform);
        return transform;
    }

    private static Transform createStrategy(JsonObject json, AugmentDefaults defaults) {
        String type = getString(json, "type", null);
        if (type == null) {
            throw new IllegalArgumentException("Missing augmentation type in " + json);
        }
        switch (type) {
            case "auto_augment":
                AutoAugment.Builder autoAugment = AutoAugment.builder();
                String policy = getString(json, "policy", null);
                if (policy != null) {
                    autoAugment.optPolicy(policy);
                }
                return setCommon(autoAugment, json, defaults).build();
            case "rand_augment":
                return setCommon(RandAugment.builder(), json, defaults)
                        .optNumOps(getInt(json, "num_ops", 2))
                        .optMagnitude(getInt(json, "magnitude", 9))
                        .optNumMagnitudeBins(getNumMagnitudeBins(json, defaults))
                        .build();
            case "trivial_augment_wide":
                return setCommon(TrivialAugmentWide.builder(), json, defaults)
                        .optNumMagnitudeBins(getNumMagnitudeBins(json, defaults))
                        .build();
            case "aug_mix":
                return setCommon(AugMix.builder(), json, defaults)
                        .optSeverity(getInt(json, "severity", 3))
                        .optMixtureWidth(getInt(json, "mixture_width", 3))
                        .optChainDepth(getInt(json, "chain_depth", -1))
                        .optAlpha(getDouble(json, "alpha", 1.0))
                        .optAllOps(getBoolean(json, "all_ops", true))
                        .build();
            default:
                throw new IllegalArgumentException("Unknown augmentation type: " + type);
        }
    }

    private static <T extends AutoAugmentBase.BaseBuilder<T>> T setCommon(
            T builder, JsonObject json, AugmentDefaults defaults) {
        String interpolation = getString(json, "interpolation", null);
        if (interpolation != null) {
            builder.optInterpolation(interpolation);
        } else if (defaults.getInterpolation() != null) {
            builder.optInterpolation(defaults.getInterpolation());
        }
        if (json.has("fill")) {
            builder.optFill(parseFill(json.get("fill")));
        } else if (defaults.getFill() != null) {
            builder.optFill(defaults.getFill());
        }
        return builder;
    }

    private static Fill parseFill(JsonElement element) {
        if (element.isJsonNull()) {
            return Fill.zero();
        }
        try {
            if (element.isJsonArray()) {
                JsonArray array = element.getAsJsonArray();
                List<Float> values = new ArrayList<>(array.size());
                for (JsonElement value : array) {
                    values.add(value.getAsFloat());
                }
                return Fill.from(values);
            }
            return Fill.of(element.getAsFloat());
        } catch (IllegalStateException | UnsupportedOperationException e) {
            throw new IllegalArgumentException("Got inappropriate fill arg: " + element, e);
        }
    }

    private static int getNumMagnitudeBins(JsonObject json, AugmentDefaults defaults) {
        Integer bins = defaults.getNumMagnitudeBins();
        return getInt(json, "num_magnitude_bins", bins == null ? 31 : bins);
    }

    private static String getString(JsonObject json, String key, String defaultValue) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            return defaultValue;
        }
        if (!element.isJsonPrimitive()) {
            throw new IllegalArgumentException(key + " must be a string, got " + element);
        }
        return element.getAsString();
    }

    private static int getInt(JsonObject json, String key, int defaultValue) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            return defaultValue;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException(key + " must be a number, got " + element);
        }
        try {
            return element.getAsBigDecimal().intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(key + " must be an integer, got " + element, e);
        }
    }

    private static double getDouble(JsonObject json, String key, double defaultValue) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            return defaultValue;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException(key + " must be a number, got " + element);
        }
        return element.getAsDouble();
    }

    private static boolean getBoolean(JsonObject json, String key, boolean defaultValue) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            return defaultValue;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            throw new IllegalArgumentException(key + " must be a boolean, got " + element);
        }
        return element.getAsBoolean();
    }
}
