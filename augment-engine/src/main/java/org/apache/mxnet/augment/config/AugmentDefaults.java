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

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import org.apache.mxnet.augment.image.Fill;
import org.apache.mxnet.augment.image.Interpolation;

/**
 * Engine-wide defaults read from an {@code augment.properties} file.
 *
 * <p>Supported keys are {@code interpolation} ({@code nearest} or {@code bilinear}), {@code fill}
 * (a number, or comma separated per-channel numbers) and {@code num_magnitude_bins}. A missing
 * key leaves the default of each strategy in place.
 */
public final class AugmentDefaults {

    /** The classpath location of the defaults file. */
    public static final String RESOURCE = "augment.properties";

    private Interpolation interpolation;
    private Fill fill;
    private Integer numMagnitudeBins;

    private AugmentDefaults() {}

    /**
     * Returns defaults that override nothing.
     *
     * @return empty defaults
     */
    public static AugmentDefaults empty() {
        return new AugmentDefaults();
    }

    /**
     * Returns the defaults of the {@code augment.properties} file on the classpath, or empty
     * defaults if there is none.
     *
     * @return the defaults
     * @throws IOException if the file could not be read
     */
    public static AugmentDefaults fromClasspath() throws IOException {
        URL url = AugmentDefaults.class.getClassLoader().getResource(RESOURCE);
        if (url == null) {
            return empty();
        }
        return fromUrl(url);
    }

    /**
     * Returns the defaults parsed from a properties file.
     *
     * @param url the url to the properties file
     * @return the defaults
     * @throws IOException if the file could not be read
     * @throws IllegalArgumentException if a value is invalid
     */
    public static AugmentDefaults fromUrl(URL url) throws IOException {
        AugmentDefaults defaults = new AugmentDefaults();
        try (InputStream conf = url.openStream()) {
            Properties prop = new Properties();
            prop.load(conf);
            String interpolation = prop.getProperty("interpolation");
            if (interpolation != null) {
                defaults.interpolation = Interpolation.fromValue(interpolation.trim());
            }
            String fill = prop.getProperty("fill");
            if (fill != null) {
                defaults.fill = parseFill(fill);
            }
            String bins = prop.getProperty("num_magnitude_bins");
            if (bins != null) {
                try {
                    defaults.numMagnitudeBins = Integer.valueOf(bins.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid num_magnitude_bins: " + bins, e);
                }
            }
        }
        return defaults;
    }

    private static Fill parseFill(String value) {
        List<Float> values = new ArrayList<>();
        for (String token : value.split(",")) {
            try {
                values.add(Float.valueOf(token.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Got inappropriate fill arg: " + value, e);
            }
        }
        return Fill.from(values);
    }

    /**
     * Returns the default interpolation.
     *
     * @return the default interpolation, or {@code null} if not set
     */
    public Interpolation getInterpolation() {
        return interpolation;
    }

    /**
     * Returns the default fill.
     *
     * @return the default fill, or {@code null} if not set
     */
    public Fill getFill() {
        return fill;
    }

    /**
     * Returns the default number of magnitude bins of the random strategies.
     *
     * @return the default number of bins, or {@code null} if not set
     */
    public Integer getNumMagnitudeBins() {
        return numMagnitudeBins;
    }
}
