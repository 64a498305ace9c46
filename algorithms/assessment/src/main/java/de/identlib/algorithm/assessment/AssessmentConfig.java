/* Copyright (C) 2024-2026 IdentLib contributors
 * This file is part of IdentLib.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.identlib.algorithm.assessment;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.identlib.algebra.groebner.GroebnerEngines;
import de.identlib.api.algebra.GroebnerEngine;
import de.identlib.api.exception.ConfigurationException;
import de.identlib.api.model.VariableChangePolicy;
import de.identlib.oracle.membership.RandomizedFieldMembershipOracle;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of an identifiability assessment, bound from JSON.
 * <p>
 * Fields missing from the JSON keep their defaults; unknown fields are ignored. {@link #validate()} rejects values the
 * pipeline cannot work with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssessmentConfig {

    public static final String DEFAULT_RESOURCE = "identlib.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(AssessmentConfig.class);

    private static final ObjectMapper MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @JsonProperty("probability")
    private double probability = 0.99;

    @JsonProperty("engine")
    private String engine = GroebnerEngines.DEFAULT.getName();

    @JsonProperty("variableChange")
    private String variableChange = "default";

    /** Seed of the sampler, {@code null} for a fresh seed per assessor. */
    @JsonProperty("seed")
    private @Nullable Long seed;

    @JsonProperty("maxResamples")
    private int maxResamples = RandomizedFieldMembershipOracle.DEFAULT_MAX_RESAMPLES;

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the class path, or returns the built-in defaults if there is none.
     */
    public static AssessmentConfig defaults() {
        try (InputStream in = AssessmentConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                LOGGER.debug("No {} on the class path, using built-in defaults", DEFAULT_RESOURCE);
                return new AssessmentConfig().validate();
            }
            return read(MAPPER.readValue(in, AssessmentConfig.class), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + DEFAULT_RESOURCE + " from the class path", e);
        }
    }

    public static AssessmentConfig load(Path path) {
        Objects.requireNonNull(path, "Config path cannot be null");
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new ConfigurationException("Config file not found or not readable: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(MAPPER.readValue(in, AssessmentConfig.class), path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot parse config file " + path, e);
        }
    }

    public static AssessmentConfig fromJson(String json) {
        try {
            return read(MAPPER.readValue(json, AssessmentConfig.class), "inline JSON");
        } catch (IOException e) {
            throw new ConfigurationException("Cannot parse config JSON", e);
        }
    }

    private static AssessmentConfig read(@Nullable AssessmentConfig config, String source) {
        if (config == null) {
            LOGGER.warn("Config {} is empty, falling back to defaults", source);
            config = new AssessmentConfig();
        }
        return config.validate();
    }

    /**
     * Checks all values.
     *
     * @return this instance
     *
     * @throws ConfigurationException
     *         if a value is out of range or names an unknown engine or policy
     */
    public AssessmentConfig validate() {
        ConfigurationException.checkProbability(probability);
        engine();
        variableChangePolicy();
        if (maxResamples < 0) {
            throw new ConfigurationException("maxResamples must not be negative, got " + maxResamples);
        }
        return this;
    }

    public double getProbability() {
        return probability;
    }

    public void setProbability(double probability) {
        this.probability = probability;
    }

    public GroebnerEngine engine() {
        return GroebnerEngines.forName(engine);
    }

    public String getEngineName() {
        return engine;
    }

    public void setEngineName(String engine) {
        this.engine = engine;
    }

    public VariableChangePolicy variableChangePolicy() {
        return VariableChangePolicy.fromName(variableChange);
    }

    public void setVariableChange(String variableChange) {
        this.variableChange = variableChange;
    }

    public @Nullable Long getSeed() {
        return seed;
    }

    public void setSeed(@Nullable Long seed) {
        this.seed = seed;
    }

    public int getMaxResamples() {
        return maxResamples;
    }

    public void setMaxResamples(int maxResamples) {
        this.maxResamples = maxResamples;
    }

    /**
     * A random source for the sampler: seeded if a seed is configured, otherwise seeded from a secure source.
     */
    public Random newRandom() {
        return seed == null ? new Random(new SecureRandom().nextLong()) : new Random(seed);
    }
}
