package io.spectools.spectra.config;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * JSON-serializable tunables for the spectrum engines.
 *
 * <h2>Purpose</h2>
 *
 * <p>Collects the numeric knobs that the engines would otherwise hard-code:
 * Monte-Carlo draw counts, the integration rule used by synthetic photometry,
 * the convolution oversampling factor and the closeness tolerances used when
 * two spectra are combined. Every field has a default, so a partial JSON
 * document only overrides what it names.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "monte_carlo_draws": 1000,
 *   "integration_rule": "trapezoid",   // or "simpson"
 *   "oversample_factor": 10,
 *   "close_rtol": 1.0e-5,
 *   "close_atol": 1.0e-8,
 *   "sky_line_half_width": 10.0,
 *   "random_seed": 42                  // optional
 * }
 * }</pre>
 *
 * @see io.spectools.spectra.photometry.SyntheticPhotometry
 * @see io.spectools.spectra.convolve.GaussianConvolver
 */
public final class SpectraSettings {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    private static final SpectraSettings DEFAULTS = new SpectraSettings();

    @SerializedName("monte_carlo_draws")
    private int monteCarloDraws = 1000;

    @SerializedName("integration_rule")
    private String integrationRule = "trapezoid";

    @SerializedName("oversample_factor")
    private int oversampleFactor = 10;

    @SerializedName("close_rtol")
    private double closeRtol = 1e-5;

    @SerializedName("close_atol")
    private double closeAtol = 1e-8;

    @SerializedName("sky_line_half_width")
    private double skyLineHalfWidth = 10.0;

    /** Seed for the Monte-Carlo random provider; null draws a fresh seed */
    @SerializedName("random_seed")
    private Long randomSeed;

    private SpectraSettings() {
    }

    /// @return the shared default settings
    public static SpectraSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses settings from JSON, keeping defaults for absent fields.
     *
     * @param json the JSON text
     * @return validated settings
     * @throws IllegalArgumentException if the JSON is malformed or a value is out of range
     */
    public static SpectraSettings fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        SpectraSettings settings;
        try {
            settings = GSON.fromJson(json, SpectraSettings.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed settings JSON: " + e.getMessage(), e);
        }
        if (settings == null) {
            return DEFAULTS;
        }
        settings.validate();
        return settings;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public int monteCarloDraws() {
        return monteCarloDraws;
    }

    public String integrationRule() {
        return integrationRule;
    }

    public int oversampleFactor() {
        return oversampleFactor;
    }

    public double closeRtol() {
        return closeRtol;
    }

    public double closeAtol() {
        return closeAtol;
    }

    public double skyLineHalfWidth() {
        return skyLineHalfWidth;
    }

    /// @return the configured seed, or null when none was given
    public Long randomSeed() {
        return randomSeed;
    }

    private void validate() {
        if (monteCarloDraws < 0) {
            throw new IllegalArgumentException("monte_carlo_draws must be non-negative, got: " + monteCarloDraws);
        }
        if (integrationRule == null || integrationRule.isBlank()) {
            throw new IllegalArgumentException("integration_rule cannot be empty");
        }
        if (oversampleFactor < 1) {
            throw new IllegalArgumentException("oversample_factor must be at least 1, got: " + oversampleFactor);
        }
        if (closeRtol < 0 || closeAtol < 0) {
            throw new IllegalArgumentException("closeness tolerances must be non-negative, got rtol="
                + closeRtol + " atol=" + closeAtol);
        }
        if (!(skyLineHalfWidth > 0)) {
            throw new IllegalArgumentException("sky_line_half_width must be positive, got: " + skyLineHalfWidth);
        }
    }

    @Override
    public String toString() {
        return "SpectraSettings{draws=" + monteCarloDraws + ", rule=" + integrationRule
            + ", oversample=" + oversampleFactor + ", rtol=" + closeRtol + ", atol=" + closeAtol
            + ", skyHalfWidth=" + skyLineHalfWidth + ", seed=" + randomSeed + "}";
    }

    /// Programmatic construction of settings.
    public static final class Builder {
        private final SpectraSettings settings = new SpectraSettings();

        private Builder() {
        }

        public Builder monteCarloDraws(int draws) {
            settings.monteCarloDraws = draws;
            return this;
        }

        public Builder integrationRule(String rule) {
            settings.integrationRule = rule;
            return this;
        }

        public Builder oversampleFactor(int factor) {
            settings.oversampleFactor = factor;
            return this;
        }

        public Builder closeTolerance(double rtol, double atol) {
            settings.closeRtol = rtol;
            settings.closeAtol = atol;
            return this;
        }

        public Builder skyLineHalfWidth(double halfWidth) {
            settings.skyLineHalfWidth = halfWidth;
            return this;
        }

        public Builder randomSeed(long seed) {
            settings.randomSeed = seed;
            return this;
        }

        public SpectraSettings build() {
            SpectraSettings built = new SpectraSettings();
            built.monteCarloDraws = settings.monteCarloDraws;
            built.integrationRule = settings.integrationRule;
            built.oversampleFactor = settings.oversampleFactor;
            built.closeRtol = settings.closeRtol;
            built.closeAtol = settings.closeAtol;
            built.skyLineHalfWidth = settings.skyLineHalfWidth;
            built.randomSeed = settings.randomSeed;
            built.validate();
            return built;
        }
    }
}
