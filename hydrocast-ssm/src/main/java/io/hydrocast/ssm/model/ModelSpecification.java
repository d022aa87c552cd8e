package io.hydrocast.ssm.model;

/*
 * Copyright (c) hydrocast
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

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural description of the state-space model: active terms, priors and
 * the initial-condition prior.
 *
 * <h2>Generative Equations</h2>
 *
 * <pre>{@code
 * y[t]    ~ Normal(x[t], 1/tau_obs)                    for observed y[t]
 * x[1]    ~ Normal(x_ic, 1/tau_ic)                     x_ic fixed, or mu0 for the decay variant
 * x[t]    ~ Normal(mu[t], 1/tau_add)                   t = 2..n
 * mu[t]   = mu0 + beta_decay*(x[t-1]-mu0) + beta_rain*rain[t]
 *         + beta_season_sin*season_sin[t] + beta_season_cos*season_cos[t]
 * rain[t] ~ Normal(mu_rain, 1/tau_rain)                for missing rain[t], with imputation
 * }</pre>
 *
 * <h2>Priors</h2>
 *
 * <ul>
 *   <li>{@code tau_obs, tau_add, tau_rain ~ Gamma(shape, rate)}</li>
 *   <li>{@code beta_rain, beta_season_sin, beta_season_cos ~ Normal(0, variance)}</li>
 *   <li>{@code beta_decay ~ Uniform(lower, upper)} with bounds inside {@code [0, 1]}</li>
 *   <li>{@code mu0, mu_rain ~ Normal(0, large variance)}</li>
 * </ul>
 *
 * <p>Inactive terms fix their coefficients (see {@link #fixedValue(Parameter)})
 * and their priors are not used.
 *
 * <h2>Presets</h2>
 *
 * <pre>{@code
 * ModelSpecification.randomWalk();          // no terms, fixed initial condition
 * ModelSpecification.randomWalkWithRain();  // RAIN
 * ModelSpecification.full();                // DECAY, RAIN, SEASONAL, RAIN_IMPUTATION; baseline initial condition
 * }</pre>
 *
 * <p>Instances are immutable and validated on construction. No computation
 * beyond validation happens here; samplers read the structure through
 * {@link #hasTerm(ModelTerm)}, the prior accessors and {@link ProcessMean}.
 */
public final class ModelSpecification {

    public static final GammaPrior DEFAULT_PRECISION_PRIOR = new GammaPrior(0.01, 0.01);
    public static final NormalPrior DEFAULT_COEFFICIENT_PRIOR = NormalPrior.centered(100.0);
    public static final NormalPrior DEFAULT_LEVEL_PRIOR = NormalPrior.centered(1.0e4);
    public static final InitialCondition DEFAULT_FIXED_INITIAL = InitialCondition.fixed(0.0, 0.01);
    public static final InitialCondition DEFAULT_BASELINE_INITIAL = InitialCondition.baseline(0.01);

    @SerializedName("terms")
    private final Set<ModelTerm> terms;

    @SerializedName("tau_obs")
    private final GammaPrior tauObs;

    @SerializedName("tau_add")
    private final GammaPrior tauAdd;

    @SerializedName("tau_rain")
    private final GammaPrior tauRain;

    @SerializedName("beta_rain")
    private final NormalPrior betaRain;

    @SerializedName("beta_season_sin")
    private final NormalPrior betaSeasonSin;

    @SerializedName("beta_season_cos")
    private final NormalPrior betaSeasonCos;

    @SerializedName("beta_decay")
    private final UniformPrior betaDecay;

    @SerializedName("mu0")
    private final NormalPrior mu0;

    @SerializedName("mu_rain")
    private final NormalPrior muRain;

    @SerializedName("initial_condition")
    private final InitialCondition initialCondition;

    private ModelSpecification(Builder b) {
        this.terms = Collections.unmodifiableSet(b.terms.isEmpty()
            ? EnumSet.noneOf(ModelTerm.class) : EnumSet.copyOf(b.terms));
        this.tauObs = b.tauObs;
        this.tauAdd = b.tauAdd;
        this.tauRain = b.tauRain;
        this.betaRain = b.betaRain;
        this.betaSeasonSin = b.betaSeasonSin;
        this.betaSeasonCos = b.betaSeasonCos;
        this.betaDecay = b.betaDecay;
        this.mu0 = b.mu0;
        this.muRain = b.muRain;
        this.initialCondition = b.initialCondition;
    }

    /// Pure random walk observed with noise.
    public static ModelSpecification randomWalk() {
        return builder().build();
    }

    /// Random walk with a lagged rainfall effect.
    public static ModelSpecification randomWalkWithRain() {
        return builder().term(ModelTerm.RAIN).build();
    }

    /// Decay-to-baseline model with rainfall, seasonal terms and rainfall imputation.
    public static ModelSpecification full() {
        return builder()
            .term(ModelTerm.DECAY)
            .term(ModelTerm.RAIN)
            .term(ModelTerm.SEASONAL)
            .term(ModelTerm.RAIN_IMPUTATION)
            .initialCondition(DEFAULT_BASELINE_INITIAL)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        if (terms != null) {
            b.terms.addAll(terms);
        }
        b.tauObs = tauObs;
        b.tauAdd = tauAdd;
        b.tauRain = tauRain;
        b.betaRain = betaRain;
        b.betaSeasonSin = betaSeasonSin;
        b.betaSeasonCos = betaSeasonCos;
        b.betaDecay = betaDecay;
        b.mu0 = mu0;
        b.muRain = muRain;
        b.initialCondition = initialCondition;
        return b;
    }

    public boolean hasTerm(ModelTerm term) {
        return terms.contains(term);
    }

    public Set<ModelTerm> terms() {
        return terms;
    }

    /**
     * Parameters that are random variables under this specification, in
     * update order: precisions first, then levels and coefficients.
     */
    public List<Parameter> sampledParameters() {
        List<Parameter> sampled = new ArrayList<>();
        sampled.add(Parameter.TAU_OBS);
        sampled.add(Parameter.TAU_ADD);
        if (hasTerm(ModelTerm.DECAY)) {
            sampled.add(Parameter.MU0);
            sampled.add(Parameter.BETA_DECAY);
        }
        if (hasTerm(ModelTerm.RAIN)) {
            sampled.add(Parameter.BETA_RAIN);
        }
        if (hasTerm(ModelTerm.SEASONAL)) {
            sampled.add(Parameter.BETA_SEASON_SIN);
            sampled.add(Parameter.BETA_SEASON_COS);
        }
        if (hasTerm(ModelTerm.RAIN_IMPUTATION)) {
            sampled.add(Parameter.MU_RAIN);
            sampled.add(Parameter.TAU_RAIN);
        }
        return Collections.unmodifiableList(sampled);
    }

    public boolean isSampled(Parameter parameter) {
        return sampledParameters().contains(parameter);
    }

    /**
     * Value held by a parameter this specification does not sample.
     *
     * <p>{@code beta_decay} is 1 without the decay term (pure random walk);
     * {@code tau_rain} is 1 so that an unused imputation model stays proper;
     * everything else is 0.
     */
    public double fixedValue(Parameter parameter) {
        switch (parameter) {
            case BETA_DECAY:
                return 1.0;
            case TAU_OBS:
            case TAU_ADD:
            case TAU_RAIN:
                return 1.0;
            default:
                return 0.0;
        }
    }

    /// Rainfall regression coefficients active under this specification, in design-matrix order.
    public List<Parameter> regressionCoefficients() {
        List<Parameter> coefficients = new ArrayList<>();
        if (hasTerm(ModelTerm.RAIN)) {
            coefficients.add(Parameter.BETA_RAIN);
        }
        if (hasTerm(ModelTerm.SEASONAL)) {
            coefficients.add(Parameter.BETA_SEASON_SIN);
            coefficients.add(Parameter.BETA_SEASON_COS);
        }
        return Collections.unmodifiableList(coefficients);
    }

    /// Normal prior of a regression coefficient or level parameter.
    public NormalPrior normalPrior(Parameter parameter) {
        switch (parameter) {
            case BETA_RAIN:
                return betaRain;
            case BETA_SEASON_SIN:
                return betaSeasonSin;
            case BETA_SEASON_COS:
                return betaSeasonCos;
            case MU0:
                return mu0;
            case MU_RAIN:
                return muRain;
            default:
                throw new IllegalArgumentException(parameter + " does not have a normal prior");
        }
    }

    /// Gamma prior of a precision parameter.
    public GammaPrior gammaPrior(Parameter parameter) {
        switch (parameter) {
            case TAU_OBS:
                return tauObs;
            case TAU_ADD:
                return tauAdd;
            case TAU_RAIN:
                return tauRain;
            default:
                throw new IllegalArgumentException(parameter + " does not have a gamma prior");
        }
    }

    public UniformPrior decayPrior() {
        return betaDecay;
    }

    public InitialCondition initialCondition() {
        return initialCondition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelSpecification)) return false;
        ModelSpecification that = (ModelSpecification) o;
        return terms.equals(that.terms)
            && tauObs.equals(that.tauObs)
            && tauAdd.equals(that.tauAdd)
            && tauRain.equals(that.tauRain)
            && betaRain.equals(that.betaRain)
            && betaSeasonSin.equals(that.betaSeasonSin)
            && betaSeasonCos.equals(that.betaSeasonCos)
            && betaDecay.equals(that.betaDecay)
            && mu0.equals(that.mu0)
            && muRain.equals(that.muRain)
            && initialCondition.equals(that.initialCondition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(terms, tauObs, tauAdd, tauRain, betaRain, betaSeasonSin, betaSeasonCos,
            betaDecay, mu0, muRain, initialCondition);
    }

    @Override
    public String toString() {
        return "ModelSpecification[terms=" + terms + ", initialCondition=" + initialCondition + "]";
    }

    /**
     * Builder for {@link ModelSpecification}. Unset priors take the defaults
     * declared on {@link ModelSpecification}.
     */
    public static final class Builder {
        private final Set<ModelTerm> terms = EnumSet.noneOf(ModelTerm.class);
        private GammaPrior tauObs;
        private GammaPrior tauAdd;
        private GammaPrior tauRain;
        private NormalPrior betaRain;
        private NormalPrior betaSeasonSin;
        private NormalPrior betaSeasonCos;
        private UniformPrior betaDecay;
        private NormalPrior mu0;
        private NormalPrior muRain;
        private InitialCondition initialCondition;

        private Builder() {
        }

        public Builder term(ModelTerm term) {
            terms.add(Objects.requireNonNull(term, "term"));
            return this;
        }

        public Builder terms(Set<ModelTerm> terms) {
            this.terms.clear();
            this.terms.addAll(terms);
            return this;
        }

        public Builder withoutTerm(ModelTerm term) {
            terms.remove(term);
            return this;
        }

        public Builder tauObs(GammaPrior prior) {
            this.tauObs = prior;
            return this;
        }

        public Builder tauAdd(GammaPrior prior) {
            this.tauAdd = prior;
            return this;
        }

        public Builder tauRain(GammaPrior prior) {
            this.tauRain = prior;
            return this;
        }

        public Builder betaRain(NormalPrior prior) {
            this.betaRain = prior;
            return this;
        }

        public Builder betaSeasonSin(NormalPrior prior) {
            this.betaSeasonSin = prior;
            return this;
        }

        public Builder betaSeasonCos(NormalPrior prior) {
            this.betaSeasonCos = prior;
            return this;
        }

        public Builder betaDecay(UniformPrior prior) {
            this.betaDecay = prior;
            return this;
        }

        public Builder mu0(NormalPrior prior) {
            this.mu0 = prior;
            return this;
        }

        public Builder muRain(NormalPrior prior) {
            this.muRain = prior;
            return this;
        }

        public Builder initialCondition(InitialCondition initialCondition) {
            this.initialCondition = initialCondition;
            return this;
        }

        /**
         * Validates and builds the specification.
         *
         * @throws IllegalArgumentException if decay bounds leave {@code [0, 1]},
         *     or a baseline initial condition is used without the decay term
         */
        public ModelSpecification build() {
            terms.remove(null);
            if (tauObs == null) tauObs = DEFAULT_PRECISION_PRIOR;
            if (tauAdd == null) tauAdd = DEFAULT_PRECISION_PRIOR;
            if (tauRain == null) tauRain = DEFAULT_PRECISION_PRIOR;
            if (betaRain == null) betaRain = DEFAULT_COEFFICIENT_PRIOR;
            if (betaSeasonSin == null) betaSeasonSin = DEFAULT_COEFFICIENT_PRIOR;
            if (betaSeasonCos == null) betaSeasonCos = DEFAULT_COEFFICIENT_PRIOR;
            if (betaDecay == null) betaDecay = UniformPrior.unit();
            if (mu0 == null) mu0 = DEFAULT_LEVEL_PRIOR;
            if (muRain == null) muRain = DEFAULT_LEVEL_PRIOR;
            if (initialCondition == null) {
                initialCondition = terms.contains(ModelTerm.DECAY)
                    ? DEFAULT_BASELINE_INITIAL : DEFAULT_FIXED_INITIAL;
            }

            if (betaDecay.lower() < 0.0 || betaDecay.upper() > 1.0) {
                throw new IllegalArgumentException(
                    "Decay bounds must lie within [0, 1], got: [" + betaDecay.lower() + ", " + betaDecay.upper() + "]");
            }
            if (initialCondition.tiedToBaseline() && !terms.contains(ModelTerm.DECAY)) {
                throw new IllegalArgumentException(
                    "A baseline initial condition requires the decay term, which samples mu0");
            }
            return new ModelSpecification(this);
        }
    }
}
