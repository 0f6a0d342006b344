package com.creditsim.simulator.planner;

import com.creditsim.common.model.AmountModel;
import com.creditsim.common.model.Amounts;

import java.math.BigDecimal;
import java.util.Random;

/**
 * Draws one payment amount below a usable limit.
 *
 * <p>Distribution, first that applies: log-normal fitted to {@code p50}/{@code p90};
 * triangular over {@code [min, cap]} with mode {@code p50} (or the midpoint); uniform
 * {@code 0.10 + r × cap} when there is no amount model. The result is truncated to cents
 * and never exceeds the cap.
 */
public final class AmountSampler {

    /** Standard normal quantile at 0.90. */
    static final double Z90 = 1.281551565545;

    private static final BigDecimal DEFAULT_LOW = new BigDecimal("0.10");

    private final BigDecimal globalCap;

    /** @param globalCap optional process-wide cap on one payment; {@code null} for none */
    public AmountSampler(BigDecimal globalCap) {
        this.globalCap = globalCap;
    }

    /** @return the amount, or {@code null} when nothing fits the limit and the model minimum */
    public BigDecimal pick(Random rng, BigDecimal limit, AmountModel model) {
        BigDecimal cap = limit;
        if (globalCap != null) cap = Amounts.min(cap, globalCap);
        if (cap.signum() <= 0) return null;

        BigDecimal modelMin = null;
        if (model != null) {
            if (model.max() != null) cap = Amounts.min(cap, BigDecimal.valueOf(model.max()));
            if (model.min() != null) modelMin = BigDecimal.valueOf(model.min());
        }
        if (cap.signum() <= 0) return null;
        if (modelMin != null && modelMin.compareTo(cap) > 0) return null;

        double raw;
        if (model != null) {
            BigDecimal low = modelMin != null ? modelMin : DEFAULT_LOW;
            Double lognormal = sampleLogNormal(rng, model, low, cap);
            raw = lognormal != null ? lognormal : sampleTriangular(rng, model, low, cap);
        } else {
            raw = 0.1 + rng.nextDouble() * cap.doubleValue();
        }
        if (!Double.isFinite(raw)) return null;

        BigDecimal amount = Amounts.truncate(Amounts.min(BigDecimal.valueOf(raw), cap));
        if (modelMin != null && amount.compareTo(modelMin) < 0) {
            amount = Amounts.truncate(modelMin);
        }
        return amount.signum() > 0 ? amount : null;
    }

    private static Double sampleLogNormal(Random rng, AmountModel model, BigDecimal low, BigDecimal cap) {
        if (model.p50() == null || model.p90() == null) return null;
        if (model.p50() <= 0 || model.p90() <= 0) return null;

        BigDecimal p50 = BigDecimal.valueOf(model.p50());
        BigDecimal p90 = BigDecimal.valueOf(model.p90());
        p50 = Amounts.min(Amounts.max(p50, low), cap);
        p90 = Amounts.min(Amounts.max(p90, p50), cap);

        double ratio = p50.signum() > 0 ? p90.doubleValue() / p50.doubleValue() : 1.0;
        if (ratio <= 1.0) return null;

        double mu    = Math.log(p50.doubleValue());
        double sigma = Math.log(ratio) / Z90;
        if (!Double.isFinite(mu) || !Double.isFinite(sigma) || sigma <= 0) return null;
        return Math.exp(mu + sigma * rng.nextGaussian());
    }

    private static double sampleTriangular(Random rng, AmountModel model, BigDecimal low, BigDecimal cap) {
        double lo   = low.doubleValue();
        double hi   = cap.doubleValue();
        double mode = model.p50() != null ? model.p50() : (lo + hi) / 2.0;
        mode = Math.min(Math.max(mode, lo), hi);
        return triangular(rng, lo, hi, mode);
    }

    static double triangular(Random rng, double low, double high, double mode) {
        double u = rng.nextDouble();
        if (high == low) return low;
        double c = (mode - low) / (high - low);
        if (u > c) {
            u = 1.0 - u;
            c = 1.0 - c;
            double swap = low;
            low  = high;
            high = swap;
        }
        return low + (high - low) * Math.sqrt(u * c);
    }
}
