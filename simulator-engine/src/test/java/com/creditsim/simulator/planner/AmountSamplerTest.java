package com.creditsim.simulator.planner;

import com.creditsim.common.model.AmountModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class AmountSamplerTest {

    @Test
    @DisplayName("never exceeds the usable limit")
    void belowLimit() {
        AmountSampler sampler = new AmountSampler(null);
        Random rng = new Random(1);
        for (int i = 0; i < 200; i++) {
            BigDecimal amount = sampler.pick(rng, new BigDecimal("12.50"), null);
            assertNotNull(amount);
            assertTrue(amount.compareTo(new BigDecimal("12.50")) <= 0);
            assertTrue(amount.signum() > 0);
        }
    }

    @Test
    @DisplayName("global cap applies over the limit")
    void globalCap() {
        AmountSampler sampler = new AmountSampler(new BigDecimal("5"));
        Random rng = new Random(2);
        for (int i = 0; i < 100; i++) {
            assertTrue(sampler.pick(rng, new BigDecimal("1000"), null).compareTo(new BigDecimal("5")) <= 0);
        }
    }

    @Test
    @DisplayName("log-normal model stays inside [min, max]")
    void logNormalBounds() {
        AmountSampler sampler = new AmountSampler(null);
        AmountModel model = new AmountModel(50.0, 500.0, 20.0, 200.0);
        Random rng = new Random(3);
        for (int i = 0; i < 500; i++) {
            BigDecimal amount = sampler.pick(rng, new BigDecimal("1000"), model);
            assertTrue(amount.compareTo(new BigDecimal("20")) >= 0);
            assertTrue(amount.compareTo(new BigDecimal("200")) <= 0);
        }
    }

    @Test
    @DisplayName("triangular model is used without p90")
    void triangular() {
        AmountSampler sampler = new AmountSampler(null);
        AmountModel model = new AmountModel(null, null, 10.0, 30.0);
        Random rng = new Random(4);
        for (int i = 0; i < 200; i++) {
            BigDecimal amount = sampler.pick(rng, new BigDecimal("1000"), model);
            assertTrue(amount.compareTo(new BigDecimal("10")) >= 0);
            assertTrue(amount.compareTo(new BigDecimal("30")) <= 0);
        }
    }

    @Test
    @DisplayName("nothing fits when the model minimum is above the limit")
    void minimumAboveLimit() {
        AmountSampler sampler = new AmountSampler(null);
        assertNull(sampler.pick(new Random(5), new BigDecimal("15"), new AmountModel(null, null, 20.0, null)));
        assertNull(sampler.pick(new Random(5), BigDecimal.ZERO, null));
    }

    @Test
    @DisplayName("truncates to cents")
    void cents() {
        BigDecimal amount = new AmountSampler(null).pick(new Random(6), new BigDecimal("99.99"), null);
        assertTrue(amount.scale() <= 2);
    }
}
