package com.ryuqq.jobhub.core.protection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RateLimiterConfig 테스트.
 *
 * @author JobHub Team
 * @since 1.0.0
 */
class RateLimiterConfigTest {

    @Test
    void defaultConstructor_UsesDefaults() {
        RateLimiterConfig config = new RateLimiterConfig();

        assertEquals(10, config.maxPerSecond());
        assertEquals(250, config.maxPerMinute());
        assertEquals(1_000_000_000L, config.maxPerDay());
    }

    @Test
    void constructor_NonPositiveLimit_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RateLimiterConfig(0, 250, 1000)
        );
        assertTrue(exception.getMessage().contains("maxPerSecond must be positive"));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiterConfig(1, -1, 1000));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiterConfig(1, 1, 0));
    }

    @Test
    void withMethods_ReplaceSingleLimit() {
        RateLimiterConfig config = new RateLimiterConfig().withMaxPerSecond(2).withMaxPerDay(500);

        assertEquals(2, config.maxPerSecond());
        assertEquals(250, config.maxPerMinute());
        assertEquals(500, config.maxPerDay());
    }
}
