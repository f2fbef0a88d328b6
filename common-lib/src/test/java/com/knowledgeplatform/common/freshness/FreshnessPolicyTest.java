package com.knowledgeplatform.common.freshness;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boundary verification of {@link FreshnessPolicy}.
 */
class FreshnessPolicyTest {

    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    @Nested
    @DisplayName("default 7-day window")
    class DefaultWindow {

        private final FreshnessPolicy policy = new FreshnessPolicy();

        @Test
        @DisplayName("absent topic → refresh")
        void absentTopic_needsRefresh() {
            assertTrue(policy.needsRefresh(null, NOW));
        }

        @Test
        @DisplayName("updated a moment ago → fresh")
        void justUpdated_isFresh() {
            assertFalse(policy.needsRefresh(NOW.minusSeconds(1), NOW));
        }

        @Test
        @DisplayName("exactly 7 days old → still fresh")
        void exactlySevenDays_isFresh() {
            assertFalse(policy.needsRefresh(NOW.minus(Duration.ofDays(7)), NOW));
        }

        @Test
        @DisplayName("7 days + 1 second old → stale")
        void sevenDaysAndOneSecond_isStale() {
            assertTrue(policy.needsRefresh(NOW.minus(Duration.ofDays(7)).minusSeconds(1), NOW));
        }

        @Test
        @DisplayName("10 days old → stale")
        void tenDays_isStale() {
            assertTrue(policy.needsRefresh(NOW.minus(Duration.ofDays(10)), NOW));
        }

        @Test
        @DisplayName("timestamp in the future → fresh")
        void futureTimestamp_isFresh() {
            assertFalse(policy.needsRefresh(NOW.plus(Duration.ofHours(2)), NOW));
        }

        @Test
        void exposesDefaultWindow() {
            assertEquals(FreshnessPolicy.DEFAULT_STALENESS_WINDOW, policy.stalenessWindow());
        }
    }

    @Nested
    @DisplayName("overridden window")
    class CustomWindow {

        @Test
        @DisplayName("1-day window: 1 day fresh, 1 day + 1s stale")
        void oneDayWindow_boundary() {
            FreshnessPolicy policy = new FreshnessPolicy(Duration.ofDays(1));
            assertFalse(policy.needsRefresh(NOW.minus(Duration.ofDays(1)), NOW));
            assertTrue(policy.needsRefresh(NOW.minus(Duration.ofDays(1)).minusSeconds(1), NOW));
        }

        @Test
        @DisplayName("zero window: any age refreshes")
        void zeroWindow_alwaysStaleOnceOlder() {
            FreshnessPolicy policy = new FreshnessPolicy(Duration.ZERO);
            assertFalse(policy.needsRefresh(NOW, NOW));
            assertTrue(policy.needsRefresh(NOW.minusMillis(1), NOW));
        }

        @Test
        void negativeWindow_rejected() {
            assertThrows(IllegalArgumentException.class, () -> new FreshnessPolicy(Duration.ofDays(-1)));
        }

        @Test
        void nullWindow_rejected() {
            assertThrows(NullPointerException.class, () -> new FreshnessPolicy(null));
        }
    }
}
