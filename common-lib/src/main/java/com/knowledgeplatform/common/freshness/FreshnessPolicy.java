package com.knowledgeplatform.common.freshness;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether stored topic content is old enough to warrant a refresh from the
 * external source.
 *
 * <p>The boundary is exclusive: content exactly {@code stalenessWindow} old is still
 * fresh, one second more is stale. A missing timestamp (no stored topic) always
 * needs a refresh.
 *
 * <p>Pure and stateless apart from the configured window. Safe to share.
 */
public final class FreshnessPolicy {

    public static final Duration DEFAULT_STALENESS_WINDOW = Duration.ofDays(7);

    private final Duration stalenessWindow;

    public FreshnessPolicy() {
        this(DEFAULT_STALENESS_WINDOW);
    }

    public FreshnessPolicy(Duration stalenessWindow) {
        Objects.requireNonNull(stalenessWindow, "stalenessWindow");
        if (stalenessWindow.isNegative()) {
            throw new IllegalArgumentException("stalenessWindow must not be negative: " + stalenessWindow);
        }
        this.stalenessWindow = stalenessWindow;
    }

    /**
     * @param lastUpdate last successful refresh of the topic, {@code null} when no topic is stored
     * @param now        current instant
     * @return {@code true} when the topic is absent or older than the staleness window
     */
    public boolean needsRefresh(Instant lastUpdate, Instant now) {
        if (lastUpdate == null) {
            return true;
        }
        return Duration.between(lastUpdate, now).compareTo(stalenessWindow) > 0;
    }

    public Duration stalenessWindow() {
        return stalenessWindow;
    }
}
