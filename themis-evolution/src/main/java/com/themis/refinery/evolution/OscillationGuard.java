package com.themis.refinery.evolution;

import com.themis.refinery.api.Telemetry;
import com.themis.refinery.api.model.AlertSeverity;
import com.themis.refinery.api.model.RuleType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Blocks further changes to a rule area that changed too often.
 *
 * <p>Each area keeps the instants of its recent changes. Two or more changes
 * inside the window freeze the area on the next check; a frozen area stays
 * blocked for the cooldown period. Callers check before mutating and track
 * after a successful mutation. Thread-safe.
 */
public final class OscillationGuard {
    private static final Logger logger = Logger.getLogger(OscillationGuard.class.getName());

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);
    public static final Duration DEFAULT_COOLDOWN = Duration.ofHours(24);

    static final int FREEZE_THRESHOLD = 2;

    private final Duration window;
    private final Duration cooldown;
    private final Clock clock;
    private final Telemetry telemetry;
    private final Map<String, Deque<Instant>> changes = new HashMap<>();
    private final Map<String, Instant> freezes = new HashMap<>();

    public OscillationGuard() {
        this(DEFAULT_WINDOW, DEFAULT_COOLDOWN, Clock.systemUTC(), Telemetry.noop());
    }

    public OscillationGuard(Duration window, Duration cooldown, Clock clock, Telemetry telemetry) {
        if (window.isNegative() || window.isZero() || cooldown.isNegative()) {
            throw new IllegalArgumentException("Window must be positive and cooldown non-negative");
        }
        this.window = window;
        this.cooldown = cooldown;
        this.clock = clock;
        this.telemetry = telemetry;
    }

    /**
     * @return {@code true} when the area must not be changed now
     */
    public synchronized boolean checkOscillation(String area) {
        Instant now = clock.instant();
        Instant frozenAt = freezes.get(area);
        if (frozenAt != null) {
            if (Duration.between(frozenAt, now).compareTo(cooldown) < 0) {
                return true;
            }
            freezes.remove(area);
            logger.info("Cooldown elapsed, rule area unfrozen: " + area);
        }

        Deque<Instant> recent = prune(area, now);
        if (recent.size() >= FREEZE_THRESHOLD) {
            freezes.put(area, now);
            String message = String.format("%d changes within %s, frozen for %s",
                    recent.size(), window, cooldown);
            logger.warning("Oscillation detected in rule area " + area + ": " + message);
            telemetry.recordAlert("oscillation:" + area, AlertSeverity.WARNING, message);
            return true;
        }
        return false;
    }

    public boolean checkOscillation(RuleType type) {
        return checkOscillation(type.code());
    }

    public synchronized void trackChange(String area) {
        Instant now = clock.instant();
        prune(area, now).addLast(now);
    }

    public void trackChange(RuleType type) {
        trackChange(type.code());
    }

    public synchronized boolean isFrozen(String area) {
        Instant frozenAt = freezes.get(area);
        return frozenAt != null && Duration.between(frozenAt, clock.instant()).compareTo(cooldown) < 0;
    }

    /**
     * Operator override: lifts a freeze and forgets the area's recent changes.
     */
    public synchronized void unfreeze(String area) {
        freezes.remove(area);
        changes.remove(area);
        logger.info("Rule area unfrozen manually: " + area);
    }

    public synchronized Set<String> frozenAreas() {
        Set<String> frozen = new TreeSet<>();
        for (String area : freezes.keySet()) {
            if (isFrozen(area)) {
                frozen.add(area);
            }
        }
        return frozen;
    }

    private Deque<Instant> prune(String area, Instant now) {
        Deque<Instant> recent = changes.computeIfAbsent(area, a -> new ArrayDeque<>());
        Instant cutoff = now.minus(window);
        while (!recent.isEmpty() && recent.peekFirst().isBefore(cutoff)) {
            recent.pollFirst();
        }
        return recent;
    }
}
