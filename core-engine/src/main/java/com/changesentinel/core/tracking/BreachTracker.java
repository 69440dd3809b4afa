package com.changesentinel.core.tracking;

import com.changesentinel.core.model.AnomalySignal;
import com.changesentinel.core.model.Breach;
import com.changesentinel.core.model.BreachDecision;
import com.changesentinel.core.model.BreachType;
import com.changesentinel.core.model.MetricDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-metric hysteresis across cycles.
 *
 * <p>
 * A metric must breach on {@code consecutivePoints} consecutive evaluations
 * before a signal is emitted. The state machine is
 * {@code NORMAL -> SUSPECT -> CONFIRMED}; any clean evaluation returns it to
 * {@code NORMAL} immediately. Exactly one signal is emitted per streak, on the
 * evaluation that completes it.
 * </p>
 *
 * <h3>State Management</h3>
 * <p>
 * Entries live in a {@link ConcurrentHashMap} and are only replaced inside
 * {@code compute}, which serialises updates per metric. Applying the same
 * decision twice (same {@code observedAt}) is a no-op, as is applying a
 * decision older than the last one seen.
 * </p>
 *
 * @since 1.0.0
 */
public class BreachTracker {

    private static final Logger LOG = LoggerFactory.getLogger(BreachTracker.class);

    private final Map<String, BreachState> states = new ConcurrentHashMap<>();
    private final Clock clock;

    public BreachTracker() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of {@code detectedAt} timestamps
     */
    public BreachTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    // ---------------------------------------------------------------
    // Tracking
    // ---------------------------------------------------------------

    /**
     * Apply one evaluation result.
     *
     * @param definition the evaluated metric
     * @param decision   the evaluation result for it
     * @return a signal if this decision completes a breach streak
     */
    public Optional<AnomalySignal> track(MetricDefinition definition, BreachDecision decision) {
        Objects.requireNonNull(definition, "MetricDefinition must not be null");
        Objects.requireNonNull(decision, "BreachDecision must not be null");
        if (!definition.id().equals(decision.getMetricId())) {
            throw new IllegalArgumentException("Decision for '" + decision.getMetricId()
                    + "' tracked against definition '" + definition.id() + "'");
        }

        AtomicReference<AnomalySignal> emitted = new AtomicReference<>();
        int required = definition.getConsecutivePoints();

        states.compute(definition.id(), (id, previous) -> {
            BreachState state = previous != null ? previous : BreachState.INITIAL;
            if (state.hasSeen(decision.getObservedAt())) {
                LOG.debug("Metric [{}]: decision at {} already applied - ignored", id, decision.getObservedAt());
                return state;
            }
            if (!decision.isBreach()) {
                if (state.status != BreachStatus.NORMAL) {
                    LOG.info("Metric [{}] recovered after {} breaching evaluation(s)", id, state.consecutiveCount);
                }
                return state.clean(decision.getObservedAt());
            }

            BreachState next = state.breached(decision.getObservedAt(), required);
            if (next.consecutiveCount == required) {
                emitted.set(toSignal(definition, decision, next));
            } else if (next.status == BreachStatus.SUSPECT) {
                LOG.debug("Metric [{}] suspect: {}/{} consecutive breach(es)", id, next.consecutiveCount, required);
            }
            return next;
        });

        AnomalySignal signal = emitted.get();
        if (signal != null) {
            LOG.info("Anomaly confirmed: metric={} type={} severity={} onset={}",
                    signal.getMetricId(), signal.getBreachType(), signal.getSeverity(), signal.getOnset());
        }
        return Optional.ofNullable(signal);
    }

    private AnomalySignal toSignal(MetricDefinition definition, BreachDecision decision, BreachState state) {
        Breach primary = decision.primaryBreach().orElseThrow();
        Set<BreachType> types = EnumSet.noneOf(BreachType.class);
        decision.getBreaches().forEach(b -> types.add(b.getType()));
        return AnomalySignal.builder()
                .metricId(definition.id())
                .scope(definition.getScope())
                .unit(definition.getUnit())
                .category(definition.causationCategory())
                .breachType(primary.getType())
                .breachTypes(types)
                .observedValue(decision.getCurrentValue())
                .baselineValue(decision.getBaselineValue())
                .threshold(primary.getThreshold())
                .magnitude(primary.getMagnitude())
                .consecutiveCount(state.consecutiveCount)
                .onset(state.onset)
                .detectedAt(clock.instant())
                .build();
    }

    // ---------------------------------------------------------------
    // Inspection / maintenance
    // ---------------------------------------------------------------

    /**
     * @param metricId the metric identity
     * @return the metric's current entry, if it was ever tracked
     */
    public Optional<BreachStateView> snapshot(String metricId) {
        BreachState state = states.get(metricId);
        return state == null ? Optional.empty() : Optional.of(new BreachStateView(metricId, state));
    }

    /**
     * @return the current status of a metric, {@code NORMAL} if never tracked
     */
    public BreachStatus statusOf(String metricId) {
        BreachState state = states.get(metricId);
        return state == null ? BreachStatus.NORMAL : state.status;
    }

    /**
     * Return a metric to {@code NORMAL}, keeping its last-seen marker.
     */
    public void reset(String metricId) {
        states.computeIfPresent(metricId, (id, state) -> state.clean(state.lastSeen));
    }

    /**
     * Drop a metric's entry entirely, e.g. after it was removed from config.
     */
    public void forget(String metricId) {
        states.remove(metricId);
    }

    public int trackedCount() {
        return states.size();
    }
}
