package com.changesentinel.core.correlation;

import com.changesentinel.core.model.AnomalyBatch;
import com.changesentinel.core.model.AnomalySignal;
import com.changesentinel.core.model.CausationCategory;
import com.changesentinel.core.model.DeploymentEvent;
import com.changesentinel.core.model.RankedDeployment;
import com.changesentinel.core.model.RcaFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Attributes confirmed signals to recent deployments.
 *
 * <p>
 * A deployment is a candidate for a signal when its scope matches the
 * signal's scope (directly or via {@link ScopeRelations}) and it happened
 * within {@code [onset - window, onset]}. Deployments after the onset are
 * never candidates. Candidates are scored with the {@link CorrelationPolicy}
 * and the {@link CausationTable}, and ranked by confidence, ties going to
 * the most recent deployment.
 * </p>
 *
 * <p>
 * One finding is produced per signal with at least one candidate. Signals
 * without candidates produce nothing and stay unattributed. Findings are
 * ordered by confidence, then by the primary deployment's timestamp, most
 * recent first.
 * </p>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class DeploymentCorrelator {

    private static final Logger LOG = LoggerFactory.getLogger(DeploymentCorrelator.class);

    private static final Comparator<RankedDeployment> CANDIDATE_ORDER = Comparator
            .comparingDouble(RankedDeployment::getConfidence).reversed()
            .thenComparing((RankedDeployment r) -> r.getDeployment().getTimestamp(), Comparator.reverseOrder());

    private static final Comparator<RcaFinding> FINDING_ORDER = Comparator
            .comparingDouble(RcaFinding::getConfidence).reversed()
            .thenComparing((RcaFinding f) -> f.getPrimary().getDeployment().getTimestamp(), Comparator.reverseOrder());

    private final CorrelationPolicy policy;
    private final CausationTable causationTable;
    private final ScopeRelations scopeRelations;

    public DeploymentCorrelator() {
        this(CorrelationPolicy.defaults(), CausationTable.defaults(), ScopeRelations.none());
    }

    public DeploymentCorrelator(CorrelationPolicy policy, CausationTable causationTable,
            ScopeRelations scopeRelations) {
        this.policy = Objects.requireNonNull(policy, "CorrelationPolicy must not be null");
        this.causationTable = Objects.requireNonNull(causationTable, "CausationTable must not be null");
        this.scopeRelations = Objects.requireNonNull(scopeRelations, "ScopeRelations must not be null");
    }

    /**
     * Correlate with the policy's window.
     */
    public List<RcaFinding> correlate(AnomalyBatch batch, List<DeploymentEvent> deployments) {
        return correlate(batch, deployments, policy.getWindow());
    }

    /**
     * @param batch       the cycle's signals
     * @param deployments deployment events; duplicates are ignored
     * @param window      look-back window before each onset
     * @return findings, best first
     */
    public List<RcaFinding> correlate(AnomalyBatch batch, List<DeploymentEvent> deployments, Duration window) {
        Objects.requireNonNull(batch, "AnomalyBatch must not be null");
        Objects.requireNonNull(deployments, "deployments must not be null");
        Objects.requireNonNull(window, "window must not be null");
        CorrelationPolicy effective = window.equals(policy.getWindow())
                ? policy
                : new CorrelationPolicy(window, policy.getProximityFloor(),
                        policy.getProximityWeight(), policy.getCategoryWeight());

        List<DeploymentEvent> distinct = new ArrayList<>(new LinkedHashSet<>(deployments));
        List<RcaFinding> findings = new ArrayList<>();
        for (AnomalySignal signal : batch.getSignals()) {
            List<RankedDeployment> candidates = rank(signal, distinct, effective);
            if (candidates.isEmpty()) {
                LOG.info("Signal [{}] has no deployment within {} before onset {}",
                        signal.getMetricId(), window, signal.getOnset());
                continue;
            }
            RankedDeployment primary = candidates.get(0);
            CausationCategory category = causationTable.isExactMatch(signal.getCategory(),
                    primary.getDeployment().getCategory())
                            ? signal.getCategory()
                            : CausationCategory.DEPLOYMENT_GENERIC;
            findings.add(new RcaFinding(signal, candidates, category));
            LOG.info("Signal [{}] attributed to {} {} by {} (confidence={})",
                    signal.getMetricId(), primary.getDeployment().getScope(),
                    primary.getDeployment().getVersion(), primary.getDeployment().getActor(),
                    String.format("%.3f", primary.getConfidence()));
        }
        findings.sort(FINDING_ORDER);
        return findings;
    }

    private List<RankedDeployment> rank(AnomalySignal signal, List<DeploymentEvent> deployments,
            CorrelationPolicy effective) {
        Instant onset = signal.getOnset();
        Instant earliest = onset.minus(effective.getWindow());
        List<RankedDeployment> ranked = new ArrayList<>();
        for (DeploymentEvent deployment : deployments) {
            Instant ts = deployment.getTimestamp();
            if (ts.isAfter(onset) || ts.isBefore(earliest)) {
                continue;
            }
            if (!scopeRelations.matches(signal.getScope(), deployment.getScope())) {
                continue;
            }
            double proximity = effective.proximity(Duration.between(ts, onset));
            double categoryScore = causationTable.score(signal.getCategory(), deployment.getCategory());
            double confidence = effective.confidence(proximity, categoryScore);
            ranked.add(new RankedDeployment(deployment, confidence, proximity, categoryScore));
        }
        ranked.sort(CANDIDATE_ORDER);
        return ranked;
    }
}
