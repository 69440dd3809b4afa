package com.changesentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The artifact of one cycle: its batch of signals and the ranked root-cause
 * findings. Created once per cycle and immutable thereafter; report
 * renderers and alert dispatchers consume it read-only.
 *
 * @since 1.0.0
 */
public final class AnomalyReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AnomalyBatch batch;
    private final List<RcaFinding> findings;

    public AnomalyReport(AnomalyBatch batch, List<RcaFinding> findings) {
        this.batch = Objects.requireNonNull(batch, "batch must not be null");
        this.findings = findings != null ? List.copyOf(findings) : List.of();
    }

    public String getCycleId() {
        return batch.getCycleId();
    }

    public AnomalyBatch getBatch() {
        return batch;
    }

    /**
     * @return findings sorted by descending confidence
     */
    public List<RcaFinding> getFindings() {
        return findings;
    }

    /**
     * @return signals no deployment could be attributed to
     */
    public List<AnomalySignal> getUnattributedSignals() {
        Set<AnomalySignal> attributed = findings.stream()
                .map(RcaFinding::getSignal)
                .collect(Collectors.toSet());
        return batch.getSignals().stream()
                .filter(signal -> !attributed.contains(signal))
                .toList();
    }

    public boolean hasAnomalies() {
        return !batch.getSignals().isEmpty();
    }

    @Override
    public String toString() {
        return "AnomalyReport{" + batch + ", findings=" + findings.size() + '}';
    }
}
