package com.changesentinel.core.correlation;

import com.changesentinel.core.model.AnomalyBatch;
import com.changesentinel.core.model.AnomalyReport;
import com.changesentinel.core.model.AnomalySignal;
import com.changesentinel.core.model.BreachType;
import com.changesentinel.core.model.CausationCategory;
import com.changesentinel.core.model.CycleTrigger;
import com.changesentinel.core.model.DeploymentEvent;
import com.changesentinel.core.model.RankedDeployment;
import com.changesentinel.core.model.RcaFinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DeploymentCorrelator}.
 */
class DeploymentCorrelatorTest {

    private static final Duration WINDOW = Duration.ofSeconds(3_600);

    private final DeploymentCorrelator correlator = new DeploymentCorrelator();

    @Test
    @DisplayName("Should only attribute deployments before the onset, scored by proximity")
    void shouldIgnoreDeploymentsAfterOnset() {
        AnomalySignal signal = signal("db", "db.cpu", CausationCategory.DB_CPU, 100);
        DeploymentEvent before = deployment("db", 40, "v1", CausationCategory.DEPLOYMENT_GENERIC);
        DeploymentEvent after = deployment("db", 150, "v2", CausationCategory.DEPLOYMENT_GENERIC);

        List<RcaFinding> findings = correlator.correlate(batch(signal), List.of(before, after), WINDOW);

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.getCandidates()).extracting(RankedDeployment::getDeployment)
                    .containsExactly(before);
            // proximity 0.1 + 0.9 * (1 - 60/3600) = 0.985, generic category 0.4
            assertThat(finding.getPrimary().getProximity()).isCloseTo(0.985, within(1e-9));
            assertThat(finding.getConfidence()).isCloseTo(0.7 * 0.985 + 0.3 * 0.4, within(1e-9));
            assertThat(finding.getCategory()).isEqualTo(CausationCategory.DEPLOYMENT_GENERIC);
        });
    }

    @Test
    @DisplayName("Should include a deployment exactly at the onset and at the window edge")
    void shouldIncludeBoundaries() {
        AnomalySignal signal = signal("db", "db.cpu", CausationCategory.DB_CPU, 3_700);
        DeploymentEvent atOnset = deployment("db", 3_700, "v3", CausationCategory.DB_CPU);
        DeploymentEvent atEdge = deployment("db", 100, "v1", CausationCategory.DB_CPU);
        DeploymentEvent tooOld = deployment("db", 99, "v0", CausationCategory.DB_CPU);

        RcaFinding finding = correlator.correlate(batch(signal), List.of(atEdge, tooOld, atOnset), WINDOW).get(0);

        assertThat(finding.getCandidates()).extracting(RankedDeployment::getDeployment)
                .containsExactly(atOnset, atEdge);
        assertThat(finding.getConfidence()).isCloseTo(1.0, within(1e-9));
        assertThat(finding.getCandidates().get(1).getProximity()).isCloseTo(0.1, within(1e-9));
        assertThat(finding.getCategory()).isEqualTo(CausationCategory.DB_CPU);
    }

    @Test
    @DisplayName("Should rank a matching category above a closer generic deployment")
    void shouldRankByConfidence() {
        AnomalySignal signal = signal("db", "db.cpu", CausationCategory.DB_CPU, 3_600);
        DeploymentEvent generic = deployment("db", 3_500, "app", CausationCategory.DEPLOYMENT_GENERIC);
        DeploymentEvent matching = deployment("db", 3_000, "param-group", CausationCategory.DB_CPU);

        RcaFinding finding = correlator.correlate(batch(signal), List.of(generic, matching), WINDOW).get(0);

        assertThat(finding.getPrimary().getDeployment()).isEqualTo(matching);
        assertThat(finding.getCandidates()).hasSize(2);
        assertThat(finding.getCategory()).isEqualTo(CausationCategory.DB_CPU);
    }

    @Test
    @DisplayName("Should break confidence ties by most recent deployment")
    void shouldBreakTiesByRecency() {
        AnomalySignal signal = signal("db", "db.cpu", CausationCategory.DB_CPU, 1_000);
        CorrelationPolicy categoryOnly = new CorrelationPolicy(WINDOW, 0.1, 0.0, 1.0);
        DeploymentCorrelator scorer = new DeploymentCorrelator(categoryOnly, CausationTable.defaults(),
                ScopeRelations.none());
        DeploymentEvent older = deployment("db", 200, "v1", CausationCategory.DEPLOYMENT_GENERIC);
        DeploymentEvent newer = deployment("db", 800, "v2", CausationCategory.DEPLOYMENT_GENERIC);

        RcaFinding finding = scorer.correlate(batch(signal), List.of(older, newer)).get(0);

        assertThat(finding.getCandidates()).extracting(RankedDeployment::getDeployment)
                .containsExactly(newer, older);
    }

    @Test
    @DisplayName("Should attribute across related scopes only when configured")
    void shouldUseScopeRelations() {
        AnomalySignal signal = signal("rds", "rds.cpu", CausationCategory.DB_CPU, 1_000);
        DeploymentEvent apiDeploy = deployment("orders-api", 900, "v7", CausationCategory.DEPLOYMENT_GENERIC);

        assertThat(correlator.correlate(batch(signal), List.of(apiDeploy), WINDOW)).isEmpty();

        DeploymentCorrelator related = new DeploymentCorrelator(CorrelationPolicy.defaults(),
                CausationTable.defaults(), ScopeRelations.builder().relate("rds", "orders-api").build());
        assertThat(related.correlate(batch(signal), List.of(apiDeploy), WINDOW)).hasSize(1);

        DeploymentCorrelator wildcard = new DeploymentCorrelator(CorrelationPolicy.defaults(),
                CausationTable.defaults(), ScopeRelations.builder().relate("rds", ScopeRelations.ANY).build());
        assertThat(wildcard.correlate(batch(signal), List.of(apiDeploy), WINDOW)).hasSize(1);
    }

    @Test
    @DisplayName("Should leave signals without candidates unattributed")
    void shouldLeaveUnattributedSignals() {
        AnomalySignal explained = signal("db", "db.cpu", CausationCategory.DB_CPU, 1_000);
        AnomalySignal unexplained = signal("redis", "redis.memory", CausationCategory.CACHE_MEMORY, 1_000);
        AnomalyBatch batch = batch(explained, unexplained);

        List<RcaFinding> findings = correlator.correlate(batch,
                List.of(deployment("db", 900, "v1", CausationCategory.DB_CPU)), WINDOW);
        AnomalyReport report = new AnomalyReport(batch, findings);

        assertThat(findings).extracting(f -> f.getSignal().getMetricId()).containsExactly("db.cpu");
        assertThat(report.getUnattributedSignals()).containsExactly(unexplained);
    }

    @Test
    @DisplayName("Should order findings by confidence and count a deployment once")
    void shouldOrderFindings() {
        AnomalySignal weak = signal("db", "db.connections", CausationCategory.DB_CONNECTIONS, 3_600);
        AnomalySignal strong = signal("db", "db.cpu", CausationCategory.DB_CPU, 3_600);
        DeploymentEvent deploy = deployment("db", 3_000, "v1", CausationCategory.DB_CPU);

        List<RcaFinding> findings = correlator.correlate(batch(weak, strong), List.of(deploy, deploy), WINDOW);

        assertThat(findings).extracting(f -> f.getSignal().getMetricId())
                .containsExactly("db.cpu", "db.connections");
        assertThat(findings.get(0).getCandidates()).hasSize(1);
        assertThat(findings.get(1).getPrimary().getCategoryScore()).isEqualTo(CausationTable.UNRELATED);
    }

    private static AnomalyBatch batch(AnomalySignal... signals) {
        return AnomalyBatch.builder()
                .cycleId("c-1")
                .trigger(CycleTrigger.ON_DEMAND)
                .startedAt(Instant.ofEpochSecond(10_000))
                .signals(List.of(signals))
                .build();
    }

    private static AnomalySignal signal(String scope, String metricId, CausationCategory category, long onset) {
        return AnomalySignal.builder()
                .metricId(metricId)
                .scope(scope)
                .category(category)
                .breachType(BreachType.ABSOLUTE)
                .observedValue(65)
                .baselineValue(50.0)
                .threshold(10)
                .magnitude(55)
                .onset(Instant.ofEpochSecond(onset))
                .build();
    }

    private static DeploymentEvent deployment(String scope, long at, String version, CausationCategory category) {
        return new DeploymentEvent(scope, Instant.ofEpochSecond(at), version, "ci-bot", category);
    }
}
