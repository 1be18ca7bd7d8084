package com.beacon.alertmigration.api.model;

import com.beacon.alertmigration.api.exceptions.AlertMigrationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MigrationReportTest {

    private static LegacyAlert alert(long id) {
        return new LegacyAlert(1, id, 1, 1, "Alert " + id, null, 60, null, null, null);
    }

    private static MigrationResult result(String uid, List<MigrationIssue> issues, List<SilenceRecord> silences) {
        MigratedAlertRule rule = new MigratedAlertRule(1, uid, "Alert", "A", List.of(), 60, 1, "f", "d", 1,
                "g", 1, Duration.ZERO, Instant.EPOCH, Map.of(), Map.of(), false,
                NoDataState.NO_DATA, ExecutionErrorState.ALERTING);
        return new MigrationResult(rule, silences, issues);
    }

    @Test
    @DisplayName("Should count outcomes and expose rules and silences")
    void testReport() {
        SilenceRecord silence = new SilenceRecord("s1", SilenceRecord.Kind.NO_DATA,
                List.of(SilenceRecord.Matcher.equal("rule_uid", "u1")), Instant.EPOCH, Instant.EPOCH, "me", "c");
        AlertMigrationException failure = new AlertMigrationException(MigrationStage.SETTINGS, "bad json");

        MigrationReport report = MigrationReport.of(List.of(
                AlertMigrationStatus.migrated(alert(1), result("u1", List.of(), List.of(silence))),
                AlertMigrationStatus.migrated(alert(2), result("u2",
                        List.of(MigrationIssue.degraded(MigrationStage.CHANNELS, "missing")), List.of())),
                AlertMigrationStatus.migrated(alert(3), result("u3",
                        List.of(MigrationIssue.info(MigrationStage.STATES, "defaulted")), List.of())),
                AlertMigrationStatus.failed(alert(4), failure.getStage(), failure.getMessage())));

        assertThat(report.stats()).isEqualTo(new MigrationReport.Stats(4, 2, 1, 1));
        assertThat(report.rules()).extracting(MigratedAlertRule::uid).containsExactly("u1", "u2", "u3");
        assertThat(report.silences()).containsExactly(silence);
        assertThat(report.statuses().get(3).error()).isEqualTo("parse settings: bad json");
        assertThat(report.statuses().get(3).issues()).isEmpty();
    }

    @Test
    @DisplayName("Should add labels without mutating the original rule")
    void testWithLabel() {
        MigratedAlertRule rule = result("u1", List.of(), List.of()).rule();

        MigratedAlertRule labelled = rule.withLabel("rule_uid", "u1");

        assertThat(rule.labels()).isEmpty();
        assertThat(labelled.labels()).containsEntry("rule_uid", "u1");
        assertThat(labelled.uid()).isEqualTo("u1");
    }
}
