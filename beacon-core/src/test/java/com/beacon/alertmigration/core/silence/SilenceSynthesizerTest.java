package com.beacon.alertmigration.core.silence;

import com.beacon.alertmigration.api.model.DashboardAlertSettings;
import com.beacon.alertmigration.api.model.ExecutionErrorState;
import com.beacon.alertmigration.api.model.MigratedAlertRule;
import com.beacon.alertmigration.api.model.MigrationIssue;
import com.beacon.alertmigration.api.model.MigrationStage;
import com.beacon.alertmigration.api.model.NoDataState;
import com.beacon.alertmigration.api.model.SilenceRecord;
import com.beacon.alertmigration.api.spi.SilenceSink;
import com.beacon.alertmigration.core.MigrationDiagnostics;
import com.beacon.alertmigration.infra.config.MigrationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link SilenceSynthesizer}.
 */
class SilenceSynthesizerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private SilenceSynthesizer synthesizer;
    private MigratedAlertRule rule;

    @BeforeEach
    void setUp() {
        synthesizer = new SilenceSynthesizer(MigrationConfig.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
        rule = new MigratedAlertRule(1, "rule-uid", "CPU High", "B", List.of(), 60, 1, "folder",
                "dash", 3, "Ops - 1m", 1, Duration.ZERO, NOW, Map.of("rule_uid", "rule-uid"), Map.of(),
                false, NoDataState.NO_DATA, ExecutionErrorState.ERROR);
    }

    private static DashboardAlertSettings settings(String noData, String execError) {
        return new DashboardAlertSettings(null, null, noData, execError, null);
    }

    @Test
    @DisplayName("Should create one error silence scoped to the rule for keep_state errors")
    void testErrorSilence() {
        List<SilenceRecord> silences = synthesizer.synthesize(rule, settings("no_data", "keep_state"));

        assertThat(silences).singleElement().satisfies(silence -> {
            assertThat(silence.kind()).isEqualTo(SilenceRecord.Kind.ERROR);
            assertThat(silence.kind().tag()).isEqualTo("error");
            assertThat(silence.matchers()).containsExactly(
                    SilenceRecord.Matcher.equal("alertname", SilenceSynthesizer.ERROR_ALERT_NAME),
                    SilenceRecord.Matcher.equal("rule_uid", "rule-uid"));
            assertThat(silence.startsAt()).isEqualTo(NOW);
            assertThat(silence.endsAt()).isEqualTo(NOW.plus(Duration.ofDays(365)));
            assertThat(silence.createdBy()).isEqualTo(MigrationConfig.DEFAULT_SILENCE_CREATED_BY);
            assertThat(silence.comment()).contains("rule-uid").contains("CPU High").contains("Error");
            assertThat(silence.id()).isNotBlank();
        });
    }

    @Test
    @DisplayName("Should create one no-data silence for keep_state no-data")
    void testNoDataSilence() {
        List<SilenceRecord> silences = synthesizer.synthesize(rule, settings("keep_state", "alerting"));

        assertThat(silences).singleElement().satisfies(silence -> {
            assertThat(silence.kind()).isEqualTo(SilenceRecord.Kind.NO_DATA);
            assertThat(silence.matchers()).contains(
                    SilenceRecord.Matcher.equal("alertname", SilenceSynthesizer.NO_DATA_ALERT_NAME));
        });
    }

    @Test
    @DisplayName("Should create both silences, error first, when both options keep state")
    void testBothSilences() {
        List<SilenceRecord> silences = synthesizer.synthesize(rule, settings("keep_state", "keep_state"));

        assertThat(silences).extracting(SilenceRecord::kind)
                .containsExactly(SilenceRecord.Kind.ERROR, SilenceRecord.Kind.NO_DATA);
    }

    @Test
    @DisplayName("Should create no silences for other options")
    void testNoSilences() {
        assertThat(synthesizer.synthesize(rule, settings("", ""))).isEmpty();
        assertThat(synthesizer.synthesize(rule, settings("alerting", "ok"))).isEmpty();
    }

    @Test
    @DisplayName("Should hand silences to the sink and return the accepted ones")
    void testCreateSilences() {
        CollectingSilenceSink sink = new CollectingSilenceSink();
        MigrationDiagnostics diagnostics = new MigrationDiagnostics();

        List<SilenceRecord> accepted =
                synthesizer.createSilences(rule, settings("keep_state", "keep_state"), sink, diagnostics);

        assertThat(accepted).hasSize(2);
        assertThat(sink.getSilences()).containsExactlyElementsOf(accepted);
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should record a sink failure without failing")
    void testSinkFailure() {
        SilenceSink failing = silence -> {
            if (silence.kind() == SilenceRecord.Kind.ERROR) {
                throw new IllegalStateException("alertmanager unavailable");
            }
        };
        MigrationDiagnostics diagnostics = new MigrationDiagnostics();

        List<SilenceRecord> accepted =
                synthesizer.createSilences(rule, settings("keep_state", "keep_state"), failing, diagnostics);

        assertThat(accepted).extracting(SilenceRecord::kind).containsExactly(SilenceRecord.Kind.NO_DATA);
        assertThat(diagnostics.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.stage()).isEqualTo(MigrationStage.SILENCES);
            assertThat(issue.severity()).isEqualTo(MigrationIssue.Severity.DEGRADED);
            assertThat(issue.message()).contains("alertmanager unavailable");
        });
    }

    @Test
    @DisplayName("Should use the configured silence duration and author")
    void testConfiguredDuration() {
        MigrationConfig config = MigrationConfig.builder()
                .silenceDuration(Duration.ofDays(30))
                .silenceCreatedBy("ops-bot")
                .build();
        SilenceSynthesizer custom = new SilenceSynthesizer(config, Clock.fixed(NOW, ZoneOffset.UTC));

        SilenceRecord silence = custom.buildSilence(rule, SilenceRecord.Kind.NO_DATA);

        assertThat(silence.endsAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
        assertThat(silence.createdBy()).isEqualTo("ops-bot");
    }
}
