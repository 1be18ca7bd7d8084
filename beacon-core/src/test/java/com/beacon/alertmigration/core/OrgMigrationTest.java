package com.beacon.alertmigration.core;

import com.beacon.alertmigration.api.MigrationListener;
import com.beacon.alertmigration.api.exceptions.AlertMigrationException;
import com.beacon.alertmigration.api.model.AlertMigrationStatus;
import com.beacon.alertmigration.api.model.AlertQuery;
import com.beacon.alertmigration.api.model.DashboardUpgradeInfo;
import com.beacon.alertmigration.api.model.LegacyAlert;
import com.beacon.alertmigration.api.model.MigrationReport;
import com.beacon.alertmigration.api.model.MigrationResult;
import com.beacon.alertmigration.api.model.MigrationStage;
import com.beacon.alertmigration.api.model.SilenceRecord;
import com.beacon.alertmigration.api.model.TranslatedCondition;
import com.beacon.alertmigration.api.spi.ConditionTranslator;
import com.beacon.alertmigration.core.silence.CollectingSilenceSink;
import com.beacon.alertmigration.infra.channel.InMemoryChannelResolver;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrgMigrationTest {

    private static final long ORG_ID = 1;
    private static final DashboardUpgradeInfo OPS = new DashboardUpgradeInfo("ops-dash", "Ops", "folder-ops");
    private static final DashboardUpgradeInfo DB = new DashboardUpgradeInfo("db-dash", "Databases", "folder-db");

    @Mock
    private ConditionTranslator conditionTranslator;
    @Mock
    private MigrationListener listener;

    private CollectingSilenceSink silenceSink;
    private OrgMigration migration;

    @BeforeEach
    void setUp() {
        silenceSink = new CollectingSilenceSink();
        AtomicInteger uids = new AtomicInteger();
        migration = OrgMigration.builder(ORG_ID, conditionTranslator)
                .channelResolver(new InMemoryChannelResolver(List.of()))
                .silenceSink(silenceSink)
                .tracer(OpenTelemetry.noop().getTracer("test"))
                .uidSupplier(() -> "uid-" + uids.incrementAndGet())
                .existingTitles(folderUid -> folderUid.equals("folder-db") ? Set.of("Replication lag") : Set.of())
                .build();
    }

    private static LegacyAlert alert(long id, String name, String settings) {
        return new LegacyAlert(ORG_ID, id, 7, id * 10, name, "", 60, Duration.ZERO, "ok", settings);
    }

    private void translatorSucceeds() {
        when(conditionTranslator.translate(any(), eq(ORG_ID))).thenReturn(new TranslatedCondition("B", List.of(
                new AlertQuery("B", "", null, AlertQuery.EXPRESSION_DATASOURCE_UID, "{}"))));
    }

    @Test
    @DisplayName("Should keep titles unique per folder across calls")
    void testTitlesUniquePerFolder() {
        translatorSucceeds();

        String first = migration.migrateAlert(alert(1, "CPU High", "{}"), OPS).rule().title();
        String second = migration.migrateAlert(alert(2, "CPU High", "{}"), OPS).rule().title();
        String otherFolder = migration.migrateAlert(alert(3, "CPU High", "{}"), DB).rule().title();

        assertThat(first).isEqualTo("CPU High");
        assertThat(second).isEqualTo("CPU High #2");
        assertThat(otherFolder).isEqualTo("CPU High");
        assertThat(migration.isTitleTaken("folder-ops", "CPU High #2")).isTrue();
        assertThat(migration.isTitleTaken("folder-db", "CPU High #2")).isFalse();
    }

    @Test
    @DisplayName("Should seed a folder with its existing titles")
    void testExistingTitlesSeeded() {
        translatorSucceeds();

        MigrationResult result = migration.migrateAlert(alert(1, "Replication lag", "{}"), DB);

        assertThat(result.rule().title()).isEqualTo("Replication lag #2");
    }

    @Test
    @DisplayName("Should continue a batch past a failing alert")
    void testBatchContinuesPastFailure() {
        translatorSucceeds();
        List<LegacyAlert> alerts = List.of(
                alert(1, "First", "{}"),
                alert(2, "Broken", "{\"conditions\": ["),
                alert(3, "Third", "{\"notifications\":[{\"uid\":\"missing\"}]}"));

        MigrationReport report = migration.migrateDashboardAlerts(alerts, OPS);

        assertThat(report.statuses()).extracting(AlertMigrationStatus::status).containsExactly(
                AlertMigrationStatus.Status.MIGRATED,
                AlertMigrationStatus.Status.FAILED,
                AlertMigrationStatus.Status.DEGRADED);
        assertThat(report.statuses().get(1).failedStage()).isEqualTo(MigrationStage.SETTINGS);
        assertThat(report.statuses().get(1).error()).startsWith(MigrationStage.SETTINGS.label());
        assertThat(report.stats()).isEqualTo(new MigrationReport.Stats(3, 1, 1, 1));
        assertThat(report.rules()).extracting(r -> r.title()).containsExactly("First", "Third");
    }

    @Test
    @DisplayName("Should notify the listener of migrated and failed alerts")
    void testListenerCallbacks() {
        migration.setMigrationListener(listener);
        translatorSucceeds();
        LegacyAlert good = alert(1, "Good", "{}");
        LegacyAlert bad = alert(2, "Bad", "not json");

        MigrationResult result = migration.migrateAlert(good, OPS);
        assertThatThrownBy(() -> migration.migrateAlert(bad, OPS)).isInstanceOf(AlertMigrationException.class);

        verify(listener).onAlertMigrated(good, result);
        verify(listener).onAlertFailed(eq(bad), any(AlertMigrationException.class));
    }

    @Test
    @DisplayName("Should collect keep-state silences through the configured sink")
    void testSilencesCollected() {
        translatorSucceeds();

        MigrationReport report = migration.migrateDashboardAlerts(List.of(
                alert(1, "A", "{\"noDataState\":\"keep_state\",\"executionErrorState\":\"keep_state\"}"),
                alert(2, "B", "{}")), OPS);

        assertThat(report.silences()).hasSize(2);
        assertThat(silenceSink.getSilences()).extracting(SilenceRecord::kind)
                .containsExactly(SilenceRecord.Kind.ERROR, SilenceRecord.Kind.NO_DATA);
        assertThat(report.rules().get(0).labels()).containsEntry("rule_uid", report.rules().get(0).uid());
    }

    @Test
    @DisplayName("Should reject alerts of another organisation")
    void testOrgMismatch() {
        LegacyAlert foreign = new LegacyAlert(2, 1, 7, 1, "A", "", 60, Duration.ZERO, "ok", "{}");

        assertThatThrownBy(() -> migration.migrateAlert(foreign, OPS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("org 2");
    }

    @Test
    @DisplayName("Should surface condition translation failures with the condition stage")
    void testConditionFailure() {
        when(conditionTranslator.translate(any(), anyLong())).thenThrow(new IllegalStateException("no reducer"));

        MigrationReport report = migration.migrateDashboardAlerts(List.of(alert(1, "A", "{}")), OPS);

        assertThat(report.statuses()).singleElement()
                .satisfies(s -> assertThat(s.failedStage()).isEqualTo(MigrationStage.CONDITION));
        assertThat(migration.isTitleTaken("folder-ops", "A")).isFalse();
    }

    @Test
    @DisplayName("Should require a channel resolver")
    void testBuilderRequiresResolver() {
        assertThatThrownBy(() -> OrgMigration.builder(ORG_ID, conditionTranslator).build())
                .isInstanceOf(IllegalStateException.class);
    }
}
