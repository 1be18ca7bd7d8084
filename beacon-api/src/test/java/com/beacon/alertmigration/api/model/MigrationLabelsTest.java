package com.beacon.alertmigration.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MigrationLabelsTest {

    @Test
    @DisplayName("Should build contact labels from the verbatim channel name")
    void testContactLabel() {
        assertThat(MigrationLabels.contactLabel("pager")).isEqualTo("__legacy_c_pager__");
        assertThat(MigrationLabels.contactLabel("Ops Slack #1")).isEqualTo("__legacy_c_Ops Slack #1__");
        assertThat(MigrationLabels.contactLabel(null)).isEqualTo("__legacy_c___");
    }

    @Test
    @DisplayName("Should keep channels with similar names on separate labels")
    void testDistinctChannelsDistinctLabels() {
        assertThat(MigrationLabels.contactLabel("Ops Slack"))
                .isNotEqualTo(MigrationLabels.contactLabel("Ops-Slack"))
                .isNotEqualTo(MigrationLabels.contactLabel("Ops_Slack"));
    }

    @Test
    @DisplayName("Should parse only known legacy options")
    void testOptionParsing() {
        assertThat(NoDataOption.fromValue("keep_state")).contains(NoDataOption.KEEP_STATE);
        assertThat(NoDataOption.fromValue("KEEP_STATE")).isEmpty();
        assertThat(ExecutionErrorOption.fromValue("ok")).contains(ExecutionErrorOption.OK);
        assertThat(ExecutionErrorOption.fromValue("no_data")).isEmpty();
    }
}
