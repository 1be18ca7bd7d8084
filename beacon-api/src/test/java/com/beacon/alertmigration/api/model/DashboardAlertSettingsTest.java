package com.beacon.alertmigration.api.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class DashboardAlertSettingsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should parse the fields migration reads and ignore the rest")
    void testParse() throws Exception {
        String json = "{"
                + "\"conditions\": [{\"type\": \"query\", \"evaluator\": {\"type\": \"gt\", \"params\": [80]}}],"
                + "\"notifications\": [{\"id\": 3}, {\"uid\": \"abc\"}],"
                + "\"noDataState\": \"keep_state\","
                + "\"executionErrorState\": \"alerting\","
                + "\"alertRuleTags\": {\"team\": \"infra\", \"tier\": 1},"
                + "\"handler\": 1, \"frequency\": \"60s\""
                + "}";

        DashboardAlertSettings settings = mapper.readValue(json, DashboardAlertSettings.class);

        assertThat(settings.conditions()).hasSize(1);
        assertThat(settings.conditions().get(0).path("evaluator").path("type").asText()).isEqualTo("gt");
        assertThat(settings.notifications()).containsExactly(
                NotificationChannelReference.ofId(3), NotificationChannelReference.ofUid("abc"));
        assertThat(settings.noDataState()).isEqualTo("keep_state");
        assertThat(settings.executionErrorState()).isEqualTo("alerting");
        assertThat(settings.tags()).containsExactly(entry("team", "infra"), entry("tier", ""));
    }

    @Test
    @DisplayName("Should default missing fields to empty values")
    void testEmptyDocument() throws Exception {
        DashboardAlertSettings settings = mapper.readValue("{}", DashboardAlertSettings.class);

        assertThat(settings.conditions()).isEmpty();
        assertThat(settings.notifications()).isEmpty();
        assertThat(settings.noDataState()).isEmpty();
        assertThat(settings.executionErrorState()).isEmpty();
        assertThat(settings.tags()).isEmpty();
    }

    @Test
    @DisplayName("Should read no tags when alertRuleTags is not an object")
    void testNonObjectTags() throws Exception {
        for (String tags : new String[]{"[]", "\"\"", "null", "42", "[\"a\"]"}) {
            DashboardAlertSettings settings =
                    mapper.readValue("{\"alertRuleTags\": " + tags + "}", DashboardAlertSettings.class);

            assertThat(settings.tags()).as("alertRuleTags = %s", tags).isEmpty();
        }
    }

    @Test
    @DisplayName("Should map non-string tag values to empty strings")
    void testNonStringTagValues() throws Exception {
        DashboardAlertSettings settings = mapper.readValue(
                "{\"alertRuleTags\": {\"a\": 5, \"b\": {\"x\": 1}, \"c\": [1], \"d\": true, \"e\": null, \"f\": \"ok\"}}",
                DashboardAlertSettings.class);

        assertThat(settings.tags()).containsExactly(
                entry("a", ""), entry("b", ""), entry("c", ""), entry("d", ""), entry("e", ""), entry("f", "ok"));
    }

    @Test
    @DisplayName("Should distinguish usable channel ids and uids")
    void testReferenceChecks() {
        assertThat(NotificationChannelReference.ofId(5).hasId()).isTrue();
        assertThat(new NotificationChannelReference(0L, "u").hasId()).isFalse();
        assertThat(new NotificationChannelReference(0L, "u").hasUid()).isTrue();
        assertThat(new NotificationChannelReference(null, "").hasUid()).isFalse();
    }
}
