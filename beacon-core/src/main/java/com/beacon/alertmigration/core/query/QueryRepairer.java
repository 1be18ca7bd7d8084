/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.core.query;

import com.beacon.alertmigration.api.exceptions.AlertMigrationException;
import com.beacon.alertmigration.api.model.AlertQuery;
import com.beacon.alertmigration.api.model.MigrationStage;
import com.beacon.alertmigration.core.MigrationDiagnostics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites query models that the unified engine cannot run as-is.
 *
 * <p>Models are edited as Jackson {@link ObjectNode}s so that unknown fields
 * and field order survive untouched. Expression queries are passed through
 * without being parsed.
 *
 * <p>Repairs, in order:
 * <ol>
 *   <li>drop the UI-only {@code hide} flag</li>
 *   <li>Graphite: replace {@code target} with the pre-expanded
 *       {@code targetFull}, since referenced sub-queries are not expanded
 *       by the unified engine</li>
 *   <li>Prometheus: a "Both" query ({@code instant} and {@code range} both
 *       true) becomes a range query</li>
 * </ol>
 */
public class QueryRepairer {

    private static final Logger logger = LoggerFactory.getLogger(QueryRepairer.class);

    static final String HIDE_FIELD = "hide";
    static final String GRAPHITE_TARGET_FIELD = "target";
    static final String GRAPHITE_TARGET_FULL_FIELD = "targetFull";
    static final String INSTANT_FIELD = "instant";
    static final String RANGE_FIELD = "range";
    static final String DATASOURCE_FIELD = "datasource";
    static final String DATASOURCE_TYPE_FIELD = "type";
    static final String PROMETHEUS_TYPE = "prometheus";

    private final ObjectMapper objectMapper;

    public QueryRepairer() {
        this.objectMapper = JsonMapper.builder()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
                .build();
    }

    public List<AlertQuery> repair(List<AlertQuery> queries) {
        return repair(queries, new MigrationDiagnostics());
    }

    /**
     * Repairs each query of a translated condition.
     *
     * @return new list of the same length and order
     * @throws AlertMigrationException with stage QUERIES if a model is not a JSON object
     */
    public List<AlertQuery> repair(List<AlertQuery> queries, MigrationDiagnostics diagnostics) {
        List<AlertQuery> result = new ArrayList<>(queries.size());
        for (AlertQuery query : queries) {
            if (query.isExpression()) {
                result.add(query);
                continue;
            }
            ObjectNode model = parseModel(query);
            model.remove(HIDE_FIELD);
            fixGraphiteReferencedSubQueries(model);
            fixPrometheusBothTypeQuery(query.refId(), model, diagnostics);
            result.add(query.withModel(writeModel(query, model)));
        }
        return result;
    }

    private ObjectNode parseModel(AlertQuery query) {
        JsonNode node;
        try {
            node = objectMapper.readTree(query.model());
        } catch (JsonProcessingException e) {
            throw new AlertMigrationException(MigrationStage.QUERIES,
                    "invalid model for query " + query.refId() + ": " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new AlertMigrationException(MigrationStage.QUERIES,
                    "model for query " + query.refId() + " is not a JSON object");
        }
        return (ObjectNode) node;
    }

    private String writeModel(AlertQuery query, ObjectNode model) {
        try {
            return objectMapper.writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new AlertMigrationException(MigrationStage.QUERIES,
                    "cannot serialize model for query " + query.refId() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * targetFull holds the expanded form of target; when present it replaces
     * target, keeping target's position if target exists.
     */
    void fixGraphiteReferencedSubQueries(ObjectNode model) {
        JsonNode fullQuery = model.remove(GRAPHITE_TARGET_FULL_FIELD);
        if (fullQuery != null) {
            model.set(GRAPHITE_TARGET_FIELD, fullQuery);
        }
    }

    /**
     * Converts Prometheus "Both" queries to range queries.
     *
     * <p>Splitting into one instant and one range query would need the
     * classic condition to be split too, with operator precedence the legacy
     * conditions cannot express, so the instant part is dropped instead.
     */
    void fixPrometheusBothTypeQuery(String refId, ObjectNode model, MigrationDiagnostics diagnostics) {
        Boolean instant = readFlag(model, INSTANT_FIELD);
        if (instant == null) {
            return;
        }
        Boolean range = readFlag(model, RANGE_FIELD);
        if (range == null) {
            return;
        }
        if (!instant || !range) {
            return;
        }

        DatasourceCheck check = checkPrometheus(model);
        if (check.problem() != null) {
            logger.atInfo()
                    .addKeyValue("refId", refId)
                    .addKeyValue("err", check.problem())
                    .log("Unable to convert alert rule that resembles a Prometheus 'Both' type query to 'Range'");
            return;
        }
        if (!check.prometheus()) {
            return;
        }

        logger.atWarn()
                .addKeyValue("refId", refId)
                .log("Prometheus 'Both' type queries are not supported in unified alerting. Converting to range query.");
        diagnostics.info(MigrationStage.QUERIES,
                "Query " + refId + " was a Prometheus 'Both' query and was converted to a range query");
        model.set(INSTANT_FIELD, BooleanNode.FALSE);
    }

    /**
     * @return the flag value, false when absent or null, or null when the
     *         field holds something that is not a boolean
     */
    private Boolean readFlag(ObjectNode model, String field) {
        JsonNode value = model.get(field);
        if (value == null || value.isNull()) {
            return Boolean.FALSE;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (checkPrometheus(model).prometheus()) {
            logger.atInfo()
                    .addKeyValue(field, value.toString())
                    .log("Failed to parse " + field + " field on Prometheus query");
        }
        return null;
    }

    private DatasourceCheck checkPrometheus(ObjectNode model) {
        JsonNode datasource = model.get(DATASOURCE_FIELD);
        if (datasource == null) {
            return DatasourceCheck.unknown("missing datasource field");
        }
        if (!datasource.isObject() && !datasource.isNull()) {
            return DatasourceCheck.unknown("parse datasource '" + datasource + "'");
        }
        JsonNode type = datasource.get(DATASOURCE_TYPE_FIELD);
        if (type != null && !type.isTextual() && !type.isNull()) {
            return DatasourceCheck.unknown("parse datasource '" + datasource + "'");
        }
        if (type == null || type.isNull() || type.textValue().isEmpty()) {
            return DatasourceCheck.unknown("missing type field '" + datasource + "'");
        }
        return new DatasourceCheck(PROMETHEUS_TYPE.equals(type.textValue()), null);
    }

    private record DatasourceCheck(boolean prometheus, String problem) {
        static DatasourceCheck unknown(String problem) {
            return new DatasourceCheck(false, problem);
        }
    }
}
