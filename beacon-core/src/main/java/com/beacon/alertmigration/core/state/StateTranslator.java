/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.core.state;

import com.beacon.alertmigration.api.model.ExecutionErrorOption;
import com.beacon.alertmigration.api.model.ExecutionErrorState;
import com.beacon.alertmigration.api.model.MigrationStage;
import com.beacon.alertmigration.api.model.NoDataOption;
import com.beacon.alertmigration.api.model.NoDataState;
import com.beacon.alertmigration.core.MigrationDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Maps legacy no-data and execution-error options onto unified states.
 *
 * <p>Both translations are total. Legacy options come from stored free text,
 * so an unknown value falls back to a default and is logged.
 *
 * <p>"Keep last state" has no unified counterpart. The unified engine raises
 * a dedicated synthetic alert for no-data and error results, so keep-state
 * maps to {@link NoDataState#NO_DATA} and {@link ExecutionErrorState#ERROR};
 * the synthetic alert is then silenced for the rule.
 */
public class StateTranslator {

    private static final Logger logger = LoggerFactory.getLogger(StateTranslator.class);

    static final NoDataState DEFAULT_NO_DATA_STATE = NoDataState.NO_DATA;
    static final ExecutionErrorState DEFAULT_EXEC_ERR_STATE = ExecutionErrorState.ERROR;

    public NoDataState translateNoData(String option) {
        return translateNoData(option, new MigrationDiagnostics());
    }

    public NoDataState translateNoData(String option, MigrationDiagnostics diagnostics) {
        if (option == null || option.isEmpty()) {
            return NoDataState.NO_DATA;
        }
        Optional<NoDataOption> known = NoDataOption.fromValue(option);
        if (known.isEmpty()) {
            logger.atWarn()
                    .addKeyValue("old", option)
                    .addKeyValue("new", DEFAULT_NO_DATA_STATE)
                    .log("Unable to translate NoData state. Using default");
            diagnostics.info(MigrationStage.STATES,
                    "Unknown no-data option '" + option + "', using " + DEFAULT_NO_DATA_STATE);
            return DEFAULT_NO_DATA_STATE;
        }
        return switch (known.get()) {
            case OK -> NoDataState.OK;
            case NO_DATA, KEEP_STATE -> NoDataState.NO_DATA;
            case ALERTING -> NoDataState.ALERTING;
        };
    }

    public ExecutionErrorState translateExecError(String option) {
        return translateExecError(option, new MigrationDiagnostics());
    }

    public ExecutionErrorState translateExecError(String option, MigrationDiagnostics diagnostics) {
        if (option == null || option.isEmpty()) {
            return ExecutionErrorState.ALERTING;
        }
        Optional<ExecutionErrorOption> known = ExecutionErrorOption.fromValue(option);
        if (known.isEmpty()) {
            logger.atWarn()
                    .addKeyValue("old", option)
                    .addKeyValue("new", DEFAULT_EXEC_ERR_STATE)
                    .log("Unable to translate execution error state. Using default");
            diagnostics.info(MigrationStage.STATES,
                    "Unknown execution error option '" + option + "', using " + DEFAULT_EXEC_ERR_STATE);
            return DEFAULT_EXEC_ERR_STATE;
        }
        return switch (known.get()) {
            case ALERTING -> ExecutionErrorState.ALERTING;
            case KEEP_STATE -> ExecutionErrorState.ERROR;
            case OK -> ExecutionErrorState.OK;
        };
    }
}
