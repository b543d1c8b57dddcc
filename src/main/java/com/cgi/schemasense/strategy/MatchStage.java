package com.cgi.schemasense.strategy;

import com.cgi.schemasense.model.FieldMatch;
import com.cgi.schemasense.model.enums.MatchStageType;

import java.util.Optional;

/**
 * One step of the field classification pipeline.
 * Implements the Strategy pattern.
 */
public interface MatchStage {
    /**
     * Unique name of the stage.
     *
     * @return Stage name
     */
    String getName();

    /**
     * Pipeline position of this stage.
     *
     * @return Stage type
     */
    MatchStageType getStageType();

    /**
     * Tries to decide the column. An empty result passes the column to the next stage.
     *
     * @param context Column, table context and pattern library
     * @return Match if this stage decides the column
     */
    Optional<FieldMatch> attemptMatch(FieldContext context);
}
