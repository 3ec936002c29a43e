package com.boardroom.sim.situation;

import com.boardroom.sim.exception.ContentValidationException;

import java.util.Collection;
import java.util.Optional;

/**
 * Content collaborator: situation definitions and per-card trigger tables.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Immutable</b>  — content does not change after construction</li>
 *   <li><b>Complete</b>   — define every id in {@link SituationIds#REQUIRED}</li>
 * </ul>
 *
 * <p>Current implementation: {@link JsonSituationCatalog}.
 */
public interface SituationCatalog {

    Optional<SituationDefinition> find(String situationId);

    /** Card-specific triggers; empty when the card falls back to generic triggers. */
    Optional<CardSituations> triggersFor(String cardId);

    Collection<SituationDefinition> situations();

    /**
     * @throws ContentValidationException when the id is unknown
     */
    default SituationDefinition get(String situationId) {
        return find(situationId).orElseThrow(() ->
            new ContentValidationException("SituationCatalog", "Unknown situation " + situationId));
    }
}
