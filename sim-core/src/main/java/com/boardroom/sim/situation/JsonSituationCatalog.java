package com.boardroom.sim.situation;

import com.boardroom.sim.exception.ContentValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SituationCatalog} read from JSON with Jackson.
 *
 * <p>Document layout:
 * <pre>
 * {
 *   "situations":   [ SituationDefinition, ... ],
 *   "cardTriggers": [ CardSituations, ... ]
 * }
 * </pre>
 *
 * <p>Validated on load: duplicate situation or card ids, triggers that name
 * an unknown situation, and missing {@link SituationIds#REQUIRED} entries all
 * raise {@link ContentValidationException}.
 */
public final class JsonSituationCatalog implements SituationCatalog {

    private static final Logger log = LoggerFactory.getLogger(JsonSituationCatalog.class);

    public static final String DEFAULT_RESOURCE = "/catalog/situations.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Map<String, SituationDefinition> situations;
    private final Map<String, CardSituations> cardTriggers;

    record CatalogDocument(
        @JsonProperty("situations")   List<SituationDefinition> situations,
        @JsonProperty("cardTriggers") List<CardSituations> cardTriggers
    ) {}

    private JsonSituationCatalog(Map<String, SituationDefinition> situations,
                                 Map<String, CardSituations> cardTriggers) {
        this.situations = Collections.unmodifiableMap(situations);
        this.cardTriggers = Collections.unmodifiableMap(cardTriggers);
    }

    /** The built-in catalog bundled on the classpath. */
    public static JsonSituationCatalog loadDefault() {
        try (InputStream in = JsonSituationCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new ContentValidationException("SituationCatalog", "Missing resource " + DEFAULT_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new ContentValidationException("SituationCatalog", "Unreadable resource " + DEFAULT_RESOURCE, e);
        }
    }

    public static JsonSituationCatalog load(InputStream in) {
        CatalogDocument doc;
        try {
            doc = MAPPER.readValue(in, CatalogDocument.class);
        } catch (IOException e) {
            throw new ContentValidationException("SituationCatalog", "Malformed situation catalog", e);
        }
        JsonSituationCatalog catalog = fromDocument(doc);
        log.info("[SituationCatalog] Loaded. situations={} cardTriggers={}",
            catalog.situations.size(), catalog.cardTriggers.size());
        return catalog;
    }

    static JsonSituationCatalog fromDocument(CatalogDocument doc) {
        Map<String, SituationDefinition> byId = new LinkedHashMap<>();
        for (SituationDefinition s : doc.situations() == null ? List.<SituationDefinition>of() : doc.situations()) {
            if (byId.putIfAbsent(s.situationId(), s) != null) {
                throw new ContentValidationException("SituationCatalog", "Duplicate situation " + s.situationId());
            }
        }

        for (String required : SituationIds.REQUIRED) {
            if (!byId.containsKey(required)) {
                throw new ContentValidationException("SituationCatalog", "Missing required situation " + required);
            }
        }

        Map<String, CardSituations> triggers = new LinkedHashMap<>();
        for (CardSituations c : doc.cardTriggers() == null ? List.<CardSituations>of() : doc.cardTriggers()) {
            for (SituationTrigger t : c.triggers()) {
                if (!byId.containsKey(t.situationId())) {
                    throw new ContentValidationException("SituationCatalog",
                        "Card " + c.cardId() + " triggers unknown situation " + t.situationId());
                }
            }
            if (triggers.putIfAbsent(c.cardId(), c) != null) {
                throw new ContentValidationException("SituationCatalog", "Duplicate trigger table for " + c.cardId());
            }
        }

        return new JsonSituationCatalog(byId, triggers);
    }

    @Override
    public Optional<SituationDefinition> find(String situationId) {
        return Optional.ofNullable(situations.get(situationId));
    }

    @Override
    public Optional<CardSituations> triggersFor(String cardId) {
        return Optional.ofNullable(cardTriggers.get(cardId));
    }

    @Override
    public Collection<SituationDefinition> situations() {
        return situations.values();
    }
}
