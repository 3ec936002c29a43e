package com.boardroom.sim.card;

import com.boardroom.sim.model.Meter;
import com.boardroom.sim.model.OrgState;
import com.boardroom.sim.outcome.OutcomeProfile;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A project card the CEO can play during the PlayCards phase.
 *
 * <p>{@code meterAffinity} (optional) ties the card's risk to one meter: a
 * healthy meter lowers the chance of a Bad outcome, a weak one raises it.
 * {@code riskLevel} is a display hint: 1 safe, 2 moderate, 3 volatile.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlayableCard(
    @JsonProperty("cardId")             String cardId,
    @JsonProperty("title")              String title,
    @JsonProperty("description")        String description,
    @JsonProperty("flavor")             String flavor,
    @JsonProperty("outcomes")           OutcomeProfile outcomes,
    @JsonProperty("corporateIntensity") int corporateIntensity,
    @JsonProperty("category")           CardCategory category,
    @JsonProperty("meterAffinity")      Meter meterAffinity,
    @JsonProperty("riskLevel")          int riskLevel
) {

    public PlayableCard {
        if (cardId == null || cardId.isBlank()) {
            throw new IllegalArgumentException("cardId must not be blank");
        }
        outcomes = outcomes == null ? OutcomeProfile.neutral() : outcomes;
        category = category == null ? CardCategory.ACTION : category;
        riskLevel = riskLevel == 0 ? 2 : riskLevel;
    }

    @JsonIgnore
    public boolean isCorporate() {
        return corporateIntensity > 0;
    }

    @JsonIgnore
    public boolean isRevenue() {
        return category == CardCategory.REVENUE;
    }

    public String riskLabel() {
        return switch (riskLevel) {
            case 1 -> "SAFE";
            case 3 -> "VOLATILE";
            default -> "MODERATE";
        };
    }

    /**
     * Risk reduction from the affinity meter: +15 at 70+, +8 at 60+, -15
     * below 25, -8 below 40, otherwise 0. Cards without affinity return 0.
     */
    public int affinityModifier(OrgState org) {
        if (meterAffinity == null) return 0;
        int value = org.getMeter(meterAffinity);
        if (value >= 70) return 15;
        if (value >= 60) return 8;
        if (value < 25) return -15;
        if (value < 40) return -8;
        return 0;
    }
}
