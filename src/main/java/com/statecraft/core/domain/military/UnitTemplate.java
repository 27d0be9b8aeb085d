package com.statecraft.core.domain.military;

import com.statecraft.core.domain.ledger.ResourceMap;
import com.statecraft.core.domain.world.Nation;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recruitable unit type. Costs are per unit.
 *
 * <p>{@code classification} is a list of tokens separated by spaces or commas. An empty classification
 * is open to everyone; otherwise at least one token has to match the nation (see {@link #isAllowedFor}).
 */
public record UnitTemplate(
        String templateId,
        String displayName,
        String category,
        long manpowerCost,
        double cashCost,
        ResourceMap resources,
        String techRequired,
        String classification,
        String referenceNation
) {

    public static final String TOKEN_WGRD = "WGRD";
    public static final String TOKEN_CMO = "CMO";

    public boolean requiresTech() {
        return techRequired != null && !techRequired.isBlank();
    }

    public Set<String> classificationTokens() {
        if (classification == null || classification.isBlank()) return Set.of();
        return Arrays.stream(classification.replace(',', ' ').trim().split("\\s+"))
                .filter(t -> !t.isBlank())
                .map(t -> t.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * WGRD units need a WGRD member; CMO units need {@code referenceNation} to equal the nation's affiliation;
     * any other token matches the reference nation, or the nation's name/id.
     */
    public boolean isAllowedFor(Nation nation) {
        Set<String> tokens = classificationTokens();
        if (tokens.isEmpty()) return true;
        if (nation == null) return false;

        if (tokens.contains(TOKEN_WGRD) && nation.wgrdMember()) return true;

        String ref = referenceNation == null ? "" : referenceNation.trim();
        if (tokens.contains(TOKEN_CMO)) {
            String aff = nation.affiliation() == null ? "" : nation.affiliation().trim();
            if (!ref.isEmpty() && ref.equalsIgnoreCase(aff)) return true;
        }

        if (!ref.isEmpty() && tokens.contains(ref.toUpperCase(Locale.ROOT))) return true;

        String natRef = nation.name() != null && !nation.name().isBlank() ? nation.name() : nation.nationId();
        String needle = natRef == null ? "" : natRef.trim().toUpperCase(Locale.ROOT);
        return !needle.isEmpty() && tokens.stream().anyMatch(t -> t.contains(needle));
    }
}
