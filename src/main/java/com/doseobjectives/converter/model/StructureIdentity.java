package com.doseobjectives.converter.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Identity of the anatomical structure a clinical goal applies to.
 *
 * @invariant canonicalId is non-empty.
 * @invariant synonyms never contain canonicalId; iteration order is first-seen order.
 */
public final class StructureIdentity {

    private final String canonicalId;
    private final Set<String> synonyms;
    private final Long code;

    /**
     * @param canonicalId the structure id the goal is attached to
     * @param synonyms alternative structure ids, may contain the canonical id (dropped)
     * @param code the numeric structure code, or null when the sheet has none
     * @throws IllegalArgumentException if canonicalId is null or blank
     */
    public StructureIdentity(String canonicalId, Set<String> synonyms, Long code) {
        if (canonicalId == null || canonicalId.isBlank()) {
            throw new IllegalArgumentException("Canonical structure id must not be empty");
        }
        this.canonicalId = canonicalId;
        Set<String> distinct = new LinkedHashSet<>(synonyms);
        distinct.remove(canonicalId);
        this.synonyms = Collections.unmodifiableSet(distinct);
        this.code = code;
    }

    public String getCanonicalId() {
        return canonicalId;
    }

    public Set<String> getSynonyms() {
        return synonyms;
    }

    public Optional<Long> getCode() {
        return Optional.ofNullable(code);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StructureIdentity)) {
            return false;
        }
        StructureIdentity other = (StructureIdentity) o;
        return canonicalId.equals(other.canonicalId)
                && synonyms.equals(other.synonyms)
                && Objects.equals(code, other.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(canonicalId, synonyms, code);
    }

    @Override
    public String toString() {
        return canonicalId + (synonyms.isEmpty() ? "" : " " + synonyms) + (code == null ? "" : " #" + code);
    }
}
