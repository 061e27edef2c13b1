package com.doseobjectives.converter.pipeline;

import com.doseobjectives.converter.model.ParsedRow;
import com.doseobjectives.converter.model.StructureIdentity;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives the structure identity and the output aliases of a parsed row.
 * <p>
 * "Structure IDs" is pipe separated (canonical id first, synonyms after), "Structure Codes"
 * is pipe separated with the first positive integer taken as the code, and "IDAliases" is
 * semicolon separated.
 */
public class IdentityResolver {

    private static final Pattern STRUCTURE_SEPARATOR = Pattern.compile("\\|");
    private static final Pattern ALIAS_SEPARATOR = Pattern.compile(";");
    private static final Pattern INTEGRAL = Pattern.compile("^\\d+(?:\\.0+)?$");

    private final AliasMode aliasMode;

    public IdentityResolver() {
        this(AliasMode.ID_ALIASES);
    }

    public IdentityResolver(AliasMode aliasMode) {
        this.aliasMode = aliasMode;
    }

    /**
     * @pre row.getStructureIds() contains at least one non-blank pipe segment
     */
    public StructureIdentity resolveIdentity(ParsedRow row) {
        List<String> ids = structureIds(row.getStructureIds());
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("Row " + row.getRowNumber() + " has no structure id");
        }
        Set<String> synonyms = new LinkedHashSet<>(ids.subList(1, ids.size()));
        return new StructureIdentity(ids.get(0), synonyms, parseCode(row.getStructureCodes()));
    }

    /**
     * @return the measure item identifiers for this row: non-empty, trimmed, duplicates
     *         collapsed to their first occurrence
     */
    public List<String> resolveAliases(ParsedRow row, StructureIdentity identity) {
        List<String> aliasTokens = tokens(row.getIdAliases(), ALIAS_SEPARATOR);
        List<String> structureTokens = structureIds(row.getStructureIds());

        Set<String> aliases = new LinkedHashSet<>();
        switch (aliasMode) {
            case FIRST_ID_ALIAS:
                if (!aliasTokens.isEmpty()) {
                    aliases.add(aliasTokens.get(0));
                }
                break;
            case STRUCTURE_IDS:
                aliases.addAll(structureTokens);
                break;
            case ALL:
                aliases.addAll(structureTokens);
                aliases.addAll(aliasTokens);
                break;
            case ID_ALIASES:
            default:
                aliases.addAll(aliasTokens);
                break;
        }
        if (aliases.isEmpty()) {
            aliases.add(identity.getCanonicalId());
        }
        return List.copyOf(aliases);
    }

    static Long parseCode(String structureCodes) {
        for (String token : tokens(structureCodes, STRUCTURE_SEPARATOR)) {
            if (INTEGRAL.matcher(token).matches()) {
                long code = new BigDecimal(token).longValue();
                if (code > 0) {
                    return code;
                }
            }
        }
        return null;
    }

    /**
     * @return the non-empty pipe segments of a "Structure IDs" cell, stripped of Unicode
     *         whitespace; empty when the cell names no structure
     */
    static List<String> structureIds(String raw) {
        return tokens(raw, STRUCTURE_SEPARATOR);
    }

    private static List<String> tokens(String raw, Pattern separator) {
        List<String> result = new ArrayList<>();
        if (raw == null || raw.isEmpty()) {
            return result;
        }
        for (String part : separator.split(raw)) {
            String stripped = part.strip();
            if (!stripped.isEmpty()) {
                result.add(stripped);
            }
        }
        return result;
    }
}
