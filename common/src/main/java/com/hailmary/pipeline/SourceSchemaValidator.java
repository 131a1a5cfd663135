package com.hailmary.pipeline;

import com.hailmary.config.SourceConfig;
import com.hailmary.exception.SyncConfigurationException;
import com.hailmary.source.RelationalStore;

import java.util.List;
import java.util.Optional;

/**
 * Checks that a source's relation, primary key and tracking column exist with the exact
 * casing configured.  A casing mismatch is reported with the near match, so an operator
 * sees {@code found 'updatedat'} instead of a pipeline that never advances.
 */
public final class SourceSchemaValidator {

    private SourceSchemaValidator() {
        // utility class
    }

    /**
     * @throws SyncConfigurationException if the relation or a required column is missing
     */
    public static void validate(SourceConfig source, RelationalStore store) {
        List<String> columns = store.listColumns(source.getRelation());
        if (columns.isEmpty()) {
            throw new SyncConfigurationException(source.getName(),
                    "Relation '" + source.getRelation() + "' does not exist or has no columns"
                            + " (identifiers are matched case-sensitively)");
        }
        requireColumn(source, columns, source.getTrackingColumn(), "Tracking column");
        for (String keyColumn : source.getPrimaryKey()) {
            requireColumn(source, columns, keyColumn, "Primary key column");
        }
    }

    private static void requireColumn(SourceConfig source, List<String> columns, String column, String role) {
        if (columns.contains(column)) {
            return;
        }
        Optional<String> nearMatch = columns.stream()
                .filter(c -> c.equalsIgnoreCase(column))
                .findFirst();
        String message = role + " '" + column + "' not found in '" + source.getRelation() + "'";
        if (nearMatch.isPresent()) {
            message += "; found '" + nearMatch.get() + "' (identifiers are matched case-sensitively)";
        }
        throw new SyncConfigurationException(source.getName(), message);
    }
}
