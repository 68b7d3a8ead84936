package com.profitrate.reconciliation.config;

import java.util.List;
import java.util.Map;

/**
 * JSON binding of the sources document.
 *
 * <pre>
 * {
 *   "readTimeoutSeconds": 30,
 *   "workers": 4,
 *   "sources": [
 *     {"sourceId": "A", "variableId": "K", "path": "a.csv", "layout": "wide"}
 *   ],
 *   "priorities": {"K": ["A", "B"]}
 * }
 * </pre>
 */
public record SourcesConfig(
        Integer readTimeoutSeconds,
        Integer workers,
        List<SourceEntry> sources,
        Map<String, List<String>> priorities
) {

    /**
     * One source file contributing one variable. Layout options are optional.
     */
    public record SourceEntry(
            String sourceId,
            String variableId,
            String path,
            String layout,
            String rowLabel,
            Integer labelColumn,
            Integer firstYearColumn,
            String yearColumn,
            String variableColumn,
            String valueColumn
    ) {}
}
