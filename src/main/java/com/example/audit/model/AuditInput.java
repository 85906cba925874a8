package com.example.audit.model;

import java.util.List;
import java.util.Objects;

/**
 * Shared input handed, unchanged, to every analysis strategy of a batch.
 *
 * @param contracts      Concatenated contract sources (required)
 * @param docs           Project documentation, empty when none was supplied
 * @param additionalLinks Reference links supplied with the task
 * @param additionalDocs Free-text additional documentation, may be {@code null}
 * @param qaResponses    Question/answer pairs supplied with the task
 */
public record AuditInput(
        String contracts,
        String docs,
        List<String> additionalLinks,
        String additionalDocs,
        List<QaPair> qaResponses
) {
    public AuditInput {
        contracts = contracts != null ? contracts : "";
        docs = docs != null ? docs : "";
        additionalLinks = additionalLinks != null
                ? additionalLinks.stream().filter(Objects::nonNull).toList()
                : List.of();
        qaResponses = qaResponses != null
                ? qaResponses.stream().filter(Objects::nonNull).toList()
                : List.of();
    }

    public static AuditInput ofContracts(String contracts) {
        return new AuditInput(contracts, "", List.of(), null, List.of());
    }
}
