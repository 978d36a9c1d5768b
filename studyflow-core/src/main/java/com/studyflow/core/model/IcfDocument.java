package com.studyflow.core.model;

import java.util.List;

/**
 * Informed-consent form content relevant to study flow validation.
 *
 * @param procedureMentions text passages describing procedures
 * @param riskDescriptions risk descriptions
 * @param visitMentions passages describing individual visits
 */
public record IcfDocument(
    List<String> procedureMentions,
    List<String> riskDescriptions,
    List<String> visitMentions
) {
    public IcfDocument {
        procedureMentions = procedureMentions == null ? List.of() : List.copyOf(procedureMentions);
        riskDescriptions = riskDescriptions == null ? List.of() : List.copyOf(riskDescriptions);
        visitMentions = visitMentions == null ? List.of() : List.copyOf(visitMentions);
    }

    public int visitCount() {
        return visitMentions.size();
    }
}
