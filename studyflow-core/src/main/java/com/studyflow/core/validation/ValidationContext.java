package com.studyflow.core.validation;

import com.studyflow.core.config.StudyFlowConfig.ValidationSettings;
import com.studyflow.core.model.EndpointProcedureMap;
import com.studyflow.core.model.IcfDocument;
import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.SapDocument;
import com.studyflow.core.model.StudyFlow;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Input of a validation pass.
 *
 * <p>The ICF and SAP are optional; rules comparing the protocol against an absent
 * document report nothing.
 *
 * @param flow study flow under validation
 * @param endpointMaps endpoint procedure maps of the study
 * @param icf informed-consent form content, or null
 * @param sap statistical analysis plan content, or null
 * @param invasiveProcedureIds ids of procedures the catalog marks as invasive
 * @param settings rule thresholds
 */
public record ValidationContext(
    StudyFlow flow,
    List<EndpointProcedureMap> endpointMaps,
    IcfDocument icf,
    SapDocument sap,
    Set<String> invasiveProcedureIds,
    ValidationSettings settings
) {
    public ValidationContext {
        Objects.requireNonNull(flow, "flow must not be null");
        endpointMaps = endpointMaps == null ? List.of() : List.copyOf(endpointMaps);
        invasiveProcedureIds = invasiveProcedureIds == null ? Set.of() : Set.copyOf(invasiveProcedureIds);
        settings = settings == null ? ValidationSettings.defaults() : settings;
    }

    public Optional<IcfDocument> icfDocument() {
        return Optional.ofNullable(icf);
    }

    public Optional<SapDocument> sapDocument() {
        return Optional.ofNullable(sap);
    }

    public boolean isInvasive(Procedure procedure) {
        return invasiveProcedureIds.contains(procedure.id());
    }

    /**
     * Returns the visits that count towards the scheduled visit total.
     *
     * @return all visits except unscheduled ones
     */
    public List<Visit> scheduledVisits() {
        return flow.visits().stream()
            .filter(v -> v.type() != VisitType.UNSCHEDULED)
            .toList();
    }

    public List<EndpointProcedureMap> primaryEndpointMaps() {
        return endpointMaps.stream()
            .filter(EndpointProcedureMap::isPrimary)
            .toList();
    }
}
