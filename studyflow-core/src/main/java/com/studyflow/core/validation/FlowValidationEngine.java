package com.studyflow.core.validation;

import com.studyflow.core.config.StudyFlowConfig.ValidationSettings;
import com.studyflow.core.model.EndpointProcedureMap;
import com.studyflow.core.model.FlowIssue;
import com.studyflow.core.model.IcfDocument;
import com.studyflow.core.model.ProcedureCatalogEntry;
import com.studyflow.core.model.RuleId;
import com.studyflow.core.model.SapDocument;
import com.studyflow.core.model.StudyFlow;
import com.studyflow.core.procedure.ProcedureCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the fixed battery of study flow rules.
 *
 * <p>Rules are evaluated in {@link RuleId} declaration order and never short-circuit each
 * other, so validating an unchanged flow twice yields the same issues in the same order.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * FlowValidationEngine engine = new FlowValidationEngine(ProcedureCatalog.loadDefault());
 * FlowValidationResult result = engine.validate(flow, endpointMaps, icf, sap);
 * if (!result.valid()) {
 *     result.issuesBySeverity(IssueSeverity.CRITICAL).forEach(System.out::println);
 * }
 * }</pre>
 */
public class FlowValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(FlowValidationEngine.class);

    private final Map<RuleId, FlowRule> rules;
    private final Set<String> invasiveProcedureIds;
    private final ValidationSettings settings;

    public FlowValidationEngine(ProcedureCatalog catalog) {
        this(catalog, ValidationSettings.defaults());
    }

    public FlowValidationEngine(ProcedureCatalog catalog, ValidationSettings settings) {
        Objects.requireNonNull(catalog, "catalog must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.invasiveProcedureIds = catalog.entries().stream()
            .filter(ProcedureCatalogEntry::invasive)
            .map(ProcedureCatalogEntry::id)
            .collect(Collectors.toUnmodifiableSet());

        Map<RuleId, FlowRule> table = new EnumMap<>(RuleId.class);
        for (RuleId id : RuleId.values()) {
            table.put(id, ruleFor(id));
        }
        this.rules = Collections.unmodifiableMap(table);
    }

    /**
     * Returns the evaluator of a rule.
     *
     * @param id rule identifier
     * @return rule evaluator
     */
    public static FlowRule ruleFor(RuleId id) {
        return switch (id) {
            case PROCEDURE_NOT_IN_ICF -> ProtocolIcfRules::procedureNotInIcf;
            case RISKS_NOT_DESCRIBED -> ProtocolIcfRules::risksNotDescribed;
            case VISIT_MISSING_IN_ICF -> ProtocolIcfRules::visitMissingInIcf;
            case ENDPOINT_TIMING_DRIFT -> ProtocolSapRules::endpointTimingDrift;
            case MISSING_ASSESSMENT_FOR_ENDPOINT -> ProtocolSapRules::missingAssessmentForEndpoint;
            case INCORRECT_SCHEDULE_FOR_PRIMARY -> ProtocolSapRules::incorrectScheduleForPrimary;
            case FLOW_INTEGRITY_DRIFT -> GlobalRules::flowIntegrityDrift;
            case CYCLES_INCONSISTENT -> GlobalRules::cyclesInconsistent;
            case UNSUPPORTED_VISIT_TIMING -> GlobalRules::unsupportedVisitTiming;
            case MISSING_MANDATORY_VISITS -> GlobalRules::missingMandatoryVisits;
        };
    }

    /**
     * Validates a flow without companion documents.
     *
     * @param flow study flow
     * @param endpointMaps endpoint procedure maps
     * @return validation result
     */
    public FlowValidationResult validate(StudyFlow flow, List<EndpointProcedureMap> endpointMaps) {
        return validate(flow, endpointMaps, null, null);
    }

    /**
     * Validates a flow against its endpoint maps and optional ICF and SAP.
     *
     * @param flow study flow
     * @param endpointMaps endpoint procedure maps
     * @param icf informed-consent form, or null
     * @param sap statistical analysis plan, or null
     * @return validation result
     */
    public FlowValidationResult validate(StudyFlow flow, List<EndpointProcedureMap> endpointMaps,
                                         IcfDocument icf, SapDocument sap) {
        return validate(new ValidationContext(flow, endpointMaps, icf, sap, invasiveProcedureIds, settings));
    }

    public FlowValidationResult validate(ValidationContext context) {
        List<FlowIssue> issues = new ArrayList<>();
        for (Map.Entry<RuleId, FlowRule> entry : rules.entrySet()) {
            List<FlowIssue> found = entry.getValue().evaluate(context);
            log.debug("Rule {} found {} issue(s)", entry.getKey(), found.size());
            issues.addAll(found);
        }

        FlowValidationResult result = FlowValidationResult.of(issues);
        log.info("Validated flow {}: {} issue(s), {} critical, {} error",
            context.flow().id(), result.summary().total(), result.summary().critical(), result.summary().error());
        return result;
    }
}
