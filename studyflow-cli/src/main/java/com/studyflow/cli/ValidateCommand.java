package com.studyflow.cli;

import com.studyflow.core.config.StudyFlowConfig;
import com.studyflow.core.flow.GeneratedStudy;
import com.studyflow.core.flow.StudyFlowJson;
import com.studyflow.core.model.IcfDocument;
import com.studyflow.core.model.SapDocument;
import com.studyflow.core.procedure.ProcedureCatalog;
import com.studyflow.core.validation.FlowValidationEngine;
import com.studyflow.core.validation.FlowValidationResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a study flow against its endpoints and, when given, the ICF
 * and SAP.
 *
 * <p>Exit codes: 0 when no blocking issue was found, 2 when a critical or error issue
 * was found, 1 when validation could not run.
 */
@Command(
    name = "validate",
    description = "Validate a study flow, optionally against ICF and SAP facts",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    static final int EXIT_BLOCKING_ISSUES = 2;

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Study JSON to validate", defaultValue = "studyflow.json")
    private Path studyFile;

    @Option(names = "--icf", description = "ICF facts (YAML)")
    private Path icfFile;

    @Option(names = "--sap", description = "SAP facts (YAML)")
    private Path sapFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file")
    private Path configFile;

    @Option(names = "--json", description = "Print the validation result as JSON")
    private boolean json;

    @Override
    public Integer call() {
        try {
            log.info("Validating study flow: {}", studyFile);
            StudyFlowConfig config = CommandSupport.loadConfig(configFile);
            GeneratedStudy study = StudyFlowJson.readStudy(studyFile);
            IcfDocument icf = CommandSupport.readIcf(icfFile);
            SapDocument sap = CommandSupport.readSap(sapFile);

            FlowValidationEngine engine = new FlowValidationEngine(ProcedureCatalog.loadDefault(), config.validation());
            FlowValidationResult result = engine.validate(study.flow(), study.endpointMaps(), icf, sap);

            if (json) {
                System.out.println(StudyFlowJson.toJson(result));
            } else {
                System.out.println((result.valid() ? "✓ " : "✗ ") + "Validation of " + study.flow().id()
                    + (result.valid() ? " passed" : " found blocking issues"));
                CommandSupport.printSummary(result);
                CommandSupport.printIssues(result.issues());
            }
            return result.valid() ? 0 : EXIT_BLOCKING_ISSUES;
        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
