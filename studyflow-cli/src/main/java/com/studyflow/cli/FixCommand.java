package com.studyflow.cli;

import com.studyflow.core.autofix.AutoFixEngine;
import com.studyflow.core.autofix.AutoFixImpact;
import com.studyflow.core.autofix.AutoFixRequest;
import com.studyflow.core.autofix.AutoFixResult;
import com.studyflow.core.autofix.RejectedChange;
import com.studyflow.core.config.StudyFlowConfig;
import com.studyflow.core.flow.GeneratedStudy;
import com.studyflow.core.flow.StudyFlowJson;
import com.studyflow.core.model.FixStrategy;
import com.studyflow.core.model.FlowChange;
import com.studyflow.core.model.IcfDocument;
import com.studyflow.core.model.SapDocument;
import com.studyflow.core.procedure.ProcedureCatalog;
import com.studyflow.core.validation.FlowValidationEngine;
import com.studyflow.core.validation.FlowValidationResult;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to apply auto-fixes to the issues of a study flow.
 *
 * <p>The flow is validated first; the selected issues ({@code --issue}, or every
 * auto-fixable issue with {@code --all}) are repaired, and the updated flow is validated
 * again so the report shows what is left.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * studyflow fix studyflow.json --all
 * studyflow fix studyflow.json --issue MISSING_BASELINE --dry-run
 * studyflow fix studyflow.json --all --sap sap.yaml --sap-output sap-fixed.yaml
 * }</pre>
 */
@Command(
    name = "fix",
    description = "Apply auto-fixes to validation issues",
    mixinStandardHelpOptions = true
)
public class FixCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FixCommand.class);

    @Parameters(index = "0", description = "Study JSON to fix", defaultValue = "studyflow.json")
    private Path studyFile;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Selection selection;

    @Option(names = "--strategy", description = "conservative, balanced or aggressive", defaultValue = "conservative")
    private String strategy;

    @Option(names = "--icf", description = "ICF facts (YAML)")
    private Path icfFile;

    @Option(names = "--sap", description = "SAP facts (YAML)")
    private Path sapFile;

    @Option(names = "--sap-output", description = "Write the SAP facts with applied schedule changes")
    private Path sapOutput;

    @Option(names = {"-o", "--output"}, description = "Output study JSON (default: overwrite the input)")
    private Path output;

    @Option(names = {"-c", "--config"}, description = "Configuration file")
    private Path configFile;

    @Option(names = "--dry-run", description = "Show the proposed changes without writing anything")
    private boolean dryRun;

    static class Selection {
        @Option(names = {"-i", "--issue"}, description = "Issue id to fix (repeatable)")
        List<String> issueIds;

        @Option(names = "--all", description = "Fix every auto-fixable issue")
        boolean all;
    }

    @Override
    public Integer call() {
        try {
            StudyFlowConfig config = CommandSupport.loadConfig(configFile);
            ProcedureCatalog catalog = ProcedureCatalog.loadDefault();
            GeneratedStudy study = StudyFlowJson.readStudy(studyFile);
            IcfDocument icf = CommandSupport.readIcf(icfFile);
            SapDocument sap = CommandSupport.readSap(sapFile);

            FlowValidationEngine validator = new FlowValidationEngine(catalog, config.validation());
            FlowValidationResult before = validator.validate(study.flow(), study.endpointMaps(), icf, sap);

            List<String> selected = selection.all ? before.autoFixableIssueIds() : selection.issueIds;
            if (selected.isEmpty()) {
                System.out.println("✓ Nothing to fix");
                return 0;
            }

            AutoFixEngine engine = new AutoFixEngine(catalog, config.autofix());
            AutoFixRequest request = new AutoFixRequest(selected, FixStrategy.fromWireName(strategy));
            AutoFixResult result = engine.applyAutoFixes(study.flow(), before.issues(), study.endpointMaps(), request);

            printResult(result);
            if (dryRun) {
                AutoFixImpact impact = AutoFixEngine.estimateAutoFixImpact(result.appliedChanges());
                System.out.printf("Impact: %d visit(s) added, %d procedure(s) added, risk %s%n",
                    impact.visitsAdded(), impact.proceduresAdded(), impact.riskLevel().wireName());
                System.out.println("Dry run: nothing written");
                return 0;
            }

            Path target = output != null ? output : studyFile;
            StudyFlowJson.writeStudy(study.withFlow(result.updatedFlow()), target);
            System.out.println("✓ Updated study written to " + target.toAbsolutePath());

            SapDocument updatedSap = sap == null ? null : sap.withChanges(result.appliedChanges());
            if (updatedSap != null && sapOutput != null) {
                CommandSupport.writeSap(updatedSap, sapOutput);
                System.out.println("✓ Updated SAP facts written to " + sapOutput.toAbsolutePath());
            }

            FlowValidationResult after = validator.validate(result.updatedFlow(), study.endpointMaps(), icf, updatedSap);
            System.out.println();
            System.out.println("Re-validation:");
            CommandSupport.printSummary(after);
            return 0;
        } catch (Exception e) {
            log.error("Auto-fix failed", e);
            System.err.println("✗ Auto-fix failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printResult(AutoFixResult result) {
        AutoFixResult.Summary summary = result.summary();
        System.out.printf("Applied %d change(s), rejected %d; fixed %d issue(s), %d remaining%n",
            summary.changesApplied(), summary.changesRejected(), summary.issuesFixed(), summary.issuesRemaining());
        for (FlowChange change : result.appliedChanges()) {
            System.out.printf("  + %s %s: %s%n", change.type().wireName(), change.targetId(), change.reason());
        }
        for (RejectedChange rejected : result.rejectedChanges()) {
            System.out.printf("  - %s (%s): %s%n", rejected.change().type().wireName(), rejected.issueId(),
                rejected.reason());
        }
        for (String warning : result.warnings()) {
            System.out.println("  ! " + warning);
        }
    }
}
