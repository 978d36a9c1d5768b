package com.studyflow.cli;

import com.studyflow.core.config.StudyFlowConfig;
import com.studyflow.core.model.ProcedureCatalogEntry;
import com.studyflow.core.model.ProcedureMappingResult;
import com.studyflow.core.model.ProcedureMatch;
import com.studyflow.core.procedure.MappingStats;
import com.studyflow.core.procedure.MappingValidation;
import com.studyflow.core.procedure.ProcedureCatalog;
import com.studyflow.core.procedure.ProcedureMapper;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to map procedure text to the procedure catalog.
 *
 * <p>Each argument is mapped as one procedure name. With {@code --extract} the arguments
 * are joined into prose and every procedure mentioned in it is reported.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * studyflow map "blood pressure" "12-lead ECG"
 * studyflow map --extract "Patients undergo MRI and a complete blood count at each visit"
 * }</pre>
 */
@Command(
    name = "map",
    description = "Map procedure text to the procedure catalog",
    mixinStandardHelpOptions = true
)
public class MapCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MapCommand.class);

    @Parameters(arity = "1..*", description = "Procedure names, or prose with --extract")
    private List<String> texts;

    @Option(names = "--extract", description = "Extract every procedure mentioned in the text")
    private boolean extract;

    @Option(names = {"-c", "--config"}, description = "Configuration file")
    private Path configFile;

    @Override
    public Integer call() {
        try {
            StudyFlowConfig config = CommandSupport.loadConfig(configFile);
            ProcedureMapper mapper = new ProcedureMapper(ProcedureCatalog.loadDefault(), config.mapping());

            List<ProcedureMappingResult> results = extract
                ? mapper.extractFromText(String.join(" ", texts))
                : mapper.mapAll(texts);
            for (ProcedureMappingResult result : results) {
                printResult(mapper, result);
            }

            MappingStats stats = ProcedureMapper.stats(results);
            System.out.println();
            System.out.printf("Matched %d of %d (high: %d, medium: %d, low: %d)%n",
                stats.matched(), stats.total(), stats.highConfidence(), stats.mediumConfidence(),
                stats.lowConfidence());
            return 0;
        } catch (Exception e) {
            log.error("Procedure mapping failed", e);
            System.err.println("✗ Procedure mapping failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printResult(ProcedureMapper mapper, ProcedureMappingResult result) {
        if (!result.matched()) {
            System.out.printf("  ✗ %s: no match%n", result.originalText());
            return;
        }
        ProcedureCatalogEntry entry = result.matchedProcedure();
        System.out.printf("  ✓ %s -> %s (ID: %s, %s) confidence %.2f%s%n",
            result.originalText(), entry.name(), entry.id(), entry.category().wireName(),
            result.confidence(), result.lowConfidence() ? " [low]" : "");
        for (ProcedureMatch alternative : result.alternatives()) {
            System.out.printf("      or %s (%.2f)%n", alternative.entry().name(), alternative.confidence());
        }
        MappingValidation validation = mapper.validate(result);
        for (String warning : validation.warnings()) {
            System.out.println("      ! " + warning);
        }
    }
}
