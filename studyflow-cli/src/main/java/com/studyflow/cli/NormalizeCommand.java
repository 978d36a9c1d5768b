package com.studyflow.cli;

import com.studyflow.core.model.VisitNormalizationResult;
import com.studyflow.core.visit.VisitNormalizer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to normalize free-text visit labels.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * studyflow normalize Screening "Week 4" "Визит 3" EOT
 * }</pre>
 */
@Command(
    name = "normalize",
    description = "Normalize free-text visit labels",
    mixinStandardHelpOptions = true
)
public class NormalizeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(NormalizeCommand.class);

    @Parameters(arity = "1..*", description = "Visit labels")
    private List<String> labels;

    @Override
    public Integer call() {
        log.debug("Normalizing {} label(s)", labels.size());
        VisitNormalizer normalizer = new VisitNormalizer();
        for (VisitNormalizationResult result : normalizer.normalizeAll(labels)) {
            System.out.printf("  %-24s -> %-18s day %5d  %-16s confidence %.2f%n",
                result.originalName(), result.normalizedName(), result.day(),
                result.type().wireName(), result.confidence());
        }
        return 0;
    }
}
