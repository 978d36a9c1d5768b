package com.studyflow.cli;

import com.studyflow.core.config.StudyFlowConfig;
import com.studyflow.core.flow.GeneratedStudy;
import com.studyflow.core.flow.StudyFlowContextFormatter;
import com.studyflow.core.flow.StudyFlowGenerator;
import com.studyflow.core.flow.StudyFlowJson;
import com.studyflow.core.flow.StudyFlowRequest;
import com.studyflow.core.model.Endpoint;
import com.studyflow.core.model.EndpointType;
import com.studyflow.core.model.StudyFlow;
import com.studyflow.core.procedure.InferenceRules;
import com.studyflow.core.procedure.ProcedureCatalog;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to generate a study flow.
 *
 * <p>Endpoints are given as {@code [primary:|secondary:|exploratory:]Name}. Without a
 * prefix the first endpoint is primary and the rest are secondary. When no visit labels
 * are given the schedule is derived from the duration.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * studyflow generate -e "primary:HbA1c change from baseline" -e "Body weight" -w 24
 * studyflow generate -l Screening -l Baseline -l "Week 4" -l "Week 8" -l EOT -o flow.json
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate a study flow from endpoints, visit labels and duration",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Option(names = {"-e", "--endpoint"}, description = "Endpoint, optionally prefixed with its type")
    private List<String> endpoints = new ArrayList<>();

    @Option(names = {"-l", "--label"}, description = "Visit label (repeatable)")
    private List<String> labels = new ArrayList<>();

    @Option(names = {"-w", "--weeks"}, description = "Treatment duration in weeks (default: 24)")
    private Integer durationWeeks;

    @Option(names = "--cycle-length", description = "Treatment cycle length in days")
    private Integer cycleLength;

    @Option(names = "--study-id", description = "Study identifier", defaultValue = "study")
    private String studyId;

    @Option(names = {"-o", "--output"}, description = "Output study JSON", defaultValue = "studyflow.json")
    private Path output;

    @Option(names = {"-c", "--config"}, description = "Configuration file")
    private Path configFile;

    @Option(names = "--context", description = "Also print the study flow as document context")
    private boolean printContext;

    @Override
    public Integer call() {
        try {
            StudyFlowConfig config = CommandSupport.loadConfig(configFile);
            StudyFlowGenerator generator = new StudyFlowGenerator(
                ProcedureCatalog.loadDefault(), InferenceRules.loadDefault(), config);

            StudyFlowRequest request = new StudyFlowRequest(
                studyId, parseEndpoints(endpoints), labels, durationWeeks, cycleLength);
            GeneratedStudy study = generator.generate(request);
            StudyFlowJson.writeStudy(study, output);

            StudyFlow flow = study.flow();
            System.out.println("✓ Study flow generated: " + flow.id());
            System.out.printf("  Visits: %d%n", flow.visits().size());
            System.out.printf("  Procedures: %d%n", flow.procedures().size());
            System.out.printf("  Cycles: %d%n", flow.cycles().size());
            System.out.printf("  Total duration: %d days%n", flow.totalDuration());
            System.out.println("  Output: " + output.toAbsolutePath());

            if (printContext) {
                System.out.println(StudyFlowContextFormatter.format(flow));
            }
            return 0;
        } catch (Exception e) {
            log.error("Generation failed", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Parses endpoint arguments into endpoints with ids {@code ep_0}, {@code ep_1}, ...
     *
     * @param values raw arguments
     * @return endpoints in argument order
     * @throws IllegalArgumentException if a name is blank
     */
    static List<Endpoint> parseEndpoints(List<String> values) {
        List<Endpoint> parsed = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i).trim();
            EndpointType type = i == 0 ? EndpointType.PRIMARY : EndpointType.SECONDARY;
            int colon = value.indexOf(':');
            if (colon > 0) {
                EndpointType prefixed = typeFor(value.substring(0, colon));
                if (prefixed != null) {
                    type = prefixed;
                    value = value.substring(colon + 1).trim();
                }
            }
            if (value.isEmpty()) {
                throw new IllegalArgumentException("Endpoint name must not be blank: " + values.get(i));
            }
            parsed.add(new Endpoint("ep_" + i, value, type, null));
        }
        return parsed;
    }

    private static EndpointType typeFor(String prefix) {
        return switch (prefix.trim().toLowerCase(Locale.ROOT)) {
            case "primary" -> EndpointType.PRIMARY;
            case "secondary" -> EndpointType.SECONDARY;
            case "exploratory" -> EndpointType.EXPLORATORY;
            default -> null;
        };
    }
}
