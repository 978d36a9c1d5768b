package com.studyflow.cli;

import com.studyflow.core.export.ExportConfig;
import com.studyflow.core.export.ExportedDocument;
import com.studyflow.core.export.TopExporter;
import com.studyflow.core.export.TopExporters;
import com.studyflow.core.flow.GeneratedStudy;
import com.studyflow.core.flow.StudyFlowJson;
import com.studyflow.core.renderer.OutputBundle;
import com.studyflow.core.renderer.OutputDocument;
import com.studyflow.core.renderer.OutputRenderer;
import com.studyflow.core.renderer.RenderContext;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to export the Table of Procedures of a study flow.
 *
 * <p>Exporters and renderers are discovered via SPI. {@code --format all} runs every
 * exporter. Exporter settings ({@code -s markdown.heading=false}) are passed through;
 * "true" and "false" become booleans.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * studyflow export studyflow.json -f csv -f html -o out
 * studyflow export studyflow.json -f markdown -r console
 * }</pre>
 */
@Command(
    name = "export",
    description = "Export the Table of Procedures",
    mixinStandardHelpOptions = true
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Parameters(index = "0", description = "Study JSON to export", defaultValue = "studyflow.json")
    private Path studyFile;

    @Option(names = {"-f", "--format"}, description = "Exporter id, or 'all' (default: csv)")
    private List<String> formats = new ArrayList<>();

    @Option(names = {"-r", "--renderer"}, description = "Renderer id: filesystem or console", defaultValue = "filesystem")
    private String rendererId;

    @Option(names = {"-o", "--output"}, description = "Output directory", defaultValue = "./studyflow-output")
    private Path outputDir;

    @Option(names = "--title", description = "Document title (default: flow id)")
    private String title;

    @Option(names = {"-s", "--setting"}, description = "Exporter or renderer setting key=value")
    private Map<String, String> settings = new LinkedHashMap<>();

    @Override
    public Integer call() {
        try {
            GeneratedStudy study = StudyFlowJson.readStudy(studyFile);
            TopExporters exporters = TopExporters.discover();
            List<TopExporter> selected = selectExporters(exporters);

            ExportConfig config = new ExportConfig(title != null ? title : study.flow().id(), exporterSettings());
            List<OutputDocument> documents = new ArrayList<>();
            for (TopExporter exporter : selected) {
                log.debug("Exporting with {}", exporter.getId());
                ExportedDocument document = exporter.export(study.flow().topMatrix(), config);
                documents.add(document.toOutputDocument());
            }

            renderOutput(new OutputBundle(documents));
            if (!"console".equals(rendererId)) {
                System.out.println("✓ Exported " + documents.size() + " document(s) to " + outputDir.toAbsolutePath());
            }
            return 0;
        } catch (Exception e) {
            log.error("Export failed", e);
            System.err.println("✗ Export failed: " + e.getMessage());
            return 1;
        }
    }

    private List<TopExporter> selectExporters(TopExporters exporters) {
        if (formats.isEmpty()) {
            return List.of(exporters.require("csv"));
        }
        if (formats.stream().anyMatch("all"::equalsIgnoreCase)) {
            return exporters.all();
        }
        List<TopExporter> selected = new ArrayList<>();
        for (String format : formats) {
            selected.add(exporters.require(format));
        }
        return selected;
    }

    private Map<String, Object> exporterSettings() {
        Map<String, Object> converted = new LinkedHashMap<>();
        settings.forEach((key, value) -> {
            if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
                converted.put(key, Boolean.valueOf(value));
            } else {
                converted.put(key, value);
            }
        });
        return converted;
    }

    private void renderOutput(OutputBundle bundle) {
        ServiceLoader<OutputRenderer> renderers = ServiceLoader.load(OutputRenderer.class);
        for (OutputRenderer renderer : renderers) {
            if (rendererId.equals(renderer.getId())) {
                renderer.render(bundle, new RenderContext(outputDir.toString(), settings));
                return;
            }
        }
        throw new IllegalArgumentException("Unknown renderer: " + rendererId);
    }
}
