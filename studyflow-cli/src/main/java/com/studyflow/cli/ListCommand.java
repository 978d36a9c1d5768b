package com.studyflow.cli;

import com.studyflow.core.export.TopExporter;
import com.studyflow.core.export.TopExporters;
import com.studyflow.core.model.ProcedureCategory;
import com.studyflow.core.model.RuleId;
import com.studyflow.core.procedure.CatalogStats;
import com.studyflow.core.procedure.ProcedureCatalog;
import com.studyflow.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available exporters, renderers, procedure catalog categories or
 * validation rules.
 *
 * <p>Exporters and renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * studyflow list exporters
 * studyflow list renderers
 * studyflow list categories
 * studyflow list rules
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available exporters, renderers, catalog categories or rules",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: exporters, renderers, categories or rules"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "exporters", "exporter", "formats" -> listExporters();
            case "renderers", "renderer" -> listRenderers();
            case "categories", "category", "catalog" -> listCategories();
            case "rules", "rule" -> listRules();
            default -> {
                log.error("Unknown type: {}. Use: exporters, renderers, categories or rules", type);
                yield 1;
            }
        };
    }

    private int listExporters() {
        System.out.println("Available Exporters:");
        System.out.println();

        TopExporters exporters = TopExporters.discover();
        for (TopExporter exporter : exporters.all()) {
            System.out.printf("  • %s (ID: %s)%n", exporter.getDisplayName(), exporter.getId());
            System.out.printf("    Extension: .%s%n", exporter.getFileExtension());
        }
        if (exporters.all().isEmpty()) {
            System.out.println("  No exporters found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }
        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }

    private int listCategories() {
        ProcedureCatalog catalog = ProcedureCatalog.loadDefault();
        CatalogStats stats = catalog.stats();
        System.out.printf("Procedure Catalog %s: %d procedures (%d invasive, %d with standard codes)%n",
            catalog.version(), stats.total(), stats.invasive(), stats.withStandardCodes());
        System.out.println();

        for (ProcedureCategory category : ProcedureCategory.values()) {
            int count = stats.byCategory().getOrDefault(category, 0);
            System.out.printf("  • %s (ID: %s) - %d procedure(s)%n",
                category.displayName(), category.wireName(), count);
        }
        return 0;
    }

    private int listRules() {
        System.out.println("Validation Rules:");
        System.out.println();

        for (RuleId rule : RuleId.values()) {
            System.out.printf("  • %s [%s]%n", rule.name(), rule.family().name().toLowerCase(Locale.ROOT));
            System.out.printf("    %s%n", rule.description());
        }
        return 0;
    }
}
