package com.studyflow.core.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Registry of the exporters found on the class path.
 */
public final class TopExporters {

    private static final Logger log = LoggerFactory.getLogger(TopExporters.class);

    private final List<TopExporter> exporters;

    public TopExporters(List<TopExporter> exporters) {
        this.exporters = List.copyOf(exporters);
    }

    /**
     * Discovers exporters through {@link ServiceLoader}.
     *
     * @return registry of discovered exporters
     */
    public static TopExporters discover() {
        log.debug("Discovering ToP exporters via ServiceLoader");
        List<TopExporter> found = new ArrayList<>();
        ServiceLoader.load(TopExporter.class).forEach(found::add);
        log.debug("Discovered {} exporter(s)", found.size());
        return new TopExporters(found);
    }

    public List<TopExporter> all() {
        return exporters;
    }

    public List<String> ids() {
        return exporters.stream().map(TopExporter::getId).toList();
    }

    public Optional<TopExporter> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String wanted = id.trim().toLowerCase(Locale.ROOT);
        return exporters.stream().filter(e -> e.getId().equals(wanted)).findFirst();
    }

    /**
     * Looks up an exporter by id.
     *
     * @param id format id, case-insensitive
     * @return exporter
     * @throws IllegalArgumentException if no exporter has this id
     */
    public TopExporter require(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException(
            "Unsupported export format: " + id + " (available: " + String.join(", ", ids()) + ")"));
    }
}
