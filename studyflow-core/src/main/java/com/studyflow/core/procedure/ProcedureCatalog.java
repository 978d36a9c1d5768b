package com.studyflow.core.procedure;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.studyflow.core.model.ProcedureCatalogEntry;
import com.studyflow.core.model.ProcedureCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Static reference set of clinical procedures.
 *
 * <p>The catalog is loaded once (usually from the bundled {@code procedure-catalog.yaml})
 * and never mutated afterwards. Components that need it receive it through their
 * constructor rather than reaching for a global.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProcedureCatalog catalog = ProcedureCatalog.loadDefault();
 * catalog.findById("proc_hba1c").ifPresent(entry -> log.info("{}", entry.name()));
 * List<ProcedureCatalogEntry> labs = catalog.byCategory(ProcedureCategory.LABS);
 * }</pre>
 */
public final class ProcedureCatalog {

    private static final Logger log = LoggerFactory.getLogger(ProcedureCatalog.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Classpath location of the bundled catalog.
     */
    public static final String DEFAULT_RESOURCE = "/procedure-catalog.yaml";

    private final String version;
    private final Map<String, ProcedureCatalogEntry> entries;

    public ProcedureCatalog(String version, List<ProcedureCatalogEntry> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        this.version = version == null ? "unversioned" : version;
        Map<String, ProcedureCatalogEntry> byId = new LinkedHashMap<>();
        for (ProcedureCatalogEntry entry : entries) {
            if (byId.putIfAbsent(entry.id(), entry) != null) {
                throw new IllegalArgumentException("Duplicate catalog id: " + entry.id());
            }
        }
        this.entries = Collections.unmodifiableMap(byId);
    }

    /**
     * Loads the catalog bundled with the engine.
     *
     * @return bundled catalog
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static ProcedureCatalog loadDefault() {
        try (InputStream in = ProcedureCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Procedure catalog resource not found: " + DEFAULT_RESOURCE);
            }
            return fromYaml(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read procedure catalog: " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Reads a catalog from YAML.
     *
     * @param in YAML stream with {@code version} and {@code entries}
     * @return parsed catalog
     * @throws IOException if the stream is not a valid catalog document
     */
    public static ProcedureCatalog fromYaml(InputStream in) throws IOException {
        CatalogDocument document = YAML_MAPPER.readValue(in, CatalogDocument.class);
        ProcedureCatalog catalog = new ProcedureCatalog(document.version(), document.entries());
        log.debug("Loaded procedure catalog {} with {} entries", catalog.version(), catalog.size());
        return catalog;
    }

    public String version() {
        return version;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns every entry in catalog order.
     */
    public List<ProcedureCatalogEntry> entries() {
        return List.copyOf(entries.values());
    }

    public Optional<ProcedureCatalogEntry> findById(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    /**
     * Returns the entry with the given id.
     *
     * @throws IllegalArgumentException if the id is unknown
     */
    public ProcedureCatalogEntry require(String id) {
        ProcedureCatalogEntry entry = entries.get(id);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown procedure: " + id);
        }
        return entry;
    }

    public List<ProcedureCatalogEntry> byCategory(ProcedureCategory category) {
        return entries.values().stream()
            .filter(entry -> entry.category() == category)
            .toList();
    }

    /**
     * Returns entries tagged with an endpoint type (e.g. {@code diabetes}).
     */
    public List<ProcedureCatalogEntry> forEndpointType(String endpointType) {
        return entries.values().stream()
            .filter(entry -> entry.endpointTypes().contains(endpointType))
            .toList();
    }

    /**
     * Case-insensitive substring search over names and synonyms.
     *
     * @param query search text
     * @return matching entries in catalog order
     */
    public List<ProcedureCatalogEntry> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return entries.values().stream()
            .filter(entry -> entry.searchableNames().stream()
                .anyMatch(name -> name.toLowerCase(Locale.ROOT).contains(needle)))
            .toList();
    }

    /**
     * Computes catalog statistics.
     */
    public CatalogStats stats() {
        Map<ProcedureCategory, Integer> byCategory = new EnumMap<>(ProcedureCategory.class);
        int withCodes = 0;
        int withEndpointLinks = 0;
        int invasive = 0;
        for (ProcedureCatalogEntry entry : entries.values()) {
            byCategory.merge(entry.category(), 1, Integer::sum);
            if (entry.code() != null) {
                withCodes++;
            }
            if (!entry.endpointTypes().isEmpty()) {
                withEndpointLinks++;
            }
            if (entry.invasive()) {
                invasive++;
            }
        }
        return new CatalogStats(entries.size(), byCategory, withCodes, withEndpointLinks, invasive);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogDocument(
        @JsonProperty("version") String version,
        @JsonProperty("entries") List<ProcedureCatalogEntry> entries
    ) {
        CatalogDocument {
            entries = entries == null ? List.of() : entries;
        }
    }
}
