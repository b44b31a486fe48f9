package in.warroom.infrastructure.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.warroom.application.port.output.IncidentProvider;
import in.warroom.domain.model.FixPatch;
import in.warroom.domain.model.Incident;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Incident provider backed by a JSON catalog of canned scenarios.
 *
 * The catalog is read once at construction, from a file if a path is configured,
 * otherwise from the bundled classpath resource. Each call picks one entry at random.
 * Entries without buggy/fixed code become incidents without a patch.
 */
public final class CatalogIncidentProvider implements IncidentProvider {
    private static final Logger log = LoggerFactory.getLogger(CatalogIncidentProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String DEFAULT_RESOURCE = "incidents.json";

    private final List<Incident> incidents;
    private final Random random;

    public CatalogIncidentProvider(List<Incident> incidents, Random random) {
        this.incidents = List.copyOf(incidents);
        this.random = random;
    }

    /**
     * Load the catalog from a file path, or from the bundled resource when the path is blank.
     * An unreadable catalog yields an empty provider, which refuses every run.
     */
    public static CatalogIncidentProvider load(String path, Random random) {
        List<Incident> incidents;
        try {
            if (path != null && !path.isBlank()) {
                try (InputStream in = Files.newInputStream(Path.of(path))) {
                    incidents = parse(in);
                }
                log.info("✓ Loaded {} incident(s) from catalog file: {}", incidents.size(), path);
            } else {
                try (InputStream in = CatalogIncidentProvider.class.getClassLoader()
                        .getResourceAsStream(DEFAULT_RESOURCE)) {
                    if (in == null) {
                        throw new IOException("Resource not found: " + DEFAULT_RESOURCE);
                    }
                    incidents = parse(in);
                }
                log.info("✓ Loaded {} incident(s) from bundled catalog", incidents.size());
            }
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load incident catalog ({}), no incidents available: {}",
                path == null || path.isBlank() ? DEFAULT_RESOURCE : path, e.getMessage());
            incidents = List.of();
        }
        return new CatalogIncidentProvider(incidents, random);
    }

    static List<Incident> parse(InputStream in) throws IOException {
        List<CatalogEntry> entries = MAPPER.readValue(in, new TypeReference<List<CatalogEntry>>() {});
        List<Incident> incidents = new ArrayList<>(entries.size());
        for (CatalogEntry entry : entries) {
            incidents.add(entry.toIncident());
        }
        return incidents;
    }

    @Override
    public Optional<Incident> nextIncident() {
        if (incidents.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(incidents.get(random.nextInt(incidents.size())));
    }

    public int size() {
        return incidents.size();
    }

    /**
     * JSON shape of one catalog entry.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogEntry(
        @JsonProperty("service") String service,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("symptoms") List<String> symptoms,
        @JsonProperty("root_cause") String rootCause,
        @JsonProperty("fix_description") String fixDescription,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("agent_owner") String agentOwner,
        @JsonProperty("buggy_code") String buggyCode,
        @JsonProperty("fixed_code") String fixedCode
    ) {
        Incident toIncident() {
            FixPatch patch = buggyCode != null && fixedCode != null ? new FixPatch(buggyCode, fixedCode) : null;
            return new Incident(service, errorCode, errorMessage, symptoms, rootCause,
                fixDescription, fileName, agentOwner, patch);
        }
    }
}
