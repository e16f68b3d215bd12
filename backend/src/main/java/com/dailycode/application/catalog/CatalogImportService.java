package com.dailycode.application.catalog;

import com.dailycode.application.catalog.exception.CatalogImportException;
import com.dailycode.config.DailyCodeProperties;
import com.dailycode.domain.common.exception.CatalogUnavailableException;
import com.dailycode.domain.problem.model.Difficulty;
import com.dailycode.domain.problem.model.Problem;
import com.dailycode.domain.problem.repository.ProblemRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.io.IOException;
import java.io.InputStream;
import java.text.Normalizer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.StreamSupport;

/**
 * Loads a catalog JSON document into the problem store.
 * <p>
 * The document is either an array of problems or an object with a {@code problems} array. Identities
 * already present are skipped, never overwritten.
 */
@Slf4j
@Service
public class CatalogImportService {

    static final String BUNDLED_CATALOG = "catalog/sample-problems.json";

    private final ProblemRepository problemRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String defaultLocation;

    public CatalogImportService(ProblemRepository problemRepository, ObjectMapper objectMapper, Clock clock,
                                DailyCodeProperties properties) {
        this.problemRepository = problemRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultLocation = properties.catalog().location();
    }

    /**
     * Imports from the given path, or from the configured location when {@code path} is null.
     * Falls back to the bundled sample catalog when no path is given and the configured file does not exist.
     */
    public ImportResult importCatalog(String path) {
        Resource resource;
        if (path != null) {
            resource = new FileSystemResource(path);
            if (!resource.exists()) {
                throw new CatalogImportException("Catalog file not found: " + path);
            }
        } else {
            resource = new FileSystemResource(defaultLocation);
            if (!resource.exists()) {
                log.info("No catalog at {}, loading bundled sample catalog", defaultLocation);
                resource = new ClassPathResource(BUNDLED_CATALOG);
            }
        }
        return importCatalog(resource);
    }

    public ImportResult importCatalog(Resource resource) {
        String source = resource.getDescription();
        JsonNode entries = readEntries(resource);

        List<String> skipped = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int imported = 0;
        int index = 0;
        for (JsonNode entry : entries) {
            index++;
            Problem problem;
            try {
                problem = toProblem(entry);
            } catch (IllegalArgumentException e) {
                log.warn("Rejected catalog entry #{}: {}", index, e.getMessage());
                rejected.add("#" + index + ": " + e.getMessage());
                continue;
            }
            if (!seen.add(problem.getId()) || exists(problem.getId())) {
                skipped.add(problem.getId());
                continue;
            }
            save(problem);
            imported++;
        }

        log.info("Catalog import from {} - read: {}, imported: {}, skipped: {}, rejected: {}",
                source, index, imported, skipped.size(), rejected.size());
        return new ImportResult(source, index, imported, List.copyOf(skipped), List.copyOf(rejected));
    }

    /**
     * Lower-case ASCII slug of a title, e.g. "Two Sum II" becomes "two-sum-ii".
     */
    static String slugify(String title) {
        String ascii = Normalizer.normalize(title, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        return slug.length() > 120 ? slug.substring(0, 120) : slug;
    }

    private JsonNode readEntries(Resource resource) {
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new CatalogImportException("Catalog is not valid JSON: " + resource.getDescription(), e);
        } catch (IOException e) {
            throw new CatalogImportException("Cannot read catalog: " + resource.getDescription(), e);
        }
        if (root != null && root.isObject() && root.has("problems")) {
            root = root.get("problems");
        }
        if (root == null || !root.isArray()) {
            throw new CatalogImportException("Catalog must be a JSON array of problems: " + resource.getDescription());
        }
        return root;
    }

    private Problem toProblem(JsonNode entry) {
        if (!entry.isObject()) {
            throw new IllegalArgumentException("entry is not an object");
        }
        String title = requireText(entry, "title");
        String description = requireText(entry, "description");
        String difficultyCode = requireText(entry, "difficulty");
        Difficulty difficulty = Difficulty.fromCode(difficultyCode)
                .orElseThrow(() -> new IllegalArgumentException("unknown difficulty '" + difficultyCode + "'"));

        String id = entry.hasNonNull("id") && !entry.get("id").asText().isBlank()
                ? entry.get("id").asText().trim()
                : slugify(title);
        if (id.isEmpty()) {
            throw new IllegalArgumentException("cannot derive an id from title '" + title + "'");
        }
        if (id.length() > 120) {
            throw new IllegalArgumentException("id longer than 120 characters");
        }

        List<String> tags = entry.path("tags").isArray()
                ? StreamSupport.stream(entry.get("tags").spliterator(), false).map(JsonNode::asText).toList()
                : List.of();

        return Problem.builder()
                .id(id)
                .title(title)
                .description(description)
                .difficulty(difficulty)
                .tags(tags)
                .constraints(constraints(entry.get("constraints")))
                .examples(jsonArray(entry, "examples"))
                .hints(jsonArray(entry, "hints"))
                .testCases(jsonArray(entry, "test_cases"))
                .createdAt(clock.instant())
                .build();
    }

    private static String constraints(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isArray()) {
            List<String> lines = new ArrayList<>();
            node.forEach(n -> lines.add(n.asText()));
            return String.join("\n", lines);
        }
        return node.asText();
    }

    private String jsonArray(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            return "[]";
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("'" + field + "' must be an array");
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("'" + field + "' cannot be serialized", e);
        }
    }

    private static String requireText(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            throw new IllegalArgumentException("missing '" + field + "'");
        }
        return node.asText().trim();
    }

    private boolean exists(String id) {
        try {
            return problemRepository.existsById(id);
        } catch (DataAccessException | TransactionException e) {
            throw new CatalogUnavailableException("Failed to check problem " + id, e);
        }
    }

    private void save(Problem problem) {
        try {
            problemRepository.save(problem);
        } catch (DataAccessException | TransactionException e) {
            throw new CatalogUnavailableException("Failed to store problem " + problem.getId(), e);
        }
    }
}
