package com.di.chunkmutator.migration;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of the {@link MutationSpec} beans in the context, keyed by normalized
 * (trimmed, lower-case) name.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MutationSpecRegistry {

    private final List<MutationSpec> specs;

    private Map<String, MutationSpec> specsByName;

    /**
     * Discovers and registers all specs. Called automatically after injection.
     *
     * @throws IllegalStateException if a spec has a blank name or two specs share a name
     */
    @PostConstruct
    void initialize() {
        if (specs == null || specs.isEmpty()) {
            log.warn("No MutationSpec beans found. Registry will be empty.");
            specsByName = Collections.emptyMap();
            return;
        }

        specs.forEach(spec -> log.info("  - MutationSpec: {} (name='{}', relation={}, kind={})",
                spec.getClass().getSimpleName(), spec.name(), spec.relation(), spec.kind()));

        Map<String, List<MutationSpec>> grouped = specs.stream()
                .peek(MutationSpecRegistry::validateName)
                .collect(Collectors.groupingBy(spec -> normalize(spec.name())));
        validateNoDuplicates(grouped);
        specsByName = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().get(0)));

        log.info("Registered {} mutation spec(s): {}", specsByName.size(), specsByName.keySet());
    }

    /**
     * @param name spec name (case-insensitive)
     * @throws IllegalArgumentException if the name is blank or unknown
     */
    public MutationSpec getSpec(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Migration name cannot be null or blank");
        }
        MutationSpec spec = specsByName.get(normalize(name));
        if (spec == null) {
            throw new IllegalArgumentException(
                    String.format("Unknown migration: '%s'. Available migrations: %s", name, specsByName.keySet()));
        }
        return spec;
    }

    public Set<String> getRegisteredNames() {
        return Collections.unmodifiableSet(specsByName.keySet());
    }

    public boolean hasSpec(String name) {
        return name != null && !name.isBlank() && specsByName.containsKey(normalize(name));
    }

    private static void validateName(MutationSpec spec) {
        if (spec.name() == null || spec.name().isBlank()) {
            throw new IllegalStateException(String.format(
                    "MutationSpec %s returned blank name(). Name must be non-null and non-blank.",
                    spec.getClass().getName()));
        }
    }

    private static void validateNoDuplicates(Map<String, List<MutationSpec>> grouped) {
        String detail = grouped.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(e -> String.format("'%s' -> [%s]", e.getKey(), e.getValue().stream()
                        .map(spec -> spec.getClass().getName())
                        .collect(Collectors.joining(", "))))
                .collect(Collectors.joining(" ; "));
        if (!detail.isEmpty()) {
            throw new IllegalStateException("Duplicate MutationSpec name() values detected: " + detail);
        }
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
