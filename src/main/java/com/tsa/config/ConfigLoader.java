package com.tsa.config;

import com.tsa.condition.IdentifierNormalizer;
import com.tsa.exception.ConfigurationException;
import com.tsa.exception.InvalidIdentifierException;
import com.tsa.interval.AnalysisWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads analysis definitions from YAML files.
 * <pre>
 * analysis:
 *   name: winter-2018
 *   collections:
 *     - title: Tampere
 *       time-from: 2018-01-01
 *       time-until: 2018-01-31
 *       zone: Europe/Helsinki
 *       station-ids: [s1122]
 *       conditions:
 *         - site: Ylöjärvi
 *           master-alias: d1
 *           condition: s1122#kitka3_luku >= 0.30
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String DEFAULT_ZONE = "UTC";

    /**
     * Load an analysis definition from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the definition file
     * @return Loaded definition
     * @throws ConfigurationException if the file cannot be read or is invalid
     */
    public static AnalysisConfig load(String path) {
        log.info("Loading analysis definition from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(new Yaml().load(inputStream));
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load analysis definition from: " + path, e);
        }
    }

    /**
     * Parse an analysis definition from YAML text.
     */
    public static AnalysisConfig parse(String yamlText) {
        return parseYaml(new Yaml().load(yamlText));
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static AnalysisConfig parseYaml(Object loaded) {
        if (loaded == null) {
            throw new ConfigurationException("Analysis definition is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Analysis definition must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // The analysis section could be at root or under 'analysis' key
        Map<String, Object> analysis = root.containsKey("analysis")
                ? asMap(root.get("analysis"), "analysis")
                : root;

        String name = getString(analysis, "name", "analysis");
        List<Object> collectionsList = asList(analysis.get("collections"), "collections");
        if (collectionsList.isEmpty()) {
            throw new ConfigurationException("Analysis '" + name + "' defines no collections");
        }

        List<CollectionConfig> collections = new ArrayList<>();
        Set<String> titles = new HashSet<>();
        for (int i = 0; i < collectionsList.size(); i++) {
            CollectionConfig collection = parseCollection(asMap(collectionsList.get(i), "collections[" + i + "]"), i);
            if (!titles.add(collection.title())) {
                throw new ConfigurationException("Collection title '" + collection.title() + "' is used twice");
            }
            collections.add(collection);
        }

        AnalysisConfig config = new AnalysisConfig(name, collections);
        log.info("Loaded analysis definition: {} with {} collections, {} conditions",
                name, collections.size(), config.conditionCount());
        return config;
    }

    private static CollectionConfig parseCollection(Map<String, Object> map, int index) {
        String title = getString(map, "title", "collection-" + (index + 1));
        ZoneId zone = parseZone(getString(map, "zone", DEFAULT_ZONE), title);
        AnalysisWindow window = parseWindow(map, zone, title);
        boolean mergeSlices = getBoolean(map, "merge-slices", true);

        List<ConditionDefinition> conditions = new ArrayList<>();
        List<String> invalidEntries = new ArrayList<>();

        Set<String> stationIds = new LinkedHashSet<>();
        for (Object station : asList(map.get("station-ids"), title + ".station-ids")) {
            String id = String.valueOf(station);
            try {
                stationIds.add(IdentifierNormalizer.normalizeStation(id));
            } catch (InvalidIdentifierException e) {
                invalidEntries.add("Station id '" + id + "' is not valid, skipping: " + e.getMessage());
                log.warn("Collection '{}' has invalid station id '{}'", title, id);
            }
        }
        List<Object> conditionsList = asList(map.get("conditions"), title + ".conditions");
        for (int i = 0; i < conditionsList.size(); i++) {
            int row = i + 1;
            if (!(conditionsList.get(i) instanceof Map<?, ?>)) {
                invalidEntries.add("Row " + row + ": entry is not a mapping");
                continue;
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> entry = (Map<String, Object>) conditionsList.get(i);
            String site = getString(entry, "site", null);
            String masterAlias = getString(entry, "master-alias", null);
            String condition = getString(entry, "condition", null);

            List<String> missing = new ArrayList<>();
            if (isBlank(site)) missing.add("site");
            if (isBlank(masterAlias)) missing.add("master-alias");
            if (isBlank(condition)) missing.add("condition");
            if (!missing.isEmpty()) {
                invalidEntries.add("Row " + row + ": missing " + String.join(", ", missing) + ", skipping entry");
                log.warn("Collection '{}' row {} is missing {}", title, row, missing);
                continue;
            }
            conditions.add(new ConditionDefinition(site, masterAlias, condition, row));
        }

        log.debug("Parsed collection: title={}, window={}, conditions={}", title, window, conditions.size());
        return new CollectionConfig(title, window, mergeSlices, stationIds, conditions, invalidEntries);
    }

    private static ZoneId parseZone(String zone, String title) {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Collection '" + title + "' has invalid zone: " + zone, e);
        }
    }

    /**
     * Dates expand to the start of the first day and the last second of the last day.
     */
    private static AnalysisWindow parseWindow(Map<String, Object> map, ZoneId zone, String title) {
        Object fromValue = map.get("time-from");
        Object untilValue = map.get("time-until");
        if (fromValue == null || untilValue == null) {
            throw new ConfigurationException("Collection '" + title + "' needs time-from and time-until");
        }
        Instant from = parseTime(fromValue, zone, false, title);
        Instant until = parseTime(untilValue, zone, true, title);
        if (from.isAfter(until)) {
            throw new ConfigurationException("Collection '" + title + "' has time-from " + from
                    + " after time-until " + until);
        }
        return new AnalysisWindow(from, until);
    }

    private static Instant parseTime(Object value, ZoneId zone, boolean endOfDay, String title) {
        // SnakeYAML reads unquoted timestamps as java.util.Date; a bare date arrives as UTC midnight
        if (value instanceof Date date) {
            ZonedDateTime utc = date.toInstant().atZone(ZoneOffset.UTC);
            if (utc.toLocalTime().equals(LocalTime.MIDNIGHT)) {
                return atDayBoundary(utc.toLocalDate(), zone, endOfDay);
            }
            return date.toInstant();
        }
        String text = value.toString().strip();
        try {
            if (text.length() == 10) {
                return atDayBoundary(LocalDate.parse(text), zone, endOfDay);
            }
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException e) {
                return LocalDateTime.parse(text).atZone(zone).toInstant();
            }
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Collection '" + title + "' has invalid time: " + text, e);
        }
    }

    private static Instant atDayBoundary(LocalDate date, ZoneId zone, boolean endOfDay) {
        return endOfDay
                ? date.atTime(AnalysisWindow.END_OF_DAY).atZone(zone).toInstant()
                : date.atStartOfDay(zone).toInstant();
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String key) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value, String key) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException("'" + key + "' must be a list");
        }
        return (List<Object>) value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
