package com.tsa.interval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsa.condition.Block;
import com.tsa.exception.IntervalSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Interval source loaded from a JSON document of previously fetched block data:
 * <pre>
 * {
 *   "s1122#kitka3_luku >= 0.30": [
 *     {"from": "2018-01-01T00:00:00Z", "until": "2018-01-01T06:00:00Z", "value": true}
 *   ],
 *   "d1_2": [ ... ]
 * }
 * </pre>
 * Keys are predicate texts or block aliases, see {@link InMemoryIntervalSource}.
 */
public class JsonIntervalSource implements IntervalSource {

    private static final Logger log = LoggerFactory.getLogger(JsonIntervalSource.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final InMemoryIntervalSource delegate;

    private JsonIntervalSource(InMemoryIntervalSource delegate) {
        this.delegate = delegate;
    }

    /**
     * Load intervals from a path. Supports classpath: prefix for classpath resources.
     */
    public static JsonIntervalSource load(String path) {
        log.info("Loading interval data from: {}", path);
        Resource resource = path.startsWith("classpath:")
                ? new ClassPathResource(path.substring("classpath:".length()))
                : new FileSystemResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return read(objectMapper.readValue(inputStream, new TypeReference<Map<String, List<IntervalEntry>>>() {}));
        } catch (IOException e) {
            throw new IntervalSourceException("Failed to load interval data from: " + path, e);
        }
    }

    /**
     * Parse intervals from a JSON string.
     */
    public static JsonIntervalSource parse(String json) {
        try {
            return read(objectMapper.readValue(json, new TypeReference<Map<String, List<IntervalEntry>>>() {}));
        } catch (IOException e) {
            throw new IntervalSourceException("Invalid interval JSON: " + e.getMessage(), e);
        }
    }

    private static JsonIntervalSource read(Map<String, List<IntervalEntry>> document) {
        if (document == null) {
            throw new IntervalSourceException("Interval document is empty");
        }
        InMemoryIntervalSource source = new InMemoryIntervalSource();
        for (Map.Entry<String, List<IntervalEntry>> entry : document.entrySet()) {
            List<Interval> intervals = new ArrayList<>();
            if (entry.getValue() != null) {
                for (IntervalEntry e : entry.getValue()) {
                    intervals.add(e.toInterval(entry.getKey()));
                }
            }
            source.put(entry.getKey(), intervals);
        }
        log.debug("Loaded intervals for {} keys", document.size());
        return new JsonIntervalSource(source);
    }

    @Override
    public List<Interval> fetch(Block block, AnalysisWindow window) {
        return delegate.fetch(block, window);
    }

    /**
     * One interval as it appears in the document.
     */
    record IntervalEntry(String from, String until, Boolean value) {

        Interval toInterval(String key) {
            if (from == null || until == null || value == null) {
                throw new IntervalSourceException("Interval of '" + key + "' needs from, until and value");
            }
            try {
                return new Interval(parseTime(from), parseTime(until), value);
            } catch (DateTimeParseException | IllegalArgumentException e) {
                throw new IntervalSourceException("Invalid interval of '" + key + "': " + e.getMessage(), e);
            }
        }

        private static Instant parseTime(String text) {
            return OffsetDateTime.parse(text).toInstant();
        }
    }
}
