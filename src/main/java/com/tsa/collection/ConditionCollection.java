package com.tsa.collection;

import com.tsa.condition.Block;
import com.tsa.condition.Condition;
import com.tsa.condition.ConditionCompiler;
import com.tsa.condition.IdentifierNormalizer;
import com.tsa.error.ErrorCollection;
import com.tsa.error.ErrorKind;
import com.tsa.error.TsaError;
import com.tsa.exception.IntervalSourceException;
import com.tsa.exception.InvalidIdentifierException;
import com.tsa.interval.AnalysisWindow;
import com.tsa.interval.Interval;
import com.tsa.interval.IntervalPlanner;
import com.tsa.interval.IntervalSource;
import com.tsa.interval.ValidityPartition;
import com.tsa.result.ConditionResult;
import com.tsa.result.ResultSummarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Conditions sharing one title and one analysis window.
 * <p>
 * Conditions are compiled as they are added. Secondary references are
 * resolved once all conditions are known, which also fixes the evaluation
 * order: primary conditions in insertion order, then secondary conditions so
 * that every condition comes after the ones it refers to.
 * <p>
 * A collection is not thread-safe. Separate collections share no state.
 */
public class ConditionCollection {

    private static final Logger log = LoggerFactory.getLogger(ConditionCollection.class);

    private final String title;
    private final AnalysisWindow window;
    private final ErrorCollection errors;
    private final Map<String, Condition> conditions = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> referenceTargets = new HashMap<>();
    private final Map<String, ValidityPartition> partitions = new LinkedHashMap<>();
    private final Map<String, ConditionResult> results = new LinkedHashMap<>();

    private List<Condition> evaluationOrder = List.of();
    private boolean referencesResolved;

    public ConditionCollection(String title, AnalysisWindow window) {
        this.title = title;
        this.window = window;
        this.errors = new ErrorCollection(title);
    }

    /**
     * Compile and add a condition.
     * <p>
     * Invalid identifiers and duplicate id strings are recorded as collection
     * errors and the entry is skipped. Other problems leave the condition
     * invalid but part of the collection.
     *
     * @param sourceRow Row of the definition in its source, or null
     * @return The added condition, empty if the entry was skipped
     */
    public Optional<Condition> addCondition(String site, String masterAlias, String rawCondition, Integer sourceRow) {
        Condition condition;
        try {
            condition = ConditionCompiler.compile(site, masterAlias, rawCondition, sourceRow);
        } catch (InvalidIdentifierException e) {
            errors.add(ErrorKind.INVALID_IDENTIFIER, rowPrefix(sourceRow) + e.getMessage());
            return Optional.empty();
        }
        if (conditions.containsKey(condition.getIdString())) {
            errors.add(ErrorKind.DUPLICATE_CONDITION, rowPrefix(sourceRow) + "Condition <"
                    + condition.getIdString() + "> is already defined, skipping");
            return Optional.empty();
        }
        conditions.put(condition.getIdString(), condition);
        referencesResolved = false;
        return Optional.of(condition);
    }

    public Optional<Condition> addCondition(String site, String masterAlias, String rawCondition) {
        return addCondition(site, masterAlias, rawCondition, null);
    }

    /**
     * Record an error that belongs to the collection rather than a condition.
     */
    public void addError(ErrorKind kind, String message) {
        errors.add(kind, message);
    }

    /**
     * Resolve secondary references and compute the evaluation order.
     * <p>
     * References that match nothing, point to an invalid condition or take
     * part in a cycle invalidate the referencing condition. Errors of an
     * earlier resolution are dropped first, so conditions added since then
     * can satisfy references.
     */
    public void resolveReferences() {
        referenceTargets.clear();
        conditions.values().forEach(Condition::clearReferenceErrors);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Condition condition : conditions.values()) {
                if (condition.isValid() && !bindReferences(condition)) {
                    changed = true;
                }
            }
        }

        List<Condition> order = new ArrayList<>();
        Set<String> placed = new LinkedHashSet<>();
        List<Condition> pending = new ArrayList<>();
        for (Condition condition : conditions.values()) {
            if (!condition.isValid()) {
                continue;
            }
            if (condition.isSecondary()) {
                pending.add(condition);
            } else {
                order.add(condition);
                placed.add(condition.getIdString());
            }
        }

        while (!pending.isEmpty()) {
            Condition next = null;
            for (Condition candidate : pending) {
                if (placed.containsAll(referenceTargets.get(candidate.getIdString()).values())) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                String involved = pending.stream().map(Condition::getIdString).collect(Collectors.joining(", "));
                for (Condition condition : pending) {
                    condition.rejectReference("Circular reference among conditions " + involved);
                }
                break;
            }
            pending.remove(next);
            order.add(next);
            placed.add(next.getIdString());
        }

        evaluationOrder = Collections.unmodifiableList(order);
        referencesResolved = true;
        log.debug("Collection '{}' evaluation order: {}", title,
                order.stream().map(Condition::getIdString).toList());
    }

    /**
     * Bind each reference of a condition to its target.
     *
     * @return false if the condition was invalidated
     */
    private boolean bindReferences(Condition condition) {
        Map<String, String> targets = new LinkedHashMap<>();
        for (String reference : condition.getReferences()) {
            Condition target = findReferenced(condition, reference);
            if (target == null) {
                condition.rejectReference("Reference '" + reference
                        + "' does not match any condition in collection '" + title + "'");
                return false;
            }
            if (target == condition) {
                condition.rejectReference("Condition refers to itself via '" + reference + "'");
                return false;
            }
            if (!target.isValid()) {
                condition.rejectReference("Reference '" + reference
                        + "' points to invalid condition <" + target.getIdString() + ">");
                return false;
            }
            targets.put(reference, target.getIdString());
        }
        referenceTargets.put(condition.getIdString(), targets);
        return true;
    }

    private Condition findReferenced(Condition owner, String reference) {
        String sameSiteId = owner.getSite() + "_" + reference;
        if (IdentifierNormalizer.isValid(sameSiteId) && conditions.containsKey(sameSiteId)) {
            return conditions.get(sameSiteId);
        }
        return conditions.get(reference);
    }

    /**
     * Warn about primary blocks whose station is not among the available ones.
     * The conditions stay valid. Numeric ids match {@code s<id>} stations; ids
     * that are not station ids at all are recorded as collection errors.
     *
     * @param availableStations Known station identifiers or numeric station ids
     * @return Unknown station identifiers found
     */
    public Set<String> validateStations(Set<String> availableStations) {
        Set<String> available = new HashSet<>();
        for (String id : availableStations) {
            try {
                available.add(IdentifierNormalizer.normalizeStation(id));
            } catch (InvalidIdentifierException e) {
                errors.add(ErrorKind.INVALID_ENTRY, "Available station '" + id + "' ignored: " + e.getMessage());
            }
        }
        Set<String> unknown = new LinkedHashSet<>();
        for (Condition condition : conditions.values()) {
            for (Block block : condition.getBlocks()) {
                if (block.isSecondary()) {
                    continue;
                }
                String station = block.getPredicate().station();
                if (!available.contains(station)) {
                    unknown.add(station);
                    condition.getErrors().add(ErrorKind.UNKNOWN_STATION,
                            "Station '" + station + "' of block " + block.getAlias() + " is not available");
                }
            }
        }
        if (!unknown.isEmpty()) {
            log.warn("Collection '{}' uses unknown stations: {}", title, unknown);
        }
        return unknown;
    }

    /**
     * Plan and summarize every valid condition in evaluation order.
     * <p>
     * Primary blocks are fetched from the source; secondary blocks take the
     * master values of the referenced condition. A failure is recorded on its
     * condition and the remaining conditions are still analyzed.
     *
     * @return Results by condition id string
     */
    public Map<String, ConditionResult> analyze(IntervalSource source, IntervalPlanner planner) {
        if (!referencesResolved) {
            resolveReferences();
        }
        partitions.clear();
        results.clear();
        if (window.isDegenerate()) {
            errors.add(ErrorKind.DEGENERATE_WINDOW, "Analysis window " + window.from() + " has zero length");
        }

        for (Condition condition : evaluationOrder) {
            if (!condition.isValid()) {
                continue;
            }
            try {
                Map<String, List<Interval>> blockIntervals = collectIntervals(condition, source);
                if (blockIntervals == null) {
                    continue;
                }
                ValidityPartition partition = planner.plan(condition.getAliasExpression(), blockIntervals, window);
                ConditionResult result = ResultSummarizer.summarize(partition, window);
                partitions.put(condition.getIdString(), partition);
                results.put(condition.getIdString(), result);
                if (result.getTotalSpan().isZero()) {
                    condition.getErrors().add(ErrorKind.DEGENERATE_WINDOW, "Condition has a zero-length time span");
                }
                log.debug("{}: {}", condition.getIdString(), result);
            } catch (IntervalSourceException e) {
                log.error("Interval data of condition {} failed: {}", condition.getIdString(), e.getMessage());
                condition.invalidate(ErrorKind.INTERVAL_SOURCE_FAILURE, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Analysis of condition {} failed", condition.getIdString(), e);
                condition.invalidate(ErrorKind.INTERVAL_SOURCE_FAILURE,
                        e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        log.info("Collection '{}' analyzed: {} of {} conditions have results", title, results.size(), conditions.size());
        return getResults();
    }

    private Map<String, List<Interval>> collectIntervals(Condition condition, IntervalSource source) {
        Map<String, List<Interval>> blockIntervals = new LinkedHashMap<>();
        Map<String, String> targets = referenceTargets.getOrDefault(condition.getIdString(), Map.of());
        for (Block block : condition.getBlocks()) {
            if (!block.isSecondary()) {
                blockIntervals.put(block.getAlias(), source.fetch(block, window));
                continue;
            }
            ValidityPartition referenced = partitions.get(targets.get(block.getReference()));
            if (referenced == null) {
                condition.rejectReference("Referenced condition '" + block.getReference() + "' has no result");
                return null;
            }
            blockIntervals.put(block.getAlias(), referenced.toIntervals());
        }
        return blockIntervals;
    }

    /**
     * Collection errors followed by the errors of each condition.
     */
    public List<TsaError> errorReport() {
        List<TsaError> report = new ArrayList<>(errors.getErrors());
        for (Condition condition : conditions.values()) {
            report.addAll(condition.getErrors().getErrors());
        }
        return report;
    }

    private static String rowPrefix(Integer sourceRow) {
        return sourceRow == null ? "" : "Row " + sourceRow + ": ";
    }

    public String getTitle() {
        return title;
    }

    public AnalysisWindow getWindow() {
        return window;
    }

    public ErrorCollection getErrors() {
        return errors;
    }

    public List<Condition> getConditions() {
        return List.copyOf(conditions.values());
    }

    public Optional<Condition> getCondition(String idString) {
        return Optional.ofNullable(conditions.get(idString));
    }

    /**
     * Valid conditions in the order they are analyzed; empty before references are resolved.
     */
    public List<Condition> getEvaluationOrder() {
        return evaluationOrder;
    }

    /**
     * Referenced condition id string per reference of a condition.
     */
    public Map<String, String> getReferenceTargets(String idString) {
        return Collections.unmodifiableMap(referenceTargets.getOrDefault(idString, Map.of()));
    }

    public Optional<ValidityPartition> getPartition(String idString) {
        return Optional.ofNullable(partitions.get(idString));
    }

    public Optional<ConditionResult> getResult(String idString) {
        return Optional.ofNullable(results.get(idString));
    }

    public Map<String, ConditionResult> getResults() {
        return Collections.unmodifiableMap(results);
    }

    public int size() {
        return conditions.size();
    }

    @Override
    public String toString() {
        return "ConditionCollection<" + title + "> with " + conditions.size() + " conditions";
    }
}
