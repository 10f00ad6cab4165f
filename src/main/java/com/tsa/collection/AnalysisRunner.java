package com.tsa.collection;

import com.tsa.condition.Condition;
import com.tsa.config.AnalysisConfig;
import com.tsa.config.CollectionConfig;
import com.tsa.config.ConditionDefinition;
import com.tsa.error.ErrorKind;
import com.tsa.error.TsaError;
import com.tsa.interval.IntervalPlanner;
import com.tsa.interval.IntervalSource;
import com.tsa.result.ConditionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds condition collections from an analysis definition and analyzes them.
 * In dry-validation mode conditions are only compiled and cross-checked.
 */
public class AnalysisRunner {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRunner.class);

    private final IntervalSource intervalSource;

    public AnalysisRunner(IntervalSource intervalSource) {
        this.intervalSource = intervalSource;
    }

    /**
     * Run every collection of the definition.
     *
     * @param config      Analysis definition
     * @param dryValidate Only compile, resolve references and check stations
     * @return Collections with their conditions, results and errors
     */
    public List<ConditionCollection> run(AnalysisConfig config, boolean dryValidate) {
        log.info("=== Analysis '{}' started{} ===", config.name(), dryValidate ? " (dry validation)" : "");
        List<ConditionCollection> collections = new ArrayList<>();
        for (CollectionConfig collectionConfig : config.collections()) {
            ConditionCollection collection = build(collectionConfig);
            if (!dryValidate) {
                collection.analyze(intervalSource, new IntervalPlanner(collectionConfig.mergeSlices()));
            }
            logSummary(collection, dryValidate);
            collections.add(collection);
        }
        long errorCount = collections.stream()
                .flatMap(c -> c.errorReport().stream())
                .filter(TsaError::isError)
                .count();
        log.info("=== Analysis '{}' finished with {} errors ===", config.name(), errorCount);
        return collections;
    }

    /**
     * Build one collection: add its conditions, resolve references and check stations.
     */
    public ConditionCollection build(CollectionConfig collectionConfig) {
        ConditionCollection collection = new ConditionCollection(collectionConfig.title(), collectionConfig.window());
        collectionConfig.invalidEntries().forEach(message -> collection.addError(ErrorKind.INVALID_ENTRY, message));
        for (ConditionDefinition definition : collectionConfig.conditions()) {
            collection.addCondition(definition.site(), definition.masterAlias(), definition.condition(), definition.row());
        }
        collection.resolveReferences();
        if (!collectionConfig.stationIds().isEmpty()) {
            collection.validateStations(collectionConfig.stationIds());
        }
        return collection;
    }

    private static void logSummary(ConditionCollection collection, boolean dryValidate) {
        log.info("Collection '{}' [{} - {}]: {} conditions, {} to analyze",
                collection.getTitle(), collection.getWindow().from(), collection.getWindow().until(),
                collection.size(), collection.getEvaluationOrder().size());
        for (Condition condition : collection.getConditions()) {
            Optional<ConditionResult> result = collection.getResult(condition.getIdString());
            if (result.isPresent()) {
                ConditionResult r = result.get();
                log.info("  {}: valid {}%, invalid {}%, no data {}%", condition.getIdString(),
                        percent(r.getPercentageValid()), percent(r.getPercentageInvalid()),
                        percent(r.getPercentageNoData()));
            } else if (condition.isValid()) {
                log.info("  {}: {}", condition.getIdString(), dryValidate ? "OK" : "no result");
            } else {
                log.info("  {}: INVALID ({} errors)", condition.getIdString(), condition.getErrors().size());
            }
        }
        for (TsaError error : collection.errorReport()) {
            if (error.isError()) {
                log.warn("  {}", error);
            }
        }
    }

    private static String percent(double share) {
        return String.format("%.1f", share * 100);
    }
}
