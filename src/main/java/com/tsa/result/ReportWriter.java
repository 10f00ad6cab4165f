package com.tsa.result;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tsa.collection.ConditionCollection;
import com.tsa.condition.Block;
import com.tsa.condition.Condition;
import com.tsa.error.TsaError;
import com.tsa.exception.TsaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes analysis outcomes as a JSON report: per collection the window, each
 * condition with its blocks and summary, and the error report.
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper objectMapper;

    public ReportWriter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Build the report tree.
     */
    public ObjectNode toTree(String analysisName, List<ConditionCollection> collections) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("analysis", analysisName);
        ArrayNode collectionsNode = root.putArray("collections");
        for (ConditionCollection collection : collections) {
            collectionsNode.add(collectionNode(collection));
        }
        return root;
    }

    public String toJson(String analysisName, List<ConditionCollection> collections) {
        try {
            return objectMapper.writeValueAsString(toTree(analysisName, collections));
        } catch (IOException e) {
            throw new TsaException("Failed to serialize report", e);
        }
    }

    /**
     * Write the report to a file, creating parent directories.
     */
    public void write(Path path, String analysisName, List<ConditionCollection> collections) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), toTree(analysisName, collections));
            log.info("Wrote report of {} collections to {}", collections.size(), path);
        } catch (IOException e) {
            throw new TsaException("Failed to write report to: " + path, e);
        }
    }

    private ObjectNode collectionNode(ConditionCollection collection) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("title", collection.getTitle());
        node.put("timeFrom", collection.getWindow().from().toString());
        node.put("timeUntil", collection.getWindow().until().toString());

        ArrayNode conditions = node.putArray("conditions");
        for (Condition condition : collection.getConditions()) {
            conditions.add(conditionNode(condition, collection));
        }

        ArrayNode errors = node.putArray("errors");
        for (TsaError error : collection.errorReport()) {
            ObjectNode errorNode = errors.addObject();
            errorNode.put("scope", error.scope());
            errorNode.put("kind", error.kind().displayName());
            errorNode.put("level", error.level().name());
            errorNode.put("message", error.message());
        }
        return node;
    }

    private ObjectNode conditionNode(Condition condition, ConditionCollection collection) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", condition.getIdString());
        node.put("site", condition.getSite());
        node.put("masterAlias", condition.getMasterAlias());
        node.put("condition", condition.getRawCondition());
        node.put("aliasExpression", condition.getAliasExpression());
        node.put("state", condition.getState().name());
        node.put("secondary", condition.isSecondary());

        ArrayNode blocks = node.putArray("blocks");
        for (Block block : condition.getBlocks()) {
            ObjectNode blockNode = blocks.addObject();
            blockNode.put("alias", block.getAlias());
            blockNode.put(block.isSecondary() ? "reference" : "predicate", block.getCanonicalText());
            blockNode.put("text", block.getRawText());
        }

        collection.getResult(condition.getIdString()).ifPresent(result -> node.set("result", resultNode(result)));
        return node;
    }

    private ObjectNode resultNode(ConditionResult result) {
        ObjectNode node = objectMapper.createObjectNode();
        result.getDataFrom().ifPresent(from -> node.put("dataFrom", from.toString()));
        result.getDataUntil().ifPresent(until -> node.put("dataUntil", until.toString()));
        node.put("totalSpanSeconds", result.getTotalSpan().toSeconds());
        node.put("validSeconds", result.getValidDuration().toSeconds());
        node.put("invalidSeconds", result.getInvalidDuration().toSeconds());
        node.put("noDataSeconds", result.getNoDataDuration().toSeconds());
        node.put("percentageValid", result.getPercentageValid());
        node.put("percentageInvalid", result.getPercentageInvalid());
        node.put("percentageNoData", result.getPercentageNoData());
        return node;
    }
}
