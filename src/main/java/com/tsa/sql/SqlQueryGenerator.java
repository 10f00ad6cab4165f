package com.tsa.sql;

import com.tsa.collection.ConditionCollection;
import com.tsa.condition.Block;
import com.tsa.condition.Condition;
import com.tsa.condition.Operator;
import com.tsa.condition.Predicate;
import com.tsa.condition.PredicateParser;
import com.tsa.exception.ConfigurationException;
import com.tsa.interval.AnalysisWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Generates PostgreSQL statements that compute condition partitions inside the database.
 * <p>
 * Each block becomes a transaction-scoped temp table with a {@code valid_r tstzrange}
 * column and a boolean column named by the block alias. Each condition becomes a
 * session temp table named by its id string, holding {@code vfrom, vuntil, vdiff},
 * one column per block and the {@code master} column. Boundaries of all blocks are
 * unioned, paired with {@code LEAD()} into elementary ranges, and blocks are left
 * joined onto the ranges by overlap, so a missing block row is {@code NULL}.
 * <p>
 * The generator only produces text and never connects to a database.
 */
public class SqlQueryGenerator {

    private static final Logger log = LoggerFactory.getLogger(SqlQueryGenerator.class);

    private static final Pattern NUMBERED_STATION = Pattern.compile("s(\\d+)");

    /**
     * Views limiting station observations to the window, created once per collection.
     */
    public String sessionViews(AnalysisWindow window) {
        return "CREATE OR REPLACE TEMP VIEW statobs_time AS "
                + "SELECT id, tfrom, statid "
                + "FROM statobs "
                + "WHERE tfrom BETWEEN " + timestamp(window.from()) + " AND " + timestamp(window.until()) + ";\n"
                + "CREATE OR REPLACE TEMP VIEW obs_main AS "
                + "SELECT tfrom, statid, seid, seval "
                + "FROM statobs_time "
                + "INNER JOIN seobs "
                + "ON statobs_time.id = seobs.obsid;";
    }

    /**
     * Query listing the stations that have observations in the window.
     */
    public String availableStations() {
        return "SELECT DISTINCT statid FROM statobs_time ORDER BY statid;";
    }

    /**
     * Definition query of a primary block. Each station observation is valid until
     * the next one; observations without a reading of the sensor are left out and
     * runs of equal values are joined.
     */
    public String primaryBlockQuery(Block block, AnalysisWindow window) {
        Predicate predicate = block.getPredicate();
        if (predicate == null) {
            throw new IllegalArgumentException("Block " + block.getAlias() + " is not a primary block");
        }
        String station = stationLiteral(predicate.station());
        String sensor = "(SELECT id FROM sensors WHERE lower(name) = " + quote(predicate.sensor()) + ")";
        return "WITH station_obs AS ( \n"
                + "SELECT t.tfrom, LEAD(t.tfrom, 1, " + timestamp(window.until()) + ") OVER (ORDER BY t.tfrom) AS tuntil, v.seval \n"
                + "FROM (SELECT DISTINCT tfrom FROM obs_main WHERE statid = " + station + ") t \n"
                + "LEFT JOIN obs_main v ON v.tfrom = t.tfrom AND v.statid = " + station + " AND v.seid = " + sensor + "), \n"
                + "flagged AS ( \n"
                + "SELECT tfrom, tuntil, (" + comparison(predicate) + ") AS val, \n"
                + "LAG(tuntil) OVER (ORDER BY tfrom) AS prev_until, \n"
                + "LAG(" + comparison(predicate) + ") OVER (ORDER BY tfrom) AS prev_val \n"
                + "FROM station_obs WHERE seval IS NOT NULL), \n"
                + "grouped AS ( \n"
                + "SELECT tfrom, tuntil, val, \n"
                + "SUM(CASE WHEN tfrom = prev_until AND val = prev_val THEN 0 ELSE 1 END) "
                + "OVER (ORDER BY tfrom) AS grp \n"
                + "FROM flagged) \n"
                + "SELECT tstzrange(min(tfrom), max(tuntil)) AS valid_r, val AS " + block.getAlias() + " \n"
                + "FROM grouped GROUP BY grp, val ORDER BY 1";
    }

    /**
     * Definition query of a secondary block: the known master values of the referenced condition.
     */
    public String secondaryBlockQuery(Block block, String referencedTable) {
        if (!block.isSecondary()) {
            throw new IllegalArgumentException("Block " + block.getAlias() + " is not a secondary block");
        }
        return "SELECT tstzrange(vfrom, vuntil) AS valid_r, master AS " + block.getAlias() + " \n"
                + "FROM " + referencedTable + " WHERE master IS NOT NULL";
    }

    /**
     * Statements creating the temp table of a valid condition.
     *
     * @param condition        Valid condition
     * @param referenceTargets Table (condition id string) per reference of the condition
     * @param window           Analysis window
     * @throws ConfigurationException if the condition is invalid or a reference has no target
     */
    public String conditionQuery(Condition condition, Map<String, String> referenceTargets, AnalysisWindow window) {
        if (!condition.isValid()) {
            throw new ConfigurationException("Cannot generate SQL for invalid condition " + condition.getIdString());
        }
        String table = condition.getIdString();
        List<Block> blocks = condition.getBlocks();

        StringBuilder sql = new StringBuilder("DROP TABLE IF EXISTS ").append(table).append(";\n");
        for (Block block : blocks) {
            String definition;
            if (block.isSecondary()) {
                String target = referenceTargets.get(block.getReference());
                if (target == null) {
                    throw new ConfigurationException("No table for reference '" + block.getReference()
                            + "' of condition " + table);
                }
                definition = secondaryBlockQuery(block, target);
            } else {
                definition = primaryBlockQuery(block, window);
            }
            sql.append("CREATE TEMP TABLE ").append(block.getAlias())
                    .append(" ON COMMIT DROP AS (").append(definition).append(");\n");
        }

        sql.append("CREATE TEMP TABLE ").append(table).append(" AS ( \n");
        if (blocks.size() == 1) {
            String alias = blocks.get(0).getAlias();
            sql.append("SELECT \n")
                    .append("lower(valid_r) AS vfrom, \n")
                    .append("upper(valid_r) AS vuntil, \n")
                    .append("upper(valid_r)-lower(valid_r) AS vdiff, \n")
                    .append(alias).append(", \n")
                    .append("(").append(condition.getAliasExpression()).append(") AS master \n")
                    .append("FROM ").append(alias).append(");");
        } else {
            String masterSeq = blocks.stream()
                    .map(b -> "SELECT unnest( array [lower(valid_r), upper(valid_r)] ) AS vt FROM " + b.getAlias())
                    .collect(Collectors.joining("\nUNION \n"));
            List<String> joins = new ArrayList<>();
            joins.add("master_ranges");
            for (Block block : blocks) {
                joins.add("LEFT JOIN " + block.getAlias() + " ON master_ranges.valid_r && "
                        + block.getAlias() + ".valid_r");
            }
            sql.append("WITH master_seq AS ( \n").append(masterSeq).append(" \nORDER BY vt), \n")
                    .append("master_ranges_wlastnull AS ( \n")
                    .append("SELECT vt AS vfrom, LEAD(vt, 1) OVER (ORDER BY vt) AS vuntil \n")
                    .append("FROM master_seq), \n")
                    .append("master_ranges AS ( \n")
                    .append("SELECT tstzrange(vfrom, vuntil) AS valid_r \n")
                    .append("FROM master_ranges_wlastnull \n")
                    .append("WHERE vuntil IS NOT NULL) \n")
                    .append("SELECT \n")
                    .append("lower(master_ranges.valid_r) AS vfrom, \n")
                    .append("upper(master_ranges.valid_r) AS vuntil, \n")
                    .append("upper(master_ranges.valid_r)-lower(master_ranges.valid_r) AS vdiff, \n")
                    .append(blocks.stream().map(Block::getAlias).collect(Collectors.joining(", \n"))).append(", \n")
                    .append("(").append(condition.getAliasExpression()).append(") AS master \n")
                    .append("FROM ").append(String.join(" \n", joins)).append(");");
        }
        log.debug("Generated SQL for {}", condition);
        return sql.toString();
    }

    /**
     * Session views followed by the statements of every condition in evaluation order.
     * References must have been resolved.
     */
    public List<String> collectionQueries(ConditionCollection collection) {
        List<String> statements = new ArrayList<>();
        statements.add(sessionViews(collection.getWindow()));
        for (Condition condition : collection.getEvaluationOrder()) {
            if (condition.isValid()) {
                statements.add(conditionQuery(condition,
                        collection.getReferenceTargets(condition.getIdString()), collection.getWindow()));
            }
        }
        return statements;
    }

    private static String comparison(Predicate predicate) {
        if (predicate.operator() == Operator.IN) {
            String items = predicate.listValues().stream()
                    .map(item -> PredicateParser.isNumeric(item) ? item : quote(item))
                    .collect(Collectors.joining(", "));
            return "seval IN (" + items + ")";
        }
        return "seval " + predicate.operator().symbol() + " " + predicate.normalizedValue();
    }

    /**
     * Station identifiers of the form {@code s1122} refer to numeric station ids.
     */
    private static String stationLiteral(String station) {
        Matcher matcher = NUMBERED_STATION.matcher(station);
        return matcher.matches() ? matcher.group(1) : quote(station);
    }

    private static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    private static String timestamp(Instant instant) {
        return "'" + instant + "'::timestamptz";
    }
}
