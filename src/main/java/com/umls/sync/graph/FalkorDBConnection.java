package com.umls.sync.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FalkorDB implementation using the JFalkorDB client.
 *
 * <p>Parameters are rendered into the query text as Cypher literals. Strings, numbers,
 * booleans, lists and maps (with identifier keys) are supported, nested to any depth.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final Pattern PARAMETER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern MAP_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized for graph: {}", graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = render(query, params);
        if (log.isTraceEnabled()) {
            log.trace("Executing: {}", processedQuery);
        }
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = render(query, params);
        if (log.isTraceEnabled()) {
            log.trace("Querying: {}", processedQuery);
        }

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }

        log.debug("Query returned {} results", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    /**
     * Substitutes every {@code $name} placeholder that has a parameter with its literal.
     * Placeholders without a parameter are left untouched.
     */
    static String render(String query, Map<String, Object> params) {
        if (params.isEmpty()) {
            return query;
        }
        Matcher matcher = PARAMETER.matcher(query);
        StringBuilder result = new StringBuilder(query.length() + 64);
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name)
                    ? formatValue(params.get(name))
                    : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return quote((String) value);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?>) {
            StringBuilder sb = new StringBuilder("[");
            Iterator<?> it = ((Collection<?>) value).iterator();
            while (it.hasNext()) {
                sb.append(formatValue(it.next()));
                if (it.hasNext()) {
                    sb.append(", ");
                }
            }
            return sb.append(']').toString();
        }
        if (value instanceof Map<?, ?>) {
            StringBuilder sb = new StringBuilder("{");
            Iterator<? extends Map.Entry<?, ?>> it = ((Map<?, ?>) value).entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> entry = it.next();
                String key = String.valueOf(entry.getKey());
                if (!MAP_KEY.matcher(key).matches()) {
                    throw new IllegalArgumentException("Map parameter key is not an identifier: " + key);
                }
                sb.append(key).append(": ").append(formatValue(entry.getValue()));
                if (it.hasNext()) {
                    sb.append(", ");
                }
            }
            return sb.append('}').toString();
        }
        return quote(value.toString());
    }

    private static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        if (driver != null) {
            try {
                driver.close();
            } catch (Exception e) {
                log.warn("Error closing FalkorDB connection", e);
            }
        }
        log.info("FalkorDB connection closed");
    }
}
