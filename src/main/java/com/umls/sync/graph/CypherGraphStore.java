package com.umls.sync.graph;

import com.umls.sync.core.model.AssertionEdge;
import com.umls.sync.core.model.BiolinkCategory;
import com.umls.sync.core.model.Code;
import com.umls.sync.core.model.CodeMembership;
import com.umls.sync.core.model.Concept;
import com.umls.sync.core.model.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * {@link GraphStore} over a Cypher {@link GraphConnection}.
 *
 * <p>Graph layout:</p>
 * <pre>
 * (:Concept {cui, preferred_name, categories, last_seen_version})   plus one label per category
 * (:Code {code_id, sab, name, last_seen_version})
 * (:Concept)-[:HAS_CODE {last_seen_version}]-&gt;(:Code)
 * (:Concept)-[:`biolink:treats` {source_rela, asserted_by_sabs, last_seen_version}]-&gt;(:Concept)
 * (:UMLS_Meta {id: 'singleton', version})
 * </pre>
 *
 * <p>Relationship types and labels cannot be parameters, so writes are grouped per type (or per
 * category set) and each group is sent as one {@code UNWIND} statement.</p>
 */
public class CypherGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(CypherGraphStore.class);

    static final String META_ID = "singleton";

    private static final String PROVENANCE_UNION =
            "coalesce(r.asserted_by_sabs, []) + [x IN row.sabs WHERE NOT x IN coalesce(r.asserted_by_sabs, [])]";

    private final GraphConnection connection;

    public CypherGraphStore(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public void ensureConstraints() {
        log.info("constraints.ensuring graph={}", connection.getGraphName());
        safeExecute("CREATE INDEX FOR (c:Concept) ON (c.cui)");
        safeExecute("CREATE INDEX FOR (c:Code) ON (c.code_id)");
        safeExecute("CREATE INDEX FOR (m:UMLS_Meta) ON (m.id)");
        log.info("constraints.ensured graph={}", connection.getGraphName());
    }

    private void safeExecute(String query) {
        try {
            connection.execute(query);
        } catch (Exception e) {
            // Index might already exist
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public boolean conceptExists(String cui) {
        List<Map<String, Object>> results = connection.query("""
                MATCH (c:Concept {cui: $cui})
                RETURN count(c) as found
                """, Map.of("cui", cui));
        return extractCount(results, "found") > 0;
    }

    @Override
    public Optional<Concept> findConcept(String cui) {
        List<Map<String, Object>> results = connection.query("""
                MATCH (c:Concept {cui: $cui})
                RETURN c.cui as cui, c.preferred_name as name, c.categories as categories,
                       c.last_seen_version as version
                """, Map.of("cui", cui));
        if (results.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> row = results.get(0);
        Set<BiolinkCategory> categories = EnumSet.noneOf(BiolinkCategory.class);
        for (String curie : asStrings(row.get("categories"))) {
            BiolinkCategory.fromCurie(curie).ifPresent(categories::add);
        }
        Object name = row.get("name");
        return Optional.of(new Concept(cui, name != null ? name.toString() : "", categories,
                asString(row.get("version"))));
    }

    @Override
    public long deleteConcepts(List<String> cuis) {
        if (cuis.isEmpty()) {
            return 0;
        }
        List<Map<String, Object>> results = connection.query("""
                UNWIND $cuis AS cui
                MATCH (c:Concept {cui: cui})
                DETACH DELETE c
                RETURN count(c) as deleted
                """, Map.of("cuis", cuis));
        return extractCount(results, "deleted");
    }

    @Override
    public void upsertConcepts(List<Concept> concepts, String version) {
        InputSanitizer.validateVersion(version);
        Map<Set<BiolinkCategory>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Concept concept : concepts) {
            Map<String, Object> row = new HashMap<>();
            row.put("cui", concept.cui());
            row.put("name", concept.preferredName());
            row.put("categories", curies(concept.categories()));
            groups.computeIfAbsent(concept.categories(), k -> new ArrayList<>()).add(row);
        }
        for (Map.Entry<Set<BiolinkCategory>, List<Map<String, Object>>> group : groups.entrySet()) {
            connection.execute(conceptUpsertQuery(group.getKey()),
                    Map.of("rows", group.getValue(), "version", version));
        }
    }

    /**
     * Upsert statement for concepts sharing one category set: the set's labels are added and
     * every other known category label is removed.
     */
    static String conceptUpsertQuery(Set<BiolinkCategory> categories) {
        StringBuilder query = new StringBuilder("""
                UNWIND $rows AS row
                MERGE (c:Concept {cui: row.cui})
                SET c.preferred_name = row.name, c.categories = row.categories, c.last_seen_version = $version
                """);
        List<String> removed = new ArrayList<>();
        for (BiolinkCategory category : BiolinkCategory.values()) {
            if (!categories.contains(category)) {
                removed.add(label(category));
            }
        }
        if (!removed.isEmpty()) {
            query.append("REMOVE c").append(String.join("", removed)).append('\n');
        }
        if (!categories.isEmpty()) {
            query.append("SET c").append(categories.stream()
                    .map(CypherGraphStore::label)
                    .collect(Collectors.joining())).append('\n');
        }
        return query.toString();
    }

    private static String label(BiolinkCategory category) {
        InputSanitizer.validateLabel(category.curie());
        return ":`" + category.curie() + "`";
    }

    @Override
    public void upsertCodes(List<Code> codes, String version) {
        if (codes.isEmpty()) {
            return;
        }
        InputSanitizer.validateVersion(version);
        List<Map<String, Object>> rows = new ArrayList<>(codes.size());
        for (Code code : codes) {
            Map<String, Object> row = new HashMap<>();
            row.put("id", code.codeId());
            row.put("sab", code.source());
            row.put("name", code.name());
            rows.add(row);
        }
        connection.execute("""
                UNWIND $rows AS row
                MERGE (c:Code {code_id: row.id})
                SET c.sab = row.sab, c.name = row.name, c.last_seen_version = $version
                """, Map.of("rows", rows, "version", version));
    }

    @Override
    public void upsertMemberships(List<CodeMembership> memberships, String version) {
        if (memberships.isEmpty()) {
            return;
        }
        InputSanitizer.validateVersion(version);
        connection.execute("""
                UNWIND $rows AS row
                MATCH (c:Concept {cui: row.cui})
                MATCH (k:Code {code_id: row.code})
                MERGE (c)-[r:HAS_CODE]->(k)
                SET r.last_seen_version = $version
                """, Map.of("rows", membershipRows(memberships), "version", version));
    }

    @Override
    public void mergeMemberships(List<CodeMembership> memberships) {
        if (memberships.isEmpty()) {
            return;
        }
        connection.execute("""
                UNWIND $rows AS row
                MATCH (c:Concept {cui: row.cui})
                MATCH (k:Code {code_id: row.code})
                MERGE (c)-[r:HAS_CODE]->(k)
                SET r.last_seen_version = coalesce(r.last_seen_version, row.version)
                """, Map.of("rows", membershipRows(memberships)));
    }

    private static List<Map<String, Object>> membershipRows(List<CodeMembership> memberships) {
        List<Map<String, Object>> rows = new ArrayList<>(memberships.size());
        for (CodeMembership membership : memberships) {
            Map<String, Object> row = new HashMap<>();
            row.put("cui", membership.cui());
            row.put("code", membership.codeId());
            row.put("version", membership.lastSeenVersion());
            rows.add(row);
        }
        return rows;
    }

    @Override
    public void upsertAssertions(List<AssertionEdge> edges, String version) {
        InputSanitizer.validateVersion(version);
        for (Map.Entry<String, List<Map<String, Object>>> group : groupByType(edges).entrySet()) {
            connection.execute(assertionQuery(group.getKey(), "$version"),
                    Map.of("rows", group.getValue(), "version", version));
        }
    }

    @Override
    public void mergeAssertions(List<AssertionEdge> edges) {
        for (Map.Entry<String, List<Map<String, Object>>> group : groupByType(edges).entrySet()) {
            connection.execute(assertionQuery(group.getKey(), "coalesce(r.last_seen_version, row.version)"),
                    Map.of("rows", group.getValue()));
        }
    }

    static String assertionQuery(String type, String versionExpression) {
        InputSanitizer.validateRelationshipType(type);
        return """
                UNWIND $rows AS row
                MATCH (s:Concept {cui: row.source})
                MATCH (t:Concept {cui: row.target})
                MERGE (s)-[r:`%s` {source_rela: row.label}]->(t)
                SET r.asserted_by_sabs = %s, r.last_seen_version = %s
                """.formatted(type, PROVENANCE_UNION, versionExpression);
    }

    private static Map<String, List<Map<String, Object>>> groupByType(List<AssertionEdge> edges) {
        Map<String, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (AssertionEdge edge : edges) {
            Map<String, Object> row = new HashMap<>();
            row.put("source", edge.sourceCui());
            row.put("target", edge.targetCui());
            row.put("label", edge.relationLabel());
            row.put("sabs", new ArrayList<>(edge.assertedBy()));
            row.put("version", edge.lastSeenVersion());
            groups.computeIfAbsent(edge.predicate().typeName(), k -> new ArrayList<>()).add(row);
        }
        return groups;
    }

    @Override
    public List<CodeMembership> findMemberships(String cui) {
        List<Map<String, Object>> results = connection.query("""
                MATCH (c:Concept {cui: $cui})-[r:HAS_CODE]->(k:Code)
                RETURN k.code_id as code, r.last_seen_version as version
                """, Map.of("cui", cui));
        List<CodeMembership> memberships = new ArrayList<>(results.size());
        for (Map<String, Object> row : results) {
            memberships.add(new CodeMembership(cui, asString(row.get("code")), asString(row.get("version"))));
        }
        return memberships;
    }

    @Override
    public List<AssertionEdge> findAssertions(String cui) {
        List<Map<String, Object>> results = connection.query("""
                MATCH (s:Concept {cui: $cui})-[r]->(t:Concept)
                RETURN s.cui as source, t.cui as target, type(r) as type, r.source_rela as label,
                       r.asserted_by_sabs as sabs, r.last_seen_version as version
                UNION ALL
                MATCH (s:Concept)-[r]->(t:Concept {cui: $cui})
                WHERE s.cui <> $cui
                RETURN s.cui as source, t.cui as target, type(r) as type, r.source_rela as label,
                       r.asserted_by_sabs as sabs, r.last_seen_version as version
                """, Map.of("cui", cui));
        List<AssertionEdge> edges = new ArrayList<>(results.size());
        for (Map<String, Object> row : results) {
            String label = asString(row.get("label"));
            edges.add(new AssertionEdge(
                    asString(row.get("source")),
                    asString(row.get("target")),
                    label != null ? label : "",
                    Predicate.fromTypeName(asString(row.get("type"))),
                    new TreeSet<>(asStrings(row.get("sabs"))),
                    asString(row.get("version"))));
        }
        return edges;
    }

    @Override
    public long deleteStaleAssertions(String version, int batchSize) {
        return deleteBatch("""
                MATCH (:Concept)-[r]->(:Concept)
                WHERE r.last_seen_version IS NULL OR r.last_seen_version <> $version
                WITH r LIMIT $batchSize
                DELETE r
                RETURN count(r) as deleted
                """, version, batchSize);
    }

    @Override
    public long deleteStaleMemberships(String version, int batchSize) {
        return deleteBatch("""
                MATCH (:Concept)-[r:HAS_CODE]->(:Code)
                WHERE r.last_seen_version IS NULL OR r.last_seen_version <> $version
                WITH r LIMIT $batchSize
                DELETE r
                RETURN count(r) as deleted
                """, version, batchSize);
    }

    @Override
    public long deleteStaleCodes(String version, int batchSize) {
        return deleteBatch("""
                MATCH (c:Code)
                WHERE c.last_seen_version IS NULL OR c.last_seen_version <> $version
                WITH c LIMIT $batchSize
                DETACH DELETE c
                RETURN count(c) as deleted
                """, version, batchSize);
    }

    private long deleteBatch(String query, String version, int batchSize) {
        InputSanitizer.validateVersion(version);
        List<Map<String, Object>> results = connection.query(query, Map.of(
                "version", version,
                "batchSize", batchSize
        ));
        return extractCount(results, "deleted");
    }

    @Override
    public Optional<String> currentVersion() {
        List<Map<String, Object>> results = connection.query("""
                MATCH (m:UMLS_Meta {id: $id})
                RETURN m.version as version
                """, Map.of("id", META_ID));
        if (results.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(asString(results.get(0).get("version")));
    }

    @Override
    public void commitVersion(String version) {
        InputSanitizer.validateVersion(version);
        connection.execute("""
                MERGE (m:UMLS_Meta {id: $id})
                SET m.version = $version
                """, Map.of("id", META_ID, "version", version));
        log.info("version.committed graph={} version={}", connection.getGraphName(), version);
    }

    @Override
    public GraphStats stats() {
        long concepts = count("MATCH (c:Concept) RETURN count(c) as total");
        long codes = count("MATCH (c:Code) RETURN count(c) as total");
        long memberships = count("MATCH (:Concept)-[r:HAS_CODE]->(:Code) RETURN count(r) as total");
        long assertions = count("MATCH (:Concept)-[r]->(:Concept) RETURN count(r) as total");
        return new GraphStats(concepts, codes, memberships, assertions);
    }

    private long count(String query) {
        return extractCount(connection.query(query), "total");
    }

    @Override
    public void close() {
        connection.close();
    }

    private static List<String> curies(Collection<BiolinkCategory> categories) {
        List<String> curies = new ArrayList<>(categories.size());
        for (BiolinkCategory category : categories) {
            curies.add(category.curie());
        }
        return curies;
    }

    private static long extractCount(List<Map<String, Object>> results, String column) {
        if (results.isEmpty()) return 0;
        Object value = results.get(0).get(column);
        if (value instanceof Number) return ((Number) value).longValue();
        return 0;
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    private static List<String> asStrings(Object value) {
        List<String> strings = new ArrayList<>();
        if (value instanceof Collection<?>) {
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    strings.add(item.toString());
                }
            }
        }
        return strings;
    }
}
