package com.gdin.inspection.cognify.storage.graph;

import com.gdin.inspection.cognify.config.properties.Neo4jProperties;
import com.gdin.inspection.cognify.exception.CognifyException;
import com.gdin.inspection.cognify.exception.TransientStoreException;
import com.gdin.inspection.cognify.models.EdgeKey;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Relationship;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Neo4j 图库。所有节点带 :DataPoint 标签并以 id 唯一，
 * 边统一用 :RELATES 关系类型，具体关系标签放在 relation 属性上。
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "gdin.ai.cognify.storage", name = "graph", havingValue = "neo4j")
public class Neo4jGraphStore implements GraphStore {

    private static final Pattern LABEL = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    @Resource
    private Neo4jProperties neo4jProperties;

    private Driver driver;

    @PostConstruct
    public void init() {
        log.info("Initializing Neo4j GraphStore at: {}", neo4jProperties.getUri());
        driver = GraphDatabase.driver(neo4jProperties.getUri(),
                AuthTokens.basic(neo4jProperties.getUsername(), neo4jProperties.getPassword()));
        createIndexes();
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j GraphStore connection closed");
        }
    }

    private void createIndexes() {
        try (Session session = session()) {
            session.run("CREATE CONSTRAINT data_point_id IF NOT EXISTS FOR (n:DataPoint) REQUIRE n.id IS UNIQUE");
            session.run("CREATE INDEX data_point_dataset IF NOT EXISTS FOR (n:DataPoint) ON (n.dataset_id)");
            session.run("CREATE INDEX data_point_name IF NOT EXISTS FOR (n:DataPoint) ON (n.normalized_name)");
        } catch (ServiceUnavailableException e) {
            log.warn("Neo4j 暂不可用，索引稍后再建: {}", e.getMessage());
        }
    }

    @Override
    public void upsertNode(GraphNode node) {
        if (!LABEL.matcher(node.getLabel()).matches()) {
            throw new CognifyException("非法的节点标签: " + node.getLabel());
        }
        Map<String, Object> props = new LinkedHashMap<>(node.getProperties());
        props.put("dataset_id", node.getDatasetId());
        String cypher = "MERGE (n:DataPoint {id: $id}) SET n += $props, n:" + node.getLabel();
        write(cypher, Map.of("id", node.getId(), "props", props), r -> null);
    }

    @Override
    public void upsertEdge(GraphEdge edge) {
        Map<String, Object> props = new LinkedHashMap<>(edge.getProperties());
        props.put("dataset_id", edge.getDatasetId());
        String cypher = """
                MATCH (a:DataPoint {id: $source}), (b:DataPoint {id: $target})
                MERGE (a)-[r:RELATES {relation: $relation}]->(b)
                SET r += $props
                RETURN count(r) AS written
                """;
        Long written = write(cypher,
                Map.of("source", edge.getSourceId(), "target", edge.getTargetId(), "relation", edge.getRelation(), "props", props),
                r -> r.isEmpty() ? 0L : r.get(0).get("written").asLong());
        if (written == null || written == 0L) {
            throw new CognifyException("边的端点不存在: " + edge.key());
        }
    }

    @Override
    public void deleteNodes(Collection<String> ids) {
        if (ids.isEmpty()) return;
        write("MATCH (n:DataPoint) WHERE n.id IN $ids DETACH DELETE n",
                Map.of("ids", new ArrayList<>(ids)), r -> null);
    }

    @Override
    public void deleteEdges(Collection<EdgeKey> keys) {
        for (EdgeKey key : keys) {
            write("""
                            MATCH (a:DataPoint {id: $source})-[r:RELATES {relation: $relation}]->(b:DataPoint {id: $target})
                            DELETE r
                            """,
                    Map.of("source", key.sourceId(), "target", key.targetId(), "relation", key.relation()),
                    r -> null);
        }
    }

    @Override
    public Optional<GraphNode> getNode(String id) {
        return getNodes(List.of(id)).stream().findFirst();
    }

    @Override
    public List<GraphNode> getNodes(Collection<String> ids) {
        if (ids.isEmpty()) return List.of();
        return read("MATCH (n:DataPoint) WHERE n.id IN $ids RETURN n",
                Map.of("ids", new ArrayList<>(ids)),
                records -> records.stream().map(r -> toNode(r.get("n").asNode())).toList());
    }

    @Override
    public List<GraphEdge> getEdges(Collection<EdgeKey> keys) {
        List<GraphEdge> out = new ArrayList<>();
        for (EdgeKey key : keys) {
            out.addAll(read("""
                            MATCH (a:DataPoint {id: $source})-[r:RELATES {relation: $relation}]->(b:DataPoint {id: $target})
                            RETURN a.id AS source, b.id AS target, r
                            """,
                    Map.of("source", key.sourceId(), "target", key.targetId(), "relation", key.relation()),
                    records -> records.stream().map(this::toEdge).toList()));
        }
        return out;
    }

    @Override
    public List<GraphNode> findNodesByName(String datasetId, Collection<String> normalizedNames) {
        if (normalizedNames.isEmpty()) return List.of();
        return read("MATCH (n:DataPoint) WHERE ($dataset IS NULL OR n.dataset_id = $dataset) AND n.normalized_name IN $names RETURN n",
                params("dataset", datasetId, "names", new ArrayList<>(normalizedNames)),
                records -> records.stream().map(r -> toNode(r.get("n").asNode())).toList());
    }

    @Override
    public List<GraphEdge> neighbors(Collection<String> nodeIds, String datasetId) {
        if (nodeIds.isEmpty()) return List.of();
        return read("""
                        MATCH (a:DataPoint)-[r:RELATES]->(b:DataPoint)
                        WHERE (a.id IN $ids OR b.id IN $ids) AND ($dataset IS NULL OR r.dataset_id = $dataset)
                        RETURN a.id AS source, b.id AS target, r
                        """,
                params("ids", new ArrayList<>(nodeIds), "dataset", datasetId),
                records -> records.stream().map(this::toEdge).toList());
    }

    @Override
    public int countNodes(String datasetId) {
        return read("MATCH (n:DataPoint) WHERE $dataset IS NULL OR n.dataset_id = $dataset RETURN count(n) AS c",
                params("dataset", datasetId), records -> records.get(0).get("c").asInt());
    }

    @Override
    public int countEdges(String datasetId) {
        return read("MATCH ()-[r:RELATES]->() WHERE $dataset IS NULL OR r.dataset_id = $dataset RETURN count(r) AS c",
                params("dataset", datasetId), records -> records.get(0).get("c").asInt());
    }

    private GraphNode toNode(Node n) {
        Map<String, Object> props = new LinkedHashMap<>(n.asMap());
        String id = (String) props.remove("id");
        String datasetId = (String) props.remove("dataset_id");
        String label = null;
        for (String l : n.labels()) {
            if (!"DataPoint".equals(l)) label = l;
        }
        return GraphNode.builder().id(id).datasetId(datasetId).label(label).properties(props).build();
    }

    private GraphEdge toEdge(Record record) {
        Relationship r = record.get("r").asRelationship();
        Map<String, Object> props = new LinkedHashMap<>(r.asMap());
        String relation = (String) props.remove("relation");
        String datasetId = (String) props.remove("dataset_id");
        return GraphEdge.builder()
                .sourceId(record.get("source").asString())
                .targetId(record.get("target").asString())
                .relation(relation)
                .datasetId(datasetId)
                .properties(props)
                .build();
    }

    private Session session() {
        return driver.session(SessionConfig.forDatabase(neo4jProperties.getDatabase()));
    }

    private <T> T write(String cypher, Map<String, Object> params, Function<List<Record>, T> mapper) {
        try (Session session = session()) {
            return session.executeWrite(tx -> mapper.apply(tx.run(cypher, params).list()));
        } catch (ServiceUnavailableException | SessionExpiredException | TransientException e) {
            throw new TransientStoreException("图库暂时不可用", e);
        }
    }

    private <T> T read(String cypher, Map<String, Object> params, Function<List<Record>, T> mapper) {
        try (Session session = session()) {
            return session.executeRead(tx -> mapper.apply(tx.run(cypher, params).list()));
        } catch (ServiceUnavailableException | SessionExpiredException | TransientException e) {
            throw new TransientStoreException("图库暂时不可用", e);
        }
    }

    /**
     * 允许 null 值的参数表。
     */
    private static Map<String, Object> params(Object... kv) {
        Map<String, Object> out = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            out.put((String) kv[i], kv[i + 1]);
        }
        return out;
    }
}
