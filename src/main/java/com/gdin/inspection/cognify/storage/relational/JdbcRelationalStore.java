package com.gdin.inspection.cognify.storage.relational;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gdin.inspection.cognify.exception.CognifyException;
import com.gdin.inspection.cognify.exception.TransientStoreException;
import com.gdin.inspection.cognify.models.DataItemStatus;
import com.gdin.inspection.cognify.models.DataPoint;
import com.gdin.inspection.cognify.models.DataPointType;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.PipelineRun;
import com.gdin.inspection.cognify.util.IOUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 基于 JdbcTemplate 的关系库实现，表结构见 schema.sql。
 * 采用先查后改的 upsert，兼容 H2 与 PostgreSQL。
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "gdin.ai.cognify.storage", name = "relational", havingValue = "jdbc")
public class JdbcRelationalStore implements RelationalStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcRelationalStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public List<RowSyncState> upsertRows(List<? extends DataPoint> dataPoints) {
        return translate("upsertRows", () -> transactionTemplate.execute(status -> {
            List<RowSyncState> out = new ArrayList<>(dataPoints.size());
            for (DataPoint dp : dataPoints) {
                out.add(upsertRow(dp));
            }
            return out;
        }));
    }

    private RowSyncState upsertRow(DataPoint dp) {
        String fp = dp.fingerprint();
        List<RowSyncState> existing = jdbcTemplate.query(
                "SELECT fingerprint, vector_synced, graph_synced FROM cognify_data_point WHERE id = ?",
                (rs, i) -> RowSyncState.builder()
                        .id(dp.getId())
                        .fingerprint(rs.getString("fingerprint"))
                        .vectorSynced(rs.getBoolean("vector_synced"))
                        .graphSynced(rs.getBoolean("graph_synced"))
                        .changed(false)
                        .build(),
                dp.getId());
        if (!existing.isEmpty() && fp.equals(existing.get(0).getFingerprint())) {
            return existing.get(0);
        }
        Timestamp now = Timestamp.from(Instant.now());
        String payload = toJson(dp);
        if (existing.isEmpty()) {
            jdbcTemplate.update("INSERT INTO cognify_data_point (id, dataset_id, type, fingerprint, payload, vector_synced, graph_synced, updated_at) "
                            + "VALUES (?, ?, ?, ?, ?, FALSE, FALSE, ?)",
                    dp.getId(), dp.getDatasetId(), dp.getType().name(), fp, payload, now);
        } else {
            jdbcTemplate.update("UPDATE cognify_data_point SET dataset_id = ?, type = ?, fingerprint = ?, payload = ?, "
                            + "vector_synced = FALSE, graph_synced = FALSE, updated_at = ? WHERE id = ?",
                    dp.getDatasetId(), dp.getType().name(), fp, payload, now, dp.getId());
        }
        return RowSyncState.builder().id(dp.getId()).fingerprint(fp).changed(true).build();
    }

    @Override
    public List<EdgeSyncState> upsertEdges(List<Edge> edges) {
        return translate("upsertEdges", () -> transactionTemplate.execute(status -> {
            List<EdgeSyncState> out = new ArrayList<>(edges.size());
            for (Edge edge : edges) {
                out.add(upsertEdge(edge));
            }
            return out;
        }));
    }

    private EdgeSyncState upsertEdge(Edge edge) {
        List<Object[]> existing = jdbcTemplate.query(
                "SELECT provenance, fingerprint, graph_synced FROM cognify_edge WHERE id = ?",
                (rs, i) -> new Object[]{rs.getString("provenance"), rs.getString("fingerprint"), rs.getBoolean("graph_synced")},
                edge.getId());
        Set<String> merged = existing.isEmpty() ? new LinkedHashSet<>() : IOUtil.parseStringSet((String) existing.get(0)[0]);
        int before = merged.size();
        merged.addAll(edge.getProvenance());
        String fp = EdgeFingerprints.of(edge.key(), merged);
        boolean changed = existing.isEmpty() || !fp.equals(existing.get(0)[1]);
        boolean graphSynced = !changed && (Boolean) existing.get(0)[2];
        if (changed) {
            Timestamp now = Timestamp.from(Instant.now());
            String provenance = toJson(merged);
            if (existing.isEmpty()) {
                jdbcTemplate.update("INSERT INTO cognify_edge (id, dataset_id, source_id, relation, target_id, provenance, fingerprint, graph_synced, updated_at) "
                                + "VALUES (?, ?, ?, ?, ?, ?, ?, FALSE, ?)",
                        edge.getId(), edge.getDatasetId(), edge.getSourceId(), edge.getRelation(), edge.getTargetId(), provenance, fp, now);
            } else {
                jdbcTemplate.update("UPDATE cognify_edge SET provenance = ?, fingerprint = ?, graph_synced = FALSE, updated_at = ? WHERE id = ?",
                        provenance, fp, now, edge.getId());
            }
        }
        return EdgeSyncState.builder()
                .id(edge.getId())
                .key(edge.key())
                .fingerprint(fp)
                .provenance(merged)
                .changed(changed)
                .graphSynced(graphSynced)
                .provenanceAdded(merged.size() - before)
                .build();
    }

    @Override
    public void markVectorSynced(List<RowSyncState> states) {
        if (states.isEmpty()) return;
        translate("markVectorSynced", () -> jdbcTemplate.batchUpdate(
                "UPDATE cognify_data_point SET vector_synced = TRUE WHERE id = ? AND fingerprint = ?",
                states.stream().map(s -> new Object[]{s.getId(), s.getFingerprint()}).toList()));
    }

    @Override
    public void markGraphSynced(List<RowSyncState> states) {
        if (states.isEmpty()) return;
        translate("markGraphSynced", () -> jdbcTemplate.batchUpdate(
                "UPDATE cognify_data_point SET graph_synced = TRUE WHERE id = ? AND fingerprint = ?",
                states.stream().map(s -> new Object[]{s.getId(), s.getFingerprint()}).toList()));
    }

    @Override
    public void markEdgesGraphSynced(List<EdgeSyncState> states) {
        if (states.isEmpty()) return;
        translate("markEdgesGraphSynced", () -> jdbcTemplate.batchUpdate(
                "UPDATE cognify_edge SET graph_synced = TRUE WHERE id = ? AND fingerprint = ?",
                states.stream().map(s -> new Object[]{s.getId(), s.getFingerprint()}).toList()));
    }

    @Override
    public Optional<String> findFingerprint(String id) {
        return translate("findFingerprint", () -> jdbcTemplate.queryForList(
                "SELECT fingerprint FROM cognify_data_point WHERE id = ?", String.class, id)
                .stream().findFirst());
    }

    @Override
    public Map<String, GraphEntity> findEntities(Collection<String> ids) {
        Map<String, GraphEntity> out = new LinkedHashMap<>();
        if (ids.isEmpty()) return out;
        List<String> distinct = ids.stream().distinct().toList();
        String placeholders = String.join(", ", Collections.nCopies(distinct.size(), "?"));
        List<Object> args = new ArrayList<>(distinct);
        args.add(DataPointType.ENTITY.name());
        translate("findEntities", () -> {
            jdbcTemplate.query("SELECT id, payload FROM cognify_data_point WHERE id IN (" + placeholders + ") AND type = ?",
                    rs -> {
                        out.put(rs.getString("id"), toEntity(rs.getString("payload")));
                    },
                    args.toArray());
            return null;
        });
        return out;
    }

    @Override
    public List<EdgeSyncState> replaceEdgeProvenance(List<Edge> edges) {
        return translate("replaceEdgeProvenance", () -> transactionTemplate.execute(status -> {
            List<EdgeSyncState> out = new ArrayList<>(edges.size());
            Timestamp now = Timestamp.from(Instant.now());
            for (Edge edge : edges) {
                Set<String> provenance = new LinkedHashSet<>(edge.getProvenance());
                String fp = EdgeFingerprints.of(edge.key(), provenance);
                int updated = jdbcTemplate.update(
                        "UPDATE cognify_edge SET provenance = ?, fingerprint = ?, graph_synced = FALSE, updated_at = ? WHERE id = ?",
                        toJson(provenance), fp, now, edge.getId());
                if (updated == 0) continue;
                out.add(EdgeSyncState.builder()
                        .id(edge.getId())
                        .key(edge.key())
                        .fingerprint(fp)
                        .provenance(provenance)
                        .changed(true)
                        .graphSynced(false)
                        .build());
            }
            return out;
        }));
    }

    @Override
    public void deleteRows(Collection<String> ids) {
        if (ids.isEmpty()) return;
        translate("deleteRows", () -> jdbcTemplate.batchUpdate(
                "DELETE FROM cognify_data_point WHERE id = ?",
                ids.stream().map(id -> new Object[]{id}).toList()));
    }

    @Override
    public void deleteEdges(Collection<String> edgeIds) {
        if (edgeIds.isEmpty()) return;
        translate("deleteEdges", () -> jdbcTemplate.batchUpdate(
                "DELETE FROM cognify_edge WHERE id = ?",
                edgeIds.stream().map(id -> new Object[]{id}).toList()));
    }

    @Override
    public Set<String> findProvenance(String edgeId) {
        return translate("findProvenance", () -> jdbcTemplate.queryForList(
                        "SELECT provenance FROM cognify_edge WHERE id = ?", String.class, edgeId)
                .stream().findFirst()
                .map(IOUtil::parseStringSet)
                .orElseGet(LinkedHashSet::new));
    }

    @Override
    public int countRows(String datasetId, DataPointType type) {
        Integer n = translate("countRows", () -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM cognify_data_point WHERE dataset_id = ? AND type = ?", Integer.class, datasetId, type.name()));
        return n == null ? 0 : n;
    }

    @Override
    public int countEdges(String datasetId) {
        Integer n = translate("countEdges", () -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM cognify_edge WHERE dataset_id = ?", Integer.class, datasetId));
        return n == null ? 0 : n;
    }

    @Override
    public Optional<DataItemStatus> findDataItemStatus(String documentId, String pipelineName, String datasetId) {
        return translate("findDataItemStatus", () -> jdbcTemplate.queryForList(
                        "SELECT status FROM cognify_data_item_status WHERE document_id = ? AND pipeline_name = ? AND dataset_id = ?",
                        String.class, documentId, pipelineName, datasetId)
                .stream().findFirst()
                .map(DataItemStatus::valueOf));
    }

    @Override
    public void saveDataItemStatus(String documentId, String pipelineName, String datasetId, DataItemStatus status) {
        translate("saveDataItemStatus", () -> transactionTemplate.execute(tx -> {
            Timestamp now = Timestamp.from(Instant.now());
            int updated = jdbcTemplate.update(
                    "UPDATE cognify_data_item_status SET status = ?, updated_at = ? WHERE document_id = ? AND pipeline_name = ? AND dataset_id = ?",
                    status.name(), now, documentId, pipelineName, datasetId);
            if (updated == 0) {
                jdbcTemplate.update("INSERT INTO cognify_data_item_status (document_id, pipeline_name, dataset_id, status, updated_at) VALUES (?, ?, ?, ?, ?)",
                        documentId, pipelineName, datasetId, status.name(), now);
            }
            return updated;
        }));
    }

    @Override
    public void deleteDataItemStatus(String documentId, String datasetId) {
        translate("deleteDataItemStatus", () -> jdbcTemplate.update(
                "DELETE FROM cognify_data_item_status WHERE document_id = ? AND dataset_id = ?", documentId, datasetId));
    }

    @Override
    public void savePipelineRun(PipelineRun run) {
        PipelineRun snapshot = run.snapshot();
        String payload = toJson(snapshot);
        translate("savePipelineRun", () -> transactionTemplate.execute(tx -> {
            Timestamp now = Timestamp.from(Instant.now());
            int updated = jdbcTemplate.update(
                    "UPDATE cognify_pipeline_run SET status = ?, payload = ?, updated_at = ? WHERE id = ?",
                    snapshot.getStatus().name(), payload, now, snapshot.getId());
            if (updated == 0) {
                jdbcTemplate.update("INSERT INTO cognify_pipeline_run (id, dataset_id, pipeline_name, status, payload, created_at, updated_at) "
                                + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                        snapshot.getId(), snapshot.getDatasetId(), snapshot.getPipelineName(), snapshot.getStatus().name(),
                        payload, Timestamp.from(snapshot.getCreatedAt()), now);
            }
            return updated;
        }));
    }

    @Override
    public Optional<PipelineRun> findPipelineRun(String runId) {
        return translate("findPipelineRun", () -> jdbcTemplate.queryForList(
                        "SELECT payload FROM cognify_pipeline_run WHERE id = ?", String.class, runId)
                .stream().findFirst()
                .map(this::toRun));
    }

    @Override
    public List<PipelineRun> listPipelineRuns(String datasetId) {
        return translate("listPipelineRuns", () -> {
            List<String> payloads = datasetId == null
                    ? jdbcTemplate.queryForList("SELECT payload FROM cognify_pipeline_run ORDER BY created_at", String.class)
                    : jdbcTemplate.queryForList("SELECT payload FROM cognify_pipeline_run WHERE dataset_id = ? ORDER BY created_at", String.class, datasetId);
            return payloads.stream().map(this::toRun).toList();
        });
    }

    private PipelineRun toRun(String payload) {
        try {
            return IOUtil.jsonDeserializeWithNoType(payload, PipelineRun.class);
        } catch (JsonProcessingException e) {
            throw new CognifyException("pipeline run 反序列化失败", e);
        }
    }

    private GraphEntity toEntity(String payload) {
        try {
            return IOUtil.jsonDeserializeWithNoType(payload, GraphEntity.class);
        } catch (JsonProcessingException e) {
            throw new CognifyException("实体行反序列化失败", e);
        }
    }

    private static String toJson(Object o) {
        try {
            return IOUtil.jsonSerializeWithNoType(o);
        } catch (JsonProcessingException e) {
            throw new CognifyException("序列化失败: " + o.getClass().getSimpleName(), e);
        }
    }

    /**
     * 连接类、超时类错误转成可重试异常，其余原样抛出。
     */
    private <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException | DataAccessResourceFailureException e) {
            log.warn("关系库 {} 暂时失败: {}", operation, e.getMessage());
            throw new TransientStoreException("关系库暂时不可用: " + operation, e);
        }
    }
}
