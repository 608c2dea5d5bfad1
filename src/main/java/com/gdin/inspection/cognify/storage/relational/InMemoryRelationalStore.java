package com.gdin.inspection.cognify.storage.relational;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gdin.inspection.cognify.exception.CognifyException;
import com.gdin.inspection.cognify.models.DataItemStatus;
import com.gdin.inspection.cognify.models.DataPoint;
import com.gdin.inspection.cognify.models.DataPointType;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.PipelineRun;
import com.gdin.inspection.cognify.util.IOUtil;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 进程内关系库，所有方法在同一把锁下执行，一次调用即一个事务。
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "gdin.ai.cognify.storage", name = "relational", havingValue = "memory", matchIfMissing = true)
public class InMemoryRelationalStore implements RelationalStore {

    @AllArgsConstructor
    private static class Row {
        String datasetId;
        DataPointType type;
        String fingerprint;
        /** 实体行保留 JSON 快照，其它类型为 null */
        String payload;
        boolean vectorSynced;
        boolean graphSynced;
    }

    @AllArgsConstructor
    private static class EdgeRow {
        String datasetId;
        Set<String> provenance;
        String fingerprint;
        boolean graphSynced;
    }

    private final Map<String, Row> rows = new HashMap<>();
    private final Map<String, EdgeRow> edges = new HashMap<>();
    private final Map<String, DataItemStatus> itemStatus = new HashMap<>();
    private final Map<String, PipelineRun> runs = new LinkedHashMap<>();

    @Override
    public synchronized List<RowSyncState> upsertRows(List<? extends DataPoint> dataPoints) {
        List<RowSyncState> out = new ArrayList<>(dataPoints.size());
        for (DataPoint dp : dataPoints) {
            String fp = dp.fingerprint();
            Row row = rows.get(dp.getId());
            if (row != null && fp.equals(row.fingerprint)) {
                out.add(state(dp.getId(), row, false));
                continue;
            }
            Row fresh = new Row(dp.getDatasetId(), dp.getType(), fp, payloadOf(dp), false, false);
            rows.put(dp.getId(), fresh);
            out.add(state(dp.getId(), fresh, true));
        }
        return out;
    }

    @Override
    public synchronized List<EdgeSyncState> upsertEdges(List<Edge> input) {
        List<EdgeSyncState> out = new ArrayList<>(input.size());
        for (Edge edge : input) {
            EdgeRow row = edges.get(edge.getId());
            Set<String> merged = new LinkedHashSet<>(row == null ? Set.of() : row.provenance);
            int before = merged.size();
            merged.addAll(edge.getProvenance());
            String fp = EdgeFingerprints.of(edge.key(), merged);
            boolean changed = row == null || !fp.equals(row.fingerprint);
            if (changed) {
                row = new EdgeRow(edge.getDatasetId(), merged, fp, false);
                edges.put(edge.getId(), row);
            }
            out.add(EdgeSyncState.builder()
                    .id(edge.getId())
                    .key(edge.key())
                    .fingerprint(fp)
                    .provenance(new LinkedHashSet<>(merged))
                    .changed(changed)
                    .graphSynced(row.graphSynced)
                    .provenanceAdded(merged.size() - before)
                    .build());
        }
        return out;
    }

    @Override
    public synchronized void markVectorSynced(List<RowSyncState> states) {
        for (RowSyncState s : states) {
            Row row = rows.get(s.getId());
            if (row != null && row.fingerprint.equals(s.getFingerprint())) row.vectorSynced = true;
        }
    }

    @Override
    public synchronized void markGraphSynced(List<RowSyncState> states) {
        for (RowSyncState s : states) {
            Row row = rows.get(s.getId());
            if (row != null && row.fingerprint.equals(s.getFingerprint())) row.graphSynced = true;
        }
    }

    @Override
    public synchronized void markEdgesGraphSynced(List<EdgeSyncState> states) {
        for (EdgeSyncState s : states) {
            EdgeRow row = edges.get(s.getId());
            if (row != null && row.fingerprint.equals(s.getFingerprint())) row.graphSynced = true;
        }
    }

    @Override
    public synchronized Optional<String> findFingerprint(String id) {
        return Optional.ofNullable(rows.get(id)).map(r -> r.fingerprint);
    }

    @Override
    public synchronized Map<String, GraphEntity> findEntities(Collection<String> ids) {
        Map<String, GraphEntity> out = new LinkedHashMap<>();
        for (String id : ids) {
            Row row = rows.get(id);
            if (row == null || row.payload == null) continue;
            try {
                out.put(id, IOUtil.jsonDeserializeWithNoType(row.payload, GraphEntity.class));
            } catch (JsonProcessingException e) {
                throw new CognifyException("实体行反序列化失败: " + id, e);
            }
        }
        return out;
    }

    @Override
    public synchronized List<EdgeSyncState> replaceEdgeProvenance(List<Edge> input) {
        List<EdgeSyncState> out = new ArrayList<>(input.size());
        for (Edge edge : input) {
            EdgeRow row = edges.get(edge.getId());
            if (row == null) continue;
            Set<String> provenance = new LinkedHashSet<>(edge.getProvenance());
            String fp = EdgeFingerprints.of(edge.key(), provenance);
            edges.put(edge.getId(), new EdgeRow(row.datasetId, provenance, fp, false));
            out.add(EdgeSyncState.builder()
                    .id(edge.getId())
                    .key(edge.key())
                    .fingerprint(fp)
                    .provenance(new LinkedHashSet<>(provenance))
                    .changed(true)
                    .graphSynced(false)
                    .build());
        }
        return out;
    }

    @Override
    public synchronized void deleteRows(Collection<String> ids) {
        ids.forEach(rows::remove);
    }

    @Override
    public synchronized void deleteEdges(Collection<String> edgeIds) {
        edgeIds.forEach(edges::remove);
    }

    @Override
    public synchronized Set<String> findProvenance(String edgeId) {
        EdgeRow row = edges.get(edgeId);
        return row == null ? Set.of() : new LinkedHashSet<>(row.provenance);
    }

    @Override
    public synchronized int countRows(String datasetId, DataPointType type) {
        return (int) rows.values().stream()
                .filter(r -> r.datasetId.equals(datasetId) && r.type == type)
                .count();
    }

    @Override
    public synchronized int countEdges(String datasetId) {
        return (int) edges.values().stream().filter(e -> e.datasetId.equals(datasetId)).count();
    }

    @Override
    public synchronized Optional<DataItemStatus> findDataItemStatus(String documentId, String pipelineName, String datasetId) {
        return Optional.ofNullable(itemStatus.get(itemKey(documentId, pipelineName, datasetId)));
    }

    @Override
    public synchronized void saveDataItemStatus(String documentId, String pipelineName, String datasetId, DataItemStatus status) {
        itemStatus.put(itemKey(documentId, pipelineName, datasetId), status);
    }

    @Override
    public synchronized void deleteDataItemStatus(String documentId, String datasetId) {
        itemStatus.keySet().removeIf(k -> k.startsWith(datasetId + "|") && k.endsWith("|" + documentId));
    }

    @Override
    public synchronized void savePipelineRun(PipelineRun run) {
        runs.put(run.getId(), run.snapshot());
    }

    @Override
    public synchronized Optional<PipelineRun> findPipelineRun(String runId) {
        return Optional.ofNullable(runs.get(runId)).map(PipelineRun::snapshot);
    }

    @Override
    public synchronized List<PipelineRun> listPipelineRuns(String datasetId) {
        return runs.values().stream()
                .filter(r -> datasetId == null || datasetId.equals(r.getDatasetId()))
                .sorted(Comparator.comparing(PipelineRun::getCreatedAt))
                .map(PipelineRun::snapshot)
                .toList();
    }

    private static RowSyncState state(String id, Row row, boolean changed) {
        return RowSyncState.builder()
                .id(id)
                .fingerprint(row.fingerprint)
                .changed(changed)
                .vectorSynced(row.vectorSynced)
                .graphSynced(row.graphSynced)
                .build();
    }

    private static String payloadOf(DataPoint dp) {
        if (!(dp instanceof GraphEntity)) return null;
        try {
            return IOUtil.jsonSerializeWithNoType(dp);
        } catch (JsonProcessingException e) {
            throw new CognifyException("实体行序列化失败: " + dp.getId(), e);
        }
    }

    private static String itemKey(String documentId, String pipelineName, String datasetId) {
        return datasetId + "|" + pipelineName + "|" + documentId;
    }
}
