package com.gdin.inspection.cognify.storage.relational;

import com.gdin.inspection.cognify.models.DataItemStatus;
import com.gdin.inspection.cognify.models.DataPoint;
import com.gdin.inspection.cognify.models.DataPointType;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.PipelineRun;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 关系库：数据点元数据、边的 provenance、文档处理状态与 pipeline run 记录。
 * <p>
 * 三库写入时它总是第一个被写，是同步进度的权威记录。
 */
public interface RelationalStore {

    /**
     * 在一个事务内 upsert 数据点行。指纹未变化的行保持原样（包括同步标记）。
     */
    List<RowSyncState> upsertRows(List<? extends DataPoint> dataPoints);

    /**
     * 在一个事务内 upsert 边，provenance 与已存在的集合取并集。
     */
    List<EdgeSyncState> upsertEdges(List<Edge> edges);

    /**
     * 仅当行的指纹仍等于 state 中的指纹时才置位，避免覆盖并发写入的新版本。
     */
    void markVectorSynced(List<RowSyncState> states);

    void markGraphSynced(List<RowSyncState> states);

    void markEdgesGraphSynced(List<EdgeSyncState> states);

    Optional<String> findFingerprint(String id);

    /**
     * 已提交的实体行，按 id 返回。不存在或不是实体的 id 不出现在结果中。
     */
    Map<String, GraphEntity> findEntities(Collection<String> ids);

    Set<String> findProvenance(String edgeId);

    /**
     * 用给定集合整体替换边的 provenance（不取并集），同步标记重置。删除文档时使用。
     */
    List<EdgeSyncState> replaceEdgeProvenance(List<Edge> edges);

    void deleteRows(Collection<String> ids);

    void deleteEdges(Collection<String> edgeIds);

    int countRows(String datasetId, DataPointType type);

    int countEdges(String datasetId);

    Optional<DataItemStatus> findDataItemStatus(String documentId, String pipelineName, String datasetId);

    void saveDataItemStatus(String documentId, String pipelineName, String datasetId, DataItemStatus status);

    /**
     * 删除文档在所有 pipeline 下的处理状态。
     */
    void deleteDataItemStatus(String documentId, String datasetId);

    void savePipelineRun(PipelineRun run);

    Optional<PipelineRun> findPipelineRun(String runId);

    List<PipelineRun> listPipelineRuns(String datasetId);
}
