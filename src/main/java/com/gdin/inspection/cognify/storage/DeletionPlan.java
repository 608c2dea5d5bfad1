package com.gdin.inspection.cognify.storage;

import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.GraphEntity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * 删除一个文档时需要在三库中做的改动。
 */
@Value
@Builder
public class DeletionPlan {

    String datasetId;

    String documentId;

    @Singular
    List<String> chunkIds;

    @Singular
    List<String> summaryIds;

    /** 不再被任何分片引用的实体 */
    @Singular
    List<String> entityIds;

    /** 不再被任何实体 is_a 的类型 */
    @Singular
    List<String> entityTypeIds;

    /** 整体删除的边 */
    @Singular
    List<Edge> deletedEdges;

    /** 去掉被删分片后 provenance 仍非空的边，provenance 已是删除后的集合 */
    @Singular
    List<Edge> trimmedEdges;

    /** 关系列表有变化、需要重写的存活实体 */
    @Singular
    List<GraphEntity> rewrittenEntities;

    /**
     * 整体删除的节点，依次为摘要、分片、文档、实体、类型。
     */
    public List<String> nodeIds() {
        List<String> out = new ArrayList<>(summaryIds);
        out.addAll(chunkIds);
        out.add(documentId);
        out.addAll(entityIds);
        out.addAll(entityTypeIds);
        return out;
    }
}
