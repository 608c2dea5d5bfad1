package com.gdin.inspection.cognify.index.workflows;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.index.classify.DocumentClassifier;
import com.gdin.inspection.cognify.models.DataItemStatus;
import com.gdin.inspection.cognify.models.Document;
import com.gdin.inspection.cognify.models.PipelineRun;
import com.gdin.inspection.cognify.models.RawDocument;
import com.gdin.inspection.cognify.storage.relational.RelationalStore;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * classify_documents：原始文档 → {@link Document}。
 * 同一批中内容相同的文档只保留一份；开启增量加载时，已在本 pipeline 上完成的文档直接跳过。
 */
@Slf4j
@Service
public class ClassifyDocumentsWorkflow {

    @Resource
    private DocumentClassifier documentClassifier;

    @Resource
    private RelationalStore relationalStore;

    @Resource
    private CognifyProperties cognifyProperties;

    public List<Document> run(List<RawDocument> rawDocuments, PipelineRun run) {
        if (CollectionUtil.isEmpty(rawDocuments)) {
            log.info("run {} 没有待处理的文档", run.getId());
            return new ArrayList<>();
        }
        boolean incremental = Boolean.TRUE.equals(cognifyProperties.getPipeline().getIncrementalLoading());

        Map<String, Document> byId = new LinkedHashMap<>();
        for (RawDocument raw : rawDocuments) {
            Document doc = documentClassifier.classify(raw, run.getDatasetId());
            byId.putIfAbsent(doc.getId(), doc);
        }

        List<Document> pending = new ArrayList<>();
        int skipped = 0;
        for (Document doc : byId.values()) {
            if (incremental) {
                Optional<DataItemStatus> status = relationalStore.findDataItemStatus(
                        doc.getId(), run.getPipelineName(), run.getDatasetId());
                if (status.isPresent() && status.get() == DataItemStatus.COMPLETED) {
                    log.debug("文档已处理，跳过: id={}, name={}", doc.getId(), doc.getName());
                    skipped++;
                    continue;
                }
            }
            relationalStore.saveDataItemStatus(doc.getId(), run.getPipelineName(), run.getDatasetId(), DataItemStatus.PROCESSING);
            pending.add(doc);
        }

        run.setTotalUnits(byId.size());
        run.setAlreadyCompletedUnits(skipped);
        log.info("run {} 文档分类完成: 共 {} 个，待处理 {} 个，已完成跳过 {} 个",
                run.getId(), byId.size(), pending.size(), skipped);
        return pending;
    }
}
