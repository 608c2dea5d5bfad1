package com.gdin.inspection.cognify.controller;

import cn.hutool.core.codec.Base64;
import com.gdin.inspection.cognify.index.run.CognifyIndexRunner;
import com.gdin.inspection.cognify.models.PipelineRun;
import com.gdin.inspection.cognify.models.RawDocument;
import com.gdin.inspection.cognify.req.CognifyRunReq;
import com.gdin.inspection.cognify.req.DocumentReq;
import com.gdin.inspection.cognify.resp.ResultData;
import com.gdin.inspection.cognify.storage.DeletionReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.annotation.Resource;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/cognify")
@Tag(name = "认知化", description = "提交数据集、查询与取消 run、删除文档")
public class CognifyController {

    @Resource
    private CognifyIndexRunner cognifyIndexRunner;

    @PostMapping("/runs")
    @Operation(summary = "提交 run，立即返回 run id")
    public ResultData<String> submit(@Valid @RequestBody CognifyRunReq req) {
        List<RawDocument> documents = req.getDocuments().stream().map(CognifyController::toRaw).toList();
        return ResultData.success(cognifyIndexRunner.submit(req.getDatasetId(), req.getPipelineName(), documents));
    }

    @GetMapping("/runs/{id}")
    @Operation(summary = "查询 run 状态")
    public ResponseEntity<ResultData<PipelineRun>> status(@PathVariable("id") String id) {
        return cognifyIndexRunner.status(id)
                .map(run -> ResponseEntity.ok(ResultData.success(run)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ResultData.fail(HttpStatus.NOT_FOUND.value(), "run 不存在: " + id)));
    }

    @GetMapping("/runs")
    @Operation(summary = "列出数据集的 run")
    public ResultData<List<PipelineRun>> list(@RequestParam(value = "datasetId", required = false) String datasetId) {
        return ResultData.success(cognifyIndexRunner.listRuns(datasetId));
    }

    @PostMapping("/runs/{id}/cancel")
    @Operation(summary = "取消 run，在当前任务结束后生效")
    public ResponseEntity<ResultData<Boolean>> cancel(@PathVariable("id") String id,
                                                      @RequestParam(value = "reason", required = false) String reason) {
        if (cognifyIndexRunner.cancel(id, reason)) {
            return ResponseEntity.ok(ResultData.success(true));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ResultData.fail(HttpStatus.CONFLICT.value(), "run 不存在或已结束: " + id, false));
    }

    @DeleteMapping("/datasets/{datasetId}/documents/{documentId}")
    @Operation(summary = "从三库删除文档及只属于它的子图")
    public ResponseEntity<ResultData<DeletionReport>> deleteDocument(@PathVariable("datasetId") String datasetId,
                                                                     @PathVariable("documentId") String documentId) {
        return cognifyIndexRunner.deleteDocument(datasetId, documentId)
                .map(report -> ResponseEntity.ok(ResultData.success(report)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ResultData.fail(HttpStatus.NOT_FOUND.value(), "文档不存在: " + documentId)));
    }

    private static RawDocument toRaw(DocumentReq doc) {
        byte[] content = "base64".equalsIgnoreCase(doc.getEncoding())
                ? Base64.decode(doc.getContent())
                : doc.getContent().getBytes(StandardCharsets.UTF_8);
        return RawDocument.builder()
                .name(doc.getName())
                .content(content)
                .mimeType(doc.getMimeType())
                .build();
    }
}
