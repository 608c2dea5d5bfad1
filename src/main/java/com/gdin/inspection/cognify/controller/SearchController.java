package com.gdin.inspection.cognify.controller;

import com.gdin.inspection.cognify.query.HybridSearchRouter;
import com.gdin.inspection.cognify.query.SearchRequest;
import com.gdin.inspection.cognify.query.SearchResponse;
import com.gdin.inspection.cognify.resp.ResultData;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.annotation.Resource;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/search")
@Tag(name = "检索", description = "向量 / 图 / 混合检索")
public class SearchController {

    @Resource
    private HybridSearchRouter hybridSearchRouter;

    @PostMapping
    @Operation(summary = "检索；空结果 status=EMPTY，一路不可用 status=DEGRADED")
    public ResultData<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        log.info("search: mode={}, dataset={}, query={}", request.getMode(), request.getDatasetId(), request.getQuery());
        return ResultData.success(hybridSearchRouter.search(request));
    }
}
