package com.gdin.inspection.cognify.controller;

import com.gdin.inspection.cognify.exception.CognifyException;
import com.gdin.inspection.cognify.exception.FatalPipelineException;
import com.gdin.inspection.cognify.exception.RetrievalUnavailableException;
import com.gdin.inspection.cognify.exception.UnitInputException;
import com.gdin.inspection.cognify.query.SearchResponse;
import com.gdin.inspection.cognify.query.SearchStatus;
import com.gdin.inspection.cognify.resp.ResultData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ResultData<Void>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return badRequest(message);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            UnitInputException.class, FatalPipelineException.class})
    public ResponseEntity<ResultData<Void>> handleBadInput(Exception e) {
        log.warn("请求参数错误: {}", e.getMessage());
        return badRequest(e.getMessage());
    }

    @ExceptionHandler(RetrievalUnavailableException.class)
    public ResponseEntity<ResultData<SearchResponse>> handleUnavailable(RetrievalUnavailableException e) {
        log.warn("检索不可用: modes={}, {}", e.getModes(), e.getMessage());
        SearchResponse body = SearchResponse.builder()
                .status(SearchStatus.UNAVAILABLE)
                .unavailableModes(e.getModes())
                .message(e.getMessage())
                .build();
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ResultData.fail(HttpStatus.SERVICE_UNAVAILABLE.value(), e.getMessage(), body));
    }

    @ExceptionHandler(CognifyException.class)
    public ResponseEntity<ResultData<Void>> handleCognify(CognifyException e) {
        log.error("请求处理失败", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ResultData.fail(HttpStatus.INTERNAL_SERVER_ERROR.value(), e.getMessage()));
    }

    private static ResponseEntity<ResultData<Void>> badRequest(String message) {
        return ResponseEntity.badRequest().body(ResultData.fail(HttpStatus.BAD_REQUEST.value(), message));
    }
}
