package com.gdin.inspection.cognify.index.pipeline;

import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.index.pipeline.context.PipelineRunContext;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * 任务内按单元（文档、分片）并发执行。
 * 单元失败记到 run 上并从结果中剔除，不影响其它单元；返回结果保持输入顺序。
 */
@Component
public class UnitExecutor {

    public interface UnitFunction<T, R> {
        R apply(T unit) throws Exception;
    }

    @Resource
    private CognifyProperties cognifyProperties;

    public UnitExecutor() {
    }

    public UnitExecutor(CognifyProperties cognifyProperties) {
        this.cognifyProperties = cognifyProperties;
    }

    public <T, R> List<R> map(String task,
                              List<T> units,
                              Function<T, String> unitId,
                              UnitFunction<T, R> fn,
                              PipelineRunContext context) {
        List<R> out = new ArrayList<>(units.size());
        if (units.isEmpty()) return out;

        int threads = Math.max(1, Math.min(units.size(), cognifyProperties.getPipeline().getConcurrentRequests()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<R>> futures = new ArrayList<>(units.size());
            for (T unit : units) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        return fn.apply(unit);
                    } catch (RuntimeException e) {
                        throw e;
                    } catch (Exception e) {
                        throw new CompletionException(e);
                    }
                }, pool));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    R r = futures.get(i).join();
                    if (r != null) out.add(r);
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    context.unitFailed(task, unitId.apply(units.get(i)), cause);
                }
            }
        } finally {
            pool.shutdown();
        }
        return out;
    }
}
