package com.gdin.inspection.cognify.util;

import cn.hutool.core.thread.ThreadFactoryBuilder;
import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.exception.CognifyException;
import com.gdin.inspection.cognify.exception.RetriesExhaustedException;
import com.gdin.inspection.cognify.exception.TransientStoreException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 外部调用的超时与有界重试。
 * <p>
 * 只有 {@link TransientStoreException} 和超时会被重试，
 * 第 N 次重试前等待 min(backoffMs * multiplier^N, maxBackoffMs)，
 * 次数用尽抛出 {@link RetriesExhaustedException}。其它异常原样抛出。
 */
@Slf4j
@Component
public class RetryExecutor {

    private final CognifyProperties.Retry policy;

    private final ExecutorService callExecutor = Executors.newCachedThreadPool(
            ThreadFactoryBuilder.create().setNamePrefix("cognify-call-").setDaemon(true).build());

    @Autowired
    public RetryExecutor(CognifyProperties properties) {
        this(properties.getRetry());
    }

    public RetryExecutor(CognifyProperties.Retry policy) {
        this.policy = policy;
    }

    public <T> T call(String operation, Callable<T> action) {
        return call(operation, action, Duration.ofMillis(policy.getCallTimeoutMs()));
    }

    public <T> T call(String operation, Callable<T> action, Duration timeout) {
        int maxAttempts = Math.max(1, policy.getMaxAttempts());
        Throwable last = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return callWithTimeout(action, timeout);
            } catch (TransientStoreException | TimeoutException e) {
                last = e;
                if (attempt < maxAttempts - 1) {
                    long delay = backoffDelay(attempt);
                    log.warn("{} 第 {} 次调用失败，{}ms 后重试: {}", operation, attempt + 1, delay, e.getMessage());
                    sleep(delay);
                }
            }
        }
        log.error("{} 重试 {} 次后仍失败", operation, maxAttempts);
        throw new RetriesExhaustedException(operation, maxAttempts, last);
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public long backoffDelay(int attempt) {
        double delay = policy.getBackoffMs() * Math.pow(policy.getMultiplier(), attempt);
        return (long) Math.min(delay, policy.getMaxBackoffMs());
    }

    private <T> T callWithTimeout(Callable<T> action, Duration timeout) throws TimeoutException {
        Future<T> future = callExecutor.submit(action);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CognifyException("调用被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new CognifyException("调用失败: " + cause.getMessage(), cause);
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CognifyException("重试等待被中断", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
    }
}
