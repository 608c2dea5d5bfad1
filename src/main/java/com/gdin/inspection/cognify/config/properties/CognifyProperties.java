package com.gdin.inspection.cognify.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "gdin.ai.cognify")
@Component
public class CognifyProperties implements Serializable {

    private Chunking chunking = new Chunking();

    private Extraction extraction = new Extraction();

    private Ontology ontology = new Ontology();

    private Pipeline pipeline = new Pipeline();

    private Retry retry = new Retry();

    private Search search = new Search();

    private Storage storage = new Storage();

    @Data
    public static class Chunking implements Serializable {
        /** size / paragraph */
        private String strategy = "size";
        /** size 策略下单个分片的 token 上限 */
        private Integer maxChunkTokens = 512;
        /** paragraph 策略下单个分片的字符上限 */
        private Integer paragraphMaxChars = 2000;
    }

    @Data
    public static class Extraction implements Serializable {
        /** 抽取提示里给模型的候选实体类型，为空时不限制 */
        private List<String> entityTypes = new ArrayList<>();
        private String tupleDelimiter = "<|>";
        private String recordDelimiter = "##";
        private String completionDelimiter = "<|COMPLETE|>";
        /** 单次模型调用超时（秒） */
        private Integer timeoutSeconds = 120;
    }

    @Data
    public static class Ontology implements Serializable {
        /** 本体文件路径（classpath: 或文件路径），为空时不做本体校验 */
        private String file;
        /** 模糊匹配阈值 */
        private Double matchThreshold = 0.8;
    }

    @Data
    public static class Pipeline implements Serializable {
        private String defaultName = "cognify";
        /** 单元级并发度 */
        private Integer concurrentRequests = 4;
        /** 已完成的文档是否跳过 */
        private Boolean incrementalLoading = true;
        /** 后台 run 线程数 */
        private Integer runnerThreads = 2;
    }

    /**
     * 存储与模型调用的重试策略：delay = min(backoffMs * multiplier^N, maxBackoffMs)。
     */
    @Data
    public static class Retry implements Serializable {
        private Integer maxAttempts = 3;
        private Long backoffMs = 200L;
        private Long maxBackoffMs = 5000L;
        private Double multiplier = 2.0;
        /** 单次存储调用超时（毫秒） */
        private Long callTimeoutMs = 30000L;
    }

    @Data
    public static class Search implements Serializable {
        private Integer defaultTopK = 10;
        private Integer maxTopK = 100;
        private Integer traversalDepth = 2;
        private Double semanticWeight = 0.6;
        private Double structuralWeight = 0.4;
    }

    @Data
    public static class Storage implements Serializable {
        /** memory / jdbc */
        private String relational = "memory";
        /** memory / milvus */
        private String vector = "memory";
        /** memory / neo4j */
        private String graph = "memory";
    }
}
