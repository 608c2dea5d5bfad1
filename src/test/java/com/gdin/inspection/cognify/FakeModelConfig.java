package com.gdin.inspection.cognify;

import com.gdin.inspection.cognify.exception.ExtractionException;
import com.gdin.inspection.cognify.index.extract.CandidateEntity;
import com.gdin.inspection.cognify.index.extract.CandidateRelation;
import com.gdin.inspection.cognify.index.extract.ExtractedGraph;
import com.gdin.inspection.cognify.index.extract.ExtractionSchema;
import com.gdin.inspection.cognify.index.extract.GraphExtractionAdapter;
import com.gdin.inspection.cognify.index.summarize.SummaryGenerator;
import com.gdin.inspection.cognify.models.DocumentCategory;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 测试用的模型替身：按固定词表抽实体，不访问 Ollama。
 * <ul>
 *     <li>文本含 EXPLODE 时抽取失败；</li>
 *     <li>文本含 SLOW 且设置了闸门时，先通知 started 再等待 release；</li>
 *     <li>文本写成 "Alice (Company)" 时，该实体的类型取括号内的名字。</li>
 * </ul>
 */
@TestConfiguration
public class FakeModelConfig {

    @Bean
    @Primary
    public FakeGraphExtractionAdapter fakeGraphExtractionAdapter() {
        return new FakeGraphExtractionAdapter();
    }

    @Bean
    @Primary
    public SummaryGenerator fakeSummaryGenerator() {
        return (text, category) -> {
            String head = text.length() > 40 ? text.substring(0, 40) : text;
            return (category == DocumentCategory.CODE ? "code: " : "summary: ") + head.trim();
        };
    }

    public static class FakeGraphExtractionAdapter implements GraphExtractionAdapter {

        private static final Map<String, String> KNOWN = new LinkedHashMap<>();

        static {
            KNOWN.put("Alice", "Person");
            KNOWN.put("Bob", "Person");
            KNOWN.put("Paris", "City");
            KNOWN.put("Acme", "Company");
        }

        private volatile CountDownLatch started;
        private volatile CountDownLatch release;

        public void gate(CountDownLatch started, CountDownLatch release) {
            this.started = started;
            this.release = release;
        }

        public void reset() {
            this.started = null;
            this.release = null;
        }

        @Override
        public ExtractedGraph extract(String chunkId, String text, ExtractionSchema schema) {
            if (text.contains("EXPLODE")) {
                throw new ExtractionException(chunkId, "模型返回了无法解析的内容", null);
            }
            CountDownLatch r = release;
            if (text.contains("SLOW") && r != null) {
                started.countDown();
                try {
                    if (!r.await(10, TimeUnit.SECONDS)) {
                        throw new ExtractionException(chunkId, "等待放行超时", null);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ExtractionException(chunkId, "等待放行被中断", e);
                }
            }

            List<String> found = new ArrayList<>();
            for (String name : KNOWN.keySet()) {
                int at = text.indexOf(name);
                if (at >= 0) found.add(name);
            }
            found.sort((a, b) -> Integer.compare(text.indexOf(a), text.indexOf(b)));

            ExtractedGraph.ExtractedGraphBuilder graph = ExtractedGraph.builder();
            for (String name : found) {
                graph.entity(CandidateEntity.builder()
                        .name(name)
                        .type(typeOf(text, name))
                        .description(name + " appears in " + chunkId)
                        .build());
            }
            for (int i = 1; i < found.size(); i++) {
                graph.relation(CandidateRelation.builder()
                        .source(found.get(i - 1))
                        .target(found.get(i))
                        .label("related to")
                        .description(found.get(i - 1) + " and " + found.get(i))
                        .strength(1.0)
                        .build());
            }
            return graph.build();
        }

        private static String typeOf(String text, String name) {
            String marker = name + " (";
            int at = text.indexOf(marker);
            if (at >= 0) {
                int end = text.indexOf(')', at + marker.length());
                if (end > 0) return text.substring(at + marker.length(), end);
            }
            return KNOWN.get(name);
        }
    }
}
