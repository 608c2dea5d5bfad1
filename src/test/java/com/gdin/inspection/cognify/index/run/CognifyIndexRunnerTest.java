package com.gdin.inspection.cognify.index.run;

import cn.hutool.crypto.SecureUtil;
import com.gdin.inspection.cognify.FakeModelConfig;
import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.exception.TransientStoreException;
import com.gdin.inspection.cognify.index.workflows.CognifyPipelineRegistrar;
import com.gdin.inspection.cognify.models.DataItemStatus;
import com.gdin.inspection.cognify.models.DataPointType;
import com.gdin.inspection.cognify.models.EdgeKey;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.Relations;
import com.gdin.inspection.cognify.models.PipelineRun;
import com.gdin.inspection.cognify.models.PipelineRunStatus;
import com.gdin.inspection.cognify.models.RawDocument;
import com.gdin.inspection.cognify.models.TaskLogEntry;
import com.gdin.inspection.cognify.models.TaskStatus;
import com.gdin.inspection.cognify.query.HybridSearchRouter;
import com.gdin.inspection.cognify.query.SearchHit;
import com.gdin.inspection.cognify.query.SearchMode;
import com.gdin.inspection.cognify.query.SearchRequest;
import com.gdin.inspection.cognify.query.SearchResponse;
import com.gdin.inspection.cognify.query.SearchStatus;
import com.gdin.inspection.cognify.storage.DeletionReport;
import com.gdin.inspection.cognify.storage.graph.GraphEdge;
import com.gdin.inspection.cognify.storage.graph.GraphNode;
import com.gdin.inspection.cognify.storage.graph.GraphNodeMapper;
import com.gdin.inspection.cognify.storage.graph.GraphStore;
import com.gdin.inspection.cognify.storage.relational.RelationalStore;
import com.gdin.inspection.cognify.storage.vector.VectorStore;
import com.gdin.inspection.cognify.util.DataPointIds;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;

@Slf4j
@SpringBootTest
@Import(FakeModelConfig.class)
public class CognifyIndexRunnerTest {

    @Resource
    private CognifyIndexRunner cognifyIndexRunner;

    @Resource
    private RelationalStore relationalStore;

    @Resource
    private VectorStore vectorStore;

    @SpyBean
    private GraphStore graphStore;

    @Resource
    private HybridSearchRouter hybridSearchRouter;

    @Resource
    private CognifyProperties cognifyProperties;

    @Resource
    private FakeModelConfig.FakeGraphExtractionAdapter fakeGraphExtractionAdapter;

    @AfterEach
    public void restore() {
        cognifyProperties.getPipeline().setIncrementalLoading(true);
        cognifyProperties.getRetry().setCallTimeoutMs(5000L);
        fakeGraphExtractionAdapter.reset();
    }

    @Test
    public void testRunPersistsIntoAllThreeStores() {
        String ds = "e2e-basic";
        PipelineRun run = cognifyIndexRunner.runSync(ds, null, List.of(text("trip.txt", "Alice met Bob in Paris.")));
        log.info("run 结果: {}", run);

        Assertions.assertEquals(PipelineRunStatus.COMPLETED, run.getStatus());
        Assertions.assertEquals(CognifyPipelineRegistrar.COGNIFY, run.getPipelineName());
        Assertions.assertEquals(1, run.getTotalUnits());
        Assertions.assertEquals(1, run.getCompletedUnits());
        Assertions.assertTrue(run.getFailedUnits().isEmpty());
        Assertions.assertEquals(List.of(
                CognifyPipelineRegistrar.CLASSIFY_DOCUMENTS,
                CognifyPipelineRegistrar.CHUNK_DOCUMENTS,
                CognifyPipelineRegistrar.EXTRACT_GRAPH,
                CognifyPipelineRegistrar.SUMMARIZE_CHUNKS,
                CognifyPipelineRegistrar.PERSIST_DATAPOINTS), completedTasks(run));

        Assertions.assertEquals(1, relationalStore.countRows(ds, DataPointType.DOCUMENT));
        Assertions.assertEquals(1, relationalStore.countRows(ds, DataPointType.DOCUMENT_CHUNK));
        Assertions.assertEquals(3, relationalStore.countRows(ds, DataPointType.ENTITY));
        Assertions.assertEquals(2, relationalStore.countRows(ds, DataPointType.ENTITY_TYPE));
        Assertions.assertEquals(1, relationalStore.countRows(ds, DataPointType.TEXT_SUMMARY));

        GraphNode alice = graphStore.getNode(DataPointIds.entityId(ds, "Alice")).orElseThrow();
        Assertions.assertEquals("Alice", alice.stringProperty(GraphNodeMapper.NAME));
        Assertions.assertEquals("Person", alice.stringProperty(GraphNodeMapper.TYPE_NAME));
        Assertions.assertTrue(vectorStore.count(ds) > 0);
        Assertions.assertTrue(graphStore.countEdges(ds) > 0);
        Assertions.assertEquals(graphStore.countEdges(ds), relationalStore.countEdges(ds));

        Assertions.assertEquals(DataItemStatus.COMPLETED,
                relationalStore.findDataItemStatus(documentId(ds, "Alice met Bob in Paris."), run.getPipelineName(), ds).orElseThrow());
        // run 记录已落库
        Assertions.assertEquals(PipelineRunStatus.COMPLETED,
                cognifyIndexRunner.status(run.getId()).orElseThrow().getStatus());
    }

    @Test
    public void testReingestCreatesNothingNew() {
        String ds = "e2e-reingest";
        List<RawDocument> docs = List.of(
                text("a.txt", "Alice met Bob in Paris."),
                text("b.txt", "Bob works at Acme."));
        Assertions.assertEquals(PipelineRunStatus.COMPLETED, cognifyIndexRunner.runSync(ds, null, docs).getStatus());

        int nodes = graphStore.countNodes(ds);
        int graphEdges = graphStore.countEdges(ds);
        int vectors = vectorStore.count(ds);
        int entities = relationalStore.countRows(ds, DataPointType.ENTITY);
        int edges = relationalStore.countEdges(ds);
        Assertions.assertEquals(4, entities);

        // 增量加载：两篇文档都已完成，直接跳过
        PipelineRun skipped = cognifyIndexRunner.runSync(ds, null, docs);
        Assertions.assertEquals(PipelineRunStatus.COMPLETED, skipped.getStatus());
        Assertions.assertEquals(2, skipped.getTotalUnits());
        Assertions.assertEquals(2, skipped.getAlreadyCompletedUnits());

        // 关闭增量加载后全量重跑，三库都不应新增
        cognifyProperties.getPipeline().setIncrementalLoading(false);
        PipelineRun again = cognifyIndexRunner.runSync(ds, null, docs);
        Assertions.assertEquals(PipelineRunStatus.COMPLETED, again.getStatus());
        Assertions.assertEquals(0, again.getAlreadyCompletedUnits());
        Assertions.assertEquals(nodes, graphStore.countNodes(ds));
        Assertions.assertEquals(graphEdges, graphStore.countEdges(ds));
        Assertions.assertEquals(vectors, vectorStore.count(ds));
        Assertions.assertEquals(entities, relationalStore.countRows(ds, DataPointType.ENTITY));
        Assertions.assertEquals(edges, relationalStore.countEdges(ds));
    }

    @Test
    public void testSameEntityAcrossDocumentsIsMerged() {
        String ds = "e2e-merge";
        cognifyIndexRunner.runSync(ds, null, List.of(text("a.txt", "Alice met Bob in Paris.")));
        cognifyIndexRunner.runSync(ds, null, List.of(text("b.txt", "Alice works at Acme.")));

        Assertions.assertEquals(4, relationalStore.countRows(ds, DataPointType.ENTITY));
        GraphNode alice = graphStore.getNode(DataPointIds.entityId(ds, "Alice")).orElseThrow();
        // 两个分片的描述都保留
        Assertions.assertEquals(2, alice.stringProperty(GraphNodeMapper.DESCRIPTION).split("\n").length);
    }

    @Test
    public void testOneFailingChunkFailsRunButKeepsOthers() {
        String ds = "e2e-partial";
        Map<String, String> contents = new LinkedHashMap<>();
        contents.put("d1.txt", "Report 1: Alice met Bob.");
        contents.put("d2.txt", "Report 2: Bob visited Paris.");
        contents.put("d3.txt", "Report 3: EXPLODE Alice.");
        contents.put("d4.txt", "Report 4: Acme hired Alice.");
        contents.put("d5.txt", "Report 5: Paris is quiet.");
        List<RawDocument> docs = new ArrayList<>();
        contents.forEach((name, body) -> docs.add(text(name, body)));

        PipelineRun run = cognifyIndexRunner.runSync(ds, null, docs);

        Assertions.assertEquals(PipelineRunStatus.FAILED, run.getStatus());
        Assertions.assertEquals(CognifyPipelineRegistrar.EXTRACT_GRAPH, run.getFailedTask());
        Assertions.assertEquals(1, run.getFailedUnits().size());
        Assertions.assertEquals(4, run.getCompletedUnits());
        // 失败单元之外的任务照常执行
        Assertions.assertTrue(completedTasks(run).contains(CognifyPipelineRegistrar.PERSIST_DATAPOINTS));

        Assertions.assertEquals(DataItemStatus.FAILED,
                relationalStore.findDataItemStatus(documentId(ds, contents.get("d3.txt")), run.getPipelineName(), ds).orElseThrow());
        Assertions.assertEquals(DataItemStatus.COMPLETED,
                relationalStore.findDataItemStatus(documentId(ds, contents.get("d4.txt")), run.getPipelineName(), ds).orElseThrow());
        Assertions.assertTrue(graphStore.getNode(DataPointIds.entityId(ds, "Acme")).isPresent());
        Assertions.assertTrue(graphStore.getNode(DataPointIds.entityId(ds, "Paris")).isPresent());
    }

    @Test
    public void testUndecodableDocumentIsDroppedAlone() {
        String ds = "e2e-decode";
        RawDocument broken = RawDocument.builder()
                .name("broken.txt")
                .content(new byte[]{(byte) 0xC3, (byte) 0x28, (byte) 0xA0})
                .build();

        PipelineRun run = cognifyIndexRunner.runSync(ds, null, List.of(broken, text("ok.txt", "Bob lives in Paris.")));

        Assertions.assertEquals(PipelineRunStatus.COMPLETED, run.getStatus());
        String brokenId = DataPointIds.documentId(ds, SecureUtil.sha256().digestHex(broken.getContent()));
        Assertions.assertTrue(run.getFailedUnits().containsKey(brokenId));
        Assertions.assertEquals(1, run.getCompletedUnits());
        Assertions.assertEquals(DataItemStatus.FAILED,
                relationalStore.findDataItemStatus(brokenId, run.getPipelineName(), ds).orElseThrow());
        Assertions.assertTrue(graphStore.getNode(DataPointIds.entityId(ds, "Bob")).isPresent());
    }

    @Test
    public void testCancelTakesEffectAfterCurrentTask() throws Exception {
        String ds = "e2e-cancel";
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        fakeGraphExtractionAdapter.gate(started, release);

        String runId = cognifyIndexRunner.submit(ds, null, List.of(text("slow.txt", "SLOW Alice met Bob.")));
        Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));
        Assertions.assertTrue(cognifyIndexRunner.cancel(runId, "用户取消"));
        release.countDown();

        PipelineRun run = awaitTerminal(runId);
        Assertions.assertEquals(PipelineRunStatus.FAILED, run.getStatus());
        Assertions.assertEquals("用户取消", run.getCancelReason());
        Assertions.assertTrue(completedTasks(run).contains(CognifyPipelineRegistrar.EXTRACT_GRAPH));
        Assertions.assertFalse(completedTasks(run).contains(CognifyPipelineRegistrar.PERSIST_DATAPOINTS));

        // 已完成任务的元数据保留，图库没有写入
        Assertions.assertEquals(1, relationalStore.countRows(ds, DataPointType.DOCUMENT_CHUNK));
        Assertions.assertEquals(0, graphStore.countNodes(ds));
    }

    @Test
    public void testHybridSearchAfterIngest() {
        String ds = "e2e-search";
        cognifyIndexRunner.runSync(ds, null, List.of(
                text("a.txt", "Alice met Bob in Paris."),
                text("b.txt", "Acme opened an office.")));

        SearchResponse response = hybridSearchRouter.search(SearchRequest.builder()
                .query("Where did Alice go?")
                .datasetId(ds)
                .mode(SearchMode.HYBRID)
                .topK(5)
                .build());
        Assertions.assertEquals(SearchStatus.OK, response.getStatus());
        Assertions.assertTrue(response.getUnavailableModes().isEmpty());
        Assertions.assertFalse(response.getHits().isEmpty());
        Assertions.assertTrue(response.getHits().size() <= 5);

        // 结构检索以查询中的实体为锚点，锚点得分最高
        SearchResponse structural = hybridSearchRouter.search(SearchRequest.builder()
                .query("Where did Alice go?")
                .datasetId(ds)
                .mode(SearchMode.STRUCTURAL)
                .build());
        List<String> ids = structural.getHits().stream().map(SearchHit::getId).toList();
        Assertions.assertEquals(DataPointIds.entityId(ds, "Alice"), ids.get(0));

        SearchResponse empty = hybridSearchRouter.search(SearchRequest.builder()
                .query("anything")
                .datasetId("e2e-search-nothing")
                .mode(SearchMode.STRUCTURAL)
                .build());
        Assertions.assertEquals(SearchStatus.EMPTY, empty.getStatus());
    }

    @Test
    public void testDocumentsSharingEntityPersistInParallel() {
        String ds = "e2e-shared";
        String first = "Alice met Bob in Paris.";
        String second = "Alice (Company) met Bob at Acme.";
        PipelineRun run = cognifyIndexRunner.runSync(ds, null, List.of(text("a.txt", first), text("b.txt", second)));

        Assertions.assertEquals(PipelineRunStatus.COMPLETED, run.getStatus());
        Assertions.assertEquals(2, run.getCompletedUnits());

        // 两篇文档给 Alice 的类型不同，三库只保留一个
        String alice = DataPointIds.entityId(ds, "Alice");
        List<GraphEdge> isA = graphStore.neighbors(List.of(alice), ds).stream()
                .filter(e -> Relations.IS_A.equals(e.getRelation()) && alice.equals(e.getSourceId()))
                .toList();
        Assertions.assertEquals(1, isA.size());
        GraphEntity committed = relationalStore.findEntities(List.of(alice)).get(alice);
        Assertions.assertEquals(committed.getTypeId(), isA.get(0).getTargetId());
        Assertions.assertEquals(committed.getTypeName(),
                graphStore.getNode(alice).orElseThrow().stringProperty(GraphNodeMapper.TYPE_NAME));
        Assertions.assertEquals(graphStore.countEdges(ds), relationalStore.countEdges(ds));

        // 共享的关系边记下两篇文档的分片
        EdgeKey key = new EdgeKey(alice, DataPointIds.normalizeRelation("related to"), DataPointIds.entityId(ds, "Bob"));
        Set<String> chunks = Set.of(
                DataPointIds.chunkId(ds, documentId(ds, first), 0),
                DataPointIds.chunkId(ds, documentId(ds, second), 0));
        Assertions.assertEquals(chunks, GraphNodeMapper.provenance(graphStore.getEdges(List.of(key)).get(0)));
        Assertions.assertEquals(chunks, relationalStore.findProvenance(DataPointIds.edgeId(ds, key)));
    }

    @Test
    public void testTransientStoreFailureIsRetriedWithinRun() {
        String ds = "e2e-store-retry";
        Mockito.doThrow(new TransientStoreException("graph busy"))
                .doCallRealMethod()
                .when(graphStore).upsertEdge(any());

        PipelineRun run = cognifyIndexRunner.runSync(ds, null, List.of(text("a.txt", "Alice met Bob in Paris.")));

        Assertions.assertEquals(PipelineRunStatus.COMPLETED, run.getStatus());
        Assertions.assertEquals(graphStore.countEdges(ds), relationalStore.countEdges(ds));
    }

    @Test
    public void testStoreTimeoutDuringPersistFailsRun() {
        String ds = "e2e-store-timeout";
        cognifyProperties.getRetry().setCallTimeoutMs(200L);
        // 写图边一直卡住，每次调用都超时
        Mockito.doAnswer(invocation -> {
            Thread.sleep(5000);
            return null;
        }).when(graphStore).upsertEdge(any());

        String body = "Alice met Bob in Paris.";
        PipelineRun run = cognifyIndexRunner.runSync(ds, null, List.of(text("a.txt", body)));

        Assertions.assertEquals(PipelineRunStatus.FAILED, run.getStatus());
        Assertions.assertEquals(CognifyPipelineRegistrar.PERSIST_DATAPOINTS, run.getFailedTask());
        Assertions.assertTrue(run.getFailedUnits().containsKey(documentId(ds, body)));
        Assertions.assertEquals(0, run.getCompletedUnits());
        Mockito.verify(graphStore, Mockito.times(cognifyProperties.getRetry().getMaxAttempts())).upsertEdge(any());

        // 节点已写入，边没有；文档标记为失败，下次运行会重做
        Assertions.assertTrue(graphStore.countNodes(ds) > 0);
        Assertions.assertEquals(0, graphStore.countEdges(ds));
        Assertions.assertEquals(DataItemStatus.FAILED,
                relationalStore.findDataItemStatus(documentId(ds, body), run.getPipelineName(), ds).orElseThrow());
    }

    @Test
    public void testDeleteDocumentKeepsSharedSubgraph() {
        String ds = "e2e-delete";
        String first = "Alice met Bob in Paris.";
        String second = "Alice met Bob at Acme.";
        cognifyIndexRunner.runSync(ds, null, List.of(text("a.txt", first), text("b.txt", second)));
        int vectors = vectorStore.count(ds);

        String docId = documentId(ds, first);
        DeletionReport report = cognifyIndexRunner.deleteDocument(ds, docId).orElseThrow();
        log.info("删除结果: {}", report);

        Assertions.assertEquals(1, report.getChunksDeleted());
        Assertions.assertEquals(1, report.getSummariesDeleted());
        Assertions.assertEquals(1, report.getEntitiesDeleted());
        Assertions.assertEquals(1, relationalStore.countRows(ds, DataPointType.DOCUMENT));
        Assertions.assertEquals(1, relationalStore.countRows(ds, DataPointType.TEXT_SUMMARY));
        Assertions.assertTrue(graphStore.getNode(docId).isEmpty());
        Assertions.assertTrue(vectorStore.count(ds) < vectors);

        // 只出现在被删文档里的实体和类型一并删除
        String paris = DataPointIds.entityId(ds, "Paris");
        String city = DataPointIds.entityTypeId(ds, "City");
        Assertions.assertTrue(graphStore.getNode(paris).isEmpty());
        Assertions.assertTrue(relationalStore.findFingerprint(paris).isEmpty());
        Assertions.assertTrue(graphStore.getNode(city).isEmpty());
        Assertions.assertTrue(relationalStore.findFingerprint(city).isEmpty());

        // 共享的边保留，只剩另一篇文档的分片
        String alice = DataPointIds.entityId(ds, "Alice");
        String bob = DataPointIds.entityId(ds, "Bob");
        EdgeKey shared = new EdgeKey(alice, DataPointIds.normalizeRelation("related to"), bob);
        Set<String> remaining = Set.of(DataPointIds.chunkId(ds, documentId(ds, second), 0));
        Assertions.assertEquals(remaining, GraphNodeMapper.provenance(graphStore.getEdges(List.of(shared)).get(0)));
        Assertions.assertEquals(remaining, relationalStore.findProvenance(DataPointIds.edgeId(ds, shared)));

        // Bob 指向 Paris 的关系随边一起去掉
        GraphEntity bobEntity = relationalStore.findEntities(List.of(bob)).get(bob);
        Assertions.assertTrue(bobEntity.getRelations().stream().noneMatch(r -> paris.equals(r.getTargetId())));
        Assertions.assertEquals(graphStore.countEdges(ds), relationalStore.countEdges(ds));
        Assertions.assertTrue(relationalStore.findDataItemStatus(docId, CognifyPipelineRegistrar.COGNIFY, ds).isEmpty());

        Assertions.assertEquals(Optional.empty(), cognifyIndexRunner.deleteDocument(ds, docId));

        // 删除后重新导入，被删的部分重新出现
        PipelineRun again = cognifyIndexRunner.runSync(ds, null, List.of(text("a.txt", first), text("b.txt", second)));
        Assertions.assertEquals(1, again.getAlreadyCompletedUnits());
        Assertions.assertTrue(graphStore.getNode(paris).isPresent());
        Assertions.assertEquals(graphStore.countEdges(ds), relationalStore.countEdges(ds));
    }

    private PipelineRun awaitTerminal(String runId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            PipelineRun run = cognifyIndexRunner.status(runId).orElseThrow();
            if (run.getStatus().isTerminal()) {
                return run;
            }
            Thread.sleep(20);
        }
        throw new AssertionError("run 未在 10 秒内结束: " + runId);
    }

    private static List<String> completedTasks(PipelineRun run) {
        List<String> tasks = new ArrayList<>();
        for (TaskLogEntry e : run.getTaskLog()) {
            if (e.getStatus() == TaskStatus.COMPLETED || e.getStatus() == TaskStatus.PARTIAL) {
                tasks.add(e.getTask());
            }
        }
        return tasks;
    }

    private static String documentId(String ds, String body) {
        return DataPointIds.documentId(ds, SecureUtil.sha256().digestHex(body.getBytes(StandardCharsets.UTF_8)));
    }

    private static RawDocument text(String name, String body) {
        return RawDocument.builder()
                .name(name)
                .content(body.getBytes(StandardCharsets.UTF_8))
                .build();
    }
}
