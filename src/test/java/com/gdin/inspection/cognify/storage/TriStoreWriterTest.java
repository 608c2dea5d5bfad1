package com.gdin.inspection.cognify.storage;

import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.exception.RetriesExhaustedException;
import com.gdin.inspection.cognify.exception.TransientStoreException;
import com.gdin.inspection.cognify.index.update.EntityMergeService;
import com.gdin.inspection.cognify.models.DataPoint;
import com.gdin.inspection.cognify.models.DataPointType;
import com.gdin.inspection.cognify.models.Document;
import com.gdin.inspection.cognify.models.DocumentCategory;
import com.gdin.inspection.cognify.models.DocumentChunk;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.EdgeKey;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.GraphEntityType;
import com.gdin.inspection.cognify.models.Relations;
import com.gdin.inspection.cognify.storage.graph.GraphEdge;
import com.gdin.inspection.cognify.storage.graph.GraphNode;
import com.gdin.inspection.cognify.storage.graph.GraphNodeMapper;
import com.gdin.inspection.cognify.storage.graph.InMemoryGraphStore;
import com.gdin.inspection.cognify.storage.relational.InMemoryRelationalStore;
import com.gdin.inspection.cognify.storage.vector.InMemoryVectorStore;
import com.gdin.inspection.cognify.util.DataPointIds;
import com.gdin.inspection.cognify.util.RetryExecutor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.mockito.ArgumentMatchers.any;

public class TriStoreWriterTest {

    private static final String DATASET = "writer-ds";

    private InMemoryRelationalStore relationalStore;
    private InMemoryVectorStore vectorStore;
    private InMemoryGraphStore graphStore;
    private TriStoreWriter writer;

    @BeforeEach
    public void setUp() {
        CognifyProperties.Retry retry = new CognifyProperties.Retry();
        retry.setBackoffMs(1L);
        retry.setMaxBackoffMs(2L);
        relationalStore = Mockito.spy(new InMemoryRelationalStore());
        vectorStore = Mockito.spy(new InMemoryVectorStore());
        graphStore = Mockito.spy(new InMemoryGraphStore());
        writer = new TriStoreWriter(relationalStore, vectorStore, graphStore,
                new RetryExecutor(retry), new IdLockRegistry(), new EntityMergeService());
    }

    private static GraphEntityType type(String name) {
        return GraphEntityType.builder()
                .id(DataPointIds.entityTypeId(DATASET, name))
                .datasetId(DATASET)
                .name(name)
                .ontologyValid(true)
                .build();
    }

    private static GraphEntity entity(String name, String type, String description) {
        return GraphEntity.builder()
                .id(DataPointIds.entityId(DATASET, name))
                .datasetId(DATASET)
                .name(name)
                .typeId(DataPointIds.entityTypeId(DATASET, type))
                .typeName(type)
                .description(description)
                .build();
    }

    private static Edge edge(String source, String relation, String target, String chunkId) {
        EdgeKey key = new EdgeKey(source, relation, target);
        Edge e = Edge.builder()
                .id(DataPointIds.edgeId(DATASET, key))
                .datasetId(DATASET)
                .sourceId(source)
                .relation(relation)
                .targetId(target)
                .build();
        e.addProvenance(chunkId);
        return e;
    }

    private static void embed(List<DataPoint> points) {
        for (DataPoint dp : points) {
            if (dp.isEmbeddable()) dp.setEmbedding(new float[]{1f, 0f, 0f});
        }
    }

    private static PersistBatch batch() {
        Document doc = Document.builder()
                .id("doc-1").datasetId(DATASET).name("a.txt").category(DocumentCategory.TEXT).contentHash("h")
                .build();
        DocumentChunk chunk = DocumentChunk.builder()
                .id("chunk-1").datasetId(DATASET).documentId("doc-1").chunkIndex(0)
                .text("Alice lives in Paris.").category(DocumentCategory.TEXT)
                .build();
        GraphEntity alice = entity("Alice", "Person", "engineer");
        GraphEntity paris = entity("Paris", "City", "capital");
        List<DataPoint> points = new ArrayList<>(List.of(doc, chunk, type("Person"), type("City"), alice, paris));
        embed(points);
        return PersistBatch.builder()
                .dataPoints(points)
                .edge(edge("chunk-1", Relations.IS_PART_OF, "doc-1", "chunk-1"))
                .edge(edge("chunk-1", Relations.CONTAINS, alice.getId(), "chunk-1"))
                .edge(edge(alice.getId(), "lives_in", paris.getId(), "chunk-1"))
                .build();
    }

    @Test
    public void testWritesStoresInOrder() {
        PersistReport report = writer.persist(batch());

        InOrder order = Mockito.inOrder(relationalStore, vectorStore, graphStore);
        order.verify(relationalStore).upsertRows(any());
        order.verify(vectorStore).upsertAll(any());
        order.verify(graphStore, Mockito.atLeastOnce()).upsertNode(any());
        order.verify(graphStore, Mockito.atLeastOnce()).upsertEdge(any());

        Assertions.assertEquals(6, report.getNodesWritten());
        Assertions.assertEquals(5, report.getVectorsWritten());
        Assertions.assertEquals(3, report.getEdgesWritten());
        Assertions.assertEquals(6, graphStore.countNodes(DATASET));
        Assertions.assertEquals(3, graphStore.countEdges(DATASET));
        Assertions.assertEquals(5, vectorStore.count(DATASET));
    }

    @Test
    public void testRepeatedPersistIsNoop() {
        writer.persist(batch());
        PersistReport second = writer.persist(batch());

        Assertions.assertTrue(second.isNoop(), second.toString());
        Assertions.assertEquals(6, second.getRowsUnchanged());
        Assertions.assertEquals(6, graphStore.countNodes(DATASET));
        Assertions.assertEquals(3, graphStore.countEdges(DATASET));
        Mockito.verify(vectorStore, Mockito.times(1)).upsertAll(any());
    }

    @Test
    public void testRewriteAfterPartialFailureOnlyCompletesMissingStep() {
        Mockito.doThrow(new TransientStoreException("graph down")).when(graphStore).upsertEdge(any());

        Assertions.assertThrows(RetriesExhaustedException.class, () -> writer.persist(batch()));
        Assertions.assertEquals(6, graphStore.countNodes(DATASET));
        Assertions.assertEquals(0, graphStore.countEdges(DATASET));

        Mockito.doCallRealMethod().when(graphStore).upsertEdge(any());
        PersistReport retry = writer.persist(batch());

        Assertions.assertEquals(0, retry.getVectorsWritten());
        Assertions.assertEquals(0, retry.getNodesWritten());
        Assertions.assertEquals(3, retry.getEdgesWritten());
        Assertions.assertEquals(3, graphStore.countEdges(DATASET));
    }

    @Test
    public void testTransientFailureIsRetried() {
        Mockito.doThrow(new TransientStoreException("vector busy"))
                .doCallRealMethod()
                .when(vectorStore).upsertAll(any());

        PersistReport report = writer.persist(batch());

        Mockito.verify(vectorStore, Mockito.times(2)).upsertAll(any());
        Assertions.assertEquals(5, report.getVectorsWritten());
    }

    @Test
    public void testProvenanceIsUnionedAcrossChunks() {
        writer.persist(batch());

        GraphEntity alice = entity("Alice", "Person", "engineer");
        GraphEntity paris = entity("Paris", "City", "capital");
        PersistBatch other = PersistBatch.builder()
                .edge(edge(alice.getId(), "lives_in", paris.getId(), "chunk-2"))
                .build();
        PersistReport report = writer.persist(other);

        Assertions.assertEquals(1, report.getProvenanceAdded());
        Assertions.assertEquals(3, graphStore.countEdges(DATASET));
        String edgeId = DataPointIds.edgeId(DATASET, new EdgeKey(alice.getId(), "lives_in", paris.getId()));
        Assertions.assertEquals(Set.of("chunk-1", "chunk-2"), relationalStore.findProvenance(edgeId));
    }

    @Test
    public void testCommittedEntityTypeWinsAcrossBatches() {
        writer.persist(batch());

        GraphEntity conflicting = entity("Alice", "City", "moved");
        conflicting.setEmbedding(new float[]{0f, 1f, 0f});
        PersistReport report = writer.persist(PersistBatch.builder()
                .dataPoint(type("City"))
                .dataPoint(conflicting)
                .build());

        Assertions.assertEquals(1, report.getTypeConflicts());
        GraphNode node = graphStore.getNode(conflicting.getId()).orElseThrow();
        Assertions.assertEquals("Person", node.stringProperty(GraphNodeMapper.TYPE_NAME));
        Assertions.assertEquals("engineer\nmoved", node.stringProperty(GraphNodeMapper.DESCRIPTION));
    }

    @Test
    public void testConflictingTypeFromAnotherDocumentKeepsOneIsAEdge() {
        PersistBatch first = batch();
        GraphEntity alice = entity("Alice", "Person", "engineer");
        writer.persist(PersistBatch.builder()
                .dataPoints(first.getDataPoints())
                .edges(first.getEdges())
                .edge(edge(alice.getId(), Relations.IS_A, DataPointIds.entityTypeId(DATASET, "Person"), "chunk-1"))
                .build());

        // 另一篇文档把 Alice 抽成了 Organization
        DocumentChunk chunk2 = DocumentChunk.builder()
                .id("chunk-2").datasetId(DATASET).documentId("doc-2").chunkIndex(0)
                .text("Alice signed the contract.").category(DocumentCategory.TEXT)
                .build();
        GraphEntity conflicting = entity("Alice", "Organization", "signed");
        List<DataPoint> points = new ArrayList<>(List.of(chunk2, type("Organization"), conflicting));
        embed(points);
        String organizationId = DataPointIds.entityTypeId(DATASET, "Organization");
        PersistReport report = writer.persist(PersistBatch.builder()
                .dataPoints(points)
                .edge(edge("chunk-2", Relations.CONTAINS, alice.getId(), "chunk-2"))
                .edge(edge(alice.getId(), Relations.IS_A, organizationId, "chunk-2"))
                .build());

        Assertions.assertEquals(1, report.getTypeConflicts());
        List<GraphEdge> isA = graphStore.neighbors(List.of(alice.getId()), DATASET).stream()
                .filter(e -> Relations.IS_A.equals(e.getRelation()))
                .toList();
        Assertions.assertEquals(1, isA.size());
        Assertions.assertEquals(DataPointIds.entityTypeId(DATASET, "Person"), isA.get(0).getTargetId());

        // 图库与关系库中的类型一致，落选类型没有落库
        Assertions.assertEquals("Person",
                graphStore.getNode(alice.getId()).orElseThrow().stringProperty(GraphNodeMapper.TYPE_NAME));
        Assertions.assertEquals("Person", relationalStore.findEntities(List.of(alice.getId())).get(alice.getId()).getTypeName());
        Assertions.assertTrue(relationalStore.findFingerprint(organizationId).isEmpty());
        Assertions.assertTrue(graphStore.getNode(organizationId).isEmpty());
        Assertions.assertEquals(2, relationalStore.countRows(DATASET, DataPointType.ENTITY_TYPE));
    }

    @Test
    public void testConcurrentProvenanceIsNotOverwrittenByStaleWrite() throws Exception {
        CountDownLatch paused = new CountDownLatch(1);
        CountDownLatch resume = new CountDownLatch(1);
        AtomicBoolean first = new AtomicBoolean(true);
        // 第一个写入者写完节点后、写边之前停住
        Mockito.doAnswer(invocation -> {
            Object result = invocation.callRealMethod();
            if (first.compareAndSet(true, false)) {
                paused.countDown();
                Assertions.assertTrue(resume.await(10, TimeUnit.SECONDS));
            }
            return result;
        }).when(relationalStore).markGraphSynced(any());

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<PersistReport> slow = pool.submit(() -> writer.persist(batch()));
            Assertions.assertTrue(paused.await(10, TimeUnit.SECONDS));

            GraphEntity alice = entity("Alice", "Person", "engineer");
            GraphEntity paris = entity("Paris", "City", "capital");
            writer.persist(PersistBatch.builder()
                    .edge(edge(alice.getId(), "lives_in", paris.getId(), "chunk-2"))
                    .build());

            resume.countDown();
            slow.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        EdgeKey key = new EdgeKey(DataPointIds.entityId(DATASET, "Alice"), "lives_in", DataPointIds.entityId(DATASET, "Paris"));
        GraphEdge written = graphStore.getEdges(List.of(key)).get(0);
        Assertions.assertEquals(Set.of("chunk-1", "chunk-2"), GraphNodeMapper.provenance(written));
        Assertions.assertEquals(Set.of("chunk-1", "chunk-2"), relationalStore.findProvenance(DataPointIds.edgeId(DATASET, key)));
    }

    @Test
    public void testDeleteRemovesInReverseOrder() {
        PersistBatch persisted = batch();
        writer.persist(persisted);

        String alice = DataPointIds.entityId(DATASET, "Alice");
        String paris = DataPointIds.entityId(DATASET, "Paris");
        DeletionReport report = writer.delete(DeletionPlan.builder()
                .datasetId(DATASET)
                .documentId("doc-1")
                .chunkId("chunk-1")
                .entityId(alice)
                .entityId(paris)
                .entityTypeId(DataPointIds.entityTypeId(DATASET, "Person"))
                .entityTypeId(DataPointIds.entityTypeId(DATASET, "City"))
                .deletedEdges(persisted.getEdges())
                .build());

        InOrder order = Mockito.inOrder(relationalStore, vectorStore, graphStore);
        order.verify(graphStore).deleteEdges(any());
        order.verify(graphStore).deleteNodes(any());
        order.verify(vectorStore).deleteAll(any());
        order.verify(relationalStore).deleteEdges(any());
        order.verify(relationalStore).deleteRows(any());

        Assertions.assertEquals(6, report.getNodesDeleted());
        Assertions.assertEquals(3, report.getEdgesDeleted());
        Assertions.assertEquals(0, graphStore.countNodes(DATASET));
        Assertions.assertEquals(0, graphStore.countEdges(DATASET));
        Assertions.assertEquals(0, vectorStore.count(DATASET));
        Assertions.assertEquals(0, relationalStore.countRows(DATASET, DataPointType.ENTITY));
        Assertions.assertEquals(0, relationalStore.countEdges(DATASET));

        // 删除后重新写入同一批数据，三库恢复原状
        PersistReport again = writer.persist(batch());
        Assertions.assertEquals(6, again.getNodesWritten());
        Assertions.assertEquals(3, graphStore.countEdges(DATASET));
    }
}
