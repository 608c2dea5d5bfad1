package com.gdin.inspection.cognify.storage.relational;

import com.gdin.inspection.cognify.models.DataItemStatus;
import com.gdin.inspection.cognify.models.DataPointType;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.EdgeKey;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.PipelineRun;
import com.gdin.inspection.cognify.models.PipelineRunStatus;
import com.gdin.inspection.cognify.models.TaskStatus;
import com.gdin.inspection.cognify.util.DataPointIds;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.util.List;
import java.util.Set;
import java.util.UUID;

public class JdbcRelationalStoreTest {

    private JdbcRelationalStore store;

    @BeforeEach
    public void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        store = new JdbcRelationalStore(new JdbcTemplate(dataSource), new DataSourceTransactionManager(dataSource));
    }

    private static GraphEntity alice(String description) {
        return GraphEntity.builder()
                .id(DataPointIds.entityId("ds", "Alice"))
                .datasetId("ds")
                .name("Alice")
                .typeId(DataPointIds.entityTypeId("ds", "Person"))
                .typeName("Person")
                .description(description)
                .build();
    }

    @Test
    public void testUnchangedRowKeepsSyncFlags() {
        RowSyncState first = store.upsertRows(List.of(alice("engineer"))).get(0);
        Assertions.assertTrue(first.isChanged());
        store.markVectorSynced(List.of(first));
        store.markGraphSynced(List.of(first));

        RowSyncState second = store.upsertRows(List.of(alice("engineer"))).get(0);
        Assertions.assertFalse(second.isChanged());
        Assertions.assertTrue(second.isVectorSynced());
        Assertions.assertTrue(second.isGraphSynced());
        Assertions.assertEquals(1, store.countRows("ds", DataPointType.ENTITY));
    }

    @Test
    public void testChangedRowResetsSyncFlags() {
        RowSyncState first = store.upsertRows(List.of(alice("engineer"))).get(0);
        RowSyncState second = store.upsertRows(List.of(alice("engineer\nlives in Paris"))).get(0);

        // 旧指纹的同步标记不能落到新版本上
        store.markVectorSynced(List.of(first));
        RowSyncState third = store.upsertRows(List.of(alice("engineer\nlives in Paris"))).get(0);

        Assertions.assertTrue(second.isChanged());
        Assertions.assertFalse(third.isVectorSynced());
        Assertions.assertEquals(second.getFingerprint(), store.findFingerprint(alice("x").getId()).orElseThrow());
    }

    @Test
    public void testEdgeProvenanceIsUnioned() {
        EdgeKey key = new EdgeKey("a", "knows", "b");
        Edge e1 = Edge.builder().id(DataPointIds.edgeId("ds", key)).datasetId("ds")
                .sourceId("a").relation("knows").targetId("b").build();
        e1.addProvenance("c1");
        Edge e2 = Edge.builder().id(e1.getId()).datasetId("ds")
                .sourceId("a").relation("knows").targetId("b").build();
        e2.addProvenance("c2");
        e2.addProvenance("c1");

        EdgeSyncState s1 = store.upsertEdges(List.of(e1)).get(0);
        store.markEdgesGraphSynced(List.of(s1));
        EdgeSyncState s2 = store.upsertEdges(List.of(e2)).get(0);
        EdgeSyncState s3 = store.upsertEdges(List.of(e2)).get(0);

        Assertions.assertEquals(1, s2.getProvenanceAdded());
        Assertions.assertTrue(s2.isChanged());
        Assertions.assertFalse(s2.isGraphSynced());
        Assertions.assertFalse(s3.isChanged());
        Assertions.assertEquals(0, s3.getProvenanceAdded());
        Assertions.assertEquals(Set.of("c1", "c2"), store.findProvenance(e1.getId()));
        Assertions.assertEquals(1, store.countEdges("ds"));
    }

    @Test
    public void testCommittedEntityIsReadBack() {
        GraphEntity stored = alice("engineer");
        store.upsertRows(List.of(stored));

        GraphEntity read = store.findEntities(List.of(stored.getId(), "missing")).get(stored.getId());
        Assertions.assertEquals(1, store.findEntities(List.of(stored.getId(), "missing")).size());
        Assertions.assertEquals("Person", read.getTypeName());
        Assertions.assertEquals(stored.getTypeId(), read.getTypeId());
        Assertions.assertEquals(stored.fingerprint(), read.fingerprint());
    }

    @Test
    public void testProvenanceReplacementAndDeletes() {
        EdgeKey key = new EdgeKey("a", "knows", "b");
        Edge edge = Edge.builder().id(DataPointIds.edgeId("ds", key)).datasetId("ds")
                .sourceId("a").relation("knows").targetId("b").build();
        edge.addProvenance("c1");
        edge.addProvenance("c2");
        store.markEdgesGraphSynced(store.upsertEdges(List.of(edge)));

        Edge trimmed = Edge.builder().id(edge.getId()).datasetId("ds")
                .sourceId("a").relation("knows").targetId("b").build();
        trimmed.addProvenance("c2");
        EdgeSyncState replaced = store.replaceEdgeProvenance(List.of(trimmed)).get(0);

        Assertions.assertFalse(replaced.isGraphSynced());
        Assertions.assertEquals(Set.of("c2"), store.findProvenance(edge.getId()));
        // 不存在的边不会被插入
        Edge unknown = Edge.builder().id("missing").datasetId("ds").sourceId("x").relation("knows").targetId("y").build();
        Assertions.assertTrue(store.replaceEdgeProvenance(List.of(unknown)).isEmpty());

        store.deleteEdges(List.of(edge.getId()));
        store.upsertRows(List.of(alice("engineer")));
        store.deleteRows(List.of(alice("engineer").getId()));
        store.saveDataItemStatus("doc-1", "cognify", "ds", DataItemStatus.COMPLETED);
        store.deleteDataItemStatus("doc-1", "ds");

        Assertions.assertEquals(0, store.countEdges("ds"));
        Assertions.assertEquals(0, store.countRows("ds", DataPointType.ENTITY));
        Assertions.assertTrue(store.findDataItemStatus("doc-1", "cognify", "ds").isEmpty());
    }

    @Test
    public void testDataItemStatusUpsert() {
        Assertions.assertTrue(store.findDataItemStatus("doc", "cognify", "ds").isEmpty());
        store.saveDataItemStatus("doc", "cognify", "ds", DataItemStatus.PROCESSING);
        store.saveDataItemStatus("doc", "cognify", "ds", DataItemStatus.COMPLETED);
        Assertions.assertEquals(DataItemStatus.COMPLETED, store.findDataItemStatus("doc", "cognify", "ds").orElseThrow());
        Assertions.assertTrue(store.findDataItemStatus("doc", "cognify", "other").isEmpty());
    }

    @Test
    public void testPipelineRunIsStoredAfterEveryTransition() {
        PipelineRun run = new PipelineRun("run-1", "ds", "cognify");
        store.savePipelineRun(run);
        Assertions.assertEquals(PipelineRunStatus.STARTED, store.findPipelineRun("run-1").orElseThrow().getStatus());

        run.transitionTo(PipelineRunStatus.RUNNING);
        run.taskStarted("classify_documents");
        run.taskFinished("classify_documents", TaskStatus.COMPLETED, 2, 0, null);
        run.unitFailed("doc-9", "chunk_documents: bad utf-8");
        run.fail("extract_graph", "boom");
        store.savePipelineRun(run);

        PipelineRun loaded = store.findPipelineRun("run-1").orElseThrow();
        Assertions.assertEquals(PipelineRunStatus.FAILED, loaded.getStatus());
        Assertions.assertEquals("extract_graph", loaded.getFailedTask());
        Assertions.assertEquals(1, loaded.getTaskLog().size());
        Assertions.assertEquals(TaskStatus.COMPLETED, loaded.getTaskLog().get(0).getStatus());
        Assertions.assertEquals("chunk_documents: bad utf-8", loaded.getFailedUnits().get("doc-9"));
        Assertions.assertEquals(1, store.listPipelineRuns("ds").size());
        Assertions.assertTrue(store.listPipelineRuns("other").isEmpty());
    }
}
