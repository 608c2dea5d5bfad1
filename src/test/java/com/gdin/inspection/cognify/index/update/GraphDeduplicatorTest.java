package com.gdin.inspection.cognify.index.update;

import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.index.extract.CandidateEntity;
import com.gdin.inspection.cognify.index.extract.CandidateRelation;
import com.gdin.inspection.cognify.index.extract.ExtractedGraph;
import com.gdin.inspection.cognify.index.ontology.OntologyResolver;
import com.gdin.inspection.cognify.index.ontology.OntologySnapshot;
import com.gdin.inspection.cognify.models.DocumentCategory;
import com.gdin.inspection.cognify.models.DocumentChunk;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.EdgeKey;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.Relations;
import com.gdin.inspection.cognify.storage.graph.GraphNodeMapper;
import com.gdin.inspection.cognify.storage.graph.InMemoryGraphStore;
import com.gdin.inspection.cognify.util.DataPointIds;
import com.gdin.inspection.cognify.util.RetryExecutor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public class GraphDeduplicatorTest {

    private static final String DATASET = "ds";

    private InMemoryGraphStore graphStore;
    private GraphDeduplicator deduplicator;
    private OntologySnapshot ontology;

    @BeforeEach
    public void setUp() {
        CognifyProperties.Retry retry = new CognifyProperties.Retry();
        retry.setBackoffMs(1L);
        graphStore = new InMemoryGraphStore();
        deduplicator = new GraphDeduplicator();
        ReflectionTestUtils.setField(deduplicator, "graphStore", graphStore);
        ReflectionTestUtils.setField(deduplicator, "retryExecutor", new RetryExecutor(retry));
        ReflectionTestUtils.setField(deduplicator, "ontologyResolver", new OntologyResolver(0.8));
        ReflectionTestUtils.setField(deduplicator, "entityMergeService", new EntityMergeService());
        ReflectionTestUtils.setField(deduplicator, "relationshipMergeService", new RelationshipMergeService());
        ontology = OntologySnapshot.of(List.of(
                new OntologySnapshot.Definition("Person", null),
                new OntologySnapshot.Definition("Place", null),
                new OntologySnapshot.Definition("City", "Place")));
    }

    private static DocumentChunk chunk(String id) {
        return DocumentChunk.builder()
                .id(id)
                .datasetId(DATASET)
                .documentId("doc-1")
                .chunkIndex(0)
                .text("Alice lives in Paris.")
                .category(DocumentCategory.TEXT)
                .build();
    }

    private static CandidateEntity entity(String name, String type) {
        return CandidateEntity.builder().name(name).type(type).description(name + " desc").build();
    }

    private static CandidateRelation relation(String source, String target, String label) {
        return CandidateRelation.builder().source(source).target(target).label(label).description("").build();
    }

    @Test
    public void testNewEntitiesWithStructuralEdges() {
        DocumentChunk chunk = chunk("c1");
        ExtractedGraph graph = ExtractedGraph.builder()
                .entity(entity("Alice", "Person"))
                .entity(entity("Paris", "city"))
                .entity(entity("alice", "Person"))
                .relation(relation("Alice", "Paris", "Lives In"))
                .relation(relation("Alice", "Bob", "knows"))
                .build();

        DeduplicationResult r = deduplicator.deduplicate(chunk, graph, ontology);

        Assertions.assertEquals(2, r.getEntities().size());
        Assertions.assertEquals(2, r.getNewEntities());
        Assertions.assertEquals(1, r.getDroppedRelations());
        Assertions.assertEquals(Set.of("Person", "City"),
                r.getEntityTypes().stream().map(t -> t.getName()).collect(Collectors.toSet()));

        String alice = DataPointIds.entityId(DATASET, "Alice");
        String paris = DataPointIds.entityId(DATASET, "Paris");
        Set<EdgeKey> keys = r.getEdges().stream().map(Edge::key).collect(Collectors.toSet());
        Assertions.assertEquals(Set.of(
                new EdgeKey(alice, "lives_in", paris),
                new EdgeKey("c1", Relations.IS_PART_OF, "doc-1"),
                new EdgeKey("c1", Relations.CONTAINS, alice),
                new EdgeKey("c1", Relations.CONTAINS, paris),
                new EdgeKey(alice, Relations.IS_A, DataPointIds.entityTypeId(DATASET, "Person")),
                new EdgeKey(paris, Relations.IS_A, DataPointIds.entityTypeId(DATASET, "City"))), keys);
        Assertions.assertEquals(List.of(alice, paris), chunk.getContains());
        r.getEdges().forEach(e -> Assertions.assertEquals(Set.of("c1"), e.getProvenance()));
    }

    @Test
    public void testResultDoesNotDependOnCandidateOrder() {
        ExtractedGraph forward = ExtractedGraph.builder()
                .entity(entity("Alice", "Person"))
                .entity(entity("Bob", "Person"))
                .entity(entity("Paris", "City"))
                .relation(relation("Alice", "Bob", "knows"))
                .relation(relation("Bob", "Paris", "visits"))
                .build();
        ExtractedGraph backward = ExtractedGraph.builder()
                .entity(entity("Paris", "City"))
                .entity(entity("Bob", "Person"))
                .entity(entity("Alice", "Person"))
                .relation(relation("Bob", "Paris", "visits"))
                .relation(relation("Alice", "Bob", "knows"))
                .build();

        DeduplicationResult a = deduplicator.deduplicate(chunk("c1"), forward, ontology);
        DeduplicationResult b = deduplicator.deduplicate(chunk("c1"), backward, ontology);

        Assertions.assertEquals(
                a.getEntities().stream().map(GraphEntity::fingerprint).collect(Collectors.toSet()),
                b.getEntities().stream().map(GraphEntity::fingerprint).collect(Collectors.toSet()));
        Assertions.assertEquals(
                a.getEdges().stream().map(Edge::key).collect(Collectors.toSet()),
                b.getEdges().stream().map(Edge::key).collect(Collectors.toSet()));
    }

    @Test
    public void testConflictingCandidatesMergeTheSameWayInAnyOrder() {
        List<CandidateEntity> entities = List.of(
                CandidateEntity.builder().name("Alice").type("Person").description("a1").build(),
                CandidateEntity.builder().name("alice").type("Organization").description("a2").build(),
                entity("Bob", "Person"),
                entity("Paris", "City"));
        List<CandidateRelation> relations = List.of(
                relation("Alice", "Bob", "knows"),
                relation("Alice", "Paris", "lives in"));

        ExtractedGraph.ExtractedGraphBuilder forward = ExtractedGraph.builder();
        entities.forEach(forward::entity);
        relations.forEach(forward::relation);
        ExtractedGraph.ExtractedGraphBuilder reversed = ExtractedGraph.builder();
        for (int i = entities.size() - 1; i >= 0; i--) reversed.entity(entities.get(i));
        for (int i = relations.size() - 1; i >= 0; i--) reversed.relation(relations.get(i));

        GraphEntity a = alice(deduplicator.deduplicate(chunk("c1"), forward.build(), ontology));
        GraphEntity b = alice(deduplicator.deduplicate(chunk("c1"), reversed.build(), ontology));

        // 本体内的 Person 优先于本体外的 Organization
        Assertions.assertEquals("Person", a.getTypeName());
        Assertions.assertEquals(a.getTypeName(), b.getTypeName());
        Assertions.assertEquals(a.getName(), b.getName());
        Assertions.assertEquals("a1\na2", a.getDescription());
        Assertions.assertEquals(a.getDescription(), b.getDescription());
        Assertions.assertEquals(a.getRelations(), b.getRelations());
        Assertions.assertEquals(a.fingerprint(), b.fingerprint());
    }

    private static GraphEntity alice(DeduplicationResult r) {
        String id = DataPointIds.entityId(DATASET, "Alice");
        return r.getEntities().stream().filter(e -> e.getId().equals(id)).findFirst().orElseThrow();
    }

    @Test
    public void testExistingEntityKeepsCommittedType() {
        GraphEntity committed = GraphEntity.builder()
                .id(DataPointIds.entityId(DATASET, "Alice"))
                .datasetId(DATASET)
                .name("Alice")
                .typeId(DataPointIds.entityTypeId(DATASET, "Person"))
                .typeName("Person")
                .ontologyValid(true)
                .description("first")
                .build();
        graphStore.upsertNode(GraphNodeMapper.toNode(committed));

        ExtractedGraph graph = ExtractedGraph.builder()
                .entity(CandidateEntity.builder().name("ALICE").type("Organization").description("second").build())
                .build();
        DeduplicationResult r = deduplicator.deduplicate(chunk("c2"), graph, ontology);

        Assertions.assertEquals(0, r.getNewEntities());
        Assertions.assertEquals(1, r.getMergedEntities());
        Assertions.assertEquals(1, r.getTypeConflicts());
        GraphEntity merged = r.getEntities().get(0);
        Assertions.assertEquals("Person", merged.getTypeName());
        Assertions.assertEquals("first\nsecond", merged.getDescription());
        Assertions.assertTrue(r.getEntityTypes().stream().noneMatch(t -> t.getName().equals("Organization")));
    }
}
