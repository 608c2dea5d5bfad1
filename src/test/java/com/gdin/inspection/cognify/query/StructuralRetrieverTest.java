package com.gdin.inspection.cognify.query;

import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.exception.RetrievalUnavailableException;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.storage.graph.GraphEdge;
import com.gdin.inspection.cognify.storage.graph.GraphNodeMapper;
import com.gdin.inspection.cognify.storage.graph.GraphStore;
import com.gdin.inspection.cognify.storage.graph.InMemoryGraphStore;
import com.gdin.inspection.cognify.util.DataPointIds;
import com.gdin.inspection.cognify.util.RetryExecutor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;

public class StructuralRetrieverTest {

    private static final String DATASET = "ds";

    private InMemoryGraphStore graphStore;
    private StructuralRetriever retriever;

    @BeforeEach
    public void setUp() {
        graphStore = new InMemoryGraphStore();
        retriever = retriever(graphStore);
        for (String name : List.of("Alice", "Bob", "Paris")) {
            graphStore.upsertNode(GraphNodeMapper.toNode(GraphEntity.builder()
                    .id(id(name))
                    .datasetId(DATASET)
                    .name(name)
                    .typeName("Person")
                    .build()));
        }
        link("Alice", "knows", "Bob");
        link("Bob", "lives_in", "Paris");
    }

    private static StructuralRetriever retriever(GraphStore store) {
        StructuralRetriever r = new StructuralRetriever();
        ReflectionTestUtils.setField(r, "graphStore", store);
        ReflectionTestUtils.setField(r, "retryExecutor", new RetryExecutor(new CognifyProperties.Retry()));
        return r;
    }

    private static String id(String name) {
        return DataPointIds.entityId(DATASET, name);
    }

    private void link(String source, String relation, String target) {
        graphStore.upsertEdge(GraphEdge.builder()
                .sourceId(id(source))
                .relation(relation)
                .targetId(id(target))
                .datasetId(DATASET)
                .properties(Map.of())
                .build());
    }

    @Test
    public void testAnchorFromQueryTextAndHopScoring() {
        List<SearchHit> hits = retriever.retrieve("Where does Alice live?", null, DATASET, 2, 10);

        Assertions.assertEquals(List.of(id("Alice"), id("Bob"), id("Paris")), hits.stream().map(SearchHit::getId).toList());
        Assertions.assertEquals(1.0, hits.get(0).getScore());
        Assertions.assertEquals(0.5, hits.get(1).getScore());
        Assertions.assertEquals(2, hits.get(2).getHops());
        Assertions.assertEquals("Alice knows Bob", hits.get(0).getSnippet());
    }

    @Test
    public void testExplicitAnchorAndDepthLimit() {
        List<SearchHit> hits = retriever.retrieve("anything", "paris", DATASET, 1, 10);
        Assertions.assertEquals(List.of(id("Paris"), id("Bob")), hits.stream().map(SearchHit::getId).toList());
    }

    @Test
    public void testNoAnchorGivesEmptyResult() {
        Assertions.assertTrue(retriever.retrieve("nothing matches here", null, DATASET, 2, 10).isEmpty());
        Assertions.assertTrue(retriever.retrieve("Alice", null, "other-dataset", 2, 10).isEmpty());
    }

    @Test
    public void testGraphFailureIsUnavailable() {
        GraphStore broken = Mockito.mock(GraphStore.class);
        Mockito.when(broken.findNodesByName(any(), any())).thenThrow(new IllegalStateException("connection refused"));

        RetrievalUnavailableException e = Assertions.assertThrows(RetrievalUnavailableException.class,
                () -> retriever(broken).retrieve("Alice", null, DATASET, 2, 10));
        Assertions.assertEquals(List.of(SearchMode.STRUCTURAL), e.getModes());
    }

    @Test
    public void testNgramsCoverMultiWordNames() {
        Assertions.assertTrue(StructuralRetriever.ngrams("trip to New York").contains("new_york"));
        Assertions.assertTrue(StructuralRetriever.ngrams("trip to New York").contains("trip_to_new_york"));
        Assertions.assertTrue(StructuralRetriever.ngrams(" ").isEmpty());
    }
}
