package com.gdin.inspection.cognify.index.ontology;

import com.gdin.inspection.cognify.exception.FatalPipelineException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class OntologyResolverTest {

    private static OntologySnapshot snapshot(OntologySnapshot.Definition... defs) {
        return OntologySnapshot.of(List.of(defs));
    }

    private static OntologySnapshot.Definition def(String name, String parent) {
        return new OntologySnapshot.Definition(name, parent);
    }

    @Test
    public void testExactMatchIsCaseInsensitive() {
        OntologySnapshot s = snapshot(def("Place", null), def("City", "Place"));
        ResolvedType r = new OntologyResolver(0.8).resolve("Paris", "city", s);
        Assertions.assertTrue(r.isOntologyValid());
        Assertions.assertEquals("City", r.getTypeName());
        Assertions.assertEquals(List.of("Place", "City"), r.getMatchedClass().getPath());
    }

    @Test
    public void testBelowThresholdKeepsCandidateType() {
        OntologySnapshot s = snapshot(def("Person", null));
        ResolvedType r = new OntologyResolver(0.8).resolve("Car", "Vehicle", s);
        Assertions.assertFalse(r.isOntologyValid());
        Assertions.assertEquals("Vehicle", r.getTypeName());
    }

    @Test
    public void testBlankTypeFallsBackToDefault() {
        ResolvedType r = new OntologyResolver(0.8).resolve("x", " ", OntologySnapshot.empty());
        Assertions.assertEquals(OntologyResolver.DEFAULT_TYPE, r.getTypeName());
        Assertions.assertFalse(r.isOntologyValid());
    }

    @Test
    public void testTieBreaksOnDepthThenDeclarationOrder() {
        // "place" 与两个类的相似度相同，更深的类优先
        OntologySnapshot nested = snapshot(def("Placex", null), def("Placey", "Placex"));
        Assertions.assertEquals("Placey", new OntologyResolver(0.5).resolve("e", "place", nested).getTypeName());

        // 深度也相同时取先声明的
        OntologySnapshot flat = snapshot(def("Placey", null), def("Placex", null));
        Assertions.assertEquals("Placey", new OntologyResolver(0.5).resolve("e", "place", flat).getTypeName());
    }

    @Test
    public void testInvalidSnapshotIsRejected() {
        Assertions.assertThrows(FatalPipelineException.class, () -> snapshot(def("A", "Missing")));
        Assertions.assertThrows(FatalPipelineException.class, () -> snapshot(def("A", "B"), def("B", "A")));
        Assertions.assertThrows(FatalPipelineException.class, () -> snapshot(def("A", null), def("A", null)));
    }
}
