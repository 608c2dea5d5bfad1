package com.gdin.inspection.cognify.index.ontology;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.inspection.cognify.exception.FatalPipelineException;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 某一时刻的本体快照：类名 + 父类，加载后不可变。
 * <pre>
 * {"classes": [{"name": "Place"}, {"name": "City", "parent": "Place"}]}
 * </pre>
 */
public final class OntologySnapshot {

    private static final OntologySnapshot EMPTY = new OntologySnapshot(List.of());

    private final List<OntologyClass> classes;

    private OntologySnapshot(List<OntologyClass> classes) {
        this.classes = Collections.unmodifiableList(classes);
    }

    public static OntologySnapshot empty() {
        return EMPTY;
    }

    public List<OntologyClass> getClasses() {
        return classes;
    }

    public boolean isEmpty() {
        return classes.isEmpty();
    }

    /**
     * 按声明顺序建立快照，父类可以声明在子类之后；父类不存在或成环时抛出异常。
     */
    public static OntologySnapshot of(List<Definition> definitions) {
        Map<String, Definition> byName = new LinkedHashMap<>();
        for (Definition d : definitions) {
            if (d.getName() == null || d.getName().isBlank()) {
                throw new FatalPipelineException("本体类名不能为空");
            }
            if (byName.putIfAbsent(d.getName(), d) != null) {
                throw new FatalPipelineException("本体类重复声明: " + d.getName());
            }
        }
        List<OntologyClass> out = new ArrayList<>(byName.size());
        int order = 0;
        for (Definition d : byName.values()) {
            out.add(OntologyClass.builder()
                    .name(d.getName())
                    .parent(d.getParent())
                    .path(pathOf(d, byName))
                    .order(order++)
                    .build());
        }
        return new OntologySnapshot(out);
    }

    private static List<String> pathOf(Definition d, Map<String, Definition> byName) {
        List<String> path = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Definition cur = d;
        while (cur != null) {
            if (!seen.add(cur.getName())) {
                throw new FatalPipelineException("本体继承成环: " + d.getName());
            }
            path.add(0, cur.getName());
            String parent = cur.getParent();
            if (parent == null || parent.isBlank()) break;
            cur = byName.get(parent);
            if (cur == null) {
                throw new FatalPipelineException("本体父类不存在: " + parent);
            }
        }
        return path;
    }

    @Data
    @NoArgsConstructor
    public static class Definition {
        @JsonProperty("name")
        private String name;
        @JsonProperty("parent")
        private String parent;

        public Definition(String name, String parent) {
            this.name = name;
            this.parent = parent;
        }
    }

    @Data
    @NoArgsConstructor
    public static class Document {
        @JsonProperty("classes")
        private List<Definition> classes = new ArrayList<>();
    }
}
