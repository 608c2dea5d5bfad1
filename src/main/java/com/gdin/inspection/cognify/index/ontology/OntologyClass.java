package com.gdin.inspection.cognify.index.ontology;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class OntologyClass {
    String name;
    String parent;
    /** 从根到自身的类名路径 */
    List<String> path;
    /** 声明顺序，用于最后的平局裁决 */
    int order;

    public int depth() {
        return path == null ? 0 : path.size();
    }
}
