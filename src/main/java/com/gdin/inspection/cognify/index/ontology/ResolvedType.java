package com.gdin.inspection.cognify.index.ontology;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ResolvedType {
    /** 规范化后的类型名：命中本体时为本体类名，否则为候选类型原样 */
    String typeName;
    boolean ontologyValid;
    OntologyClass matchedClass;
    double similarity;
}
