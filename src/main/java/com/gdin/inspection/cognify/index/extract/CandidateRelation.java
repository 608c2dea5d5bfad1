package com.gdin.inspection.cognify.index.extract;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CandidateRelation {
    String source;
    String target;
    String label;
    String description;
    Double strength;
}
