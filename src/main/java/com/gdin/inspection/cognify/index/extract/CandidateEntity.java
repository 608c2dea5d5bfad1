package com.gdin.inspection.cognify.index.extract;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CandidateEntity {
    String name;
    String type;
    String description;
}
