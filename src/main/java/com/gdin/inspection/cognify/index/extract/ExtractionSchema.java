package com.gdin.inspection.cognify.index.extract;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ExtractionSchema {
    /** 候选实体类型提示，为空表示不限 */
    List<String> entityTypes;
}
