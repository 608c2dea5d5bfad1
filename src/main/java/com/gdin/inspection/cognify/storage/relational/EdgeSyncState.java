package com.gdin.inspection.cognify.storage.relational;

import com.gdin.inspection.cognify.models.EdgeKey;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class EdgeSyncState {
    String id;
    EdgeKey key;
    String fingerprint;
    /** 合并后的完整 provenance */
    Set<String> provenance;
    boolean changed;
    boolean graphSynced;
    /** 本次新增的 provenance 条数 */
    int provenanceAdded;
}
