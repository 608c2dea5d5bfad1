package com.gdin.inspection.cognify.storage.relational;

import lombok.Builder;
import lombok.Value;

/**
 * 关系库中一行数据点在下游两个库的同步状态。
 * 指纹变化时两个标记都会被重置。
 */
@Value
@Builder
public class RowSyncState {
    String id;
    String fingerprint;
    /** 本次 upsert 是否改写了关系库中的行 */
    boolean changed;
    boolean vectorSynced;
    boolean graphSynced;
}
