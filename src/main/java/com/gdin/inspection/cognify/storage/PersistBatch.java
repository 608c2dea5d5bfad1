package com.gdin.inspection.cognify.storage;

import com.gdin.inspection.cognify.models.DataPoint;
import com.gdin.inspection.cognify.models.Edge;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一次三库写入的数据：数据点 + 边。
 */
@Value
@Builder
public class PersistBatch {

    @Singular
    List<DataPoint> dataPoints;

    @Singular
    List<Edge> edges;

    public boolean isEmpty() {
        return dataPoints.isEmpty() && edges.isEmpty();
    }

    public static PersistBatch empty() {
        return PersistBatch.builder().build();
    }
}
