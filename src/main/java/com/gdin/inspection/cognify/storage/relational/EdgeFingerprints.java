package com.gdin.inspection.cognify.storage.relational;

import cn.hutool.crypto.SecureUtil;
import com.gdin.inspection.cognify.models.EdgeKey;

import java.util.Collection;
import java.util.TreeSet;

/**
 * 边的指纹只由 (source, relation, target) 与 provenance 集合决定，与 provenance 顺序无关。
 */
public final class EdgeFingerprints {

    private EdgeFingerprints() {
    }

    public static String of(EdgeKey key, Collection<String> provenance) {
        return SecureUtil.sha256(key + "|" + String.join(",", new TreeSet<>(provenance)));
    }
}
