package com.gdin.inspection.cognify.index.embed;

import cn.hutool.core.lang.hash.MurmurHash;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 不依赖外部服务的词袋哈希向量，同一文本永远得到同一向量。
 * 用于离线环境和测试，检索质量只够区分词面重叠。
 */
public class HashingEmbeddingModel implements EmbeddingModel {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final int dimension;

    public HashingEmbeddingModel(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
        List<Embedding> out = new ArrayList<>(textSegments.size());
        for (TextSegment segment : textSegments) {
            out.add(Embedding.from(vector(segment.text())));
        }
        return Response.from(out);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    float[] vector(String text) {
        float[] v = new float[dimension];
        if (text == null) return v;
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty()) continue;
            int h = MurmurHash.hash32(token.getBytes(StandardCharsets.UTF_8));
            int idx = Math.floorMod(h, dimension);
            v[idx] += (h & 0x40000000) == 0 ? 1f : -1f;
        }
        double norm = 0;
        for (float x : v) norm += x * x;
        if (norm > 0) {
            float inv = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < v.length; i++) v[i] *= inv;
        }
        return v;
    }
}
