package com.gdin.inspection.cognify.index.chunk;

import com.gdin.inspection.cognify.config.properties.CognifyProperties;
import com.gdin.inspection.cognify.exception.DecodingException;
import com.gdin.inspection.cognify.exception.FatalPipelineException;
import com.gdin.inspection.cognify.models.Document;
import com.gdin.inspection.cognify.models.DocumentChunk;
import com.gdin.inspection.cognify.util.DataPointIds;
import com.gdin.inspection.cognify.util.TokenUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 文档切片。
 * <p>
 * 返回的序列是惰性、有序、有限的，每次 iterator() 都从头开始重新切，结果相同。
 * 分片按 chunkIndex 顺序拼接即得到规范化后的全文。
 */
@Slf4j
@Service
public class Chunker {

    @Resource
    private TokenUtil tokenUtil;

    @Resource
    private CognifyProperties cognifyProperties;

    public Chunker() {
    }

    public Chunker(TokenUtil tokenUtil, CognifyProperties cognifyProperties) {
        this.tokenUtil = tokenUtil;
        this.cognifyProperties = cognifyProperties;
    }

    public ChunkingStrategy defaultStrategy() {
        CognifyProperties.Chunking cfg = cognifyProperties.getChunking();
        return switch (cfg.getStrategy()) {
            case "size" -> new SizeBoundedChunkingStrategy(tokenUtil, cfg.getMaxChunkTokens());
            case "paragraph" -> new ParagraphChunkingStrategy(cfg.getParagraphMaxChars());
            default -> throw new FatalPipelineException("未知的切片策略: " + cfg.getStrategy());
        };
    }

    public Iterable<DocumentChunk> chunk(Document document) {
        return chunk(document, defaultStrategy());
    }

    /**
     * @throws DecodingException 文档内容不是合法 UTF-8
     */
    public Iterable<DocumentChunk> chunk(Document document, ChunkingStrategy strategy) {
        String text = TextNormalizer.normalize(decode(document));
        return () -> new Iterator<>() {
            private final Iterator<String> pieces = strategy.split(text);
            private int index = 0;
            private int offset = 0;

            @Override
            public boolean hasNext() {
                return pieces.hasNext();
            }

            @Override
            public DocumentChunk next() {
                if (!hasNext()) throw new NoSuchElementException();
                String piece = pieces.next();
                DocumentChunk chunk = toChunk(document, strategy, piece, index, offset);
                index++;
                offset += piece.length();
                return chunk;
            }
        };
    }

    private DocumentChunk toChunk(Document document, ChunkingStrategy strategy, String piece, int index, int offset) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("document_name", document.getName());
        metadata.put("start_offset", offset);
        metadata.put("chunking_strategy", strategy.name());
        return DocumentChunk.builder()
                .id(DataPointIds.chunkId(document.getDatasetId(), document.getId(), index))
                .datasetId(document.getDatasetId())
                .documentId(document.getId())
                .chunkIndex(index)
                .text(piece)
                .tokenCount(tokenUtil.getTokenCount(piece))
                .category(document.getCategory())
                .metadata(metadata)
                .build();
    }

    static String decode(Document document) {
        byte[] raw = document.getRawContent() == null ? new byte[0] : document.getRawContent();
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("文档不是合法 UTF-8: id={}, name={}", document.getId(), document.getName());
            throw new DecodingException(document.getId(), "文档不是合法 UTF-8: " + document.getName(), e);
        }
    }
}
