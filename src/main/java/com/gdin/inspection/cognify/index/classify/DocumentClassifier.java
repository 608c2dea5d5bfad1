package com.gdin.inspection.cognify.index.classify;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.crypto.SecureUtil;
import com.gdin.inspection.cognify.models.Document;
import com.gdin.inspection.cognify.models.DocumentCategory;
import com.gdin.inspection.cognify.models.RawDocument;
import com.gdin.inspection.cognify.util.DataPointIds;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 文档分类：按内容哈希生成确定性 id，按扩展名推断 mime 与 TEXT/CODE 类别。
 * 这里不解码内容，解码由切片器负责。
 */
@Service
public class DocumentClassifier {

    private static final Set<String> CODE_EXTENSIONS = Set.of(
            "java", "kt", "scala", "groovy", "py", "js", "jsx", "ts", "tsx", "go", "rs",
            "c", "h", "cc", "cpp", "hpp", "cs", "rb", "php", "swift", "sql", "sh");

    private static final Map<String, String> MIME_OVERRIDES = Map.of(
            "md", "text/markdown",
            "txt", "text/plain",
            "csv", "text/csv",
            "json", "application/json",
            "yaml", "application/yaml",
            "yml", "application/yaml");

    public Document classify(RawDocument raw, String datasetId) {
        byte[] content = raw.getContent() == null ? new byte[0] : raw.getContent();
        String name = StrUtil.blankToDefault(raw.getName(), "unnamed");
        String ext = StrUtil.nullToEmpty(FileUtil.extName(name)).toLowerCase(Locale.ROOT);
        DocumentCategory category = CODE_EXTENSIONS.contains(ext) ? DocumentCategory.CODE : DocumentCategory.TEXT;
        String contentHash = SecureUtil.sha256().digestHex(content);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("extension", ext);

        return Document.builder()
                .id(DataPointIds.documentId(datasetId, contentHash))
                .datasetId(datasetId)
                .name(name)
                .mimeType(StrUtil.blankToDefault(raw.getMimeType(), mimeType(name, ext, category)))
                .category(category)
                .contentHash(contentHash)
                .sizeBytes((long) content.length)
                .rawContent(content)
                .metadata(metadata)
                .build();
    }

    private static String mimeType(String name, String ext, DocumentCategory category) {
        String override = MIME_OVERRIDES.get(ext);
        if (override != null) return override;
        String guessed = FileUtil.getMimeType(name);
        if (guessed != null) return guessed;
        return category == DocumentCategory.CODE ? "text/x-source" : "text/plain";
    }
}
