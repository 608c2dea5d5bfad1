package com.gdin.inspection.cognify.index.chunk;

/**
 * 切片前的文本规范化：去掉 BOM，CRLF 与单独的 CR 统一为 LF。
 * 分片拼接还原的是规范化后的文本。
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";
        String s = text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
        return s.replace("\r\n", "\n").replace('\r', '\n');
    }
}
