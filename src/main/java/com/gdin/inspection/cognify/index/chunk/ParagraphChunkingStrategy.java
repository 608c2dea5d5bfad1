package com.gdin.inspection.cognify.index.chunk;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按段落（空行分隔）聚合，单片不超过 maxChars；超长段落按字符硬切。
 */
public class ParagraphChunkingStrategy implements ChunkingStrategy {

    // 段落正文连同其后的空行
    private static final Pattern PARAGRAPH = Pattern.compile("(?s).+?(?:\\n[ \\t]*\\n\\s*|\\z)");

    private final int maxChars;

    public ParagraphChunkingStrategy(int maxChars) {
        if (maxChars <= 0) throw new IllegalArgumentException("maxChars 必须大于 0");
        this.maxChars = maxChars;
    }

    @Override
    public String name() {
        return "paragraph";
    }

    @Override
    public Iterator<String> split(String text) {
        return new Iterator<>() {
            private final Matcher matcher = PARAGRAPH.matcher(text);
            private int pos = 0;

            @Override
            public boolean hasNext() {
                return pos < text.length();
            }

            @Override
            public String next() {
                if (!hasNext()) throw new NoSuchElementException();
                int start = pos;
                while (pos < text.length() && matcher.find(pos)) {
                    int len = matcher.end() - pos;
                    if (pos > start && (pos - start) + len > maxChars) break;
                    if (pos == start && len > maxChars) {
                        pos = safeCut(text, pos + maxChars);
                        break;
                    }
                    pos = matcher.end();
                }
                return text.substring(start, pos);
            }
        };
    }

    private static int safeCut(String text, int at) {
        if (at < text.length() && Character.isHighSurrogate(text.charAt(at - 1))) return at + 1;
        return at;
    }
}
