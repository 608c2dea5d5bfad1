package com.gdin.inspection.cognify.index.chunk;

import com.gdin.inspection.cognify.util.TokenUtil;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按 token 上限在词边界处切分；单个词本身超过上限时按字符二分切开。
 */
public class SizeBoundedChunkingStrategy implements ChunkingStrategy {

    // 一个词连同其后的空白，或者文本开头的纯空白
    private static final Pattern PIECE = Pattern.compile("\\S+\\s*|\\s+");

    private final TokenUtil tokenUtil;
    private final int maxTokens;

    public SizeBoundedChunkingStrategy(TokenUtil tokenUtil, int maxTokens) {
        if (maxTokens <= 0) throw new IllegalArgumentException("maxTokens 必须大于 0");
        this.tokenUtil = tokenUtil;
        this.maxTokens = maxTokens;
    }

    @Override
    public String name() {
        return "size";
    }

    @Override
    public Iterator<String> split(String text) {
        return new Iterator<>() {
            private final Matcher matcher = PIECE.matcher(text);
            private int pos = 0;

            @Override
            public boolean hasNext() {
                return pos < text.length();
            }

            @Override
            public String next() {
                if (!hasNext()) throw new NoSuchElementException();
                int start = pos;
                int tokens = 0;
                while (pos < text.length() && matcher.find(pos)) {
                    String piece = matcher.group();
                    int pieceTokens = tokenUtil.getTokenCount(piece);
                    if (tokens > 0 && tokens + pieceTokens > maxTokens) break;
                    if (tokens == 0 && pieceTokens > maxTokens) {
                        pos += longestPrefixWithin(piece);
                        break;
                    }
                    tokens += pieceTokens;
                    pos = matcher.end();
                    if (tokens >= maxTokens) break;
                }
                return text.substring(start, pos);
            }
        };
    }

    /**
     * token 数不超过上限的最长前缀长度，至少为 1 个字符（不拆代理对）。
     */
    private int longestPrefixWithin(String piece) {
        int lo = 1;
        int hi = piece.length();
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (tokenUtil.getTokenCount(piece.substring(0, mid)) <= maxTokens) lo = mid;
            else hi = mid - 1;
        }
        if (lo < piece.length() && Character.isHighSurrogate(piece.charAt(lo - 1))) {
            lo = lo > 1 ? lo - 1 : lo + 1;
        }
        return lo;
    }
}
