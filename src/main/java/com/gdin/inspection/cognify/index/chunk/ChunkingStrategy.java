package com.gdin.inspection.cognify.index.chunk;

import java.util.Iterator;

/**
 * 把一段规范化文本切成连续片段。按顺序拼接全部片段必须恰好还原输入。
 */
public interface ChunkingStrategy {

    String name();

    Iterator<String> split(String text);
}
