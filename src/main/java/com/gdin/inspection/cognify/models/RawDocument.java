package com.gdin.inspection.cognify.models;

import lombok.Builder;
import lombok.Value;

/**
 * 待认知化的原始输入：名称 + 字节内容。
 */
@Value
@Builder
public class RawDocument {
    String name;
    byte[] content;
    /** 可选，未提供时按扩展名推断 */
    String mimeType;
}
