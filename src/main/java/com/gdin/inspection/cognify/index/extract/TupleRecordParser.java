package com.gdin.inspection.cognify.index.extract;

import cn.hutool.core.util.StrUtil;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 解析 tuple 协议的模型输出：
 * <pre>
 * ("entity"&lt;|&gt;name&lt;|&gt;type&lt;|&gt;description)##
 * ("relationship"&lt;|&gt;source&lt;|&gt;target&lt;|&gt;label&lt;|&gt;description&lt;|&gt;strength)##
 * &lt;|COMPLETE|&gt;
 * </pre>
 * 字段数不足的记录直接丢弃。
 */
public class TupleRecordParser {

    private final String tupleDelimiter;
    private final String recordDelimiter;
    private final String completionDelimiter;

    public TupleRecordParser(String tupleDelimiter, String recordDelimiter, String completionDelimiter) {
        this.tupleDelimiter = tupleDelimiter;
        this.recordDelimiter = recordDelimiter;
        this.completionDelimiter = completionDelimiter;
    }

    public ExtractedGraph parse(String output) {
        ExtractedGraph.ExtractedGraphBuilder builder = ExtractedGraph.builder();
        if (StrUtil.isBlank(output)) return builder.build();

        String combined = output.replace(completionDelimiter, "");
        for (String rec : combined.split(Pattern.quote(recordDelimiter))) {
            String record = rec.trim();
            if (record.isEmpty()) continue;

            // 去掉最外层括号
            record = record.replaceAll("^\\(|\\)$", "").trim();
            if (record.isEmpty()) continue;

            String[] fields = record.split(Pattern.quote(tupleDelimiter));
            String tag = cleanStr(fields[0]).toLowerCase(Locale.ROOT);
            if ("entity".equals(tag) && fields.length >= 4) {
                String name = cleanStr(fields[1]);
                if (name.isEmpty()) continue;
                builder.entity(CandidateEntity.builder()
                        .name(name)
                        .type(cleanStr(fields[2]))
                        .description(cleanStr(fields[3]))
                        .build());
            } else if ("relationship".equals(tag) && fields.length >= 5) {
                String source = cleanStr(fields[1]);
                String target = cleanStr(fields[2]);
                if (source.isEmpty() || target.isEmpty()) continue;
                boolean withStrength = fields.length >= 6;
                builder.relation(CandidateRelation.builder()
                        .source(source)
                        .target(target)
                        .label(cleanStr(fields[3]))
                        .description(cleanStr(fields[4]))
                        .strength(withStrength ? parseStrength(fields[5]) : null)
                        .build());
            }
        }
        return builder.build();
    }

    private static Double parseStrength(String s) {
        try {
            return Double.parseDouble(cleanStr(s));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String cleanStr(String s) {
        if (s == null) return "";
        return s.trim().replaceAll("^\"|\"$", "").trim();
    }
}
