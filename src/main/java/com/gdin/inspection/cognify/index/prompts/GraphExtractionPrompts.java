package com.gdin.inspection.cognify.index.prompts;

import java.util.List;

/**
 * 图抽取提示词。
 */
public final class GraphExtractionPrompts {

    private GraphExtractionPrompts() {
    }

    public static String build(String text,
                               List<String> entityTypes,
                               String recordDelimiter,
                               String tupleDelimiter,
                               String completionDelimiter) {
        String types = entityTypes == null || entityTypes.isEmpty()
                ? "不限，按文本内容自行归类"
                : String.join(", ", entityTypes);
        String t = tupleDelimiter;
        return """
- 任务说明 -
从给定文本中识别所有不同的实体，以及实体之间所有明确存在的关系。

- 实体抽取规则 -
1. 每个实体提取：entity_name（实体名称）、entity_type（实体类型，候选类型：%s）、entity_description（实体在文本中的含义或属性）。
2. 每个实体输出为：("entity"%s<entity_name>%s<entity_type>%s<entity_description>)

- 关系抽取规则 -
1. 只在已识别的实体之间抽取关系，source 与 target 必须是上面出现过的 entity_name。
2. relationship_label 用简短的小写动词短语，单词之间用下划线连接，例如 met_in、works_for、located_in。
3. 每条关系输出为：("relationship"%s<source_entity>%s<target_entity>%s<relationship_label>%s<relationship_description>%s<relationship_strength>)
   relationship_strength 为 0~1 之间的小数。

- 输出格式要求 -
1. 所有实体与关系组成一个列表，记录之间用 %s 分隔。
2. 全部输出完成后追加 %s。
3. 不要输出任何解释性文字或 markdown。

- 文本 -
%s
""".formatted(types, t, t, t, t, t, t, t, t,
                recordDelimiter, completionDelimiter, text);
    }
}
