package com.gdin.inspection.cognify.index.prompts;

public final class SummarizePrompts {

    private SummarizePrompts() {
    }

    public static String text(String content) {
        return """
请用简洁的一段话概括下面文本的主要内容，保留关键的人物、地点、事件与结论，不要添加原文没有的信息。
只输出摘要本身。

%s
""".formatted(content);
    }

    public static String code(String content) {
        return """
请概括下面这段代码的用途：说明它定义了哪些主要的类、函数或接口，以及它们各自的职责。
只输出摘要本身，不要复述代码。

%s
""".formatted(content);
    }
}
