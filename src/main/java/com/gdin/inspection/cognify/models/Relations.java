package com.gdin.inspection.cognify.models;

/**
 * 管道自身产生的结构性关系标签。
 */
public final class Relations {

    public static final String IS_PART_OF = "is_part_of";
    public static final String CONTAINS = "contains";
    public static final String IS_A = "is_a";
    public static final String MADE_FROM = "made_from";

    private Relations() {
    }
}
