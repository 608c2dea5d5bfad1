package com.gdin.inspection.cognify.exception;

import com.gdin.inspection.cognify.query.SearchMode;
import lombok.Getter;

import java.util.List;

/**
 * 检索所需的后端不可用。modes 列出失败的检索模式。
 */
@Getter
public class RetrievalUnavailableException extends CognifyException {

    private final List<SearchMode> modes;

    public RetrievalUnavailableException(List<SearchMode> modes, String message, Throwable cause) {
        super(message, cause);
        this.modes = List.copyOf(modes);
    }

    public RetrievalUnavailableException(SearchMode mode, String message, Throwable cause) {
        this(List.of(mode), message, cause);
    }
}
