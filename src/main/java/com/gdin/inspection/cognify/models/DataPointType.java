package com.gdin.inspection.cognify.models;

public enum DataPointType {
    DOCUMENT,
    DOCUMENT_CHUNK,
    ENTITY,
    ENTITY_TYPE,
    TEXT_SUMMARY,
    CODE_SUMMARY
}
