package com.webdelta.core.model;

/** 변경 유형. 현재는 내용 변경 한 가지 */
public enum ChangeType {
    CONTENT_CHANGE("content_change");

    private final String wireName;

    ChangeType(String wireName) { this.wireName = wireName; }

    /** 산출물(JSON)에 쓰이는 이름 */
    public String wireName() { return wireName; }
}
