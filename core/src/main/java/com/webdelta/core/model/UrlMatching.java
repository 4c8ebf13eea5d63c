package com.webdelta.core.model;

/**
 * 치환 후 URL 동등성 판정 방식.
 * EXACT: 문자열 완전 일치(기본)
 * NORMALIZED: scheme/host 대소문자, 끝 슬래시, 쿼리 파라미터 순서 무시
 */
public enum UrlMatching { EXACT, NORMALIZED }
