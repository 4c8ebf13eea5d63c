package com.webdelta.core.model;

/** 렌더 완료 판정 기준 */
public enum WaitStrategy { LOAD, DOMCONTENTLOADED, NETWORKIDLE }
