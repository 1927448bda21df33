package com.dealerscout.core.model;

/**
 * 전략 우선순위 등급. 선언 순서가 곧 선택 순서다.
 * SPECIFIC(사이트 전용) → GENERIC(패턴 계열) → FALLBACK(휴리스틱/LLM).
 */
public enum Tier {
    SPECIFIC,
    GENERIC,
    FALLBACK;

    /** 더 높은 우선순위면 true (null은 최하위 취급) */
    public boolean outranks(Tier other) {
        if (other == null) return true;
        return this.ordinal() < other.ordinal();
    }
}
