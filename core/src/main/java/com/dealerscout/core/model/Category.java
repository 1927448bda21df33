package com.dealerscout.core.model;

/** 딜러 분류 */
public enum Category {
    FRANCHISED,
    USED,
    COLLISION,
    FIXED_OPS,
    UNKNOWN
}
