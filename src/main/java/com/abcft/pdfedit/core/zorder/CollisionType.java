package com.abcft.pdfedit.core.zorder;

public enum CollisionType {
    NONE,
    PARTIAL,
    FULL,
    CONTAINS,
    IDENTICAL
}
