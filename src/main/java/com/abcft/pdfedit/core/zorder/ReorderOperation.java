package com.abcft.pdfedit.core.zorder;

public enum ReorderOperation {
    TO_FRONT,
    TO_BACK,
    FORWARD,
    BACKWARD,
    TO_LEVEL,
    SWAP,
    GROUP
}
