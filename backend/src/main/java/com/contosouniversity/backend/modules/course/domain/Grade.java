package com.contosouniversity.backend.modules.course.domain;

/**
 * Letter grades; stored by ordinal (A=0 .. F=4) to match the legacy column.
 */
public enum Grade {
    A,
    B,
    C,
    D,
    F
}
