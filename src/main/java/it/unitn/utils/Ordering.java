package it.unitn.utils;

public enum Ordering {
    LT,
    EQ,
    GT
}
