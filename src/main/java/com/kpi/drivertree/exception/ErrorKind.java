package com.kpi.drivertree.exception;

/**
 * Category of a tree generation failure, reported verbatim to the caller.
 */
public enum ErrorKind {
    PARSE,
    VALIDATION,
    CONFLICT,
    CONSISTENCY,
    NOT_FOUND
}
