package com.lambdacalc.debug;

/** Severity of a debug hub message, lowest first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}
