package org.quill.junit.extensions.logging;

/**
 * Levels the log watch can assert on.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
