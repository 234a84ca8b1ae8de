package org.sysmlite.engine.workspace;

public enum Severity {
    ERROR,
    WARNING,
    INFORMATION,
    HINT
}
