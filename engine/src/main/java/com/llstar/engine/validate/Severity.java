package com.llstar.engine.validate;

public enum Severity {
    ERROR,
    WARNING
}
