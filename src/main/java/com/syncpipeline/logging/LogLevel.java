package com.syncpipeline.logging;

public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR
}
