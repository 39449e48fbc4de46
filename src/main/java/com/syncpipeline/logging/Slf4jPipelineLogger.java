package com.syncpipeline.logging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default {@link PipelineLogger} backed by SLF4J. MDC (traceId) is whatever the calling thread carries.
 */
@Component
@Slf4j
public class Slf4jPipelineLogger implements PipelineLogger {

    @Override
    public void log(LogLevel level, String message) {
        switch (level) {
            case DEBUG -> log.debug(message);
            case INFO -> log.info(message);
            case WARNING -> log.warn(message);
            case ERROR -> log.error(message);
        }
    }
}
