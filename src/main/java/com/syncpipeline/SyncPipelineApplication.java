package com.syncpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Sync Ingestion Pipeline Application.
 *
 * Wires the validator, chunker, serialized chunk worker and record store behind
 * {@link com.syncpipeline.service.PipelineOrchestrator}.
 */
@SpringBootApplication
public class SyncPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SyncPipelineApplication.class, args);
    }
}
