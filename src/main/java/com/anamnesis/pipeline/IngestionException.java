package com.anamnesis.pipeline;

/**
 * An ingestion stopped at {@link #stage()}; nothing downstream of that stage ran.
 */
public class IngestionException extends Exception {
    private final IngestionStage stage;

    public IngestionException(IngestionStage stage, Throwable cause) {
        super("ingestion failed at stage " + stage.stageName() + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public IngestionStage stage() {
        return stage;
    }
}
