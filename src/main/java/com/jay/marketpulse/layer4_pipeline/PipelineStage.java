package com.jay.marketpulse.layer4_pipeline;

/**
 * A named unit of work in the pipeline. The object returned by {@link #execute} is handed
 * to later stages through the context and persisted as {@link #artifactName()}.
 */
public interface PipelineStage {

    String name();

    /** File name of the artifact this stage owns under the data directory. */
    String artifactName();

    /** Stages that call the text generator are skipped in fast mode. */
    default boolean usesTextGeneration() {
        return false;
    }

    /**
     * @throws StageComputationException when the stage cannot produce its artifact; the run stops
     */
    Object execute(StageContext context);
}
