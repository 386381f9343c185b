package com.numaansystems.bridge.federation;

/**
 * The federation pipeline stopped at a stage. Later stages were not run.
 */
public class PipelineException extends Exception {

    private final FederationStage stage;

    public PipelineException(FederationStage stage, FederationException cause) {
        super("Federation failed at stage " + stage.getStageName() + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public FederationStage getStage() {
        return stage;
    }

    public String getErrorCode() {
        return getCause().getErrorCode();
    }

    /**
     * @return the user-facing message of the failed stage
     */
    public String getStageMessage() {
        return getCause().getMessage();
    }

    @Override
    public synchronized FederationException getCause() {
        return (FederationException) super.getCause();
    }
}
