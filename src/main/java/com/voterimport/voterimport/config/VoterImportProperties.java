package com.voterimport.voterimport.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized onboarding and import configuration bound from {@code application.properties}.
 * Command-line options override these values per run.
 */
@ConfigurationProperties(prefix = "voter")
public class VoterImportProperties {

    private String configDir = VoterImportConstants.DEFAULT_CONFIG_DIR;
    private String dbPath = VoterImportConstants.DEFAULT_DB_PATH;
    private boolean verbose;
    private int sampleSize = VoterImportConstants.DEFAULT_SAMPLE_SIZE;
    private double minConfidence = VoterImportConstants.DEFAULT_MIN_CONFIDENCE;
    private int maxRecordedErrors = VoterImportConstants.DEFAULT_MAX_RECORDED_ERRORS;
    private int sinkRetryAttempts = VoterImportConstants.DEFAULT_SINK_RETRY_ATTEMPTS;
    private int duplicateAddressThreshold = VoterImportConstants.DEFAULT_DUPLICATE_ADDRESS_THRESHOLD;

    public String getConfigDir() {
        return configDir;
    }

    public void setConfigDir(String configDir) {
        this.configDir = configDir;
    }

    public String getDbPath() {
        return dbPath;
    }

    public void setDbPath(String dbPath) {
        this.dbPath = dbPath;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public int getMaxRecordedErrors() {
        return maxRecordedErrors;
    }

    public void setMaxRecordedErrors(int maxRecordedErrors) {
        this.maxRecordedErrors = maxRecordedErrors;
    }

    public int getSinkRetryAttempts() {
        return sinkRetryAttempts;
    }

    public void setSinkRetryAttempts(int sinkRetryAttempts) {
        this.sinkRetryAttempts = sinkRetryAttempts;
    }

    public int getDuplicateAddressThreshold() {
        return duplicateAddressThreshold;
    }

    public void setDuplicateAddressThreshold(int duplicateAddressThreshold) {
        this.duplicateAddressThreshold = duplicateAddressThreshold;
    }
}
