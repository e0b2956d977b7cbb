package com.voterimport.voterimport.config;

/**
 * Shared constants for onboarding and import flows.
 */
public final class VoterImportConstants {

    private VoterImportConstants() {
    }

    public static final String DEFAULT_CONFIG_DIR = "configs";
    public static final String DEFAULT_DB_PATH = "data/voters.db";
    public static final int DEFAULT_SAMPLE_SIZE = 1000;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.5;
    public static final int DEFAULT_MAX_RECORDED_ERRORS = 1000;
    public static final int DEFAULT_SINK_RETRY_ATTEMPTS = 3;
    public static final int DEFAULT_DUPLICATE_ADDRESS_THRESHOLD = 10;

    public static final String CONFIG_FILE_SUFFIX = "_config.json";
    public static final String DEFAULT_TABLE_PREFIX = "voters_";
    public static final String JDBC_URL_PREFIX = "jdbc:sqlite:";

    public static final String FILE_EXT_ZIP = ".zip";
    public static final String FILE_EXT_TXT = ".txt";
    public static final String FILE_EXT_CSV = ".csv";
    public static final String FILE_EXT_DAT = ".dat";
    public static final String FILE_EXT_PSV = ".psv";
    public static final String FILE_EXT_TSV = ".tsv";

    public static final int CHARSET_SAMPLE_BYTES = 64 * 1024;
    public static final String FALLBACK_CHARSET = "windows-1252";

    public static final String VALID_TABLE_NAME_REGEX = "[a-zA-Z_][a-zA-Z0-9_]*";
    public static final String VALID_STATE_CODE_REGEX = "[A-Za-z]{2}";

    public static final String MSG_CONFIG_MISSING = "No configuration for state %s at %s. Run onboard first.";
    public static final String MSG_CONFIG_INCOMPLETE = "Configuration for state %s has no mapping for required fields %s";
    public static final String MSG_CONFIG_READ_FAILED = "Invalid configuration file: %s";
    public static final String MSG_CONFIG_WRITE_FAILED = "Unable to write configuration file: %s";
    public static final String MSG_INPUT_NOT_FOUND = "Input file not found: %s";
    public static final String MSG_INPUT_READ_FAILED = "Unable to read input file: %s";
    public static final String MSG_INPUT_EMPTY = "Input file is empty: %s";
    public static final String MSG_ZIP_NO_TEXT_FILE = "No readable text file found inside ZIP: %s";
    public static final String MSG_INVALID_TABLE = "Invalid table name: %s";
    public static final String MSG_INVALID_STATE_CODE = "State code must be two letters: %s";
    public static final String MSG_SINK_FAILED = "Storage operation failed for %s";
    public static final String MSG_RUN_ID_NOT_GENERATED = "Unable to generate unique run id";
    public static final String MSG_UNKNOWN_COLUMN = "Column %s is not present in the %s extract";
}
