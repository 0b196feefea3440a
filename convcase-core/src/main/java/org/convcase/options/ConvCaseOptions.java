package org.convcase.options;

/**
 * Configuration option constants shared by the configuration loader and the CLI.
 */
public final class ConvCaseOptions {

    private ConvCaseOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "CCASE_PROFILE";

        /**
         * Configuration file name, searched from the working directory upwards.
         */
        public static final String CONFIG_FILE = "ccase.yaml";
    }

    /**
     * Conversion defaults applied when the command line leaves them out.
     */
    public static final class Conversion {
        private Conversion() {}

        public static final String TO_KEY = "ccase.conversion.to";
        public static final String FROM_KEY = "ccase.conversion.from";
    }
}
