package mc.orchestrator.runtime;

import mc.orchestrator.model.JavaConfig;

import java.util.Map;

/**
 * Environment variables understood by the runtime entrypoint script.
 */
public final class RuntimeEnv {
    public static final String SERVER_DIR_NAME = "SERVER_DIR_NAME";
    public static final String MIN_RAM = "MIN_RAM";
    public static final String MAX_RAM = "MAX_RAM";
    public static final String SERVER_PORT = "SERVER_PORT";
    public static final String SERVER_TYPE = "SERVER_TYPE";
    public static final String SERVER_VERSION = "SERVER_VERSION";
    public static final String SERVER_JAR = "SERVER_JAR";
    public static final String JAVA_VERSION = "JAVA_VERSION";
    public static final String JAVA_BIN = "JAVA_BIN";
    public static final String JAVA_OPTS = "JAVA_OPTS";
    public static final String JAVA_VERSION_LABEL = "mc.java_version";

    public static final String DEFAULT_MIN_RAM = "1G";
    public static final String DEFAULT_MAX_RAM = "2G";

    private RuntimeEnv() {
    }

    /**
     * Java settings carried by an instance environment, or the image default when none are set.
     */
    public static JavaConfig javaConfig(Map<String, String> env, String labelVersion) {
        String version = env.get(JAVA_VERSION);
        if (version == null || version.isBlank()) {
            version = labelVersion != null && !labelVersion.isBlank() ? labelVersion : JavaConfig.DEFAULT_VERSION;
        }
        String binary = env.getOrDefault(JAVA_BIN, JavaConfig.binaryFor(version));
        return new JavaConfig(version, binary, env.get(JAVA_OPTS));
    }
}
