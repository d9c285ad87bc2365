package mc.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JavaConfig(String version, String binaryPath, String extraArgs) {

    public static final String DEFAULT_VERSION = "21";

    public static String binaryFor(String version) {
        return "/usr/local/bin/java" + version;
    }

    public static JavaConfig defaults() {
        return new JavaConfig(DEFAULT_VERSION, binaryFor(DEFAULT_VERSION), null);
    }
}
