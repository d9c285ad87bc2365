package mc.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of {@code server_meta.json}, the sidecar kept in every instance directory.
 * Keys this class does not model are carried through a read-modify-write untouched.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "type", "version", "loader_version", "min_ram", "max_ram", "min_ram_mb", "max_ram_mb",
        "host_port", "env_overrides", "created_at", "created_ts", "previous_names", "custom_id"})
public class ServerMetadata {
    private String name;
    @JsonAlias("server_type")
    private String type;
    @JsonAlias("server_version")
    private String version;
    private String loaderVersion;
    private String minRam;
    private String maxRam;
    private Integer minRamMb;
    private Integer maxRamMb;
    private Integer hostPort;
    private Map<String, String> envOverrides = new LinkedHashMap<>();
    private String createdAt;
    private Long createdTs;
    private List<String> previousNames = new ArrayList<>();
    private String customId;
    private String javaVersion;
    private String javaBin;
    private String javaArgs;
    private Map<String, String> labels = new LinkedHashMap<>();

    @JsonIgnore
    private Map<String, Object> other = new LinkedHashMap<>();

    @JsonAnySetter
    public void putOther(String key, Object value) {
        other.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getOther() {
        return other;
    }

    public void setEnvOverrides(Map<String, String> envOverrides) {
        this.envOverrides = envOverrides == null ? new LinkedHashMap<>() : new LinkedHashMap<>(envOverrides);
    }

    public void setPreviousNames(List<String> previousNames) {
        this.previousNames = previousNames == null ? new ArrayList<>() : new ArrayList<>(previousNames);
    }

    public void setLabels(Map<String, String> labels) {
        this.labels = labels == null ? new LinkedHashMap<>() : new LinkedHashMap<>(labels);
    }

    public void recordRename(String oldName, String newName) {
        if (oldName != null && !oldName.equals(newName)) {
            previousNames.add(oldName);
        }
        this.name = newName;
    }

    public void recordRam(String minRam, String maxRam, int minRamMb, int maxRamMb) {
        this.minRam = minRam;
        this.maxRam = maxRam;
        this.minRamMb = minRamMb;
        this.maxRamMb = maxRamMb;
    }

    @JsonIgnore
    public JavaConfig getJavaConfig() {
        if (javaVersion == null && javaBin == null && javaArgs == null) {
            return null;
        }
        return new JavaConfig(javaVersion, javaBin, javaArgs);
    }

    public void applyJavaConfig(JavaConfig javaConfig) {
        this.javaVersion = javaConfig.version();
        this.javaBin = javaConfig.binaryPath();
        this.javaArgs = javaConfig.extraArgs();
    }
}
