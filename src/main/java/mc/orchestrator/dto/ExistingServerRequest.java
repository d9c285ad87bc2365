package mc.orchestrator.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recreates a runtime handle for an instance directory that already holds its server files.
 * RAM and port left null are taken from the stored metadata.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExistingServerRequest {

    @NotBlank(message = "Server name cannot be empty")
    private String name;

    @Min(1)
    @Max(65535)
    private Integer hostPort;

    private String minRam;
    private String maxRam;

    @Builder.Default
    private Map<String, String> envOverrides = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, String> extraLabels = new LinkedHashMap<>();
}
