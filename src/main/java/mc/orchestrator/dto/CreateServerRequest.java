package mc.orchestrator.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CreateServerRequest {

    @NotBlank(message = "Server name cannot be empty")
    @Pattern(regexp = "^[A-Za-z0-9][A-Za-z0-9_.-]*$", message = "Server name contains invalid characters")
    private String name;

    @NotBlank(message = "Server type cannot be empty")
    private String type;

    @NotBlank(message = "Server version cannot be empty")
    private String version;

    private String loaderVersion;
    private String installerVersion;

    @Min(1)
    @Max(65535)
    private Integer hostPort;

    @Builder.Default
    private String minRam = "1G";
    @Builder.Default
    private String maxRam = "2G";

    @Builder.Default
    private Map<String, String> extraLabels = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, String> envOverrides = new LinkedHashMap<>();
}
