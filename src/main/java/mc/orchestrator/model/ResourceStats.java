package mc.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResourceStats {
    private String id;
    private double cpuPercent;
    private double memoryUsageMb;
    private double memoryLimitMb;
    private double memoryPercent;
    private double networkRxMb;
    private double networkTxMb;
    private String error;

    public static ResourceStats unavailable(String id, String error) {
        return ResourceStats.builder().id(id).error(error).build();
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
