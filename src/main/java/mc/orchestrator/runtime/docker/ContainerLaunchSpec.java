package mc.orchestrator.runtime.docker;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to create one runtime container. Exactly one of {@code bindHostPath}
 * or {@code volumeName} is set.
 */
@Builder(toBuilder = true)
public record ContainerLaunchSpec(String name,
                                  String image,
                                  Map<String, String> labels,
                                  Map<String, String> env,
                                  int containerPort,
                                  Integer hostPort,
                                  String bindHostPath,
                                  String bindTarget,
                                  String volumeName,
                                  String volumeTarget,
                                  Long memoryBytes,
                                  String network,
                                  String workingDir,
                                  List<String> entrypoint) {
}
