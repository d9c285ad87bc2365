package mc.orchestrator.runtime;

import mc.orchestrator.dto.CreateServerRequest;
import mc.orchestrator.dto.ExistingServerRequest;
import mc.orchestrator.model.BackendKind;
import mc.orchestrator.model.CommandResult;
import mc.orchestrator.model.DeleteResult;
import mc.orchestrator.model.OperationResult;
import mc.orchestrator.model.ServerInstance;

import java.util.List;

/**
 * Lifecycle of server instances on one execution substrate. Exactly one implementation is active per process,
 * chosen from configuration at startup. All calls block until the substrate has answered.
 */
public interface RuntimeBackend {

    BackendKind kind();

    ServerInstance create(CreateServerRequest request);

    /**
     * Like {@link #create} but for a directory whose server files are already in place. Supplied environment
     * overrides are merged over the ones stored in the instance metadata.
     */
    ServerInstance createFromExisting(ExistingServerRequest request);

    OperationResult start(String id);

    /**
     * Graceful stop through the command channels, escalating once the stop deadline passes.
     * Stopping an instance that is not running is a no-op.
     */
    OperationResult stop(String id, boolean force);

    default OperationResult stop(String id) {
        return stop(id, false);
    }

    OperationResult restart(String id);

    OperationResult kill(String id);

    DeleteResult delete(String id);

    List<ServerInstance> list();

    /**
     * @return the instance, with status {@code not_found} when the handle no longer resolves
     */
    ServerInstance get(String id);

    String logs(String id, int tail);

    CommandResult sendCommand(String id, String command);

    /**
     * Removes the runtime handle without touching the instance directory, so it can be recreated from disk.
     * Missing handles are ignored.
     */
    void removeHandle(String id);
}
