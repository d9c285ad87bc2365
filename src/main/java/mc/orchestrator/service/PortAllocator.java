package mc.orchestrator.service;

import lombok.extern.slf4j.Slf4j;
import mc.orchestrator.exception.PortConflictException;

import java.util.Set;

/**
 * Picks host ports that no instance currently binds. Allocation is check-then-use:
 * callers retry with the next free port when the bind itself reports a conflict.
 */
@Slf4j
public class PortAllocator {
    public static final int MAX_PORT = 65535;

    private final PortUsageProbe probe;
    private final int defaultStart;
    private final int defaultEnd;

    public PortAllocator(PortUsageProbe probe, int defaultStart, int defaultEnd) {
        this.probe = probe;
        this.defaultStart = defaultStart;
        this.defaultEnd = defaultEnd;
    }

    public Set<Integer> usedPorts(PortScope scope) {
        return probe.usedPorts(scope);
    }

    public int pick(Integer preferred) {
        return pick(preferred, defaultStart, defaultEnd, true);
    }

    public int pick(Integer preferred, int start, int end, boolean allowFallback) {
        Set<Integer> used = probe.usedPorts(PortScope.ALL);
        if (preferred != null) {
            if (preferred < 1 || preferred > MAX_PORT) {
                throw new IllegalArgumentException("Port out of range: " + preferred);
            }
            if (!used.contains(preferred)) {
                return preferred;
            }
            if (!allowFallback) {
                throw new PortConflictException("Host port " + preferred + " is already in use", preferred);
            }
            log.debug("Preferred port {} is taken, scanning for the next free one", preferred);
        }

        int scanStart = Math.max(start, preferred != null ? preferred + 1 : start);
        for (int port = scanStart; port <= end; port++) {
            if (!used.contains(port)) {
                return port;
            }
        }
        for (int port = Math.max(end + 1, scanStart); port <= MAX_PORT; port++) {
            if (!used.contains(port)) {
                log.debug("Range {}-{} exhausted, using extended port {}", start, end, port);
                return port;
            }
        }
        throw new PortConflictException("No available host ports found from " + scanStart + " to " + MAX_PORT, preferred);
    }
}
