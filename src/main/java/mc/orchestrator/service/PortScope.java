package mc.orchestrator.service;

public enum PortScope {
    /** Every host port published by any instance. */
    ALL,
    /** Only host ports bound to the well-known game port, still scanning every instance. */
    GAME_PORT
}
