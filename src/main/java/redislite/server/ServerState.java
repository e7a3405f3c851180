package redislite.server;

public enum ServerState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING
}
