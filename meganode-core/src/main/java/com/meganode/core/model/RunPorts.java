package com.meganode.core.model;

/**
 * Ports a running user node serves on, reported once the node is ready.
 */
public record RunPorts(
    UserPk userPk,
    int appPort,
    int lexePort
) {
    public RunPorts {
        if (userPk == null) {
            throw new IllegalArgumentException("User pk must not be null");
        }
        if (appPort < 0 || appPort > 0xFFFF || lexePort < 0 || lexePort > 0xFFFF) {
            throw new IllegalArgumentException(
                String.format("Invalid ports: app=%d lexe=%d", appPort, lexePort));
        }
    }
}
