package com.pmsuite.orchestrator.proxy;

/**
 * The four backends behind the orchestrator.
 */
public enum BackendService {

    ATLAS("atlas"),
    WORKPULSE("workpulse"),
    EPR("epr"),
    LABS("labs");

    private final String serviceName;

    BackendService(String serviceName) {
        this.serviceName = serviceName;
    }

    public String serviceName() {
        return serviceName;
    }

    public static BackendService fromServiceName(String name) {
        for (BackendService service : values()) {
            if (service.serviceName.equalsIgnoreCase(name)) {
                return service;
            }
        }
        throw new IllegalArgumentException("Unknown backend service: " + name);
    }
}
