package net.jibri.core.model;

public enum HealthStatus {
    HEALTHY,
    UNHEALTHY
}
