package net.jibri.core.model;

public enum BusyStatus {
    IDLE,
    BUSY
}
