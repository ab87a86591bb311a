package net.jibri.core.event;

@FunctionalInterface
public interface IdleListener {
    void onIdle(IdleEvent event);
}
