package net.jibri.core.event;

/** 구독 핸들. close()는 멱등 */
public interface Subscription extends AutoCloseable {
    boolean isActive();

    @Override
    void close();
}
