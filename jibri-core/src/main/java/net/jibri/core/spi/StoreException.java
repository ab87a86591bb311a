package net.jibri.core.spi;

/** 스토어가 쓰기/삭제를 승인하지 않았을 때 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
