package net.jibri.core.model;

import java.util.Objects;

/**
 * 스토어 키 네이밍.
 * - idle 레코드: {ns}:idle:{workerId}
 * - pending 락 : {ns}:pending:{workerId}
 */
public final class KeySpace {
    public static final String DEFAULT_NAMESPACE = "jibri";

    private final String namespace;
    private final String idlePrefix;
    private final String pendingPrefix;

    public KeySpace(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        this.namespace = namespace;
        this.idlePrefix = namespace + ":idle:";
        this.pendingPrefix = namespace + ":pending:";
    }

    public String namespace() { return namespace; }

    public String idleKey(String workerId) { return idlePrefix + workerId; }

    public String pendingKey(String workerId) { return pendingPrefix + workerId; }

    /** SCAN MATCH 패턴 */
    public String idlePattern() { return idlePrefix + "*"; }

    /** prefix 뒤에 workerId 가 붙은 idle 키인지 */
    public boolean isIdleKey(String key) {
        return key != null && key.startsWith(idlePrefix) && key.length() > idlePrefix.length();
    }

    /** idle 키 → workerId. workerId 자체에 ':' 가 있어도 prefix만 잘라낸다 */
    public String workerIdOf(String idleKey) {
        Objects.requireNonNull(idleKey, "idleKey");
        if (!isIdleKey(idleKey)) {
            throw new IllegalArgumentException("not an idle key: " + idleKey);
        }
        return idleKey.substring(idlePrefix.length());
    }

    @Override public String toString() { return "KeySpace{" + namespace + '}'; }
}
