package net.jibri.adapter.redis;

import java.util.UUID;

public final class RedisUtil {
    private RedisUtil() {}

    public static final String OK = "OK";

    /** SET 응답 확인 (NX 미충족이면 Lettuce는 null을 돌려준다) */
    public static boolean ok(String reply) { return OK.equalsIgnoreCase(reply); }

    /** 프로세스 식별자: 락 소유 토큰/릴레이 발신자 구분용 */
    public static String newInstanceId() { return UUID.randomUUID().toString(); }
}
