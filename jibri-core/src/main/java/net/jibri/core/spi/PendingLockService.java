package net.jibri.core.spi;

import java.time.Duration;

/**
 * 분산 상호배제 락. 인스턴스 간 "워커당 클레임 1건" 보장은 전적으로 여기에 의존한다.
 * 명시적 해제는 없다: 락은 holdFor 경과 후 만료로만 풀린다.
 */
public interface PendingLockService {
    /**
     * 1회 원자적 획득 시도 (없을 때만 set + 만료).
     * @return 획득 성공 여부. 이미 누군가 보유 중이면 false
     * @throws Exception 전송/연결 오류
     */
    boolean tryAcquire(String key, Duration holdFor) throws Exception;
}
