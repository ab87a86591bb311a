package net.jibri.core.spi;

import java.time.Duration;

/**
 * idle 레코드 저장소 (TTL 지원 KV 스토어).
 * - 만료는 쓰기와 원자적으로 설정되어야 한다
 * - scan은 약한 일관성: 스캔 도중 만료/삭제된 키가 나오거나 같은 키가 반복될 수 있다.
 *   진실의 근거는 스캔이 아니라 클레임(락 획득) 단계다.
 */
public interface IdleRecordStore {
    /** 스캔 시작/종료 커서 */
    String INITIAL_CURSOR = "0";

    void putWithExpiry(String key, String value, Duration ttl) throws Exception; // 덮어쓰기 + 만료

    void delete(String key) throws Exception;                                    // 없으면 무시

    ScanPage scan(String cursor, String matchPattern) throws Exception;          // 커서 한 페이지
}
