package com.ryuqq.kindstore.core.spi;

/**
 * Query 실행 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: 한 번의 어댑터 호출로 가져올 최대 결과 수 (기본 300)</li>
 *   <li>keysOnly: Key만 조회할지 여부</li>
 *   <li>offset: 건너뛸 결과 수 (첫 배치에만 적용)</li>
 *   <li>limit: 전체 결과 수 상한 (null이면 무제한)</li>
 *   <li>cursor: 이전 배치가 반환한 재개 지점 (null이면 처음부터)</li>
 * </ul>
 *
 * @param batchSize 배치 크기 (1 이상)
 * @param keysOnly Key만 조회 여부
 * @param offset 오프셋 (0 이상)
 * @param limit 결과 상한 (nullable, 0 이상)
 * @param cursor 재개 커서 (nullable)
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public record QueryOptions(int batchSize, boolean keysOnly, int offset, Integer limit, String cursor) {

    /**
     * 기본 배치 크기.
     */
    public static final int DEFAULT_BATCH_SIZE = 300;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: batchSize=300, keysOnly=false, offset=0, limit=없음, cursor=없음</p>
     */
    public QueryOptions() {
        this(DEFAULT_BATCH_SIZE, false, 0, null, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueryOptions {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative (current: " + offset + ")");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative (current: " + limit + ")");
        }
    }

    public QueryOptions withBatchSize(int batchSize) {
        return new QueryOptions(batchSize, keysOnly, offset, limit, cursor);
    }

    public QueryOptions withKeysOnly(boolean keysOnly) {
        return new QueryOptions(batchSize, keysOnly, offset, limit, cursor);
    }

    public QueryOptions withOffset(int offset) {
        return new QueryOptions(batchSize, keysOnly, offset, limit, cursor);
    }

    public QueryOptions withLimit(Integer limit) {
        return new QueryOptions(batchSize, keysOnly, offset, limit, cursor);
    }

    public QueryOptions withCursor(String cursor) {
        return new QueryOptions(batchSize, keysOnly, offset, limit, cursor);
    }
}
