/**
 * 쿼리와 페이지네이션.
 *
 * <p>{@link com.ryuqq.kindstore.core.query.Query}는 불변 레코드이며,
 * 실행 결과는 배치 단위의 {@link com.ryuqq.kindstore.core.query.Resultset} 또는
 * 커서 기반 {@link com.ryuqq.kindstore.core.query.Pages}로 조회합니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
package com.ryuqq.kindstore.core.query;
