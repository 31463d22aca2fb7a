/**
 * 트랜잭션 전파 및 재시도.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kindstore.core.transaction.Transaction} - 트랜잭션 SPI</li>
 *   <li>{@link com.ryuqq.kindstore.core.transaction.AbstractTransaction} - 상태 기계 템플릿</li>
 *   <li>{@link com.ryuqq.kindstore.core.transaction.TransactionStack} - 스레드별 트랜잭션 스택</li>
 *   <li>{@link com.ryuqq.kindstore.core.transaction.Transactional} - 충돌 시 재시도 래퍼</li>
 * </ul>
 *
 * <h2>전파</h2>
 * <ul>
 *   <li>NESTED: 열린 트랜잭션이 있으면 합류, 없으면 새로 시작</li>
 *   <li>INDEPENDENT: 항상 새로 시작</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Kindstore Team
 */
package com.ryuqq.kindstore.core.transaction;
