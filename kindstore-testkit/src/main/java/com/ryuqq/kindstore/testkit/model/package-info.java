/**
 * 어댑터 계약 테스트가 공유하는 모델.
 *
 * <p>모델은 프로세스 전역 레지스트리에 등록되므로 한 JVM에서 한 번만 정의됩니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
package com.ryuqq.kindstore.testkit.model;
