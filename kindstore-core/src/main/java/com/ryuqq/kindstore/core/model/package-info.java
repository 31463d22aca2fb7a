/**
 * 모델 계층.
 *
 * <p>{@link com.ryuqq.kindstore.core.model.Model}, 속성 디스크립터 기반 클래스
 * {@link com.ryuqq.kindstore.core.model.Property}, 스키마와 레지스트리, 배치 연산
 * {@link com.ryuqq.kindstore.core.model.Entities}를 포함합니다.</p>
 *
 * <p>모델은 Key로 kind가 해석되는 프로세스 전역 레지스트리에 등록되며,
 * 다형성 계층은 루트의 kind를 공유합니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
package com.ryuqq.kindstore.core.model;
