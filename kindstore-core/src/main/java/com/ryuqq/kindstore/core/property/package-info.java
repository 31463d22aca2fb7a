/**
 * 내장 속성 타입.
 *
 * <p>각 타입은 자신의 빌더로 생성합니다 ({@code StringProperty.builder("email").indexed().build()}).
 * blob 타입({@link com.ryuqq.kindstore.core.property.BytesProperty},
 * {@link com.ryuqq.kindstore.core.property.TextProperty},
 * {@link com.ryuqq.kindstore.core.property.JsonProperty},
 * {@link com.ryuqq.kindstore.core.property.MsgpackProperty})은 인덱스할 수 없습니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
package com.ryuqq.kindstore.core.property;
