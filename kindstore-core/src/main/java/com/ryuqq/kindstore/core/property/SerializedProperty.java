package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.codec.ValueCodec;
import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.model.Model;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

/**
 * 직렬화되어 저장되는 임의 값 속성의 기반 클래스.
 *
 * <p>허용 타입: Boolean, 정수/실수, String, byte[], Map, List, ZonedDateTime, Key, Model.
 * 중첩된 값의 타입은 직렬화 시점에 검사됩니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public abstract class SerializedProperty extends BlobProperty<Object> {

    protected SerializedProperty(Builder<?, ?> builder, ValueCodec serializer) {
        super(builder, Object.class, List.of(serializer));
    }

    protected SerializedProperty(SerializedProperty source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
    }

    @Override
    protected Object validateElement(Object value) {
        if (value instanceof Boolean || value instanceof Number || value instanceof String
            || value instanceof byte[] || value instanceof Map<?, ?> || value instanceof List<?>
            || value instanceof ZonedDateTime || value instanceof Key || value instanceof Model) {
            return value;
        }
        throw new IllegalArgumentException(
            "Value of type " + value.getClass().getSimpleName() + " assigned to "
                + getClass().getSimpleName() + " property " + nameOnModel() + ".");
    }
}
