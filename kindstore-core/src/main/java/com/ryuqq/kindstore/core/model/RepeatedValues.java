package com.ryuqq.kindstore.core.model;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;

/**
 * repeated 속성 값의 타입 지정 뷰.
 *
 * <p>조회는 엔티티에 저장된 리스트를 매번 다시 읽어 원소를 속성의 값 타입으로 변환하고,
 * 수정은 원소를 검증한 뒤 새 리스트로 교체하여 엔티티에 바로 반영합니다.</p>
 *
 * @param <T> 원소 타입
 * @author Kindstore Team
 * @since 1.0.0
 */
final class RepeatedValues<T> extends AbstractList<T> {

    private final Property<T> property;
    private final Model entity;

    RepeatedValues(Property<T> property, Model entity) {
        this.property = property;
        this.entity = entity;
    }

    @Override
    public T get(int index) {
        return property.valueType().cast(current().get(index));
    }

    @Override
    public int size() {
        return current().size();
    }

    @Override
    public T set(int index, T element) {
        List<Object> values = new ArrayList<>(current());
        Object previous = values.set(index, validated(element));
        replace(values);
        return property.valueType().cast(previous);
    }

    @Override
    public void add(int index, T element) {
        List<Object> values = new ArrayList<>(current());
        values.add(index, validated(element));
        replace(values);
        modCount++;
    }

    @Override
    public T remove(int index) {
        List<Object> values = new ArrayList<>(current());
        Object removed = values.remove(index);
        replace(values);
        modCount++;
        return property.valueType().cast(removed);
    }

    private List<?> current() {
        Object raw = property.read(entity);
        if (raw instanceof List<?> values) {
            return values;
        }
        throw new IllegalStateException(
            "Repeated property " + property.nameOnModel() + " holds a value of type "
                + (raw == null ? "null" : raw.getClass().getSimpleName()) + ".");
    }

    private Object validated(T element) {
        if (element == null) {
            throw new IllegalArgumentException(
                "Repeated property " + property.nameOnModel() + " cannot contain null values.");
        }
        return property.validateElement(element);
    }

    private void replace(List<Object> values) {
        entity.data().put(property.nameOnEntity(), values);
    }
}
