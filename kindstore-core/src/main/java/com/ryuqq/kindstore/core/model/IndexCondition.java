package com.ryuqq.kindstore.core.model;

/**
 * Predicate deciding whether a property is indexed for one particular entity.
 *
 * <p>Evaluated every time the entity is stored, against its current values.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 * @see com.ryuqq.kindstore.core.condition.Conditions
 */
@FunctionalInterface
public interface IndexCondition {

    /**
     * @param entity the entity being stored
     * @param property the property whose indexing is decided
     * @return true if the property should be indexed
     */
    boolean test(Model entity, Property<?> property);
}
