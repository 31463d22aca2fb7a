package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.Property;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * 날짜/시간 속성.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>{@link LocalDateTime}은 시스템 시간대로 해석</li>
 *   <li>저장 시 UTC로 변환되며 변환된 값이 엔티티에도 반영됨</li>
 *   <li>autoNowAdd: 값이 없을 때 저장 시각으로 설정</li>
 *   <li>autoNow: 저장할 때마다 저장 시각으로 설정</li>
 *   <li>wire 값이 {@link Long}이면 epoch 마이크로초로 해석 (프로젝션 결과)</li>
 * </ul>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class DateTimeProperty extends Property<ZonedDateTime> {

    private final boolean autoNowAdd;
    private final boolean autoNow;
    private final Clock clock;

    private DateTimeProperty(Builder builder, boolean autoNowAdd, boolean autoNow, Clock clock) {
        super(builder, ZonedDateTime.class, List.of());
        this.autoNowAdd = autoNowAdd;
        this.autoNow = autoNow;
        this.clock = clock;
    }

    private DateTimeProperty(DateTimeProperty source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
        this.autoNowAdd = source.autoNowAdd;
        this.autoNow = source.autoNow;
        this.clock = source.clock;
    }

    @Override
    public DateTimeProperty withPrefix(String entityPrefix, String modelPrefix) {
        return new DateTimeProperty(this, entityPrefix, modelPrefix);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean isAutoNowAdd() {
        return autoNowAdd;
    }

    public boolean isAutoNow() {
        return autoNow;
    }

    @Override
    protected Object validateElement(Object value) {
        if (value instanceof LocalDateTime local) {
            return local.atZone(ZoneId.systemDefault());
        }
        return super.validateElement(value);
    }

    @Override
    public Object prepareToStore(Model entity, Object value) {
        Object current = value;
        if ((current == null && autoNowAdd) || autoNow) {
            current = ZonedDateTime.now(clock);
        }
        if (current != null) {
            current = toUtc(current);
            if (entity != null) {
                rawData(entity).put(nameOnEntity(), current);
            }
        }
        return super.prepareToStore(entity, current);
    }

    @Override
    public Object prepareToLoad(Model entity, Object value) {
        if (value instanceof List<?> values) {
            List<Object> loaded = new ArrayList<>(values.size());
            for (Object element : values) {
                loaded.add(fromWire(element));
            }
            return super.prepareToLoad(entity, loaded);
        }
        return super.prepareToLoad(entity, fromWire(value));
    }

    @Override
    public Object toWireValue(Object value) {
        Object wire = super.toWireValue(value);
        return wire instanceof ZonedDateTime dt ? dt.withZoneSameInstant(ZoneOffset.UTC) : wire;
    }

    private static Object toUtc(Object value) {
        if (value instanceof List<?> values) {
            List<Object> converted = new ArrayList<>(values.size());
            for (Object element : values) {
                converted.add(toUtc(element));
            }
            return converted;
        }
        return ((ZonedDateTime) value).withZoneSameInstant(ZoneOffset.UTC);
    }

    private static Object fromWire(Object value) {
        if (value instanceof Long micros) {
            return Instant.EPOCH.plus(micros, ChronoUnit.MICROS).atZone(ZoneOffset.UTC);
        }
        if (value instanceof ZonedDateTime dt) {
            return dt.withZoneSameInstant(ZoneOffset.UTC);
        }
        return value;
    }

    public static final class Builder extends Property.Builder<DateTimeProperty, Builder> {

        private boolean autoNowAdd;
        private boolean autoNow;
        private Clock clock = Clock.systemDefaultZone();

        private Builder(String name) {
            super(name);
        }

        public Builder autoNowAdd() {
            this.autoNowAdd = true;
            return this;
        }

        public Builder autoNow() {
            this.autoNow = true;
            return this;
        }

        /**
         * 현재 시각을 제공하는 Clock 지정 (기본값: 시스템 Clock).
         */
        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            this.clock = clock;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected DateTimeProperty create() {
            if (repeated && (autoNowAdd || autoNow)) {
                throw new IllegalArgumentException("Cannot use autoNow or autoNowAdd with repeated properties.");
            }
            return new DateTimeProperty(this, autoNowAdd, autoNow, clock);
        }
    }
}
