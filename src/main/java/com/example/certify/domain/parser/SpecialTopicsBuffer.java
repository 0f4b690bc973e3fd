package com.example.certify.domain.parser;

import com.example.certify.domain.model.CourseRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * One-slot lookahead holding a special-topics record until a possible "Course Topic" line refines its title.
 */
public sealed interface SpecialTopicsBuffer {

    static SpecialTopicsBuffer empty() {
        return Empty.INSTANCE;
    }

    static SpecialTopicsBuffer holding(CourseRecord record) {
        return new Holding(record);
    }

    Optional<CourseRecord> pending();

    default boolean isHolding() {
        return pending().isPresent();
    }

    final class Empty implements SpecialTopicsBuffer {
        private static final Empty INSTANCE = new Empty();

        private Empty() {
        }

        @Override
        public Optional<CourseRecord> pending() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }

    record Holding(CourseRecord record) implements SpecialTopicsBuffer {

        public Holding {
            Objects.requireNonNull(record, "record");
        }

        @Override
        public Optional<CourseRecord> pending() {
            return Optional.of(record);
        }
    }
}
