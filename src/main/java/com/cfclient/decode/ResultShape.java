package com.cfclient.decode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The three forms a {@code result} field arrives in. {@link #toList()} gives callers one uniform shape.
 */
public interface ResultShape<T> {

    List<T> toList();

    @SuppressWarnings("unchecked")
    static <T> ResultShape<T> absent() {
        return (ResultShape<T>) Absent.INSTANCE;
    }

    static <T> ResultShape<T> single(T value) {
        return new Single<>(value);
    }

    static <T> ResultShape<T> many(List<T> values) {
        return new Many<>(values);
    }

    /** Field missing or JSON null. */
    record Absent<T>() implements ResultShape<T> {

        private static final Absent<Object> INSTANCE = new Absent<>();

        @Override
        public List<T> toList() {
            return List.of();
        }
    }

    /** Bare object where a one-element array was expected. */
    record Single<T>(T value) implements ResultShape<T> {

        @Override
        public List<T> toList() {
            return List.of(value);
        }
    }

    /** Array result; may hold nulls when the server sent null elements. */
    record Many<T>(List<T> values) implements ResultShape<T> {

        public Many {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public List<T> toList() {
            return values;
        }
    }
}
