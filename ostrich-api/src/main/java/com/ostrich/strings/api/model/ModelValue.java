/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Objects;

/**
 * Value assigned to a variable by a string model: either a length or a literal word.
 */
public interface ModelValue {

    boolean isLength();

    /**
     * An integer (length) assignment.
     */
    record Length(long value) implements ModelValue {
        @Override
        public boolean isLength() {
            return true;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * A literal word, given as a sequence of character codes.
     */
    record Word(IntList codes) implements ModelValue {
        public Word {
            Objects.requireNonNull(codes, "codes must not be null");
            codes = IntLists.unmodifiable(new IntArrayList(codes));
        }

        public static Word of(String text) {
            IntArrayList codes = new IntArrayList(text.length());
            for (int i = 0; i < text.length(); i++) {
                codes.add(text.charAt(i));
            }
            return new Word(codes);
        }

        public int length() {
            return codes.size();
        }

        public String asString() {
            StringBuilder sb = new StringBuilder(codes.size());
            for (int i = 0; i < codes.size(); i++) {
                sb.append((char) codes.getInt(i));
            }
            return sb.toString();
        }

        @Override
        public boolean isLength() {
            return false;
        }

        @Override
        public String toString() {
            return '"' + asString() + '"';
        }
    }
}
