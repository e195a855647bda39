/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.preop;

import com.ostrich.strings.api.PreOp;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;
import java.util.Optional;

/**
 * PreOps of the predefined string and regex operations.
 *
 * <p>Only the word-valued operations whose result is determined by literal
 * arguments evaluate forwards; regex-parameterised replacement, length,
 * membership and regex construction are handled purely at automaton level.
 */
public enum BuiltinPreOp implements PreOp {
    EMPTY,
    CONS,
    CONCAT,
    LENGTH,
    REPLACE,
    REPLACE_ALL,
    REPLACE_RE,
    REPLACE_RE_ALL,
    REVERSE,
    REGEX_MEMBERSHIP,
    REGEX_CONSTRUCTION,
    /** Symbols the search treats as unconstrained; their presence marks the problem incomplete */
    UNINTERPRETED;

    @Override
    public Optional<IntList> eval(List<IntList> arguments) {
        return switch (this) {
            case EMPTY -> Optional.of(new IntArrayList());
            case CONS -> {
                checkArity(arguments, 2);
                IntList head = arguments.get(0);
                if (head.size() != 1) {
                    throw new IllegalArgumentException("cons expects a single character, got " + head);
                }
                IntArrayList result = new IntArrayList(head);
                result.addAll(arguments.get(1));
                yield Optional.of(result);
            }
            case CONCAT -> {
                checkArity(arguments, 2);
                IntArrayList result = new IntArrayList(arguments.get(0));
                result.addAll(arguments.get(1));
                yield Optional.of(result);
            }
            case REVERSE -> {
                checkArity(arguments, 1);
                IntList input = arguments.get(0);
                IntArrayList result = new IntArrayList(input.size());
                for (int i = input.size() - 1; i >= 0; i--) {
                    result.add(input.getInt(i));
                }
                yield Optional.of(result);
            }
            case REPLACE -> {
                checkArity(arguments, 3);
                yield Optional.of(replace(arguments.get(0), arguments.get(1), arguments.get(2), false));
            }
            case REPLACE_ALL -> {
                checkArity(arguments, 3);
                yield Optional.of(replace(arguments.get(0), arguments.get(1), arguments.get(2), true));
            }
            default -> Optional.empty();
        };
    }

    /**
     * SMT-LIB replacement of a literal pattern. An empty pattern is matched once at
     * the front by {@code str.replace} and never by {@code str.replace_all}.
     */
    static IntList replace(IntList subject, IntList pattern, IntList replacement, boolean all) {
        if (pattern.isEmpty()) {
            if (all) {
                return new IntArrayList(subject);
            }
            IntArrayList result = new IntArrayList(replacement);
            result.addAll(subject);
            return result;
        }

        IntArrayList result = new IntArrayList(subject.size());
        int i = 0;
        boolean replaced = false;
        while (i < subject.size()) {
            if ((all || !replaced) && matchesAt(subject, pattern, i)) {
                result.addAll(replacement);
                i += pattern.size();
                replaced = true;
            } else {
                result.add(subject.getInt(i));
                i++;
            }
        }
        return result;
    }

    private static boolean matchesAt(IntList subject, IntList pattern, int offset) {
        if (offset + pattern.size() > subject.size()) {
            return false;
        }
        for (int j = 0; j < pattern.size(); j++) {
            if (subject.getInt(offset + j) != pattern.getInt(j)) {
                return false;
            }
        }
        return true;
    }

    private void checkArity(List<IntList> arguments, int expected) {
        if (arguments.size() != expected) {
            throw new IllegalArgumentException(
                    name() + " expects " + expected + " arguments, got " + arguments.size());
        }
    }
}
