package com.clinicflow.ingestion.service;

import org.springframework.lang.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Closes a JSON document that was cut off mid-stream.
 * <p>
 * The text is scanned once while tracking open objects and arrays. Whenever a value completes (or a
 * container opens) the position and the stack of open containers are remembered. The repair cuts the
 * text at the last such point and appends the closers for exactly the containers open there, innermost
 * first.
 */
final class TruncatedJsonRepairer {

    private enum State { EXPECT_KEY, EXPECT_COLON, EXPECT_VALUE, AFTER_VALUE }

    private static final class Frame {
        private final char open;
        private State state;

        private Frame(char open, State state) {
            this.open = open;
            this.state = state;
        }
    }

    private TruncatedJsonRepairer() {
    }

    /**
     * Whether the text leaves a string, object or array open. Strings are honoured, so braces inside
     * quoted values do not count.
     */
    static boolean isUnbalanced(String text) {
        int depth = 0;
        boolean inString = false;
        boolean escape = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escape) {
                    escape = false;
                } else if (c == '\\') {
                    escape = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> depth++;
                case '}', ']' -> depth--;
                default -> {
                }
            }
        }
        return inString || depth > 0;
    }

    /**
     * Returns the repaired text, or {@code null} when the text does not start a JSON object or nothing
     * complete survives the cut.
     */
    static @Nullable String repair(String text) {
        if (text.isEmpty() || text.charAt(0) != '{') {
            return null;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        boolean inString = false;
        boolean stringIsKey = false;
        boolean escape = false;
        boolean inPrimitive = false;
        int safeEnd = -1;
        String safeClosers = "";

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escape) {
                    escape = false;
                } else if (c == '\\') {
                    escape = true;
                } else if (c == '"') {
                    inString = false;
                    Frame top = stack.peek();
                    if (stringIsKey) {
                        top.state = State.EXPECT_COLON;
                    } else {
                        top.state = State.AFTER_VALUE;
                        safeEnd = i + 1;
                        safeClosers = closers(stack);
                    }
                }
                continue;
            }
            if (inPrimitive) {
                if (c == ',' || c == '}' || c == ']' || Character.isWhitespace(c)) {
                    inPrimitive = false;
                    stack.peek().state = State.AFTER_VALUE;
                    safeEnd = i;
                    safeClosers = closers(stack);
                } else {
                    continue;
                }
            }
            if (Character.isWhitespace(c)) {
                continue;
            }
            Frame top = stack.peek();
            switch (c) {
                case '{', '[' -> {
                    if (top != null) {
                        top.state = State.AFTER_VALUE;
                    } else if (i > 0) {
                        return null;
                    }
                    stack.push(new Frame(c, c == '{' ? State.EXPECT_KEY : State.EXPECT_VALUE));
                    safeEnd = i + 1;
                    safeClosers = closers(stack);
                }
                case '}', ']' -> {
                    if (top == null || top.open != (c == '}' ? '{' : '[')) {
                        return null;
                    }
                    stack.pop();
                    if (stack.isEmpty()) {
                        // the document closed; whatever follows is not part of it
                        return text.substring(0, i + 1);
                    }
                    safeEnd = i + 1;
                    safeClosers = closers(stack);
                }
                case '"' -> {
                    if (top == null) {
                        return null;
                    }
                    inString = true;
                    stringIsKey = top.open == '{' && top.state == State.EXPECT_KEY;
                }
                case ':' -> {
                    if (top == null) {
                        return null;
                    }
                    top.state = State.EXPECT_VALUE;
                }
                case ',' -> {
                    if (top == null) {
                        return null;
                    }
                    top.state = top.open == '{' ? State.EXPECT_KEY : State.EXPECT_VALUE;
                }
                default -> {
                    if (top == null) {
                        return null;
                    }
                    inPrimitive = true;
                }
            }
        }
        if (safeEnd < 0) {
            return null;
        }
        return text.substring(0, safeEnd) + safeClosers;
    }

    private static String closers(Deque<Frame> stack) {
        StringBuilder out = new StringBuilder(stack.size());
        Iterator<Frame> it = stack.iterator();
        while (it.hasNext()) {
            out.append(it.next().open == '{' ? '}' : ']');
        }
        return out.toString();
    }
}
