package com.openforge.cortex.recovery;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Quote- and nesting-aware scanning over free text that contains JSON-ish fragments.
 */
final class JsonSpans {

    private JsonSpans() {}

    /**
     * Index of the bracket closing the one at {@code open}, or -1 when the text ends first.
     * Brackets inside double-quoted strings are ignored.
     */
    static int matchingClose(String text, int open) {
        char opener = text.charAt(open);
        char closer = switch (opener) {
            case '{' -> '}';
            case '[' -> ']';
            case '(' -> ')';
            default -> throw new IllegalArgumentException("Not an opening bracket: " + opener);
        };
        int depth = 0;
        boolean inString = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == opener) {
                depth++;
            } else if (c == closer) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /** Brace matches for every object opener in {@code text}, computed in one pass. */
    static ObjectIndex objectIndex(String text) {
        return new ObjectIndex(text);
    }

    /**
     * Closing position of each '{' in a text, or -1 where the text ends first.
     * Openers inside a string of an enclosing object are not objects and stay at -1.
     */
    static final class ObjectIndex {

        private final String text;
        private final int[] closes;
        private final int[] innermost;

        private ObjectIndex(String text) {
            this.text      = text;
            this.closes    = new int[text.length()];
            this.innermost = new int[text.length()];
            Arrays.fill(closes, -1);

            Deque<Integer> open = new ArrayDeque<>();
            boolean inString = false;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (c == '\\') {
                        i++;
                    } else if (c == '"') {
                        inString = false;
                    }
                    continue;
                }
                if (c == '"' && !open.isEmpty()) {
                    inString = true;
                } else if (c == '{') {
                    open.push(i);
                } else if (c == '}' && !open.isEmpty()) {
                    closes[open.pop()] = i;
                }
            }

            // balanced spans nest, so the innermost one around i is the top of this stack
            Deque<Integer> active = new ArrayDeque<>();
            for (int i = 0; i < text.length(); i++) {
                while (!active.isEmpty() && closes[active.peek()] <= i) {
                    active.pop();
                }
                if (closes[i] >= 0) {
                    active.push(i);
                }
                innermost[i] = active.isEmpty() ? -1 : active.peek();
            }
        }

        /** Every balanced top-level {...} span, left to right. Unbalanced openers are skipped. */
        List<String> topLevelObjects() {
            List<String> spans = new ArrayList<>();
            int i = 0;
            while (i < text.length()) {
                int open = text.indexOf('{', i);
                if (open < 0) {
                    break;
                }
                int close = closes[open];
                if (close < 0) {
                    i = open + 1;
                    continue;
                }
                spans.add(text.substring(open, close + 1));
                i = close + 1;
            }
            return spans;
        }

        /** The innermost balanced object that contains the position {@code at}, or null. */
        String enclosingObject(int at) {
            int open = innermost[at];
            return open < 0 ? null : text.substring(open, closes[open] + 1);
        }
    }

    /**
     * Splits on {@code separator} at nesting depth zero, outside single or double quotes.
     */
    static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{' || c == '[' || c == '(') {
                depth++;
            } else if (c == '}' || c == ']' || c == ')') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    /** Position of the first {@code target} char at depth zero outside quotes, or -1. */
    static int indexOfTopLevel(String text, char target) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{' || c == '[' || c == '(') {
                depth++;
            } else if (c == '}' || c == ']' || c == ')') {
                depth--;
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
