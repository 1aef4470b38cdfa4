package com.libragraph.entitystore.util;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parser and formatter for the line-oriented ID index blob.
 *
 * <p>Index format: one ID token per line, every line terminated by {@code \n}.
 * The parser also accepts {@code \r} and {@code \r\n} terminators and a final
 * token without a terminator, so indexes written by other tools stay readable.
 *
 * <p>Tokens are opaque here; turning them into typed IDs is the caller's job.
 */
public final class IdIndex {

    private static final char LF = '\n';
    private static final char CR = '\r';

    private IdIndex() {
    }

    /**
     * Parses index content into its ordered, de-duplicated tokens.
     *
     * @param content index text, may be null or empty
     * @return tokens in first-occurrence order; empty list for empty content
     */
    public static List<String> parse(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }

        Set<String> tokens = new LinkedHashSet<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (isTerminator(c)) {
                addToken(tokens, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        // Trailing token without terminator
        addToken(tokens, current);

        return List.copyOf(tokens);
    }

    /**
     * Formats tokens as index content. Every line is terminated, including the last.
     */
    public static String format(List<String> tokens) {
        Objects.requireNonNull(tokens, "tokens cannot be null");
        StringBuilder out = new StringBuilder();
        for (String token : tokens) {
            out.append(requireValidToken(token)).append(LF);
        }
        return out.toString();
    }

    /**
     * Returns the text to append to {@code existing} so that {@code token} becomes
     * a new, independently parseable last line.
     *
     * <p>If the existing content does not end in a terminator, a {@code \n} is
     * prepended so the previous last line is not joined with the new token.
     */
    public static String appendSuffix(String existing, String token) {
        requireValidToken(token);
        if (existing == null || existing.isEmpty()) {
            return token + LF;
        }
        if (!endsWithTerminator(existing)) {
            return LF + token + LF;
        }
        return token + LF;
    }

    public static boolean endsWithTerminator(String content) {
        if (content == null || content.isEmpty()) {
            return false;
        }
        return isTerminator(content.charAt(content.length() - 1));
    }

    /**
     * Checks that a token can be stored as a single index line.
     *
     * @throws IllegalArgumentException if the token is empty, contains a line
     *                                  terminator, or has surrounding whitespace
     */
    public static String requireValidToken(String token) {
        Objects.requireNonNull(token, "token cannot be null");
        if (token.isEmpty()) {
            throw new IllegalArgumentException("Index token cannot be empty");
        }
        if (token.indexOf(LF) >= 0 || token.indexOf(CR) >= 0) {
            throw new IllegalArgumentException("Index token cannot contain a line terminator: "
                    + token.replace("\n", "\\n").replace("\r", "\\r"));
        }
        if (!token.strip().equals(token)) {
            throw new IllegalArgumentException("Index token has surrounding whitespace: '" + token + "'");
        }
        return token;
    }

    private static boolean isTerminator(char c) {
        return c == LF || c == CR;
    }

    private static void addToken(Set<String> tokens, StringBuilder current) {
        String token = current.toString().strip();
        // Blank between \r and \n
        if (!token.isEmpty()) {
            tokens.add(token);
        }
    }
}
