package com.anamnesis.rdf;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * N-Triples rendering of {@link Triple}s and the reverse parse of that rendering.
 */
public final class NTriples {
    private static final Pattern PREFIXED_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*:[^\\s\"<>]+$");

    private NTriples() {
    }

    public static String serialize(List<Triple> triples) {
        StringBuilder builder = new StringBuilder();
        for (Triple triple : triples) {
            builder.append(formatUri(triple.subject()))
                    .append(' ')
                    .append(formatUri(triple.predicate()))
                    .append(' ')
                    .append(formatObject(triple.object()))
                    .append(" .\n");
        }
        return builder.toString();
    }

    public static List<Triple> parse(String ntriples) {
        List<Triple> triples = new ArrayList<>();
        String[] lines = ntriples.split("\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (!line.endsWith(" .")) {
                throw new IllegalArgumentException("line " + (i + 1) + ": missing terminating ' .'");
            }
            String body = line.substring(0, line.length() - 2).strip();
            int subjectEnd = uriEnd(body, 0, i);
            String subject = body.substring(1, subjectEnd);
            int predicateStart = skipSpaces(body, subjectEnd + 1);
            int predicateEnd = uriEnd(body, predicateStart, i);
            String predicate = body.substring(predicateStart + 1, predicateEnd);
            String object = body.substring(skipSpaces(body, predicateEnd + 1)).strip();
            if (object.startsWith("<") && object.endsWith(">")) {
                object = object.substring(1, object.length() - 1);
            } else if (!object.startsWith("\"")) {
                throw new IllegalArgumentException("line " + (i + 1) + ": object is neither a URI nor a literal");
            }
            triples.add(new Triple(subject, predicate, object));
        }
        return triples;
    }

    public static String literal(String text) {
        return "\"" + escape(text) + "\"";
    }

    public static String typedLiteral(String text, String datatypeUri) {
        return literal(text) + "^^<" + datatypeUri + ">";
    }

    public static String escape(String text) {
        StringBuilder builder = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> builder.append("\\\\");
                case '"' -> builder.append("\\\"");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7F) {
                        builder.append(String.format("\\u%04X", (int) c));
                    } else {
                        builder.append(c);
                    }
                }
            }
        }
        return builder.toString();
    }

    static String formatUri(String term) {
        if (term.startsWith("<") && term.endsWith(">")) {
            return term;
        }
        if (isAbsolute(term)) {
            return "<" + term + ">";
        }
        int colon = term.indexOf(':');
        if (colon >= 0) {
            return "<" + RdfVocabulary.BASE + term.substring(colon + 1) + ">";
        }
        return "<" + term + ">";
    }

    static String formatObject(String value) {
        if (value.startsWith("\"")) {
            return value;
        }
        if (isAbsolute(value) || PREFIXED_NAME.matcher(value).matches()) {
            return formatUri(value);
        }
        return literal(value);
    }

    private static boolean isAbsolute(String term) {
        return term.startsWith("http://") || term.startsWith("https://");
    }

    private static int uriEnd(String body, int start, int lineIndex) {
        if (start >= body.length() || body.charAt(start) != '<') {
            throw new IllegalArgumentException("line " + (lineIndex + 1) + ": expected '<' at column " + (start + 1));
        }
        int end = body.indexOf('>', start);
        if (end < 0) {
            throw new IllegalArgumentException("line " + (lineIndex + 1) + ": unterminated URI");
        }
        return end;
    }

    private static int skipSpaces(String body, int index) {
        while (index < body.length() && body.charAt(index) == ' ') {
            index++;
        }
        return index;
    }
}
