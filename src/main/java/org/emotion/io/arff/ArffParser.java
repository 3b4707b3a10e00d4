package org.emotion.io.arff;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parser for the text attribute-relation format:
 * <pre>
 * % comment
 * &#64;relation emodb
 * &#64;attribute name string
 * &#64;attribute pcm_loudness numeric
 * &#64;attribute class {W,L,E,A,F,T,N}
 * &#64;data
 * '03a01Fa',0.52,F
 * </pre>
 * Sparse rows are not supported.
 */
public final class ArffParser {

    public ArffRelation parse(Reader in) throws IOException {
        BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);

        String relation = null;
        List<ArffAttribute> attributes = new ArrayList<>();
        List<List<Object>> data = new ArrayList<>();
        boolean inData = false;

        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String s = line.strip();
            if (s.isEmpty() || s.startsWith("%")) {
                continue;
            }

            if (inData) {
                data.add(parseRow(s, attributes, lineNo));
                continue;
            }

            String lower = s.toLowerCase(Locale.ROOT);
            if (lower.startsWith("@relation")) {
                List<String> tokens = splitHeader(s.substring("@relation".length()), lineNo);
                if (tokens.size() != 1) {
                    throw new ArffFormatException(lineNo, "@relation needs exactly one name");
                }
                relation = tokens.get(0);
            } else if (lower.startsWith("@attribute")) {
                attributes.add(parseAttribute(s.substring("@attribute".length()), lineNo));
            } else if (lower.startsWith("@data")) {
                if (attributes.isEmpty()) {
                    throw new ArffFormatException(lineNo, "@data before any @attribute");
                }
                inData = true;
            } else {
                throw new ArffFormatException(lineNo, "Unexpected header line: " + s);
            }
        }

        if (relation == null) {
            throw new ArffFormatException(lineNo, "Missing @relation");
        }
        if (!inData) {
            throw new ArffFormatException(lineNo, "Missing @data section");
        }
        return new ArffRelation(relation, attributes, data);
    }

    private static ArffAttribute parseAttribute(String rest, int lineNo) {
        String body = rest.strip();
        int brace = body.indexOf('{');
        if (brace >= 0) {
            List<String> nameTokens = splitHeader(body.substring(0, brace), lineNo);
            int close = body.lastIndexOf('}');
            if (nameTokens.size() != 1 || close < brace) {
                throw new ArffFormatException(lineNo, "Malformed nominal attribute: " + body);
            }
            List<String> values = new ArrayList<>();
            for (String v : splitValues(body.substring(brace + 1, close), lineNo)) {
                values.add(v);
            }
            return ArffAttribute.nominal(nameTokens.get(0), values);
        }

        List<String> tokens = splitHeader(body, lineNo);
        if (tokens.size() < 2) {
            throw new ArffFormatException(lineNo, "Attribute needs a name and a type: " + body);
        }
        String name = tokens.get(0);
        return switch (tokens.get(1).toLowerCase(Locale.ROOT)) {
            case "numeric", "real", "integer" -> ArffAttribute.numeric(name);
            case "string" -> ArffAttribute.string(name);
            case "date" -> new ArffAttribute(name, ArffAttribute.Type.DATE, List.of());
            default -> throw new ArffFormatException(lineNo, "Unsupported attribute type: " + tokens.get(1));
        };
    }

    private static List<Object> parseRow(String s, List<ArffAttribute> attributes, int lineNo) {
        if (s.startsWith("{")) {
            throw new ArffFormatException(lineNo, "Sparse rows are not supported");
        }
        List<String> raw = splitValues(s, lineNo);
        if (raw.size() != attributes.size()) {
            throw new ArffFormatException(lineNo,
                    "Row has " + raw.size() + " values, expected " + attributes.size());
        }

        List<Object> row = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            String v = raw.get(i);
            ArffAttribute attr = attributes.get(i);
            if (v == null) {
                row.add(null);
            } else if (attr.type() == ArffAttribute.Type.NUMERIC) {
                try {
                    row.add(Double.parseDouble(v));
                } catch (NumberFormatException e) {
                    throw new ArffFormatException(lineNo,
                            "Attribute " + attr.name() + " is numeric but got '" + v + "'");
                }
            } else if (attr.type() == ArffAttribute.Type.NOMINAL && !attr.nominalValues().contains(v)) {
                throw new ArffFormatException(lineNo,
                        "Value '" + v + "' is not declared for nominal attribute " + attr.name());
            } else {
                row.add(v);
            }
        }
        return row;
    }

    /** Whitespace-separated tokens, honouring quotes. */
    private static List<String> splitHeader(String s, int lineNo) {
        List<String> out = new ArrayList<>();
        int i = 0;
        int n = s.length();
        while (i < n) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '\'' || c == '"') {
                int end = closingQuote(s, i, lineNo);
                out.add(unescape(s.substring(i + 1, end)));
                i = end + 1;
            } else {
                int start = i;
                while (i < n && !Character.isWhitespace(s.charAt(i))) {
                    i++;
                }
                out.add(s.substring(start, i));
            }
        }
        return out;
    }

    /** Comma-separated values, honouring quotes; an unquoted {@code ?} becomes {@code null}. */
    private static List<String> splitValues(String s, int lineNo) {
        List<String> out = new ArrayList<>();
        int i = 0;
        int n = s.length();
        while (i <= n) {
            while (i < n && Character.isWhitespace(s.charAt(i))) {
                i++;
            }
            String value;
            if (i < n && (s.charAt(i) == '\'' || s.charAt(i) == '"')) {
                int end = closingQuote(s, i, lineNo);
                value = unescape(s.substring(i + 1, end));
                i = end + 1;
                while (i < n && Character.isWhitespace(s.charAt(i))) {
                    i++;
                }
            } else {
                int start = i;
                while (i < n && s.charAt(i) != ',') {
                    i++;
                }
                String token = s.substring(start, i).strip();
                value = token.equals("?") ? null : token;
            }
            out.add(value);

            if (i < n && s.charAt(i) != ',') {
                throw new ArffFormatException(lineNo, "Expected ',' at column " + (i + 1));
            }
            i++;
        }
        return out;
    }

    private static int closingQuote(String s, int open, int lineNo) {
        char q = s.charAt(open);
        for (int i = open + 1; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == q) {
                return i;
            }
        }
        throw new ArffFormatException(lineNo, "Unterminated quote");
    }

    private static String unescape(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char next = s.charAt(++i);
                sb.append(switch (next) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    default -> next;
                });
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Syntax error in an attribute-relation file. */
    public static final class ArffFormatException extends IllegalArgumentException {

        private final int line;

        public ArffFormatException(int line, String message) {
            super("line " + line + ": " + message);
            this.line = line;
        }

        public int line() {
            return line;
        }
    }
}
