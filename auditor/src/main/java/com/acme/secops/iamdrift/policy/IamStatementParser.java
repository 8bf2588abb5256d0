package com.acme.secops.iamdrift.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parser for the cloud IAM single-line statement form:
 * {@code Allow <subject> to <verb> <resource-type> [in <scope>] [where <condition>]}.
 * A statement without an {@code in} clause parses with {@link Scope#unspecified()}.
 */
public final class IamStatementParser implements StatementParser {

    @Override
    public ParseResult parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return unparsed(raw, ParseError.Kind.MALFORMED_GRAMMAR, "statement is blank", 0);
        }

        List<Token> tokens = tokenize(raw);
        if (!tokens.get(0).is("allow")) {
            return unparsed(raw, ParseError.Kind.MALFORMED_GRAMMAR, "statement does not start with Allow", 0);
        }

        int i = 1;
        if (i >= tokens.size() || tokens.get(i).is("to")) {
            return unparsed(raw, ParseError.Kind.MISSING_SUBJECT, "no subject before 'to'", i);
        }

        SubjectType subjectType;
        String subjectName = "";
        boolean subjectById = false;
        String subjectKeyword = tokens.get(i).lower();
        switch (subjectKeyword) {
            case "any-user" -> {
                subjectType = SubjectType.ANY_USER;
                i++;
            }
            case "any-group" -> {
                subjectType = SubjectType.ANY_GROUP;
                i++;
            }
            case "group", "dynamic-group", "service" -> {
                subjectType = switch (subjectKeyword) {
                    case "group" -> SubjectType.GROUP;
                    case "dynamic-group" -> SubjectType.DYNAMIC_GROUP;
                    default -> SubjectType.SERVICE;
                };
                i++;
                if (i >= tokens.size() || tokens.get(i).is("to")) {
                    return unparsed(raw, ParseError.Kind.MISSING_SUBJECT,
                        subjectKeyword + " requires a name", i);
                }
                Token nameToken = tokens.get(i);
                if (subjectType != SubjectType.SERVICE && nameToken.is("id")
                    && i + 1 < tokens.size() && !tokens.get(i + 1).is("to")) {
                    subjectById = true;
                    subjectName = tokens.get(i + 1).text();
                    i += 2;
                } else if (subjectType == SubjectType.GROUP && nameToken.text().equals("*")) {
                    subjectType = SubjectType.ANY_GROUP;
                    i++;
                } else {
                    subjectName = unquoteName(nameToken.text());
                    i++;
                }
                if (subjectName.isEmpty() && !subjectType.isTenancyWide()) {
                    return unparsed(raw, ParseError.Kind.MISSING_SUBJECT, subjectKeyword + " name is empty", i - 1);
                }
            }
            default -> {
                return unparsed(raw, ParseError.Kind.MISSING_SUBJECT,
                    "unknown subject: " + tokens.get(i).text(), i);
            }
        }

        if (i >= tokens.size() || !tokens.get(i).is("to")) {
            return unparsed(raw, ParseError.Kind.MALFORMED_GRAMMAR, "expected 'to' after subject", i);
        }
        i++;

        if (i >= tokens.size()) {
            return unparsed(raw, ParseError.Kind.MALFORMED_GRAMMAR, "missing verb", i);
        }
        Token verbToken = tokens.get(i);
        if (verbToken.text().startsWith("{")) {
            return unparsed(raw, ParseError.Kind.UNSUPPORTED_VERB, "permission lists are not supported", i);
        }
        Verb verb = Verb.fromToken(verbToken.text());
        if (verb == null) {
            return unparsed(raw, ParseError.Kind.UNSUPPORTED_VERB, "unsupported verb: " + verbToken.text(), i);
        }
        i++;

        if (i >= tokens.size() || tokens.get(i).is("in")) {
            return unparsed(raw, ParseError.Kind.MALFORMED_GRAMMAR, "missing resource type", i);
        }
        String resourceType = tokens.get(i).lower();
        i++;

        Scope scope;
        if (i >= tokens.size() || tokens.get(i).is("where")) {
            scope = Scope.unspecified();
        } else if (!tokens.get(i).is("in")) {
            return unparsed(raw, ParseError.Kind.MALFORMED_GRAMMAR, "expected 'in' after resource type", i);
        } else if (++i >= tokens.size()) {
            return unparsed(raw, ParseError.Kind.MALFORMED_GRAMMAR, "missing scope", i);
        } else if (tokens.get(i).is("tenancy")) {
            scope = Scope.tenancy();
            i++;
        } else if (tokens.get(i).is("compartment")) {
            i++;
            if (i >= tokens.size() || tokens.get(i).is("where")) {
                return unparsed(raw, ParseError.Kind.MALFORMED_GRAMMAR, "compartment requires a name", i);
            }
            if (tokens.get(i).is("id") && i + 1 < tokens.size() && !tokens.get(i + 1).is("where")) {
                scope = Scope.compartmentId(tokens.get(i + 1).text());
                i += 2;
            } else {
                scope = Scope.compartment(unquoteName(tokens.get(i).text()));
                i++;
            }
        } else {
            return unparsed(raw, ParseError.Kind.MALFORMED_GRAMMAR, "unknown scope: " + tokens.get(i).text(), i);
        }

        String condition = null;
        if (i < tokens.size()) {
            if (!tokens.get(i).is("where")) {
                return unparsed(raw, ParseError.Kind.MALFORMED_GRAMMAR, "unexpected token: " + tokens.get(i).text(), i);
            }
            if (i + 1 >= tokens.size()) {
                return unparsed(raw, ParseError.Kind.MALFORMED_GRAMMAR, "empty where clause", i);
            }
            condition = raw.substring(tokens.get(i + 1).start()).trim();
        }

        return new ParseResult.Parsed(new Grant(
            verb,
            resourceType,
            subjectType,
            subjectName,
            subjectById,
            scope,
            condition
        ));
    }

    private static ParseResult unparsed(String raw, ParseError.Kind kind, String message, int position) {
        return new ParseResult.Unparsed(raw == null ? "" : raw, new ParseError(kind, message, position));
    }

    // Splits on whitespace outside quotes; quotes stay in the token text.
    private static List<Token> tokenize(String raw) {
        List<Token> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int start = -1;
        char quote = 0;

        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote == 0 && Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    out.add(new Token(current.toString(), start));
                    current.setLength(0);
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                if (quote == 0) {
                    quote = c;
                } else if (quote == c) {
                    quote = 0;
                }
            }
            if (current.length() == 0) {
                start = i;
            }
            current.append(c);
        }
        if (current.length() > 0) {
            out.add(new Token(current.toString(), start));
        }
        return out;
    }

    /**
     * Strips quotes and identity-domain prefixes: {@code 'Default'/'Admins'} becomes
     * {@code Admins}.
     */
    static String unquoteName(String token) {
        String name = token;
        char quote = 0;
        int lastSlash = -1;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c == '\'' || c == '"') {
                if (quote == 0) {
                    quote = c;
                } else if (quote == c) {
                    quote = 0;
                }
            } else if (c == '/' && quote == 0) {
                lastSlash = i;
            }
        }
        if (lastSlash >= 0) {
            name = token.substring(lastSlash + 1);
        }
        if (name.length() >= 2) {
            char first = name.charAt(0);
            char last = name.charAt(name.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                name = name.substring(1, name.length() - 1);
            }
        }
        return name.trim();
    }

    private record Token(String text, int start) {
        boolean is(String keyword) {
            return text.equalsIgnoreCase(keyword);
        }

        String lower() {
            return text.toLowerCase(Locale.ROOT);
        }
    }
}
