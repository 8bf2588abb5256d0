package com.acme.secops.iamdrift.policy;

public sealed interface ParseResult permits ParseResult.Parsed, ParseResult.Unparsed {
    record Parsed(Grant grant) implements ParseResult {}
    record Unparsed(String raw, ParseError error) implements ParseResult {}
}
