package com.acme.secops.iamdrift.policy;

/**
 * Parses single-line IAM policy statements into structured grants.
 *
 * <p>Implementations must be side-effect free: the same input always yields an equal
 * result, and a statement outside the grammar is reported as
 * {@link ParseResult.Unparsed} rather than thrown.
 */
public interface StatementParser {
    /**
     * @param raw the statement text as stored on the policy
     * @return the parsed grant, or the reason it could not be parsed
     */
    ParseResult parse(String raw);
}
