package com.resume.network.llm;

/**
 * External natural-language interpreter. Implementations turn a free-form search request into
 * JSON filter fields; they never execute queries.
 *
 * <p>Oracle output is treated as untrusted input. Timeouts are enforced by the caller.</p>
 */
public interface QueryOracle {

    /**
     * Asks the oracle to interpret a request.
     *
     * @throws OracleUnavailableException if the oracle cannot be reached or fails to answer
     */
    OracleResponse translate(OracleRequest request);

    /**
     * Returns the name/identifier of this oracle.
     */
    String getOracleName();

    /**
     * Checks if the oracle is available and configured.
     */
    boolean isAvailable();
}
