package com.resume.network.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * No-operation oracle for when natural-language interpretation is disabled.
 * Every call fails, so every translation takes the keyword fallback.
 */
public class NoOpQueryOracle implements QueryOracle {
    private static final Logger log = LoggerFactory.getLogger(NoOpQueryOracle.class);

    @Override
    public OracleResponse translate(OracleRequest request) {
        log.debug("NoOp oracle called for text: '{}'", request.text());
        throw new OracleUnavailableException("Query oracle not configured - NoOp oracle in use");
    }

    @Override
    public String getOracleName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
