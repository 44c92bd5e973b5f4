package com.fleetinsight.api.validation;

import org.springframework.stereotype.Component;

/**
 * Validates query parameters of the record endpoints.
 */
@Component
public class QueryParamValidator {

    public static final int MAX_LIMIT = 10_000;

    /** 1..{@value #MAX_LIMIT}. */
    public boolean isValidLimit(int limit) {
        return limit > 0 && limit <= MAX_LIMIT;
    }
}
