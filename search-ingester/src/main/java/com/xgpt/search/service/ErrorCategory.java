package com.xgpt.search.service;

public enum ErrorCategory {
    /** Connectivity problems; retried */
    NETWORK,
    /** Source throttling; retried after the reset window */
    RATE_LIMIT,
    /** 5xx and similar transient server trouble; retried */
    TEMPORARY,
    /** Credentials missing or rejected; needs an operator */
    AUTHENTICATION,
    /** Bad request; needs an operator */
    VALIDATION,
    /** Anything else; retried with bounded attempts */
    UNKNOWN
}
