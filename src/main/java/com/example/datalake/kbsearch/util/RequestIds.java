package com.example.datalake.kbsearch.util;

import java.util.UUID;

public final class RequestIds {

    private static final int LENGTH = 8;

    private RequestIds() {
    }

    /** Short id tying a response to its log lines. */
    public static String newRequestId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, LENGTH);
    }
}
