package com.findex.backend.util;

public final class MdcKeys {

    public static final String REQUEST_ID = "requestId";
    public static final String CORRELATION_ID = "correlationId";
    public static final String EXPORT_ID = "exportId";

    private MdcKeys() {
    }
}
