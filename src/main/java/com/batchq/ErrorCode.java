package com.batchq;

/** Failure kinds reported to RPC callers, with their JSON-RPC error codes. */
public enum ErrorCode {
    PARSE_ERROR(-32700),
    INVALID_REQUEST(-32600),
    METHOD_NOT_FOUND(-32601),
    INVALID_PARAMS(-32602),
    INTERNAL(-32603),

    NOT_FOUND(-32001),
    VALIDATION(-32002),
    CONFLICT(-32003),
    LAUNCH(-32004),
    STORAGE(-32005),
    CONFIG(-32006);

    private final int rpcCode;

    ErrorCode(int rpcCode) {
        this.rpcCode = rpcCode;
    }

    public int rpcCode() {
        return rpcCode;
    }

    public static ErrorCode fromName(String name) {
        if (name != null) {
            for (ErrorCode c : values()) {
                if (c.name().equals(name)) return c;
            }
        }
        return INTERNAL;
    }
}
