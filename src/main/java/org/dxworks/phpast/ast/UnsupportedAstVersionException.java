package org.dxworks.phpast.ast;

public class UnsupportedAstVersionException extends IllegalArgumentException {

    private final int requestedVersion;

    public UnsupportedAstVersionException(int requestedVersion) {
        super("Unexpected version: want 40 or 50, got " + requestedVersion);
        this.requestedVersion = requestedVersion;
    }

    public int getRequestedVersion() {
        return requestedVersion;
    }
}
