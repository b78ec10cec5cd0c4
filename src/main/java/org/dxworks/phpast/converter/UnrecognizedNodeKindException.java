package org.dxworks.phpast.converter;

public class UnrecognizedNodeKindException extends RuntimeException {

    private final String nodeType;
    private final int line;

    public UnrecognizedNodeKindException(String nodeType, int line) {
        super("No converter for node type '" + nodeType + "' on line " + line);
        this.nodeType = nodeType;
        this.line = line;
    }

    public String getNodeType() {
        return nodeType;
    }

    public int getLine() {
        return line;
    }
}
