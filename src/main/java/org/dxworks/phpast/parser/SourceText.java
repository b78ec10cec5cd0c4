package org.dxworks.phpast.parser;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;

/**
 * Source code together with its UTF-8 encoding. Tree-sitter reports UTF-8 byte offsets,
 * while Java strings are indexed by UTF-16 chars, so node text is cut from the bytes.
 */
public class SourceText {

    private final String source;
    private final byte[] bytes;

    public SourceText(String source) {
        this.source = source;
        this.bytes = source.getBytes(StandardCharsets.UTF_8);
    }

    public String getSource() {
        return source;
    }

    public String text(TSNode node) {
        if (node == null || node.isNull()) return null;
        return slice(node.getStartByte(), node.getEndByte());
    }

    public String slice(int startByte, int endByte) {
        if (startByte < 0) startByte = 0;
        if (endByte > bytes.length) endByte = bytes.length;
        if (startByte >= endByte) return "";
        return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** The byte at the given offset, or -1 outside the source. */
    public int byteAt(int offset) {
        if (offset < 0 || offset >= bytes.length) return -1;
        return bytes[offset] & 0xFF;
    }

    public int length() {
        return bytes.length;
    }
}
