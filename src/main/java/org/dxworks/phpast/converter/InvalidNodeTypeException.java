package org.dxworks.phpast.converter;

public class InvalidNodeTypeException extends IllegalArgumentException {
    public InvalidNodeTypeException(String message) {
        super(message);
    }
}
