package com.raditha.extract.model;

/**
 * A coded validation message.
 *
 * @param code    stable machine-readable code, e.g. METHOD_NAME_RESERVED
 * @param message human-readable text
 */
public record ValidationMessage(String code, String message) {

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
