package com.queryforge.service;

/**
 * Result of input-shape validation: valid, or the first reason the input was rejected.
 */
public record InputCheck(boolean valid, String reason) {

    private static final InputCheck OK = new InputCheck(true, "");

    public static InputCheck ok() {
        return OK;
    }

    public static InputCheck rejected(String reason) {
        return new InputCheck(false, reason);
    }
}
