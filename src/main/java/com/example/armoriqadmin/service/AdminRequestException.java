package com.example.armoriqadmin.service;

/**
 * Caller input the admin API refuses before anything is sent upstream.
 */
public class AdminRequestException extends RuntimeException {

    private AdminRequestException(String message) {
        super(message);
    }

    public static AdminRequestException blank(String field) {
        return new AdminRequestException(field + " must be non-blank");
    }
}
