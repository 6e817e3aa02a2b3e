package com.retailpos.pricing.exception;

import lombok.Getter;

@Getter
public class UnresolvedProductException extends RuntimeException {
    private final String token;

    public UnresolvedProductException(String token) {
        super("No product or alias matches '" + token + "'");
        this.token = token;
    }
}
