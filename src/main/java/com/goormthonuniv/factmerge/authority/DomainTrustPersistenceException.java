package com.goormthonuniv.factmerge.authority;

public class DomainTrustPersistenceException extends RuntimeException {

    public DomainTrustPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
