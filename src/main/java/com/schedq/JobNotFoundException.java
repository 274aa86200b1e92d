package com.schedq;

public class JobNotFoundException extends RuntimeException {

    private final String code;

    public JobNotFoundException(String code) {
        super("Job not found: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
