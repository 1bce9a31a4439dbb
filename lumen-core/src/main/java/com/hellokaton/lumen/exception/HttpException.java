package com.hellokaton.lumen.exception;

import lombok.Getter;

/**
 * An error that carries the HTTP status it should be rendered with.
 */
@Getter
public class HttpException extends LumenException {

    private final int status;
    private final String detail;

    public HttpException(int status, String detail) {
        super(status + ": " + detail);
        this.status = status;
        this.detail = detail;
    }

}
