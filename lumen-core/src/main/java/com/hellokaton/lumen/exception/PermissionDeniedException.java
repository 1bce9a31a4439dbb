package com.hellokaton.lumen.exception;

public class PermissionDeniedException extends HttpException {

    public PermissionDeniedException(String detail) {
        super(403, detail);
    }

}
