package com.hellokaton.lumen.exception;

public class NotFoundException extends HttpException {

    public NotFoundException(String detail) {
        super(404, detail);
    }

}
