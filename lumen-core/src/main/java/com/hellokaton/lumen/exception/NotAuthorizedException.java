package com.hellokaton.lumen.exception;

public class NotAuthorizedException extends HttpException {

    public NotAuthorizedException(String detail) {
        super(401, detail);
    }

}
