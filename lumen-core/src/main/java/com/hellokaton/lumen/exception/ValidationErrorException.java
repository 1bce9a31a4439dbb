package com.hellokaton.lumen.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Request data failed validation. Rendered as 400 by the default handler.
 */
@Getter
public class ValidationErrorException extends HttpException {

    private final List<String> errors;

    public ValidationErrorException(String detail) {
        this(detail, Collections.<String>emptyList());
    }

    public ValidationErrorException(String detail, List<String> errors) {
        super(400, detail);
        this.errors = errors == null ? Collections.<String>emptyList() : Collections.unmodifiableList(errors);
    }

}
