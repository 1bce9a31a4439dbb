package com.hellokaton.lumen.mvc.handler;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Key of an exception handler registration: either an exception type or
 * an http status code.
 * <p>
 * {@link Exception}, {@link Throwable} and status 500 are catch-all keys.
 */
@Getter
@EqualsAndHashCode
public final class ExceptionKey {

    public static final int SERVER_ERROR = 500;

    private final Class<? extends Throwable> type;
    private final Integer status;

    private ExceptionKey(Class<? extends Throwable> type, Integer status) {
        this.type = type;
        this.status = status;
    }

    public static ExceptionKey of(Class<? extends Throwable> type) {
        if (null == type) {
            throw new IllegalArgumentException("Exception type must not be null");
        }
        return new ExceptionKey(type, null);
    }

    public static ExceptionKey of(int status) {
        return new ExceptionKey(null, status);
    }

    public boolean isCatchAll() {
        if (null != status) {
            return status == SERVER_ERROR;
        }
        return type == Exception.class || type == Throwable.class;
    }

    @Override
    public String toString() {
        return null != type ? type.getName() : String.valueOf(status);
    }

}
