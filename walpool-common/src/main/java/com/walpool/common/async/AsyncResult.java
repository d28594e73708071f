/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.common.async;

public class AsyncResult<T> {

    protected T result;
    protected Throwable cause;
    protected boolean succeeded;

    public AsyncResult(T result) {
        this.result = result;
        succeeded = true;
    }

    public AsyncResult(Throwable cause) {
        this.cause = cause;
        succeeded = false;
    }

    public T getResult() {
        return result;
    }

    public Throwable getCause() {
        return cause;
    }

    public boolean isSucceeded() {
        return succeeded;
    }
}
