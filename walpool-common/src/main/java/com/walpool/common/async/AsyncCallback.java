/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.common.async;

import java.util.concurrent.CountDownLatch;

import com.walpool.common.exceptions.DbException;
import com.walpool.common.exceptions.ErrorCode;

/**
 * The completion signal of a task handed to another thread.
 * The submitting thread blocks in {@link #await()} until the task sets its result.
 */
public class AsyncCallback<T> {

    private final CountDownLatch latch = new CountDownLatch(1);
    private volatile AsyncResult<T> asyncResult;

    public T await() {
        if (asyncResult == null) {
            try {
                latch.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw DbException.get(ErrorCode.INTERRUPTED_1, e, "a task to complete");
            }
        }
        return getResult(asyncResult);
    }

    public void setAsyncResult(T result) {
        setAsyncResult(new AsyncResult<>(result));
    }

    public void setAsyncResult(Throwable cause) {
        setAsyncResult(new AsyncResult<T>(cause));
    }

    public void setAsyncResult(AsyncResult<T> asyncResult) {
        this.asyncResult = asyncResult;
        latch.countDown();
    }

    public AsyncResult<T> getAsyncResult() {
        return asyncResult;
    }

    // 任务抛出的RuntimeException和Error原样抛给调用者
    private T getResult(AsyncResult<T> asyncResult) {
        if (asyncResult.isSucceeded())
            return asyncResult.getResult();
        throw DbException.rethrow(asyncResult.getCause());
    }
}
