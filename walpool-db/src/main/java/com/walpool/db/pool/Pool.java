/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db.pool;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;
import java.util.function.Function;

import com.walpool.common.exceptions.DbException;
import com.walpool.common.exceptions.ErrorCode;

/**
 * A pool of at most maximumCount elements, created on demand.
 * <p>
 * {@link #get(Function)} blocks when all elements are checked out and no more can be created.
 * Waiters are served in arrival order.
 */
public class Pool<T> {

    @FunctionalInterface
    public interface ElementFactory<T> {
        T create();
    }

    private static class Item<T> {
        final T element;
        boolean available;

        Item(T element) {
            this.element = element;
        }
    }

    private final String name;
    private final ElementFactory<T> factory;
    private final Consumer<T> evictor;
    private final Semaphore semaphore;

    // 受this保护
    private final ArrayList<Item<T>> items = new ArrayList<>();
    private boolean closed;

    /**
     * @param factory creates a new element, called with the pool lock held
     * @param evictor disposes of an element removed by {@link #clear()} or {@link #close()}
     */
    public Pool(String name, int maximumCount, ElementFactory<T> factory, Consumer<T> evictor) {
        if (maximumCount <= 0)
            throw new IllegalArgumentException("maximumCount must be > 0, got " + maximumCount);
        this.name = name;
        this.factory = factory;
        this.evictor = evictor;
        semaphore = new Semaphore(maximumCount, true);
    }

    /**
     * Checks out an element, runs the block with it and returns the element to the pool,
     * whatever the block does.
     * <p>
     * A failure of the element factory is thrown to the caller, the pool remains usable.
     */
    public <R> R get(Function<? super T, R> block) {
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DbException.get(ErrorCode.INTERRUPTED_1, e, name);
        }
        Item<T> item;
        try {
            item = checkOut();
        } catch (Throwable t) {
            semaphore.release();
            throw t;
        }
        try {
            return block.apply(item.element);
        } finally {
            try {
                checkIn(item);
            } finally {
                semaphore.release();
            }
        }
    }

    private synchronized Item<T> checkOut() {
        if (closed)
            throw DbException.get(ErrorCode.DATABASE_CLOSED_1, name);
        for (Item<T> item : items) {
            if (item.available) {
                item.available = false;
                return item;
            }
        }
        Item<T> item = new Item<>(factory.create());
        items.add(item);
        return item;
    }

    private synchronized void checkIn(Item<T> item) {
        if (closed) {
            // 池关闭时正在使用的元素在归还时销毁
            items.remove(item);
            evictor.accept(item.element);
        } else {
            item.available = true;
        }
    }

    /**
     * Visits every live element, checked out or not.
     * No element is created or evicted during the visit.
     */
    public synchronized void forEach(Consumer<? super T> visitor) {
        for (Item<T> item : items)
            visitor.accept(item.element);
    }

    /**
     * Evicts the elements that are not checked out.
     */
    public synchronized void clear() {
        evictIdle();
    }

    /**
     * Evicts the idle elements now and the others when they are returned.
     * Later checkouts fail.
     */
    public synchronized void close() {
        if (closed)
            return;
        closed = true;
        evictIdle();
    }

    private void evictIdle() {
        RuntimeException error = null;
        for (Iterator<Item<T>> it = items.iterator(); it.hasNext();) {
            Item<T> item = it.next();
            if (!item.available)
                continue;
            it.remove();
            try {
                evictor.accept(item.element);
            } catch (RuntimeException e) {
                if (error == null)
                    error = e;
                else
                    error.addSuppressed(e);
            }
        }
        if (error != null)
            throw error;
    }

    public synchronized int getLiveCount() {
        return items.size();
    }

    public synchronized int getIdleCount() {
        int count = 0;
        for (Item<T> item : items) {
            if (item.available)
                count++;
        }
        return count;
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
