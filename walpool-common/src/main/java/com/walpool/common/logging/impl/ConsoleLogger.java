/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.common.logging.impl;

import java.io.PrintStream;

import com.walpool.common.logging.Logger;

class ConsoleLogger implements Logger {

    enum Level {
        TRACE,
        DEBUG,
        INFO,
        WARN,
        ERROR
    }

    private final String name;
    private final Level level;

    ConsoleLogger(String name, Level level) {
        this.name = name;
        this.level = level;
    }

    private boolean isEnabled(Level l) {
        return l.ordinal() >= level.ordinal();
    }

    @Override
    public boolean isWarnEnabled() {
        return isEnabled(Level.WARN);
    }

    @Override
    public boolean isInfoEnabled() {
        return isEnabled(Level.INFO);
    }

    @Override
    public boolean isDebugEnabled() {
        return isEnabled(Level.DEBUG);
    }

    @Override
    public boolean isTraceEnabled() {
        return isEnabled(Level.TRACE);
    }

    @Override
    public void error(Object message) {
        log(Level.ERROR, message, null);
    }

    @Override
    public void error(Object message, Throwable t) {
        log(Level.ERROR, message, t);
    }

    @Override
    public void error(Object message, Throwable t, Object... params) {
        log(Level.ERROR, format(message, params), t);
    }

    @Override
    public void warn(Object message) {
        log(Level.WARN, message, null);
    }

    @Override
    public void warn(Object message, Object... params) {
        log(Level.WARN, format(message, params), null);
    }

    @Override
    public void warn(Object message, Throwable t) {
        log(Level.WARN, message, t);
    }

    @Override
    public void warn(Object message, Throwable t, Object... params) {
        log(Level.WARN, format(message, params), t);
    }

    @Override
    public void info(Object message) {
        log(Level.INFO, message, null);
    }

    @Override
    public void info(Object message, Object... params) {
        log(Level.INFO, format(message, params), null);
    }

    @Override
    public void debug(Object message) {
        log(Level.DEBUG, message, null);
    }

    @Override
    public void debug(Object message, Object... params) {
        log(Level.DEBUG, format(message, params), null);
    }

    @Override
    public void trace(Object message, Object... params) {
        log(Level.TRACE, format(message, params), null);
    }

    private void log(Level l, Object message, Throwable t) {
        if (!isEnabled(l))
            return;
        PrintStream out = l.ordinal() >= Level.WARN.ordinal() ? System.err : System.out;
        out.println(l + " [" + Thread.currentThread().getName() + "] " + name + " - " + message);
        if (t != null)
            t.printStackTrace(out);
    }

    // 把{}占位符替换成参数
    static String format(Object message, Object... params) {
        String pattern = String.valueOf(message);
        if (params == null || params.length == 0)
            return pattern;
        int length = pattern.length();
        StringBuilder s = new StringBuilder(length + 16 * params.length);
        int p = 0;
        for (int i = 0; i < length; i++) {
            char c = pattern.charAt(i);
            if (c == '{' && i + 1 < length && pattern.charAt(i + 1) == '}' && p < params.length) {
                s.append(params[p++]);
                i++;
            } else {
                s.append(c);
            }
        }
        return s.toString();
    }
}
