package com.todomanager.performance.support;

/**
 * 回调注册表的参数校验
 */
public final class Registrations {

    private Registrations() {
    }

    public static String requireKey(String key, String name) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return key;
    }

    public static <T> T requireCallback(T callback, String name) {
        if (callback == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return callback;
    }
}
