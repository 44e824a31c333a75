package com.todomanager.performance.support;

import java.util.Optional;

/**
 * 回调分发结果
 *
 * 用户注册的处理器/回调（批量刷新处理器、刷新回调、内存等级回调）统一通过
 * {@link #invoke(String, Runnable)} 执行：异常被捕获并封装为失败结果，绝不向上抛出，
 * 调用方负责记录日志。
 *
 * @param target  分发目标（更新类型 / 组件ID / 内存等级）
 * @param failure 失败原因，成功时为 null
 */
public record DispatchResult(String target, Throwable failure) {

    public static DispatchResult success(String target) {
        return new DispatchResult(target, null);
    }

    public static DispatchResult failed(String target, Throwable failure) {
        return new DispatchResult(target, failure);
    }

    /**
     * 执行用户代码并返回结果
     */
    public static DispatchResult invoke(String target, Runnable action) {
        try {
            action.run();
            return success(target);
        } catch (Exception e) {
            return failed(target, e);
        }
    }

    public boolean succeeded() {
        return failure == null;
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(failure);
    }
}
