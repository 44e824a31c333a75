package com.todomanager.performance.batch;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 待刷新的单条更新
 *
 * @param kind       更新类型，决定由哪个刷新处理器接收
 * @param itemId     业务对象标识（不透明）
 * @param payload    字段名 -> 值
 * @param enqueuedAt 入队时间
 */
public record PendingUpdate(
    String kind,
    Object itemId,
    Map<String, Object> payload,
    Instant enqueuedAt
) {
    public PendingUpdate {
        payload = payload == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
