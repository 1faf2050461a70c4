package com.tencent.hpcflow.domain.event;

/**
 * EventListener - 事件监听接口
 */
public interface EventListener {
    /**
     * 处理事件，实现方不得长时间阻塞
     * @param event 事件对象
     */
    void onEvent(Event event);
}
