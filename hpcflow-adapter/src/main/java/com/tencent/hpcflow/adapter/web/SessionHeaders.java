package com.tencent.hpcflow.adapter.web;

/**
 * 会话标识通过请求头传递，缺省时操作不改变任何会话的聚焦
 */
final class SessionHeaders {

    static final String SESSION_ID = "X-Hpcflow-Session";

    private SessionHeaders() {
    }
}
