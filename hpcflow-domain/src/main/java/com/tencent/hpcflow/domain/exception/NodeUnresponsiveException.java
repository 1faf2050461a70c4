package com.tencent.hpcflow.domain.exception;

/**
 * NodeUnresponsiveException - 节点失去响应（瞬时错误）
 */
public class NodeUnresponsiveException extends HpcflowException {

    public NodeUnresponsiveException(String entity, String message) {
        super(ErrorCode.NODE_UNRESPONSIVE, entity, message);
    }

    public NodeUnresponsiveException(String entity, String message, Throwable cause) {
        super(ErrorCode.NODE_UNRESPONSIVE, entity, message, cause);
    }
}
