package com.tencent.hpcflow.client.dto;

import lombok.Data;

import java.io.Serializable;

/**
 * 响应基类
 * <p>
 * 失败时 errCode 为错误码名称（如 CONFLICT），errEntity 为出错实体（如 "pipeline:io_test"）。
 * </p>
 */
@Data
public class Response implements Serializable {
    private static final long serialVersionUID = 1L;

    private boolean success = true;
    private String errCode;
    private String errEntity;
    private String errMessage;

    public static Response buildSuccess() {
        Response response = new Response();
        response.setSuccess(true);
        return response;
    }

    public static Response buildFailure(String errCode, String errMessage) {
        return buildFailure(errCode, null, errMessage);
    }

    public static Response buildFailure(String errCode, String errEntity, String errMessage) {
        Response response = new Response();
        response.setSuccess(false);
        response.setErrCode(errCode);
        response.setErrEntity(errEntity);
        response.setErrMessage(errMessage);
        return response;
    }
}
