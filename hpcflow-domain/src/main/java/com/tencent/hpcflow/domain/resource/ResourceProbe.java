package com.tencent.hpcflow.domain.resource;

import java.util.List;

/**
 * ResourceProbe - 资源探测器
 * <p>
 * 从 hostfile、硬件代理等外部来源读取集群节点及其容量。
 * </p>
 */
public interface ResourceProbe {

    /**
     * 探测当前节点列表
     * @return 节点容量，编号按 hostfile 行序
     */
    List<NodeResource> probe();
}
