package com.tencent.hpcflow.domain.schedule;

import com.tencent.hpcflow.domain.resource.ResourceDemand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * NodeAssignment - 单个节点上的放置列表
 * <p>
 * placements 按包在流水线中的位置排序，即节点内的执行顺序。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeAssignment {

    private int nodeId;

    private String host;

    /**
     * 计划时节点的容量
     */
    private ResourceDemand capacity;

    @Builder.Default
    private List<PackagePlacement> placements = new ArrayList<>();

    public ResourceDemand reserved() {
        return placements.stream().map(PackagePlacement::getReservation)
                .reduce(ResourceDemand.NONE, ResourceDemand::plus);
    }

    void sortByOrder() {
        placements.sort(Comparator.comparingInt(PackagePlacement::getOrder));
    }
}
