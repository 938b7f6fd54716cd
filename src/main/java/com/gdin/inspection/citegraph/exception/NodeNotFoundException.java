package com.gdin.inspection.citegraph.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class NodeNotFoundException extends GraphException {

    private final List<String> missingIds;

    public NodeNotFoundException(String graphId, List<String> missingIds) {
        super(ErrorCode.NODE_NOT_FOUND, "图 " + graphId + " 中不存在节点: " + missingIds);
        this.missingIds = List.copyOf(missingIds);
    }
}
