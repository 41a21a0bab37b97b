package com.tracechain.api.dto;

import com.tracechain.bridge.BridgeStatus;

import java.util.List;

public record CreateBridgeResponse(List<BridgeStatus> bridges) {
}
