package com.gdin.inspection.citegraph.graph.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.inspection.citegraph.exception.ErrorCode;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ItemOutcome {

    @JsonProperty("item_id")
    String itemId;

    @JsonProperty("status")
    ItemStatus status;

    @JsonProperty("error_code")
    String errorCode;

    @JsonProperty("error")
    String error;

    @JsonProperty("retryable")
    boolean retryable;

    public static ItemOutcome succeeded(String itemId) {
        return new ItemOutcome(itemId, ItemStatus.SUCCEEDED, null, null, false);
    }

    public static ItemOutcome cancelled(String itemId) {
        return new ItemOutcome(itemId, ItemStatus.CANCELLED, ErrorCode.CANCELLED.name(), "任务已取消，未执行", true);
    }

    public static ItemOutcome failed(String itemId, String errorCode, String error, boolean retryable) {
        return new ItemOutcome(itemId, ItemStatus.FAILED, errorCode, error, retryable);
    }
}
