package com.gdin.inspection.citegraph.resp;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;
import org.springframework.http.HttpStatus;

@Data
@NoArgsConstructor
@Accessors(chain = true)
@Schema(description = "统一响应体")
public class ResultData<T> {

    @Schema(description = "状态码，与 HTTP 状态一致")
    private int code;

    @Schema(description = "提示信息")
    private String message;

    @Schema(description = "数据")
    private T data;

    @Schema(description = "时间戳")
    private long timestamp = System.currentTimeMillis();

    public static <T> ResultData<T> success() {
        return new ResultData<T>()
                .setCode(HttpStatus.OK.value())
                .setMessage(HttpStatus.OK.getReasonPhrase());
    }

    public static <T> ResultData<T> success(T data) {
        ResultData<T> resultData = success();
        return resultData.setData(data);
    }

    public static <T> ResultData<T> fail(int code, String message) {
        return new ResultData<T>().setCode(code).setMessage(message);
    }

    public static ResultData<String> fail(int code, String message, String data) {
        ResultData<String> resultData = fail(code, message);
        return resultData.setData(data);
    }

    public static ResultData<String> fail(int code, String message, Throwable e) {
        return fail(code, message, e.getMessage());
    }
}
