package com.gdin.inspection.cognify.resp;

import lombok.Data;
import lombok.experimental.Accessors;
import org.springframework.http.HttpStatus;

@Data
@Accessors(chain = true)
public class ResultData<T> {

    private int code;

    private String message;

    private T data;

    private long timestamp = System.currentTimeMillis();

    public static <T> ResultData<T> success(T data) {
        ResultData<T> resultData = new ResultData<>();
        resultData.setCode(HttpStatus.OK.value());
        resultData.setMessage(HttpStatus.OK.getReasonPhrase());
        resultData.setData(data);
        return resultData;
    }

    public static <T> ResultData<T> fail(int code, String message) {
        ResultData<T> resultData = new ResultData<>();
        resultData.setCode(code);
        resultData.setMessage(message);
        return resultData;
    }

    public static <T> ResultData<T> fail(int code, String message, T data) {
        ResultData<T> resultData = fail(code, message);
        resultData.setData(data);
        return resultData;
    }
}
