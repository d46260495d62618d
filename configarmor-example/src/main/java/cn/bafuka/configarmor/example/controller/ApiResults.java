package cn.bafuka.configarmor.example.controller;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * 统一的接口返回结构
 */
final class ApiResults {

    private ApiResults() {
    }

    static Map<String, Object> ok(Object data) {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("data", data);
        return result;
    }

    static Map<String, Object> message(String message) {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("message", message);
        return result;
    }

    static Map<String, Object> failure(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        Map<String, Object> result = new HashMap<>();
        result.put("success", false);
        result.put("error", cause.getClass().getSimpleName());
        result.put("message", cause.getMessage());
        return result;
    }
}
