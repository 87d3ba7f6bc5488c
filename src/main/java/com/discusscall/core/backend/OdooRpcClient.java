package com.discusscall.core.backend;

import com.discusscall.core.config.CallProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Odoo JSON-RPC 客户端：POST {url}/jsonrpc，service/method/args 形式调用。
 * 先 common.login 拿 uid，之后所有模型调用都走 object.execute_kw。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OdooRpcClient {

    private final RestTemplate odooRestTemplate;
    private final CallProperties properties;

    private final AtomicLong requestIds = new AtomicLong();
    private volatile Long uid;

    public JsonNode call(String service, String method, List<Object> args) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("service", service);
        params.put("method", method);
        params.put("args", args);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("method", "call");
        request.put("params", params);
        request.put("id", requestIds.incrementAndGet());

        String url = endpoint();
        JsonNode response;
        try {
            response = odooRestTemplate.postForObject(url, request, JsonNode.class);
        } catch (RestClientException e) {
            throw new OdooRpcException("RPC transport error: " + service + "." + method, e);
        }
        if (response == null) {
            throw new OdooRpcException("Empty RPC response: " + service + "." + method);
        }
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new OdooRpcException(errorMessage(error));
        }
        return response.path("result");
    }

    /** 登录一次后缓存 uid */
    public long uid() {
        Long current = uid;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (uid == null) {
                CallProperties.Backend b = properties.getBackend();
                JsonNode result = call("common", "login", Arrays.asList(b.getDatabase(), b.getLogin(), b.getPassword()));
                if (!result.isIntegralNumber()) {
                    throw new OdooRpcException("Authentication failed for login " + b.getLogin());
                }
                uid = result.asLong();
                log.info("Authenticated against {} as uid={}", b.getUrl(), uid);
            }
            return uid;
        }
    }

    public JsonNode executeKw(String model, String method, List<?> args, Map<String, ?> kwargs) {
        CallProperties.Backend b = properties.getBackend();
        List<Object> rpcArgs = new ArrayList<>();
        rpcArgs.add(b.getDatabase());
        rpcArgs.add(uid());
        rpcArgs.add(b.getPassword());
        rpcArgs.add(model);
        rpcArgs.add(method);
        rpcArgs.add(args);
        rpcArgs.add(kwargs == null ? Map.of() : kwargs);
        log.debug("execute_kw {}.{}", model, method);
        return call("object", "execute_kw", rpcArgs);
    }

    /** 会话失效时调用，下一次请求重新登录 */
    public void resetSession() {
        uid = null;
    }

    private String endpoint() {
        String base = properties.getBackend().getUrl();
        return base.endsWith("/") ? base + "jsonrpc" : base + "/jsonrpc";
    }

    private String errorMessage(JsonNode error) {
        JsonNode dataMessage = error.path("data").path("message");
        if (dataMessage.isTextual() && !dataMessage.asText().isBlank()) {
            return dataMessage.asText();
        }
        return error.path("message").asText("Unknown RPC error");
    }
}
