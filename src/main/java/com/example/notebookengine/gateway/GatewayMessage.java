package com.example.notebookengine.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 2.0 shaped frame exchanged over the progress WebSocket.
 * Server pushes are notifications (no id); the only client request is "heartbeat".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayMessage {

    @Builder.Default
    private String jsonrpc = "2.0";
    private String id;
    private String method;
    private Object params;
    private Object result;
    private GatewayError error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GatewayError {
        private int code;
        private String message;
    }

    public static GatewayMessage success(String id, Object result) {
        return GatewayMessage.builder().id(id).result(result).build();
    }

    public static GatewayMessage error(String id, int code, String message) {
        return GatewayMessage.builder()
                .id(id)
                .error(GatewayError.builder().code(code).message(message).build())
                .build();
    }

    public static GatewayMessage notification(String method, Object params) {
        return GatewayMessage.builder().method(method).params(params).build();
    }
}
