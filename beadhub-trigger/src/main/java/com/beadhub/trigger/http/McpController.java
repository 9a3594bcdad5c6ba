package com.beadhub.trigger.http;

import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.trigger.application.mcp.McpToolDispatcher;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 智能体工具调用入口。响应体是 JSON-RPC 信封而非统一 Response，工具错误也以 200 返回。
 */
@RestController
@RequestMapping("/v1/mcp")
public class McpController {

    private final McpToolDispatcher mcpToolDispatcher;

    public McpController(McpToolDispatcher mcpToolDispatcher) {
        this.mcpToolDispatcher = mcpToolDispatcher;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> call(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                                    @RequestBody Map<String, Object> request) {
        return mcpToolDispatcher.handle(identity, request);
    }
}
