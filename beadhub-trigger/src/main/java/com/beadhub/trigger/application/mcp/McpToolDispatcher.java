package com.beadhub.trigger.application.mcp;

import com.beadhub.api.dto.EscalationCreateRequestDTO;
import com.beadhub.api.dto.HeartbeatRequestDTO;
import com.beadhub.api.dto.SubscriptionCreateRequestDTO;
import com.beadhub.api.dto.WorkspaceDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.presence.model.valobj.PresenceFilter;
import com.beadhub.domain.presence.model.valobj.PresenceRecord;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.trigger.application.command.EscalationCommandService;
import com.beadhub.trigger.application.command.SubscriptionCommandService;
import com.beadhub.trigger.application.command.WorkspaceCommandService;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.trigger.application.query.BeadIssueQueryService;
import com.beadhub.trigger.application.query.EscalationQueryService;
import com.beadhub.trigger.application.query.StatusQueryService;
import com.beadhub.trigger.application.query.SubscriptionQueryService;
import com.beadhub.trigger.application.query.WorkspaceQueryService;
import com.beadhub.types.enums.ResponseCode;
import com.beadhub.types.exception.AppException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * JSON-RPC 2.0 工具入口：tools/call 按工具名分发到既有读写用例，结果以 text 内容块返回。
 * <p>
 * 业务异常的错误码取其 HTTP 状态码，其余异常统一为 -32000。
 * </p>
 */
@Slf4j
@Service
public class McpToolDispatcher {

    static final String JSONRPC_VERSION = "2.0";
    static final String METHOD_TOOLS_CALL = "tools/call";
    static final int INVALID_REQUEST = -32600;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int INTERNAL_ERROR = -32000;

    private final ObjectMapper objectMapper;
    private final WorkspaceGuard workspaceGuard;
    private final WorkspaceCommandService workspaceCommandService;
    private final WorkspaceQueryService workspaceQueryService;
    private final StatusQueryService statusQueryService;
    private final BeadIssueQueryService beadIssueQueryService;
    private final SubscriptionCommandService subscriptionCommandService;
    private final SubscriptionQueryService subscriptionQueryService;
    private final EscalationCommandService escalationCommandService;
    private final EscalationQueryService escalationQueryService;
    private final CoordinationViewAssembler assembler;
    private final Map<String, BiFunction<AuthIdentity, Map<String, Object>, Object>> tools;

    public McpToolDispatcher(ObjectMapper objectMapper,
                             WorkspaceGuard workspaceGuard,
                             WorkspaceCommandService workspaceCommandService,
                             WorkspaceQueryService workspaceQueryService,
                             StatusQueryService statusQueryService,
                             BeadIssueQueryService beadIssueQueryService,
                             SubscriptionCommandService subscriptionCommandService,
                             SubscriptionQueryService subscriptionQueryService,
                             EscalationCommandService escalationCommandService,
                             EscalationQueryService escalationQueryService,
                             CoordinationViewAssembler assembler) {
        this.objectMapper = objectMapper;
        this.workspaceGuard = workspaceGuard;
        this.workspaceCommandService = workspaceCommandService;
        this.workspaceQueryService = workspaceQueryService;
        this.statusQueryService = statusQueryService;
        this.beadIssueQueryService = beadIssueQueryService;
        this.subscriptionCommandService = subscriptionCommandService;
        this.subscriptionQueryService = subscriptionQueryService;
        this.escalationCommandService = escalationCommandService;
        this.escalationQueryService = escalationQueryService;
        this.assembler = assembler;
        this.tools = ImmutableMap.<String, BiFunction<AuthIdentity, Map<String, Object>, Object>>builder()
                .put("register_agent", this::registerAgent)
                .put("list_agents", this::listAgents)
                .put("status", this::status)
                .put("get_ready_issues", this::getReadyIssues)
                .put("get_issue", this::getIssue)
                .put("subscribe_to_bead", this::subscribeToBead)
                .put("list_subscriptions", this::listSubscriptions)
                .put("unsubscribe", this::unsubscribe)
                .put("escalate", this::escalate)
                .put("get_escalation", this::getEscalation)
                .build();
    }

    public Map<String, Object> handle(AuthIdentity identity, Map<String, Object> request) {
        Object rpcId = request == null ? null : request.get("id");
        if (request == null || !JSONRPC_VERSION.equals(request.get("jsonrpc"))) {
            return error(rpcId, INVALID_REQUEST, "Invalid jsonrpc version");
        }
        if (!METHOD_TOOLS_CALL.equals(request.get("method"))) {
            return error(rpcId, METHOD_NOT_FOUND, "Method not found");
        }
        Object params = request.get("params");
        if (params != null && !(params instanceof Map)) {
            return error(rpcId, INVALID_PARAMS, "params must be an object");
        }
        Map<?, ?> paramMap = params == null ? Map.of() : (Map<?, ?>) params;
        if (!(paramMap.get("name") instanceof String name)) {
            return error(rpcId, INVALID_PARAMS, "Invalid params: name is required");
        }
        Object rawArguments = paramMap.get("arguments");
        if (rawArguments != null && !(rawArguments instanceof Map)) {
            return error(rpcId, INVALID_PARAMS, "Invalid params: arguments must be an object");
        }
        BiFunction<AuthIdentity, Map<String, Object>, Object> tool = tools.get(name);
        if (tool == null) {
            return error(rpcId, METHOD_NOT_FOUND, "Unknown tool: " + name);
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (rawArguments != null) {
            ((Map<?, ?>) rawArguments).forEach((key, value) -> arguments.put(String.valueOf(key), value));
        }

        try {
            return result(rpcId, tool.apply(identity, arguments));
        } catch (AppException ex) {
            ResponseCode responseCode = ResponseCode.fromCode(ex.getCode());
            log.warn("MCP tool failed. tool={}, code={}, error={}", name, ex.getCode(), ex.getInfo());
            return error(rpcId, responseCode.getHttpStatus(),
                    StringUtils.defaultIfBlank(ex.getInfo(), responseCode.getInfo()));
        } catch (RuntimeException ex) {
            log.error("MCP tool crashed. tool={}", name, ex);
            return error(rpcId, INTERNAL_ERROR, "Internal error");
        }
    }

    private Object registerAgent(AuthIdentity identity, Map<String, Object> args) {
        String workspaceId = getString(args, "workspace_id");
        String alias = getString(args, "alias");
        if (workspaceId == null || alias == null) {
            throw AppException.illegalParameter("workspace_id and alias are required");
        }
        HeartbeatRequestDTO heartbeat = new HeartbeatRequestDTO();
        heartbeat.setWorkspaceId(workspaceId);
        heartbeat.setBranch(getString(args, "branch"));
        PresenceRecord record = workspaceCommandService.heartbeat(identity, heartbeat);
        if (!alias.equals(record.getAlias())) {
            log.info("register_agent alias differs from workspace alias. workspaceId={}, requested={}, actual={}",
                    workspaceId, alias, record.getAlias());
        }
        return Map.of("ok", Boolean.TRUE, "alias", record.getAlias());
    }

    private Object listAgents(AuthIdentity identity, Map<String, Object> args) {
        WorkspaceEntity workspace = requireWorkspace(identity, args);
        List<WorkspaceDTO> agents = new ArrayList<>();
        for (PresenceRecord record : workspaceQueryService.lookupOnline(PresenceFilter.builder()
                .projectId(workspace.getProjectId())
                .build())) {
            agents.add(assembler.toWorkspaceDTO(record, identity.isPublicReader()));
        }
        return Map.of("agents", agents);
    }

    private Object status(AuthIdentity identity, Map<String, Object> args) {
        WorkspaceEntity workspace = requireWorkspace(identity, args);
        return statusQueryService.status(identity, workspace.getWorkspaceId(), null);
    }

    private Object getReadyIssues(AuthIdentity identity, Map<String, Object> args) {
        Integer limit = null;
        Object rawLimit = args.get("limit");
        if (rawLimit instanceof Integer number) {
            limit = number;
        } else if (rawLimit != null) {
            limit = Ints.tryParse(String.valueOf(rawLimit).trim());
            if (limit == null) {
                throw AppException.illegalParameter("limit must be an integer");
            }
        }
        return beadIssueQueryService.ready(identity, getString(args, "workspace_id"), getString(args, "repo"),
                getString(args, "branch"), limit);
    }

    private Object getIssue(AuthIdentity identity, Map<String, Object> args) {
        return beadIssueQueryService.get(identity, getString(args, "bead_id"));
    }

    private Object subscribeToBead(AuthIdentity identity, Map<String, Object> args) {
        String workspaceId = getString(args, "workspace_id");
        String beadId = getString(args, "bead_id");
        if (workspaceId == null || beadId == null) {
            throw AppException.illegalParameter("workspace_id and bead_id are required");
        }
        SubscriptionCreateRequestDTO request = new SubscriptionCreateRequestDTO();
        request.setWorkspaceId(workspaceId);
        request.setBeadId(beadId);
        request.setRepo(getString(args, "repo"));
        if (args.get("event_types") instanceof List<?> eventTypes) {
            request.setEventTypes(eventTypes.stream().map(String::valueOf).toList());
        }
        return assembler.toSubscriptionDTO(subscriptionCommandService.subscribe(identity, request));
    }

    private Object listSubscriptions(AuthIdentity identity, Map<String, Object> args) {
        WorkspaceEntity workspace = requireWorkspace(identity, args);
        return subscriptionQueryService.list(identity, workspace.getWorkspaceId());
    }

    private Object unsubscribe(AuthIdentity identity, Map<String, Object> args) {
        String workspaceId = getString(args, "workspace_id");
        String subscriptionId = getString(args, "subscription_id");
        if (workspaceId == null || subscriptionId == null) {
            throw AppException.illegalParameter("workspace_id and subscription_id are required");
        }
        subscriptionCommandService.unsubscribe(identity, workspaceId, subscriptionId);
        return Map.of("subscription_id", subscriptionId, "removed", Boolean.TRUE);
    }

    private Object escalate(AuthIdentity identity, Map<String, Object> args) {
        EscalationCreateRequestDTO request;
        try {
            request = objectMapper.convertValue(args, EscalationCreateRequestDTO.class);
        } catch (IllegalArgumentException ex) {
            throw AppException.illegalParameter("Invalid escalation arguments");
        }
        return assembler.toEscalationDTO(escalationCommandService.create(identity, request), false);
    }

    private Object getEscalation(AuthIdentity identity, Map<String, Object> args) {
        String escalationId = getString(args, "escalation_id");
        if (escalationId == null) {
            throw AppException.illegalParameter("escalation_id is required");
        }
        return escalationQueryService.get(identity, escalationId);
    }

    private WorkspaceEntity requireWorkspace(AuthIdentity identity, Map<String, Object> args) {
        String workspaceId = getString(args, "workspace_id");
        if (workspaceId == null) {
            throw AppException.illegalParameter("workspace_id is required");
        }
        return workspaceGuard.requireLiveWorkspace(identity.getProjectId(), workspaceId);
    }

    private String getString(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value == null ? null : StringUtils.trimToNull(String.valueOf(value));
    }

    private Map<String, Object> result(Object rpcId, Object payload) {
        String text;
        try {
            text = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize tool result", ex);
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("type", "text");
        content.put("text", text);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.put("id", rpcId);
        response.put("result", Map.of("content", List.of(content)));
        return response;
    }

    private Map<String, Object> error(Object rpcId, int code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.put("id", rpcId);
        response.put("error", error);
        return response;
    }
}
