package com.beadhub.test;

import com.beadhub.api.dto.PolicyDTO;
import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.auth.service.TrustBoundaryDomainService;
import com.beadhub.domain.policy.model.entity.PolicyEntity;
import com.beadhub.domain.policy.model.valobj.PolicyBundle;
import com.beadhub.domain.policy.model.valobj.PolicyInvariant;
import com.beadhub.trigger.application.command.PolicyCommandService;
import com.beadhub.trigger.application.common.CoordinationViewAssembler;
import com.beadhub.trigger.application.common.WorkspaceGuard;
import com.beadhub.trigger.application.query.PolicyQueryService;
import com.beadhub.trigger.http.GlobalApiExceptionHandler;
import com.beadhub.trigger.http.PolicyController;
import com.beadhub.types.enums.PrincipalKindEnum;
import com.beadhub.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class PolicyControllerTest {

    private MockMvc mockMvc;
    private PolicyQueryService policyQueryService;
    private PolicyCommandService policyCommandService;
    private TrustBoundaryDomainService trustBoundaryDomainService;
    private WorkspaceGuard workspaceGuard;

    @BeforeEach
    public void setUp() {
        policyQueryService = mock(PolicyQueryService.class);
        policyCommandService = mock(PolicyCommandService.class);
        trustBoundaryDomainService = mock(TrustBoundaryDomainService.class);
        workspaceGuard = mock(WorkspaceGuard.class);
        PolicyController controller = new PolicyController(policyQueryService, policyCommandService,
                trustBoundaryDomainService, workspaceGuard, new CoordinationViewAssembler());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldReturnActivePolicyWithEtag() throws Exception {
        when(policyQueryService.getActive("p-1", null, false)).thenReturn(activeDTO("pol-2", 2));

        mockMvc.perform(get("/v1/policies/active").requestAttr(AuthIdentity.REQUEST_ATTRIBUTE, agent()))
                .andExpect(status().isOk())
                .andExpect(header().string("ETag", "\"pol-2\""))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.policy_id").value("pol-2"))
                .andExpect(jsonPath("$.data.version").value(2));
    }

    @Test
    public void shouldAnswerNotModifiedForMatchingEtag() throws Exception {
        when(policyQueryService.getActive("p-1", "developer", true)).thenReturn(activeDTO("pol-2", 2));

        mockMvc.perform(get("/v1/policies/active")
                        .param("role", "developer")
                        .param("only_selected", "true")
                        .header("If-None-Match", "W/\"pol-1\", \"pol-2\"")
                        .requestAttr(AuthIdentity.REQUEST_ATTRIBUTE, agent()))
                .andExpect(status().isNotModified())
                .andExpect(header().string("ETag", "\"pol-2\""));
    }

    @Test
    public void shouldCreateAndActivateNewVersion() throws Exception {
        PolicyEntity created = policy("pol-3", 3);
        when(policyCommandService.create(eq("p-1"), any(PolicyBundle.class), eq("pol-2"), eq(true), isNull()))
                .thenReturn(created);

        mockMvc.perform(post("/v1/policies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bundle\":{\"invariants\":[{\"id\":\"x\",\"title\":\"X\",\"body_md\":\"b\"}],"
                                + "\"roles\":{}},\"base_policy_id\":\"pol-2\"}")
                        .requestAttr(AuthIdentity.REQUEST_ATTRIBUTE, agent()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.policy_id").value("pol-3"))
                .andExpect(jsonPath("$.data.is_active").value(true))
                .andExpect(jsonPath("$.data.bundle.invariants[0].id").value("x"));

        verify(trustBoundaryDomainService).ensureWritable(any(AuthIdentity.class));
    }

    @Test
    public void shouldReportStaleBaseAsConflict() throws Exception {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("base_policy_id", "pol-1");
        detail.put("active_policy_id", "pol-2");
        detail.put("active_version", 2);
        when(policyCommandService.create(eq("p-1"), any(PolicyBundle.class), eq("pol-1"), anyBoolean(), isNull()))
                .thenThrow(AppException.conflict("Active policy has changed since base_policy_id", detail));

        mockMvc.perform(post("/v1/policies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bundle\":{\"invariants\":[]},\"base_policy_id\":\"pol-1\"}")
                        .requestAttr(AuthIdentity.REQUEST_ATTRIBUTE, agent()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("0006"))
                .andExpect(jsonPath("$.data.active_policy_id").value("pol-2"))
                .andExpect(jsonPath("$.data.active_version").value(2));
    }

    @Test
    public void shouldRequireBundle() throws Exception {
        mockMvc.perform(post("/v1/policies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"activate\":true}")
                        .requestAttr(AuthIdentity.REQUEST_ATTRIBUTE, agent()))
                .andExpect(status().isUnprocessableEntity());

        verify(policyCommandService, never()).create(any(), any(), any(), anyBoolean(), any());
    }

    @Test
    public void shouldRejectResetFromPublicReader() throws Exception {
        AuthIdentity reader = AuthIdentity.builder()
                .projectId("p-1")
                .principalKind(PrincipalKindEnum.PUBLIC_READER)
                .build();
        doThrow(AppException.forbidden("Public readers cannot modify project state"))
                .when(trustBoundaryDomainService).ensureWritable(reader);

        mockMvc.perform(post("/v1/policies/reset").requestAttr(AuthIdentity.REQUEST_ATTRIBUTE, reader))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("0004"));

        verify(policyCommandService, never()).resetToDefaults(any(), any(), any());
    }

    private PolicyDTO activeDTO(String policyId, int version) {
        PolicyDTO dto = new PolicyDTO();
        dto.setPolicyId(policyId);
        dto.setProjectId("p-1");
        dto.setVersion(version);
        dto.setIsActive(true);
        return dto;
    }

    private PolicyEntity policy(String policyId, int version) {
        PolicyBundle bundle = new PolicyBundle();
        bundle.getInvariants().add(new PolicyInvariant("x", "X", "b"));
        PolicyEntity entity = new PolicyEntity();
        entity.setPolicyId(policyId);
        entity.setProjectId("p-1");
        entity.setVersion(version);
        entity.setBundle(bundle);
        entity.setCreatedAt(LocalDateTime.now());
        return entity;
    }

    private AuthIdentity agent() {
        return AuthIdentity.builder()
                .projectId("p-1")
                .actorId("ws-1")
                .principalKind(PrincipalKindEnum.API_KEY)
                .principalId("key-1")
                .build();
    }
}
