package com.beadhub.test.integration;

import com.beadhub.Application;
import com.beadhub.domain.project.adapter.repository.IWorkspaceRepository;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
        classes = Application.class,
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "spring.task.scheduling.enabled=false",
                "beadhub.observability.http-log.enabled=false"
        }
)
@AutoConfigureMockMvc
@EnabledIfSystemProperty(named = "it.docker.enabled", matches = "true")
public class CoordinationFlowIntegrationTest extends BeadhubIntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private IWorkspaceRepository workspaceRepository;

    @Test
    public void shouldInitSyncAndArbitrateClaimsEndToEnd() throws Exception {
        JsonNode alice = init("alice-dev", "Alice");
        JsonNode bob = init("bob-dev", "Bob");
        Assertions.assertEquals(alice.path("project_id").asText(), bob.path("project_id").asText());
        Assertions.assertEquals(alice.path("repo_id").asText(), bob.path("repo_id").asText());

        mockMvc.perform(post("/v1/bdh/sync")
                        .header("Authorization", "Bearer " + alice.path("api_key").asText())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "workspace_id", alice.path("workspace_id").asText(),
                                "issues_jsonl", "{\"id\":\"bd-1\",\"title\":\"Login\",\"status\":\"in_progress\"}"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.issues_added").value(1))
                .andExpect(jsonPath("$.data.claims[0].action").value("claimed"));

        mockMvc.perform(post("/v1/bdh/sync")
                        .header("Authorization", "Bearer " + bob.path("api_key").asText())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "workspace_id", bob.path("workspace_id").asText(),
                                "issues_jsonl", "{\"id\":\"bd-1\",\"title\":\"Login\",\"status\":\"in_progress\"}"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.claims[0].action").value("rejected"))
                .andExpect(jsonPath("$.data.claims[0].held_by").value("alice-dev"));

        mockMvc.perform(get("/v1/claims")
                        .header("Authorization", "Bearer " + bob.path("api_key").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.claims.length()").value(1))
                .andExpect(jsonPath("$.data.claims[0].alias").value("alice-dev"));

        mockMvc.perform(get("/v1/policies/active")
                        .header("Authorization", "Bearer " + alice.path("api_key").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.version").value(1))
                .andExpect(jsonPath("$.data.policy_id").value(alice.path("policy_id").asText()));
    }

    @Test
    public void shouldRejectSyncForAnotherWorkspace() throws Exception {
        JsonNode alice = init("alice-dev", "Alice");
        JsonNode bob = init("bob-dev", "Bob");

        mockMvc.perform(post("/v1/bdh/sync")
                        .header("Authorization", "Bearer " + alice.path("api_key").asText())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "workspace_id", bob.path("workspace_id").asText(),
                                "issues_jsonl", ""))))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/v1/claims"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    public void shouldGrantConcurrentClaimToExactlyOneWorkspace() throws Exception {
        JsonNode alice = init("alice-dev", "Alice");
        JsonNode bob = init("bob-dev", "Bob");
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (JsonNode agent : List.of(alice, bob)) {
                Callable<String> task = () -> {
                    start.await();
                    MvcResult result = mockMvc.perform(post("/v1/bdh/sync")
                                    .header("Authorization", "Bearer " + agent.path("api_key").asText())
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content(objectMapper.writeValueAsString(Map.of(
                                            "workspace_id", agent.path("workspace_id").asText(),
                                            "issues_jsonl", "{\"id\":\"bd-7\",\"title\":\"Race\",\"status\":\"in_progress\"}"))))
                            .andReturn();
                    Assertions.assertEquals(200, result.getResponse().getStatus(), result.getResponse().getContentAsString());
                    return objectMapper.readTree(result.getResponse().getContentAsString())
                            .path("data").path("claims").path(0).path("action").asText();
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            List<String> actions = new ArrayList<>();
            for (Future<String> future : futures) {
                actions.add(future.get(10, TimeUnit.SECONDS));
            }
            Assertions.assertEquals(1, actions.stream().filter("claimed"::equals).count(), "并发认领只能有一个成功: " + actions);
            Assertions.assertEquals(1, actions.stream().filter("rejected"::equals).count(), "另一方应被拒绝: " + actions);
        } finally {
            executor.shutdownNow();
        }
        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM server.bead_claims WHERE bead_id = 'bd-7'", Integer.class);
        Assertions.assertEquals(1, rows, "认领表中只允许一行");
    }

    @Test
    public void shouldRejectPolicyWriteAgainstStaleBase() throws Exception {
        JsonNode alice = init("alice-dev", "Alice");
        String staleBase = alice.path("policy_id").asText();

        MvcResult reset = mockMvc.perform(post("/v1/policies/reset")
                        .header("Authorization", "Bearer " + alice.path("api_key").asText())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("base_policy_id", staleBase))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.version").value(2))
                .andReturn();
        String activeId = objectMapper.readTree(reset.getResponse().getContentAsString())
                .path("data").path("policy_id").asText();

        mockMvc.perform(post("/v1/policies/reset")
                        .header("Authorization", "Bearer " + alice.path("api_key").asText())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("base_policy_id", staleBase))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.data.active_policy_id").value(activeId))
                .andExpect(jsonPath("$.data.active_version").value(2));

        Integer versions = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM server.project_policies", Integer.class);
        Assertions.assertEquals(2, versions, "冲突的写入不能留下新版本");
    }

    @Test
    public void shouldCascadeRepoDeleteToWorkspacesClaimsAndPresence() throws Exception {
        JsonNode alice = init("alice-dev", "Alice");
        String workspaceId = alice.path("workspace_id").asText();
        String apiKey = alice.path("api_key").asText();
        mockMvc.perform(post("/v1/bdh/sync")
                        .header("Authorization", "Bearer " + apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "workspace_id", workspaceId,
                                "issues_jsonl", "{\"id\":\"bd-1\",\"title\":\"Login\",\"status\":\"in_progress\"}"))))
                .andExpect(status().isOk());
        mockMvc.perform(post("/v1/workspaces/heartbeat")
                        .header("Authorization", "Bearer " + apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("workspace_id", workspaceId))))
                .andExpect(status().isOk());
        Assertions.assertTrue(Boolean.TRUE.equals(redisTemplate.hasKey("presence:" + workspaceId)));

        mockMvc.perform(delete("/v1/repos/" + alice.path("repo_id").asText())
                        .header("Authorization", "Bearer " + apiKey))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.workspaces_deleted").value(1))
                .andExpect(jsonPath("$.data.claims_deleted").value(1))
                .andExpect(jsonPath("$.data.presence_cleared").value(1));

        Integer claims = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM server.bead_claims", Integer.class);
        Integer liveWorkspaces = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM server.workspaces WHERE deleted_at IS NULL", Integer.class);
        Integer liveRepos = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM server.repos WHERE deleted_at IS NULL", Integer.class);
        Assertions.assertEquals(0, claims);
        Assertions.assertEquals(0, liveWorkspaces);
        Assertions.assertEquals(0, liveRepos);
        Assertions.assertFalse(Boolean.TRUE.equals(redisTemplate.hasKey("presence:" + workspaceId)));
    }

    @Test
    public void shouldKeepWorkspaceOwnershipWhenUpsertCarriesOtherRepo() throws Exception {
        JsonNode alice = init("alice-dev", "Alice");
        String workspaceId = alice.path("workspace_id").asText();
        WorkspaceEntity workspace = workspaceRepository.findById(workspaceId);
        workspace.setRepoId("other-repo");
        workspace.setProjectId("other-project");
        workspace.setHostname("laptop-2");

        WorkspaceEntity saved = workspaceRepository.save(workspace);

        Assertions.assertEquals(alice.path("repo_id").asText(), saved.getRepoId(), "upsert 不能改写 repo_id");
        Assertions.assertEquals(alice.path("project_id").asText(), saved.getProjectId(), "upsert 不能改写 project_id");
        Assertions.assertEquals("laptop-2", saved.getHostname());
    }

    private JsonNode init(String alias, String humanName) throws Exception {
        MvcResult result = mockMvc.perform(post("/v1/init")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "project_slug", "acme",
                                "repo_origin", "git@github.com:acme/app.git",
                                "alias", alias,
                                "human_name", humanName,
                                "role", "developer"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("data");
    }
}
