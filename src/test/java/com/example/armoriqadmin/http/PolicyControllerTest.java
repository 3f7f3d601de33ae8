package com.example.armoriqadmin.http;

import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.armoriqadmin.models.PermissionState;
import com.example.armoriqadmin.requests.PolicyCreateHttpRequest;
import com.example.armoriqadmin.requests.PolicyUpdateHttpRequest;
import com.example.armoriqadmin.service.ProxyGateway;
import com.example.armoriqadmin.service.ProxyRequest;
import com.example.armoriqadmin.service.ProxyRoute;
import com.example.armoriqadmin.service.UpstreamException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = PolicyController.class)
@Import(RequestIdFilter.class)
class PolicyControllerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProxyGateway gateway;

    @Test
    @DisplayName("GET policies returns the proxy's list")
    void listPolicies() throws Exception {
        when(gateway.forward(ProxyRequest.of(ProxyRoute.LIST_POLICIES)))
                .thenReturn(Optional.of(MAPPER.readTree("{\"policies\":[{\"agentId\":\"a1\"}]}")));

        mockMvc.perform(MockMvcRequestBuilders.get("/policies"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.header().exists("X-Request-Id"))
                .andExpect(MockMvcResultMatchers.jsonPath("$.policies[0].agentId", equalTo("a1")));
    }

    @Test
    @DisplayName("GET policy forwards the agent id from the path")
    void getPolicy() throws Exception {
        when(gateway.forward(ProxyRequest.forAgent(ProxyRoute.GET_POLICY, "a1")))
                .thenReturn(Optional.of(MAPPER.readTree("{\"agentId\":\"a1\",\"endpointId\":\"e1\"}")));

        mockMvc.perform(MockMvcRequestBuilders.get("/policies/a1"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.endpointId", equalTo("e1")));
    }

    @Test
    @DisplayName("GET policy relays the proxy's 404 and error body")
    void getPolicyNotFound() throws Exception {
        when(gateway.forward(ProxyRequest.forAgent(ProxyRoute.GET_POLICY, "ghost")))
                .thenThrow(UpstreamException.unexpectedStatus(ProxyRoute.GET_POLICY, 404,
                        MAPPER.readTree("{\"error\":\"not found\"}")));

        mockMvc.perform(MockMvcRequestBuilders.get("/policies/ghost"))
                .andExpect(MockMvcResultMatchers.status().isNotFound())
                .andExpect(MockMvcResultMatchers.content().json("{\"error\":\"not found\"}", true));
    }

    @Test
    @DisplayName("POST policy answers 201 and forwards the payload")
    void createPolicy() throws Exception {
        when(gateway.forward(any())).thenReturn(Optional.of(MAPPER.readTree("{\"agentId\":\"a1\"}")));

        mockMvc.perform(MockMvcRequestBuilders.post("/policies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agentId\":\"a1\",\"endpointId\":\"e1\",\"permissions\":{\"read\":true}}"))
                .andExpect(MockMvcResultMatchers.status().isCreated())
                .andExpect(MockMvcResultMatchers.jsonPath("$.agentId", equalTo("a1")));

        ArgumentCaptor<ProxyRequest> captor = ArgumentCaptor.forClass(ProxyRequest.class);
        verify(gateway).forward(captor.capture());
        ProxyRequest forwarded = captor.getValue();
        assertEquals(ProxyRoute.CREATE_POLICY, forwarded.route());
        PolicyCreateHttpRequest body = assertInstanceOf(PolicyCreateHttpRequest.class, forwarded.body());
        assertEquals("e1", body.endpointId());
        assertEquals(PermissionState.GRANTED, body.permissions().read());
        assertEquals(PermissionState.UNSET, body.permissions().delete());
    }

    @Test
    @DisplayName("POST policy with a blank agent id is rejected without calling the proxy")
    void createPolicyBlankAgent() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/policies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agentId\":\" \",\"endpointId\":\"e1\"}"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("BAD_REQUEST")));

        verify(gateway, never()).forward(any());
    }

    @Test
    @DisplayName("GET policy with a blank agent id is rejected without calling the proxy")
    void getPolicyBlankAgent() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/policies/{agentId}", " "))
                .andExpect(MockMvcResultMatchers.status().isBadRequest())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("BAD_REQUEST")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.message", equalTo("agentId must be non-blank")));

        verify(gateway, never()).forward(any());
    }

    @Test
    @DisplayName("server-side argument errors are internal errors, not bad requests")
    void serverSideArgumentError() throws Exception {
        when(gateway.forward(any())).thenThrow(new IllegalArgumentException("URI is not absolute"));

        mockMvc.perform(MockMvcRequestBuilders.get("/policies"))
                .andExpect(MockMvcResultMatchers.status().isInternalServerError())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("INTERNAL_ERROR")));
    }

    @Test
    @DisplayName("POST policy with malformed JSON is a bad request")
    void createPolicyMalformed() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/policies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agentId\":"))
                .andExpect(MockMvcResultMatchers.status().isBadRequest());

        verify(gateway, never()).forward(any());
    }

    @Test
    @DisplayName("PUT policy forwards permissions for the addressed agent")
    void updatePolicy() throws Exception {
        when(gateway.forward(any())).thenReturn(Optional.of(MAPPER.readTree("{\"agentId\":\"a1\"}")));

        mockMvc.perform(MockMvcRequestBuilders.put("/policies/a1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"permissions\":{\"update\":false}}"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.agentId", equalTo("a1")));

        ArgumentCaptor<ProxyRequest> captor = ArgumentCaptor.forClass(ProxyRequest.class);
        verify(gateway).forward(captor.capture());
        ProxyRequest forwarded = captor.getValue();
        assertEquals(ProxyRoute.UPDATE_POLICY, forwarded.route());
        assertEquals(Map.of("agentId", "a1"), forwarded.pathVariables());
        PolicyUpdateHttpRequest body = assertInstanceOf(PolicyUpdateHttpRequest.class, forwarded.body());
        assertEquals(PermissionState.DENIED, body.permissions().update());
    }

    @Test
    @DisplayName("DELETE policy answers 204 with no body")
    void deletePolicy() throws Exception {
        when(gateway.forward(ProxyRequest.forAgent(ProxyRoute.DELETE_POLICY, "a1"))).thenReturn(Optional.empty());

        mockMvc.perform(MockMvcRequestBuilders.delete("/policies/a1"))
                .andExpect(MockMvcResultMatchers.status().isNoContent())
                .andExpect(MockMvcResultMatchers.content().string(""));

        verify(gateway).forward(ProxyRequest.forAgent(ProxyRoute.DELETE_POLICY, "a1"));
    }

    @Test
    @DisplayName("proxy timeout surfaces as 504")
    void deletePolicyTimeout() throws Exception {
        when(gateway.forward(ProxyRequest.forAgent(ProxyRoute.DELETE_POLICY, "a1")))
                .thenThrow(UpstreamException.timeout(ProxyRoute.DELETE_POLICY,
                        new SocketTimeoutException("Read timed out")));

        mockMvc.perform(MockMvcRequestBuilders.delete("/policies/a1"))
                .andExpect(MockMvcResultMatchers.status().isGatewayTimeout())
                .andExpect(MockMvcResultMatchers.jsonPath("$.error", equalTo("Proxy request timed out")));
    }
}
