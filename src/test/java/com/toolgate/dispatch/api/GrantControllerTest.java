package com.toolgate.dispatch.api;

import com.toolgate.core.permission.GrantKind;
import com.toolgate.core.permission.GrantStatus;
import com.toolgate.core.permission.PermissionTracker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(GrantController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class GrantControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PermissionTracker tracker;

    @Test
    @DisplayName("GET /grants lists active grants")
    void list() throws Exception {
        when(tracker.activeGrantStatuses()).thenReturn(List.of(
                new GrantStatus("bash", GrantKind.ITERATIONS, 0, 3),
                new GrantStatus("edit_file", GrantKind.TIME, 240, 0)));

        mockMvc.perform(get("/api/v1/grants"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].toolName").value("bash"))
                .andExpect(jsonPath("$[0].remainingUses").value(3))
                .andExpect(jsonPath("$[1].kind").value("TIME"))
                .andExpect(jsonPath("$[1].remainingSeconds").value(240));
    }

    @Test
    @DisplayName("DELETE /grants/{tool} revokes the grant")
    void revoke() throws Exception {
        when(tracker.remaining("bash")).thenReturn(Optional.of(new GrantStatus("bash", GrantKind.ITERATIONS, 0, 2)));

        mockMvc.perform(delete("/api/v1/grants/bash"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revoked").value(true));

        verify(tracker).revoke("bash");
    }
}
