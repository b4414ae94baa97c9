package com.toolgate.dispatch.api;

import com.toolgate.core.mode.ModeChange;
import com.toolgate.core.mode.ModeManager;
import com.toolgate.core.mode.OperatingMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModeController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ModeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ModeManager modeManager;

    @Test
    @DisplayName("GET /mode describes the current mode")
    void current() throws Exception {
        when(modeManager.currentMode()).thenReturn(OperatingMode.PLAN);

        mockMvc.perform(get("/api/v1/mode"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("PLAN"))
                .andExpect(jsonPath("$.read_only").value(true))
                .andExpect(jsonPath("$.auto_approve").value(false));
    }

    @Test
    @DisplayName("POST /mode/cycle returns the new and previous mode")
    void cycle() throws Exception {
        when(modeManager.cycleMode()).thenReturn(new ModeChange(OperatingMode.NORMAL, OperatingMode.AUTO));

        mockMvc.perform(post("/api/v1/mode/cycle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("AUTO"))
                .andExpect(jsonPath("$.previous").value("NORMAL"));
    }

    @Test
    @DisplayName("PUT /mode/{mode} accepts lower-case names")
    void set() throws Exception {
        when(modeManager.setMode(OperatingMode.ARCHITECT))
                .thenReturn(new ModeChange(OperatingMode.NORMAL, OperatingMode.ARCHITECT));

        mockMvc.perform(put("/api/v1/mode/architect"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("ARCHITECT"));
    }

    @Test
    @DisplayName("PUT /mode/{mode} with an unknown mode returns 400")
    void unknownMode() throws Exception {
        mockMvc.perform(put("/api/v1/mode/turbo"))
                .andExpect(status().isBadRequest());

        verify(modeManager, never()).setMode(any());
    }

    @Test
    @DisplayName("GET /mode/prompt returns the system prompt modifier")
    void prompt() throws Exception {
        when(modeManager.currentMode()).thenReturn(OperatingMode.YOLO);
        when(modeManager.systemPromptModifier()).thenReturn("<active_mode>YOLO</active_mode>");

        mockMvc.perform(get("/api/v1/mode/prompt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.system_prompt_modifier").value("<active_mode>YOLO</active_mode>"));
    }
}
