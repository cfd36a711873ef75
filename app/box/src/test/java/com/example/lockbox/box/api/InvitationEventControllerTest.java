package com.example.lockbox.box.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.lockbox.box.service.InvitationBatchResult;
import com.example.lockbox.box.service.InvitationEventHandler;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(InvitationEventController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class InvitationEventControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private InvitationEventHandler invitationEventHandler;

  @Test
  @SuppressWarnings("unchecked")
  void batchIsDelegatedToHandler() throws Exception {
    when(invitationEventHandler.handleBatch(anyList()))
        .thenReturn(new InvitationBatchResult(1, 0, 1, 0));

    mockMvc
        .perform(
            post("/internal/invitation-events:batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    [
                      {"eventType":"invitation_viewed","boxId":"box-1","invitationId":"inv-1","userId":"user-1"},
                      {"eventType":"invitation_viewed"}
                    ]
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.applied").value(1))
        .andExpect(jsonPath("$.skipped").value(1));

    final ArgumentCaptor<List<JsonNode>> captor = ArgumentCaptor.forClass(List.class);
    verify(invitationEventHandler).handleBatch(captor.capture());
    assertThat(captor.getValue()).hasSize(2);
    assertThat(captor.getValue().get(0).path("boxId").asText()).isEqualTo("box-1");
  }

  @Test
  void malformedBodyIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/internal/invitation-events:batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is invalid"));
  }
}
