package com.tgnote.backend.controller;

import com.tgnote.backend.config.SecurityConfig;
import com.tgnote.backend.config.WebCorsConfig;
import com.tgnote.backend.filter.TelegramAuthFilter;
import com.tgnote.backend.service.AttachmentService;
import com.tgnote.backend.service.NoteService;
import com.tgnote.backend.utils.TelegramInitDataVerifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(NoteController.class)
@Import({SecurityConfig.class, WebCorsConfig.class})
@TestPropertySource(properties = "application.config.auth.enforce=true")
class NoteControllerAuthTest {

    private static final String CREATE_BODY = "{\"userId\":1,\"title\":\"t\",\"content\":\"c\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private NoteService noteService;

    @MockBean
    private AttachmentService attachmentService;

    @MockBean
    private TelegramInitDataVerifier verifier;

    @Test
    void mutationWithoutInitDataIsRejected() throws Exception {
        when(verifier.verify(null)).thenReturn(Optional.empty());

        mockMvc.perform(post("/notes").contentType(MediaType.APPLICATION_JSON).content(CREATE_BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthorized"));
        verifyNoInteractions(noteService);
    }

    @Test
    void mutationWithValidInitDataPasses() throws Exception {
        when(verifier.verify("signed")).thenReturn(Optional.of(1L));

        mockMvc.perform(post("/notes")
                        .header(TelegramAuthFilter.INIT_DATA_HEADER, "signed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isOk());
    }

    @Test
    void readsStayOpen() throws Exception {
        when(noteService.list()).thenReturn(List.of());

        mockMvc.perform(get("/notes"))
                .andExpect(status().isOk());
        verifyNoInteractions(verifier);
    }
}
