package com.querydesk.portal.endpoint;

import com.querydesk.portal.dto.CreateFaqRequest;
import com.querydesk.portal.exception.GlobalExceptionHandler;
import com.querydesk.portal.exception.NotFoundException;
import com.querydesk.portal.exception.ValidationException;
import com.querydesk.portal.model.FaqEntry;
import com.querydesk.portal.service.FaqAggregatorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class AdminFaqControllerTest {

    private MockMvc mockMvc;

    @Mock
    private FaqAggregatorService faqAggregator;

    @InjectMocks
    private AdminFaqController adminFaqController;

    @BeforeEach
    public void setup() {
        mockMvc = MockMvcBuilders.standaloneSetup(adminFaqController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private FaqEntry faq(boolean active) {
        return FaqEntry.builder().id(3L).question("Exam dates?").questionKey("exam dates?")
                .answer("June").frequency(4).active(active).build();
    }

    @Test
    public void testAdminListIncludesInactive() throws Exception {
        Mockito.when(faqAggregator.listFaqs(null, false)).thenReturn(List.of(faq(false)));

        mockMvc.perform(get("/api/admin/faqs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].active").value(false));
    }

    @Test
    public void testCreateFaq() throws Exception {
        Mockito.when(faqAggregator.createFaq(any(CreateFaqRequest.class))).thenReturn(faq(true));

        mockMvc.perform(post("/api/admin/faqs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Exam dates?\",\"answer\":\"June\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id").value(3));
    }

    @Test
    public void testCreateDuplicateFaq() throws Exception {
        Mockito.when(faqAggregator.createFaq(any(CreateFaqRequest.class)))
                .thenThrow(new ValidationException("An FAQ with this question already exists"));

        mockMvc.perform(post("/api/admin/faqs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Exam dates?\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ValidationError"));
    }

    @Test
    public void testSetAnswer() throws Exception {
        Mockito.when(faqAggregator.setAnswer(3L, "June", "Exams")).thenReturn(faq(true));

        mockMvc.perform(put("/api/admin/faqs/3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"June\",\"category\":\"Exams\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.frequency").value(4));
    }

    @Test
    public void testToggleMissingFaq() throws Exception {
        Mockito.when(faqAggregator.toggleActive(8L)).thenThrow(new NotFoundException("FAQ not found: 8"));

        mockMvc.perform(post("/api/admin/faqs/8/toggle"))
                .andExpect(status().isNotFound());
    }
}
