package com.querydesk.portal.endpoint;

import com.querydesk.portal.dto.PageResult;
import com.querydesk.portal.dto.QueryFilter;
import com.querydesk.portal.dto.QueryUpdateRequest;
import com.querydesk.portal.dto.QueryUpdateResult;
import com.querydesk.portal.exception.GlobalExceptionHandler;
import com.querydesk.portal.exception.InvalidStatusException;
import com.querydesk.portal.exception.NotFoundException;
import com.querydesk.portal.model.FaqEntry;
import com.querydesk.portal.model.Query;
import com.querydesk.portal.model.QueryStatus;
import com.querydesk.portal.service.FaqAggregatorService;
import com.querydesk.portal.service.QueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class AdminQueryControllerTest {

    private MockMvc mockMvc;

    @Mock
    private QueryService queryService;

    @Mock
    private FaqAggregatorService faqAggregator;

    @InjectMocks
    private AdminQueryController adminQueryController;

    @BeforeEach
    public void setup() {
        mockMvc = MockMvcBuilders.standaloneSetup(adminQueryController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private Query query(QueryStatus status) {
        return Query.builder().id(1L).requesterName("Jo").requesterEmail("jo@x.com")
                .message("How to reset password?").status(status).build();
    }

    @Test
    public void testListWithFilters() throws Exception {
        Mockito.when(queryService.list(any(QueryFilter.class), eq(1), eq(20), isNull(), eq("desc")))
                .thenReturn(new PageResult<>(List.of(query(QueryStatus.PENDING)), 1, 20, 1, 1));

        mockMvc.perform(get("/api/admin/queries")
                        .param("status", "pending")
                        .param("category", "Accounts")
                        .param("search", "reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.items[0].status").value("pending"));

        ArgumentCaptor<QueryFilter> filter = ArgumentCaptor.forClass(QueryFilter.class);
        Mockito.verify(queryService).list(filter.capture(), eq(1), eq(20), isNull(), eq("desc"));
        assertThat(filter.getValue()).isEqualTo(new QueryFilter(QueryStatus.PENDING, "Accounts", "reset"));
    }

    @Test
    public void testListWithUnknownStatusFilter() throws Exception {
        mockMvc.perform(get("/api/admin/queries").param("status", "archived"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("InvalidStatus"));
    }

    @Test
    public void testResolveWithResponse() throws Exception {
        Query resolved = query(QueryStatus.RESOLVED);
        resolved.setAdminResponse("See settings");
        resolved.setResolvedAt(LocalDateTime.of(2024, 3, 15, 10, 0));
        Mockito.when(queryService.update(eq(1L), any(QueryUpdateRequest.class)))
                .thenReturn(new QueryUpdateResult(resolved, true));

        mockMvc.perform(patch("/api/admin/queries/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"resolved\",\"adminResponse\":\"See settings\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.query.status").value("resolved"))
                .andExpect(jsonPath("$.data.query.adminResponse").value("See settings"))
                .andExpect(jsonPath("$.data.responded").value(true));
    }

    @Test
    public void testUpdateWithInvalidStatus() throws Exception {
        Mockito.when(queryService.update(eq(1L), any(QueryUpdateRequest.class)))
                .thenThrow(new InvalidStatusException("Unknown status: closed"));

        mockMvc.perform(patch("/api/admin/queries/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"closed\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("InvalidStatus"));
    }

    @Test
    public void testGetMissingQuery() throws Exception {
        Mockito.when(queryService.get(99L)).thenThrow(new NotFoundException("Query not found: 99"));

        mockMvc.perform(get("/api/admin/queries/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NotFound"));
    }

    @Test
    public void testDeleteQuery() throws Exception {
        mockMvc.perform(delete("/api/admin/queries/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        Mockito.verify(queryService).delete(1L);
    }

    @Test
    public void testDeleteMissingQuery() throws Exception {
        Mockito.doThrow(new NotFoundException("Query not found: 5")).when(queryService).delete(5L);

        mockMvc.perform(delete("/api/admin/queries/5"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void testPromoteToFaq() throws Exception {
        Mockito.when(faqAggregator.promoteQuery(1L)).thenReturn(FaqEntry.builder().id(4L)
                .question("How to reset password?").questionKey("how to reset password?").answer("See settings").build());

        mockMvc.perform(post("/api/admin/queries/1/faq"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(4))
                .andExpect(jsonPath("$.data.answer").value("See settings"));
    }
}
