package com.eventquery.api;

import com.eventquery.domain.exception.InvalidQueryException;
import com.eventquery.domain.model.QueryRequest;
import com.eventquery.domain.model.QueryResult;
import com.eventquery.domain.plan.PlanType;
import com.eventquery.domain.service.QueryService;
import com.eventquery.infrastructure.export.CsvResultWriter;
import com.eventquery.infrastructure.store.PartitionNotFoundException;
import com.eventquery.infrastructure.store.PartitionRef;
import com.eventquery.domain.model.EventKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class QueryControllerTest {

    private static final String COUNTRY_REVENUE = "{\"select\": [\"country\", {\"SUM\": \"bid_price\"}],"
            + " \"where\": [{\"col\": \"type\", \"op\": \"eq\", \"val\": \"impression\"}], \"group_by\": [\"country\"]}";

    @Mock
    private QueryService queryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new QueryController(queryService, new CsvResultWriter())).build();
    }

    @Test
    void testQuery_ReturnsResult() throws Exception {
        when(queryService.execute(any(QueryRequest.class))).thenReturn(countryResult());

        mockMvc.perform(post("/api/v1/analytics/query").contentType(MediaType.APPLICATION_JSON).content(COUNTRY_REVENUE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.columns[1]").value("SUM(bid_price)"))
                .andExpect(jsonPath("$.rows[0][0]").value("US"))
                .andExpect(jsonPath("$.rows[0][1]").value(8.0))
                .andExpect(jsonPath("$.planType").value("CATALOG_LOOKUP"))
                .andExpect(jsonPath("$.cached").value(false));
    }

    @Test
    void testQueryCsv_ReturnsCsvBody() throws Exception {
        when(queryService.execute(any(QueryRequest.class))).thenReturn(countryResult());

        mockMvc.perform(post("/api/v1/analytics/query/csv").contentType(MediaType.APPLICATION_JSON).content(COUNTRY_REVENUE))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string("country,SUM(bid_price)\nUS,8.0\nDE,\n"));
    }

    @Test
    void testQuery_InvalidQueryIsBadRequest() throws Exception {
        when(queryService.execute(any(QueryRequest.class))).thenThrow(new InvalidQueryException("Unknown column 'nope'"));

        mockMvc.perform(post("/api/v1/analytics/query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"select\": [\"nope\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_query"))
                .andExpect(jsonPath("$.message").value("Unknown column 'nope'"));
    }

    @Test
    void testQuery_MalformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/analytics/query").contentType(MediaType.APPLICATION_JSON).content("{\"select\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_query"));

        verifyNoInteractions(queryService);
    }

    @Test
    void testQuery_StoreFailureIsServerError() throws Exception {
        PartitionRef missing = new PartitionRef(EventKind.CLICK, LocalDate.of(2024, 1, 2));
        when(queryService.execute(any(QueryRequest.class))).thenThrow(new PartitionNotFoundException(missing));

        mockMvc.perform(post("/api/v1/analytics/query").contentType(MediaType.APPLICATION_JSON).content(COUNTRY_REVENUE))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("store_error"))
                .andExpect(jsonPath("$.message").value("Partition not found: type=click/day=2024-01-02"));
    }

    @Test
    void testInvalidateCache_NoContent() throws Exception {
        mockMvc.perform(delete("/api/v1/analytics/cache"))
                .andExpect(status().isNoContent());

        verify(queryService).invalidateCache();
    }

    private static QueryResult countryResult() {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(new ArrayList<>(List.of("US", 8.0)));
        List<Object> germany = new ArrayList<>();
        germany.add("DE");
        germany.add(null);
        rows.add(germany);
        return QueryResult.builder()
                .columns(List.of("country", "SUM(bid_price)"))
                .rows(rows)
                .planType(PlanType.CATALOG_LOOKUP)
                .build();
    }
}
