package com.safepocket.anomaly.controller;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.safepocket.anomaly.SeriesFixtures;
import com.safepocket.anomaly.security.TraceIdFilter;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AnomalyControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Test
    void detectsSpikeThroughEnsemble() throws Exception {
        Map<String, Object> body = Map.of("rows", spikeRows());

        mockMvc.perform(post("/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].date").value("2023-12-01"))
                .andExpect(jsonPath("$[0].metric").value("Revenue"))
                .andExpect(jsonPath("$[0].direction").value("spike"))
                .andExpect(jsonPath("$[0].severity").value("Critical"))
                .andExpect(jsonPath("$[0].severity_level").value("CRITICAL"))
                .andExpect(jsonPath("$[0].deviation_pct").value(328.57))
                .andExpect(jsonPath("$[0].detection_methods", hasItem("grubbs_test")))
                .andExpect(jsonPath("$[0].algorithms_agreed").exists())
                .andExpect(jsonPath("$[0].context.algorithm_deviations").exists());
    }

    @Test
    void singleMethodOmitsEnsembleFields() throws Exception {
        Map<String, Object> body = Map.of("rows", spikeRows(), "metric", "revenue", "method", "zscore");

        mockMvc.perform(post("/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].method").value("modified_zscore"))
                .andExpect(jsonPath("$[0].confidence").doesNotExist())
                .andExpect(jsonPath("$[0].detection_methods").doesNotExist())
                .andExpect(jsonPath("$[0].algorithms_agreed").doesNotExist());
    }

    @Test
    void rowsWithoutDatesReturnEmptyList() throws Exception {
        Map<String, Object> body = Map.of("rows", List.of(Map.of("revenue", 1), Map.of("revenue", 900)));

        mockMvc.perform(post("/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void missingRowsFailValidation() throws Exception {
        mockMvc.perform(post("/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"ensemble\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.rows").exists());
    }

    @Test
    void thresholdOutsideUnitIntervalFailsValidation() throws Exception {
        Map<String, Object> body = Map.of("rows", spikeRows(), "confidenceThreshold", 1.5);

        mockMvc.perform(post("/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void invalidDateIsRejected() throws Exception {
        Map<String, Object> body = Map.of("rows", List.of(Map.of("date", "31/12/2023", "revenue", 1)));

        mockMvc.perform(post("/anomalies/detect")
                        .header(TraceIdFilter.TRACE_HEADER, "trace-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isBadRequest())
                .andExpect(header().string(TraceIdFilter.TRACE_HEADER, "trace-123"))
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.traceId").value("trace-123"));
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rows\": [}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void listsMethods() throws Exception {
        mockMvc.perform(get("/anomalies/methods"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("ensemble"))
                .andExpect(jsonPath("$", hasItem("grubbs")));
    }

    private static List<Map<String, Object>> spikeRows() {
        List<LocalDate> dates = SeriesFixtures.monthlyDates(24);
        List<Double> revenue = SeriesFixtures.flatWithSpike();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < dates.size(); i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", dates.get(i).toString());
            row.put("revenue", revenue.get(i));
            row.put("profit", 50_000);
            rows.add(row);
        }
        return rows;
    }
}
