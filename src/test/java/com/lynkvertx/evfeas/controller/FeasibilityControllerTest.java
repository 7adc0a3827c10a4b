package com.lynkvertx.evfeas.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class FeasibilityControllerTest {

    private static final String TALL_CSV = "timestamp,kW\n2024-01-01 05:00,5\n2024-01-01 05:15,7.5\n";

    @Autowired
    private MockMvc mockMvc;

    private static MockMultipartFile upload(String part, String name, String content) {
        return new MockMultipartFile(part, name, "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }

    private static MockMultipartFile requestPart(String json) {
        return new MockMultipartFile("request", "", MediaType.APPLICATION_JSON_VALUE,
            json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void analyzeReportsEachFileIndependently() throws Exception {
        mockMvc.perform(multipart("/api/feasibility/analyze")
                .file(upload("files", "site.csv", TALL_CSV))
                .file(upload("files", "meter.csv", "timestamp,voltage\n2024-01-01 05:00,230\n"))
                .file(upload("files", "notes.txt", "not a table")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(200))
            .andExpect(jsonPath("$.message").value("Analysis completed"))
            .andExpect(jsonPath("$.data.analysedCount").value(1))
            .andExpect(jsonPath("$.data.failedCount").value(2))
            .andExpect(jsonPath("$.data.files[0].status").value("OK"))
            .andExpect(jsonPath("$.data.files[0].shape").value("TALL"))
            .andExpect(jsonPath("$.data.files[0].hourlyProfile[0].hour").value(5))
            .andExpect(jsonPath("$.data.files[0].peakPowerKw").value(7.5))
            .andExpect(jsonPath("$.data.files[1].errorCode").value("MISSING_POWER_COLUMN"))
            .andExpect(jsonPath("$.data.files[2].errorCode").value("UNREADABLE_FILE"));
    }

    @Test
    void analyzeAppliesRequestParameters() throws Exception {
        mockMvc.perform(multipart("/api/feasibility/analyze")
                .file(upload("files", "site.csv", TALL_CSV))
                .file(requestPart("{\"capacityKw\":5,\"strategy\":\"NONE\"}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.files[0].capacityKw").value(5))
            .andExpect(jsonPath("$.data.files[0].strategy").value("NONE"))
            .andExpect(jsonPath("$.data.files[0].exceedsCapacity").value(true))
            .andExpect(jsonPath("$.data.files[0].evaluation[0].Excess_Power_kW").value("-2.5"));
    }

    @Test
    void invalidRequestPartIsRejected() throws Exception {
        mockMvc.perform(multipart("/api/feasibility/analyze")
                .file(upload("files", "site.csv", TALL_CSV))
                .file(requestPart("{\"capacityKw\":-5}")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400))
            .andExpect(jsonPath("$.data.capacityKw").exists());
    }

    @Test
    void missingFilesPartIsRejected() throws Exception {
        mockMvc.perform(multipart("/api/feasibility/analyze")
                .file(requestPart("{}")))
            .andExpect(status().isBadRequest());
    }

    @Test
    void exportDownloadsCsv() throws Exception {
        mockMvc.perform(multipart("/api/feasibility/export")
                .file(upload("file", "site.csv", TALL_CSV)))
            .andExpect(status().isOk())
            .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("site.csv_analysis.csv")))
            .andExpect(content().string(
                "Hour,Max_Power_kW,Capacity_kW,Excess_Power_kW,Level2_Chargers,Level3_Chargers,Exceeds_Capacity\n"
                    + "5,7.5,100,92.5,12,1,false\n"));
    }

    @Test
    void exportOfBrokenFileIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/feasibility/export")
                .file(upload("file", "meter.csv", "timestamp,voltage\n2024-01-01 05:00,230\n")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("No 'kW' column found.")));
    }

    @Test
    void chargerMixAllocatesLargestFirst() throws Exception {
        mockMvc.perform(post("/api/feasibility/charger-mix")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"excessByHour\":{\"0\":320,\"1\":-5},\"ratingsKw\":[150,250]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Charger mix calculated"))
            .andExpect(jsonPath("$.data.label").value("Approximate charger mix (greedy, largest first)"))
            .andExpect(jsonPath("$.data.records[0]['250kW_Count']").value("1"))
            .andExpect(jsonPath("$.data.records[0]['150kW_Count']").value("0"))
            .andExpect(jsonPath("$.data.records[0].Remaining_kW").value("70"))
            .andExpect(jsonPath("$.data.records[1]['250kW_Count']").value("0"));
    }

    @Test
    void chargerMixWithoutRatingsIsRejected() throws Exception {
        mockMvc.perform(post("/api/feasibility/charger-mix")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"excessByHour\":{\"0\":320},\"ratingsKw\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.data.ratingsKw").exists());
    }

    @Test
    void chargerMixWithNullHeadroomIsRejected() throws Exception {
        mockMvc.perform(post("/api/feasibility/charger-mix")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"excessByHour\":{\"0\":null,\"1\":100},\"ratingsKw\":[50]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    void chargerMixWithUncountableUnitsIsRejected() throws Exception {
        mockMvc.perform(post("/api/feasibility/charger-mix")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"excessByHour\":{\"0\":1E+30},\"ratingsKw\":[1]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("Charger count out of range")));
    }

    @Test
    void corsPreflightAllowsLocalFrontend() throws Exception {
        mockMvc.perform(options("/api/feasibility/analyze")
                .header(HttpHeaders.ORIGIN, "http://localhost:5173")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
            .andExpect(status().isOk())
            .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:5173"));
    }
}
