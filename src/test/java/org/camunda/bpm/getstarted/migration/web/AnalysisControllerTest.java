package org.camunda.bpm.getstarted.migration.web;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.camunda.bpm.getstarted.migration.analysis.BpmnSamples.LEGACY_BPMN;
import static org.camunda.bpm.getstarted.migration.analysis.BpmnSamples.MALFORMED_BPMN;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = "migration.upload.folder=target/test-uploads")
class AnalysisControllerTest {
    private static final Path UPLOAD_FOLDER = Path.of("target/test-uploads");

    @Autowired
    private MockMvc mockMvc;

    private static MockMultipartFile upload(String filename, String fixture) throws IOException {
        return new MockMultipartFile("file", filename, "application/xml", Files.readAllBytes(Path.of(fixture)));
    }

    @Test
    void shouldReportHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void shouldAnalyzeUploadedFile() throws Exception {
        mockMvc.perform(multipart("/analyze").file(upload("order.bpmn", LEGACY_BPMN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.file").value("order.bpmn"))
                .andExpect(jsonPath("$.data.statistics.total_issues").value(10))
                .andExpect(jsonPath("$.data.statistics.issue_counts_by_severity.CRITICAL").value(7))
                .andExpect(jsonPath("$.data.issues[0].element_id").value("ApproveOrder"))
                .andExpect(jsonPath("$.data.process_variables[3]").value("stockChecker"));

        assertUploadFolderEmpty();
    }

    @Test
    void shouldRejectMissingFile() throws Exception {
        mockMvc.perform(multipart("/analyze"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No file uploaded"));
    }

    @Test
    void shouldRejectEmptyFilename() throws Exception {
        mockMvc.perform(multipart("/analyze").file(new MockMultipartFile("file", "", "application/xml", new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No file selected"));
    }

    @Test
    void shouldRejectWrongExtension() throws Exception {
        mockMvc.perform(multipart("/analyze").file(upload("order.txt", LEGACY_BPMN)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid file type. Only .bpmn and .xml files are allowed"));
    }

    @Test
    void shouldReturnUnprocessableForMalformedXml() throws Exception {
        mockMvc.perform(multipart("/analyze").file(upload("broken.xml", MALFORMED_BPMN)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").exists());

        assertUploadFolderEmpty();
    }

    @Test
    void shouldSanitizeFilenames() {
        assertEquals("process.bpmn", AnalysisController.sanitize("../../etc/process.bpmn"));
        assertEquals("my_process.bpmn", AnalysisController.sanitize("C:\\models\\my process.bpmn"));
        assertEquals("", AnalysisController.sanitize(null));
    }

    private static void assertUploadFolderEmpty() throws IOException {
        try (Stream<Path> files = Files.list(UPLOAD_FOLDER)) {
            assertEquals(0, files.count());
        }
    }
}
