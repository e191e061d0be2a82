package dev.tentapress.controller;

import dev.tentapress.dto.ArchiveResult;
import dev.tentapress.dto.ExportOptions;
import dev.tentapress.exception.ExportInitException;
import dev.tentapress.service.ExportService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdminExportControllerTest {

    @Mock
    private ExportService exportService;

    @InjectMocks
    private AdminExportController controller;

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should stream the archive as an attachment and discard it afterwards")
    void streamsArchive() throws IOException {
        Path zip = Files.writeString(tempDir.resolve("tentapress-export-20261019-115500.zip"), "PK-archive-bytes");
        ArchiveResult archive = new ArchiveResult(zip, "tentapress-export-20261019-115500.zip");
        when(exportService.createExportArchive(ExportOptions.defaults())).thenReturn(Mono.just(archive));
        when(exportService.discardArchive(archive)).thenReturn(Mono.empty());

        ResponseEntity<Flux<DataBuffer>> response = controller.runExport(null, null, null, null).block();

        assertThat(response).isNotNull();
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getHeaders().getContentType()).isEqualTo(AdminExportController.APPLICATION_ZIP);
        assertThat(response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION))
                .isEqualTo("attachment; filename=\"tentapress-export-20261019-115500.zip\"");
        verify(exportService, never()).discardArchive(any());

        StepVerifier.create(DataBufferUtils.join(response.getBody())
                        .map(buffer -> {
                            String body = buffer.toString(StandardCharsets.UTF_8);
                            DataBufferUtils.release(buffer);
                            return body;
                        }))
                .expectNext("PK-archive-bytes")
                .verifyComplete();

        verify(exportService, timeout(1000)).discardArchive(archive);
    }

    @Test
    @DisplayName("Should pass explicit inclusion flags through")
    void passesFlags() {
        ExportOptions expected = new ExportOptions(false, true, false, true);
        when(exportService.createExportArchive(expected)).thenReturn(Mono.empty());

        StepVerifier.create(controller.runExport(false, null, false, true))
                .verifyComplete();

        verify(exportService).createExportArchive(expected);
    }

    @Test
    @DisplayName("Should propagate export failures to the exception handler")
    void propagatesFailure() {
        when(exportService.createExportArchive(any()))
                .thenReturn(Mono.error(new ExportInitException("Unable to create export zip.", new IOException("disk full"))));

        StepVerifier.create(controller.runExport(null, null, null, null))
                .expectError(ExportInitException.class)
                .verify();
    }
}
