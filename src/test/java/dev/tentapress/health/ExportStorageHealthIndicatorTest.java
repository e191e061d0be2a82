package dev.tentapress.health;

import dev.tentapress.service.storage.ExportStagingArea;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExportStorageHealthIndicatorTest {

    @Mock
    private ExportStagingArea stagingArea;

    @InjectMocks
    private ExportStorageHealthIndicator healthIndicator;

    @Test
    @DisplayName("Should report UP when the staging directory is writable")
    void up() {
        when(stagingArea.getDirectory()).thenReturn(Path.of("/srv/tp-exports"));
        when(stagingArea.isWritable()).thenReturn(Mono.just(true));

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails()).containsEntry("directory", Path.of("/srv/tp-exports").toString());
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should report DOWN when the staging directory is not writable")
    void down() {
        when(stagingArea.getDirectory()).thenReturn(Path.of("/srv/tp-exports"));
        when(stagingArea.isWritable()).thenReturn(Mono.just(false));

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should report DOWN when the check fails")
    void error() {
        when(stagingArea.getDirectory()).thenReturn(Path.of("/srv/tp-exports"));
        when(stagingArea.isWritable()).thenReturn(Mono.error(new IllegalStateException("io")));

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("error", "IllegalStateException");
                })
                .verifyComplete();
    }
}
