package com.nilsson.soeji.service;

import com.nilsson.soeji.data.ImageRepository;
import com.nilsson.soeji.service.derivative.LosslessEncoder;
import com.nilsson.soeji.service.storage.StorageKeys;
import com.nilsson.soeji.testsupport.TestApp;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.nilsson.soeji.testsupport.PngFixtures.png;
import static com.nilsson.soeji.testsupport.PngFixtures.withComment;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FolderImportServiceTest {

    @TempDir
    Path tempDir;

    private TestApp app;

    @AfterEach
    void tearDown() {
        if (app != null) app.close();
    }

    @Test
    void testImportFolder_countsOutcomesAndSkipsOtherFiles() throws Exception {
        app = TestApp.start(tempDir.resolve("app"));
        Path folder = Files.createDirectories(tempDir.resolve("incoming"));
        byte[] first = withComment("{\"prompt\":\"cat\"}", 0x111111);
        Files.write(folder.resolve("a.png"), first);
        Files.write(folder.resolve("b.PNG"), png(3, 3, 0x222222));
        Files.write(folder.resolve("copy-of-a.png"), first);
        Files.write(folder.resolve("broken.png"), "not really".getBytes(StandardCharsets.US_ASCII));
        Files.write(folder.resolve("notes.txt"), "ignored".getBytes(StandardCharsets.US_ASCII));
        Files.createDirectories(folder.resolve("nested.png"));

        FolderImportService.ImportSummary summary = app.get(FolderImportService.class).importFolder(folder);

        assertEquals(2, summary.getCreated());
        assertEquals(1, summary.getDuplicate());
        assertEquals(List.of(folder.resolve("broken.png")), summary.getFailures());
        assertTrue(summary.hasFailures());
        assertEquals(2, app.get(ImageRepository.class).countImages());
    }

    @Test
    void testImportFolder_reimportOnlyReportsDuplicates() throws Exception {
        app = TestApp.start(tempDir.resolve("app"));
        Path folder = Files.createDirectories(tempDir.resolve("incoming"));
        for (int i = 0; i < FolderImportService.BATCH_SIZE + 3; i++) {
            Files.write(folder.resolve(String.format("img-%02d.png", i)), png(2, 2, 0x010101 * (i + 1)));
        }
        FolderImportService service = app.get(FolderImportService.class);

        FolderImportService.ImportSummary firstRun = service.importFolder(folder);
        FolderImportService.ImportSummary secondRun = service.importFolder(folder);

        assertEquals(FolderImportService.BATCH_SIZE + 3, firstRun.getCreated());
        assertEquals(0, secondRun.getCreated());
        assertEquals(FolderImportService.BATCH_SIZE + 3, secondRun.getDuplicate());
        assertFalse(secondRun.hasFailures());
    }

    @Test
    void testImportFolder_derivativeFailuresAreNotFatal() throws Exception {
        LosslessEncoder failing = mock(LosslessEncoder.class);
        when(failing.keySuffix()).thenReturn(StorageKeys.LOSSLESS_SUFFIX);
        when(failing.contentType()).thenReturn(StorageKeys.PNG_CONTENT_TYPE);
        when(failing.encode(any())).thenThrow(new IOException("encoder crashed"));
        app = TestApp.start(tempDir.resolve("app"), binder -> binder.bind(LosslessEncoder.class).toInstance(failing));
        Path folder = Files.createDirectories(tempDir.resolve("incoming"));
        Files.write(folder.resolve("a.png"), png(2, 2, 0x333333));

        FolderImportService.ImportSummary summary = app.get(FolderImportService.class).importFolder(folder);

        assertEquals(1, summary.getCreated());
        assertEquals(1, app.get(ImageRepository.class).findIdsWithoutLosslessDerivative().size());
    }

    @Test
    void testImportFolder_rejectsMissingFolder() {
        app = TestApp.start(tempDir.resolve("app"));

        assertThrows(IOException.class,
                () -> app.get(FolderImportService.class).importFolder(tempDir.resolve("missing")));
    }
}
