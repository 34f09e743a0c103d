package com.nilsson.soeji.service.reader;

import com.nilsson.soeji.service.parser.PromptParser;
import com.nilsson.soeji.service.png.PngChunkReader;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.nilsson.soeji.testsupport.PngFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MetadataReaderRegistryTest {

    private final MetadataReaderRegistry registry =
            new MetadataReaderRegistry(new NovelAIPngReader(new PngChunkReader(), new PromptParser()));

    @Test
    void testDetectAndRead_novelAIComment() {
        byte[] png = withComment("{\"prompt\":\"cat ears, smile\",\"steps\":28}", 0x123456);

        MetadataReadResult result = registry.detectAndRead(png, "upload.png");

        assertEquals(NovelAIPngReader.FORMAT_NAME, result.getFormat());
        assertTrue(result.isKnownFormat());
        assertEquals("cat ears, smile", result.getMetadata().getPrompt());
        assertEquals(2, result.getMetadata().getTags().size());
    }

    @Test
    void testDetectAndRead_extensionIsCaseInsensitive() {
        byte[] png = withComment("{\"prompt\":\"cat\"}", 0x654321);

        assertEquals("nai", registry.detectAndRead(png, "UPLOAD.PNG").getFormat());
    }

    @Test
    void testDetectAndRead_pngWithoutCommentIsStillNovelAI() {
        MetadataReadResult result = registry.detectAndRead(png(2, 2, 0), "blank.png");

        assertEquals("nai", result.getFormat());
        assertTrue(result.getMetadata().isEmpty());
    }

    @Test
    void testDetectAndRead_unknownWhenNoReaderClaims() {
        byte[] png = withComment("{\"prompt\":\"cat\"}", 0x111111);
        byte[] text = "not an image".getBytes(StandardCharsets.US_ASCII);

        MetadataReadResult wrongExtension = registry.detectAndRead(png, "upload.jpg");
        MetadataReadResult wrongContent = registry.detectAndRead(text, "upload.png");

        assertEquals(MetadataReadResult.UNKNOWN_FORMAT, wrongExtension.getFormat());
        assertFalse(wrongExtension.isKnownFormat());
        assertNotNull(wrongExtension.getMetadata());
        assertEquals(MetadataReadResult.UNKNOWN_FORMAT, wrongContent.getFormat());
    }

    @Test
    void testDetectAndRead_firstMatchingReaderWins() {
        MetadataReader first = mock(MetadataReader.class);
        MetadataReader second = mock(MetadataReader.class);
        when(first.supportedExtensions()).thenReturn(List.of(".png"));
        when(first.canRead(any())).thenReturn(false);
        when(second.supportedExtensions()).thenReturn(List.of(".png"));
        when(second.canRead(any())).thenReturn(true);
        when(second.read(any())).thenReturn(MetadataReadResult.unknown());

        new MetadataReaderRegistry(List.of(first, second)).detectAndRead(new byte[]{1}, "a.png");

        verify(first, never()).read(any());
        verify(second).read(any());
    }

    @Test
    void testExtensionOf() {
        assertEquals(".png", MetadataReaderRegistry.extensionOf("a.b.PNG"));
        assertEquals("", MetadataReaderRegistry.extensionOf("dir.v1/file"));
        assertEquals("", MetadataReaderRegistry.extensionOf("README"));
        assertEquals("", MetadataReaderRegistry.extensionOf(null));
    }
}
