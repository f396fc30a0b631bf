/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ferry.bot;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InboundFileTest {

    private static InboundFile.Builder file(InboundFile.Kind kind) {
        return InboundFile.builder().kind(kind).source(() -> new byte[0]).uniqueId("AQADxyz");
    }

    @Test
    void testDocumentKeepsNameAndType() {
        InboundFile doc = file(InboundFile.Kind.DOCUMENT).fileName("plan.docx").mimeType("application/msword").build();

        assertEquals("plan.docx", doc.resolveName());
        assertEquals("application/msword", doc.resolveContentType());
    }

    @Test
    void testPhotoNameAndTypeAreDerived() {
        InboundFile photo = file(InboundFile.Kind.PHOTO).fileName("ignored.png").mimeType("image/png").build();

        assertEquals("photo_AQADxyz.jpg", photo.resolveName());
        assertEquals("image/jpeg", photo.resolveContentType());
    }

    @Test
    void testVideoWithoutNameGetsDefault() {
        InboundFile video = file(InboundFile.Kind.VIDEO).mimeType("video/mp4").build();

        assertEquals("video_AQADxyz.mp4", video.resolveName());
        assertEquals("video/mp4", video.resolveContentType());
    }

    @Test
    void testNamedVideoKeepsName() {
        assertEquals("clip.mov", file(InboundFile.Kind.VIDEO).fileName("clip.mov").build().resolveName());
    }

    @Test
    void testUntypedDocumentLeavesTypeToCore() {
        assertNull(file(InboundFile.Kind.DOCUMENT).fileName("a.bin").build().resolveContentType());
    }

    @Test
    void testRequiredFields() {
        assertThrows(NullPointerException.class, () -> InboundFile.builder().kind(InboundFile.Kind.PHOTO).build());
    }
}
