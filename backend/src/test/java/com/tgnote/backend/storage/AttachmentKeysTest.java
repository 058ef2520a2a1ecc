package com.tgnote.backend.storage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttachmentKeysTest {

    @Test
    void splitsBaseNameAndExtension() {
        AttachmentKeys.FileName name = AttachmentKeys.split("report.pdf");

        assertThat(name.baseName()).isEqualTo("report");
        assertThat(name.extension()).isEqualTo("pdf");
    }

    @Test
    void onlyTheLastDotStartsTheExtension() {
        AttachmentKeys.FileName name = AttachmentKeys.split("backup.tar.gz");

        assertThat(name.baseName()).isEqualTo("backup.tar");
        assertThat(name.extension()).isEqualTo("gz");
    }

    @Test
    void fileWithoutExtensionKeepsWholeName() {
        AttachmentKeys.FileName name = AttachmentKeys.split("README");

        assertThat(name.baseName()).isEqualTo("README");
        assertThat(name.extension()).isEmpty();
    }

    @Test
    void dropsClientDirectories() {
        assertThat(AttachmentKeys.split("C:\\Users\\me\\photo.jpg"))
                .isEqualTo(new AttachmentKeys.FileName("photo", "jpg"));
        assertThat(AttachmentKeys.split("../../etc/passwd"))
                .isEqualTo(new AttachmentKeys.FileName("passwd", ""));
    }

    @Test
    void rejectsBlankNames() {
        assertThatThrownBy(() -> AttachmentKeys.split(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AttachmentKeys.split("uploads/")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void uploadAndDeleteDeriveTheSameKey() {
        AttachmentKeys.FileName name = AttachmentKeys.split("report.pdf");

        String uploadKey = AttachmentKeys.objectKey(42L, name.baseName(), name.extension());
        String deleteKey = AttachmentKeys.objectKey(42L, "report", "pdf");

        assertThat(uploadKey).isEqualTo("42-report.pdf").isEqualTo(deleteKey);
    }

    @Test
    void keyHasNoTrailingDotWithoutExtension() {
        assertThat(AttachmentKeys.objectKey(7L, "README", "")).isEqualTo("7-README");
    }

    @Test
    void rejectsExtensionsWiderThanTheColumn() {
        String tooLong = "x".repeat(AttachmentKeys.MAX_EXTENSION_LENGTH + 6);

        assertThatThrownBy(() -> AttachmentKeys.split("a." + tooLong))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("extension");
        assertThat(AttachmentKeys.split("a." + "y".repeat(AttachmentKeys.MAX_EXTENSION_LENGTH)).extension())
                .hasSize(AttachmentKeys.MAX_EXTENSION_LENGTH);
    }
}
