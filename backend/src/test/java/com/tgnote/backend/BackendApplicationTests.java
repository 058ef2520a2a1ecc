package com.tgnote.backend;

import com.tgnote.backend.service.AttachmentService;
import com.tgnote.backend.service.NoteService;
import com.tgnote.backend.storage.ObjectStorage;
import com.tgnote.backend.storage.S3ObjectStorage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class BackendApplicationTests {

    @Autowired
    private ObjectStorage objectStorage;

    @Autowired
    private NoteService noteService;

    @Autowired
    private AttachmentService attachmentService;

    @Test
    void contextLoads() {
        assertThat(objectStorage).isInstanceOf(S3ObjectStorage.class);
        assertThat(noteService).isNotNull();
        assertThat(attachmentService).isNotNull();
    }
}
