package com.example.dococr;

import com.example.dococr.dictionary.SymbolDictionaryProvider;
import com.example.dococr.model.FieldRecord;
import com.example.dococr.service.DocumentOcrService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class DocOcrApplicationTests {

    @Autowired
    private DocumentOcrService documentOcrService;

    @Autowired
    private SymbolDictionaryProvider symbolDictionaryProvider;

    @Test
    void shouldWireTextPipelineWithoutModels() {
        FieldRecord record = documentOcrService.parseText("대\n표자 : 홍길동\n등륵번호 : 111-22-33333", true);

        assertThat(documentOcrService.isModelAvailable()).isFalse();
        assertThat(symbolDictionaryProvider.isAvailable()).isFalse();
        assertThat(record.getRepresentative()).isEqualTo("홍길동");
        assertThat(record.getRegistrationNumber()).isEqualTo("111-22-33333");
    }
}
