package com.example.dococr.service;

import com.example.dococr.dictionary.SymbolDictionary;
import com.example.dococr.model.DecodedSpan;
import com.example.dococr.model.RecognitionLogits;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SequenceDecoderTest {

    // 类别: 0=空白, 1=A, 2=B, 3=C, 4=空格
    private final SequenceDecoder decoder = new SequenceDecoder(new SymbolDictionary(List.of("A", "B", "C")));

    @Test
    void shouldCollapseRepeatsAndSkipBlanks() {
        DecodedSpan span = decoder.decode(oneHot(5, 1, 1, 0, 2));

        assertThat(span.getText()).isEqualTo("AB");
        assertThat(span.getConfidence()).isEqualTo(1.0);
    }

    @Test
    void shouldEmitRepeatedSymbolSeparatedByBlank() {
        assertThat(decoder.decode(oneHot(5, 1, 0, 1)).getText()).isEqualTo("AA");
    }

    @Test
    void shouldReturnZeroConfidenceForAllBlank() {
        DecodedSpan span = decoder.decode(oneHot(5, 0, 0, 0));

        assertThat(span.getText()).isEmpty();
        assertThat(span.getConfidence()).isZero();
        assertThat(span.isEmpty()).isTrue();
    }

    @Test
    void shouldDecodeTrailingSpaceSymbol() {
        assertThat(decoder.decode(oneHot(5, 1, 4, 3)).getText()).isEqualTo("A C");
    }

    @Test
    void shouldSkipIndicesOutsideDictionary() {
        DecodedSpan span = decoder.decode(oneHot(7, 6, 1));

        assertThat(span.getText()).isEqualTo("A");
    }

    @Test
    void shouldHandleEmptySequence() {
        DecodedSpan span = decoder.decode(new RecognitionLogits(new float[0], 0, 5));

        assertThat(span.getText()).isEmpty();
        assertThat(span.getConfidence()).isZero();
    }

    private static RecognitionLogits oneHot(int numClasses, int... classes) {
        float[][] scores = new float[classes.length][numClasses];
        for (int t = 0; t < classes.length; t++) {
            scores[t][classes[t]] = 1.0f;
        }
        return RecognitionLogits.of(scores);
    }
}
