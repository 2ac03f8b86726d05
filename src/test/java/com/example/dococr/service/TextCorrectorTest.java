package com.example.dococr.service;

import com.example.dococr.dictionary.CorrectionDictionary;
import com.example.dococr.model.CorrectionDetail;
import com.example.dococr.model.CorrectionMethod;
import com.example.dococr.model.CorrectionResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextCorrectorTest {

    static final String CERTIFICATE = String.join("\n",
            "사업자등록증",
            "(법인사업자)",
            "등록번호 : 111-22-33333",
            "법인명(단체명) : (주)테스트",
            "대표자 : 홍길동",
            "개업연월일 : 2020년 01월 01일",
            "사업장 소재지 : 서울특별시 강남구 테헤란로 123",
            "본 정 소 재 지 : 서울특별시 서초구 서초대로 456",
            "사업의 종류 : 업태 서비스 종목 포털") + "\n";

    private static TextCorrector corrector;

    @BeforeAll
    static void setUp() {
        corrector = new TextCorrector(CorrectionDictionary.loadDefault());
    }

    @Nested
    class CleanText {

        @Test
        void shouldLeaveCleanCertificateUntouched() {
            CorrectionResult result = corrector.correct(CERTIFICATE);

            assertThat(result.getCorrected()).isEqualTo(CERTIFICATE);
            assertThat(result.getCorrections()).isEmpty();
            assertThat(result.getConfidence()).isEqualTo(1.0);
            assertThat(result.isChanged()).isFalse();
        }

        @Test
        void shouldBeIdempotent() {
            String noisy = "데표자 : 홍길동\n등륵번호 : 123-45-67890\n";

            String once = corrector.correct(noisy).getCorrected();
            String twice = corrector.correct(once).getCorrected();

            assertThat(twice).isEqualTo(once);
        }

        @Test
        void shouldSeparateDateFromLabelFixedByKeywordPass() {
            String noisy = "2015년12월01일빕인등록번호 : 110111-1234567";

            CorrectionResult once = corrector.correct(noisy);
            String twice = corrector.correct(once.getCorrected()).getCorrected();

            assertThat(once.getCorrected()).isEqualTo("2015년12월01일\n법인등록번호 : 110111-1234567");
            assertThat(twice).isEqualTo(once.getCorrected());
        }

        @Test
        void shouldTreatNullAsEmpty() {
            CorrectionResult result = corrector.correct(null);

            assertThat(result.getCorrected()).isEmpty();
            assertThat(result.getConfidence()).isEqualTo(1.0);
        }
    }

    @Nested
    class Passes {

        @Test
        void shouldMergeLoneDaeLine() {
            CorrectionResult result = corrector.correct("대\n표자 : 홍길동");

            assertThat(result.getCorrected()).isEqualTo("대표자 : 홍길동");
            assertThat(result.getCorrections())
                    .extracting(CorrectionDetail::getMethod)
                    .contains(CorrectionMethod.MERGE);
        }

        @Test
        void shouldMergeSpaceSplitLabel() {
            assertThat(corrector.correct("법 인명 : 테스트").getCorrected()).isEqualTo("법인명 : 테스트");
        }

        @Test
        void shouldSeparateDateFromFollowingLabel() {
            CorrectionResult result = corrector.correct("2015년12월01일법인등록번호 : 110111-1234567");

            assertThat(result.getCorrected()).isEqualTo("2015년12월01일\n법인등록번호 : 110111-1234567");
            assertThat(result.getCorrections())
                    .extracting(CorrectionDetail::getMethod)
                    .containsOnly(CorrectionMethod.PREFIX);
        }

        @Test
        void shouldReplaceWholeLatinTokensOnly() {
            CorrectionResult replaced = corrector.correct("AOE 소재지");
            CorrectionResult untouched = corrector.correct("HOAX 123");

            assertThat(replaced.getCorrected()).isEqualTo("사업장 소재지");
            assertThat(replaced.getCorrections())
                    .extracting(CorrectionDetail::getMethod)
                    .contains(CorrectionMethod.CONFUSION);
            assertThat(untouched.getCorrected()).isEqualTo("HOAX 123");
        }

        @Test
        void shouldApplyDictionaryCorrections() {
            CorrectionResult result = corrector.correct("등륵번호 : 123-45-67890");

            assertThat(result.getCorrected()).isEqualTo("등록번호 : 123-45-67890");
            CorrectionDetail detail = result.getCorrections().get(0);
            assertThat(detail.getMethod()).isEqualTo(CorrectionMethod.DICTIONARY);
            assertThat(detail.getOriginal()).isEqualTo("등륵번호");
            assertThat(detail.getPosition()).isZero();
        }

        @Test
        void shouldFixRareBigramFromConfusionSet() {
            CorrectionResult result = corrector.correct("데표자 : 홍길동");

            assertThat(result.getCorrected()).isEqualTo("대표자 : 홍길동");
            assertThat(result.getCorrections())
                    .extracting(CorrectionDetail::getMethod)
                    .containsExactly(CorrectionMethod.NGRAM);
        }

        @Test
        void shouldFixRareTrigramBySimilarity() {
            CorrectionResult result = corrector.correct("대표지 : 홍길동");

            assertThat(result.getCorrected()).isEqualTo("대표자 : 홍길동");
            assertThat(result.getCorrections())
                    .extracting(CorrectionDetail::getMethod)
                    .containsExactly(CorrectionMethod.NGRAM);
        }

        @Test
        void shouldNormalizeFieldKeywordVariants() {
            CorrectionResult result = corrector.correct("법언등록번호 : 110111-1234567");

            assertThat(result.getCorrected()).isEqualTo("법인등록번호 : 110111-1234567");
            assertThat(result.getCorrections())
                    .extracting(CorrectionDetail::getMethod)
                    .containsExactly(CorrectionMethod.KEYWORD);
        }
    }

    @Nested
    class Confidence {

        @Test
        void shouldScaleDetailConfidenceBySmallChangeRatio() {
            CorrectionResult result = corrector.correct("등륵번호 : 123-45-67890");

            assertThat(result.getConfidence()).isBetween(0.9, 0.95);
        }

        @Test
        void shouldCapConfidenceWhenTooMuchChanged() {
            CorrectionResult result = corrector.correct("AOE 소재지");

            assertThat(result.getConfidence()).isEqualTo(0.5);
        }

        @Test
        void shouldHonourConfiguredChangeRatio() {
            TextCorrector lenient = new TextCorrector(CorrectionDictionary.loadDefault(), 0.3, 0.9);

            assertThat(lenient.correct("AOE 소재지").getConfidence()).isGreaterThan(0.5);
        }

        @Test
        void shouldKeepCorrectionLogPerCall() {
            CorrectionResult first = corrector.correct("등륵번호");
            CorrectionResult second = corrector.correct("등륵번호");

            assertThat(first.getCorrections()).hasSize(1);
            assertThat(second.getCorrections()).hasSize(1);
        }
    }

    @Test
    void shouldScoreTrigramSimilarityByPosition() {
        assertThat(TextCorrector.trigramSimilarity("대표자", "대표자")).isEqualTo(1.0);
        assertThat(TextCorrector.trigramSimilarity("대표지", "대표자")).isCloseTo(2.6 / 3.0, within(1e-9));
        assertThat(TextCorrector.trigramSimilarity("abc", "ab")).isZero();
    }
}
