package com.clausescan.processing;

import com.clausescan.processing.model.ReadabilityScore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ReadabilityServiceTest {

    private final ReadabilityService readability = new ReadabilityService();

    @Test
    void testCompute_SimpleText() {
        ReadabilityScore score = readability.compute("The cat sat on the mat. The dog ran.").orElseThrow();

        assertThat(score.getFleschEase()).isEqualTo(100.0);
        assertThat(score.getFleschGrade()).isEqualTo(0.0);
        assertThat(score.getGunningFog()).isCloseTo(1.8, within(0.001));
        assertThat(score.getAvgSentenceLength()).isCloseTo(4.5, within(0.001));
        assertThat(score.getAvgWordLength()).isCloseTo(2.9, within(0.001));
        assertThat(score.getComplexWordPercent()).isEqualTo(0.0);
        assertThat(score.getGradeLabel()).isEqualTo("Very Easy");
    }

    @Test
    void testCompute_DenseLegalText() {
        ReadabilityScore score = readability.compute("Notwithstanding any contrary provision hereinafter enumerated, "
                + "the indemnifying party shall irrevocably and unconditionally indemnify the indemnified party against "
                + "all liabilities, obligations, and consequential damages arising from the aforementioned contractual "
                + "relationship.").orElseThrow();

        assertThat(score.getFleschEase()).isEqualTo(0.0);
        assertThat(score.getFleschGrade()).isGreaterThan(20.0);
        assertThat(score.getAvgSentenceLength()).isCloseTo(30.0, within(0.001));
        assertThat(score.getComplexWordPercent()).isCloseTo(60.0, within(0.001));
        assertThat(score.getGradeLabel()).isEqualTo("Very Confusing");
    }

    @Test
    void testCompute_DegenerateInput() {
        assertThat(readability.compute(null)).isEmpty();
        assertThat(readability.compute("   ")).isEmpty();
        assertThat(readability.compute("12345 67890 !!!")).isEmpty();
    }

    @Test
    void testCountSyllables() {
        assertThat(ReadabilityService.countSyllables("cat")).isEqualTo(1);
        assertThat(ReadabilityService.countSyllables("agreement")).isEqualTo(3);
        assertThat(ReadabilityService.countSyllables("the")).isEqualTo(1);
        assertThat(ReadabilityService.countSyllables("'")).isEqualTo(1);
    }
}
