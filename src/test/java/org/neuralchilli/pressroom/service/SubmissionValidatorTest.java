package org.neuralchilli.pressroom.service;

import org.junit.jupiter.api.Test;
import org.neuralchilli.pressroom.domain.Article;
import org.neuralchilli.pressroom.domain.Audience;
import org.neuralchilli.pressroom.domain.PipelineRequest;
import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.WritingStyle;
import org.neuralchilli.pressroom.support.Fixtures;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class SubmissionValidatorTest {

    private final SubmissionValidator validator = new SubmissionValidator(300, 5000);

    private static PipelineRequest.Builder complete() {
        return PipelineRequest.forUrl(Fixtures.URL)
                .style(WritingStyle.PROFESSIONAL)
                .audience(Audience.GENERAL)
                .targetLength(1000)
                .platform("wechat");
    }

    @Test
    void shouldNormaliseStagesIntoPipelineOrder() {
        List<Stage> stages = validator.validate(Set.of(Stage.WRITE, Stage.ANALYZE, Stage.EXTRACT), complete().build());

        assertThat(stages).containsExactly(Stage.EXTRACT, Stage.ANALYZE, Stage.WRITE);
    }

    @Test
    void shouldAcceptImmutableStageCollections() {
        assertThat(validator.validate(List.of(Stage.EXTRACT), complete().build()))
                .containsExactly(Stage.EXTRACT);
        assertThat(validator.validate(Set.of(Stage.ANALYZE, Stage.EXTRACT), complete().build()))
                .containsExactly(Stage.EXTRACT, Stage.ANALYZE);
    }

    @Test
    void shouldRejectNullStage() {
        List<Stage> stages = new ArrayList<>();
        stages.add(Stage.EXTRACT);
        stages.add(null);

        assertThatThrownBy(() -> validator.validate(stages, complete().build()))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("cannot contain null");
    }

    @Test
    void shouldRejectEmptyStages() {
        assertThatThrownBy(() -> validator.validate(List.of(), complete().build()))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("At least one stage");
    }

    @Test
    void shouldRejectGapInStages() {
        assertThatThrownBy(() -> validator.validate(List.of(Stage.EXTRACT, Stage.WRITE), complete().build()))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("contiguous");
    }

    @Test
    void shouldRequireUrlForExtract() {
        PipelineRequest request = complete().url(null).build();

        assertThatThrownBy(() -> validator.validate(List.of(Stage.EXTRACT), request))
                .isInstanceOfSatisfying(InvalidRequestException.class, e ->
                        assertThat(e.getErrors()).containsExactly("url is required for EXTRACT"));
    }

    @Test
    void shouldRejectNonHttpUrl() {
        PipelineRequest request = complete().url("ftp://example.com/file").build();

        assertThatThrownBy(() -> validator.validate(List.of(Stage.EXTRACT), request))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("http or https");
    }

    @Test
    void shouldRequireSeedForLeadingStage() {
        PipelineRequest request = complete().build();

        assertThatThrownBy(() -> validator.validate(List.of(Stage.ANALYZE, Stage.WRITE), request))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("seedContent is required");
    }

    @Test
    void shouldRejectSeedForDerivedStage() {
        PipelineRequest request = complete().seedAnalysis(Fixtures.analysis()).build();

        assertThatThrownBy(() -> validator.validate(List.of(Stage.EXTRACT, Stage.ANALYZE, Stage.WRITE), request))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("seedAnalysis must not be supplied");
    }

    @Test
    void shouldAcceptSeededStepWiseRun() {
        PipelineRequest request = complete().url(null).seedContent(Fixtures.content(Fixtures.URL)).build();

        List<Stage> stages = validator.validate(List.of(Stage.ANALYZE), request);

        assertThat(stages).containsExactly(Stage.ANALYZE);
    }

    @Test
    void shouldRejectTargetLengthOutOfRange() {
        assertThatThrownBy(() -> validator.validate(List.of(Stage.WRITE),
                complete().seedAnalysis(Fixtures.analysis()).targetLength(200).build()))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("between 300 and 5000");

        assertThatThrownBy(() -> validator.validate(List.of(Stage.WRITE),
                complete().seedAnalysis(Fixtures.analysis()).targetLength(5001).build()))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void shouldRequireTitleAndContentOfSeedArticle() {
        PipelineRequest request = complete().seedArticle(new Article("", "", "", 0, null)).build();

        assertThatThrownBy(() -> validator.validate(List.of(Stage.PUBLISH), request))
                .isInstanceOfSatisfying(InvalidRequestException.class, e ->
                        assertThat(e.getErrors()).containsExactlyInAnyOrder(
                                "seedArticle title is required for PUBLISH",
                                "seedArticle content is required for PUBLISH"));
    }

    @Test
    void shouldCollectEveryError() {
        PipelineRequest request = PipelineRequest.builder().build();

        assertThatThrownBy(() -> validator.validate(List.of(Stage.EXTRACT, Stage.ANALYZE, Stage.WRITE), request))
                .isInstanceOfSatisfying(InvalidRequestException.class, e ->
                        assertThat(e.getErrors()).hasSize(4));
    }
}
